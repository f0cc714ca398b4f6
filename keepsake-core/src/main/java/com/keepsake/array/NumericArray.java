package com.keepsake.array;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * An n-dimensional numeric array held in memory as a flat, row-major,
 * little-endian buffer.
 *
 * <p>Elements are addressed either by a full index (one coordinate per axis) or
 * by a flat offset into the row-major layout. Arrays are mutable; the
 * serialization layer hands out copies so that instances never share storage.
 */
public final class NumericArray implements ArrayData {
    private final DType dtype;
    private final long[] shape;
    private final byte[] bytes;
    private final ByteBuffer buffer;

    private NumericArray(DType dtype, long[] shape, byte[] bytes) {
        this.dtype = dtype;
        this.shape = shape;
        this.bytes = bytes;
        this.buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Create a zero-filled array.
     *
     * @param dtype Element type
     * @param shape Axis extents; none for a scalar
     * @return New array
     */
    public static NumericArray zeros(DType dtype, long... shape) {
        Objects.requireNonNull(dtype, "dtype");
        long[] copy = shape.clone();
        long count = elementCount(copy);
        long byteCount = count * dtype.itemSize();
        if (byteCount > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                "Array of shape " + Arrays.toString(copy) + " is too large to hold in memory");
        }
        return new NumericArray(dtype, copy, new byte[(int) byteCount]);
    }

    /**
     * Wrap raw element bytes.
     *
     * @param dtype Element type
     * @param shape Axis extents
     * @param data Row-major element bytes
     * @param order Byte order of {@code data}
     * @return New array owning a copy of the bytes
     */
    public static NumericArray fromBytes(DType dtype, long[] shape, byte[] data, ByteOrder order) {
        NumericArray array = zeros(dtype, shape);
        if (data.length != array.bytes.length) {
            throw new IllegalArgumentException(
                "Expected " + array.bytes.length + " bytes for shape " + Arrays.toString(shape) +
                " of " + dtype.code() + ", got " + data.length);
        }
        if (order == ByteOrder.LITTLE_ENDIAN || dtype.itemSize() == 1) {
            System.arraycopy(data, 0, array.bytes, 0, data.length);
        } else {
            ByteBuffer source = ByteBuffer.wrap(data).order(order);
            for (int offset = 0; offset < data.length; offset += dtype.itemSize()) {
                dtype.write(array.buffer, offset, dtype.read(source, offset));
            }
        }
        return array;
    }

    /**
     * Create a one-dimensional float64 array.
     *
     * @param values Elements
     * @return New array
     */
    public static NumericArray of(double... values) {
        NumericArray array = zeros(DType.FLOAT64, values.length);
        for (int i = 0; i < values.length; i++) {
            array.buffer.putDouble(i * 8, values[i]);
        }
        return array;
    }

    /**
     * Create a one-dimensional int64 array.
     *
     * @param values Elements
     * @return New array
     */
    public static NumericArray ofLongs(long... values) {
        NumericArray array = zeros(DType.INT64, values.length);
        for (int i = 0; i < values.length; i++) {
            array.buffer.putLong(i * 8, values[i]);
        }
        return array;
    }

    /**
     * Create a one-dimensional int32 array.
     *
     * @param values Elements
     * @return New array
     */
    public static NumericArray ofInts(int... values) {
        NumericArray array = zeros(DType.INT32, values.length);
        for (int i = 0; i < values.length; i++) {
            array.buffer.putInt(i * 4, values[i]);
        }
        return array;
    }

    /**
     * Create a zero-dimensional float64 array.
     *
     * @param value The scalar
     * @return New scalar array
     */
    public static NumericArray scalar(double value) {
        NumericArray array = zeros(DType.FLOAT64);
        array.buffer.putDouble(0, value);
        return array;
    }

    /**
     * Count the elements of a shape.
     *
     * @param shape Axis extents
     * @return Product of the extents, 1 for a scalar
     */
    public static long elementCount(long[] shape) {
        long count = 1;
        for (long extent : shape) {
            if (extent < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
            count = Math.multiplyExact(count, extent);
        }
        return count;
    }

    @Override
    public DType dtype() {
        return dtype;
    }

    @Override
    public long[] shape() {
        return shape.clone();
    }

    @Override
    public Map<String, Object> attributes() {
        return Collections.emptyMap();
    }

    @Override
    public NumericArray read() {
        return this;
    }

    /**
     * Get an element by its full index.
     *
     * @param index One coordinate per axis
     * @return The element
     */
    public Number get(long... index) {
        return getFlat(flatIndex(index));
    }

    /**
     * Get an element by its row-major offset.
     *
     * @param flat Flat element offset
     * @return The element
     */
    public Number getFlat(long flat) {
        checkFlat(flat);
        return dtype.read(buffer, (int) flat * dtype.itemSize());
    }

    /**
     * Get an element as a double.
     *
     * @param index One coordinate per axis
     * @return The element widened to double
     */
    public double getDouble(long... index) {
        return get(index).doubleValue();
    }

    /**
     * Get an element as a long.
     *
     * @param index One coordinate per axis
     * @return The element converted to long
     */
    public long getLong(long... index) {
        return get(index).longValue();
    }

    /**
     * Set an element by its full index, converting to this array's dtype.
     *
     * @param value New value
     * @param index One coordinate per axis
     */
    public void set(Number value, long... index) {
        setFlat(flatIndex(index), value);
    }

    /**
     * Set an element by its row-major offset, converting to this array's dtype.
     *
     * @param flat Flat element offset
     * @param value New value
     */
    public void setFlat(long flat, Number value) {
        checkFlat(flat);
        dtype.write(buffer, (int) flat * dtype.itemSize(), Objects.requireNonNull(value, "value"));
    }

    /**
     * Create a view of the same elements under a different shape.
     *
     * @param newShape Shape with the same element count
     * @return New array sharing no storage with this one
     */
    public NumericArray reshape(long... newShape) {
        if (elementCount(newShape) != size()) {
            throw new IllegalArgumentException(
                "Cannot reshape " + Arrays.toString(shape) + " to " + Arrays.toString(newShape));
        }
        return new NumericArray(dtype, newShape.clone(), bytes.clone());
    }

    /**
     * Convert every element to the given dtype.
     *
     * @param target Target element type
     * @return This array if the dtype already matches, else a converted copy
     */
    public NumericArray astype(DType target) {
        if (target == dtype) {
            return this;
        }
        NumericArray converted = zeros(target, shape);
        long count = size();
        for (long i = 0; i < count; i++) {
            converted.setFlat(i, getFlat(i));
        }
        return converted;
    }

    /**
     * Create an independent copy.
     *
     * @return Copy sharing no storage with this array
     */
    public NumericArray copy() {
        return new NumericArray(dtype, shape.clone(), bytes.clone());
    }

    /**
     * Get the elements as doubles in row-major order.
     *
     * @return Flat double array
     */
    public double[] toDoubleArray() {
        double[] values = new double[(int) size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = getFlat(i).doubleValue();
        }
        return values;
    }

    /**
     * Get the elements as longs in row-major order.
     *
     * @return Flat long array
     */
    public long[] toLongArray() {
        long[] values = new long[(int) size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = getFlat(i).longValue();
        }
        return values;
    }

    /**
     * Get the raw element bytes.
     *
     * @param order Byte order of the result
     * @return Row-major element bytes
     */
    public byte[] toByteArray(ByteOrder order) {
        if (order == ByteOrder.LITTLE_ENDIAN || dtype.itemSize() == 1) {
            return bytes.clone();
        }
        byte[] out = new byte[bytes.length];
        ByteBuffer target = ByteBuffer.wrap(out).order(order);
        for (int offset = 0; offset < bytes.length; offset += dtype.itemSize()) {
            dtype.write(target, offset, dtype.read(buffer, offset));
        }
        return out;
    }

    private long flatIndex(long[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                "Index of " + index.length + " coordinates for array of " + shape.length + " dimensions");
        }
        long flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException(
                    "Index " + index[axis] + " out of bounds for axis " + axis + " with extent " + shape[axis]);
            }
            flat = flat * shape[axis] + index[axis];
        }
        return flat;
    }

    private void checkFlat(long flat) {
        if (flat < 0 || flat >= size()) {
            throw new IndexOutOfBoundsException("Flat index " + flat + " out of bounds for size " + size());
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NumericArray)) {
            return false;
        }
        NumericArray other = (NumericArray) obj;
        return dtype == other.dtype &&
               Arrays.equals(shape, other.shape) &&
               Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        int result = dtype.hashCode();
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(bytes);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NumericArray(").append(dtype.code())
            .append(", shape=").append(Arrays.toString(shape)).append(", ");
        long count = size();
        long shown = Math.min(count, 8);
        sb.append('[');
        for (long i = 0; i < shown; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(getFlat(i));
        }
        if (count > shown) {
            sb.append(", ...");
        }
        return sb.append("])").toString();
    }
}
