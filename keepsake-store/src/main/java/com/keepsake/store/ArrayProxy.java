package com.keepsake.store;

import com.keepsake.array.ArrayData;
import com.keepsake.array.DType;
import com.keepsake.array.NumericArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handle to an array leaf of a {@link HierarchicalStore}.
 *
 * <p>Reads and writes go straight to the leaf's data file; only the
 * touched elements are transferred. Writing past the end of the leading axis
 * grows the leaf and zero-fills the new rows. Other axes are fixed.
 *
 * <p>The proxy deliberately offers storage access only. Call {@link #read()}
 * for an in-memory {@link NumericArray} to compute with.
 */
public final class ArrayProxy implements ArrayData {
    private static final Logger log = LoggerFactory.getLogger(ArrayProxy.class);

    private static final String DTYPE_KEY = "dtype";
    private static final String SHAPE_KEY = "shape";
    private static final String BYTE_ORDER_KEY = "byteOrder";
    private static final String ATTRIBUTES_KEY = "attributes";
    private static final String LITTLE_ENDIAN = "little";
    private static final String BIG_ENDIAN = "big";
    private static final int ZERO_CHUNK = 64 * 1024;

    private final HierarchicalStore store;
    private final String name;
    private final Path metaFile;
    private final Path dataFile;
    private final DType dtype;
    private final ByteOrder order;
    private final FileChannel channel;
    private final Map<String, Object> attributes;
    private long[] shape;
    private boolean dirty;
    private boolean released;

    private ArrayProxy(HierarchicalStore store, String name, Path metaFile, Path dataFile, DType dtype,
                       long[] shape, ByteOrder order, FileChannel channel, Map<String, Object> attributes) {
        this.store = store;
        this.name = name;
        this.metaFile = metaFile;
        this.dataFile = dataFile;
        this.dtype = dtype;
        this.shape = shape;
        this.order = order;
        this.channel = channel;
        this.attributes = attributes;
    }

    static ArrayProxy create(HierarchicalStore store, Path directory, String name, NumericArray data,
                             ByteOrder order) throws IOException {
        String entry = HierarchicalStore.encodeName(name);
        Path metaFile = directory.resolve(entry + HierarchicalStore.META_SUFFIX);
        Path dataFile = directory.resolve(entry + HierarchicalStore.DATA_SUFFIX);
        Files.write(dataFile, data.toByteArray(order));
        FileChannel channel = FileChannel.open(dataFile, StandardOpenOption.READ, StandardOpenOption.WRITE);
        ArrayProxy array = new ArrayProxy(store, name, metaFile, dataFile, data.dtype(), data.shape(), order,
            channel, new LinkedHashMap<>());
        array.dirty = true;
        array.flush();
        return array;
    }

    static ArrayProxy open(HierarchicalStore store, Path directory, String name) throws IOException {
        String entry = HierarchicalStore.encodeName(name);
        Path metaFile = directory.resolve(entry + HierarchicalStore.META_SUFFIX);
        Path dataFile = directory.resolve(entry + HierarchicalStore.DATA_SUFFIX);
        Map<String, Object> meta = store.readMap(metaFile);

        DType dtype = DType.fromCode(String.valueOf(meta.get(DTYPE_KEY)));
        long[] shape = toShape(meta.get(SHAPE_KEY), metaFile);
        ByteOrder order = BIG_ENDIAN.equals(meta.get(BYTE_ORDER_KEY)) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (meta.get(ATTRIBUTES_KEY) instanceof Map) {
            for (Map.Entry<?, ?> attribute : ((Map<?, ?>) meta.get(ATTRIBUTES_KEY)).entrySet()) {
                attributes.put(String.valueOf(attribute.getKey()), attribute.getValue());
            }
        }

        FileChannel channel = store.isWritable()
            ? FileChannel.open(dataFile, StandardOpenOption.READ, StandardOpenOption.WRITE)
            : FileChannel.open(dataFile, StandardOpenOption.READ);
        long expected = NumericArray.elementCount(shape) * dtype.itemSize();
        if (channel.size() < expected) {
            channel.close();
            throw new StoreException("Array data " + dataFile + " holds " + channel.size() +
                " bytes, shape " + Arrays.toString(shape) + " needs " + expected);
        }
        return new ArrayProxy(store, name, metaFile, dataFile, dtype, shape, order, channel, attributes);
    }

    private static long[] toShape(Object stored, Path metaFile) {
        if (!(stored instanceof List)) {
            throw new StoreException("Malformed array metadata " + metaFile + ": missing shape");
        }
        List<?> extents = (List<?>) stored;
        long[] shape = new long[extents.size()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = ((Number) extents.get(i)).longValue();
        }
        return shape;
    }

    public String getName() {
        return name;
    }

    @Override
    public DType dtype() {
        return dtype;
    }

    @Override
    public long[] shape() {
        return shape.clone();
    }

    /**
     * Get a snapshot of the leaf's attributes.
     *
     * @return Attributes in insertion order
     */
    @Override
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    /**
     * Set an attribute of the leaf.
     *
     * @param key Attribute name
     * @param value Value to store
     * @throws ReadOnlyStoreException If the store is read-only
     */
    public void setAttribute(String key, Object value) {
        checkWritable("set attribute '" + key + "' on array '" + name + "'");
        attributes.put(key, value);
        dirty = true;
    }

    public boolean removeAttribute(String key) {
        checkWritable("remove attribute '" + key + "' from array '" + name + "'");
        boolean present = attributes.containsKey(key);
        attributes.remove(key);
        dirty |= present;
        return present;
    }

    /**
     * Read every element.
     *
     * @return In-memory copy of the leaf
     */
    @Override
    public NumericArray read() {
        checkOpen();
        byte[] bytes = readBytes(0, checkedLength(size() * dtype.itemSize()));
        return NumericArray.fromBytes(dtype, shape, bytes, order);
    }

    /**
     * Read a slice of rows along the leading axis.
     *
     * @param start First row, inclusive
     * @param end Last row, exclusive
     * @return In-memory array of shape {@code [end - start, ...trailing]}
     * @throws IndexOutOfBoundsException If the range is outside the current extent
     */
    public NumericArray read(long start, long end) {
        checkOpen();
        requireLeadingAxis("slice");
        if (start < 0 || end < start || end > shape[0]) {
            throw new IndexOutOfBoundsException(
                "Rows [" + start + ", " + end + ") out of bounds for array '" + name + "' with " + shape[0] + " rows");
        }
        long[] sliceShape = shape.clone();
        sliceShape[0] = end - start;
        long rowBytes = rowBytes();
        byte[] bytes = readBytes(start * rowBytes, checkedLength((end - start) * rowBytes));
        return NumericArray.fromBytes(dtype, sliceShape, bytes, order);
    }

    /**
     * Read one row of the leading axis.
     *
     * @param row Row index
     * @return In-memory array of the trailing shape
     */
    public NumericArray readRow(long row) {
        NumericArray slice = read(row, row + 1);
        return slice.reshape(Arrays.copyOfRange(shape, 1, shape.length));
    }

    /**
     * Read a single element.
     *
     * @param index One coordinate per axis, none for a 0-dimensional leaf
     * @return The element boxed as its natural Java type
     * @throws IndexOutOfBoundsException If a coordinate is outside the current extent
     */
    public Number get(long... index) {
        checkOpen();
        requireRank(index);
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("Index " + index[axis] + " out of bounds for axis " + axis +
                    " of array '" + name + "' with extent " + shape[axis]);
            }
        }
        ByteBuffer buffer = ByteBuffer.allocate(dtype.itemSize()).order(order);
        readFully(buffer, flatIndex(index) * dtype.itemSize());
        return dtype.read(buffer, 0);
    }

    /**
     * Write a single element, converting it to the leaf's dtype. A leading
     * coordinate past the end grows the leaf.
     *
     * @param value Value to write
     * @param index One coordinate per axis, none for a 0-dimensional leaf
     * @throws StorageShapeException If a trailing coordinate is outside its extent
     */
    public void set(Number value, long... index) {
        checkWritable("write to array '" + name + "'");
        requireRank(index);
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0) {
                throw new IndexOutOfBoundsException("Negative index " + index[axis] + " for axis " + axis);
            }
            if (axis > 0 && index[axis] >= shape[axis]) {
                throw new StorageShapeException("Index " + index[axis] + " exceeds extent " + shape[axis] +
                    " of axis " + axis + " of array '" + name + "'; only the leading axis can grow");
            }
        }
        if (shape.length > 0 && index[0] >= shape[0]) {
            grow(index[0] + 1);
        }
        ByteBuffer buffer = ByteBuffer.allocate(dtype.itemSize()).order(order);
        dtype.write(buffer, 0, value);
        writeFully(buffer, flatIndex(index) * dtype.itemSize());
    }

    /**
     * Write a block of rows starting at a leading-axis position, growing the
     * leaf if the block ends past the current extent.
     *
     * @param start First row to overwrite
     * @param block Rows of the trailing shape, or a single row
     * @throws StorageShapeException If the block does not match the trailing shape
     */
    public void write(long start, ArrayData block) {
        checkWritable("write to array '" + name + "'");
        requireLeadingAxis("write rows of");
        if (start < 0) {
            throw new IndexOutOfBoundsException("Negative start row " + start);
        }
        NumericArray data = block.read().astype(dtype);
        long rows = rowsIn(data.shape());
        if (start + rows > shape[0]) {
            grow(start + rows);
        }
        writeFully(ByteBuffer.wrap(data.toByteArray(order)), start * rowBytes());
    }

    /**
     * Append rows at the end of the leading axis.
     *
     * @param block Rows of the trailing shape, or a single row
     */
    public void append(ArrayData block) {
        checkWritable("append to array '" + name + "'");
        requireLeadingAxis("append to");
        write(shape[0], block);
    }

    /**
     * Change the extent of the leading axis. Growing zero-fills new rows,
     * shrinking discards trailing rows.
     *
     * @param length New number of rows
     * @throws StorageShapeException If the leaf is 0-dimensional
     */
    public void resize(long length) {
        checkWritable("resize array '" + name + "'");
        requireLeadingAxis("resize");
        if (length < 0) {
            throw new IllegalArgumentException("Negative length " + length + " for array '" + name + "'");
        }
        if (length < shape[0]) {
            try {
                channel.truncate(length * rowBytes());
            } catch (IOException e) {
                throw new StoreException("Failed to shrink array '" + name + "'", e);
            }
            log.debug("Shrank array '{}' from {} to {} rows", name, shape[0], length);
            shape[0] = length;
            dirty = true;
        } else if (length > shape[0]) {
            grow(length);
        }
    }

    public boolean isWritable() {
        return store.isWritable();
    }

    void flush() {
        if (dirty && !released) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(DTYPE_KEY, dtype.code());
            List<Long> extents = new ArrayList<>(shape.length);
            for (long extent : shape) {
                extents.add(extent);
            }
            meta.put(SHAPE_KEY, extents);
            meta.put(BYTE_ORDER_KEY, order == ByteOrder.BIG_ENDIAN ? BIG_ENDIAN : LITTLE_ENDIAN);
            meta.put(ATTRIBUTES_KEY, attributes);
            store.writeMap(metaFile, meta);
            dirty = false;
        }
    }

    /**
     * Close the data file. Buffered metadata must have been flushed.
     */
    void release() {
        if (released) {
            return;
        }
        released = true;
        try {
            channel.close();
        } catch (IOException e) {
            throw new StoreException("Failed to close " + dataFile, e);
        }
    }

    private void grow(long length) {
        long rowBytes = rowBytes();
        zeroFill(shape[0] * rowBytes, length * rowBytes);
        log.debug("Grew array '{}' from {} to {} rows", name, shape[0], length);
        shape[0] = length;
        dirty = true;
    }

    private void zeroFill(long from, long to) {
        ByteBuffer zeros = ByteBuffer.allocate((int) Math.min(ZERO_CHUNK, Math.max(to - from, 1)));
        for (long position = from; position < to; position += zeros.capacity()) {
            zeros.clear();
            zeros.limit((int) Math.min(zeros.capacity(), to - position));
            writeFully(zeros, position);
        }
    }

    private long rowsIn(long[] blockShape) {
        int trailing = shape.length - 1;
        if (blockShape.length == shape.length &&
            Arrays.equals(blockShape, 1, blockShape.length, shape, 1, shape.length)) {
            return blockShape[0];
        }
        if (blockShape.length == trailing &&
            Arrays.equals(blockShape, 0, trailing, shape, 1, shape.length)) {
            return 1;
        }
        throw new StorageShapeException("Block of shape " + Arrays.toString(blockShape) +
            " does not fit array '" + name + "' of shape " + Arrays.toString(shape) +
            "; only the leading axis can differ");
    }

    private long rowBytes() {
        long elements = 1;
        for (int axis = 1; axis < shape.length; axis++) {
            elements *= shape[axis];
        }
        return elements * dtype.itemSize();
    }

    private long flatIndex(long[] index) {
        long flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            flat = flat * shape[axis] + index[axis];
        }
        return flat;
    }

    private void requireRank(long[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Index of " + index.length + " coordinates for array '" + name +
                "' of " + shape.length + " dimensions");
        }
    }

    private void requireLeadingAxis(String operation) {
        if (shape.length == 0) {
            throw new StorageShapeException("Cannot " + operation + " 0-dimensional array '" + name + "'");
        }
    }

    private static int checkedLength(long bytes) {
        if (bytes > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Cannot read " + bytes + " bytes into memory at once");
        }
        return (int) bytes;
    }

    private byte[] readBytes(long position, int length) {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        readFully(buffer, position);
        return buffer.array();
    }

    private void readFully(ByteBuffer buffer, long position) {
        long base = position - buffer.position();
        try {
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, base + buffer.position()) < 0) {
                    throw new StoreException("Unexpected end of " + dataFile + " at offset " +
                        (base + buffer.position()));
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to read array '" + name + "'", e);
        }
    }

    private void writeFully(ByteBuffer buffer, long position) {
        long base = position - buffer.position();
        try {
            while (buffer.hasRemaining()) {
                channel.write(buffer, base + buffer.position());
            }
        } catch (IOException e) {
            throw new StoreException("Failed to write array '" + name + "'", e);
        }
    }

    private void checkOpen() {
        store.checkOpen();
        if (released) {
            throw new IllegalStateException("Array '" + name + "' has been removed from its store");
        }
    }

    private void checkWritable(String operation) {
        store.checkWritable(operation);
        checkOpen();
    }

    @Override
    public String toString() {
        return "ArrayProxy(" + name + ", " + dtype.code() + ", " + Arrays.toString(shape) + ")";
    }
}
