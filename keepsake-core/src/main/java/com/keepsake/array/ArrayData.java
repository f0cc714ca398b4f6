package com.keepsake.array;

import java.util.Map;

/**
 * Read-only description of an n-dimensional numeric array, either held in
 * memory or backed by a store.
 *
 * <p>Slots that should accept lazily loaded store handles as well as in-memory
 * arrays declare this type rather than {@link NumericArray}.
 */
public interface ArrayData {
    /**
     * Get the element type.
     *
     * @return Element type
     */
    DType dtype();

    /**
     * Get the extents of every axis. A zero-length result is a scalar.
     *
     * @return Copy of the shape
     */
    long[] shape();

    /**
     * Get the side metadata attached to this array.
     *
     * @return Metadata map, possibly empty
     */
    Map<String, Object> attributes();

    /**
     * Materialize the whole array in memory.
     *
     * @return Array holding every element
     */
    NumericArray read();

    /**
     * Get the number of dimensions.
     *
     * @return Dimensionality, 0 for a scalar
     */
    default int ndim() {
        return shape().length;
    }

    /**
     * Get the total number of elements.
     *
     * @return Element count
     */
    default long size() {
        return NumericArray.elementCount(shape());
    }

    /**
     * Get the number of bytes the elements occupy.
     *
     * @return Byte size
     */
    default long nbytes() {
        return size() * dtype().itemSize();
    }
}
