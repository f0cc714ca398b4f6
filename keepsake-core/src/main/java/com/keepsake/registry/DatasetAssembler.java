package com.keepsake.registry;

import com.keepsake.array.NumericArray;

import java.util.Map;

/**
 * Interface for rebuilding an instance of a dataset type from its array
 * representation.
 *
 * @param <T> Dataset type
 */
@FunctionalInterface
public interface DatasetAssembler<T> {
    /**
     * Convert an array and its metadata back to an object.
     *
     * @param data The array
     * @param metadata Side metadata produced by the matching disassembler
     * @return Rebuilt object
     */
    T assemble(NumericArray data, Map<String, Object> metadata);
}
