package com.keepsake.registry;

/**
 * Interface for converting an instance of a dataset type to a flat numeric
 * array plus side metadata.
 *
 * @param <T> Dataset type
 */
@FunctionalInterface
public interface DatasetDisassembler<T> {
    /**
     * Convert an object to its array representation.
     *
     * @param value Object to convert
     * @return Array and metadata; the array must not share storage with {@code value}
     */
    DatasetPayload disassemble(T value);
}
