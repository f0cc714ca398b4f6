package com.keepsake.registry;

import com.keepsake.array.NumericArray;

import java.util.Map;

/**
 * A registered dataset type: the Java type, its qualified name and its pair of
 * conversion callbacks.
 *
 * @param <T> Dataset type
 */
public final class DatasetType<T> {
    private final String name;
    private final Class<T> type;
    private final DatasetDisassembler<T> disassembler;
    private final DatasetAssembler<? extends T> assembler;

    DatasetType(String name, Class<T> type, DatasetDisassembler<T> disassembler,
                DatasetAssembler<? extends T> assembler) {
        this.name = name;
        this.type = type;
        this.disassembler = disassembler;
        this.assembler = assembler;
    }

    public String getName() {
        return name;
    }

    public Class<T> getType() {
        return type;
    }

    /**
     * Disassemble a value of this type.
     *
     * @param value Instance of {@link #getType()}
     * @return Array and metadata
     */
    public DatasetPayload disassemble(Object value) {
        return disassembler.disassemble(type.cast(value));
    }

    /**
     * Assemble a value of this type.
     *
     * @param data The array
     * @param metadata Side metadata
     * @return Rebuilt value
     */
    public T assemble(NumericArray data, Map<String, Object> metadata) {
        return assembler.assemble(data, metadata);
    }

    @Override
    public String toString() {
        return "DatasetType(" + name + ")";
    }
}
