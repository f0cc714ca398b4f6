package com.keepsake.array;

import java.nio.ByteBuffer;

/**
 * Element types of a numeric array.
 */
public enum DType {
    BOOL("bool", 1, false),
    INT8("int8", 1, false),
    UINT8("uint8", 1, false),
    INT16("int16", 2, false),
    INT32("int32", 4, false),
    INT64("int64", 8, false),
    FLOAT32("float32", 4, true),
    FLOAT64("float64", 8, true);

    private final String code;
    private final int itemSize;
    private final boolean floating;

    DType(String code, int itemSize, boolean floating) {
        this.code = code;
        this.itemSize = itemSize;
        this.floating = floating;
    }

    /**
     * Get the stable code written to stores.
     *
     * @return Type code, e.g. {@code "float64"}
     */
    public String code() {
        return code;
    }

    /**
     * Get the number of bytes per element.
     *
     * @return Item size in bytes
     */
    public int itemSize() {
        return itemSize;
    }

    /**
     * Check whether this is a floating point type.
     *
     * @return True for float32 and float64
     */
    public boolean isFloating() {
        return floating;
    }

    /**
     * Resolve a type from its code.
     *
     * @param code Type code
     * @return Matching type
     * @throws IllegalArgumentException If no type has the code
     */
    public static DType fromCode(String code) {
        for (DType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown dtype code '" + code + "'");
    }

    /**
     * Read one element at an absolute byte offset.
     *
     * @param buffer Source buffer, in whatever byte order it was configured with
     * @param offset Absolute byte offset
     * @return The element boxed as its natural Java type
     */
    public Number read(ByteBuffer buffer, int offset) {
        switch (this) {
            case BOOL:
            case INT8:
                return buffer.get(offset);
            case UINT8:
                return (short) (buffer.get(offset) & 0xFF);
            case INT16:
                return buffer.getShort(offset);
            case INT32:
                return buffer.getInt(offset);
            case INT64:
                return buffer.getLong(offset);
            case FLOAT32:
                return buffer.getFloat(offset);
            case FLOAT64:
                return buffer.getDouble(offset);
            default:
                throw new IllegalStateException("Unhandled dtype " + this);
        }
    }

    /**
     * Write one element at an absolute byte offset, converting the value to this type.
     *
     * @param buffer Target buffer
     * @param offset Absolute byte offset
     * @param value Value to write
     */
    public void write(ByteBuffer buffer, int offset, Number value) {
        switch (this) {
            case BOOL:
                buffer.put(offset, (byte) (value.doubleValue() != 0 ? 1 : 0));
                break;
            case INT8:
            case UINT8:
                buffer.put(offset, value.byteValue());
                break;
            case INT16:
                buffer.putShort(offset, value.shortValue());
                break;
            case INT32:
                buffer.putInt(offset, value.intValue());
                break;
            case INT64:
                buffer.putLong(offset, value.longValue());
                break;
            case FLOAT32:
                buffer.putFloat(offset, value.floatValue());
                break;
            case FLOAT64:
                buffer.putDouble(offset, value.doubleValue());
                break;
            default:
                throw new IllegalStateException("Unhandled dtype " + this);
        }
    }
}
