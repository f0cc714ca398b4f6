package com.keepsake.serde;

/**
 * Exception thrown when a value is neither a primitive, a dataset, a container
 * nor a registered composite.
 */
public class UnsupportedTypeException extends SerializationException {
    private final Class<?> type;
    
    /**
     * Create a new classification failure for the given runtime type.
     *
     * @param type The unrecognized runtime type
     */
    public UnsupportedTypeException(Class<?> type) {
        this(type, "Cannot serialize value of unsupported type " + type.getName());
    }
    
    /**
     * Create a new classification failure with a custom message.
     *
     * @param type The unrecognized runtime type
     * @param message Error message
     */
    public UnsupportedTypeException(Class<?> type, String message) {
        super(message);
        this.type = type;
    }
    
    /**
     * Get the runtime type that could not be classified.
     *
     * @return Offending type
     */
    public Class<?> getType() {
        return type;
    }
}
