package com.keepsake.model;

/**
 * Exception a {@link SlotParser} throws to reject a raw value.
 */
public class InvalidSlotValueException extends IllegalArgumentException {
    /**
     * Creates a new InvalidSlotValueException with a custom message.
     * 
     * @param message The error message
     */
    public InvalidSlotValueException(String message) {
        super(message);
    }
    
    /**
     * Creates a new InvalidSlotValueException with a message and cause.
     * 
     * @param message The error message
     * @param cause The underlying cause
     */
    public InvalidSlotValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
