package com.keepsake.store;

/**
 * Exception thrown when a store cannot be opened, read or written.
 */
public class StoreException extends RuntimeException {
    /**
     * Create a StoreException with a message.
     *
     * @param message Exception message
     */
    public StoreException(String message) {
        super(message);
    }

    /**
     * Create a StoreException with a message and cause.
     *
     * @param message Exception message
     * @param cause Exception cause
     */
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
