package com.keepsake.store;

/**
 * Exception thrown when a write or resize would change an axis other than the
 * leading one, or would resize a 0-dimensional leaf.
 */
public class StorageShapeException extends UnsupportedOperationException {
    /**
     * Create a StorageShapeException with a message.
     *
     * @param message Exception message
     */
    public StorageShapeException(String message) {
        super(message);
    }
}
