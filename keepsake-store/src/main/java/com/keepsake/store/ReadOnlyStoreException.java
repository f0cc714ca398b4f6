package com.keepsake.store;

/**
 * Exception thrown when a store opened read-only is asked to change.
 */
public class ReadOnlyStoreException extends StoreException {
    /**
     * Create a ReadOnlyStoreException naming the rejected operation.
     *
     * @param operation Operation that would have modified the store
     */
    public ReadOnlyStoreException(String operation) {
        super("Cannot " + operation + ": store is open read-only");
    }
}
