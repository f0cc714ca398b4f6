package com.keepsake.store;

/**
 * How a store is opened.
 */
public enum OpenMode {
    /**
     * Open an existing store; every mutation is rejected.
     */
    READ_ONLY(false),

    /**
     * Open an existing store for reading and writing.
     */
    READ_WRITE(true),

    /**
     * Create the store, discarding any existing contents.
     */
    CREATE_TRUNCATE(true),

    /**
     * Open the store for reading and writing, creating it if absent.
     */
    READ_WRITE_CREATE(true),

    /**
     * Create the store, failing if it already exists.
     */
    CREATE_EXCLUSIVE(true);

    private final boolean writable;

    OpenMode(boolean writable) {
        this.writable = writable;
    }

    /**
     * Check whether stores opened in this mode accept mutation.
     *
     * @return True unless read-only
     */
    public boolean isWritable() {
        return writable;
    }
}
