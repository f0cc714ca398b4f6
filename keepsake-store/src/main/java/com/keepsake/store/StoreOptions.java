package com.keepsake.store;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Options applied when a store is opened.
 */
public final class StoreOptions {
    private static final StoreOptions DEFAULTS = builder().build();

    private final boolean lazyArrays;
    private final ByteOrder byteOrder;

    private StoreOptions(Builder builder) {
        this.lazyArrays = builder.lazyArrays;
        this.byteOrder = builder.byteOrder;
    }

    /**
     * Get the default options: lazy arrays, little-endian leaves.
     *
     * @return Default options
     */
    public static StoreOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Create a builder starting from the defaults.
     *
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check whether loading yields store-backed array handles instead of
     * in-memory arrays.
     *
     * @return True for lazy loading
     */
    public boolean isLazyArrays() {
        return lazyArrays;
    }

    /**
     * Get the byte order of newly created array leaves.
     *
     * @return Byte order
     */
    public ByteOrder getByteOrder() {
        return byteOrder;
    }

    @Override
    public String toString() {
        return "StoreOptions(lazyArrays=" + lazyArrays + ", byteOrder=" + byteOrder + ")";
    }

    /**
     * Builder for {@link StoreOptions}.
     */
    public static final class Builder {
        private boolean lazyArrays = true;
        private ByteOrder byteOrder = ByteOrder.LITTLE_ENDIAN;

        private Builder() {
        }

        public Builder lazyArrays(boolean lazyArrays) {
            this.lazyArrays = lazyArrays;
            return this;
        }

        public Builder byteOrder(ByteOrder byteOrder) {
            this.byteOrder = Objects.requireNonNull(byteOrder, "byteOrder");
            return this;
        }

        public StoreOptions build() {
            return new StoreOptions(this);
        }
    }
}
