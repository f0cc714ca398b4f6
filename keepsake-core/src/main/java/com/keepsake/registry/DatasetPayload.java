package com.keepsake.registry;

import com.keepsake.array.NumericArray;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The array representation of a dataset value: a numeric array plus metadata
 * whose values are primitives.
 */
public final class DatasetPayload {
    private final NumericArray data;
    private final Map<String, Object> metadata;

    /**
     * Create a payload without metadata.
     *
     * @param data The array
     */
    public DatasetPayload(NumericArray data) {
        this(data, Collections.emptyMap());
    }

    /**
     * Create a payload.
     *
     * @param data The array
     * @param metadata Side metadata, copied
     */
    public DatasetPayload(NumericArray data, Map<String, Object> metadata) {
        this.data = Objects.requireNonNull(data, "data");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public NumericArray getData() {
        return data;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DatasetPayload)) {
            return false;
        }
        DatasetPayload other = (DatasetPayload) obj;
        return data.equals(other.data) && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data, metadata);
    }

    @Override
    public String toString() {
        return "DatasetPayload(" + data + ", " + metadata + ")";
    }
}
