package com.keepsake.serde;

/**
 * Serialization categories a value can fall into.
 */
public enum ValueCategory {
    /**
     * Stored verbatim: null, text, numbers, paths and registered primitive types.
     */
    PRIMITIVE,

    /**
     * Converted to a numeric array plus metadata by a registered dataset type.
     */
    DATASET,

    /**
     * A list, set or map whose elements are serialized one by one.
     */
    CONTAINER,

    /**
     * An instance of a registered composite type, serialized slot by slot.
     */
    COMPOSITE
}
