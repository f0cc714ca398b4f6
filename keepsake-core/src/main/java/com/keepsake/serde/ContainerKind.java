package com.keepsake.serde;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shapes of container values, with the tag written for each.
 */
public enum ContainerKind {
    SEQUENCE("sequence"),
    SET("set"),
    MAPPING("mapping");

    private final String tag;

    ContainerKind(String tag) {
        this.tag = tag;
    }

    /**
     * Get the discriminator written to stores.
     *
     * @return Tag string
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolve a container kind from its tag.
     *
     * @param tag Tag string
     * @return Matching kind
     * @throws IllegalArgumentException If the tag is unknown
     */
    public static ContainerKind fromTag(String tag) {
        for (ContainerKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown container kind '" + tag + "'");
    }

    /**
     * Determine the kind of a container value.
     *
     * @param value Value to inspect
     * @return The kind, or null if the value is not a container
     */
    public static ContainerKind of(Object value) {
        if (value instanceof Map) {
            return MAPPING;
        } else if (value instanceof Set) {
            return SET;
        } else if (value instanceof List || value instanceof Collection) {
            return SEQUENCE;
        }
        return null;
    }
}
