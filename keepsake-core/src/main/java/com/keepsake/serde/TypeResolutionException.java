package com.keepsake.serde;

/**
 * Exception thrown when a type tag found in a nested structure or store
 * does not resolve to a registered composite or dataset type.
 */
public class TypeResolutionException extends SerializationException {
    private final String typeName;
    
    /**
     * Create a new resolution failure for the given type tag.
     *
     * @param typeName The qualified name that could not be resolved
     */
    public TypeResolutionException(String typeName) {
        super("No type registered under '" + typeName + "'");
        this.typeName = typeName;
    }
    
    /**
     * Get the qualified name that failed to resolve.
     *
     * @return Unresolved type name
     */
    public String getTypeName() {
        return typeName;
    }
}
