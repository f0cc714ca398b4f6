package com.keepsake.serde;

import com.keepsake.model.Composite;
import com.keepsake.registry.TypeRegistry;

/**
 * Decides the serialization category of a runtime value.
 *
 * <p>Checks run in a fixed order: null, registered primitive, registered
 * dataset, container, registered composite. The first match wins.
 */
public class ValueClassifier {
    private final TypeRegistry registry;

    /**
     * Create a classifier over a registry.
     *
     * @param registry Registry holding primitive, dataset and composite types
     */
    public ValueClassifier(TypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Classify a value.
     *
     * @param value Value to classify, may be null
     * @return The category
     * @throws UnsupportedTypeException If the value matches no category
     */
    public ValueCategory classify(Object value) {
        if (value == null) {
            return ValueCategory.PRIMITIVE;
        }
        Class<?> type = value.getClass();
        if (registry.isPrimitive(type)) {
            return ValueCategory.PRIMITIVE;
        }
        if (registry.isDataset(type)) {
            return ValueCategory.DATASET;
        }
        if (ContainerKind.of(value) != null) {
            return ValueCategory.CONTAINER;
        }
        if (value instanceof Composite) {
            if (registry.isComposite(type)) {
                return ValueCategory.COMPOSITE;
            }
            throw new UnsupportedTypeException(type,
                "Composite type " + type.getName() + " is not registered");
        }
        throw new UnsupportedTypeException(type);
    }
}
