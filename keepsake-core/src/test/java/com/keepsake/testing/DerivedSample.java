package com.keepsake.testing;

import com.keepsake.model.Slot;
import com.keepsake.registry.TypeRegistry;

/**
 * Subclass that redefines an inherited slot and adds one of its own.
 */
public class DerivedSample extends Sample {
    public static final Slot<Integer> VALUE = Sample.VALUE.withDefault(42);
    public static final Slot<Double> WEIGHT = Slot.of("weight", 1.0);

    static {
        TypeRegistry.global().registerComposite(DerivedSample.class);
    }

    public DerivedSample() {
    }
}
