package com.keepsake.model;

/**
 * Deferred hook run on the first read of a slot that was never assigned.
 */
@FunctionalInterface
public interface SlotInitializer {
    /**
     * Initialize the slot, typically by assigning it on {@code owner}.
     *
     * @param owner Instance being read
     */
    void initialize(Composite owner);
}
