package com.keepsake.model;

/**
 * Validates and converts a raw value on every assignment to a slot.
 *
 * @param <T> Slot value type
 */
@FunctionalInterface
public interface SlotParser<T> {
    /**
     * Convert a raw value to the slot's value type.
     *
     * @param owner Instance being assigned
     * @param raw Raw assigned value
     * @return Validated value to store
     * @throws InvalidSlotValueException If the value is rejected
     */
    T parse(Composite owner, Object raw);
}
