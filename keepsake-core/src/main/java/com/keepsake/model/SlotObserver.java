package com.keepsake.model;

/**
 * Callback invoked after a slot value has been stored.
 *
 * @param <T> Slot value type
 */
@FunctionalInterface
public interface SlotObserver<T> {
    /**
     * Called after a successful assignment.
     *
     * @param owner Instance that was assigned
     * @param oldValue Previous value, null if the slot held none
     * @param newValue Value now stored
     */
    void changed(Composite owner, T oldValue, T newValue);
}
