package com.keepsake.model;

/**
 * Exception thrown when a write-once slot is assigned a second time.
 */
public class ImmutableSlotException extends RuntimeException {
    private final String slotName;
    
    /**
     * Creates a new ImmutableSlotException.
     *
     * @param ownerType Class of the instance owning the slot
     * @param slotName Name of the write-once slot
     */
    public ImmutableSlotException(Class<?> ownerType, String slotName) {
        super("Slot '" + slotName + "' of " + ownerType.getName() + " is write-once and already assigned");
        this.slotName = slotName;
    }
    
    /**
     * Gets the name of the slot that rejected the assignment.
     *
     * @return The slot name
     */
    public String getSlotName() {
        return slotName;
    }
}
