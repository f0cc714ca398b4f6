package com.keepsake.model;

import com.keepsake.registry.CompositeType;
import com.keepsake.serde.GraphSerializer;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of every serializable user type.
 *
 * <p>Subclasses declare their attributes as {@code static final} {@link Slot}
 * fields, expose a no-argument constructor (it may be private) for
 * deserialization, and register themselves once when the class is initialized:
 * <pre>
 * public class Sample extends Composite {
 *     public static final Slot&lt;String&gt; NAME = Slot.of("name", "");
 *     public static final Slot&lt;Integer&gt; VALUE = Slot.of("value", 0);
 *
 *     static {
 *         TypeRegistry.global().registerComposite(Sample.class);
 *     }
 * }
 * </pre>
 *
 * <p>Slot values are held in a per-instance table keyed by slot identity, so no
 * state is shared between instances. Equality compares the class and every
 * copiable slot value.
 */
public abstract class Composite {
    private final Map<Slot<?>, SlotState> slotStates = new IdentityHashMap<>();

    /**
     * Per-instance state of one slot.
     */
    private static class SlotState {
        Object value;
        boolean assigned;
        boolean seeded;
        boolean initialized;
    }

    /**
     * Get this instance's composite type descriptor.
     *
     * @return Descriptor listing the declared slots
     */
    public CompositeType getCompositeType() {
        return CompositeType.of(getClass());
    }

    /**
     * Read a slot. The first read of a never-assigned slot runs its
     * post-initializer once, then seeds the default if the slot is still unset.
     *
     * @param slot Slot to read
     * @param <T> Value type
     * @return Current value
     */
    @SuppressWarnings("unchecked")
    public <T> T get(Slot<T> slot) {
        SlotState state = state(slot);
        if (!state.assigned && !state.initialized && slot.getPostInit() != null) {
            state.initialized = true;
            slot.getPostInit().initialize(this);
        }
        if (!state.assigned && !state.seeded) {
            state.value = slot.defaultFor(this);
            state.seeded = true;
        }
        return (T) state.value;
    }

    /**
     * Assign a slot.
     *
     * @param slot Slot to assign
     * @param value New value, passed through the slot's parser
     * @param <T> Value type
     * @throws ImmutableSlotException If the slot is write-once and already assigned
     */
    public <T> void set(Slot<T> slot, T value) {
        assign(slot, value);
    }

    /**
     * Assign a slot from an untyped value. The parser, if any, converts the
     * value; without one the value is stored as given.
     *
     * @param slot Slot to assign
     * @param raw Raw value
     * @param <T> Value type
     * @throws ImmutableSlotException If the slot is write-once and already assigned
     */
    @SuppressWarnings("unchecked")
    public <T> void assign(Slot<T> slot, Object raw) {
        T value = slot.parse(this, raw);
        SlotState state = state(slot);
        if (slot.isWriteOnce() && state.assigned) {
            throw new ImmutableSlotException(getClass(), slot.getName());
        }
        T oldValue = (state.assigned || state.seeded) ? (T) state.value : null;
        state.value = value;
        state.assigned = true;
        slot.notifyObservers(this, oldValue, value);
    }

    /**
     * Check whether a slot has been explicitly assigned on this instance.
     *
     * @param slot Slot to check
     * @return True once the slot has been assigned
     */
    public boolean isAssigned(Slot<?> slot) {
        SlotState state = slotStates.get(slot);
        return state != null && state.assigned;
    }

    /**
     * Forget a slot's value so that the next read yields the default again.
     *
     * @param slot Slot to clear
     * @throws ImmutableSlotException If the slot is write-once and already assigned
     */
    public void clear(Slot<?> slot) {
        if (slot.isWriteOnce() && isAssigned(slot)) {
            throw new ImmutableSlotException(getClass(), slot.getName());
        }
        slotStates.remove(slot);
    }

    private SlotState state(Slot<?> slot) {
        Objects.requireNonNull(slot, "slot");
        return slotStates.computeIfAbsent(slot, s -> new SlotState());
    }

    /**
     * Serialize this instance to a nested structure.
     *
     * @return Map holding the type tag and every slot value
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> toStructure() {
        return (Map<String, Object>) GraphSerializer.global().serialize(this);
    }

    /**
     * Serialize this instance to MessagePack bytes.
     *
     * @return Encoded bytes
     */
    public byte[] toBytes() {
        return GraphSerializer.global().toBytes(this);
    }

    /**
     * Create an independent instance with the same copiable slot values.
     * Non-copiable slots hold their defaults in the copy. Write-once slots that
     * were never assigned here stay unassigned in the copy.
     *
     * @param <C> Expected composite type
     * @return New instance sharing no mutable storage with this one
     */
    @SuppressWarnings("unchecked")
    public <C extends Composite> C copy() {
        GraphSerializer serializer = GraphSerializer.global();
        return (C) serializer.deserialize(serializer.serialize(this, true));
    }

    /**
     * Rebuild an instance from a nested structure.
     *
     * @param structure Map carrying a composite type tag
     * @param <C> Expected composite type
     * @return Rebuilt instance
     */
    @SuppressWarnings("unchecked")
    public static <C extends Composite> C fromStructure(Map<String, ?> structure) {
        return (C) GraphSerializer.global().deserialize(structure);
    }

    /**
     * Rebuild an instance from MessagePack bytes.
     *
     * @param data Bytes produced by {@link #toBytes()}
     * @param <C> Expected composite type
     * @return Rebuilt instance
     */
    @SuppressWarnings("unchecked")
    public static <C extends Composite> C fromBytes(byte[] data) {
        return (C) GraphSerializer.global().fromBytes(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Composite other = (Composite) obj;
        for (Slot<?> slot : getCompositeType().getSlots()) {
            if (slot.isCopiable() && !Objects.deepEquals(get(slot), other.get(slot))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = getClass().hashCode();
        for (Slot<?> slot : getCompositeType().getSlots()) {
            if (slot.isCopiable()) {
                result = 31 * result + Objects.hashCode(get(slot));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('(');
        boolean first = true;
        for (Slot<?> slot : getCompositeType().getSlots()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(slot.getName()).append('=').append(get(slot));
            first = false;
        }
        return sb.append(')').toString();
    }
}
