package com.keepsake.registry;

import com.keepsake.model.Composite;
import com.keepsake.model.Slot;
import com.keepsake.serde.SerializationException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Descriptor of a composite type: its class and its declared slots, inherited
 * slots first.
 *
 * <p>Slots are discovered from {@code static final Slot} fields. A subclass slot
 * with the same name as an inherited one replaces it in place. Discovery is
 * deferred to first use so that a class may register itself from a static
 * initializer placed anywhere in its body.
 */
public final class CompositeType {
    private static final Map<Class<?>, CompositeType> DESCRIPTORS = new ConcurrentHashMap<>();

    private final Class<? extends Composite> type;
    private volatile List<Slot<?>> slots;
    private volatile Map<String, Slot<?>> slotsByName;
    private volatile Constructor<? extends Composite> constructor;

    private CompositeType(Class<? extends Composite> type) {
        this.type = type;
    }

    /**
     * Get the descriptor of a composite class.
     *
     * @param type Composite class
     * @return Cached descriptor
     */
    public static CompositeType of(Class<? extends Composite> type) {
        return DESCRIPTORS.computeIfAbsent(type, cls -> new CompositeType(type));
    }

    public Class<? extends Composite> getType() {
        return type;
    }

    /**
     * Get every declared slot, inherited ones first.
     *
     * @return Unmodifiable slot list
     */
    public List<Slot<?>> getSlots() {
        if (slots == null) {
            discoverSlots();
        }
        return slots;
    }

    /**
     * Get the slots included in copies.
     *
     * @return Copiable slots in declaration order
     */
    public List<Slot<?>> getCopiableSlots() {
        List<Slot<?>> copiable = new ArrayList<>();
        for (Slot<?> slot : getSlots()) {
            if (slot.isCopiable()) {
                copiable.add(slot);
            }
        }
        return copiable;
    }

    /**
     * Find a slot by name.
     *
     * @param name Slot name
     * @return The slot, if declared
     */
    public Optional<Slot<?>> findSlot(String name) {
        if (slotsByName == null) {
            discoverSlots();
        }
        return Optional.ofNullable(slotsByName.get(name));
    }

    /**
     * Create an instance through the no-argument constructor.
     *
     * @return New instance with every slot unassigned
     */
    public Composite newInstance() {
        try {
            if (constructor == null) {
                Constructor<? extends Composite> ctor = type.getDeclaredConstructor();
                ctor.setAccessible(true);
                constructor = ctor;
            }
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new SerializationException(
                "Class " + type.getName() + " must have a no-arg constructor for deserialization", e);
        } catch (ReflectiveOperationException e) {
            throw new SerializationException("Failed to instantiate " + type.getName(), e);
        }
    }

    private synchronized void discoverSlots() {
        if (slots != null) {
            return;
        }
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        Class<?> current = type;
        while (current != null && current != Composite.class && current != Object.class) {
            hierarchy.push(current);
            current = current.getSuperclass();
        }

        Map<String, Slot<?>> byName = new LinkedHashMap<>();
        for (Class<?> cls : hierarchy) {
            Set<String> declaredHere = new HashSet<>();
            for (Field field : cls.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (!Modifier.isStatic(modifiers) || !Slot.class.isAssignableFrom(field.getType())) {
                    continue;
                }
                Slot<?> slot = readSlot(field);
                if (!declaredHere.add(slot.getName())) {
                    throw new IllegalStateException(
                        "Slot '" + slot.getName() + "' is declared twice in " + cls.getName());
                }
                byName.put(slot.getName(), slot);
            }
        }
        slotsByName = Collections.unmodifiableMap(byName);
        slots = Collections.unmodifiableList(new ArrayList<>(byName.values()));
    }

    private Slot<?> readSlot(Field field) {
        try {
            field.setAccessible(true);
            Slot<?> slot = (Slot<?>) field.get(null);
            if (slot == null) {
                throw new IllegalStateException(
                    "Slot field " + field.getDeclaringClass().getName() + "." + field.getName() +
                    " is not initialized");
            }
            return slot;
        } catch (IllegalAccessException e) {
            throw new SerializationException("Failed to access slot field: " + field.getName(), e);
        }
    }

    @Override
    public String toString() {
        return "CompositeType(" + type.getName() + ")";
    }
}
