package com.keepsake.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A named attribute definition on a composite type.
 *
 * <p>A slot is an immutable descriptor shared by every instance of the type that
 * declares it; the values live in each {@link Composite}. Slots are declared as
 * {@code static final} fields:
 * <pre>
 * public static final Slot&lt;String&gt; NAME = Slot.of("name", "");
 * public static final Slot&lt;List&lt;String&gt;&gt; TAGS = Slot.withFactory("tags", owner -&gt; new ArrayList&lt;&gt;());
 * public static final Slot&lt;String&gt; ID = Slot.&lt;String&gt;of("id").writeOnce();
 * </pre>
 *
 * <p>Every configuration method returns a new slot, so one definition can serve
 * as a template for others.
 *
 * @param <T> Value type
 */
public final class Slot<T> {
    private final String name;
    private final T defaultValue;
    private final Function<? super Composite, ? extends T> factory;
    private final SlotParser<T> parser;
    private final List<SlotObserver<? super T>> observers;
    private final boolean writeOnce;
    private final boolean copiable;
    private final SlotInitializer postInit;

    private Slot(String name, T defaultValue, Function<? super Composite, ? extends T> factory,
                 SlotParser<T> parser, List<SlotObserver<? super T>> observers,
                 boolean writeOnce, boolean copiable, SlotInitializer postInit) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Slot name cannot be null or empty");
        }
        if (name.startsWith("__")) {
            throw new IllegalArgumentException("Slot name '" + name + "' is reserved");
        }
        this.name = name;
        this.defaultValue = defaultValue;
        this.factory = factory;
        this.parser = parser;
        this.observers = observers;
        this.writeOnce = writeOnce;
        this.copiable = copiable;
        this.postInit = postInit;
    }

    /**
     * Create a slot whose default is null.
     *
     * @param name Slot name
     * @param <T> Value type
     * @return New slot
     */
    public static <T> Slot<T> of(String name) {
        return new Slot<>(name, null, null, null, Collections.emptyList(), false, true, null);
    }

    /**
     * Create a slot with a static default. The same default object is seen by
     * every instance, so mutable defaults should use {@link #withFactory(String, Function)}.
     *
     * @param name Slot name
     * @param defaultValue Default value
     * @param <T> Value type
     * @return New slot
     */
    public static <T> Slot<T> of(String name, T defaultValue) {
        return new Slot<>(name, defaultValue, null, null, Collections.emptyList(), false, true, null);
    }

    /**
     * Create a slot whose default is produced per instance.
     *
     * @param name Slot name
     * @param factory Called at most once per instance with the owning instance
     * @param <T> Value type
     * @return New slot
     */
    public static <T> Slot<T> withFactory(String name, Function<? super Composite, ? extends T> factory) {
        return new Slot<>(name, null, Objects.requireNonNull(factory, "factory"), null,
            Collections.emptyList(), false, true, null);
    }

    /**
     * Derive a slot with a different name.
     *
     * @param newName Slot name
     * @return New slot
     */
    public Slot<T> named(String newName) {
        return new Slot<>(newName, defaultValue, factory, parser, observers, writeOnce, copiable, postInit);
    }

    /**
     * Derive a slot with a static default, replacing any factory.
     *
     * @param value Default value
     * @return New slot
     */
    public Slot<T> withDefault(T value) {
        return new Slot<>(name, value, null, parser, observers, writeOnce, copiable, postInit);
    }

    /**
     * Derive a slot with a per-instance default factory, replacing any static default.
     *
     * @param newFactory Default factory
     * @return New slot
     */
    public Slot<T> withDefaultFactory(Function<? super Composite, ? extends T> newFactory) {
        return new Slot<>(name, null, Objects.requireNonNull(newFactory, "factory"), parser, observers,
            writeOnce, copiable, postInit);
    }

    /**
     * Derive a slot with a parser run on every assignment.
     *
     * @param newParser Parser, or null to remove it
     * @return New slot
     */
    public Slot<T> withParser(SlotParser<T> newParser) {
        return new Slot<>(name, defaultValue, factory, newParser, observers, writeOnce, copiable, postInit);
    }

    /**
     * Derive a slot with one more observer, notified after the existing ones.
     *
     * @param observer Observer to add
     * @return New slot
     */
    public Slot<T> withObserver(SlotObserver<? super T> observer) {
        List<SlotObserver<? super T>> added = new ArrayList<>(observers);
        added.add(Objects.requireNonNull(observer, "observer"));
        return new Slot<>(name, defaultValue, factory, parser, Collections.unmodifiableList(added),
            writeOnce, copiable, postInit);
    }

    /**
     * Derive a slot without the given observer. Removing an observer that is not
     * present yields an equivalent slot.
     *
     * @param observer Observer to remove
     * @return New slot
     */
    public Slot<T> withoutObserver(SlotObserver<? super T> observer) {
        List<SlotObserver<? super T>> remaining = new ArrayList<>(observers);
        remaining.remove(observer);
        return new Slot<>(name, defaultValue, factory, parser, Collections.unmodifiableList(remaining),
            writeOnce, copiable, postInit);
    }

    /**
     * Derive a slot that can be assigned only once per instance.
     *
     * @return New slot
     */
    public Slot<T> writeOnce() {
        return new Slot<>(name, defaultValue, factory, parser, observers, true, copiable, postInit);
    }

    /**
     * Derive a slot excluded from copies and copy-serialization, e.g. a cache.
     *
     * @return New slot
     */
    public Slot<T> notCopiable() {
        return new Slot<>(name, defaultValue, factory, parser, observers, writeOnce, false, postInit);
    }

    /**
     * Derive a slot included in copies and copy-serialization.
     *
     * @return New slot
     */
    public Slot<T> copiable() {
        return new Slot<>(name, defaultValue, factory, parser, observers, writeOnce, true, postInit);
    }

    /**
     * Derive a slot with a post-initializer run on the first read of an unassigned value.
     *
     * @param initializer Post-initializer, or null to remove it
     * @return New slot
     */
    public Slot<T> withPostInit(SlotInitializer initializer) {
        return new Slot<>(name, defaultValue, factory, parser, observers, writeOnce, copiable, initializer);
    }

    public String getName() {
        return name;
    }

    public boolean isWriteOnce() {
        return writeOnce;
    }

    public boolean isCopiable() {
        return copiable;
    }

    public boolean hasFactory() {
        return factory != null;
    }

    public SlotInitializer getPostInit() {
        return postInit;
    }

    /**
     * Get the observers in notification order.
     *
     * @return Unmodifiable observer list
     */
    public List<SlotObserver<? super T>> getObservers() {
        return observers;
    }

    /**
     * Produce the default value for an instance.
     *
     * @param owner Instance being seeded
     * @return Factory result, or the static default
     */
    T defaultFor(Composite owner) {
        return factory != null ? factory.apply(owner) : defaultValue;
    }

    /**
     * Run the parser, or pass the raw value through if there is none.
     *
     * @param owner Instance being assigned
     * @param raw Raw value
     * @return Value to store
     */
    @SuppressWarnings("unchecked")
    T parse(Composite owner, Object raw) {
        return parser != null ? parser.parse(owner, raw) : (T) raw;
    }

    /**
     * Notify every observer in registration order. An observer exception
     * propagates and skips the remaining observers.
     */
    void notifyObservers(Composite owner, T oldValue, T newValue) {
        for (SlotObserver<? super T> observer : observers) {
            observer.changed(owner, oldValue, newValue);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Slot(").append(name);
        if (writeOnce) {
            sb.append(", writeOnce");
        }
        if (!copiable) {
            sb.append(", notCopiable");
        }
        return sb.append(')').toString();
    }
}
