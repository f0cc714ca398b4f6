package com.keepsake.registry;

import com.keepsake.array.ArrayData;
import com.keepsake.array.DType;
import com.keepsake.array.NumericArray;
import com.keepsake.array.TimestampIndex;
import com.keepsake.model.Composite;
import com.keepsake.serde.SerializationException;
import com.keepsake.serde.TypeResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Catalog of the types the serializer understands: composite types by
 * qualified name, primitive types stored verbatim, and dataset types with
 * their conversion callbacks.
 *
 * <p>The registry performs no locking. Register every type during
 * single-threaded startup, before any concurrent serialization begins.
 */
public class TypeRegistry {
    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    /**
     * Metadata key holding the zone id of timestamp datasets.
     */
    public static final String TIMEZONE_KEY = "tz";

    private static final TypeRegistry GLOBAL = new TypeRegistry();

    private final Map<String, Class<? extends Composite>> composites = new HashMap<>();
    private final Map<Class<?>, String> compositeNames = new HashMap<>();
    private final Set<Class<?>> primitives = new LinkedHashSet<>();
    private final Map<Class<?>, DatasetType<?>> datasets = new LinkedHashMap<>();
    private final Map<String, DatasetType<?>> datasetsByName = new HashMap<>();

    /**
     * Create a registry holding the built-in primitive and dataset types.
     */
    public TypeRegistry() {
        registerBuiltinTypes();
    }

    /**
     * Get the process-wide registry used by {@link Composite} and the default serializers.
     *
     * @return Shared registry
     */
    public static TypeRegistry global() {
        return GLOBAL;
    }

    private void registerBuiltinTypes() {
        registerPrimitive(String.class);
        registerPrimitive(Number.class);
        registerPrimitive(Boolean.class);
        registerPrimitive(Character.class);
        registerPrimitive(Path.class);
        registerPrimitive(Enum.class);
        registerPrimitive(UUID.class);
        registerPrimitive(Instant.class);
        registerPrimitive(LocalDate.class);
        registerPrimitive(LocalTime.class);
        registerPrimitive(LocalDateTime.class);

        registerDataset(NumericArray.class.getName(), ArrayData.class,
            array -> new DatasetPayload(array.read().copy()),
            (data, metadata) -> data.copy());

        registerDataset(ZonedDateTime.class,
            timestamp -> new DatasetPayload(
                NumericArray.ofLongs(epochNanos(timestamp)),
                Map.of(TIMEZONE_KEY, timestamp.getZone().getId())),
            (data, metadata) -> TimestampIndex.fromEpochNanos(data.getLong(0))
                .atZone(zoneOf(metadata)));

        registerDataset(TimestampIndex.class,
            index -> new DatasetPayload(
                NumericArray.ofLongs(index.toEpochNanos()),
                Map.of(TIMEZONE_KEY, index.getZone().getId())),
            (data, metadata) -> new TimestampIndex(data.astype(DType.INT64).toLongArray(), zoneOf(metadata)));
    }

    private static long epochNanos(ZonedDateTime timestamp) {
        try {
            return TimestampIndex.toEpochNanos(timestamp.toInstant());
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Cannot store timestamp " + timestamp + ": " + e.getMessage(), e);
        }
    }

    private static ZoneId zoneOf(Map<String, Object> metadata) {
        Object zone = metadata.get(TIMEZONE_KEY);
        return zone == null ? ZoneId.of("UTC") : ZoneId.of(zone.toString());
    }

    // ---------------------------------------------------------------- composites

    /**
     * Register a composite type under its class name.
     *
     * @param type Composite class
     * @return This registry
     */
    public TypeRegistry registerComposite(Class<? extends Composite> type) {
        return registerComposite(type.getName(), type);
    }

    /**
     * Register a composite type under an explicit qualified name. Registering a
     * different class under an existing name replaces the earlier one.
     *
     * @param name Qualified name written as the type tag
     * @param type Composite class
     * @return This registry
     */
    public TypeRegistry registerComposite(String name, Class<? extends Composite> type) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Composite name cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Composite type cannot be null");
        }
        Class<? extends Composite> previous = composites.put(name, type);
        if (previous != null && previous != type) {
            log.warn("Composite name '{}' re-registered: {} replaces {}", name, type, previous);
            compositeNames.remove(previous);
        } else if (previous == null) {
            log.debug("Registered composite '{}' -> {}", name, type.getName());
        }
        compositeNames.put(type, name);
        return this;
    }

    /**
     * Remove a composite registration. Registrations are never removed implicitly.
     *
     * @param name Qualified name
     * @return This registry
     */
    public TypeRegistry unregisterComposite(String name) {
        Class<? extends Composite> removed = composites.remove(name);
        if (removed != null) {
            compositeNames.remove(removed);
        }
        return this;
    }

    /**
     * Resolve a qualified name to its composite type. If nothing is registered
     * under the name but a class of that name exists, the class is initialized
     * so that its static registration can run, and the lookup is retried.
     *
     * @param name Qualified name
     * @return Descriptor of the registered type
     * @throws TypeResolutionException If the name does not resolve
     */
    public CompositeType lookupComposite(String name) {
        Class<? extends Composite> type = composites.get(name);
        if (type == null && initializeClass(name)) {
            type = composites.get(name);
        }
        if (type == null) {
            throw new TypeResolutionException(name);
        }
        return CompositeType.of(type);
    }

    /**
     * Check if a composite type is registered under a name.
     *
     * @param name Qualified name
     * @return True if registered
     */
    public boolean isRegistered(String name) {
        return composites.containsKey(name);
    }

    /**
     * Check if a class is registered as a composite type.
     *
     * @param type Class to check
     * @return True if registered under some name
     */
    public boolean isComposite(Class<?> type) {
        return compositeNames.containsKey(type);
    }

    /**
     * Get the qualified name a composite class is registered under.
     *
     * @param type Composite class
     * @return Registered name, if any
     */
    public Optional<String> compositeName(Class<?> type) {
        return Optional.ofNullable(compositeNames.get(type));
    }

    /**
     * Get all registered composite names.
     *
     * @return Unmodifiable set of names
     */
    public Set<String> getCompositeNames() {
        return Collections.unmodifiableSet(composites.keySet());
    }

    private static boolean initializeClass(String name) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TypeRegistry.class.getClassLoader();
        }
        try {
            // only composites get their static initializer run
            Class<?> cls = Class.forName(name, false, loader);
            if (!Composite.class.isAssignableFrom(cls)) {
                return false;
            }
            Class.forName(name, true, loader);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    // ---------------------------------------------------------------- primitives

    /**
     * Register a type whose values are stored unchanged. Subtypes are primitive too.
     * Registering a type twice is a no-op.
     *
     * @param type Primitive type
     * @return This registry
     * @throws IllegalArgumentException If the type overlaps a registered dataset type
     */
    public TypeRegistry registerPrimitive(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("Primitive type cannot be null");
        }
        for (Class<?> dataset : datasets.keySet()) {
            if (overlaps(type, dataset)) {
                throw new IllegalArgumentException(
                    "Cannot register " + type.getName() + " as primitive: it overlaps dataset type " +
                    dataset.getName());
            }
        }
        if (primitives.add(type)) {
            log.debug("Registered primitive type {}", type.getName());
        }
        return this;
    }

    /**
     * Remove a primitive type. Removing a type that is not registered is a no-op.
     *
     * @param type Primitive type
     * @return This registry
     */
    public TypeRegistry removePrimitive(Class<?> type) {
        primitives.remove(type);
        return this;
    }

    /**
     * Check if values of a type are stored unchanged.
     *
     * @param type Type to check
     * @return True if the type or one of its supertypes is registered as primitive
     */
    public boolean isPrimitive(Class<?> type) {
        if (primitives.contains(type)) {
            return true;
        }
        for (Class<?> primitive : primitives) {
            if (primitive.isAssignableFrom(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get the registered primitive types.
     *
     * @return Unmodifiable set in registration order
     */
    public Set<Class<?>> getPrimitiveTypes() {
        return Collections.unmodifiableSet(primitives);
    }

    // ---------------------------------------------------------------- datasets

    /**
     * Register a dataset type under its class name.
     *
     * @param type Dataset type
     * @param disassembler Converts instances to array and metadata
     * @param assembler Converts array and metadata back to instances
     * @param <T> Dataset type
     * @return This registry
     */
    public <T> TypeRegistry registerDataset(Class<T> type, DatasetDisassembler<T> disassembler,
                                            DatasetAssembler<? extends T> assembler) {
        return registerDataset(type.getName(), type, disassembler, assembler);
    }

    /**
     * Register a dataset type under an explicit qualified name.
     *
     * @param name Qualified name written as the dataset tag
     * @param type Dataset type; subtypes are handled by the same callbacks
     * @param disassembler Converts instances to array and metadata
     * @param assembler Converts array and metadata back to instances
     * @param <T> Dataset type
     * @return This registry
     * @throws IllegalArgumentException If the type overlaps a registered primitive type
     */
    public <T> TypeRegistry registerDataset(String name, Class<T> type, DatasetDisassembler<T> disassembler,
                                            DatasetAssembler<? extends T> assembler) {
        if (type == null || disassembler == null || assembler == null) {
            throw new IllegalArgumentException("Dataset type and callbacks cannot be null");
        }
        for (Class<?> primitive : primitives) {
            if (overlaps(type, primitive)) {
                throw new IllegalArgumentException(
                    "Cannot register " + type.getName() + " as dataset: it overlaps primitive type " +
                    primitive.getName());
            }
        }
        removeDataset(type);
        DatasetType<T> datasetType = new DatasetType<>(name, type, disassembler, assembler);
        datasets.put(type, datasetType);
        datasetsByName.put(name, datasetType);
        log.debug("Registered dataset type '{}' -> {}", name, type.getName());
        return this;
    }

    /**
     * Remove a dataset type. Removing a type that is not registered is a no-op.
     *
     * @param type Dataset type
     * @return This registry
     */
    public TypeRegistry removeDataset(Class<?> type) {
        DatasetType<?> removed = datasets.remove(type);
        if (removed != null) {
            datasetsByName.remove(removed.getName());
        }
        return this;
    }

    /**
     * Check if values of a type are converted to arrays.
     *
     * @param type Type to check
     * @return True if the type or one of its supertypes is a registered dataset type
     */
    public boolean isDataset(Class<?> type) {
        return datasetFor(type).isPresent();
    }

    /**
     * Find the dataset registration handling a type: the exact class first,
     * then the first registered supertype.
     *
     * @param type Runtime type
     * @return Matching registration, if any
     */
    public Optional<DatasetType<?>> datasetFor(Class<?> type) {
        DatasetType<?> exact = datasets.get(type);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (Map.Entry<Class<?>, DatasetType<?>> entry : datasets.entrySet()) {
            if (entry.getKey().isAssignableFrom(type)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a dataset tag.
     *
     * @param name Qualified dataset name
     * @return The registration
     * @throws TypeResolutionException If nothing is registered under the name
     */
    public DatasetType<?> lookupDataset(String name) {
        DatasetType<?> type = datasetsByName.get(name);
        if (type == null) {
            throw new TypeResolutionException(name);
        }
        return type;
    }

    private static boolean overlaps(Class<?> a, Class<?> b) {
        return a.isAssignableFrom(b) || b.isAssignableFrom(a);
    }
}
