package com.keepsake.serde;

import com.keepsake.array.ArrayData;
import com.keepsake.array.NumericArray;
import com.keepsake.model.Composite;
import com.keepsake.model.Slot;
import com.keepsake.registry.CompositeType;
import com.keepsake.registry.DatasetPayload;
import com.keepsake.registry.DatasetType;
import com.keepsake.registry.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts object graphs to nested structures and back.
 *
 * <p>Nested structure shapes:
 * <ul>
 *   <li>primitive: the value itself</li>
 *   <li>dataset: {@code {__dataset__: name, data: NumericArray, metadata: {...}}}</li>
 *   <li>list, set, map: a fresh container of the same kind with serialized elements</li>
 *   <li>composite: {@code {__type__: name, <slot>: <serialized value>, ...}}</li>
 * </ul>
 *
 * <p>Cyclic graphs are not supported; serializing one recurses until the stack overflows.
 */
public class GraphSerializer {
    private static final Logger log = LoggerFactory.getLogger(GraphSerializer.class);

    /**
     * Reserved key holding a composite's qualified type name.
     */
    public static final String TYPE_KEY = "__type__";

    /**
     * Reserved key holding a dataset's qualified type name.
     */
    public static final String DATASET_KEY = "__dataset__";

    /**
     * Key of a dataset's array.
     */
    public static final String DATA_KEY = "data";

    /**
     * Key of a dataset's metadata map.
     */
    public static final String METADATA_KEY = "metadata";

    private static final GraphSerializer GLOBAL = new GraphSerializer(TypeRegistry.global());

    private final TypeRegistry registry;
    private final ValueClassifier classifier;
    private final MsgPackSerializer codec;

    /**
     * Create a serializer over a registry.
     *
     * @param registry Registry used for classification and type resolution
     */
    public GraphSerializer(TypeRegistry registry) {
        this.registry = registry;
        this.classifier = new ValueClassifier(registry);
        this.codec = new MsgPackSerializer(registry);
    }

    /**
     * Get the serializer bound to the global registry.
     *
     * @return Shared serializer
     */
    public static GraphSerializer global() {
        return GLOBAL;
    }

    public TypeRegistry getRegistry() {
        return registry;
    }

    public ValueClassifier getClassifier() {
        return classifier;
    }

    /**
     * Serialize a value including every slot of every composite.
     *
     * @param value Value to serialize
     * @return Nested structure
     */
    public Object serialize(Object value) {
        return serialize(value, false);
    }

    /**
     * Serialize a value.
     *
     * @param value Value to serialize
     * @param isCopy If true, composites contribute only their copiable slots
     * @return Nested structure
     * @throws UnsupportedTypeException If some value in the graph has no category
     */
    public Object serialize(Object value, boolean isCopy) {
        switch (classifier.classify(value)) {
            case PRIMITIVE:
                return value;
            case DATASET:
                return serializeDataset(value);
            case CONTAINER:
                return serializeContainer(value, isCopy);
            case COMPOSITE:
                return serializeComposite((Composite) value, isCopy);
            default:
                throw new UnsupportedTypeException(value.getClass());
        }
    }

    private Map<String, Object> serializeDataset(Object value) {
        DatasetType<?> type = registry.datasetFor(value.getClass())
            .orElseThrow(() -> new UnsupportedTypeException(value.getClass()));
        DatasetPayload payload = type.disassemble(value);
        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put(DATASET_KEY, type.getName());
        structure.put(DATA_KEY, payload.getData());
        structure.put(METADATA_KEY, new LinkedHashMap<>(payload.getMetadata()));
        return structure;
    }

    private Object serializeContainer(Object value, boolean isCopy) {
        if (value instanceof Map) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                map.put(serializeKey(entry.getKey()), serialize(entry.getValue(), isCopy));
            }
            return map;
        }
        Collection<?> items = (Collection<?>) value;
        Collection<Object> result = value instanceof Set ? new LinkedHashSet<>() : new ArrayList<>(items.size());
        for (Object item : items) {
            result.add(serialize(item, isCopy));
        }
        return result;
    }

    private Object serializeKey(Object key) {
        if (TYPE_KEY.equals(key) || DATASET_KEY.equals(key)) {
            throw new SerializationException("Map key '" + key + "' is reserved for composite and dataset tags");
        }
        if (classifier.classify(key) != ValueCategory.PRIMITIVE) {
            throw new UnsupportedTypeException(key.getClass(),
                "Map keys must be primitives, got " + key.getClass().getName());
        }
        return key;
    }

    private Map<String, Object> serializeComposite(Composite composite, boolean isCopy) {
        String name = registry.compositeName(composite.getClass())
            .orElseThrow(() -> new UnsupportedTypeException(composite.getClass(),
                "Composite type " + composite.getClass().getName() + " is not registered"));
        CompositeType type = composite.getCompositeType();
        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put(TYPE_KEY, name);
        for (Slot<?> slot : isCopy ? type.getCopiableSlots() : type.getSlots()) {
            if (isCopy && slot.isWriteOnce() && !composite.isAssigned(slot)) {
                continue;
            }
            structure.put(slot.getName(), serialize(composite.get(slot), isCopy));
        }
        return structure;
    }

    /**
     * Rebuild a value from a nested structure.
     *
     * @param structure Nested structure
     * @return Rebuilt value
     * @throws TypeResolutionException If a type tag is not registered
     */
    public Object deserialize(Object structure) {
        if (structure instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) structure;
            if (map.containsKey(TYPE_KEY)) {
                return deserializeComposite(map);
            }
            if (map.containsKey(DATASET_KEY)) {
                return deserializeDataset(map);
            }
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                result.put(entry.getKey(), deserialize(entry.getValue()));
            }
            return result;
        }
        if (structure instanceof Set) {
            Set<Object> result = new LinkedHashSet<>();
            for (Object item : (Set<?>) structure) {
                result.add(deserialize(item));
            }
            return result;
        }
        if (structure instanceof Collection) {
            List<Object> result = new ArrayList<>();
            for (Object item : (Collection<?>) structure) {
                result.add(deserialize(item));
            }
            return result;
        }
        return structure;
    }

    private Composite deserializeComposite(Map<?, ?> structure) {
        String name = String.valueOf(structure.get(TYPE_KEY));
        CompositeType type = registry.lookupComposite(name);
        Composite instance = type.newInstance();
        for (Map.Entry<?, ?> entry : structure.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (TYPE_KEY.equals(key)) {
                continue;
            }
            Optional<Slot<?>> slot = type.findSlot(key);
            if (slot.isPresent()) {
                instance.assign(slot.get(), deserialize(entry.getValue()));
            } else {
                log.debug("Ignoring unknown slot '{}' for composite '{}'", key, name);
            }
        }
        return instance;
    }

    @SuppressWarnings("unchecked")
    private Object deserializeDataset(Map<?, ?> structure) {
        String name = String.valueOf(structure.get(DATASET_KEY));
        DatasetType<?> type = registry.lookupDataset(name);
        Object data = structure.get(DATA_KEY);
        if (!(data instanceof ArrayData)) {
            throw new SerializationException(
                "Dataset '" + name + "' has no array under '" + DATA_KEY + "'");
        }
        Object metadata = structure.get(METADATA_KEY);
        Map<String, Object> meta = metadata instanceof Map
            ? (Map<String, Object>) metadata
            : Collections.emptyMap();
        NumericArray array = ((ArrayData) data).read();
        return type.assemble(array, meta);
    }

    /**
     * Serialize a value and encode the structure as MessagePack.
     *
     * @param value Value to serialize
     * @return Encoded bytes
     */
    public byte[] toBytes(Object value) {
        return codec.serialize(serialize(value));
    }

    /**
     * Decode MessagePack bytes and rebuild the value.
     *
     * @param data Bytes produced by {@link #toBytes(Object)}
     * @return Rebuilt value
     */
    public Object fromBytes(byte[] data) {
        return deserialize(codec.deserialize(data));
    }
}
