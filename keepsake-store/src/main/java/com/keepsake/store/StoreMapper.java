package com.keepsake.store;

import com.keepsake.array.ArrayData;
import com.keepsake.registry.DatasetType;
import com.keepsake.registry.TypeRegistry;
import com.keepsake.serde.ContainerKind;
import com.keepsake.serde.GraphSerializer;
import com.keepsake.serde.PrimitiveCodec;
import com.keepsake.serde.SerializationException;
import com.keepsake.serde.UnsupportedTypeException;
import com.keepsake.serde.ValueCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Saves object graphs into a {@link HierarchicalStore} and loads them back.
 *
 * <p>The graph is first converted to a nested structure by a
 * {@link GraphSerializer}, then mapped onto the store:
 * <ul>
 *   <li>primitive: attribute of the enclosing group, in its
 *       {@link PrimitiveCodec#encodeAttribute(Object) attribute encoding}</li>
 *   <li>container: sub-group with a {@value #CONTAINER_KEY} attribute naming
 *       the container kind; elements are keyed by position or map key</li>
 *   <li>composite: sub-group with a {@code __type__} attribute; one member per slot</li>
 *   <li>dataset: array leaf with a {@code __dataset__} attribute plus the
 *       dataset's metadata as attributes</li>
 * </ul>
 * The root value must be a composite or a container.
 */
public class StoreMapper {
    private static final Logger log = LoggerFactory.getLogger(StoreMapper.class);

    /**
     * Attribute holding the container kind of a container group.
     */
    public static final String CONTAINER_KEY = "__container__";

    private static final Set<String> RESERVED_KEYS =
        Set.of(GraphSerializer.TYPE_KEY, GraphSerializer.DATASET_KEY, CONTAINER_KEY);

    private final GraphSerializer serializer;
    private final PrimitiveCodec primitives;

    /**
     * Create a mapper over the global registry.
     */
    public StoreMapper() {
        this(GraphSerializer.global());
    }

    /**
     * Create a mapper.
     *
     * @param serializer Serializer producing and consuming nested structures
     */
    public StoreMapper(GraphSerializer serializer) {
        this.serializer = serializer;
        this.primitives = new PrimitiveCodec(serializer.getRegistry());
    }

    public GraphSerializer getSerializer() {
        return serializer;
    }

    /**
     * Save a graph into a store with default options.
     *
     * @param root Composite or container to save
     * @param destination Store location
     * @param mode Open mode; must be writable
     */
    public void save(Object root, Path destination, OpenMode mode) {
        save(root, destination, mode, StoreOptions.defaults());
    }

    /**
     * Save a graph into a store, replacing whatever the store's root held.
     *
     * @param root Composite or container to save
     * @param destination Store location
     * @param mode Open mode; must be writable
     * @param options Store options for new array leaves
     * @throws ReadOnlyStoreException If the mode is read-only
     * @throws SerializationException If the root is neither a composite nor a container
     */
    public void save(Object root, Path destination, OpenMode mode, StoreOptions options) {
        if (!mode.isWritable()) {
            throw new ReadOnlyStoreException("save to " + destination);
        }
        try (HierarchicalStore store = HierarchicalStore.open(destination, mode, options, registry())) {
            write(store.root(), root);
        }
        log.debug("Saved {} to {}", root.getClass().getName(), destination);
    }

    /**
     * Load a graph with every array materialized in memory.
     *
     * @param source Store location
     * @return Rebuilt root value
     */
    public Object load(Path source) {
        try (HierarchicalStore store = HierarchicalStore.open(source, OpenMode.READ_ONLY,
                StoreOptions.defaults(), registry())) {
            return read(store.root(), false);
        }
    }

    /**
     * Replace a group's contents with a graph.
     *
     * @param group Target group
     * @param root Composite or container to write
     * @throws SerializationException If the root is neither a composite nor a container
     */
    public void write(StoreGroup group, Object root) {
        Object structure = serializer.serialize(root);
        if (!isGroupStructure(structure)) {
            throw new SerializationException("Only a composite or container can be saved as a store root, got " +
                (root == null ? "null" : root.getClass().getName()));
        }
        group.clear();
        writeGroup(group, structure);
    }

    /**
     * Rebuild the graph held by a group.
     *
     * @param group Source group
     * @param lazy If true, numeric array leaves are returned as {@link ArrayProxy} handles
     * @return Rebuilt value
     */
    public Object read(StoreGroup group, boolean lazy) {
        return serializer.deserialize(readGroup(group, lazy));
    }

    private static boolean isGroupStructure(Object structure) {
        if (structure instanceof Map) {
            return !((Map<?, ?>) structure).containsKey(GraphSerializer.DATASET_KEY);
        }
        return structure instanceof Collection;
    }

    private void writeGroup(StoreGroup group, Object structure) {
        if (structure instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) structure;
            Object tag = map.get(GraphSerializer.TYPE_KEY);
            if (tag != null) {
                group.setAttribute(GraphSerializer.TYPE_KEY, tag);
            } else {
                group.setAttribute(CONTAINER_KEY, ContainerKind.MAPPING.tag());
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (tag != null && GraphSerializer.TYPE_KEY.equals(entry.getKey())) {
                    continue;
                }
                if (!(entry.getKey() instanceof String)) {
                    throw new SerializationException("Stored mapping keys must be strings, got " +
                        (entry.getKey() == null ? "null" : entry.getKey().getClass().getName()) +
                        " in " + group.getPath());
                }
                writeMember(group, (String) entry.getKey(), entry.getValue());
            }
        } else {
            ContainerKind kind = structure instanceof Set ? ContainerKind.SET : ContainerKind.SEQUENCE;
            group.setAttribute(CONTAINER_KEY, kind.tag());
            int position = 0;
            for (Object item : (Collection<?>) structure) {
                writeMember(group, String.valueOf(position++), item);
            }
        }
    }

    private void writeMember(StoreGroup group, String name, Object value) {
        if (RESERVED_KEYS.contains(name)) {
            throw new SerializationException("'" + name + "' is a reserved key and cannot be stored in " +
                group.getPath());
        }
        if (value instanceof Map && ((Map<?, ?>) value).containsKey(GraphSerializer.DATASET_KEY)) {
            writeDataset(group, name, (Map<?, ?>) value);
        } else if (value instanceof Map || value instanceof Collection) {
            writeGroup(group.createGroup(name), value);
        } else {
            group.setAttribute(name, primitives.encodeAttribute(value));
        }
        log.trace("Mapped '{}' in {}", name, group.getPath());
    }

    private void writeDataset(StoreGroup group, String name, Map<?, ?> structure) {
        ArrayData data = (ArrayData) structure.get(GraphSerializer.DATA_KEY);
        ArrayProxy leaf = group.createArray(name, data.read());
        leaf.setAttribute(GraphSerializer.DATASET_KEY, structure.get(GraphSerializer.DATASET_KEY));
        Object metadata = structure.get(GraphSerializer.METADATA_KEY);
        if (metadata instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) metadata).entrySet()) {
                Object value = entry.getValue();
                if (serializer.getClassifier().classify(value) != ValueCategory.PRIMITIVE) {
                    throw new UnsupportedTypeException(value.getClass(),
                        "Dataset metadata '" + entry.getKey() + "' of " + name + " must be primitive, got " +
                            value.getClass().getName());
                }
                leaf.setAttribute(String.valueOf(entry.getKey()), primitives.encodeAttribute(value));
            }
        }
    }

    private Object readGroup(StoreGroup group, boolean lazy) {
        Map<String, Object> attributes = group.attributes();
        Object tag = attributes.get(GraphSerializer.TYPE_KEY);
        if (tag != null) {
            Map<String, Object> structure = new LinkedHashMap<>();
            structure.put(GraphSerializer.TYPE_KEY, tag);
            readMembers(group, attributes, structure, lazy);
            return structure;
        }
        Object container = attributes.get(CONTAINER_KEY);
        if (container == null) {
            throw new StoreException("Group " + group.getPath() + " holds neither a composite nor a container");
        }
        ContainerKind kind = ContainerKind.fromTag(String.valueOf(container));
        Map<String, Object> members = new LinkedHashMap<>();
        readMembers(group, attributes, members, lazy);
        if (kind == ContainerKind.MAPPING) {
            return members;
        }
        Map<Integer, Object> byPosition = new TreeMap<>();
        for (Map.Entry<String, Object> member : members.entrySet()) {
            byPosition.put(position(group, member.getKey()), member.getValue());
        }
        List<Object> items = new ArrayList<>(byPosition.values());
        return kind == ContainerKind.SET ? new LinkedHashSet<>(items) : items;
    }

    private void readMembers(StoreGroup group, Map<String, Object> attributes, Map<String, Object> into,
                             boolean lazy) {
        for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
            if (!RESERVED_KEYS.contains(attribute.getKey())) {
                into.put(attribute.getKey(), primitives.decodeAttribute(attribute.getValue()));
            }
        }
        for (String child : group.children()) {
            if (group.hasGroup(child)) {
                into.put(child, readGroup(group.group(child), lazy));
            } else {
                into.put(child, readLeaf(group.array(child), lazy));
            }
        }
    }

    private Object readLeaf(ArrayProxy leaf, boolean lazy) {
        Object tag = leaf.getAttribute(GraphSerializer.DATASET_KEY);
        if (tag == null) {
            return lazy ? leaf : leaf.read();
        }
        DatasetType<?> type = registry().lookupDataset(String.valueOf(tag));
        if (lazy && type.getType().isInstance(leaf)) {
            return leaf;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Map.Entry<String, Object> attribute : leaf.attributes().entrySet()) {
            if (!GraphSerializer.DATASET_KEY.equals(attribute.getKey())) {
                metadata.put(attribute.getKey(), primitives.decodeAttribute(attribute.getValue()));
            }
        }
        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put(GraphSerializer.DATASET_KEY, tag);
        structure.put(GraphSerializer.DATA_KEY, leaf.read());
        structure.put(GraphSerializer.METADATA_KEY, metadata);
        return structure;
    }

    private static int position(StoreGroup group, String name) {
        try {
            return Integer.parseInt(name);
        } catch (NumberFormatException e) {
            throw new StoreException("Member '" + name + "' of sequence group " + group.getPath() +
                " is not a position", e);
        }
    }

    private TypeRegistry registry() {
        return serializer.getRegistry();
    }
}
