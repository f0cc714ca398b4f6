package com.keepsake.store;

import com.keepsake.array.DType;
import com.keepsake.array.NumericArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A group in a {@link HierarchicalStore}: named attributes plus ordered
 * children, each either a sub-group or an array leaf.
 *
 * <p>Attribute values are whatever {@link com.keepsake.serde.MsgPackSerializer}
 * can encode. Changes are buffered until the store is flushed.
 */
public final class StoreGroup {
    private static final Logger log = LoggerFactory.getLogger(StoreGroup.class);

    private static final String ATTRIBUTES_KEY = "attributes";
    private static final String CHILDREN_KEY = "children";

    private final HierarchicalStore store;
    private final Path directory;
    private Map<String, Object> attributes;
    private List<String> children;
    private boolean dirty;

    StoreGroup(HierarchicalStore store, Path directory) {
        this.store = store;
        this.directory = directory;
    }

    /**
     * Get the group's path from the store root, e.g. {@code /items/0}.
     *
     * @return Slash-separated path, {@code /} for the root
     */
    public String getPath() {
        StringBuilder path = new StringBuilder();
        for (Path segment : store.getLocation().relativize(directory)) {
            if (!segment.toString().isEmpty()) {
                path.append('/').append(HierarchicalStore.decodeName(segment.toString()));
            }
        }
        return path.length() == 0 ? "/" : path.toString();
    }

    /**
     * Get a snapshot of the attributes.
     *
     * @return Attributes in insertion order
     */
    public Map<String, Object> attributes() {
        load();
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Get an attribute.
     *
     * @param name Attribute name
     * @return Stored value, or null if absent
     */
    public Object getAttribute(String name) {
        load();
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        load();
        return attributes.containsKey(name);
    }

    /**
     * Set an attribute, replacing any previous value.
     *
     * @param name Attribute name
     * @param value Value to store
     * @throws ReadOnlyStoreException If the store is read-only
     */
    public void setAttribute(String name, Object value) {
        Objects.requireNonNull(name, "name");
        store.checkWritable("set attribute '" + name + "' on " + getPath());
        load();
        attributes.put(name, value);
        dirty = true;
    }

    /**
     * Remove an attribute.
     *
     * @param name Attribute name
     * @return True if the attribute existed
     */
    public boolean removeAttribute(String name) {
        store.checkWritable("remove attribute '" + name + "' from " + getPath());
        load();
        if (!attributes.containsKey(name)) {
            return false;
        }
        attributes.remove(name);
        dirty = true;
        return true;
    }

    /**
     * Get the names of all children in creation order.
     *
     * @return Child names
     */
    public List<String> children() {
        load();
        return List.copyOf(children);
    }

    public boolean contains(String name) {
        load();
        return children.contains(name);
    }

    /**
     * Check whether a child is a sub-group.
     *
     * @param name Child name
     * @return True if the child exists and is a group
     */
    public boolean hasGroup(String name) {
        return contains(name) && Files.isDirectory(directory.resolve(HierarchicalStore.encodeName(name)));
    }

    /**
     * Check whether a child is an array leaf.
     *
     * @param name Child name
     * @return True if the child exists and is an array
     */
    public boolean hasArray(String name) {
        return contains(name) &&
            Files.isRegularFile(directory.resolve(HierarchicalStore.encodeName(name) + HierarchicalStore.META_SUFFIX));
    }

    /**
     * Get a sub-group.
     *
     * @param name Child name
     * @return The group
     * @throws NoSuchElementException If there is no sub-group with that name
     */
    public StoreGroup group(String name) {
        if (!hasGroup(name)) {
            throw new NoSuchElementException("No group '" + name + "' in " + getPath());
        }
        return store.group(directory.resolve(HierarchicalStore.encodeName(name)));
    }

    /**
     * Create an empty sub-group.
     *
     * @param name Child name
     * @return The new group
     * @throws IllegalArgumentException If a child with that name exists
     */
    public StoreGroup createGroup(String name) {
        store.checkWritable("create group '" + name + "' in " + getPath());
        Path child = directory.resolve(HierarchicalStore.encodeName(name));
        requireAbsent(name);
        try {
            Files.createDirectory(child);
        } catch (IOException e) {
            throw new StoreException("Failed to create group '" + name + "' in " + getPath(), e);
        }
        StoreGroup group = store.group(child);
        group.attributes = new LinkedHashMap<>();
        group.children = new ArrayList<>();
        group.dirty = true;
        addChild(name);
        log.trace("Created group {}", group.getPath());
        return group;
    }

    /**
     * Get an array leaf.
     *
     * @param name Child name
     * @return Handle to the leaf
     * @throws NoSuchElementException If there is no array with that name
     */
    public ArrayProxy array(String name) {
        if (!hasArray(name)) {
            throw new NoSuchElementException("No array '" + name + "' in " + getPath());
        }
        return store.array(directory, name);
    }

    /**
     * Create a zero-filled array leaf.
     *
     * @param name Child name
     * @param dtype Element type
     * @param shape Initial shape
     * @return Handle to the new leaf
     */
    public ArrayProxy createArray(String name, DType dtype, long... shape) {
        return createArray(name, NumericArray.zeros(dtype, shape));
    }

    /**
     * Create an array leaf holding a copy of an array.
     *
     * @param name Child name
     * @param data Initial contents
     * @return Handle to the new leaf
     * @throws IllegalArgumentException If a child with that name exists
     */
    public ArrayProxy createArray(String name, NumericArray data) {
        store.checkWritable("create array '" + name + "' in " + getPath());
        requireAbsent(name);
        ArrayProxy array;
        try {
            array = ArrayProxy.create(store, directory, name, data, store.getOptions().getByteOrder());
        } catch (IOException e) {
            throw new StoreException("Failed to create array '" + name + "' in " + getPath(), e);
        }
        store.register(directory, name, array);
        addChild(name);
        log.trace("Created array {} in {}", array, getPath());
        return array;
    }

    /**
     * Delete a child and everything below it.
     *
     * @param name Child name
     * @return True if the child existed
     */
    public boolean remove(String name) {
        store.checkWritable("remove '" + name + "' from " + getPath());
        if (!contains(name)) {
            return false;
        }
        String entry = HierarchicalStore.encodeName(name);
        store.evict(directory.resolve(entry));
        try {
            HierarchicalStore.deleteRecursively(directory.resolve(entry));
            Files.deleteIfExists(directory.resolve(entry + HierarchicalStore.META_SUFFIX));
            Files.deleteIfExists(directory.resolve(entry + HierarchicalStore.DATA_SUFFIX));
        } catch (IOException e) {
            throw new StoreException("Failed to remove '" + name + "' from " + getPath(), e);
        }
        children.remove(name);
        dirty = true;
        return true;
    }

    /**
     * Remove every child and attribute.
     */
    public void clear() {
        store.checkWritable("clear " + getPath());
        for (String name : children()) {
            remove(name);
        }
        attributes.clear();
        dirty = true;
    }

    void flush() {
        if (dirty) {
            Map<String, Object> contents = new LinkedHashMap<>();
            contents.put(ATTRIBUTES_KEY, attributes);
            contents.put(CHILDREN_KEY, children);
            store.writeMap(directory.resolve(HierarchicalStore.ATTRIBUTES_FILE), contents);
            dirty = false;
        }
    }

    private void addChild(String name) {
        load();
        children.add(name);
        dirty = true;
    }

    private void requireAbsent(String name) {
        if (contains(name)) {
            throw new IllegalArgumentException("Child '" + name + "' already exists in " + getPath());
        }
    }

    private void load() {
        store.checkOpen();
        if (attributes != null) {
            return;
        }
        Map<String, Object> contents = store.readMap(directory.resolve(HierarchicalStore.ATTRIBUTES_FILE));
        Object storedAttributes = contents.get(ATTRIBUTES_KEY);
        Object storedChildren = contents.get(CHILDREN_KEY);
        attributes = new LinkedHashMap<>();
        if (storedAttributes instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) storedAttributes).entrySet()) {
                attributes.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        children = new ArrayList<>();
        if (storedChildren instanceof List) {
            for (Object child : (List<?>) storedChildren) {
                children.add(String.valueOf(child));
            }
        }
    }

    @Override
    public String toString() {
        return "StoreGroup(" + getPath() + ")";
    }
}
