package com.keepsake.store;

import com.keepsake.registry.TypeRegistry;
import com.keepsake.serde.MsgPackSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory-backed hierarchical store of groups, attributes and array leaves.
 *
 * <p>Layout of a group directory:
 * <pre>
 * .attrs          MessagePack map: attributes and ordered child names
 * &lt;child&gt;/        sub-group
 * &lt;leaf&gt;.meta     MessagePack map: dtype, shape, byte order, attributes
 * &lt;leaf&gt;.bin      raw row-major element bytes
 * </pre>
 * Child names are URL-encoded with every {@code '.'} escaped, so no entry
 * collides with the side files.
 *
 * <p>A store holds open file handles until {@link #close()}. Attribute and
 * shape changes are buffered and written on {@link #flush()} or close.
 */
public final class HierarchicalStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HierarchicalStore.class);

    static final String ATTRIBUTES_FILE = ".attrs";
    static final String META_SUFFIX = ".meta";
    static final String DATA_SUFFIX = ".bin";

    private final Path location;
    private final OpenMode mode;
    private final StoreOptions options;
    private final MsgPackSerializer codec;
    private final Map<Path, StoreGroup> groups = new HashMap<>();
    private final Map<Path, ArrayProxy> arrays = new LinkedHashMap<>();
    private boolean closed;

    private HierarchicalStore(Path location, OpenMode mode, StoreOptions options, TypeRegistry registry) {
        this.location = location;
        this.mode = mode;
        this.options = options;
        this.codec = new MsgPackSerializer(registry);
    }

    /**
     * Open a store with default options.
     *
     * @param location Root directory of the store
     * @param mode Open mode
     * @return Open store
     */
    public static HierarchicalStore open(Path location, OpenMode mode) {
        return open(location, mode, StoreOptions.defaults());
    }

    /**
     * Open a store whose attributes resolve primitives against the global registry.
     *
     * @param location Root directory of the store
     * @param mode Open mode
     * @param options Store options
     * @return Open store
     */
    public static HierarchicalStore open(Path location, OpenMode mode, StoreOptions options) {
        return open(location, mode, options, TypeRegistry.global());
    }

    /**
     * Open a store.
     *
     * @param location Root directory of the store
     * @param mode Open mode
     * @param options Store options
     * @param registry Registry used to decode primitives found in attributes
     * @return Open store
     * @throws StoreException If the mode's existence requirement is not met or I/O fails
     */
    public static HierarchicalStore open(Path location, OpenMode mode, StoreOptions options, TypeRegistry registry) {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(mode, "mode");
        Path root = location.toAbsolutePath();
        HierarchicalStore store = new HierarchicalStore(root, mode, options, registry);
        boolean exists = Files.isRegularFile(root.resolve(ATTRIBUTES_FILE));
        try {
            switch (mode) {
                case READ_ONLY:
                case READ_WRITE:
                    if (!exists) {
                        throw new StoreException("No store found at " + root);
                    }
                    break;
                case CREATE_EXCLUSIVE:
                    if (exists) {
                        throw new StoreException("Store already exists at " + root);
                    }
                    store.create();
                    break;
                case CREATE_TRUNCATE:
                    if (Files.isDirectory(root)) {
                        deleteContents(root);
                    }
                    store.create();
                    break;
                case READ_WRITE_CREATE:
                    if (!exists) {
                        store.create();
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported open mode " + mode);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to open store at " + root + " in mode " + mode, e);
        }
        log.debug("Opened store {} in mode {}", root, mode);
        return store;
    }

    private void create() throws IOException {
        Files.createDirectories(location);
        writeMap(location.resolve(ATTRIBUTES_FILE), Map.of());
    }

    public Path getLocation() {
        return location;
    }

    public OpenMode getMode() {
        return mode;
    }

    public StoreOptions getOptions() {
        return options;
    }

    /**
     * Check whether the store accepts mutation.
     *
     * @return True unless opened read-only
     */
    public boolean isWritable() {
        return mode.isWritable();
    }

    /**
     * Check whether the store is still open.
     *
     * @return False once closed
     */
    public boolean isOpen() {
        return !closed;
    }

    /**
     * Get the root group.
     *
     * @return Root group
     */
    public StoreGroup root() {
        checkOpen();
        return group(location);
    }

    /**
     * Write buffered attribute and shape changes.
     */
    public void flush() {
        checkOpen();
        if (!isWritable()) {
            return;
        }
        for (StoreGroup group : groups.values()) {
            group.flush();
        }
        for (ArrayProxy array : arrays.values()) {
            array.flush();
        }
        log.debug("Flushed store {}", location);
    }

    /**
     * Flush pending changes and release every file handle. Closing twice has no effect.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        StoreException failure = null;
        try {
            flush();
        } catch (StoreException e) {
            failure = e;
        }
        for (ArrayProxy array : arrays.values()) {
            try {
                array.release();
            } catch (StoreException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        arrays.clear();
        groups.clear();
        closed = true;
        log.debug("Closed store {}", location);
        if (failure != null) {
            throw failure;
        }
    }

    void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Store " + location + " is closed");
        }
    }

    void checkWritable(String operation) {
        checkOpen();
        if (!isWritable()) {
            throw new ReadOnlyStoreException(operation);
        }
    }

    StoreGroup group(Path directory) {
        return groups.computeIfAbsent(directory, dir -> new StoreGroup(this, dir));
    }

    ArrayProxy array(Path directory, String name) {
        Path key = directory.resolve(encodeName(name));
        ArrayProxy array = arrays.get(key);
        if (array == null) {
            try {
                array = ArrayProxy.open(this, directory, name);
            } catch (IOException e) {
                throw new StoreException("Failed to open array '" + name + "' in " + directory, e);
            }
            arrays.put(key, array);
        }
        return array;
    }

    void register(Path directory, String name, ArrayProxy array) {
        arrays.put(directory.resolve(encodeName(name)), array);
    }

    /**
     * Drop cached handles at or below a path, releasing array files.
     */
    void evict(Path path) {
        groups.keySet().removeIf(dir -> dir.startsWith(path));
        Iterator<Map.Entry<Path, ArrayProxy>> it = arrays.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Path, ArrayProxy> entry = it.next();
            if (entry.getKey().startsWith(path)) {
                entry.getValue().release();
                it.remove();
            }
        }
    }

    /**
     * Read a MessagePack map side file.
     *
     * @param file File to read
     * @return Decoded map
     * @throws StoreException If the file is missing or not a map
     */
    @SuppressWarnings("unchecked")
    Map<String, Object> readMap(Path file) {
        Object decoded;
        try (InputStream in = Files.newInputStream(file)) {
            decoded = codec.readFrom(in);
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file, e);
        }
        if (!(decoded instanceof Map)) {
            throw new StoreException("Malformed store file " + file + ": expected a map");
        }
        return (Map<String, Object>) decoded;
    }

    void writeMap(Path file, Map<String, ?> map) {
        try (OutputStream out = Files.newOutputStream(file)) {
            codec.writeTo(map, out);
        } catch (IOException e) {
            throw new StoreException("Failed to write " + file, e);
        }
    }

    /**
     * Encode a child name as a directory entry.
     *
     * @param name Child name
     * @return Entry name containing no {@code '.'} and no separator
     */
    static String encodeName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Child name must not be empty");
        }
        return URLEncoder.encode(name, StandardCharsets.UTF_8).replace(".", "%2E");
    }

    static String decodeName(String entry) {
        return URLDecoder.decode(entry, StandardCharsets.UTF_8);
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(path)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path entry : entries) {
            Files.delete(entry);
        }
    }

    private static void deleteContents(Path directory) throws IOException {
        List<Path> children;
        try (Stream<Path> list = Files.list(directory)) {
            children = list.collect(Collectors.toCollection(ArrayList::new));
        }
        for (Path child : children) {
            deleteRecursively(child);
        }
    }

    @Override
    public String toString() {
        return "HierarchicalStore(" + location + ", " + mode + (closed ? ", closed" : "") + ")";
    }
}
