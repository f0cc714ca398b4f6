package com.keepsake.store;

import java.nio.file.Path;

/**
 * A store held open for lazy access.
 *
 * <p>Arrays loaded through a session are {@link ArrayProxy} handles (unless
 * the options ask for eager arrays) and stay usable until the session is
 * closed. Closing writes pending attribute and shape changes and releases the
 * store's files; any later use fails with {@link IllegalStateException}.
 *
 * <pre>
 * try (StoreSession session = StoreSession.open(path, OpenMode.READ_WRITE)) {
 *     Experiment experiment = session.load(Experiment.class);
 *     ((ArrayProxy) experiment.get(Experiment.SAMPLES)).append(NumericArray.of(4.0, 5.0));
 * }
 * </pre>
 */
public final class StoreSession implements AutoCloseable {
    private final HierarchicalStore store;
    private final StoreMapper mapper;

    private StoreSession(HierarchicalStore store, StoreMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    /**
     * Open a session with default options.
     *
     * @param location Store location
     * @param mode Open mode
     * @return Open session
     */
    public static StoreSession open(Path location, OpenMode mode) {
        return open(location, mode, StoreOptions.defaults());
    }

    /**
     * Open a session over the global registry.
     *
     * @param location Store location
     * @param mode Open mode
     * @param options Store options
     * @return Open session
     */
    public static StoreSession open(Path location, OpenMode mode, StoreOptions options) {
        return open(location, mode, options, new StoreMapper());
    }

    /**
     * Open a session.
     *
     * @param location Store location
     * @param mode Open mode
     * @param options Store options
     * @param mapper Mapper used to save and load graphs
     * @return Open session
     */
    public static StoreSession open(Path location, OpenMode mode, StoreOptions options, StoreMapper mapper) {
        HierarchicalStore store = HierarchicalStore.open(location, mode, options,
            mapper.getSerializer().getRegistry());
        return new StoreSession(store, mapper);
    }

    /**
     * Replace the store's contents with a graph.
     *
     * @param root Composite or container to save
     * @throws ReadOnlyStoreException If the session is read-only
     */
    public void save(Object root) {
        store.checkWritable("save to " + store.getLocation());
        mapper.write(store.root(), root);
    }

    /**
     * Load the stored graph.
     *
     * @return Rebuilt root value
     */
    public Object load() {
        return mapper.read(store.root(), store.getOptions().isLazyArrays());
    }

    /**
     * Load the stored graph as an expected type.
     *
     * @param type Expected root type
     * @param <T> Root type
     * @return Rebuilt root value
     * @throws ClassCastException If the root is of another type
     */
    public <T> T load(Class<T> type) {
        return type.cast(load());
    }

    public StoreGroup root() {
        return store.root();
    }

    public HierarchicalStore getStore() {
        return store;
    }

    public boolean isOpen() {
        return store.isOpen();
    }

    /**
     * Write pending attribute and shape changes without closing.
     */
    public void flush() {
        store.flush();
    }

    @Override
    public void close() {
        store.close();
    }
}
