package org.Aayush.sparse.store;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of backing-store families.
 *
 * <p>Built-ins: {@link #STORE_ORDERED} (red-black tree), {@link #STORE_ORDERED_AVL}
 * (AVL tree) and {@link #STORE_HASHED} (linked open hash map).</p>
 */
public final class BackingStoreCatalog {
    public static final String STORE_ORDERED = "ORDERED";
    public static final String STORE_ORDERED_AVL = "ORDERED_AVL";
    public static final String STORE_HASHED = "HASHED";

    private static final BackingStoreFactory ORDERED_FACTORY = new RedBlackTreeFactory();
    private static final BackingStoreFactory ORDERED_AVL_FACTORY = new AvlTreeFactory();
    private static final BackingStoreFactory HASHED_FACTORY = new LinkedHashFactory();

    private final Map<String, BackingStoreFactory> factoriesById;
    private final String defaultStoreId;

    /**
     * Creates a catalog with built-in families only.
     */
    public BackingStoreCatalog() {
        this(STORE_ORDERED, defaultFactories());
    }

    /**
     * Creates a catalog by merging built-ins with custom families.
     *
     * <p>Custom ids override built-ins when ids collide.</p>
     */
    public BackingStoreCatalog(Collection<? extends BackingStoreFactory> customFactories) {
        this(STORE_ORDERED, mergeWithBuiltIns(customFactories));
    }

    /**
     * Creates a fully explicit catalog.
     */
    public BackingStoreCatalog(String defaultStoreId, Collection<? extends BackingStoreFactory> factories) {
        String normalizedDefaultId = normalizeRequiredId(defaultStoreId, "defaultStoreId");
        LinkedHashMap<String, BackingStoreFactory> map = new LinkedHashMap<>();
        for (BackingStoreFactory factory : Objects.requireNonNull(factories, "factories")) {
            BackingStoreFactory nonNullFactory = Objects.requireNonNull(factory, "factory");
            map.put(normalizeRequiredId(nonNullFactory.id(), "factory.id"), nonNullFactory);
        }
        if (!map.containsKey(normalizedDefaultId)) {
            throw new IllegalArgumentException("defaultStoreId is not present in factories: " + normalizedDefaultId);
        }
        this.defaultStoreId = normalizedDefaultId;
        this.factoriesById = Map.copyOf(map);
    }

    /**
     * Returns configured default family.
     */
    public BackingStoreFactory defaultFactory() {
        return factoriesById.get(defaultStoreId);
    }

    /**
     * Returns family by id (case-sensitive), or null when not registered.
     */
    public BackingStoreFactory factory(String storeId) {
        if (storeId == null) {
            return null;
        }
        return factoriesById.get(storeId);
    }

    /**
     * Returns immutable view of registered family ids.
     */
    public Set<String> storeIds() {
        return factoriesById.keySet();
    }

    /**
     * Returns default catalog singleton shape.
     */
    public static BackingStoreCatalog defaultCatalog() {
        return new BackingStoreCatalog();
    }

    private static Collection<? extends BackingStoreFactory> defaultFactories() {
        return List.of(ORDERED_FACTORY, ORDERED_AVL_FACTORY, HASHED_FACTORY);
    }

    private static Collection<? extends BackingStoreFactory> mergeWithBuiltIns(
            Collection<? extends BackingStoreFactory> customFactories
    ) {
        LinkedHashMap<String, BackingStoreFactory> merged = new LinkedHashMap<>();
        for (BackingStoreFactory factory : defaultFactories()) {
            merged.put(factory.id(), factory);
        }
        if (customFactories != null) {
            for (BackingStoreFactory factory : customFactories) {
                BackingStoreFactory nonNullFactory = Objects.requireNonNull(factory, "factory");
                merged.put(normalizeRequiredId(nonNullFactory.id(), "factory.id"), nonNullFactory);
            }
        }
        return merged.values();
    }

    private static String normalizeRequiredId(String id, String fieldName) {
        String normalized = Objects.requireNonNull(id, fieldName).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return normalized;
    }

    private static final class RedBlackTreeFactory implements BackingStoreFactory {
        @Override
        public String id() {
            return STORE_ORDERED;
        }

        @Override
        public <V> BackingStore<V> create(int expectedSize) {
            return SortedMapBackingStore.redBlackTree();
        }
    }

    private static final class AvlTreeFactory implements BackingStoreFactory {
        @Override
        public String id() {
            return STORE_ORDERED_AVL;
        }

        @Override
        public <V> BackingStore<V> create(int expectedSize) {
            return SortedMapBackingStore.avlTree();
        }
    }

    private static final class LinkedHashFactory implements BackingStoreFactory {
        @Override
        public String id() {
            return STORE_HASHED;
        }

        @Override
        public <V> BackingStore<V> create(int expectedSize) {
            return SortedMapBackingStore.linkedHash(expectedSize);
        }
    }
}
