package org.Aayush.sparse.store;

/**
 * Creates fresh, empty backing stores of one family.
 */
public interface BackingStoreFactory {

    /**
     * Stable family id used for catalog lookup.
     */
    String id();

    /**
     * Creates an empty store.
     *
     * @param expectedSize entry-count hint; families without pre-sizing ignore it.
     * @param <V> stored value type.
     * @return new empty store.
     */
    <V> BackingStore<V> create(int expectedSize);
}
