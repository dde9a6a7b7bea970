package org.Aayush.sparse.store;

import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import it.unimi.dsi.fastutil.objects.ObjectBidirectionalIterator;
import org.Aayush.sparse.core.Coordinates;

/**
 * Minimal associative-store contract a sparse matrix needs from its storage.
 * <p>
 * Keys are coordinate tuples, values are never {@code null}, so a {@code null}
 * result always means "no entry". Iteration order is whatever the
 * implementation natively provides; the position primitives
 * ({@link #firstKey()}, {@link #successor(Coordinates)}, ...) must agree with
 * {@link #entries()}.
 * <p>
 * <strong>Thread Safety:</strong> implementations are not required to be thread-safe.
 *
 * @param <V> stored value type.
 */
public interface BackingStore<V> {

    /**
     * Store family id (for example {@code ORDERED} or {@code HASHED}).
     */
    String id();

    /**
     * Inserts a new entry or overwrites the value of an existing one.
     */
    void put(Coordinates key, V value);

    /**
     * Returns the stored value, or {@code null} when no entry exists.
     */
    V get(Coordinates key);

    /**
     * Removes the entry for {@code key} if present.
     *
     * @return true when an entry was removed.
     */
    boolean remove(Coordinates key);

    /**
     * Number of stored entries.
     */
    int size();

    /**
     * Returns true when no entry is stored.
     */
    boolean isEmpty();

    /**
     * Bidirectional iterator over stored entries in native store order.
     */
    ObjectBidirectionalIterator<Object2ObjectMap.Entry<Coordinates, V>> entries();

    /**
     * First key in native order, or {@code null} when empty.
     */
    Coordinates firstKey();

    /**
     * Last key in native order, or {@code null} when empty.
     */
    Coordinates lastKey();

    /**
     * Key following {@code key} in native order, or {@code null} when {@code key} is last.
     *
     * @throws java.util.NoSuchElementException when the store cannot locate
     *                                          positions relative to a key it no longer holds.
     */
    Coordinates successor(Coordinates key);

    /**
     * Key preceding {@code key} in native order, or {@code null} when {@code key} is first.
     *
     * @throws java.util.NoSuchElementException when the store cannot locate
     *                                          positions relative to a key it no longer holds.
     */
    Coordinates predecessor(Coordinates key);
}
