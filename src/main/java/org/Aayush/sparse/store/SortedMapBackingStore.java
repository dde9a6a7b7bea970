package org.Aayush.sparse.store;

import it.unimi.dsi.fastutil.objects.Object2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectSortedMap;
import it.unimi.dsi.fastutil.objects.ObjectBidirectionalIterator;
import org.Aayush.sparse.core.Coordinates;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * {@link BackingStore} over any fastutil {@link Object2ObjectSortedMap}.
 * <p>
 * fastutil "sorted" maps cover both families the matrix needs:
 * <ul>
 *     <li>tree maps ({@link Object2ObjectRBTreeMap}, {@link Object2ObjectAVLTreeMap}),
 *     iterated in lexicographic coordinate order;</li>
 *     <li>{@link Object2ObjectLinkedOpenHashMap}, an open-addressing hash map
 *     iterated in first-insertion order.</li>
 * </ul>
 * Both expose bidirectional key iterators that can start at a given key, which
 * is what the position primitives are built on.
 * <p>
 * Tree maps can position relative to a key they no longer hold. The linked hash
 * map cannot and throws {@link java.util.NoSuchElementException} instead.
 *
 * @param <V> stored value type.
 */
public final class SortedMapBackingStore<V> implements BackingStore<V> {

    private final String id;
    private final Object2ObjectSortedMap<Coordinates, V> map;
    private final boolean locatesAbsentKeys;

    /**
     * Wraps an existing fastutil sorted map.
     *
     * @param id store family id reported by {@link #id()}.
     * @param map backing map; ownership passes to this store.
     */
    public SortedMapBackingStore(String id, Object2ObjectSortedMap<Coordinates, V> map) {
        this.id = Objects.requireNonNull(id, "id");
        this.map = Objects.requireNonNull(map, "map");
        this.locatesAbsentKeys = !(map instanceof Object2ObjectLinkedOpenHashMap);
    }

    /**
     * Red-black tree store in lexicographic coordinate order.
     */
    public static <V> SortedMapBackingStore<V> redBlackTree() {
        return new SortedMapBackingStore<>(BackingStoreCatalog.STORE_ORDERED, new Object2ObjectRBTreeMap<>());
    }

    /**
     * AVL tree store in lexicographic coordinate order.
     */
    public static <V> SortedMapBackingStore<V> avlTree() {
        return new SortedMapBackingStore<>(BackingStoreCatalog.STORE_ORDERED_AVL, new Object2ObjectAVLTreeMap<>());
    }

    /**
     * Hash store pre-sized for {@code expectedSize} entries, iterated in first-insertion order.
     */
    public static <V> SortedMapBackingStore<V> linkedHash(int expectedSize) {
        return new SortedMapBackingStore<>(
                BackingStoreCatalog.STORE_HASHED,
                new Object2ObjectLinkedOpenHashMap<>(expectedSize)
        );
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void put(Coordinates key, V value) {
        map.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public V get(Coordinates key) {
        return map.get(key);
    }

    @Override
    public boolean remove(Coordinates key) {
        // values are never null, so a null return means nothing was removed
        return map.remove(key) != null;
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public ObjectBidirectionalIterator<Object2ObjectMap.Entry<Coordinates, V>> entries() {
        return map.object2ObjectEntrySet().iterator();
    }

    @Override
    public Coordinates firstKey() {
        return map.isEmpty() ? null : map.firstKey();
    }

    @Override
    public Coordinates lastKey() {
        return map.isEmpty() ? null : map.lastKey();
    }

    @Override
    public Coordinates successor(Coordinates key) {
        // first next() yields the least key strictly greater than `key`
        ObjectBidirectionalIterator<Coordinates> it = iteratorFrom(key);
        return it.hasNext() ? it.next() : null;
    }

    @Override
    public Coordinates predecessor(Coordinates key) {
        // first previous() yields the greatest key <= `key`, which is `key` itself when stored
        ObjectBidirectionalIterator<Coordinates> it = iteratorFrom(key);
        if (!it.hasPrevious()) {
            return null;
        }
        Coordinates candidate = it.previous();
        if (!candidate.equals(key)) {
            return candidate;
        }
        return it.hasPrevious() ? it.previous() : null;
    }

    private ObjectBidirectionalIterator<Coordinates> iteratorFrom(Coordinates key) {
        // the linked hash map has no position for an absent key, even when empty
        if (!locatesAbsentKeys && !map.containsKey(key)) {
            throw new NoSuchElementException("store " + id + " holds no entry at " + key);
        }
        return map.keySet().iterator(key);
    }

    @Override
    public String toString() {
        return "SortedMapBackingStore[id=" + id + ", size=" + map.size() + "]";
    }
}
