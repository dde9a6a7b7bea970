package org.Aayush.sparse.matrix;

import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import it.unimi.dsi.fastutil.objects.ObjectBidirectionalIterator;
import org.Aayush.sparse.core.Coordinates;
import org.Aayush.sparse.core.MatrixContractException;
import org.Aayush.sparse.store.BackingStore;
import org.Aayush.sparse.store.BackingStoreCatalog;
import org.Aayush.sparse.store.StoreRuntimeBinder;
import org.Aayush.sparse.store.StoreRuntimeConfig;

import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Sparse N-dimensional matrix that stores only non-default elements.
 * <p>
 * Every coordinate tuple implicitly holds {@link #defaultValue()} until a
 * different value is written to it. Writing the default through a
 * {@link CellRef} erases the entry again, so {@link #size()} always counts
 * non-default elements only. Coordinates are unbounded non-negative integers.
 * <p>
 * Access paths:
 * <ul>
 *     <li>{@code matrix.at(i0, i1, ..., iN-1)} returns a {@link CellRef} directly;</li>
 *     <li>{@code matrix.index(i0).index(i1)...cell(iN-1)} builds the same tuple one
 *     dimension at a time through {@link DimensionIndexer};</li>
 *     <li>{@link #begin()}/{@link #end()} and {@link #iterator()} expose stored entries
 *     in the backing store's native order.</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. Concurrent use
 * needs one external lock around the whole matrix.
 *
 * @param <T> element type; values and the default are never {@code null}.
 */
public final class SparseMatrix<T> implements MatrixView<T> {

    public static final String REASON_DIMENSIONS_INVALID = "SM_DIMENSIONS_INVALID";
    public static final String REASON_ARITY_MISMATCH = "SM_ARITY_MISMATCH";
    public static final String REASON_INDEX_OVERFLOW = "SM_INDEX_OVERFLOW";
    public static final String REASON_INDEX_INCOMPLETE = "SM_INDEX_INCOMPLETE";
    public static final String REASON_STORE_NOT_EMPTY = "SM_STORE_NOT_EMPTY";
    public static final String REASON_ITERATOR_END = "SM_ITERATOR_END";
    public static final String REASON_ITERATOR_BEGIN = "SM_ITERATOR_BEGIN";
    public static final String REASON_STALE_POSITION = "SM_STALE_POSITION";

    private final T defaultValue;
    private final int dimensions;
    private final BackingStore<T> store;

    private SparseMatrix(T defaultValue, int dimensions, BackingStore<T> store) {
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue");
        if (dimensions < 1) {
            throw new MatrixContractException(
                    REASON_DIMENSIONS_INVALID,
                    "dimensions must be >= 1, got " + dimensions
            );
        }
        this.dimensions = dimensions;
        this.store = Objects.requireNonNull(store, "store");
        if (!store.isEmpty()) {
            throw new MatrixContractException(
                    REASON_STORE_NOT_EMPTY,
                    "backing store must be empty, found " + store.size() + " entries"
            );
        }
    }

    /**
     * Creates a matrix over the default (red-black tree) store.
     */
    public static <T> SparseMatrix<T> create(T defaultValue, int dimensions) {
        return create(defaultValue, dimensions, StoreRuntimeConfig.orderedRuntime());
    }

    /**
     * Creates a matrix over a store resolved from the default catalog.
     */
    public static <T> SparseMatrix<T> create(T defaultValue, int dimensions, StoreRuntimeConfig storeConfig) {
        return create(defaultValue, dimensions, storeConfig, BackingStoreCatalog.defaultCatalog());
    }

    /**
     * Creates a matrix over a store resolved from {@code catalog}.
     */
    public static <T> SparseMatrix<T> create(
            T defaultValue,
            int dimensions,
            StoreRuntimeConfig storeConfig,
            BackingStoreCatalog catalog
    ) {
        StoreRuntimeBinder.Binding binding = new StoreRuntimeBinder().bind(storeConfig, catalog);
        return new SparseMatrix<>(defaultValue, dimensions, binding.newStore());
    }

    /**
     * Creates a matrix that takes ownership of an empty, caller-built store.
     *
     * @throws MatrixContractException when {@code store} already holds entries.
     */
    public static <T> SparseMatrix<T> create(T defaultValue, int dimensions, BackingStore<T> store) {
        return new SparseMatrix<>(defaultValue, dimensions, store);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public T defaultValue() {
        return defaultValue;
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public boolean isEmpty() {
        return store.isEmpty();
    }

    @Override
    public T getOrDefault(Coordinates coordinates) {
        T stored = store.get(requireArity(coordinates));
        return stored != null ? stored : defaultValue;
    }

    @Override
    public T getOrDefault(long... coordinates) {
        return getOrDefault(Coordinates.of(coordinates));
    }

    @Override
    public boolean contains(Coordinates coordinates) {
        return store.get(requireArity(coordinates)) != null;
    }

    @Override
    public boolean contains(long... coordinates) {
        return contains(Coordinates.of(coordinates));
    }

    /**
     * Inserts or overwrites the entry at {@code coordinates}.
     * <p>
     * This is the raw storage primitive: it stores {@code value} even when it
     * equals the default, which leaves an entry that reads like an absent one
     * but still counts towards {@link #size()}. Use {@link CellRef#set(Object)}
     * for delete-on-default writes.
     */
    public void set(Coordinates coordinates, T value) {
        store.put(requireArity(coordinates), Objects.requireNonNull(value, "value"));
    }

    /**
     * Varargs form of {@link #set(Coordinates, Object)}.
     */
    public void set(T value, long... coordinates) {
        set(Coordinates.of(coordinates), value);
    }

    /**
     * Removes the entry at {@code coordinates}; no-op when absent.
     */
    public void erase(Coordinates coordinates) {
        store.remove(requireArity(coordinates));
    }

    /**
     * Varargs form of {@link #erase(Coordinates)}.
     */
    public void erase(long... coordinates) {
        erase(Coordinates.of(coordinates));
    }

    @Override
    public CellRef<T> at(Coordinates coordinates) {
        return new CellRef<>(this, requireArity(coordinates));
    }

    @Override
    public CellRef<T> at(long... coordinates) {
        return at(Coordinates.of(coordinates));
    }

    @Override
    public DimensionIndexer<T, CellRef<T>> index(long first) {
        return this.<CellRef<T>>startIndex(first, coordinates -> new CellRef<>(this, coordinates));
    }

    @Override
    public CellRef<T> cell(long coordinate) {
        requireSingleDimension();
        return at(Coordinates.of(coordinate));
    }

    /**
     * Read-only view over this matrix's storage. Writes made through this
     * matrix are visible through the view immediately.
     */
    public MatrixView<T> asReadOnly() {
        return new ReadOnlyMatrixView<>(this);
    }

    @Override
    public EntryIterator<T> begin() {
        return new EntryIterator<>(this, store.firstKey());
    }

    @Override
    public EntryIterator<T> end() {
        return new EntryIterator<>(this, null);
    }

    /**
     * Read-only bidirectional iterator over stored entries; {@code remove()} is unsupported.
     */
    @Override
    public ObjectBidirectionalIterator<MatrixEntry<T>> iterator() {
        ObjectBidirectionalIterator<Object2ObjectMap.Entry<Coordinates, T>> entries = store.entries();
        return new ObjectBidirectionalIterator<>() {
            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public MatrixEntry<T> next() {
                return copyOf(entries.next());
            }

            @Override
            public boolean hasPrevious() {
                return entries.hasPrevious();
            }

            @Override
            public MatrixEntry<T> previous() {
                return copyOf(entries.previous());
            }
        };
    }

    @Override
    public Spliterator<MatrixEntry<T>> spliterator() {
        return Spliterators.spliterator(
                iterator(),
                store.size(),
                Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL
        );
    }

    @Override
    public Stream<MatrixEntry<T>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public MatrixTelemetry telemetry() {
        return new MatrixTelemetry(dimensions, store.id(), store.size(), String.valueOf(defaultValue));
    }

    @Override
    public String toString() {
        MatrixTelemetry telemetry = telemetry();
        return String.format("SparseMatrix[dimensions=%d, store=%s, size=%d, default=%s]",
                telemetry.dimensions(), telemetry.storeId(), telemetry.size(), telemetry.defaultValue());
    }

    BackingStore<T> store() {
        return store;
    }

    <C extends CellView<T>> DimensionIndexer<T, C> startIndex(
            long first,
            Function<Coordinates, C> resolver
    ) {
        if (dimensions < 2) {
            throw new MatrixContractException(
                    REASON_INDEX_OVERFLOW,
                    "one-dimensional matrix is indexed with cell()"
            );
        }
        return new DimensionIndexer<>(dimensions, Coordinates.of(first), resolver);
    }

    void requireSingleDimension() {
        if (dimensions != 1) {
            throw new MatrixContractException(
                    REASON_INDEX_INCOMPLETE,
                    "cell() completes a one-dimensional matrix; this one has " + dimensions + " dimensions"
            );
        }
    }

    Coordinates requireArity(Coordinates coordinates) {
        Objects.requireNonNull(coordinates, "coordinates");
        if (coordinates.dimensions() != dimensions) {
            throw new MatrixContractException(
                    REASON_ARITY_MISMATCH,
                    "expected " + dimensions + " coordinates, got " + coordinates.dimensions()
            );
        }
        return coordinates;
    }

    private static <T> MatrixEntry<T> copyOf(Object2ObjectMap.Entry<Coordinates, T> entry) {
        return new MatrixEntry<>(entry.getKey(), entry.getValue());
    }
}
