package org.Aayush.sparse.matrix;

import org.Aayush.sparse.core.Coordinates;

import java.util.stream.Stream;

/**
 * Read operations of a sparse N-dimensional matrix.
 * <p>
 * Every coordinate that holds no entry reads as {@link #defaultValue()}. Size
 * counts stored entries only; the matrix has no extents.
 *
 * @param <T> element type.
 */
public interface MatrixView<T> extends Iterable<MatrixEntry<T>> {

    /**
     * Number of coordinates per tuple.
     */
    int dimensions();

    /**
     * Value reported for every coordinate without an entry.
     */
    T defaultValue();

    /**
     * Number of stored entries.
     */
    int size();

    /**
     * Returns true when no entry is stored.
     */
    boolean isEmpty();

    /**
     * Stored value at {@code coordinates}, or {@link #defaultValue()}. Never mutates.
     */
    T getOrDefault(Coordinates coordinates);

    /**
     * Varargs form of {@link #getOrDefault(Coordinates)}.
     */
    T getOrDefault(long... coordinates);

    /**
     * Returns true when an entry is stored at {@code coordinates}.
     */
    boolean contains(Coordinates coordinates);

    /**
     * Varargs form of {@link #contains(Coordinates)}.
     */
    boolean contains(long... coordinates);

    /**
     * Handle for one complete coordinate tuple.
     */
    CellView<T> at(Coordinates coordinates);

    /**
     * Varargs form of {@link #at(Coordinates)}.
     */
    CellView<T> at(long... coordinates);

    /**
     * Starts chained indexing with the first coordinate. Requires at least two dimensions.
     */
    DimensionIndexer<T, ? extends CellView<T>> index(long first);

    /**
     * Handle for a one-dimensional matrix.
     */
    CellView<T> cell(long coordinate);

    /**
     * Position of the first entry in store order, equal to {@link #end()} when empty.
     */
    EntryIterator<T> begin();

    /**
     * One-past-last position.
     */
    EntryIterator<T> end();

    /**
     * Sequential stream of entries in store order.
     */
    Stream<MatrixEntry<T>> stream();

    /**
     * Shape snapshot.
     */
    MatrixTelemetry telemetry();
}
