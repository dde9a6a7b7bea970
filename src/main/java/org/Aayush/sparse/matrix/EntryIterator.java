package org.Aayush.sparse.matrix;

import org.Aayush.sparse.core.Coordinates;
import org.Aayush.sparse.core.MatrixContractException;
import org.Aayush.sparse.store.BackingStore;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable position in a matrix's store order.
 * <p>
 * A position is either one stored entry or the one-past-last {@code end}
 * sentinel. {@link #increment()} and {@link #decrement()} return new positions;
 * keeping the old reference gives post-increment behaviour. Two positions are
 * equal iff they belong to the same matrix and point at the same entry.
 * <p>
 * Dereferencing copies the entry out of storage, reading the current value.
 * Positions follow the invalidation rules of the backing store: a position
 * whose entry was erased cannot be dereferenced, and hash-backed stores also
 * cannot move it.
 *
 * @param <T> element type.
 */
public final class EntryIterator<T> {

    private final SparseMatrix<T> matrix;
    // null marks end()
    private final Coordinates position;

    EntryIterator(SparseMatrix<T> matrix, Coordinates position) {
        this.matrix = matrix;
        this.position = position;
    }

    /**
     * Returns true for the one-past-last sentinel.
     */
    public boolean isEnd() {
        return position == null;
    }

    /**
     * Coordinates of the entry at this position.
     */
    public Coordinates coordinates() {
        requireDereferenceable();
        return position;
    }

    /**
     * Current value of the entry at this position.
     */
    public T value() {
        requireDereferenceable();
        T value = matrix.store().get(position);
        if (value == null) {
            throw new MatrixContractException(
                    SparseMatrix.REASON_STALE_POSITION,
                    "entry at " + position + " was erased"
            );
        }
        return value;
    }

    /**
     * Copies the entry at this position.
     */
    public MatrixEntry<T> entry() {
        return new MatrixEntry<>(coordinates(), value());
    }

    /**
     * Position of the next entry, or {@code end} after the last one.
     *
     * @throws MatrixContractException when called on {@code end}.
     */
    public EntryIterator<T> increment() {
        if (position == null) {
            throw new MatrixContractException(
                    SparseMatrix.REASON_ITERATOR_END,
                    "cannot increment past end"
            );
        }
        return new EntryIterator<>(matrix, locate(true));
    }

    /**
     * Position of the previous entry; on {@code end} this is the last entry.
     *
     * @throws MatrixContractException when called on the first entry or on an empty matrix.
     */
    public EntryIterator<T> decrement() {
        Coordinates previous = position == null ? matrix.store().lastKey() : locate(false);
        if (previous == null) {
            throw new MatrixContractException(
                    SparseMatrix.REASON_ITERATOR_BEGIN,
                    "cannot decrement before begin"
            );
        }
        return new EntryIterator<>(matrix, previous);
    }

    private Coordinates locate(boolean forward) {
        BackingStore<T> store = matrix.store();
        try {
            return forward ? store.successor(position) : store.predecessor(position);
        } catch (NoSuchElementException e) {
            throw new MatrixContractException(
                    SparseMatrix.REASON_STALE_POSITION,
                    "store " + store.id() + " cannot move from erased entry " + position,
                    e
            );
        }
    }

    private void requireDereferenceable() {
        if (position == null) {
            throw new MatrixContractException(
                    SparseMatrix.REASON_ITERATOR_END,
                    "end position cannot be dereferenced"
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryIterator)) return false;
        EntryIterator<?> that = (EntryIterator<?>) o;
        return matrix == that.matrix && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(matrix) + Objects.hashCode(position);
    }

    @Override
    public String toString() {
        return position == null ? "EntryIterator[end]" : "EntryIterator[" + position + "]";
    }
}
