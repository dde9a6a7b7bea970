package org.Aayush.sparse.matrix;

import org.Aayush.sparse.core.Coordinates;

import java.util.Objects;

/**
 * Assignable handle bound to one complete coordinate tuple.
 * <p>
 * Writing the matrix default erases the entry (or drops the write when no
 * entry exists); writing anything else creates or overwrites it. This keeps
 * storage proportional to the number of non-default elements.
 *
 * <pre>{@code
 * SparseMatrix<Integer> matrix = SparseMatrix.create(0, 2);
 * CellRef<Integer> cell = matrix.index(0).cell(0);
 * cell.set(42);   // stored, size() == 1
 * cell.set(0);    // erased, size() == 0
 * }</pre>
 *
 * @param <T> element type.
 */
public final class CellRef<T> implements CellView<T> {

    private final SparseMatrix<T> matrix;
    private final Coordinates coordinates;

    CellRef(SparseMatrix<T> matrix, Coordinates coordinates) {
        this.matrix = matrix;
        this.coordinates = coordinates;
    }

    @Override
    public Coordinates coordinates() {
        return coordinates;
    }

    @Override
    public T get() {
        return matrix.getOrDefault(coordinates);
    }

    @Override
    public boolean isStored() {
        return matrix.contains(coordinates);
    }

    /**
     * Writes {@code value}; the matrix default erases the entry.
     *
     * @return this handle.
     */
    public CellRef<T> set(T value) {
        Objects.requireNonNull(value, "value");
        if (value.equals(matrix.defaultValue())) {
            matrix.erase(coordinates);
        } else {
            matrix.set(coordinates, value);
        }
        return this;
    }

    /**
     * Copies the current value of {@code source} into this cell, with the same rules as {@link #set(Object)}.
     *
     * @return this handle.
     */
    public CellRef<T> assign(CellView<? extends T> source) {
        return set(Objects.requireNonNull(source, "source").get());
    }

    @Override
    public String toString() {
        return String.valueOf(get());
    }
}
