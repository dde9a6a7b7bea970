package org.Aayush.sparse.matrix;

import org.Aayush.sparse.core.Coordinates;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Read-only {@link MatrixView} delegating to one {@link SparseMatrix}.
 * <p>
 * Cells handed out by this view have no write method, and the view cannot be
 * cast back to the matrix.
 */
final class ReadOnlyMatrixView<T> implements MatrixView<T> {

    private final SparseMatrix<T> matrix;

    ReadOnlyMatrixView(SparseMatrix<T> matrix) {
        this.matrix = matrix;
    }

    @Override
    public int dimensions() {
        return matrix.dimensions();
    }

    @Override
    public T defaultValue() {
        return matrix.defaultValue();
    }

    @Override
    public int size() {
        return matrix.size();
    }

    @Override
    public boolean isEmpty() {
        return matrix.isEmpty();
    }

    @Override
    public T getOrDefault(Coordinates coordinates) {
        return matrix.getOrDefault(coordinates);
    }

    @Override
    public T getOrDefault(long... coordinates) {
        return matrix.getOrDefault(coordinates);
    }

    @Override
    public boolean contains(Coordinates coordinates) {
        return matrix.contains(coordinates);
    }

    @Override
    public boolean contains(long... coordinates) {
        return matrix.contains(coordinates);
    }

    @Override
    public CellView<T> at(Coordinates coordinates) {
        return new ReadOnlyCell<>(matrix, matrix.requireArity(coordinates));
    }

    @Override
    public CellView<T> at(long... coordinates) {
        return at(Coordinates.of(coordinates));
    }

    @Override
    public DimensionIndexer<T, CellView<T>> index(long first) {
        return matrix.<CellView<T>>startIndex(first, coordinates -> new ReadOnlyCell<>(matrix, coordinates));
    }

    @Override
    public CellView<T> cell(long coordinate) {
        matrix.requireSingleDimension();
        return at(Coordinates.of(coordinate));
    }

    @Override
    public EntryIterator<T> begin() {
        return matrix.begin();
    }

    @Override
    public EntryIterator<T> end() {
        return matrix.end();
    }

    @Override
    public Iterator<MatrixEntry<T>> iterator() {
        return matrix.iterator();
    }

    @Override
    public Stream<MatrixEntry<T>> stream() {
        return matrix.stream();
    }

    @Override
    public MatrixTelemetry telemetry() {
        return matrix.telemetry();
    }

    @Override
    public String toString() {
        return "ReadOnly" + matrix;
    }

    private record ReadOnlyCell<T>(SparseMatrix<T> matrix, Coordinates coordinates) implements CellView<T> {
        @Override
        public T get() {
            return matrix.getOrDefault(coordinates);
        }

        @Override
        public boolean isStored() {
            return matrix.contains(coordinates);
        }

        @Override
        public String toString() {
            return String.valueOf(get());
        }
    }
}
