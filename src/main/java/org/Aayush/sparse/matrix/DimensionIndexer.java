package org.Aayush.sparse.matrix;

import org.Aayush.sparse.core.Coordinates;
import org.Aayush.sparse.core.MatrixContractException;

import java.util.function.Function;

/**
 * Immutable builder that collects a coordinate tuple one dimension at a time.
 * <p>
 * {@code matrix.index(i0).index(i1).cell(i2)} resolves the same handle as
 * {@code matrix.at(i0, i1, i2)}. An incomplete indexer may be kept and
 * completed any number of times.
 *
 * @param <T> element type.
 * @param <C> handle type produced once the tuple is complete.
 */
public final class DimensionIndexer<T, C extends CellView<T>> {

    private final int dimensions;
    private final Coordinates prefix;
    private final Function<Coordinates, C> resolver;

    DimensionIndexer(int dimensions, Coordinates prefix, Function<Coordinates, C> resolver) {
        this.dimensions = dimensions;
        this.prefix = prefix;
        this.resolver = resolver;
    }

    /**
     * Appends the next coordinate. At least one more dimension must remain after it.
     *
     * @throws MatrixContractException when {@code coordinate} would fill the last dimension.
     */
    public DimensionIndexer<T, C> index(long coordinate) {
        if (remaining() <= 1) {
            throw new MatrixContractException(
                    SparseMatrix.REASON_INDEX_OVERFLOW,
                    "only the last dimension remains after " + prefix + "; resolve it with cell()"
            );
        }
        return new DimensionIndexer<>(dimensions, prefix.append(coordinate), resolver);
    }

    /**
     * Appends the last coordinate and resolves the handle.
     *
     * @throws MatrixContractException when more than one dimension remains.
     */
    public C cell(long coordinate) {
        if (remaining() != 1) {
            throw new MatrixContractException(
                    SparseMatrix.REASON_INDEX_INCOMPLETE,
                    remaining() + " dimensions remain after " + prefix + "; supply them with index()"
            );
        }
        return resolver.apply(prefix.append(coordinate));
    }

    /**
     * Number of dimensions still to be supplied.
     */
    public int remaining() {
        return dimensions - prefix.dimensions();
    }

    /**
     * Coordinates collected so far.
     */
    public long[] prefix() {
        return prefix.toArray();
    }

    @Override
    public String toString() {
        return "DimensionIndexer[prefix=" + prefix + ", remaining=" + remaining() + "]";
    }
}
