package org.Aayush.sparse.matrix;

import org.Aayush.sparse.core.Coordinates;

import java.util.Objects;

/**
 * One stored matrix entry, copied out of storage.
 * <p>
 * Holding or discarding an entry never affects the matrix it came from.
 *
 * @param coordinates coordinate tuple of the entry.
 * @param value stored (non-default) value.
 * @param <T> element type.
 */
public record MatrixEntry<T>(Coordinates coordinates, T value) {

    public MatrixEntry {
        Objects.requireNonNull(coordinates, "coordinates");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Component of the coordinate tuple on one axis.
     */
    public long coordinate(int axis) {
        return coordinates.get(axis);
    }
}
