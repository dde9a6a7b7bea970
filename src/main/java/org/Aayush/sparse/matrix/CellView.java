package org.Aayush.sparse.matrix;

import org.Aayush.sparse.core.Coordinates;

import java.util.Objects;

/**
 * Read-only handle bound to one complete coordinate tuple of a matrix.
 * <p>
 * A handle holds no value of its own: every read re-queries the matrix, so
 * handles bound to the same coordinates always agree. A handle must not be
 * used after its matrix is discarded.
 *
 * @param <T> element type.
 */
public interface CellView<T> {

    /**
     * Coordinates this handle is bound to.
     */
    Coordinates coordinates();

    /**
     * Current value: the stored value, or the matrix default when nothing is stored.
     */
    T get();

    /**
     * Returns true when an entry is physically stored at these coordinates.
     */
    boolean isStored();

    /**
     * Compares the current value with {@code value}.
     */
    default boolean holds(T value) {
        return Objects.equals(get(), value);
    }
}
