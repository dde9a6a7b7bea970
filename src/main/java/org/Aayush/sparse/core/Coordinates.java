package org.Aayush.sparse.core;

import java.util.Arrays;

/**
 * Immutable coordinate tuple used as the storage key of a sparse matrix.
 * <p>
 * Components are non-negative and unbounded. Two tuples are equal iff they
 * have the same length and the same components in the same order. Ordering is
 * lexicographic, which is the iteration order of tree-backed stores.
 * <p>
 * The hash folds every component through a MurmurHash3 finalizer. It is a
 * combining hash for hash-backed stores, not a cryptographic one.
 */
public final class Coordinates implements Comparable<Coordinates> {

    public static final String REASON_EMPTY_COORDINATES = "SM_EMPTY_COORDINATES";
    public static final String REASON_NEGATIVE_COORDINATE = "SM_NEGATIVE_COORDINATE";

    private final long[] components;
    private final int hash;

    private Coordinates(long[] components) {
        this.components = components;
        this.hash = combine(components);
    }

    /**
     * Creates a tuple from the given components.
     *
     * @param components coordinate per dimension, in dimension order.
     * @return immutable tuple (the input array is copied).
     * @throws MatrixContractException when no component is given or one is negative.
     */
    public static Coordinates of(long... components) {
        if (components == null || components.length == 0) {
            throw new MatrixContractException(
                    REASON_EMPTY_COORDINATES,
                    "coordinates need at least one component"
            );
        }
        long[] copy = components.clone();
        for (int axis = 0; axis < copy.length; axis++) {
            requireNonNegative(axis, copy[axis]);
        }
        return new Coordinates(copy);
    }

    /**
     * Returns a new tuple with {@code component} appended as the last dimension.
     */
    public Coordinates append(long component) {
        requireNonNegative(components.length, component);
        long[] extended = Arrays.copyOf(components, components.length + 1);
        extended[components.length] = component;
        return new Coordinates(extended);
    }

    /**
     * Number of components (the dimension count of the owning matrix).
     */
    public int dimensions() {
        return components.length;
    }

    /**
     * Returns the component for one axis.
     *
     * @throws IndexOutOfBoundsException when {@code axis} is outside {@code [0, dimensions())}.
     */
    public long get(int axis) {
        if (axis < 0 || axis >= components.length) {
            throw new IndexOutOfBoundsException(
                    "axis " + axis + " out of bounds for " + components.length + " dimensions");
        }
        return components[axis];
    }

    /**
     * Returns a copy of all components.
     */
    public long[] toArray() {
        return components.clone();
    }

    @Override
    public int compareTo(Coordinates other) {
        int shared = Math.min(components.length, other.components.length);
        for (int axis = 0; axis < shared; axis++) {
            int cmp = Long.compare(components[axis], other.components[axis]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(components.length, other.components.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinates)) return false;
        Coordinates that = (Coordinates) o;
        return hash == that.hash && Arrays.equals(components, that.components);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int axis = 0; axis < components.length; axis++) {
            if (axis > 0) {
                sb.append(", ");
            }
            sb.append(components[axis]);
        }
        return sb.append(')').toString();
    }

    private static void requireNonNegative(int axis, long component) {
        if (component < 0) {
            throw new MatrixContractException(
                    REASON_NEGATIVE_COORDINATE,
                    "coordinate on axis " + axis + " must be >= 0, got " + component
            );
        }
    }

    private static int combine(long[] components) {
        int h = 1;
        for (long component : components) {
            h = 31 * h + mix(component);
        }
        return h;
    }

    /**
     * MurmurHash3 64-bit finalizer folded to an int.
     * Package-private for testing distribution.
     */
    static int mix(long k) {
        k ^= k >>> 33;
        k *= 0xff51afd7ed558ccdL;
        k ^= k >>> 33;
        k *= 0xc4ceb9fe1a85ec53L;
        k ^= k >>> 33;
        return (int) k;
    }
}
