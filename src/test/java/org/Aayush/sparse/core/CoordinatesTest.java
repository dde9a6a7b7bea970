package org.Aayush.sparse.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Coordinates Tests")
class CoordinatesTest {

    @Test
    @DisplayName("Equality is component-wise and order-sensitive")
    void testEquality() {
        assertEquals(Coordinates.of(0, 1, 2), Coordinates.of(0, 1, 2));
        assertEquals(Coordinates.of(0, 1, 2).hashCode(), Coordinates.of(0, 1, 2).hashCode());
        assertNotEquals(Coordinates.of(0, 1, 2), Coordinates.of(2, 1, 0));
        assertNotEquals(Coordinates.of(0, 1), Coordinates.of(0, 1, 0));
    }

    @Test
    @DisplayName("Input array is copied, toArray returns a copy")
    void testDefensiveCopies() {
        long[] raw = {3, 4};
        Coordinates coordinates = Coordinates.of(raw);
        raw[0] = 99;
        assertEquals(3, coordinates.get(0));

        long[] exported = coordinates.toArray();
        exported[1] = 99;
        assertEquals(4, coordinates.get(1));
    }

    @Test
    @DisplayName("Ordering is lexicographic, shorter prefix first")
    void testLexicographicOrdering() {
        assertTrue(Coordinates.of(0, 5).compareTo(Coordinates.of(1, 0)) < 0);
        assertTrue(Coordinates.of(1, 0).compareTo(Coordinates.of(0, 5)) > 0);
        assertTrue(Coordinates.of(2, 3).compareTo(Coordinates.of(2, 4)) < 0);
        assertTrue(Coordinates.of(2).compareTo(Coordinates.of(2, 0)) < 0);
        assertEquals(0, Coordinates.of(7, 7).compareTo(Coordinates.of(7, 7)));
    }

    @Test
    @DisplayName("Components beyond int range are accepted")
    void testLargeComponents() {
        Coordinates coordinates = Coordinates.of(Long.MAX_VALUE, 1L << 40);
        assertEquals(Long.MAX_VALUE, coordinates.get(0));
        assertTrue(Coordinates.of(1L << 40).compareTo(Coordinates.of(Long.MAX_VALUE)) < 0);
    }

    @Test
    @DisplayName("Append extends the tuple by one dimension")
    void testAppend() {
        Coordinates prefix = Coordinates.of(1);
        Coordinates full = prefix.append(2).append(3);

        assertEquals(1, prefix.dimensions());
        assertEquals(3, full.dimensions());
        assertEquals(Coordinates.of(1, 2, 3), full);
    }

    @ParameterizedTest
    @ValueSource(longs = {-1L, Long.MIN_VALUE})
    @DisplayName("Negative components are rejected")
    void testNegativeRejected(long negative) {
        MatrixContractException ex = assertThrows(MatrixContractException.class, () -> Coordinates.of(0, negative));
        assertEquals(Coordinates.REASON_NEGATIVE_COORDINATE, ex.getReasonCode());

        MatrixContractException appendEx = assertThrows(
                MatrixContractException.class,
                () -> Coordinates.of(0).append(negative)
        );
        assertEquals(Coordinates.REASON_NEGATIVE_COORDINATE, appendEx.getReasonCode());
    }

    @Test
    @DisplayName("Empty tuples are rejected")
    void testEmptyRejected() {
        MatrixContractException ex = assertThrows(MatrixContractException.class, Coordinates::of);
        assertEquals(Coordinates.REASON_EMPTY_COORDINATES, ex.getReasonCode());
        assertThrows(MatrixContractException.class, () -> Coordinates.of((long[]) null));
    }

    @Test
    @DisplayName("Axis access outside the tuple fails")
    void testAxisBounds() {
        Coordinates coordinates = Coordinates.of(1, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> coordinates.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> coordinates.get(-1));
    }

    @Test
    @DisplayName("Swapped components hash differently")
    void testHashIsOrderSensitive() {
        // a plain XOR fold would collide on every transposed pair
        int collisions = 0;
        for (long a = 0; a < 50; a++) {
            for (long b = a + 1; b < 50; b++) {
                if (Coordinates.of(a, b).hashCode() == Coordinates.of(b, a).hashCode()) {
                    collisions++;
                }
            }
        }
        assertEquals(0, collisions);
    }

    @Test
    @DisplayName("Hash spreads a dense grid")
    void testHashDistribution() {
        Set<Integer> hashes = new HashSet<>();
        int side = 100;
        for (long x = 0; x < side; x++) {
            for (long y = 0; y < side; y++) {
                hashes.add(Coordinates.of(x, y).hashCode());
            }
        }
        assertTrue(hashes.size() > side * side * 0.99, "too many hash collisions: " + hashes.size());
    }

    @Test
    @DisplayName("Mix is deterministic and non-trivial")
    void testMix() {
        assertEquals(Coordinates.mix(12345L), Coordinates.mix(12345L));
        assertNotEquals(Coordinates.mix(1L), Coordinates.mix(2L));
        assertEquals(0, Coordinates.mix(0L));
    }

    @Test
    @DisplayName("String rendering lists components")
    void testToString() {
        assertEquals("(0, 1, 2)", Coordinates.of(0, 1, 2).toString());
        assertEquals("(7)", Coordinates.of(7).toString());
    }
}
