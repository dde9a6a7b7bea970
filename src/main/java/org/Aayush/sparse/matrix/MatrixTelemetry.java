package org.Aayush.sparse.matrix;

/**
 * Immutable matrix shape snapshot.
 */
public record MatrixTelemetry(
        int dimensions,
        String storeId,
        int size,
        String defaultValue
) {
}
