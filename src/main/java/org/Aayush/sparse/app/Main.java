package org.Aayush.sparse.app;

import org.Aayush.sparse.matrix.MatrixEntry;
import org.Aayush.sparse.matrix.SparseMatrix;
import org.Aayush.sparse.store.StoreRuntimeConfig;

/**
 * Demo entry point: fills both diagonals of a 10x10 sparse matrix and prints it.
 */
public class Main {
    private static final int SIDE = 10;
    private static final int EXPECTED_ENTRIES = 2 * SIDE;

    /**
     * Prints the inner 8x8 block, the entry count and every stored entry.
     *
     * @param args ignored.
     */
    public static void main(String[] args) {
        SparseMatrix<Integer> matrix = SparseMatrix.create(0, 2, StoreRuntimeConfig.hashedRuntime(EXPECTED_ENTRIES));

        for (int i = 0; i < SIDE; i++) {
            matrix.index(i).cell(i).set(i);
        }
        for (int row = 0; row < SIDE; row++) {
            int col = SIDE - 1 - row;
            matrix.index(row).cell(col).set(col);
        }

        for (int row = 1; row < SIDE - 1; row++) {
            StringBuilder line = new StringBuilder();
            for (int col = 1; col < SIDE - 1; col++) {
                line.append(matrix.getOrDefault(row, col)).append(' ');
            }
            System.out.println(line.toString().trim());
        }

        System.out.println(matrix.size());

        for (MatrixEntry<Integer> entry : matrix) {
            System.out.printf("%d %d %d%n", entry.coordinate(0), entry.coordinate(1), entry.value());
        }
    }
}
