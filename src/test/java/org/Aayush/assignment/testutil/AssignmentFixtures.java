package org.Aayush.assignment.testutil;

import org.Aayush.assignment.core.AssignmentSolution;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared matrices and solution checks for assignment tests.
 */
public final class AssignmentFixtures {
    private static final double EXACT_TOLERANCE = 1e-9d;

    private AssignmentFixtures() {
    }

    public static double[][] randomIntMatrix(Random random, int n, int minInclusive, int maxExclusive) {
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                matrix[i][j] = minInclusive + random.nextInt(maxExclusive - minInclusive);
            }
        }
        return matrix;
    }

    public static double[][] randomRealMatrix(Random random, int n, double min, double max) {
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                matrix[i][j] = min + random.nextDouble() * (max - min);
            }
        }
        return matrix;
    }

    public static double[][] uniformMatrix(int n, double value) {
        double[][] matrix = new double[n][n];
        for (double[] row : matrix) {
            Arrays.fill(row, value);
        }
        return matrix;
    }

    /**
     * Minimum assignment cost by enumerating every permutation.
     */
    public static double bruteForceMinimum(double[][] cost) {
        int n = cost.length;
        int[] permutation = new int[n];
        for (int i = 0; i < n; i++) {
            permutation[i] = i;
        }
        return enumerate(cost, permutation, 0);
    }

    private static double enumerate(double[][] cost, int[] permutation, int depth) {
        int n = permutation.length;
        if (depth == n) {
            double total = 0.0d;
            for (int i = 0; i < n; i++) {
                total += cost[i][permutation[i]];
            }
            return total;
        }
        double best = Double.POSITIVE_INFINITY;
        for (int k = depth; k < n; k++) {
            swap(permutation, depth, k);
            best = Math.min(best, enumerate(cost, permutation, depth + 1));
            swap(permutation, depth, k);
        }
        return best;
    }

    private static void swap(int[] values, int a, int b) {
        int tmp = values[a];
        values[a] = values[b];
        values[b] = tmp;
    }

    /**
     * Asserts bijection, cost consistency, complementary slackness on assigned pairs
     * and dual feasibility within {@code n * epsilon}.
     */
    public static void assertOptimalityCertificate(double[][] cost, AssignmentSolution solution) {
        int n = cost.length;
        int[] rowToCol = solution.getRowToCol();
        int[] colToRow = solution.getColToRow();
        double[] u = solution.getRowDuals();
        double[] v = solution.getColumnDuals();

        assertEquals(n, solution.getDimension());
        assertEquals(n, rowToCol.length);
        assertEquals(n, colToRow.length);

        boolean[] seen = new boolean[n];
        double expectedTotal = 0.0d;
        for (int i = 0; i < n; i++) {
            int j = rowToCol[i];
            assertTrue(j >= 0 && j < n, "row " + i + " assigned to invalid column " + j);
            assertTrue(!seen[j], "column " + j + " assigned twice");
            seen[j] = true;
            assertEquals(i, colToRow[j], "colToRow is not the inverse of rowToCol at row " + i);
            expectedTotal += cost[i][j];
        }
        assertEquals(expectedTotal, solution.getTotalCost(), EXACT_TOLERANCE * Math.max(1.0d, Math.abs(expectedTotal)));

        double tolerance = n * solution.getStats().getEpsilon() + EXACT_TOLERANCE;
        for (int i = 0; i < n; i++) {
            int assigned = rowToCol[i];
            assertEquals(cost[i][assigned], u[i] + v[assigned],
                    EXACT_TOLERANCE * Math.max(1.0d, Math.abs(u[i]) + Math.abs(v[assigned])),
                    "assigned pair (" + i + "," + assigned + ") is not tight");
            for (int j = 0; j < n; j++) {
                assertTrue(u[i] + v[j] <= cost[i][j] + tolerance,
                        "dual infeasible at (" + i + "," + j + "): " + (u[i] + v[j]) + " > " + cost[i][j]);
            }
        }
    }
}
