package org.Aayush.assignment.core;

import lombok.experimental.UtilityClass;

/**
 * Input contract checks applied before any solver phase runs.
 */
@UtilityClass
public final class CostMatrixValidator {
    public static final String REASON_COST_MATRIX_REQUIRED = "LAP_COST_MATRIX_REQUIRED";
    public static final String REASON_INVALID_DIMENSION = "LAP_INVALID_DIMENSION";
    public static final String REASON_NON_FINITE_COST = "LAP_NON_FINITE_COST";

    /**
     * Validates a square finite cost matrix and returns a private copy of it.
     *
     * @param n declared dimension.
     * @param costMatrix caller-owned matrix.
     * @return deep copy safe for the solver to read after the caller mutates its input.
     * @throws AssignmentException when the matrix is missing, not n×n, or holds NaN/infinite entries.
     */
    public static double[][] validatedCopy(int n, double[][] costMatrix) {
        if (costMatrix == null) {
            throw new AssignmentException(REASON_COST_MATRIX_REQUIRED, "cost matrix is required");
        }
        if (n <= 0) {
            throw new AssignmentException(REASON_INVALID_DIMENSION, "dimension must be > 0, got " + n);
        }
        if (costMatrix.length != n) {
            throw new AssignmentException(
                    REASON_INVALID_DIMENSION,
                    "cost matrix has " + costMatrix.length + " rows, expected " + n
            );
        }

        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            double[] row = costMatrix[i];
            if (row == null) {
                throw new AssignmentException(REASON_COST_MATRIX_REQUIRED, "cost matrix row " + i + " is null");
            }
            if (row.length != n) {
                throw new AssignmentException(
                        REASON_INVALID_DIMENSION,
                        "cost matrix row " + i + " has " + row.length + " columns, expected " + n
                );
            }
            for (int j = 0; j < n; j++) {
                if (!Double.isFinite(row[j])) {
                    throw new AssignmentException(
                            REASON_NON_FINITE_COST,
                            "cost[" + i + "][" + j + "] must be finite, got " + row[j]
                    );
                }
            }
            copy[i] = row.clone();
        }
        return copy;
    }
}
