package org.Aayush.assignment.core;

/**
 * Square linear assignment solver contract.
 *
 * <p>Implementations validate input deterministically and throw reason-coded
 * {@link AssignmentException}s for contract failures.</p>
 */
public interface AssignmentSolver {

    /**
     * Finds a minimum-cost perfect matching of rows to columns.
     *
     * @param n matrix dimension.
     * @param costMatrix n×n matrix of finite costs; read once and never retained.
     * @return optimal assignment with its dual variables.
     * @throws AssignmentException when the matrix is not a finite n×n matrix.
     */
    AssignmentSolution solve(int n, double[][] costMatrix);

    /**
     * Solves using the row count of {@code costMatrix} as dimension.
     */
    default AssignmentSolution solve(double[][] costMatrix) {
        if (costMatrix == null) {
            throw new AssignmentException(CostMatrixValidator.REASON_COST_MATRIX_REQUIRED, "cost matrix is required");
        }
        return solve(costMatrix.length, costMatrix);
    }
}
