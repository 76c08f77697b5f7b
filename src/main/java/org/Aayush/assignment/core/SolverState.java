package org.Aayush.assignment.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;

/**
 * Mutable state owned by exactly one solve call.
 *
 * <p>Phases of {@link JonkerVolgenantSolver} read and write the arrays directly;
 * nothing here escapes the call except through copies.</p>
 */
final class SolverState {
    static final int UNASSIGNED = -1;

    final int n;
    final double[][] cost;

    final int[] rowToCol;
    final int[] colToRow;
    final double[] u;
    final double[] v;

    /** Number of columns whose minimum fell on each row during column reduction. */
    final int[] matches;
    /** Free rows; spliced in place by augmenting row reduction. */
    final IntArrayList freeRows;

    // Shortest-path scratch, reused for every augmented row.
    final double[] distance;
    final int[] predecessor;
    final int[] columnList;

    SolverState(double[][] cost) {
        this.n = cost.length;
        this.cost = cost;
        this.rowToCol = new int[n];
        this.colToRow = new int[n];
        Arrays.fill(rowToCol, UNASSIGNED);
        Arrays.fill(colToRow, UNASSIGNED);
        this.u = new double[n];
        this.v = new double[n];
        this.matches = new int[n];
        this.freeRows = new IntArrayList(n);
        this.distance = new double[n];
        this.predecessor = new int[n];
        this.columnList = new int[n];
    }

    /**
     * Reduced cost of row {@code i} on column {@code j} with respect to column duals only.
     */
    double reduced(int i, int j) {
        return cost[i][j] - v[j];
    }
}
