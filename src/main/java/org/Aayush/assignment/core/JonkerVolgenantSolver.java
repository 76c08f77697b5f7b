package org.Aayush.assignment.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Jonker-Volgenant shortest augmenting path solver for dense square assignment problems.
 *
 * <p>R. Jonker and A. Volgenant, "A Shortest Augmenting Path Algorithm for Dense and
 * Sparse Linear Assignment Problems", Computing 38, 325-340, 1987.</p>
 *
 * <p>Execution flow for one call:</p>
 * <ul>
 * <li>Validate and copy the matrix, derive {@code BIG}/{@code epsilon}.</li>
 * <li>Column reduction: per-column minimum becomes the column dual, greedy partial assignment.</li>
 * <li>Reduction transfer: tighten duals of columns held by rows that won exactly once.</li>
 * <li>Augmenting row reduction: two cheap passes over the free rows.</li>
 * <li>Augmentation: one shortest augmenting path per row still free.</li>
 * <li>Finalization: row duals and total cost.</li>
 * </ul>
 *
 * <p>Instances are stateless; every call allocates its own {@link SolverState}.</p>
 */
@Slf4j
public final class JonkerVolgenantSolver implements AssignmentSolver {
    static final String REASON_AUGMENTATION_FAILED = "LAP_AUGMENTATION_FAILED";

    private static final int ROW_REDUCTION_PASSES = 2;

    private final ScaleEstimator scaleEstimator;

    /**
     * Creates a solver configured from system properties.
     */
    public JonkerVolgenantSolver() {
        this(SolverConfig.defaults());
    }

    /**
     * Creates a solver with explicit configuration.
     *
     * @param config solver configuration.
     */
    public JonkerVolgenantSolver(SolverConfig config) {
        Objects.requireNonNull(config, "config");
        this.scaleEstimator = new ScaleEstimator(config.getScaleFactor());
    }

    @Override
    public AssignmentSolution solve(int n, double[][] costMatrix) {
        double[][] cost = CostMatrixValidator.validatedCopy(n, costMatrix);
        ScaleEstimate scale = scaleEstimator.estimate(cost);
        if (scale.degenerate()) {
            log.warn("All costs are zero for n={}; tie-breaking falls back to exact equality", n);
        }

        SolverState state = new SolverState(cost);
        columnReduction(state);
        reductionTransfer(state, scale);
        int freeAfterTransfer = state.freeRows.size();
        log.debug("n={} column reduction left {} free rows (big={}, epsilon={})",
                n, freeAfterTransfer, scale.big(), scale.epsilon());

        for (int pass = 0; pass < ROW_REDUCTION_PASSES; pass++) {
            augmentingRowReduction(state, scale);
        }
        int augmented = state.freeRows.size();
        log.debug("n={} augmenting row reduction left {} free rows", n, augmented);

        for (int f = 0; f < augmented; f++) {
            augment(state, state.freeRows.getInt(f));
        }

        return finish(state, scale, freeAfterTransfer, augmented);
    }

    /**
     * Initial column duals and greedy assignment. Columns are scanned from the last
     * to the first, which tends to leave fewer rows for the later phases.
     */
    private static void columnReduction(SolverState s) {
        int n = s.n;
        double[][] cost = s.cost;
        for (int j = n - 1; j >= 0; j--) {
            double min = cost[0][j];
            int imin = 0;
            for (int i = 1; i < n; i++) {
                if (cost[i][j] < min) {
                    min = cost[i][j];
                    imin = i;
                }
            }
            s.v[j] = min;

            if (++s.matches[imin] == 1) {
                s.rowToCol[imin] = j;
                s.colToRow[j] = imin;
            } else if (s.v[j] < s.v[s.rowToCol[imin]]) {
                int j1 = s.rowToCol[imin];
                s.rowToCol[imin] = j;
                s.colToRow[j] = imin;
                s.colToRow[j1] = SolverState.UNASSIGNED;
            } else {
                s.colToRow[j] = SolverState.UNASSIGNED;
            }
        }
    }

    /**
     * Collects unmatched rows into the free list and moves slack from rows that
     * won exactly one column into that column's dual.
     */
    private static void reductionTransfer(SolverState s, ScaleEstimate scale) {
        int n = s.n;
        for (int i = 0; i < n; i++) {
            if (s.matches[i] == 0) {
                s.freeRows.add(i);
            } else if (s.matches[i] == 1) {
                int j1 = s.rowToCol[i];
                double min = scale.big();
                for (int j = 0; j < n; j++) {
                    if (j != j1) {
                        double h = s.reduced(i, j);
                        if (h < min + scale.epsilon()) {
                            min = h;
                        }
                    }
                }
                s.v[j1] -= min;
            }
        }
    }

    /**
     * One pass of augmenting row reduction over the current free list.
     *
     * <p>The list is rewritten in place: rows still free for the next phase are
     * compacted to the front, and a row displaced from a strict minimum is written
     * back at the current scan slot so it is retried immediately.</p>
     */
    private static void augmentingRowReduction(SolverState s, ScaleEstimate scale) {
        int n = s.n;
        double epsilon = scale.epsilon();
        IntArrayList free = s.freeRows;
        int pending = free.size();
        int kept = 0;
        int k = 0;

        while (k < pending) {
            int i = free.getInt(k++);

            double umin = s.reduced(i, 0);
            double usubmin = scale.big();
            int j1 = 0;
            int j2 = 0;
            for (int j = 1; j < n; j++) {
                double h = s.reduced(i, j);
                if (h < usubmin) {
                    if (h >= umin) {
                        usubmin = h;
                        j2 = j;
                    } else {
                        usubmin = umin;
                        umin = h;
                        j2 = j1;
                        j1 = j;
                    }
                }
            }

            int i0 = s.colToRow[j1];
            if (umin < usubmin + epsilon) {
                s.v[j1] -= usubmin + epsilon - umin;
            } else if (i0 != SolverState.UNASSIGNED) {
                // Minimum and second minimum tie and j1 is taken; j2 may be free.
                j1 = j2;
                i0 = s.colToRow[j2];
            }

            s.rowToCol[i] = j1;
            s.colToRow[j1] = i;

            if (i0 != SolverState.UNASSIGNED) {
                s.rowToCol[i0] = SolverState.UNASSIGNED;
                if (umin < usubmin) {
                    free.set(--k, i0);
                } else {
                    free.set(kept++, i0);
                }
            }
        }
        free.size(kept);
    }

    /**
     * Shortest augmenting path from {@code freeRow} to the nearest unassigned column.
     *
     * <p>{@code columnList} is split by two cursors: {@code [0, low)} finalized,
     * {@code [low, up)} frontier at the current minimum distance, {@code [up, n)} unvisited.
     * All columns tied at a new minimum enter the frontier together.</p>
     */
    private static void augment(SolverState s, int freeRow) {
        int n = s.n;
        double[][] cost = s.cost;
        double[] d = s.distance;
        int[] pred = s.predecessor;
        int[] cols = s.columnList;

        for (int j = 0; j < n; j++) {
            d[j] = s.reduced(freeRow, j);
            pred[j] = freeRow;
            cols[j] = j;
        }

        int low = 0;
        int up = 0;
        int last = 0;
        int endOfPath = SolverState.UNASSIGNED;
        double min = 0.0d;

        while (endOfPath == SolverState.UNASSIGNED) {
            if (up == low) {
                if (up == n) {
                    throw new AssignmentException(
                            REASON_AUGMENTATION_FAILED,
                            "no unassigned column reachable from row " + freeRow
                    );
                }
                last = low - 1;

                min = d[cols[up++]];
                for (int k = up; k < n; k++) {
                    int j = cols[k];
                    double h = d[j];
                    if (h <= min) {
                        if (h < min) {
                            up = low;
                            min = h;
                        }
                        cols[k] = cols[up];
                        cols[up++] = j;
                    }
                }
                for (int k = low; k < up; k++) {
                    if (s.colToRow[cols[k]] == SolverState.UNASSIGNED) {
                        endOfPath = cols[k];
                        break;
                    }
                }
            }

            if (endOfPath == SolverState.UNASSIGNED) {
                int j1 = cols[low++];
                int i = s.colToRow[j1];
                double h = cost[i][j1] - s.v[j1] - min;

                for (int k = up; k < n; k++) {
                    int j = cols[k];
                    double v2 = cost[i][j] - s.v[j] - h;
                    if (v2 < d[j]) {
                        pred[j] = i;
                        if (v2 == min) {
                            if (s.colToRow[j] == SolverState.UNASSIGNED) {
                                endOfPath = j;
                                break;
                            }
                            cols[k] = cols[up];
                            cols[up++] = j;
                        }
                        d[j] = v2;
                    }
                }
            }
        }

        // Price update on finalized columns keeps complementary slackness along the tree.
        for (int k = 0; k <= last; k++) {
            int j1 = cols[k];
            s.v[j1] += d[j1] - min;
        }

        int i;
        do {
            i = pred[endOfPath];
            s.colToRow[endOfPath] = i;
            int j1 = endOfPath;
            endOfPath = s.rowToCol[i];
            s.rowToCol[i] = j1;
        } while (i != freeRow);
    }

    private static AssignmentSolution finish(SolverState s, ScaleEstimate scale, int freeAfterTransfer, int augmented) {
        double total = 0.0d;
        for (int i = s.n - 1; i >= 0; i--) {
            int j = s.rowToCol[i];
            s.u[i] = s.cost[i][j] - s.v[j];
            total += s.cost[i][j];
        }

        return AssignmentSolution.builder()
                .dimension(s.n)
                .totalCost(total)
                .rowToCol(s.rowToCol)
                .colToRow(s.colToRow)
                .rowDuals(s.u)
                .columnDuals(s.v)
                .stats(SolveStats.builder()
                        .big(scale.big())
                        .epsilon(scale.epsilon())
                        .degenerateScale(scale.degenerate())
                        .freeRowsAfterReductionTransfer(freeAfterTransfer)
                        .augmentedRows(augmented)
                        .build())
                .build();
    }
}
