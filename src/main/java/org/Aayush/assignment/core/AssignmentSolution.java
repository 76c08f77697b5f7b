package org.Aayush.assignment.core;

import lombok.Builder;
import lombok.Value;

/**
 * Optimal assignment plus the dual certificate that proves it.
 *
 * <p>Array-valued fields are exposed through defensive-copy getters to keep the
 * value object immutable.</p>
 */
@Value
@Builder
public class AssignmentSolution {
    /** Matrix dimension. */
    int dimension;
    /** Sum of assigned costs. */
    double totalCost;
    /** Column assigned to each row. */
    int[] rowToCol;
    /** Row assigned to each column. */
    int[] colToRow;
    /** Row duals {@code u}. */
    double[] rowDuals;
    /** Column duals {@code v}. */
    double[] columnDuals;
    /** Scale constants and phase counters for this solve. */
    SolveStats stats;

    public int[] getRowToCol() {
        return rowToCol.clone();
    }

    public int[] getColToRow() {
        return colToRow.clone();
    }

    public double[] getRowDuals() {
        return rowDuals.clone();
    }

    public double[] getColumnDuals() {
        return columnDuals.clone();
    }

    /**
     * Returns the column assigned to one row without copying the whole array.
     */
    public int columnOf(int row) {
        return rowToCol[row];
    }

    /**
     * Returns the row assigned to one column without copying the whole array.
     */
    public int rowOf(int column) {
        return colToRow[column];
    }
}
