package org.Aayush.assignment.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-solve telemetry snapshot.
 */
@Value
@Builder
public class SolveStats {
    /** Sentinel used as infinite reduced cost. */
    double big;
    /** Tie-break slack used by the reduction phases. */
    double epsilon;
    /** True when both scale constants collapsed to zero. */
    boolean degenerateScale;
    /** Rows left unassigned after column reduction and reduction transfer. */
    int freeRowsAfterReductionTransfer;
    /** Rows that needed a shortest augmenting path search. */
    int augmentedRows;
}
