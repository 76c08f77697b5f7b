package org.Aayush.assignment.core;

/**
 * Derived numeric constants for one solve call.
 *
 * @param big finite stand-in for an infinite reduced cost.
 * @param epsilon tie-break slack used by the reduction phases.
 */
record ScaleEstimate(double big, double epsilon) {

    /**
     * Returns whether both constants collapsed to zero (all-zero cost matrix).
     */
    boolean degenerate() {
        return big == 0.0d && epsilon == 0.0d;
    }
}
