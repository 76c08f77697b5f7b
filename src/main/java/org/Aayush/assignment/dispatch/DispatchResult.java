package org.Aayush.assignment.dispatch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.assignment.core.SolveStats;

import java.util.List;

/**
 * Outcome of one dispatch request.
 */
@Value
@Builder
public class DispatchResult {
    /** Sum of suitability scores over all real assignments. */
    double totalSuitabilityScore;
    /** Optimal solver cost, padding cells included. */
    double totalCost;
    /** Assignments in driver input order. */
    @Singular("assignment")
    List<DriverAssignment> assignments;
    /** Drivers paired with a padding column. */
    @Singular("unmatchedDriver")
    List<String> unmatchedDrivers;
    /** Addresses paired with a padding row. */
    @Singular("unmatchedAddress")
    List<String> unmatchedAddresses;
    /** Solver telemetry. */
    SolveStats solveStats;
}
