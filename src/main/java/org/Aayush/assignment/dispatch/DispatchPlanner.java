package org.Aayush.assignment.dispatch;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.assignment.core.AssignmentException;
import org.Aayush.assignment.core.AssignmentSolution;
import org.Aayush.assignment.core.AssignmentSolver;
import org.Aayush.assignment.core.JonkerVolgenantSolver;
import org.Aayush.assignment.scoring.StreetNameSuitabilityScorer;
import org.Aayush.assignment.scoring.SuitabilityScorer;
import org.Aayush.core.id.LabelIndex;

import java.util.List;

/**
 * Pairs drivers with destinations so that total suitability is maximal.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate labels and index both sides.</li>
 * <li>Score every driver/address pair and convert rewards to costs.</li>
 * <li>Solve the square assignment problem.</li>
 * <li>Map solved indices back to labels, separating padding partners as unmatched.</li>
 * </ul>
 */
@Slf4j
public final class DispatchPlanner {
    public static final String REASON_REQUEST_REQUIRED = "DISPATCH_REQUEST_REQUIRED";
    public static final String REASON_EMPTY_INPUT = "DISPATCH_EMPTY_INPUT";
    public static final String REASON_INVALID_LABEL = "DISPATCH_INVALID_LABEL";
    public static final String REASON_DUPLICATE_LABEL = "DISPATCH_DUPLICATE_LABEL";
    public static final String REASON_INVALID_SCORE = "DISPATCH_INVALID_SCORE";

    private final AssignmentSolver solver;
    private final CostMatrixBuilder matrixBuilder;

    /**
     * Creates a planner with the default scorer, solver and system-property configuration.
     */
    public DispatchPlanner() {
        this(null, null, null);
    }

    /**
     * Creates a planner; any null collaborator is replaced with its default.
     *
     * @param solver assignment solver.
     * @param scorer pairwise suitability function.
     * @param config cost conversion settings.
     */
    @Builder
    public DispatchPlanner(AssignmentSolver solver, SuitabilityScorer scorer, DispatchConfig config) {
        this.solver = solver == null ? new JonkerVolgenantSolver() : solver;
        this.matrixBuilder = new CostMatrixBuilder(
                scorer == null ? new StreetNameSuitabilityScorer() : scorer,
                config == null ? DispatchConfig.defaults() : config
        );
    }

    /**
     * Executes one dispatch request.
     *
     * @param request drivers and addresses.
     * @return optimal pairing with total suitability score.
     * @throws AssignmentException when labels are missing, blank or duplicated, or scoring fails.
     */
    public DispatchResult plan(DispatchRequest request) {
        if (request == null) {
            throw new AssignmentException(REASON_REQUEST_REQUIRED, "dispatch request is required");
        }
        List<String> drivers = requireLabels(request.getDrivers(), "drivers");
        List<String> addresses = requireLabels(request.getAddresses(), "addresses");
        LabelIndex driverIndex = index(drivers, "drivers");
        LabelIndex addressIndex = index(addresses, "addresses");

        DispatchMatrices matrices = matrixBuilder.build(drivers, addresses);
        AssignmentSolution solution = solver.solve(matrices.dimension(), matrices.costs());

        DispatchResult.DispatchResultBuilder builder = DispatchResult.builder()
                .totalCost(solution.getTotalCost())
                .solveStats(solution.getStats());
        double totalScore = 0.0d;
        for (int row = 0; row < matrices.driverCount(); row++) {
            int column = solution.columnOf(row);
            if (matrices.isRealPair(row, column)) {
                double score = matrices.rewards()[row][column];
                totalScore += score;
                builder.assignment(new DriverAssignment(
                        driverIndex.labelAt(row),
                        addressIndex.labelAt(column),
                        score
                ));
            } else {
                builder.unmatchedDriver(driverIndex.labelAt(row));
            }
        }
        for (int column = 0; column < matrices.addressCount(); column++) {
            if (solution.rowOf(column) >= matrices.driverCount()) {
                builder.unmatchedAddress(addressIndex.labelAt(column));
            }
        }

        DispatchResult result = builder.totalSuitabilityScore(totalScore).build();
        log.info("Dispatched {} drivers to {} addresses: {} assignments, total suitability {}",
                driverIndex.size(), addressIndex.size(), result.getAssignments().size(), totalScore);
        return result;
    }

    private static List<String> requireLabels(List<String> labels, String fieldName) {
        if (labels == null || labels.isEmpty()) {
            throw new AssignmentException(REASON_EMPTY_INPUT, fieldName + " must contain at least one entry");
        }
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            if (label == null || label.isBlank()) {
                throw new AssignmentException(REASON_INVALID_LABEL, fieldName + "[" + i + "] must be non-blank");
            }
        }
        return labels;
    }

    private static LabelIndex index(List<String> labels, String fieldName) {
        try {
            return LabelIndex.ofOrdered(labels);
        } catch (LabelIndex.DuplicateLabelException ex) {
            throw new AssignmentException(REASON_DUPLICATE_LABEL, fieldName + ": " + ex.getMessage(), ex);
        }
    }
}
