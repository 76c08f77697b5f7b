package org.Aayush.assignment.dispatch;

import org.Aayush.assignment.core.AssignmentException;
import org.Aayush.assignment.scoring.SuitabilityScorer;

import java.util.List;
import java.util.Objects;

/**
 * Turns driver/address suitability into a square minimization problem.
 *
 * <p>A reward {@code r > 0} becomes cost {@code -r}; a zero reward becomes
 * {@link DispatchConfig#getZeroRewardCost()}. When the two lists differ in size the
 * matrix is padded to the larger count with uniform padding cells, which never
 * changes which real pairs are optimal.</p>
 */
final class CostMatrixBuilder {
    private final SuitabilityScorer scorer;
    private final DispatchConfig config;

    CostMatrixBuilder(SuitabilityScorer scorer, DispatchConfig config) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.config = Objects.requireNonNull(config, "config");
    }

    DispatchMatrices build(List<String> drivers, List<String> addresses) {
        int driverCount = drivers.size();
        int addressCount = addresses.size();
        int n = Math.max(driverCount, addressCount);

        double[][] rewards = new double[n][n];
        double[][] costs = new double[n][n];
        for (int row = 0; row < n; row++) {
            for (int column = 0; column < n; column++) {
                if (row < driverCount && column < addressCount) {
                    double reward = scorer.score(drivers.get(row), addresses.get(column));
                    if (!Double.isFinite(reward) || reward < 0.0d) {
                        throw new AssignmentException(
                                DispatchPlanner.REASON_INVALID_SCORE,
                                "scorer returned " + reward + " for driver " + row + ", address " + column
                        );
                    }
                    rewards[row][column] = reward;
                    costs[row][column] = toCost(reward);
                } else {
                    costs[row][column] = config.getPaddingCost();
                }
            }
        }
        return new DispatchMatrices(rewards, costs, driverCount, addressCount);
    }

    double toCost(double reward) {
        return reward == 0.0d ? config.getZeroRewardCost() : -reward;
    }
}
