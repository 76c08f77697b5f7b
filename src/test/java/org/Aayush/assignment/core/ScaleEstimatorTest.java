package org.Aayush.assignment.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ScaleEstimator and SolverConfig Tests")
class ScaleEstimatorTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SolverConfig.PROP_SCALE_FACTOR);
    }

    @Test
    @DisplayName("Constants derive from the mean per-row magnitude")
    void testEstimateFromMeanMagnitude() {
        ScaleEstimator estimator = new ScaleEstimator(10_000.0d);

        ScaleEstimate estimate = estimator.estimate(new double[][]{{2, -4}, {6, 0}});

        // sum |c| = 12, n = 2 -> mean 6
        assertEquals(60_000.0d, estimate.big(), 0.0d);
        assertEquals(6.0d / 10_000.0d, estimate.epsilon(), 0.0d);
        assertFalse(estimate.degenerate());
    }

    @Test
    @DisplayName("All-zero matrix yields degenerate zero constants")
    void testAllZeroIsDegenerate() {
        ScaleEstimate estimate = new ScaleEstimator(10_000.0d).estimate(new double[][]{{0, 0}, {0, 0}});

        assertEquals(0.0d, estimate.big(), 0.0d);
        assertEquals(0.0d, estimate.epsilon(), 0.0d);
        assertTrue(estimate.degenerate());
    }

    @Test
    @DisplayName("Overflowing magnitudes are rejected")
    void testOverflowRejected() {
        ScaleEstimator estimator = new ScaleEstimator(10_000.0d);
        AssignmentException ex = assertThrows(
                AssignmentException.class,
                () -> estimator.estimate(new double[][]{{1e305, 1e305}, {1e305, 1e305}})
        );
        assertEquals(ScaleEstimator.REASON_SCALE_OVERFLOW, ex.reasonCode());
    }

    @Test
    @DisplayName("Scale factor must be finite and positive")
    void testInvalidScaleFactor() {
        assertThrows(IllegalArgumentException.class, () -> new ScaleEstimator(0.0d));
        assertThrows(IllegalArgumentException.class, () -> new ScaleEstimator(-1.0d));
        assertThrows(IllegalArgumentException.class, () -> new ScaleEstimator(Double.NaN));
    }

    @Test
    @DisplayName("SolverConfig defaults honor a positive scale factor property")
    void testConfigFromProperty() {
        System.setProperty(SolverConfig.PROP_SCALE_FACTOR, "100");

        SolverConfig config = SolverConfig.defaults();
        AssignmentSolution solution = new JonkerVolgenantSolver(config).solve(new double[][]{{1, 2}, {3, 4}});

        assertEquals(100.0d, config.getScaleFactor(), 0.0d);
        assertEquals(500.0d, solution.getStats().getBig(), 1e-9d);
        assertEquals(0.05d, solution.getStats().getEpsilon(), 1e-12d);
    }

    @Test
    @DisplayName("SolverConfig defaults ignore malformed and non-positive properties")
    void testConfigFallbacks() {
        assertEquals(SolverConfig.DEFAULT_SCALE_FACTOR, SolverConfig.defaults().getScaleFactor(), 0.0d);

        System.setProperty(SolverConfig.PROP_SCALE_FACTOR, "not-a-number");
        assertEquals(SolverConfig.DEFAULT_SCALE_FACTOR, SolverConfig.defaults().getScaleFactor(), 0.0d);

        System.setProperty(SolverConfig.PROP_SCALE_FACTOR, "-5");
        assertEquals(SolverConfig.DEFAULT_SCALE_FACTOR, SolverConfig.defaults().getScaleFactor(), 0.0d);

        assertEquals(SolverConfig.DEFAULT_SCALE_FACTOR, SolverConfig.builder().build().getScaleFactor(), 0.0d);
    }
}
