package org.Aayush.assignment.core;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration for {@link JonkerVolgenantSolver}.
 */
@Value
@Builder
public class SolverConfig {
    public static final double DEFAULT_SCALE_FACTOR = 10_000.0d;

    static final String PROP_SCALE_FACTOR = "lap.solver.scaleFactor";

    /**
     * Ratio between the mean row magnitude and {@code BIG}, and between
     * {@code epsilon} and the mean row magnitude.
     */
    @Builder.Default
    double scaleFactor = DEFAULT_SCALE_FACTOR;

    /**
     * Loads configuration from system properties, falling back to built-in defaults
     * for missing, blank, malformed or non-positive values.
     */
    public static SolverConfig defaults() {
        return SolverConfig.builder()
                .scaleFactor(readPositive(PROP_SCALE_FACTOR, DEFAULT_SCALE_FACTOR))
                .build();
    }

    private static double readPositive(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isFinite(parsed) && parsed > 0.0d ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
