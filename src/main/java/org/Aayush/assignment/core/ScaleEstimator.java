package org.Aayush.assignment.core;

/**
 * Derives the {@code BIG} sentinel and tie-break {@code epsilon} from the mean
 * per-row cost magnitude of a matrix.
 */
final class ScaleEstimator {
    static final String REASON_SCALE_OVERFLOW = "LAP_SCALE_OVERFLOW";

    private final double scaleFactor;

    ScaleEstimator(double scaleFactor) {
        if (!Double.isFinite(scaleFactor) || scaleFactor <= 0.0d) {
            throw new IllegalArgumentException("scaleFactor must be finite and > 0, got " + scaleFactor);
        }
        this.scaleFactor = scaleFactor;
    }

    /**
     * Computes {@code mean = sum(|cost|) / n}, {@code big = scaleFactor * mean} and
     * {@code epsilon = mean / scaleFactor}.
     *
     * @param cost validated square matrix.
     * @return derived constants, both zero for an all-zero matrix.
     * @throws AssignmentException when the magnitudes are too large to sum finitely.
     */
    ScaleEstimate estimate(double[][] cost) {
        int n = cost.length;
        double sum = 0.0d;
        for (int i = 0; i < n; i++) {
            double[] row = cost[i];
            for (int j = 0; j < n; j++) {
                sum += Math.abs(row[j]);
            }
        }
        double mean = sum / n;
        double big = scaleFactor * mean;
        double epsilon = mean / scaleFactor;
        if (!Double.isFinite(big) || !Double.isFinite(epsilon)) {
            throw new AssignmentException(
                    REASON_SCALE_OVERFLOW,
                    "cost magnitudes overflow the scale sentinel (mean=" + mean + ", scaleFactor=" + scaleFactor + ")"
            );
        }
        return new ScaleEstimate(big, epsilon);
    }
}
