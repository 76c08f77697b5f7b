package org.Aayush.assignment.dispatch;

/**
 * Square reward and cost matrices for one dispatch request.
 *
 * @param rewards suitability scores; padding cells hold 0.
 * @param costs solver input derived from {@code rewards}.
 * @param driverCount real rows; rows at or after this index are padding.
 * @param addressCount real columns; columns at or after this index are padding.
 */
record DispatchMatrices(double[][] rewards, double[][] costs, int driverCount, int addressCount) {

    int dimension() {
        return costs.length;
    }

    boolean isRealPair(int row, int column) {
        return row < driverCount && column < addressCount;
    }
}
