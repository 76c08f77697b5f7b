package org.Aayush.assignment.dispatch;

import lombok.Builder;
import lombok.Value;

/**
 * Cost conversion settings for driver dispatch.
 */
@Value
@Builder
public class DispatchConfig {
    public static final double DEFAULT_ZERO_REWARD_COST = 0.0d;
    public static final double DEFAULT_PADDING_COST = 0.0d;

    static final String PROP_ZERO_REWARD_COST = "lap.dispatch.zeroRewardCost";
    static final String PROP_PADDING_COST = "lap.dispatch.paddingCost";

    /**
     * Cost used for pairs with zero suitability. Any value at or above 0 loses to every
     * positive reward; keep it on the scale of the rewards, since the solver's tie-break
     * slack grows with the mean cost magnitude.
     */
    @Builder.Default
    double zeroRewardCost = DEFAULT_ZERO_REWARD_COST;

    /**
     * Cost of every cell in a padding row or column when driver and address counts differ.
     */
    @Builder.Default
    double paddingCost = DEFAULT_PADDING_COST;

    /**
     * Loads configuration from system properties, keeping defaults for missing or malformed values.
     */
    public static DispatchConfig defaults() {
        return DispatchConfig.builder()
                .zeroRewardCost(readFinite(PROP_ZERO_REWARD_COST, DEFAULT_ZERO_REWARD_COST))
                .paddingCost(readFinite(PROP_PADDING_COST, DEFAULT_PADDING_COST))
                .build();
    }

    private static double readFinite(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isFinite(parsed) ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
