package org.Aayush.assignment.scoring;

/**
 * Pairwise compatibility function between a driver and a destination address.
 *
 * <p>Higher scores mean a better pairing; zero means no suitability at all.</p>
 */
@FunctionalInterface
public interface SuitabilityScorer {

    /**
     * Scores one driver/address pair.
     *
     * @param driver driver display name.
     * @param address full destination address line.
     * @return non-negative suitability score.
     */
    double score(String driver, String address);
}
