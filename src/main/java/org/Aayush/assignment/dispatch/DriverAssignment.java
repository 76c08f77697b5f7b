package org.Aayush.assignment.dispatch;

import lombok.Value;

/**
 * One driver paired with one destination.
 */
@Value
public class DriverAssignment {
    String driver;
    String address;
    /** Suitability score of this pairing. */
    double suitabilityScore;
}
