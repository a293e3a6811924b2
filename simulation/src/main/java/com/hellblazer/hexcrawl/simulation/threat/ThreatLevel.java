package com.hellblazer.hexcrawl.simulation.threat;

/**
 * Coarse banding of a threat score for display and AI heuristics.
 *
 * @author hal.hildebrand
 */
public enum ThreatLevel {
    NONE, LOW, MEDIUM, HIGH, CRITICAL;

    /**
     * none at or below 0, low up to 10, medium up to 25, high up to 50, critical above
     */
    public static ThreatLevel of(double threat) {
        if (threat <= 0) {
            return NONE;
        }
        if (threat <= 10) {
            return LOW;
        }
        if (threat <= 25) {
            return MEDIUM;
        }
        if (threat <= 50) {
            return HIGH;
        }
        return CRITICAL;
    }
}
