package com.hellblazer.hexcrawl.simulation.threat;

/**
 * Read-only view of one row of a threat table.
 *
 * @param targetId         the player the row is about
 * @param threat           current decayed score
 * @param lastUpdatedRound table round of the last positive update
 * @param updateCount      number of updates retained in history
 * @author hal.hildebrand
 */
public record ThreatEntry(String targetId, double threat, long lastUpdatedRound, int updateCount) {

    public ThreatLevel level() {
        return ThreatLevel.of(threat);
    }
}
