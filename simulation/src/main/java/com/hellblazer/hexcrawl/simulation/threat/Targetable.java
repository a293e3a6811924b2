package com.hellblazer.hexcrawl.simulation.threat;

/**
 * The identity and health a threat table needs to rank a candidate target.
 *
 * @author hal.hildebrand
 */
public interface Targetable {

    String getId();

    int getCurrentHp();

    int getMaxHp();

    boolean isAlive();

    /**
     * @return current HP as a fraction of max HP, 0 when max HP is not positive
     */
    default double getHpFraction() {
        var max = getMaxHp();
        return max <= 0 ? 0.0 : (double) getCurrentHp() / max;
    }
}
