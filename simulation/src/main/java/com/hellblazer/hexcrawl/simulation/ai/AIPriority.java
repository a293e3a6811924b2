package com.hellblazer.hexcrawl.simulation.ai;

/**
 * Priority bands for AI decisions and behavior rules.
 *
 * @author hal.hildebrand
 */
public final class AIPriority {

    /** Survival: fleeing at low health, berserk finishing blows */
    public static final int EMERGENCY = 10;
    public static final int HIGH = 8;
    public static final int MEDIUM = 5;
    public static final int LOW = 3;
    /** Doing nothing */
    public static final int MINIMAL = 1;

    private AIPriority() {
    }
}
