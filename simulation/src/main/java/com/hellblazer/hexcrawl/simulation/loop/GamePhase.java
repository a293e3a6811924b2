package com.hellblazer.hexcrawl.simulation.loop;

/**
 * Lifecycle of an encounter: {@code SETUP -> PLAYING <-> PAUSED -> ENDED}. ENDED is terminal.
 *
 * @author hal.hildebrand
 */
public enum GamePhase {
    SETUP, PLAYING, PAUSED, ENDED
}
