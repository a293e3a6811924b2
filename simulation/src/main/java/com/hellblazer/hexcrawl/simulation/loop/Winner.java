package com.hellblazer.hexcrawl.simulation.loop;

/**
 * @author hal.hildebrand
 */
public enum Winner {
    PLAYERS, MONSTERS, DRAW
}
