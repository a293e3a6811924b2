package com.hellblazer.hexcrawl.simulation;

/**
 * The four things an entity can do with its turn.
 *
 * @author hal.hildebrand
 */
public enum ActionKind {
    MOVE, ATTACK, ABILITY, WAIT
}
