package com.hellblazer.hexcrawl.simulation.entity;

/**
 * Which side of the encounter an entity fights for.
 *
 * @author hal.hildebrand
 */
public enum EntityKind {
    PLAYER, MONSTER;

    public EntityKind opponent() {
        return this == PLAYER ? MONSTER : PLAYER;
    }
}
