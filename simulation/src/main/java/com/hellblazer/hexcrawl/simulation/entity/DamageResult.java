package com.hellblazer.hexcrawl.simulation.entity;

/**
 * Outcome of damage applied to an entity.
 *
 * @param dealt   hit points actually removed
 * @param blocked damage absorbed by armor
 * @param died    true if this damage brought HP to zero
 * @author hal.hildebrand
 */
public record DamageResult(int dealt, int blocked, boolean died) {

    public static final DamageResult NONE = new DamageResult(0, 0, false);
}
