package com.hellblazer.hexcrawl.simulation.entity;

/**
 * An active status effect.
 *
 * @param type      the effect
 * @param duration  rounds remaining, the effect expires when this reaches 0
 * @param baseValue value of a single stack
 * @param stacks    number of stacks, at least 1
 * @author hal.hildebrand
 */
public record StatusEffect(StatusEffectType type, int duration, int baseValue, int stacks) {

    /**
     * @return aggregate value: base value x stacks, or the type default when no base value was given
     */
    public int value() {
        return baseValue > 0 ? baseValue * stacks : type.getDefaultValue();
    }

    StatusEffect withDuration(int newDuration) {
        return new StatusEffect(type, newDuration, baseValue, stacks);
    }
}
