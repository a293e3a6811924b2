package com.hellblazer.hexcrawl.simulation.entity;

import java.util.Objects;

/**
 * A status effect an ability applies to its target.
 *
 * @param type     the effect
 * @param duration rounds, positive
 * @param value    per-stack value, 0 for the type default
 * @param chance   probability in [0, 1]
 * @author hal.hildebrand
 */
public record StatusEffectApplication(StatusEffectType type, int duration, int value, double chance) {

    public StatusEffectApplication {
        Objects.requireNonNull(type, "type");
        if (duration <= 0) {
            throw new IllegalArgumentException("Status effect duration must be positive: " + duration);
        }
        if (!(chance >= 0.0 && chance <= 1.0)) {
            throw new IllegalArgumentException("Status effect chance must be within [0, 1]: " + chance);
        }
    }

    public static StatusEffectApplication always(StatusEffectType type, int duration, int value) {
        return new StatusEffectApplication(type, duration, value, 1.0);
    }
}
