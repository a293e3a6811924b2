package com.hellblazer.hexcrawl.simulation.ai;

import java.util.Locale;
import java.util.Optional;

/**
 * Personality of a monster's default policy, used when none of its behavior rules fires.
 *
 * @author hal.hildebrand
 */
public enum AIVariant {
    /** Chase the highest threat and hit it */
    AGGRESSIVE,
    /** Hold ground, strike what comes close, retreat when hurt */
    DEFENSIVE,
    /** Prefer ranged abilities and good positions */
    TACTICAL,
    /** Hunt the weakest enemy regardless of threat */
    BERSERKER,
    /** Heal wounded allies, otherwise fight defensively */
    SUPPORT,
    /** Only strike adjacent enemies */
    PASSIVE;

    public static Optional<AIVariant> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
