package com.hellblazer.hexcrawl.simulation.entity;

import java.util.List;

/**
 * What happened to one entity during end-of-round upkeep.
 *
 * @param entityId        the entity
 * @param statusEffects   damage and healing over time, and expired effects
 * @param damageTaken     hit points lost to damage over time
 * @param healingReceived hit points restored by healing over time
 * @param readyAbilities  abilities that came off cooldown
 * @param died            true if damage over time killed the entity
 * @author hal.hildebrand
 */
public record RoundUpkeep(String entityId, StatusEffects.TickResult statusEffects, int damageTaken,
                          int healingReceived, List<String> readyAbilities, boolean died) {

    public RoundUpkeep {
        readyAbilities = List.copyOf(readyAbilities);
    }

    public static RoundUpkeep failed(String entityId) {
        return new RoundUpkeep(entityId, StatusEffects.TickResult.EMPTY, 0, 0, List.of(), false);
    }

    public boolean hasEffects() {
        return !statusEffects.isEmpty() || damageTaken > 0 || healingReceived > 0;
    }
}
