package com.hellblazer.hexcrawl.simulation.entity;

import java.util.List;
import java.util.Objects;

/**
 * An ability an entity can use.
 *
 * @param id             unique id, e.g. "power_strike"
 * @param name           display name
 * @param kind           what the ability does to its target
 * @param damage         base damage for attack abilities
 * @param healing        base healing for healing abilities
 * @param range          maximum hex distance to the target
 * @param cooldown       rounds before the ability can be used again, 0 for none
 * @param description    free text
 * @param areaOfEffect   radius around the target hit as well, 0 for single target
 * @param statusEffects  effects applied to each target hit
 * @author hal.hildebrand
 */
public record AbilityDefinition(String id, String name, AbilityKind kind, int damage, int healing, int range,
                                int cooldown, String description, int areaOfEffect,
                                List<StatusEffectApplication> statusEffects) {

    public static final String BASIC_ATTACK_ID = "basic_attack";
    public static final String WAIT_ID = "wait";

    /** Melee strike every entity has */
    public static final AbilityDefinition BASIC_ATTACK = new AbilityDefinition(BASIC_ATTACK_ID, "Basic Attack",
                                                                               AbilityKind.ATTACK, 10, 0, 1, 0,
                                                                               "A simple melee attack", 0,
                                                                               List.of());

    /** Skip the turn */
    public static final AbilityDefinition WAIT = new AbilityDefinition(WAIT_ID, "Wait", AbilityKind.UTILITY, 0, 0, 0,
                                                                       0, "Skip your turn", 0, List.of());

    public AbilityDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Ability id is required");
        }
        Objects.requireNonNull(kind, "kind");
        if (damage < 0 || healing < 0 || range < 0 || cooldown < 0 || areaOfEffect < 0) {
            throw new IllegalArgumentException("Ability " + id + " has negative numbers");
        }
        name = name == null ? id : name;
        description = description == null ? "" : description;
        statusEffects = statusEffects == null ? List.of() : List.copyOf(statusEffects);
    }

    public static AbilityDefinition attack(String id, String name, int damage, int range, int cooldown) {
        return new AbilityDefinition(id, name, AbilityKind.ATTACK, damage, 0, range, cooldown, "", 0, List.of());
    }

    public static AbilityDefinition heal(String id, String name, int healing, int range, int cooldown) {
        return new AbilityDefinition(id, name, AbilityKind.HEALING, 0, healing, range, cooldown, "", 0, List.of());
    }

    public AbilityDefinition withAreaOfEffect(int radius) {
        return new AbilityDefinition(id, name, kind, damage, healing, range, cooldown, description, radius,
                                     statusEffects);
    }

    public AbilityDefinition withStatusEffects(List<StatusEffectApplication> effects) {
        return new AbilityDefinition(id, name, kind, damage, healing, range, cooldown, description, areaOfEffect,
                                     effects);
    }

    public boolean isAreaOfEffect() {
        return areaOfEffect > 0;
    }
}
