package com.hellblazer.hexcrawl.simulation.entity;

import java.util.List;

/**
 * A player class: base stats and the abilities it starts with.
 *
 * @author hal.hildebrand
 */
public record PlayerSpecialization(String id, String name, String description, EntityStats stats,
                                   List<AbilityDefinition> abilities) {

    /** Melee specialist with high health and armor */
    public static final PlayerSpecialization FIGHTER;
    /** Ranged specialist with high mobility */
    public static final PlayerSpecialization RANGER;
    /** Healer */
    public static final PlayerSpecialization CLERIC;

    static {
        var powerStrike = AbilityDefinition.attack("power_strike", "Power Strike", 25, 1, 2);
        var defensiveStance = new AbilityDefinition("defensive_stance", "Defensive Stance", AbilityKind.DEFENSE, 0,
                                                    0, 0, 3, "Reduces incoming damage for 3 rounds", 0,
                                                    List.of(StatusEffectApplication.always(StatusEffectType.SHIELDED,
                                                                                           3, 5)));
        FIGHTER = new PlayerSpecialization("fighter", "Fighter", "A melee combat specialist",
                                           new EntityStats(120, 3, 18, 3), List.of(powerStrike, defensiveStance));

        var aimedShot = AbilityDefinition.attack("aimed_shot", "Aimed Shot", 20, 4, 1);
        var poisonArrow = AbilityDefinition.attack("poison_arrow", "Poison Arrow", 8, 3, 3)
                                           .withStatusEffects(List.of(
                                           new StatusEffectApplication(StatusEffectType.POISON, 3, 4, 0.75)));
        RANGER = new PlayerSpecialization("ranger", "Ranger", "A ranged combat specialist",
                                          new EntityStats(90, 1, 16, 4), List.of(aimedShot, poisonArrow));

        var heal = AbilityDefinition.heal("heal", "Heal", 25, 3, 2);
        var bless = new AbilityDefinition("bless", "Bless", AbilityKind.UTILITY, 0, 0, 3, 4,
                                          "Improves healing received", 0,
                                          List.of(StatusEffectApplication.always(StatusEffectType.BLESSED, 3, 0)));
        CLERIC = new PlayerSpecialization("cleric", "Cleric", "A healer and support caster",
                                          new EntityStats(100, 2, 12, 3), List.of(heal, bless));
    }

    public PlayerSpecialization {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Specialization id is required");
        }
        name = name == null ? id : name;
        description = description == null ? "" : description;
        stats = stats == null ? EntityStats.DEFAULT : stats;
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
    }
}
