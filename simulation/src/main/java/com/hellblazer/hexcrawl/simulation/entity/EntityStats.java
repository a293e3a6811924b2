package com.hellblazer.hexcrawl.simulation.entity;

/**
 * Base combat numbers for an entity.
 *
 * @param maxHp         maximum hit points, positive
 * @param baseArmor     armor before status effects and temporary bonuses
 * @param baseDamage    damage of an unmodified basic attack
 * @param movementRange hexes the entity may move per round
 * @author hal.hildebrand
 */
public record EntityStats(int maxHp, int baseArmor, int baseDamage, int movementRange) {

    /** 100 HP, no armor, 10 damage, 3 movement */
    public static final EntityStats DEFAULT = new EntityStats(100, 0, 10, 3);

    public EntityStats {
        if (maxHp <= 0) {
            throw new IllegalArgumentException("Max HP must be positive: " + maxHp);
        }
        if (baseArmor < 0 || baseDamage < 0 || movementRange < 0) {
            throw new IllegalArgumentException(
            String.format("Armor, damage and movement must be non-negative: armor=%d, damage=%d, movement=%d",
                          baseArmor, baseDamage, movementRange));
        }
    }
}
