package com.hellblazer.hexcrawl.simulation.entity;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.threat.Targetable;

import java.util.Set;

/**
 * A participant in an encounter.
 * <p>
 * The round loop only talks to entities through this contract: identity and position, the damage and healing
 * pipeline, status effect modifiers and the action gates.
 *
 * @author hal.hildebrand
 */
public interface CombatEntity extends Targetable {

    String getName();

    EntityKind getKind();

    HexCoordinate getPosition();

    int getMovementRange();

    /**
     * @return base armor plus temporary armor plus shielded stacks
     */
    int getEffectiveArmor();

    /**
     * Damage from any source, scaled by the damage-taken modifier and reduced by armor.
     *
     * @param amount raw damage
     * @param source label for logs
     */
    DamageResult takeDamage(int amount, String source);

    /**
     * Healing scaled by the healing modifier, capped at max HP.
     */
    HealResult heal(int amount);

    double getDamageModifier();

    double getDamageTakenModifier();

    double getHealingModifier();

    /**
     * @return floor(baseDamage x damage modifier)
     */
    int calculateDamageOutput(int baseDamage);

    /**
     * @return this entity's basic attack damage after modifiers
     */
    int calculateDamageOutput();

    boolean canAct();

    boolean canMove();

    boolean canBeTargeted();

    MovementResult moveTo(HexCoordinate destination, Set<HexCoordinate> occupied, Set<HexCoordinate> obstacles);

    boolean hasMovedThisRound();

    AbilityBook getAbilities();

    StatusEffects getStatusEffects();

    StatusEffects.Application applyStatusEffect(StatusEffectType type, int duration, int value);

    /**
     * End of round bookkeeping: cooldowns, status effects, movement allowance.
     */
    RoundUpkeep processRound();

    default boolean isPlayer() {
        return getKind() == EntityKind.PLAYER;
    }

    default boolean isMonster() {
        return getKind() == EntityKind.MONSTER;
    }

    default int distanceTo(CombatEntity other) {
        return getPosition().distance(other.getPosition());
    }
}
