package com.hellblazer.hexcrawl.simulation.entity;

import java.util.Objects;

/**
 * Hit points and armor of one entity.
 * <p>
 * Armor blocks 10% of incoming damage per point, capped at 90%, and every hit that lands removes at least one hit
 * point. Hit points never leave [0, maxHp].
 *
 * @author hal.hildebrand
 */
public class CombatStats {

    /** Fraction of incoming damage blocked per point of armor */
    public static final double ARMOR_REDUCTION_RATE = 0.1;

    /** Upper bound on the fraction of damage armor can block */
    public static final double MAX_ARMOR_REDUCTION = 0.9;

    private final EntityStats base;
    private int currentHp;
    private int temporaryArmor;

    public CombatStats(EntityStats base) {
        this.base = Objects.requireNonNull(base, "base");
        this.currentHp = base.maxHp();
    }

    /**
     * Apply damage after armor.
     *
     * @param amount incoming damage, already scaled by the attacker's modifiers
     * @param armor  effective armor of the defender
     * @return damage dealt and blocked; {@link DamageResult#NONE} if already dead or the amount is not positive
     */
    public DamageResult takeDamage(int amount, int armor) {
        if (currentHp <= 0 || amount <= 0) {
            return DamageResult.NONE;
        }
        var reduction = Math.min(MAX_ARMOR_REDUCTION, Math.max(0, armor) * ARMOR_REDUCTION_RATE);
        var blocked = (int) Math.floor(amount * reduction);
        var damage = Math.max(1, amount - blocked);
        var dealt = Math.min(damage, currentHp);
        currentHp -= dealt;
        return new DamageResult(dealt, blocked, currentHp == 0);
    }

    /**
     * @return hit points restored, capped at max HP; nothing for the dead
     */
    public HealResult heal(int amount) {
        if (currentHp <= 0 || amount <= 0) {
            return new HealResult(0, currentHp);
        }
        var healed = Math.min(amount, base.maxHp() - currentHp);
        currentHp += healed;
        return new HealResult(healed, currentHp);
    }

    /**
     * @return floor(base damage x modifier)
     */
    public int calculateDamageOutput(double modifier) {
        return calculateDamageOutput(base.baseDamage(), modifier);
    }

    public static int calculateDamageOutput(int damage, double modifier) {
        return (int) Math.floor(damage * modifier);
    }

    /**
     * Clamp into [0, maxHp].
     */
    public void setHp(int hp) {
        currentHp = Math.max(0, Math.min(base.maxHp(), hp));
    }

    public int getCurrentHp() {
        return currentHp;
    }

    public int getMaxHp() {
        return base.maxHp();
    }

    public int getArmor() {
        return base.baseArmor() + temporaryArmor;
    }

    public void addTemporaryArmor(int armor) {
        temporaryArmor = Math.max(0, temporaryArmor + armor);
    }

    public void clearTemporaryArmor() {
        temporaryArmor = 0;
    }

    public int getTemporaryArmor() {
        return temporaryArmor;
    }

    public EntityStats getBase() {
        return base;
    }

    public boolean isAlive() {
        return currentHp > 0;
    }

    /**
     * Restore full HP and drop temporary armor.
     */
    public void reset() {
        currentHp = base.maxHp();
        temporaryArmor = 0;
    }

    @Override
    public String toString() {
        return String.format("CombatStats[hp=%d/%d, armor=%d]", currentHp, base.maxHp(), getArmor());
    }
}
