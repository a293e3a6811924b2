package com.hellblazer.hexcrawl.simulation.entity;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Shared state and rules of players and monsters, composed from {@link CombatStats}, {@link StatusEffects},
 * {@link AbilityBook} and {@link EntityMovement}.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractCombatEntity implements CombatEntity {
    private static final Logger log = LoggerFactory.getLogger(AbstractCombatEntity.class);

    private final String         id;
    private final String         name;
    private final EntityKind     kind;
    private final CombatStats    stats;
    private final StatusEffects  statusEffects = new StatusEffects();
    private final AbilityBook    abilities;
    private final EntityMovement movement;

    protected AbstractCombatEntity(String id, String name, EntityKind kind, EntityStats stats,
                                   Collection<AbilityDefinition> abilities, HexCoordinate position) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id is required");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.stats = new CombatStats(Objects.requireNonNull(stats, "stats"));
        this.abilities = new AbilityBook(abilities);
        this.movement = new EntityMovement(position, stats.movementRange());
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public EntityKind getKind() {
        return kind;
    }

    @Override
    public HexCoordinate getPosition() {
        return movement.getPosition();
    }

    @Override
    public int getCurrentHp() {
        return stats.getCurrentHp();
    }

    @Override
    public int getMaxHp() {
        return stats.getMaxHp();
    }

    @Override
    public boolean isAlive() {
        return stats.isAlive();
    }

    @Override
    public int getMovementRange() {
        return movement.getMovementRange();
    }

    @Override
    public int getEffectiveArmor() {
        return stats.getArmor() + statusEffects.getArmorBonus();
    }

    /**
     * The damage-taken modifier scales the incoming amount before armor is applied.
     */
    @Override
    public DamageResult takeDamage(int amount, String source) {
        var scaled = (int) Math.floor(amount * getDamageTakenModifier());
        var result = stats.takeDamage(scaled, getEffectiveArmor());
        if (result.dealt() > 0) {
            log.debug("{} took {} from {} ({} blocked, hp {}/{})", id, result.dealt(), source, result.blocked(),
                      stats.getCurrentHp(), stats.getMaxHp());
        }
        return result;
    }

    @Override
    public HealResult heal(int amount) {
        return stats.heal((int) Math.floor(amount * getHealingModifier()));
    }

    /**
     * Force HP into [0, maxHp], bypassing armor and modifiers.
     */
    public void setCurrentHp(int hp) {
        stats.setHp(hp);
    }

    @Override
    public double getDamageModifier() {
        return statusEffects.getDamageModifier();
    }

    @Override
    public double getDamageTakenModifier() {
        return statusEffects.getDamageTakenModifier();
    }

    @Override
    public double getHealingModifier() {
        return statusEffects.getHealingModifier();
    }

    @Override
    public int calculateDamageOutput(int baseDamage) {
        return CombatStats.calculateDamageOutput(baseDamage, getDamageModifier());
    }

    @Override
    public int calculateDamageOutput() {
        return stats.calculateDamageOutput(getDamageModifier());
    }

    @Override
    public boolean canAct() {
        return isAlive() && statusEffects.canAct();
    }

    @Override
    public boolean canMove() {
        return isAlive() && statusEffects.canMove();
    }

    @Override
    public boolean canBeTargeted() {
        return isAlive() && statusEffects.canBeTargeted();
    }

    @Override
    public MovementResult moveTo(HexCoordinate destination, Set<HexCoordinate> occupied,
                                 Set<HexCoordinate> obstacles) {
        if (!canMove()) {
            return MovementResult.refused(getPosition(), "Cannot move due to status effects");
        }
        return movement.moveTo(destination, occupied, obstacles);
    }

    @Override
    public boolean hasMovedThisRound() {
        return movement.hasMovedThisRound();
    }

    @Override
    public AbilityBook getAbilities() {
        return abilities;
    }

    @Override
    public StatusEffects getStatusEffects() {
        return statusEffects;
    }

    @Override
    public StatusEffects.Application applyStatusEffect(StatusEffectType type, int duration, int value) {
        var result = statusEffects.apply(type, duration, value);
        if (result.success()) {
            log.debug("{} gains {} ({} stacks, {} rounds)", id, type.effectName(), result.stacks(), duration);
        }
        return result;
    }

    /**
     * Damage and healing over time bypass the damage-taken and healing modifiers; armor still applies.
     */
    @Override
    public RoundUpkeep processRound() {
        var ready = abilities.processRound();
        var ticks = statusEffects.processRound();
        var damage = 0;
        var healing = 0;
        var died = false;
        for (var tick : ticks.effects()) {
            if (tick.isDamage()) {
                var result = stats.takeDamage(tick.value(), getEffectiveArmor());
                damage += result.dealt();
                died |= result.died();
            } else {
                healing += stats.heal(tick.value()).healed();
            }
        }
        movement.resetForNewRound();
        onRoundProcessed();
        return new RoundUpkeep(id, ticks, damage, healing, ready, died);
    }

    /**
     * Hook for subclass upkeep after the shared bookkeeping.
     */
    protected void onRoundProcessed() {
    }

    /**
     * Full HP, no effects or cooldowns, back at the starting position or a new one.
     *
     * @param startingPosition new start, or null to keep the current start
     */
    public void resetForEncounter(HexCoordinate startingPosition) {
        stats.reset();
        statusEffects.reset();
        abilities.reset();
        movement.resetForEncounter(startingPosition);
    }

    /**
     * Place the entity without movement rules, used during setup.
     */
    public void place(HexCoordinate position) {
        movement.place(position);
    }

    public CombatStats getStats() {
        return stats;
    }

    public EntityMovement getMovement() {
        return movement;
    }

    @Override
    public String toString() {
        return String.format("%s[%s, hp=%d/%d, at=%s]", getClass().getSimpleName(), id, stats.getCurrentHp(),
                             stats.getMaxHp(), getPosition().toDisplayString());
    }
}
