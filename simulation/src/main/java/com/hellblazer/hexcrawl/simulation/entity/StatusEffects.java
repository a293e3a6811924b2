package com.hellblazer.hexcrawl.simulation.entity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status effects carried by one entity.
 * <p>
 * Stacking rules:
 * - a stackable effect applied again gains a stack up to its maximum; duration becomes the longer of the two and
 * the per-stack value is kept from the first application, so the aggregate value is base x stacks
 * - a non-stackable effect applied again replaces the active one only if the new application lasts longer or is
 * stronger
 * <p>
 * Each round {@link #processRound()} reports damage and healing over time, then decrements every duration and drops
 * effects that reach zero.
 *
 * @author hal.hildebrand
 */
public class StatusEffects {

    /**
     * Result of applying an effect.
     *
     * @param success whether the effect was applied or stacked
     * @param stacks  stacks after the application
     * @param reason  why it was refused, null on success
     */
    public record Application(boolean success, int stacks, String reason) {
    }

    /**
     * One round of ticking.
     *
     * @param effects damage or healing produced this round
     * @param expired effects that ran out
     */
    public record TickResult(List<Tick> effects, List<StatusEffectType> expired) {

        public static final TickResult EMPTY = new TickResult(List.of(), List.of());

        public boolean isEmpty() {
            return effects.isEmpty() && expired.isEmpty();
        }
    }

    /**
     * @param type  the effect that produced the tick
     * @param value hit points of damage (poison, burning) or healing (regeneration)
     */
    public record Tick(StatusEffectType type, int value) {

        public boolean isDamage() {
            return type == StatusEffectType.POISON || type == StatusEffectType.BURNING;
        }
    }

    private final Map<StatusEffectType, StatusEffect> active = new EnumMap<>(StatusEffectType.class);

    public Application apply(StatusEffectType type, int duration, int value) {
        if (duration <= 0) {
            return new Application(false, getStacks(type), "Duration must be positive");
        }
        var existing = active.get(type);
        if (existing == null) {
            active.put(type, new StatusEffect(type, duration, Math.max(0, value), 1));
            return new Application(true, 1, null);
        }
        if (type.isStackable()) {
            if (existing.stacks() >= type.getMaxStacks()) {
                return new Application(false, existing.stacks(), String.format(
                "%s already at maximum stacks (%d)", type.effectName(), type.getMaxStacks()));
            }
            var base = existing.baseValue() > 0 ? existing.baseValue() : Math.max(0, value);
            var stacked = new StatusEffect(type, Math.max(existing.duration(), duration), base,
                                           existing.stacks() + 1);
            active.put(type, stacked);
            return new Application(true, stacked.stacks(), null);
        }
        if (duration > existing.duration() || value > existing.baseValue()) {
            active.put(type, new StatusEffect(type, duration, Math.max(0, value), 1));
            return new Application(true, 1, null);
        }
        return new Application(false, 1, type.effectName() + " already active with better effect");
    }

    public boolean remove(StatusEffectType type) {
        return active.remove(type) != null;
    }

    public boolean has(StatusEffectType type) {
        return active.containsKey(type);
    }

    public Optional<StatusEffect> get(StatusEffectType type) {
        return Optional.ofNullable(active.get(type));
    }

    public int getStacks(StatusEffectType type) {
        var effect = active.get(type);
        return effect == null ? 0 : effect.stacks();
    }

    /**
     * @return active effects in declaration order
     */
    public List<StatusEffect> getActive() {
        return List.copyOf(active.values());
    }

    public List<StatusEffect> getByCategory(StatusEffectType.Category category) {
        return active.values().stream().filter(e -> e.type().getCategory() == category).toList();
    }

    /**
     * @return the effects removed
     */
    public List<StatusEffectType> clear() {
        var cleared = List.copyOf(active.keySet());
        active.clear();
        return cleared;
    }

    public List<StatusEffectType> clearCategory(StatusEffectType.Category category) {
        var cleared = new ArrayList<StatusEffectType>();
        active.keySet().removeIf(type -> {
            if (type.getCategory() == category) {
                cleared.add(type);
                return true;
            }
            return false;
        });
        return cleared;
    }

    public TickResult processRound() {
        if (active.isEmpty()) {
            return TickResult.EMPTY;
        }
        var ticks = new ArrayList<Tick>();
        var expired = new ArrayList<StatusEffectType>();
        var iterator = active.entrySet().iterator();
        while (iterator.hasNext()) {
            var entry = iterator.next();
            var effect = entry.getValue();
            switch (effect.type()) {
                case POISON, BURNING, REGENERATION -> {
                    if (effect.value() > 0) {
                        ticks.add(new Tick(effect.type(), effect.value()));
                    }
                }
                default -> {
                }
            }
            var remaining = effect.duration() - 1;
            if (remaining <= 0) {
                iterator.remove();
                expired.add(effect.type());
            } else {
                entry.setValue(effect.withDuration(remaining));
            }
        }
        return new TickResult(List.copyOf(ticks), List.copyOf(expired));
    }

    public boolean canAct() {
        return !has(StatusEffectType.STUNNED) && !has(StatusEffectType.FROZEN);
    }

    public boolean canMove() {
        return !has(StatusEffectType.STUNNED) && !has(StatusEffectType.FROZEN);
    }

    public boolean canBeTargeted() {
        return !has(StatusEffectType.INVISIBLE);
    }

    /**
     * Enraged raises outgoing damage by its percentage, weakened lowers it.
     */
    public double getDamageModifier() {
        var modifier = 1.0;
        modifier *= 1.0 + percent(StatusEffectType.ENRAGED);
        modifier *= 1.0 - percent(StatusEffectType.WEAKENED);
        return Math.max(0.0, modifier);
    }

    public double getDamageTakenModifier() {
        return 1.0 + percent(StatusEffectType.VULNERABLE);
    }

    /**
     * Blessed raises incoming healing by its percentage, cursed lowers it.
     */
    public double getHealingModifier() {
        var modifier = 1.0;
        modifier *= 1.0 + percent(StatusEffectType.BLESSED);
        modifier *= 1.0 - percent(StatusEffectType.CURSED);
        return Math.max(0.0, modifier);
    }

    /**
     * @return armor granted by shielded stacks
     */
    public int getArmorBonus() {
        var shield = active.get(StatusEffectType.SHIELDED);
        return shield == null ? 0 : shield.value();
    }

    public boolean isEmpty() {
        return active.isEmpty();
    }

    public void reset() {
        active.clear();
    }

    private double percent(StatusEffectType type) {
        var effect = active.get(type);
        return effect == null ? 0.0 : effect.value() / 100.0;
    }
}
