package com.hellblazer.hexcrawl.simulation.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Every status effect an entity can carry, with its stacking rules.
 * <p>
 * Values are interpreted per effect: hit points per round for poison, burning and regeneration, armor for shielded,
 * and percentages for the damage and healing modifiers. A value of 0 on a percentage effect means the default
 * percentage.
 *
 * @author hal.hildebrand
 */
public enum StatusEffectType {
    POISON(true, 5, Category.DEBUFF, 0, "Takes damage each turn"),
    REGENERATION(true, 3, Category.BUFF, 0, "Heals each turn"),
    STUNNED(false, 1, Category.DEBUFF, 0, "Cannot act"),
    SHIELDED(true, 10, Category.BUFF, 0, "Increases armor"),
    VULNERABLE(false, 1, Category.DEBUFF, 50, "Takes increased damage"),
    ENRAGED(false, 1, Category.BUFF, 50, "Deals increased damage"),
    WEAKENED(false, 1, Category.DEBUFF, 25, "Deals reduced damage"),
    INVISIBLE(false, 1, Category.BUFF, 0, "Cannot be targeted"),
    BURNING(true, 3, Category.DEBUFF, 0, "Takes fire damage each turn"),
    FROZEN(false, 1, Category.DEBUFF, 0, "Cannot move or act"),
    BLESSED(false, 1, Category.BUFF, 50, "Enhanced healing received"),
    CURSED(false, 1, Category.DEBUFF, 50, "Reduced healing received");

    public enum Category {
        BUFF, DEBUFF
    }

    private final boolean  stackable;
    private final int      maxStacks;
    private final Category category;
    private final int      defaultValue;
    private final String   description;

    StatusEffectType(boolean stackable, int maxStacks, Category category, int defaultValue, String description) {
        this.stackable = stackable;
        this.maxStacks = maxStacks;
        this.category = category;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    /**
     * Look up an effect by its lower case name, e.g. "poison".
     */
    public static Optional<StatusEffectType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean isStackable() {
        return stackable;
    }

    public int getMaxStacks() {
        return maxStacks;
    }

    public Category getCategory() {
        return category;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    public String effectName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
