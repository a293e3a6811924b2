package com.hellblazer.hexcrawl.simulation.config;

import com.hellblazer.hexcrawl.simulation.ai.AIVariant;
import com.hellblazer.hexcrawl.simulation.ai.MonsterBehavior;
import com.hellblazer.hexcrawl.simulation.entity.AbilityDefinition;
import com.hellblazer.hexcrawl.simulation.entity.EntityStats;
import com.hellblazer.hexcrawl.simulation.threat.ThreatConfig;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Template from which {@link MonsterFactory} creates monsters.
 *
 * @param id           unique definition id, e.g. "goblin_warrior"
 * @param name         display name
 * @param description  free text
 * @param stats        base combat numbers
 * @param abilities    class abilities, in addition to the built-in basic attack
 * @param aiVariant    default policy
 * @param threatConfig threat table tuning
 * @param spawnWeight  relative likelihood in random encounters, non-negative
 * @param difficulty   rough challenge rating, positive
 * @param behaviors    scripted rules evaluated before the default policy
 * @param tags         free-form labels
 * @author hal.hildebrand
 */
public record MonsterDefinition(String id, String name, String description, EntityStats stats,
                                List<AbilityDefinition> abilities, AIVariant aiVariant, ThreatConfig threatConfig,
                                int spawnWeight, int difficulty, List<MonsterBehavior> behaviors, Set<String> tags) {

    public MonsterDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Monster definition id is required");
        }
        Objects.requireNonNull(stats, "stats");
        name = name == null ? id : name;
        description = description == null ? "" : description;
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
        aiVariant = aiVariant == null ? AIVariant.AGGRESSIVE : aiVariant;
        threatConfig = threatConfig == null ? ThreatConfig.defaultConfig() : threatConfig;
        if (spawnWeight < 0) {
            throw new IllegalArgumentException("Spawn weight must be non-negative: " + spawnWeight);
        }
        if (difficulty <= 0) {
            throw new IllegalArgumentException("Difficulty must be positive: " + difficulty);
        }
        behaviors = behaviors == null ? List.of() : List.copyOf(behaviors);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /**
     * Definition with default threat tuning, no behaviors and no tags.
     */
    public static MonsterDefinition of(String id, String name, EntityStats stats, List<AbilityDefinition> abilities,
                                       AIVariant aiVariant) {
        return new MonsterDefinition(id, name, "", stats, abilities, aiVariant, ThreatConfig.defaultConfig(), 1, 1,
                                     List.of(), Set.of());
    }
}
