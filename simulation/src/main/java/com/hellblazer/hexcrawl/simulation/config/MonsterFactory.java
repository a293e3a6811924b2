package com.hellblazer.hexcrawl.simulation.config;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ai.AIVariant;
import com.hellblazer.hexcrawl.simulation.entity.AbilityDefinition;
import com.hellblazer.hexcrawl.simulation.entity.EntityStats;
import com.hellblazer.hexcrawl.simulation.entity.Monster;
import com.hellblazer.hexcrawl.simulation.threat.ThreatConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Creates {@link Monster}s from {@link MonsterDefinition}s.
 *
 * @author hal.hildebrand
 */
public final class MonsterFactory {

    /** HP growth per level */
    public static final double HP_PER_LEVEL     = 0.1;
    /** Damage growth per level */
    public static final double DAMAGE_PER_LEVEL = 0.05;

    private MonsterFactory() {
    }

    public static Monster create(MonsterDefinition definition, String id, HexCoordinate position) {
        Objects.requireNonNull(definition, "definition");
        return new Monster(id, definition.name(), definition.id(), definition.stats(), definition.abilities(),
                           position, definition.aiVariant(), definition.threatConfig(), definition.behaviors());
    }

    /**
     * @throws IllegalArgumentException if the registry has no such definition
     */
    public static Monster create(MonsterRegistry registry, String definitionId, String id, HexCoordinate position) {
        var definition = registry.get(definitionId)
                                 .orElseThrow(
                                 () -> new IllegalArgumentException("Unknown monster definition: " + definitionId));
        return create(definition, id, position);
    }

    /**
     * Monsters numbered {@code <definition id>_1 .. _count}.
     *
     * @param positions one per monster
     */
    public static List<Monster> createMultiple(MonsterDefinition definition, List<HexCoordinate> positions) {
        var monsters = new ArrayList<Monster>(positions.size());
        for (int i = 0; i < positions.size(); i++) {
            monsters.add(create(definition, definition.id() + "_" + (i + 1), positions.get(i)));
        }
        return monsters;
    }

    /**
     * A plain melee monster with threat tracking off; it goes for the nearest player.
     */
    public static Monster createSimple(String id, String name, HexCoordinate position) {
        var threat = ThreatConfig.builder().withEnabled(false).withAvoidLastTargetRounds(0).build();
        return new Monster(id, name, new EntityStats(50, 1, 12, 3), List.of(AbilityDefinition.BASIC_ATTACK),
                           position, AIVariant.AGGRESSIVE, threat);
    }

    /**
     * Stronger copy of a definition: HP grows 10% and damage 5% per level.
     */
    public static Monster createScaled(MonsterDefinition definition, int level, HexCoordinate position) {
        var stats = definition.stats();
        var scaled = new EntityStats((int) Math.floor(stats.maxHp() * (1 + level * HP_PER_LEVEL)),
                                     stats.baseArmor(),
                                     (int) Math.floor(stats.baseDamage() * (1 + level * DAMAGE_PER_LEVEL)),
                                     stats.movementRange());
        var definitionAtLevel = new MonsterDefinition(definition.id(), definition.name(), definition.description(),
                                                      scaled, definition.abilities(), definition.aiVariant(),
                                                      definition.threatConfig(), definition.spawnWeight(),
                                                      definition.difficulty(), definition.behaviors(),
                                                      definition.tags());
        return create(definitionAtLevel, definition.id() + "_L" + level, position);
    }

    /**
     * Pick a definition with probability proportional to its spawn weight.
     *
     * @throws IllegalArgumentException if there is nothing to pick from
     */
    public static Monster createRandom(List<MonsterDefinition> definitions, String id, HexCoordinate position,
                                       Random random) {
        var total = definitions.stream().mapToInt(MonsterDefinition::spawnWeight).sum();
        if (definitions.isEmpty() || total <= 0) {
            throw new IllegalArgumentException("No monster definitions with positive spawn weight");
        }
        var roll = random.nextInt(total);
        for (var definition : definitions) {
            roll -= definition.spawnWeight();
            if (roll < 0) {
                return create(definition, id, position);
            }
        }
        throw new IllegalStateException("Spawn weight roll out of range");
    }
}
