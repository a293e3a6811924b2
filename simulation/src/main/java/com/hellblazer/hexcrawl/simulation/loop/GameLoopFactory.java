package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.config.GameLoopConfig;
import com.hellblazer.hexcrawl.simulation.config.MonsterFactory;
import com.hellblazer.hexcrawl.simulation.config.MonsterRegistry;
import com.hellblazer.hexcrawl.simulation.entity.AbilityDefinition;
import com.hellblazer.hexcrawl.simulation.entity.EntityStats;
import com.hellblazer.hexcrawl.simulation.entity.Monster;
import com.hellblazer.hexcrawl.simulation.entity.Player;
import com.hellblazer.hexcrawl.simulation.entity.PlayerSpecialization;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ready made encounters for tests, demos and quick starts.
 *
 * @author hal.hildebrand
 */
public final class GameLoopFactory {

    private GameLoopFactory() {
    }

    /**
     * Two fighters against a goblin and an orc, ten rounds.
     */
    public static GameLoop createTestScenario() {
        var fighter = new PlayerSpecialization("test_fighter", "Fighter", "A test fighter class",
                                               new EntityStats(100, 2, 15, 3),
                                               List.of(AbilityDefinition.attack("power_strike", "Power Strike", 20, 1,
                                                                                2),
                                                       AbilityDefinition.heal("heal_self", "Heal Self", 15, 0, 3)));
        var players = List.of(new Player("player1", "Hero", fighter, HexCoordinate.of(0, 0)),
                              new Player("player2", "Sidekick", fighter, HexCoordinate.of(1, 0)));
        var monsters = List.of(MonsterFactory.createSimple("monster1", "Goblin", HexCoordinate.of(3, 0)),
                               MonsterFactory.createSimple("monster2", "Orc", HexCoordinate.of(2, 1)));
        return new GameLoop(players, monsters, GameLoopConfig.builder()
                                                             .withMaxRounds(10)
                                                             .withTurnTimeout(Duration.ofSeconds(10))
                                                             .withAutoProgressAfter(Duration.ofSeconds(2))
                                                             .build());
    }

    /**
     * One strong hero with an area attack against three weak goblins, fifteen rounds.
     */
    public static GameLoop createSoloScenario() {
        var hero = new PlayerSpecialization("solo_hero", "Solo Hero", "A powerful solo adventurer",
                                            new EntityStats(150, 3, 20, 4),
                                            List.of(AbilityDefinition.attack("whirlwind", "Whirlwind", 15, 1, 3)
                                                                     .withAreaOfEffect(1)));
        var players = List.of(new Player("solo_player", "Lone Wolf", hero, HexCoordinate.ORIGIN));
        var monsters = List.of(MonsterFactory.createSimple("weak1", "Weak Goblin", HexCoordinate.of(2, 0)),
                               MonsterFactory.createSimple("weak2", "Weak Goblin", HexCoordinate.of(1, 1)),
                               MonsterFactory.createSimple("weak3", "Weak Goblin", HexCoordinate.of(0, 2)));
        return new GameLoop(players, monsters, GameLoopConfig.builder()
                                                             .withMaxRounds(15)
                                                             .withTurnTimeout(Duration.ofSeconds(15))
                                                             .withAutoProgressAfter(Duration.ofSeconds(3))
                                                             .build());
    }

    /**
     * A fighter, a ranger and a cleric against monsters from the registry, placed on the far side of the board.
     *
     * @param definitionIds one monster per id, numbered in order
     * @throws IllegalArgumentException if an id is not registered
     */
    public static GameLoop createPartyScenario(MonsterRegistry registry, List<String> definitionIds,
                                               GameLoopConfig config) {
        var players = List.of(new Player("fighter", "Fighter", PlayerSpecialization.FIGHTER, HexCoordinate.of(0, 0)),
                              new Player("ranger", "Ranger", PlayerSpecialization.RANGER, HexCoordinate.of(-1, 1)),
                              new Player("cleric", "Cleric", PlayerSpecialization.CLERIC, HexCoordinate.of(-1, 0)));
        var monsters = new ArrayList<Monster>();
        for (int i = 0; i < definitionIds.size(); i++) {
            var id = definitionIds.get(i);
            monsters.add(MonsterFactory.create(registry, id, id + "_" + (i + 1), HexCoordinate.of(5, i - 1)));
        }
        return new GameLoop(players, monsters, config);
    }
}
