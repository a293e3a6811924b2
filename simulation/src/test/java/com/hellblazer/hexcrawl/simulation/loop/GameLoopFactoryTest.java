package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.simulation.config.GameLoopConfig;
import com.hellblazer.hexcrawl.simulation.config.MonsterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class GameLoopFactoryTest {

    @Test
    void testScenariosStartValid() {
        for (var loop : List.of(GameLoopFactory.createTestScenario(), GameLoopFactory.createSoloScenario())) {
            assertEquals(GamePhase.SETUP, loop.getPhase());
            assertTrue(loop.validateState().valid(), loop.validateState().issues().toString());
        }
        assertEquals(10, GameLoopFactory.createTestScenario().getConfig().getMaxRounds());
        assertEquals(3, GameLoopFactory.createSoloScenario().getAliveMonsters().size());
    }

    @Test
    void testPartyScenario() {
        var loop = GameLoopFactory.createPartyScenario(MonsterRegistry.withDefaults(),
                                                       List.of("goblin_warrior", "goblin_shaman"),
                                                       GameLoopConfig.defaultConfig());
        assertEquals(3, loop.getAlivePlayers().size());
        var monsters = loop.getAliveMonsters();
        assertEquals("goblin_warrior_1", monsters.get(0).getId());
        assertEquals("goblin_shaman_2", monsters.get(1).getId());
        assertTrue(loop.validateState().valid());
    }

    @Test
    void testPartyPlaysToAnEnd() {
        var loop = GameLoopFactory.createPartyScenario(MonsterRegistry.withDefaults(),
                                                       List.of("goblin_warrior", "orc_brute"),
                                                       GameLoopConfig.builder().withMaxRounds(30).build());
        loop.startGame();
        while (!loop.isGameEnded()) {
            for (var player : loop.getAlivePlayers()) {
                loop.getAliveMonsters()
                    .stream()
                    .filter(m -> m.distanceTo(player) <= 1)
                    .findFirst()
                    .ifPresent(m -> loop.submitPlayerAction(PlayerAction.attack(player.getId(), m.getId())));
            }
            loop.processRound();
            assertTrue(loop.validateState().valid(), loop.validateState().issues().toString());
        }
        assertTrue(loop.getWinner().isPresent());
        assertTrue(loop.getRoundHistory().size() <= 30);
    }
}
