package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;
import com.hellblazer.hexcrawl.simulation.entity.Player;
import com.hellblazer.hexcrawl.simulation.entity.PlayerSpecialization;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for scripted behavior conditions.
 *
 * @author hal.hildebrand
 */
class BehaviorConditionTest {

    @Test
    void testHealthThresholds() {
        var self = mock(CombatEntity.class);
        when(self.getHpFraction()).thenReturn(0.3);
        var context = context(List.of(), List.of(), 1);

        assertTrue(new BehaviorCondition.HealthBelow(0.5).test(self, context));
        assertFalse(new BehaviorCondition.HealthBelow(0.3).test(self, context));
        assertTrue(new BehaviorCondition.HealthAbove(0.2).test(self, context));
        assertFalse(new BehaviorCondition.HealthAbove(0.3).test(self, context));
    }

    @Test
    void testFractionMustBeWithinUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new BehaviorCondition.HealthBelow(1.5));
        assertThrows(IllegalArgumentException.class, () -> new BehaviorCondition.HealthAbove(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new BehaviorCondition.AllyInDanger(Double.NaN));
    }

    @Test
    void testCountsIgnoreDeadAndUntargetable() {
        var living = new Player("a", "A", PlayerSpecialization.FIGHTER, HexCoordinate.of(2, 0));
        var dead = new Player("b", "B", PlayerSpecialization.RANGER, HexCoordinate.of(3, 0));
        dead.setCurrentHp(0);
        var context = context(List.of(), List.of(living, dead), 1);
        var self = mock(CombatEntity.class);

        assertTrue(new BehaviorCondition.EnemyCountAtLeast(1).test(self, context));
        assertFalse(new BehaviorCondition.EnemyCountAtLeast(2).test(self, context));
        assertFalse(new BehaviorCondition.AllyCountAtLeast(1).test(self, context));
    }

    @Test
    void testEnemyWithin() {
        var enemy = new Player("a", "A", PlayerSpecialization.FIGHTER, HexCoordinate.of(3, 0));
        var self = new Player("self", "Self", PlayerSpecialization.CLERIC, HexCoordinate.ORIGIN);
        var context = context(List.of(), List.of(enemy), 1);

        assertTrue(new BehaviorCondition.EnemyWithin(3).test(self, context));
        assertFalse(new BehaviorCondition.EnemyWithin(2).test(self, context));
    }

    @Test
    void testAllyInDanger() {
        var ally = new Player("ally", "Ally", PlayerSpecialization.FIGHTER, HexCoordinate.of(1, 0));
        var context = context(List.of(ally), List.of(), 1);
        var self = mock(CombatEntity.class);
        var condition = new BehaviorCondition.AllyInDanger(0.5);

        assertFalse(condition.test(self, context));
        ally.setCurrentHp(30);
        assertTrue(condition.test(self, context));
    }

    @Test
    void testRoundAtLeast() {
        var self = mock(CombatEntity.class);
        var condition = new BehaviorCondition.RoundAtLeast(3);
        assertFalse(condition.test(self, context(List.of(), List.of(), 2)));
        assertTrue(condition.test(self, context(List.of(), List.of(), 3)));
    }

    @Test
    void testBehaviorRequiresEveryCondition() {
        var self = mock(CombatEntity.class);
        when(self.getHpFraction()).thenReturn(0.3);
        var behavior = new MonsterBehavior("enrage", null, 7, List.of(new BehaviorCondition.HealthBelow(0.5),
                                                                      new BehaviorCondition.RoundAtLeast(2)),
                                           new BehaviorAction.AttackNearest());
        assertEquals("enrage", behavior.name());
        assertFalse(behavior.matches(self, context(List.of(), List.of(), 1)));
        assertTrue(behavior.matches(self, context(List.of(), List.of(), 2)));
    }

    private static DecisionContext context(List<CombatEntity> allies, List<CombatEntity> enemies, int round) {
        return new DecisionContext(allies, enemies, Set.of(), Set.of(), round);
    }
}
