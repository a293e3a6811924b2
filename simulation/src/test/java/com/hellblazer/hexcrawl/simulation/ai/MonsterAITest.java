package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ActionKind;
import com.hellblazer.hexcrawl.simulation.entity.AbilityDefinition;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;
import com.hellblazer.hexcrawl.simulation.entity.EntityStats;
import com.hellblazer.hexcrawl.simulation.entity.Monster;
import com.hellblazer.hexcrawl.simulation.entity.Player;
import com.hellblazer.hexcrawl.simulation.entity.PlayerSpecialization;
import com.hellblazer.hexcrawl.simulation.entity.StatusEffectType;
import com.hellblazer.hexcrawl.simulation.threat.ThreatConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for monster decision making, one scenario per policy.
 *
 * @author hal.hildebrand
 */
class MonsterAITest {

    private static final EntityStats GOBLIN = new EntityStats(40, 1, 10, 3);

    private Player hero;

    @BeforeEach
    void setUp() {
        hero = new Player("hero", "Hero", PlayerSpecialization.FIGHTER, HexCoordinate.ORIGIN);
    }

    @Test
    void testAggressiveAttacksAdjacentEnemy() {
        var goblin = monster("goblin", AIVariant.AGGRESSIVE, HexCoordinate.of(1, 0));
        var decision = goblin.decide(context(List.of(), List.of(hero), goblin, 1));
        assertEquals(ActionKind.ATTACK, decision.kind());
        assertEquals("hero", ((AIDecision.Attack) decision).targetId());
        assertEquals(AIPriority.HIGH, decision.priority());
    }

    @Test
    void testAggressiveApproachesDistantEnemy() {
        var goblin = monster("goblin", AIVariant.AGGRESSIVE, HexCoordinate.of(3, 0));
        var context = context(List.of(), List.of(hero), goblin, 1);
        var decision = goblin.decide(context);
        assertEquals(ActionKind.MOVE, decision.kind());
        var destination = ((AIDecision.Move) decision).destination();
        assertEquals(1, destination.distance(hero.getPosition()));
        assertFalse(context.occupied().contains(destination));
        assertTrue(goblin.getPosition().distance(destination) <= goblin.getMovementRange());
    }

    @Test
    void testMoveNeverLandsOnOccupiedHex() {
        var goblin = monster("goblin", AIVariant.AGGRESSIVE, HexCoordinate.of(3, 0));
        var blockers = new ArrayList<CombatEntity>();
        for (var hex : List.of(HexCoordinate.of(1, 0), HexCoordinate.of(1, -1), HexCoordinate.of(0, 1))) {
            blockers.add(monster("wall" + blockers.size(), AIVariant.PASSIVE, hex));
        }
        var context = context(blockers, List.of(hero), goblin, 1);
        var decision = goblin.decide(context);
        assertEquals(ActionKind.MOVE, decision.kind());
        var destination = ((AIDecision.Move) decision).destination();
        assertFalse(context.occupied().contains(destination));
        assertNotEquals(goblin.getPosition(), destination);
    }

    @Test
    void testDefensiveRetreatsWhenWounded() {
        var orc = monster("orc", AIVariant.DEFENSIVE, HexCoordinate.of(1, 0));
        orc.setCurrentHp(10);
        var decision = orc.decide(context(List.of(), List.of(hero), orc, 1));
        assertEquals(ActionKind.MOVE, decision.kind());
        assertEquals(AIPriority.EMERGENCY, decision.priority());
        assertTrue(((AIDecision.Move) decision).destination().distance(hero.getPosition()) > 1);
    }

    @Test
    void testDefensiveCounterattacksWhenHealthy() {
        var orc = monster("orc", AIVariant.DEFENSIVE, HexCoordinate.of(1, 0));
        var decision = orc.decide(context(List.of(), List.of(hero), orc, 1));
        assertEquals(ActionKind.ATTACK, decision.kind());
        assertEquals(AIPriority.MEDIUM, decision.priority());
    }

    @Test
    void testDefensiveHoldsWithoutAdjacentEnemy() {
        var orc = monster("orc", AIVariant.DEFENSIVE, HexCoordinate.of(4, 0));
        var decision = orc.decide(context(List.of(), List.of(hero), orc, 1));
        assertEquals(ActionKind.WAIT, decision.kind());
        assertEquals("Holding position", decision.reasoning());
    }

    @Test
    void testPassiveWaitsUntilSomethingIsAdjacent() {
        var slime = monster("slime", AIVariant.PASSIVE, HexCoordinate.of(3, 0));
        var decision = slime.decide(context(List.of(), List.of(hero), slime, 1));
        assertEquals(ActionKind.WAIT, decision.kind());
        assertEquals("Nothing within reach", decision.reasoning());

        slime.place(HexCoordinate.of(0, 1));
        assertEquals(ActionKind.ATTACK, slime.decide(context(List.of(), List.of(hero), slime, 1)).kind());
    }

    @Test
    void testBerserkerHuntsWeakest() {
        var ranger = new Player("ranger", "Ranger", PlayerSpecialization.RANGER, HexCoordinate.of(1, -1));
        ranger.setCurrentHp(20);
        var berserker = monster("berserker", AIVariant.BERSERKER, HexCoordinate.of(1, 0));
        var decision = berserker.decide(context(List.of(), List.of(hero, ranger), berserker, 1));
        assertEquals("ranger", ((AIDecision.Attack) decision).targetId());
        assertEquals(AIPriority.HIGH, decision.priority());

        berserker.setCurrentHp(10);
        assertEquals(AIPriority.EMERGENCY,
                     berserker.decide(context(List.of(), List.of(hero, ranger), berserker, 1)).priority());
    }

    @Test
    void testSupportHealsWoundedAlly() {
        var mend = AbilityDefinition.heal("mend", "Mend", 15, 3, 2);
        var shaman = new Monster("shaman", "Shaman", GOBLIN, List.of(mend), HexCoordinate.of(3, 0),
                                 AIVariant.SUPPORT, ThreatConfig.defaultConfig());
        var ally = monster("ally", AIVariant.AGGRESSIVE, HexCoordinate.of(4, 0));
        ally.setCurrentHp(10);
        var decision = shaman.decide(context(List.of(ally), List.of(hero), shaman, 1));
        assertEquals(ActionKind.ABILITY, decision.kind());
        var use = (AIDecision.UseAbility) decision;
        assertEquals("mend", use.abilityId());
        assertEquals("ally", use.targetId());
    }

    @Test
    void testTacticalPrefersStrongestAbilityInReach() {
        var archer = new Monster("archer", "Archer", GOBLIN,
                                 List.of(AbilityDefinition.attack("arrow", "Arrow", 14, 4, 0),
                                         AbilityDefinition.attack("volley", "Volley", 20, 3, 2)),
                                 HexCoordinate.of(3, 0), AIVariant.TACTICAL, ThreatConfig.defaultConfig());
        var decision = archer.decide(context(List.of(), List.of(hero), archer, 1));
        assertEquals(ActionKind.ABILITY, decision.kind());
        assertEquals("volley", ((AIDecision.UseAbility) decision).abilityId());

        archer.getAbilities().use("volley");
        assertEquals("arrow", ((AIDecision.UseAbility) archer.decide(
        context(List.of(), List.of(hero), archer, 1))).abilityId());
    }

    @Test
    void testScriptedBehaviorOverridesVariant() {
        var hold = new MonsterBehavior("hold", "Stand Fast", 9, List.of(new BehaviorCondition.RoundAtLeast(2)),
                                       new BehaviorAction.Hold());
        var goblin = new Monster("goblin", "Goblin", "goblin", GOBLIN, List.of(), HexCoordinate.of(1, 0),
                                 AIVariant.AGGRESSIVE, ThreatConfig.defaultConfig(), List.of(hold));
        assertEquals(ActionKind.ATTACK, goblin.decide(context(List.of(), List.of(hero), goblin, 1)).kind());

        var decision = goblin.decide(context(List.of(), List.of(hero), goblin, 2));
        assertEquals(ActionKind.WAIT, decision.kind());
        assertEquals("Behavior Stand Fast", decision.reasoning());
        assertEquals(9, decision.priority());
    }

    @Test
    void testHigherPriorityBehaviorWins() {
        var hold = new MonsterBehavior("hold", "Hold", 3, List.of(), new BehaviorAction.Hold());
        var flee = new MonsterBehavior("flee", "Flee", 8, List.of(new BehaviorCondition.HealthBelow(0.5)),
                                       new BehaviorAction.Retreat());
        var goblin = new Monster("goblin", "Goblin", "goblin", GOBLIN, List.of(), HexCoordinate.of(1, 0),
                                 AIVariant.AGGRESSIVE, ThreatConfig.defaultConfig(), List.of(hold, flee));
        assertEquals("flee", goblin.getAI().getBehaviors().get(0).id());
        assertEquals(ActionKind.WAIT, goblin.decide(context(List.of(), List.of(hero), goblin, 1)).kind());

        goblin.setCurrentHp(5);
        var decision = goblin.decide(context(List.of(), List.of(hero), goblin, 1));
        assertEquals(ActionKind.MOVE, decision.kind());
        assertEquals("Behavior Flee", decision.reasoning());
    }

    @Test
    void testUnusableBehaviorFallsThrough() {
        var zap = new MonsterBehavior("zap", "Zap", 9, List.of(), new BehaviorAction.UseAbility("lightning"));
        var goblin = new Monster("goblin", "Goblin", "goblin", GOBLIN, List.of(), HexCoordinate.of(1, 0),
                                 AIVariant.AGGRESSIVE, ThreatConfig.defaultConfig(), List.of(zap));
        assertEquals(ActionKind.ATTACK, goblin.decide(context(List.of(), List.of(hero), goblin, 1)).kind());
    }

    @Test
    void testAbilityOutOfReachStillChasesThreatLeader() {
        var bolt = new MonsterBehavior("bolt", "Bolt", 9, List.of(), new BehaviorAction.UseAbility("bolt"));
        var caster = new Monster("caster", "Caster", "caster", GOBLIN,
                                 List.of(AbilityDefinition.attack("bolt", "Bolt", 12, 2, 0)), HexCoordinate.ORIGIN,
                                 AIVariant.AGGRESSIVE, ThreatConfig.defaultConfig(), List.of(bolt));
        var tank = new Player("p1", "Tank", PlayerSpecialization.FIGHTER, HexCoordinate.of(6, 0));
        var mage = new Player("p2", "Mage", PlayerSpecialization.RANGER, HexCoordinate.of(-6, 0));
        var threat = caster.getThreatManager();
        threat.setThreat("p1", 100);
        threat.setThreat("p2", 5);

        var decision = caster.decide(context(List.of(), List.of(tank, mage), caster, 1));
        assertEquals(ActionKind.MOVE, decision.kind());
        var destination = ((AIDecision.Move) decision).destination();
        assertTrue(destination.distance(tank.getPosition()) < 6, "moved toward p1, landed on " + destination);
        assertTrue(threat.wasRecentlyTargeted("p1"));
        assertFalse(threat.wasRecentlyTargeted("p2"));
    }

    @Test
    void testAbilityRemembersTheEnemyItActuallyHits() {
        var bolt = new MonsterBehavior("bolt", "Bolt", 9, List.of(), new BehaviorAction.UseAbility("bolt"));
        var caster = new Monster("caster", "Caster", "caster", GOBLIN,
                                 List.of(AbilityDefinition.attack("bolt", "Bolt", 12, 2, 0)), HexCoordinate.ORIGIN,
                                 AIVariant.AGGRESSIVE, ThreatConfig.defaultConfig(), List.of(bolt));
        var tank = new Player("p1", "Tank", PlayerSpecialization.FIGHTER, HexCoordinate.of(6, 0));
        var mage = new Player("p2", "Mage", PlayerSpecialization.RANGER, HexCoordinate.of(-2, 0));
        var threat = caster.getThreatManager();
        threat.setThreat("p1", 100);
        threat.setThreat("p2", 5);

        var decision = caster.decide(context(List.of(), List.of(tank, mage), caster, 1));
        assertEquals(ActionKind.ABILITY, decision.kind());
        assertEquals("p2", ((AIDecision.UseAbility) decision).targetId());
        assertTrue(threat.wasRecentlyTargeted("p2"));
        assertFalse(threat.wasRecentlyTargeted("p1"));
    }

    @Test
    void testStunnedMonsterIdles() {
        var goblin = monster("goblin", AIVariant.AGGRESSIVE, HexCoordinate.of(1, 0));
        goblin.applyStatusEffect(StatusEffectType.STUNNED, 1, 0);
        var decision = goblin.decide(context(List.of(), List.of(hero), goblin, 1));
        assertEquals(ActionKind.WAIT, decision.kind());
        assertEquals("Cannot act", decision.reasoning());
    }

    @Test
    void testNoEnemiesIdles() {
        hero.setCurrentHp(0);
        var goblin = monster("goblin", AIVariant.AGGRESSIVE, HexCoordinate.of(1, 0));
        var decision = goblin.decide(context(List.of(), List.of(hero), goblin, 1));
        assertEquals("No enemies in sight", decision.reasoning());
        assertEquals(AIPriority.MINIMAL, decision.priority());
    }

    @Test
    void testInvisibleEnemyIgnored() {
        hero.applyStatusEffect(StatusEffectType.INVISIBLE, 2, 0);
        var goblin = monster("goblin", AIVariant.AGGRESSIVE, HexCoordinate.of(1, 0));
        assertEquals(ActionKind.WAIT, goblin.decide(context(List.of(), List.of(hero), goblin, 1)).kind());
    }

    @Test
    void testHistoryIsBounded() {
        var goblin = monster("goblin", AIVariant.AGGRESSIVE, HexCoordinate.of(1, 0));
        var context = context(List.of(), List.of(hero), goblin, 1);
        for (int i = 0; i < MonsterAI.MAX_HISTORY + 5; i++) {
            goblin.decide(context);
        }
        assertEquals(MonsterAI.MAX_HISTORY, goblin.getAI().getDecisionHistory().size());
        assertTrue(goblin.getAI().getLastDecision().isPresent());
        goblin.getAI().reset();
        assertTrue(goblin.getAI().getDecisionHistory().isEmpty());
    }

    private static Monster monster(String id, AIVariant variant, HexCoordinate position) {
        return new Monster(id, id, GOBLIN, List.of(), position, variant, ThreatConfig.defaultConfig());
    }

    private static DecisionContext context(List<? extends CombatEntity> allies, List<? extends CombatEntity> enemies,
                                           CombatEntity self, int round) {
        Set<HexCoordinate> occupied = new HashSet<>();
        occupied.add(self.getPosition());
        allies.stream().filter(CombatEntity::isAlive).forEach(a -> occupied.add(a.getPosition()));
        enemies.stream().filter(CombatEntity::isAlive).forEach(e -> occupied.add(e.getPosition()));
        return new DecisionContext(new ArrayList<>(allies), new ArrayList<>(enemies), Set.of(), occupied, round);
    }
}
