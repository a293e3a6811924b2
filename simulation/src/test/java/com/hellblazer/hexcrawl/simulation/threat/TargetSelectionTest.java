package com.hellblazer.hexcrawl.simulation.threat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for threat-based target selection.
 *
 * @author hal.hildebrand
 */
class TargetSelectionTest {

    private static Targetable candidate(String id, int hp, int maxHp) {
        var target = mock(Targetable.class);
        when(target.getId()).thenReturn(id);
        when(target.getCurrentHp()).thenReturn(hp);
        when(target.getMaxHp()).thenReturn(maxHp);
        when(target.isAlive()).thenReturn(hp > 0);
        when(target.getHpFraction()).thenCallRealMethod();
        return target;
    }

    @Test
    void testHighestThreatWins() {
        var threat = new ThreatManager();
        var a = candidate("a", 50, 100);
        var b = candidate("b", 50, 100);
        threat.setThreat("a", 10);
        threat.setThreat("b", 30);

        var result = threat.selectTarget(List.of(a, b));
        assertSame(b, result.target());
        assertEquals(0.9, result.confidence(), 0.001);
        assertTrue(result.reason().contains("highest threat"));
    }

    @Test
    void testLowestHpFallbackWithoutThreat() {
        var threat = new ThreatManager();
        var healthy = candidate("healthy", 90, 100);
        var hurt = candidate("hurt", 30, 100);

        var result = threat.selectTarget(List.of(healthy, hurt));
        assertSame(hurt, result.target());
        assertEquals(0.5, result.confidence(), 0.001);
    }

    @Test
    void testLowestHpUsesFraction() {
        var threat = new ThreatManager();
        // 20/40 = 50% against 30/100 = 30%
        var small = candidate("small", 20, 40);
        var big = candidate("big", 30, 100);
        assertSame(big, threat.selectTarget(List.of(small, big)).target());
    }

    @Test
    void testFirstCandidateFallbackWhenLowestHpDisabled() {
        var threat = new ThreatManager(ThreatConfig.builder().withFallbackToLowestHp(false).build());
        var first = candidate("z-first", 90, 100);
        var second = candidate("a-second", 10, 100);

        var result = threat.selectTarget(List.of(first, second));
        assertSame(first, result.target());
        assertEquals(0.3, result.confidence(), 0.001);
    }

    @Test
    @DisplayName("Last round's target is avoided when an alternative exists")
    void testAvoidsRecentTarget() {
        var threat = new ThreatManager();
        var tank = candidate("tank", 100, 100);
        var mage = candidate("mage", 100, 100);
        threat.setThreat("tank", 50);
        threat.setThreat("mage", 5);

        assertSame(tank, threat.selectTarget(List.of(tank, mage)).target());
        threat.processRound();
        assertSame(mage, threat.selectTarget(List.of(tank, mage)).target());

        // With a single candidate the recent target is still chosen
        threat.processRound();
        assertSame(mage, threat.selectTarget(List.of(mage)).target());
    }

    @Test
    void testTieBrokenByLowestId() {
        var threat = new ThreatManager();
        var charlie = candidate("charlie", 100, 100);
        var alpha = candidate("alpha", 100, 100);
        threat.setThreat("charlie", 20.0);
        threat.setThreat("alpha", 20.005);

        var result = threat.selectTarget(List.of(charlie, alpha));
        assertSame(alpha, result.target());
        assertEquals(0.7, result.confidence(), 0.001);

        // Same table, same answer
        var again = new ThreatManager();
        again.setThreat("charlie", 20.0);
        again.setThreat("alpha", 20.005);
        assertSame(alpha, again.selectTarget(List.of(charlie, alpha)).target());
    }

    @Test
    void testTieWithoutTiebreakerTakesRosterOrder() {
        var threat = new ThreatManager(ThreatConfig.builder().withTiebreaker(false).build());
        var charlie = candidate("charlie", 100, 100);
        var alpha = candidate("alpha", 100, 100);
        threat.setThreat("charlie", 20);
        threat.setThreat("alpha", 20);

        var result = threat.selectTarget(List.of(charlie, alpha));
        assertSame(charlie, result.target());
        assertEquals(0.8, result.confidence(), 0.001);
    }

    @Test
    void testDeadCandidatesIgnoredAndDropped() {
        var threat = new ThreatManager();
        var dead = candidate("dead", 0, 100);
        var alive = candidate("alive", 100, 100);
        threat.setThreat("dead", 99);
        threat.setThreat("alive", 1);

        assertSame(alive, threat.selectTarget(List.of(dead, alive)).target());
        assertFalse(threat.hasThreat("dead"));
    }

    @Test
    void testNoTargetCases() {
        var threat = new ThreatManager();
        var empty = threat.selectTarget(List.<Targetable>of());
        assertFalse(empty.hasTarget());
        assertEquals(0.0, empty.confidence());

        var disabled = new ThreatManager(ThreatConfig.builder().withEnabled(false).build());
        var result = disabled.selectTarget(List.of(candidate("a", 10, 10)));
        assertFalse(result.hasTarget());
        assertEquals("Threat system disabled", result.reason());
    }

    @Test
    void testSelectionIsTracked() {
        var threat = new ThreatManager();
        var a = candidate("a", 10, 10);
        threat.selectTarget(List.of(a));
        assertTrue(threat.wasRecentlyTargeted("a"));
        verify(a, atLeastOnce()).isAlive();
    }

    @Test
    void testPeekDoesNotTrack() {
        var threat = new ThreatManager();
        var a = candidate("a", 10, 10);
        var b = candidate("b", 10, 10);
        threat.setThreat("a", 50);
        threat.setThreat("b", 5);

        assertSame(a, threat.peekTarget(List.of(a, b)).target());
        assertFalse(threat.wasRecentlyTargeted("a"));
        // Peeking twice in one round keeps the leader
        assertSame(a, threat.peekTarget(List.of(a, b)).target());

        threat.trackTarget("a");
        assertSame(b, threat.peekTarget(List.of(a, b)).target());
    }
}
