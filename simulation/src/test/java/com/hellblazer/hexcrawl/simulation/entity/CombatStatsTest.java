package com.hellblazer.hexcrawl.simulation.entity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for armor mitigation and hit point bookkeeping.
 *
 * @author hal.hildebrand
 */
class CombatStatsTest {

    private CombatStats stats;

    @BeforeEach
    void setUp() {
        stats = new CombatStats(new EntityStats(100, 3, 15, 3));
    }

    @Test
    void testArmorBlocksTenPercentPerPoint() {
        var result = stats.takeDamage(20, 3);
        assertEquals(6, result.blocked());
        assertEquals(14, result.dealt());
        assertFalse(result.died());
        assertEquals(86, stats.getCurrentHp());
    }

    @Test
    void testArmorReductionIsCapped() {
        var result = stats.takeDamage(10, 50);
        assertEquals(9, result.blocked());
        assertEquals(1, result.dealt());
    }

    @Test
    void testEveryHitRemovesAtLeastOnePoint() {
        var result = stats.takeDamage(1, 9);
        assertEquals(1, result.dealt());
        assertEquals(99, stats.getCurrentHp());
    }

    @Test
    void testOverkillStopsAtZero() {
        stats.setHp(10);
        var result = stats.takeDamage(50, 0);
        assertEquals(10, result.dealt());
        assertTrue(result.died());
        assertEquals(0, stats.getCurrentHp());
        assertFalse(stats.isAlive());

        assertSame(DamageResult.NONE, stats.takeDamage(10, 0));
    }

    @Test
    void testNonPositiveDamageIgnored() {
        assertSame(DamageResult.NONE, stats.takeDamage(0, 0));
        assertSame(DamageResult.NONE, stats.takeDamage(-5, 0));
        assertEquals(100, stats.getCurrentHp());
    }

    @Test
    void testHealingCappedAtMax() {
        stats.setHp(90);
        var result = stats.heal(20);
        assertEquals(10, result.healed());
        assertEquals(100, result.newHp());
    }

    @Test
    void testDeadCannotBeHealed() {
        stats.setHp(0);
        assertEquals(0, stats.heal(50).healed());
        assertEquals(0, stats.getCurrentHp());
    }

    @Test
    void testSetHpClamps() {
        stats.setHp(500);
        assertEquals(100, stats.getCurrentHp());
        stats.setHp(-4);
        assertEquals(0, stats.getCurrentHp());
    }

    @Test
    void testDamageOutputFloorsModifiedDamage() {
        assertEquals(15, stats.calculateDamageOutput(1.0));
        assertEquals(22, stats.calculateDamageOutput(1.5));
        assertEquals(11, CombatStats.calculateDamageOutput(15, 0.75));
    }

    @Test
    void testTemporaryArmorAndReset() {
        stats.addTemporaryArmor(4);
        assertEquals(7, stats.getArmor());
        stats.takeDamage(30, stats.getArmor());
        stats.reset();
        assertEquals(3, stats.getArmor());
        assertEquals(100, stats.getCurrentHp());
    }
}
