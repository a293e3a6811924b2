package com.hellblazer.hexcrawl.simulation.threat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThreatCalculatorTest {

    private final ThreatConfig config = ThreatConfig.defaultConfig();

    @Test
    void testAreaOfEffectScaling() {
        // Four targets hit: total damage x max(1, 4 x 0.5) = x2
        var update = ThreatCalculator.areaOfEffect("p1", 10, 40, 4, 0, "fireball");
        assertEquals(80.0, update.totalDamageDealt(), 0.001);
        assertEquals("aoe:fireball", update.source());

        // One target hit never scales below x1
        var single = ThreatCalculator.areaOfEffect("p1", 10, 10, 1, 0, "fireball");
        assertEquals(10.0, single.totalDamageDealt(), 0.001);
    }

    @Test
    void testDefensiveAndSupportWeights() {
        assertEquals(12.0, ThreatCalculator.rawThreat(ThreatCalculator.defensive("p1", 12, 0, "shield"), config),
                     0.001);
        assertEquals(15.0, ThreatCalculator.rawThreat(ThreatCalculator.support("p1", 10, 0, "bless"), config), 0.001);
    }

    @Test
    void testDecayAndProjection() {
        assertEquals(81.0, ThreatCalculator.decay(100, 0.1, 2), 0.001);
        assertEquals(100.0, ThreatCalculator.decay(100, 0.1, 0), 0.001);

        var recent = List.of(ThreatCalculator.attack("p1", 10, 0), ThreatCalculator.attack("p1", 30, 0));
        assertEquals(40.0, ThreatCalculator.combine(recent, config), 0.001);
        // Average 20 per update, 2 rounds ahead: 40 x 0.9 x 0.9
        assertEquals(32.4, ThreatCalculator.estimateFuture(recent, config, 2), 0.001);
        assertEquals(0.0, ThreatCalculator.estimateFuture(List.of(), config, 2));
    }

    @Test
    void testNormalize() {
        assertEquals(50.0, ThreatCalculator.normalize(25, 50), 0.001);
        assertEquals(100.0, ThreatCalculator.normalize(80, 50), 0.001);
        assertEquals(0.0, ThreatCalculator.normalize(10, 0));
    }

    @ParameterizedTest
    @CsvSource({ "0, NONE", "-3, NONE", "10, LOW", "10.5, MEDIUM", "25, MEDIUM", "50, HIGH", "50.1, CRITICAL" })
    void testThreatLevels(double threat, ThreatLevel expected) {
        assertEquals(expected, ThreatCalculator.level(threat));
    }

    @Test
    void testValidation() {
        assertTrue(ThreatCalculator.validate(ThreatCalculator.attack("p1", 5, 1)).isEmpty());
        assertEquals("Player ID is required", ThreatCalculator.validate(ThreatCalculator.attack(" ", 5, 1)).orElseThrow());
        assertEquals("Threat values cannot be negative",
                     ThreatCalculator.validate(new ThreatUpdate("p1", -1, 0, 0, 0, "x")).orElseThrow());
        assertEquals("Player armor cannot be negative",
                     ThreatCalculator.validate(new ThreatUpdate("p1", 0, 0, 0, -1, "x")).orElseThrow());
        assertEquals("Total damage cannot be less than damage to self",
                     ThreatCalculator.validate(new ThreatUpdate("p1", 10, 5, 0, 0, "x")).orElseThrow());
    }
}
