package com.hellblazer.hexcrawl.simulation.threat;

import java.util.Collection;
import java.util.Optional;

/**
 * Factories for the threat updates produced by each kind of player action, plus the arithmetic used to project and
 * compare scores.
 * <p>
 * Usage:
 * <pre>
 * monster.getThreatManager().addThreat(ThreatCalculator.attack(player.getId(), 12, player.getEffectiveArmor()));
 * var level = ThreatCalculator.level(monster.getThreatManager().getThreat(player.getId()));
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class ThreatCalculator {

    /** Scaling applied to area damage per target hit, never below 1 */
    public static final double AOE_TARGET_FACTOR = 0.5;

    private ThreatCalculator() {
    }

    /**
     * Single-target attack: the whole hit landed on this monster.
     */
    public static ThreatUpdate attack(String playerId, double damageDealt, double playerArmor) {
        return new ThreatUpdate(playerId, damageDealt, damageDealt, 0, playerArmor, "attack");
    }

    public static ThreatUpdate healing(String playerId, double healingAmount, double playerArmor) {
        return new ThreatUpdate(playerId, 0, 0, healingAmount, playerArmor, "healing");
    }

    public static ThreatUpdate ability(String playerId, double damageToMonster, double totalDamage, double healingDone,
                                       double playerArmor, String abilityId) {
        return new ThreatUpdate(playerId, damageToMonster, totalDamage, healingDone, playerArmor,
                                "ability:" + abilityId);
    }

    /**
     * Area damage. Total damage is scaled by max(1, targetsHit x 0.5) so sweeping many enemies draws more attention.
     */
    public static ThreatUpdate areaOfEffect(String playerId, double damageToMonster, double totalDamage,
                                            int targetsHit, double playerArmor, String abilityId) {
        var multiplier = Math.max(1.0, targetsHit * AOE_TARGET_FACTOR);
        return new ThreatUpdate(playerId, damageToMonster, totalDamage * multiplier, 0, playerArmor,
                                "aoe:" + abilityId);
    }

    /**
     * Shields, taunts and armor buffs: the prevented damage counts as dealt damage.
     */
    public static ThreatUpdate defensive(String playerId, double defensiveValue, double playerArmor,
                                         String abilityId) {
        return new ThreatUpdate(playerId, 0, defensiveValue, 0, playerArmor, "defensive:" + abilityId);
    }

    /**
     * Buffs on allies: the estimated value counts as healing.
     */
    public static ThreatUpdate support(String playerId, double supportValue, double playerArmor, String abilityId) {
        return new ThreatUpdate(playerId, 0, 0, supportValue, playerArmor, "support:" + abilityId);
    }

    public static double rawThreat(ThreatUpdate update, ThreatConfig config) {
        return update.rawThreat(config);
    }

    public static double combine(Collection<ThreatUpdate> updates, ThreatConfig config) {
        var total = 0.0;
        for (var update : updates) {
            total += update.rawThreat(config);
        }
        return total;
    }

    /**
     * @return threat after {@code rounds} applications of the decay rate
     */
    public static double decay(double threat, double decayRate, int rounds) {
        var result = threat;
        for (int i = 0; i < rounds; i++) {
            result *= 1.0 - decayRate;
        }
        return result;
    }

    /**
     * Scale a score to 0..100 against the largest score observed.
     */
    public static double normalize(double threat, double maxObserved) {
        if (maxObserved <= 0) {
            return 0.0;
        }
        return Math.min(100.0, threat / maxObserved * 100.0);
    }

    /**
     * Average threat per recent update, projected {@code roundsAhead} rounds and decayed over the same span.
     */
    public static double estimateFuture(Collection<ThreatUpdate> recent, ThreatConfig config, int roundsAhead) {
        if (recent.isEmpty()) {
            return 0.0;
        }
        var average = combine(recent, config) / recent.size();
        return decay(average * roundsAhead, config.getDecayRate(), roundsAhead);
    }

    public static ThreatLevel level(double threat) {
        return ThreatLevel.of(threat);
    }

    /**
     * @return the reason the update is malformed, or empty if it is acceptable
     */
    public static Optional<String> validate(ThreatUpdate update) {
        if (update.targetId().isBlank()) {
            return Optional.of("Player ID is required");
        }
        if (update.damageToMonster() < 0 || update.totalDamageDealt() < 0 || update.healingDone() < 0) {
            return Optional.of("Threat values cannot be negative");
        }
        if (update.playerArmor() < 0) {
            return Optional.of("Player armor cannot be negative");
        }
        if (update.totalDamageDealt() < update.damageToMonster()) {
            return Optional.of("Total damage cannot be less than damage to self");
        }
        return Optional.empty();
    }
}
