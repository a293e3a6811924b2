package com.hellblazer.hexcrawl.simulation.threat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Target selection policy over a threat table.
 * <p>
 * Order of decisions:
 * - dead candidates are ignored and their rows dropped
 * - candidates picked within the avoidance window are skipped unless nobody else is left
 * - the highest score wins; scores within {@link #TIE_TOLERANCE} of the best are tied
 * - ties go to the lowest id with the tiebreaker on, otherwise to the first candidate in roster order
 * - with no scores at all, the lowest HP fraction wins (or the first candidate when that fallback is off)
 * <p>
 * Every branch is deterministic for a given table and candidate order.
 *
 * @author hal.hildebrand
 */
class TargetSelector {

    static final double TIE_TOLERANCE = 0.01;

    static final double CONFIDENCE_HIGHEST = 0.9;
    static final double CONFIDENCE_FIRST_OF_TIE = 0.8;
    static final double CONFIDENCE_TIEBREAK = 0.7;
    static final double CONFIDENCE_LOWEST_HP = 0.5;
    static final double CONFIDENCE_FIRST_AVAILABLE = 0.3;

    private final ThreatManager table;

    TargetSelector(ThreatManager table) {
        this.table = table;
    }

    <T extends Targetable> TargetingResult<T> select(List<T> candidates) {
        var config = table.getConfig();
        if (!config.isEnabled()) {
            return TargetingResult.none("Threat system disabled");
        }

        var living = new ArrayList<T>(candidates.size());
        for (var candidate : candidates) {
            if (candidate.isAlive()) {
                living.add(candidate);
            } else {
                table.clearThreat(candidate.getId());
            }
        }
        if (living.isEmpty()) {
            return TargetingResult.none("No available targets");
        }

        var eligible = living.stream().filter(c -> !table.wasRecentlyTargeted(c.getId())).toList();
        if (eligible.isEmpty()) {
            eligible = living;
        }

        var best = 0.0;
        for (var candidate : eligible) {
            best = Math.max(best, table.getThreat(candidate.getId()));
        }
        if (best <= ThreatManager.MINIMUM_THREAT) {
            return fallback(eligible, config.isFallbackToLowestHp());
        }

        var top = best;
        var tied = eligible.stream().filter(c -> table.getThreat(c.getId()) >= top - TIE_TOLERANCE).toList();
        if (tied.size() == 1) {
            var target = tied.get(0);
            return TargetingResult.of(target, String.format("Selected target with highest threat: %s (%.1f)",
                                                            target.getId(), top), CONFIDENCE_HIGHEST);
        }
        if (config.isEnableTiebreaker()) {
            var target = tied.stream().min(Comparator.comparing(Targetable::getId)).orElseThrow();
            return TargetingResult.of(target, String.format("Tie between %d targets broken by id: %s", tied.size(),
                                                            target.getId()), CONFIDENCE_TIEBREAK);
        }
        var target = tied.get(0);
        return TargetingResult.of(target,
                                  String.format("Tie between %d targets, first selected: %s", tied.size(),
                                                target.getId()), CONFIDENCE_FIRST_OF_TIE);
    }

    private <T extends Targetable> TargetingResult<T> fallback(List<T> eligible, boolean lowestHp) {
        if (lowestHp) {
            var target = eligible.stream()
                                 .min(Comparator.comparingDouble(Targetable::getHpFraction)
                                                .thenComparingInt(Targetable::getCurrentHp)
                                                .thenComparing(Targetable::getId))
                                 .orElseThrow();
            return TargetingResult.of(target, String.format("Lowest HP fallback: %s (%.0f%%)", target.getId(),
                                                            target.getHpFraction() * 100.0), CONFIDENCE_LOWEST_HP);
        }
        var target = eligible.get(0);
        return TargetingResult.of(target, "Fallback to first available target: " + target.getId(),
                                  CONFIDENCE_FIRST_AVAILABLE);
    }
}
