package com.hellblazer.hexcrawl.simulation.threat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-monster threat table.
 * <p>
 * Players accumulate threat against a monster by damaging it, by damaging others and by healing. Every round each
 * score decays by {@link ThreatConfig#getDecayRate()} and scores that fall below {@link #MINIMUM_THREAT} are
 * dropped, so the table reflects recent behavior. {@link #selectTarget(List)} ranks candidates by score and keeps a
 * short memory of its own picks to avoid hitting the same player every round when alternatives exist.
 * <p>
 * One instance belongs to exactly one monster. Not thread-safe.
 * <p>
 * Usage:
 * <pre>
 * var threat = new ThreatManager(ThreatConfig.defaultConfig());
 * threat.addThreat(ThreatCalculator.attack("p1", 20, 2));   // 20 + 2 x 20 x 0.5 = 40
 * var result = threat.selectTarget(players);
 * threat.processRound();                                     // decay
 * </pre>
 *
 * @author hal.hildebrand
 */
public class ThreatManager {
    private static final Logger log = LoggerFactory.getLogger(ThreatManager.class);

    /** Scores below this read as zero and are removed at decay time */
    public static final double MINIMUM_THREAT = 0.1;

    /** Updates retained per target */
    public static final int MAX_HISTORY = 10;

    private final ThreatConfig config;
    private final Map<String, Row> table = new LinkedHashMap<>();
    private final Map<String, Deque<ThreatUpdate>> history = new LinkedHashMap<>();
    private final Map<String, Long> lastTargeted = new LinkedHashMap<>();
    private final TargetSelector selector;
    private long round;

    public ThreatManager() {
        this(ThreatConfig.defaultConfig());
    }

    public ThreatManager(ThreatConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.selector = new TargetSelector(this);
    }

    /**
     * Record a threat-producing event. Ignored while disabled and when the event produces no positive threat.
     */
    public void addThreat(ThreatUpdate update) {
        if (!config.isEnabled()) {
            return;
        }
        var raw = update.rawThreat(config);
        if (raw > 0) {
            var row = table.computeIfAbsent(update.targetId(), id -> new Row());
            row.threat += raw;
            row.lastUpdatedRound = round;
            log.debug("Threat +{} on {} from {} (now {})", String.format("%.2f", raw), update.targetId(),
                      update.source(), String.format("%.2f", row.threat));
        }
        var updates = history.computeIfAbsent(update.targetId(), id -> new ArrayDeque<>());
        updates.addLast(update);
        while (updates.size() > MAX_HISTORY) {
            updates.removeFirst();
        }
    }

    /**
     * @return current score, 0 if the target has none
     */
    public double getThreat(String targetId) {
        var row = table.get(targetId);
        return row == null ? 0.0 : row.threat;
    }

    /**
     * Overwrite a score. Values at or below {@link #MINIMUM_THREAT} remove the row.
     */
    public void setThreat(String targetId, double value) {
        if (value <= MINIMUM_THREAT) {
            table.remove(targetId);
            return;
        }
        var row = table.computeIfAbsent(targetId, id -> new Row());
        row.threat = value;
        row.lastUpdatedRound = round;
    }

    public void clearThreat(String targetId) {
        table.remove(targetId);
        history.remove(targetId);
        lastTargeted.remove(targetId);
    }

    public void clearAllThreat() {
        table.clear();
        history.clear();
        lastTargeted.clear();
    }

    /**
     * Drop every row, history and targeting memory for ids not in {@code targetIds}.
     */
    public void retainTargets(Set<String> targetIds) {
        table.keySet().retainAll(targetIds);
        history.keySet().retainAll(targetIds);
        lastTargeted.keySet().retainAll(targetIds);
    }

    /**
     * End of round: advance the table clock and decay every score.
     */
    public void processRound() {
        round++;
        var decay = 1.0 - config.getDecayRate();
        var iterator = table.entrySet().iterator();
        while (iterator.hasNext()) {
            var entry = iterator.next();
            var row = entry.getValue();
            row.threat *= decay;
            if (row.threat < MINIMUM_THREAT) {
                log.debug("Threat on {} decayed below threshold", entry.getKey());
                iterator.remove();
            }
        }
    }

    /**
     * Choose a target among the candidates.
     *
     * @param candidates living and dead candidates in roster order
     * @return the choice with its reason and confidence, never null
     */
    public <T extends Targetable> TargetingResult<T> selectTarget(List<T> candidates) {
        var result = peekTarget(candidates);
        if (result.hasTarget()) {
            trackTarget(result.target().getId());
            log.debug("Selected {} ({}, confidence {})", result.target().getId(), result.reason(),
                      result.confidence());
        }
        return result;
    }

    /**
     * Rank the candidates as {@link #selectTarget} would, without remembering the choice. Callers that may discard
     * the choice report the target they commit to through {@link #trackTarget}.
     */
    public <T extends Targetable> TargetingResult<T> peekTarget(List<T> candidates) {
        return selector.select(candidates);
    }

    /**
     * Remember that {@code targetId} was picked this round.
     */
    public void trackTarget(String targetId) {
        lastTargeted.put(targetId, round);
    }

    /**
     * @return true if {@code targetId} was picked within the last {@link ThreatConfig#getAvoidLastTargetRounds()}
     * rounds
     */
    public boolean wasRecentlyTargeted(String targetId) {
        var avoid = config.getAvoidLastTargetRounds();
        if (avoid <= 0) {
            return false;
        }
        var when = lastTargeted.get(targetId);
        return when != null && round - when <= avoid;
    }

    /**
     * @return up to {@code count} rows, highest score first
     */
    public List<ThreatEntry> getTopThreats(int count) {
        return getEntries().stream()
                           .sorted(Comparator.comparingDouble(ThreatEntry::threat).reversed())
                           .limit(Math.max(0, count))
                           .toList();
    }

    /**
     * @return every row in insertion order
     */
    public List<ThreatEntry> getEntries() {
        var result = new ArrayList<ThreatEntry>(table.size());
        table.forEach((id, row) -> {
            var updates = history.get(id);
            result.add(new ThreatEntry(id, row.threat, row.lastUpdatedRound, updates == null ? 0 : updates.size()));
        });
        return result;
    }

    /**
     * @return retained updates for the target, oldest first
     */
    public List<ThreatUpdate> getThreatHistory(String targetId) {
        var updates = history.get(targetId);
        return updates == null ? List.of() : List.copyOf(updates);
    }

    /**
     * @return raw threat summed over the retained history, ignoring decay
     */
    public double getTotalThreatGenerated(String targetId) {
        return ThreatCalculator.combine(getThreatHistory(targetId), config);
    }

    public boolean hasThreat(String targetId) {
        return table.containsKey(targetId);
    }

    public int size() {
        return table.size();
    }

    /**
     * Forget everything: scores, history, targeting memory and the round clock.
     */
    public void resetForEncounter() {
        clearAllThreat();
        round = 0;
    }

    public ThreatConfig getConfig() {
        return config;
    }

    public long getRound() {
        return round;
    }

    /**
     * @return snapshot of the table for debugging and display
     */
    public ThreatSnapshot snapshot() {
        return new ThreatSnapshot(round, getTopThreats(table.size()), Map.copyOf(lastTargeted), config.isEnabled());
    }

    /**
     * Snapshot of a threat table.
     *
     * @param round        table clock
     * @param entries      rows, highest first
     * @param lastTargeted target id to the round it was last picked
     * @param enabled      whether the table is accepting updates
     */
    public record ThreatSnapshot(long round, List<ThreatEntry> entries, Map<String, Long> lastTargeted,
                                 boolean enabled) {
    }

    private static final class Row {
        private double threat;
        private long   lastUpdatedRound;
    }

    @Override
    public String toString() {
        return String.format("ThreatManager[round=%d, targets=%d, enabled=%s]", round, table.size(),
                             config.isEnabled());
    }
}
