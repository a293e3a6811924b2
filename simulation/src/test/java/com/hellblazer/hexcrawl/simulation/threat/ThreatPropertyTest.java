package com.hellblazer.hexcrawl.simulation.threat;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import org.junit.jupiter.api.DisplayName;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Threat Table Property-Based Tests")
class ThreatPropertyTest {

    private static final String[] IDS = { "p1", "p2", "p3", "p4", "p5" };

    @Property(tries = 100)
    @Label("Scores stay positive and history stays bounded")
    void scoresPositiveAndHistoryBounded(@ForAll @Size(min = 1, max = 40) List<@IntRange(min = 0, max = 4) Integer> who,
                                         @ForAll @IntRange(min = 0, max = 50) int damage) {
        var threat = new ThreatManager();
        for (var index : who) {
            threat.addThreat(ThreatCalculator.attack(IDS[index], damage, 2));
        }
        for (var id : IDS) {
            assertTrue(threat.getThreat(id) >= 0.0);
            assertTrue(threat.getThreatHistory(id).size() <= ThreatManager.MAX_HISTORY);
        }
    }

    @Property(tries = 100)
    @Label("Decay lowers every score and drops rows below the threshold")
    void decayLowersEveryScore(@ForAll @Size(min = 1, max = 5) List<@IntRange(min = 1, max = 100) Integer> damages,
                               @ForAll @IntRange(min = 1, max = 30) int rounds) {
        var threat = new ThreatManager();
        for (int i = 0; i < damages.size(); i++) {
            threat.addThreat(ThreatCalculator.attack(IDS[i], damages.get(i), 0));
        }
        for (int round = 0; round < rounds; round++) {
            var before = new double[damages.size()];
            for (int i = 0; i < damages.size(); i++) {
                before[i] = threat.getThreat(IDS[i]);
            }
            threat.processRound();
            for (int i = 0; i < damages.size(); i++) {
                var after = threat.getThreat(IDS[i]);
                if (before[i] > 0.0) {
                    assertTrue(after < before[i]);
                }
                assertTrue(after == 0.0 || after >= ThreatManager.MINIMUM_THREAT);
            }
        }
    }

    @Property(tries = 100)
    @Label("A fresh table always picks a living candidate with the top score")
    void selectsTopScore(@ForAll @Size(min = 1, max = 5) List<@IntRange(min = 0, max = 60) Integer> damages) {
        var threat = new ThreatManager();
        var candidates = new ArrayList<Candidate>();
        for (int i = 0; i < damages.size(); i++) {
            candidates.add(new Candidate(IDS[i], 10 + i));
            threat.addThreat(ThreatCalculator.attack(IDS[i], damages.get(i), 0));
        }

        var result = threat.selectTarget(candidates);
        assertTrue(result.hasTarget());

        var best = candidates.stream().mapToDouble(c -> threat.getThreat(c.getId())).max().orElse(0.0);
        if (best > ThreatManager.MINIMUM_THREAT) {
            assertEquals(best, threat.getThreat(result.target().getId()), TargetSelector.TIE_TOLERANCE);
        } else {
            // No scores: lowest HP fraction, which is the first candidate here
            assertEquals("p1", result.target().getId());
        }
    }

    private static final class Candidate implements Targetable {
        private final String id;
        private final int    hp;

        Candidate(String id, int hp) {
            this.id = id;
            this.hp = hp;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public int getCurrentHp() {
            return hp;
        }

        @Override
        public int getMaxHp() {
            return 100;
        }

        @Override
        public boolean isAlive() {
            return true;
        }
    }
}
