package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.simulation.entity.RoundUpkeep;

import java.util.List;
import java.util.Optional;

/**
 * What happened in one round.
 *
 * @param round         the round that was processed, or the current round for an empty result
 * @param actions       action outcomes in resolution order
 * @param upkeep        end of round status effect and cooldown outcomes, per living entity
 * @param gameEnded     true if this round ended the encounter
 * @param winner        set when the encounter ended
 * @param endReason     set when the encounter ended
 * @author hal.hildebrand
 */
public record RoundResult(int round, List<ActionResult> actions, List<RoundUpkeep> upkeep, boolean gameEnded,
                          Winner winner, String endReason) {

    public RoundResult {
        actions = List.copyOf(actions);
        upkeep = List.copyOf(upkeep);
    }

    /**
     * Result of a call that processed nothing.
     */
    public static RoundResult empty(int round) {
        return new RoundResult(round, List.of(), List.of(), false, null, null);
    }

    public Optional<Winner> getWinner() {
        return Optional.ofNullable(winner);
    }

    public boolean isEmpty() {
        return actions.isEmpty() && upkeep.isEmpty() && !gameEnded;
    }
}
