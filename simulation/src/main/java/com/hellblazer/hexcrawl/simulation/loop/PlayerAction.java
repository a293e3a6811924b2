package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ActionKind;

/**
 * An action a player submits for the current round.
 * <p>
 * Which fields are required depends on the kind: MOVE needs a destination, ATTACK a target id, ABILITY an ability id
 * (and usually a target id). Missing fields are reported by {@link GameLoop#submitPlayerAction}, not here.
 *
 * @author hal.hildebrand
 */
public record PlayerAction(String playerId, ActionKind kind, HexCoordinate destination, String targetId,
                           String abilityId) {

    public static PlayerAction move(String playerId, HexCoordinate destination) {
        return new PlayerAction(playerId, ActionKind.MOVE, destination, null, null);
    }

    public static PlayerAction attack(String playerId, String targetId) {
        return new PlayerAction(playerId, ActionKind.ATTACK, null, targetId, null);
    }

    /**
     * @param targetId null for abilities aimed at the caster
     */
    public static PlayerAction ability(String playerId, String abilityId, String targetId) {
        return new PlayerAction(playerId, ActionKind.ABILITY, null, targetId, abilityId);
    }

    public static PlayerAction waitTurn(String playerId) {
        return new PlayerAction(playerId, ActionKind.WAIT, null, null, null);
    }
}
