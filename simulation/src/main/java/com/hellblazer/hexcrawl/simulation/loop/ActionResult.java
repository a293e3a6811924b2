package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ActionKind;

import java.util.List;

/**
 * Outcome of one entity's action in a round.
 *
 * @param entityId     the actor
 * @param kind         what it tried to do
 * @param success      false if the action was refused or failed
 * @param reason       why it failed, null on success
 * @param targetId     primary target, if any
 * @param abilityId    ability used, if any
 * @param damageDealt  hit points removed across all targets
 * @param healingDone  hit points restored across all targets
 * @param newPosition  position after a successful move
 * @param targetsHit   entities affected
 * @param effects      status effects applied, as "target:effect"
 * @author hal.hildebrand
 */
public record ActionResult(String entityId, ActionKind kind, boolean success, String reason, String targetId,
                           String abilityId, int damageDealt, int healingDone, HexCoordinate newPosition,
                           List<String> targetsHit, List<String> effects) {

    public ActionResult {
        targetsHit = targetsHit == null ? List.of() : List.copyOf(targetsHit);
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    public static ActionResult failed(String entityId, ActionKind kind, String reason) {
        return new ActionResult(entityId, kind, false, reason, null, null, 0, 0, null, List.of(), List.of());
    }

    public static ActionResult waited(String entityId) {
        return new ActionResult(entityId, ActionKind.WAIT, true, null, null, null, 0, 0, null, List.of(), List.of());
    }

    public static ActionResult moved(String entityId, HexCoordinate position) {
        return new ActionResult(entityId, ActionKind.MOVE, true, null, null, null, 0, 0, position, List.of(),
                                List.of());
    }

    public static ActionResult attacked(String entityId, String targetId, int damage) {
        return new ActionResult(entityId, ActionKind.ATTACK, true, null, targetId, null, damage, 0, null,
                                List.of(targetId), List.of());
    }
}
