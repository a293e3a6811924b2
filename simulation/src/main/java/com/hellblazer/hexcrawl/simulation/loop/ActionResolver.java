package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.grid.HexLines;
import com.hellblazer.hexcrawl.simulation.ActionKind;
import com.hellblazer.hexcrawl.simulation.ai.AIDecision;
import com.hellblazer.hexcrawl.simulation.entity.AbilityDefinition;
import com.hellblazer.hexcrawl.simulation.entity.AbilityKind;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;
import com.hellblazer.hexcrawl.simulation.entity.Monster;
import com.hellblazer.hexcrawl.simulation.entity.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Applies player actions and monster decisions to the {@link GameState}.
 * <p>
 * Refusals come back as failed {@link ActionResult}s. A runtime failure inside one action is logged and reported the
 * same way so the rest of the round still resolves.
 *
 * @author hal.hildebrand
 */
class ActionResolver {
    private static final Logger log = LoggerFactory.getLogger(ActionResolver.class);

    private final GameState state;
    private final Random    random;

    ActionResolver(GameState state, Random random) {
        this.state = state;
        this.random = random;
    }

    ActionResult resolve(Player player, PlayerAction action) {
        try {
            return switch (action.kind()) {
                case MOVE -> move(player, action.destination());
                case ATTACK -> attack(player, action.targetId());
                case ABILITY -> ability(player, action.abilityId(), action.targetId());
                case WAIT -> ActionResult.waited(player.getId());
            };
        } catch (RuntimeException e) {
            log.warn("Action {} of {} failed", action.kind(), player.getId(), e);
            return ActionResult.failed(player.getId(), action.kind(), "Action failed: " + e.getMessage());
        } finally {
            state.rebuildOccupied();
        }
    }

    ActionResult resolve(Monster monster, AIDecision decision) {
        try {
            return switch (decision.kind()) {
                case MOVE -> move(monster, ((AIDecision.Move) decision).destination());
                case ATTACK -> attack(monster, ((AIDecision.Attack) decision).targetId());
                case ABILITY -> {
                    var use = (AIDecision.UseAbility) decision;
                    yield ability(monster, use.abilityId(), use.targetId());
                }
                case WAIT -> ActionResult.waited(monster.getId());
            };
        } catch (RuntimeException e) {
            log.warn("Decision {} of {} failed", decision.kind(), monster.getId(), e);
            return ActionResult.failed(monster.getId(), decision.kind(), "Action failed: " + e.getMessage());
        } finally {
            state.rebuildOccupied();
        }
    }

    private ActionResult move(CombatEntity actor, HexCoordinate destination) {
        if (!actor.canAct()) {
            return ActionResult.failed(actor.getId(), ActionKind.MOVE, "Cannot act due to status effects");
        }
        if (destination == null) {
            return ActionResult.failed(actor.getId(), ActionKind.MOVE, "Move action requires a destination");
        }
        var result = actor.moveTo(destination, state.getOccupied(), state.getObstacles());
        if (!result.success()) {
            return ActionResult.failed(actor.getId(), ActionKind.MOVE, result.reason());
        }
        log.debug("{} moved to {}", actor.getId(), result.position().toDisplayString());
        return ActionResult.moved(actor.getId(), result.position());
    }

    private ActionResult attack(CombatEntity actor, String targetId) {
        if (!actor.canAct()) {
            return ActionResult.failed(actor.getId(), ActionKind.ATTACK, "Cannot act due to status effects");
        }
        var found = state.findEntity(targetId);
        if (found.isEmpty()) {
            return ActionResult.failed(actor.getId(), ActionKind.ATTACK, "Target " + targetId + " not found");
        }
        var target = found.get();
        var refusal = refuseOpponent(actor, target);
        if (refusal != null) {
            return ActionResult.failed(actor.getId(), ActionKind.ATTACK, refusal);
        }
        var distance = actor.distanceTo(target);
        if (distance > AbilityDefinition.BASIC_ATTACK.range()) {
            return ActionResult.failed(actor.getId(), ActionKind.ATTACK,
                                       "Target out of range (distance: " + distance + ")");
        }
        var damage = target.takeDamage(actor.calculateDamageOutput(), actor.getName() + " attack");
        if (actor instanceof Player && target instanceof Monster monster) {
            monster.recordPlayerAttack(actor, damage.dealt());
        }
        log.debug("{} hit {} for {}{}", actor.getId(), target.getId(), damage.dealt(),
                  damage.died() ? " (killed)" : "");
        return ActionResult.attacked(actor.getId(), target.getId(), damage.dealt());
    }

    private ActionResult ability(CombatEntity actor, String abilityId, String targetId) {
        if (!actor.canAct()) {
            return ActionResult.failed(actor.getId(), ActionKind.ABILITY, "Cannot act due to status effects");
        }
        if (abilityId == null) {
            return ActionResult.failed(actor.getId(), ActionKind.ABILITY, "Ability action requires an ability id");
        }
        var book = actor.getAbilities();
        var unusable = book.checkUsable(abilityId);
        if (unusable.isPresent()) {
            return ActionResult.failed(actor.getId(), ActionKind.ABILITY, unusable.get());
        }
        var ability = book.get(abilityId).orElseThrow();
        if (AbilityDefinition.WAIT_ID.equals(abilityId)) {
            return ActionResult.waited(actor.getId());
        }
        if (AbilityDefinition.BASIC_ATTACK_ID.equals(abilityId)) {
            return attack(actor, targetId);
        }

        var offensive = ability.kind() == AbilityKind.ATTACK;
        CombatEntity target;
        if (targetId == null) {
            if (offensive) {
                return ActionResult.failed(actor.getId(), ActionKind.ABILITY,
                                           "Ability '" + ability.name() + "' requires a target");
            }
            target = actor;
        } else {
            var found = state.findEntity(targetId);
            if (found.isEmpty()) {
                return ActionResult.failed(actor.getId(), ActionKind.ABILITY, "Target " + targetId + " not found");
            }
            target = found.get();
        }
        var refusal = offensive ? refuseOpponent(actor, target) : refuseFriend(actor, target);
        if (refusal != null) {
            return ActionResult.failed(actor.getId(), ActionKind.ABILITY, refusal);
        }
        if (!HexLines.isValidAbilityTarget(actor.getPosition(), target.getPosition(), ability.range(),
                                           state.getObstacles())) {
            return ActionResult.failed(actor.getId(), ActionKind.ABILITY,
                                       String.format("Target out of range or sight (distance: %d, max: %d)",
                                                     actor.distanceTo(target), ability.range()));
        }

        book.use(abilityId);
        var affected = affected(actor, target, ability);
        var damageByTarget = new LinkedHashMap<String, Integer>();
        var effects = new ArrayList<String>();
        var totalDamage = 0;
        var totalHealing = 0;
        for (var hit : affected) {
            switch (ability.kind()) {
                case ATTACK -> {
                    var dealt = hit.takeDamage(actor.calculateDamageOutput(ability.damage()), ability.name()).dealt();
                    damageByTarget.put(hit.getId(), dealt);
                    totalDamage += dealt;
                }
                case HEALING -> totalHealing += hit.heal(ability.healing()).healed();
                default -> {
                }
            }
            for (var application : ability.statusEffects()) {
                if (application.chance() < 1.0 && random.nextDouble() >= application.chance()) {
                    continue;
                }
                var applied = hit.applyStatusEffect(application.type(), application.duration(),
                                                    application.value());
                if (applied.success()) {
                    effects.add(hit.getId() + ":" + application.type().effectName());
                }
            }
        }
        if (actor instanceof Player) {
            feedThreat(actor, abilityId, damageByTarget, totalDamage, affected.size(), totalHealing);
        }
        log.debug("{} used {} on {}: damage {}, healing {}, effects {}", actor.getId(), abilityId, target.getId(),
                  totalDamage, totalHealing, effects);
        return new ActionResult(actor.getId(), ActionKind.ABILITY, true, null, target.getId(), abilityId,
                                totalDamage, totalHealing, null, affected.stream().map(CombatEntity::getId).toList(),
                                effects);
    }

    /**
     * The target, plus every living entity on the target's side within the area of effect around it.
     */
    private List<CombatEntity> affected(CombatEntity actor, CombatEntity target, AbilityDefinition ability) {
        if (!ability.isAreaOfEffect()) {
            return List.of(target);
        }
        var result = new ArrayList<CombatEntity>();
        result.add(target);
        for (var entity : state.getAllEntities()) {
            if (entity == target || !entity.isAlive() || entity.getKind() != target.getKind()) {
                continue;
            }
            if (ability.kind() == AbilityKind.ATTACK && (entity == actor || !entity.canBeTargeted())) {
                continue;
            }
            if (entity.getPosition().distance(target.getPosition()) <= ability.areaOfEffect()) {
                result.add(entity);
            }
        }
        return result;
    }

    private void feedThreat(CombatEntity player, String abilityId, Map<String, Integer> damageByTarget,
                            int totalDamage, int targetsHit, int totalHealing) {
        for (var monster : state.getMonsters()) {
            var dealt = damageByTarget.getOrDefault(monster.getId(), 0);
            if (dealt > 0) {
                monster.recordPlayerAbility(player, abilityId, dealt, totalDamage, targetsHit);
            }
            if (totalHealing > 0 && monster.isAlive()) {
                monster.recordPlayerHealing(player, totalHealing);
            }
        }
    }

    private static String refuseOpponent(CombatEntity actor, CombatEntity target) {
        if (!target.isAlive()) {
            return "Target " + target.getName() + " is already dead";
        }
        if (target.getKind() == actor.getKind()) {
            return "Cannot attack an ally";
        }
        if (!target.canBeTargeted()) {
            return "Target " + target.getName() + " cannot be targeted";
        }
        return null;
    }

    private static String refuseFriend(CombatEntity actor, CombatEntity target) {
        if (!target.isAlive()) {
            return "Target " + target.getName() + " is dead";
        }
        if (target.getKind() != actor.getKind()) {
            return "Ability can only target allies";
        }
        return null;
    }
}
