package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.grid.HexLines;
import com.hellblazer.hexcrawl.grid.HexPathfinder;
import com.hellblazer.hexcrawl.grid.HexRanges;
import com.hellblazer.hexcrawl.simulation.entity.AbilityDefinition;
import com.hellblazer.hexcrawl.simulation.entity.AbilityKind;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;
import com.hellblazer.hexcrawl.simulation.threat.TargetingResult;
import com.hellblazer.hexcrawl.simulation.threat.ThreatManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decision maker for one monster.
 * <p>
 * Each round the scripted {@link MonsterBehavior} rules are tried in descending priority; the first one whose
 * conditions hold and whose action can be carried out on the current board wins. Otherwise the {@link AIVariant}
 * policy decides:
 * <ul>
 * <li>AGGRESSIVE - threat target; attack if adjacent, else path toward it</li>
 * <li>DEFENSIVE - below 40% HP retreat to a defensive position, else counterattack adjacent enemies</li>
 * <li>TACTICAL - threat target; attack ability with line of sight, else close to an aggressive position</li>
 * <li>BERSERKER - weakest enemy, emergency priority below 50% HP</li>
 * <li>SUPPORT - heal the most wounded friend below 60%, else defensive</li>
 * <li>PASSIVE - only strike adjacent enemies</li>
 * </ul>
 * A {@link AIDecision.Move} destination is always reachable and unoccupied when the decision is made.
 *
 * @author hal.hildebrand
 */
public class MonsterAI {
    public static final int    MAX_HISTORY                 = 20;
    public static final double DEFENSIVE_RETREAT_THRESHOLD = 0.4;
    public static final double BERSERK_THRESHOLD           = 0.5;
    public static final double SUPPORT_HEAL_THRESHOLD      = 0.6;

    private static final Logger log = LoggerFactory.getLogger(MonsterAI.class);

    private final AIVariant             variant;
    private final List<MonsterBehavior> behaviors;
    private final HexPathfinder         pathfinder;
    private final Deque<AIDecision>     history = new ArrayDeque<>();

    // Threat-selected enemy the decision under evaluation commits to
    private String focus;

    public MonsterAI(AIVariant variant) {
        this(variant, List.of(), new HexPathfinder());
    }

    public MonsterAI(AIVariant variant, Collection<MonsterBehavior> behaviors) {
        this(variant, behaviors, new HexPathfinder());
    }

    public MonsterAI(AIVariant variant, Collection<MonsterBehavior> behaviors, HexPathfinder pathfinder) {
        this.variant = Objects.requireNonNull(variant, "variant");
        this.behaviors = behaviors.stream().sorted(MonsterBehavior.BY_PRIORITY).toList();
        this.pathfinder = Objects.requireNonNull(pathfinder, "pathfinder");
    }

    /**
     * Decide this round's action and remember it.
     *
     * @param self    the deciding monster
     * @param threat  the monster's threat table, consulted for target selection
     * @param context the visible board
     */
    public AIDecision decide(CombatEntity self, ThreatManager threat, DecisionContext context) {
        focus = null;
        var decision = evaluate(self, threat, context);
        if (focus != null) {
            threat.trackTarget(focus);
        }
        history.addLast(decision);
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
        log.debug("{} decided {}", self.getId(), decision);
        return decision;
    }

    public Optional<AIDecision> getLastDecision() {
        return Optional.ofNullable(history.peekLast());
    }

    public List<AIDecision> getDecisionHistory() {
        return List.copyOf(history);
    }

    public AIVariant getVariant() {
        return variant;
    }

    public List<MonsterBehavior> getBehaviors() {
        return behaviors;
    }

    public void reset() {
        history.clear();
    }

    private AIDecision evaluate(CombatEntity self, ThreatManager threat, DecisionContext context) {
        if (!self.canAct()) {
            return AIDecision.idle("Cannot act");
        }
        if (context.targetableEnemies().isEmpty()) {
            return AIDecision.idle("No enemies in sight");
        }
        for (var behavior : behaviors) {
            if (!behavior.matches(self, context)) {
                continue;
            }
            var decision = perform(behavior, self, threat, context);
            if (decision.isPresent()) {
                return decision.get();
            }
            log.trace("{}: behavior {} matched but could not be carried out", self.getId(), behavior.id());
        }
        return switch (variant) {
            case AGGRESSIVE -> aggressive(self, threat, context);
            case DEFENSIVE -> defensive(self, threat, context);
            case TACTICAL -> tactical(self, threat, context);
            case BERSERKER -> berserker(self, context);
            case SUPPORT -> support(self, threat, context);
            case PASSIVE -> passive(self, threat, context);
        };
    }

    private Optional<AIDecision> perform(MonsterBehavior behavior, CombatEntity self, ThreatManager threat,
                                         DecisionContext context) {
        var priority = behavior.priority();
        var reason = "Behavior " + behavior.name();
        return switch (behavior.action().type()) {
            case ATTACK_NEAREST -> nearestEnemy(self, context).map(
            target -> engage(self, target, priority, 1.0, reason, context));
            case FOCUS_WEAKEST -> weakestEnemy(context).map(
            target -> engage(self, target, priority, 1.0, reason, context));
            case RETREAT -> retreatHex(self, context).map(
            hex -> (AIDecision) new AIDecision.Move(hex, priority, 1.0, reason));
            case USE_ABILITY -> useAbility(((BehaviorAction.UseAbility) behavior.action()).abilityId(), self, threat,
                                           context, priority, reason);
            case MOVE_TO -> approachHex(self, ((BehaviorAction.MoveTo) behavior.action()).destination(), false,
                                        context).map(
            hex -> (AIDecision) new AIDecision.Move(hex, priority, 1.0, reason));
            case HOLD -> Optional.of(new AIDecision.Wait(priority, 1.0, reason));
        };
    }

    private AIDecision aggressive(CombatEntity self, ThreatManager threat, DecisionContext context) {
        var selection = choose(self, threat, context.targetableEnemies());
        if (!selection.hasTarget()) {
            return AIDecision.idle(selection.reason());
        }
        focus = selection.target().getId();
        return engage(self, selection.target(), AIPriority.HIGH, selection.confidence(), selection.reason(),
                      context);
    }

    private AIDecision defensive(CombatEntity self, ThreatManager threat, DecisionContext context) {
        if (self.getHpFraction() < DEFENSIVE_RETREAT_THRESHOLD) {
            var nearest = nearestEnemy(self, context);
            var hex = nearest.flatMap(enemy -> defensivePosition(self, enemy, context))
                             .or(() -> retreatHex(self, context));
            if (hex.isPresent()) {
                return new AIDecision.Move(hex.get(), AIPriority.EMERGENCY, 0.9, "Retreating at low health");
            }
        }
        var adjacent = adjacentEnemies(self, context);
        if (!adjacent.isEmpty()) {
            var selection = choose(self, threat, adjacent);
            if (selection.hasTarget()) {
                focus = selection.target().getId();
                return new AIDecision.Attack(selection.target().getId(), AIPriority.MEDIUM, selection.confidence(),
                                             "Counterattacking adjacent enemy");
            }
        }
        return new AIDecision.Wait(AIPriority.LOW, 0.8, "Holding position");
    }

    private AIDecision tactical(CombatEntity self, ThreatManager threat, DecisionContext context) {
        var selection = choose(self, threat, context.targetableEnemies());
        if (!selection.hasTarget()) {
            return AIDecision.idle(selection.reason());
        }
        var target = selection.target();
        focus = target.getId();
        var ability = bestAttackAbility(self, target, context);
        if (ability.isPresent()) {
            return attackWith(ability.get(), target, AIPriority.HIGH, selection.confidence(),
                              "Attacking with " + ability.get().name());
        }
        if (self.canMove() && !self.hasMovedThisRound()) {
            var reachable = reachableFrom(self, context);
            var position = HexRanges.tacticalPositions(self.getPosition(), target.getPosition(),
                                                       self.getMovementRange())
                                    .aggressive()
                                    .stream()
                                    .filter(hex -> !hex.equals(self.getPosition()) && reachable.containsKey(hex))
                                    .findFirst();
            if (position.isPresent()) {
                return new AIDecision.Move(position.get(), AIPriority.MEDIUM, selection.confidence(),
                                           "Moving to tactical position");
            }
        }
        return engage(self, target, AIPriority.MEDIUM, selection.confidence(), selection.reason(), context);
    }

    private AIDecision berserker(CombatEntity self, DecisionContext context) {
        var target = weakestEnemy(context);
        if (target.isEmpty()) {
            return AIDecision.idle("No enemies in sight");
        }
        var priority = self.getHpFraction() < BERSERK_THRESHOLD ? AIPriority.EMERGENCY : AIPriority.HIGH;
        return engage(self, target.get(), priority, 0.9, "Hunting the weakest enemy", context);
    }

    private AIDecision support(CombatEntity self, ThreatManager threat, DecisionContext context) {
        var heals = self.getAbilities().getAvailable(AbilityKind.HEALING);
        var wounded = new ArrayList<CombatEntity>(context.livingAllies());
        wounded.add(self);
        wounded.sort(Comparator.comparingDouble(CombatEntity::getHpFraction).thenComparing(CombatEntity::getId));
        for (var friend : wounded) {
            if (friend.getHpFraction() >= SUPPORT_HEAL_THRESHOLD) {
                break;
            }
            for (var heal : heals) {
                if (HexLines.isValidAbilityTarget(self.getPosition(), friend.getPosition(), heal.range(),
                                                  context.obstacles())) {
                    return new AIDecision.UseAbility(heal.id(), friend.getId(), AIPriority.HIGH, 0.9,
                                                     "Healing " + friend.getName());
                }
            }
        }
        return defensive(self, threat, context);
    }

    private AIDecision passive(CombatEntity self, ThreatManager threat, DecisionContext context) {
        var adjacent = adjacentEnemies(self, context);
        if (adjacent.isEmpty()) {
            return AIDecision.idle("Nothing within reach");
        }
        var selection = choose(self, threat, adjacent);
        if (!selection.hasTarget()) {
            return AIDecision.idle(selection.reason());
        }
        focus = selection.target().getId();
        return new AIDecision.Attack(selection.target().getId(), AIPriority.LOW, selection.confidence(),
                                     "Striking adjacent enemy");
    }

    /**
     * Attack the target when adjacent, otherwise close the distance.
     */
    private AIDecision engage(CombatEntity self, CombatEntity target, int priority, double confidence, String reason,
                              DecisionContext context) {
        if (self.distanceTo(target) <= AbilityDefinition.BASIC_ATTACK.range()) {
            return new AIDecision.Attack(target.getId(), priority, confidence, reason);
        }
        var hex = approachHex(self, target.getPosition(), true, context);
        if (hex.isPresent()) {
            return new AIDecision.Move(hex.get(), priority, confidence, "Approaching " + target.getName());
        }
        return new AIDecision.Wait(AIPriority.MINIMAL, confidence, "No path to " + target.getName());
    }

    private Optional<AIDecision> useAbility(String abilityId, CombatEntity self, ThreatManager threat,
                                            DecisionContext context, int priority, String reason) {
        var ability = self.getAbilities().get(abilityId);
        if (ability.isEmpty() || self.getAbilities().checkUsable(abilityId).isPresent()) {
            return Optional.empty();
        }
        var definition = ability.get();
        List<CombatEntity> candidates = switch (definition.kind()) {
            case ATTACK -> {
                var enemies = new ArrayList<CombatEntity>(context.targetableEnemies());
                var preferred = choose(self, threat, context.targetableEnemies());
                if (preferred.hasTarget()) {
                    enemies.remove(preferred.target());
                    enemies.add(0, preferred.target());
                }
                yield enemies;
            }
            case HEALING -> {
                var friends = new ArrayList<CombatEntity>(context.livingAllies());
                friends.add(self);
                friends.sort(Comparator.comparingDouble(CombatEntity::getHpFraction));
                yield friends;
            }
            case DEFENSE, UTILITY -> List.of(self);
        };
        var target = candidates.stream()
                               .filter(c -> HexLines.isValidAbilityTarget(self.getPosition(), c.getPosition(),
                                                                          definition.range(), context.obstacles()))
                               .findFirst();
        if (target.isPresent() && definition.kind() == AbilityKind.ATTACK) {
            focus = target.get().getId();
        }
        return target.map(t -> attackWith(definition, t, priority, 1.0, reason));
    }

    private AIDecision attackWith(AbilityDefinition ability, CombatEntity target, int priority, double confidence,
                                  String reason) {
        if (AbilityDefinition.BASIC_ATTACK_ID.equals(ability.id())) {
            return new AIDecision.Attack(target.getId(), priority, confidence, reason);
        }
        return new AIDecision.UseAbility(ability.id(), target.getId(), priority, confidence, reason);
    }

    /**
     * @return the strongest attack ability off cooldown that can reach the target
     */
    private Optional<AbilityDefinition> bestAttackAbility(CombatEntity self, CombatEntity target,
                                                          DecisionContext context) {
        return self.getAbilities()
                   .getAvailable(AbilityKind.ATTACK)
                   .stream()
                   .filter(a -> HexLines.isValidAbilityTarget(self.getPosition(), target.getPosition(), a.range(),
                                                              context.obstacles()))
                   .max(Comparator.comparingInt(AbilityDefinition::damage));
    }

    /**
     * Farthest hex along a shortest path toward the goal that can be reached this round.
     *
     * @param stopAdjacent the goal itself is occupied; stop next to it
     */
    private Optional<HexCoordinate> approachHex(CombatEntity self, HexCoordinate goal, boolean stopAdjacent,
                                                DecisionContext context) {
        if (!self.canMove() || self.hasMovedThisRound() || goal.equals(self.getPosition())) {
            return Optional.empty();
        }
        var reachable = reachableFrom(self, context);
        var blocked = context.blockedExcept(self.getPosition(), goal);
        var path = pathfinder.findPath(self.getPosition(), goal, blocked);
        if (path.isPresent()) {
            var steps = path.get();
            var last = Math.min(self.getMovementRange(), steps.size() - (stopAdjacent ? 2 : 1));
            for (int i = last; i > 0; i--) {
                if (reachable.containsKey(steps.get(i))) {
                    return Optional.of(steps.get(i));
                }
            }
            return Optional.empty();
        }
        var current = self.getPosition().distance(goal);
        return reachable.keySet()
                        .stream()
                        .filter(hex -> hex.distance(goal) < current)
                        .min(Comparator.comparingInt((HexCoordinate hex) -> hex.distance(goal))
                                       .thenComparingInt(reachable::get));
    }

    private Optional<HexCoordinate> defensivePosition(CombatEntity self, CombatEntity enemy,
                                                      DecisionContext context) {
        if (!self.canMove() || self.hasMovedThisRound()) {
            return Optional.empty();
        }
        var reachable = reachableFrom(self, context);
        return HexRanges.tacticalPositions(self.getPosition(), enemy.getPosition(), self.getMovementRange())
                        .defensive()
                        .stream()
                        .filter(hex -> !hex.equals(self.getPosition()) && reachable.containsKey(hex))
                        .findFirst();
    }

    /**
     * @return the reachable hex maximizing distance to the nearest enemy, if it improves on staying put
     */
    private Optional<HexCoordinate> retreatHex(CombatEntity self, DecisionContext context) {
        if (!self.canMove() || self.hasMovedThisRound()) {
            return Optional.empty();
        }
        var enemies = context.targetableEnemies();
        var here = nearestDistance(self.getPosition(), enemies);
        return reachableFrom(self, context).keySet()
                                           .stream()
                                           .filter(hex -> nearestDistance(hex, enemies) > here)
                                           .max(Comparator.comparingInt(hex -> nearestDistance(hex, enemies)));
    }

    /**
     * @return hexes the monster could move to this round, its own position excluded
     */
    private Map<HexCoordinate, Integer> reachableFrom(CombatEntity self, DecisionContext context) {
        var blocked = context.blockedExcept(self.getPosition());
        var reachable = new LinkedHashMap<>(HexRanges.reachable(self.getPosition(), self.getMovementRange(), blocked));
        reachable.remove(self.getPosition());
        return reachable;
    }

    /**
     * Threat-driven ranking, falling back to the nearest candidate when the table offers nothing, e.g. while threat
     * tracking is disabled. Nothing is remembered here; {@link #decide} records the committed target.
     */
    private static TargetingResult<CombatEntity> choose(CombatEntity self, ThreatManager threat,
                                                        List<CombatEntity> candidates) {
        var selection = threat.peekTarget(candidates);
        if (selection.hasTarget()) {
            return selection;
        }
        return candidates.stream()
                         .min(Comparator.comparingInt((CombatEntity e) -> self.distanceTo(e))
                                        .thenComparing(CombatEntity::getId))
                         .map(nearest -> TargetingResult.of(nearest, "Nearest enemy", 0.5))
                         .orElse(selection);
    }

    private static int nearestDistance(HexCoordinate hex, List<CombatEntity> enemies) {
        return enemies.stream().mapToInt(e -> hex.distance(e.getPosition())).min().orElse(Integer.MAX_VALUE);
    }

    private static Optional<CombatEntity> nearestEnemy(CombatEntity self, DecisionContext context) {
        return context.targetableEnemies()
                      .stream()
                      .min(Comparator.comparingInt((CombatEntity e) -> self.distanceTo(e))
                                     .thenComparing(CombatEntity::getId));
    }

    private static Optional<CombatEntity> weakestEnemy(DecisionContext context) {
        return context.targetableEnemies()
                      .stream()
                      .min(Comparator.comparingDouble(CombatEntity::getHpFraction)
                                     .thenComparingInt(CombatEntity::getCurrentHp)
                                     .thenComparing(CombatEntity::getId));
    }

    private static List<CombatEntity> adjacentEnemies(CombatEntity self, DecisionContext context) {
        return context.targetableEnemies()
                      .stream()
                      .filter(e -> self.distanceTo(e) <= AbilityDefinition.BASIC_ATTACK.range())
                      .toList();
    }
}
