package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ActionKind;

import java.util.Objects;

/**
 * What a monster decided to do this round.
 * <p>
 * The hierarchy is closed; consumers dispatch on {@link #kind()}:
 * <pre>
 * switch (decision.kind()) {
 *     case MOVE -> move(self, ((AIDecision.Move) decision).destination());
 *     case ATTACK -> attack(self, ((AIDecision.Attack) decision).targetId());
 *     case ABILITY -> ...
 *     case WAIT -> ...
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public sealed interface AIDecision permits AIDecision.Move, AIDecision.Attack, AIDecision.UseAbility,
                                           AIDecision.Wait {

    ActionKind kind();

    /**
     * @return {@link AIPriority} band of the rule or policy that produced the decision
     */
    int priority();

    /**
     * @return 0..1 certainty, taken from target selection where one was involved
     */
    double confidence();

    String reasoning();

    /**
     * @param destination reachable, unoccupied hex at decision time
     */
    record Move(HexCoordinate destination, int priority, double confidence, String reasoning) implements AIDecision {
        public Move {
            Objects.requireNonNull(destination, "destination");
        }

        @Override
        public ActionKind kind() {
            return ActionKind.MOVE;
        }
    }

    record Attack(String targetId, int priority, double confidence, String reasoning) implements AIDecision {
        public Attack {
            Objects.requireNonNull(targetId, "targetId");
        }

        @Override
        public ActionKind kind() {
            return ActionKind.ATTACK;
        }
    }

    /**
     * @param targetId entity the ability is aimed at, null for self-targeted abilities
     */
    record UseAbility(String abilityId, String targetId, int priority, double confidence, String reasoning)
    implements AIDecision {
        public UseAbility {
            Objects.requireNonNull(abilityId, "abilityId");
        }

        @Override
        public ActionKind kind() {
            return ActionKind.ABILITY;
        }
    }

    record Wait(int priority, double confidence, String reasoning) implements AIDecision {
        @Override
        public ActionKind kind() {
            return ActionKind.WAIT;
        }
    }

    static Wait idle(String reasoning) {
        return new Wait(AIPriority.MINIMAL, 1.0, reasoning);
    }
}
