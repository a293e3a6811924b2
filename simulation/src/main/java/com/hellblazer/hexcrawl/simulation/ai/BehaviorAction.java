package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;

import java.util.Objects;

/**
 * What a {@link MonsterBehavior} does when its conditions hold. {@link MonsterAI} turns it into an
 * {@link AIDecision} against the current board.
 *
 * @author hal.hildebrand
 */
public sealed interface BehaviorAction
permits BehaviorAction.AttackNearest, BehaviorAction.FocusWeakest, BehaviorAction.Retreat, BehaviorAction.UseAbility,
        BehaviorAction.MoveTo, BehaviorAction.Hold {

    enum Type {
        ATTACK_NEAREST, FOCUS_WEAKEST, RETREAT, USE_ABILITY, MOVE_TO, HOLD
    }

    Type type();

    record AttackNearest() implements BehaviorAction {
        @Override
        public Type type() {
            return Type.ATTACK_NEAREST;
        }
    }

    /**
     * Go after the enemy with the lowest HP fraction.
     */
    record FocusWeakest() implements BehaviorAction {
        @Override
        public Type type() {
            return Type.FOCUS_WEAKEST;
        }
    }

    /**
     * Step to the reachable hex farthest from the nearest enemy.
     */
    record Retreat() implements BehaviorAction {
        @Override
        public Type type() {
            return Type.RETREAT;
        }
    }

    record UseAbility(String abilityId) implements BehaviorAction {
        public UseAbility {
            Objects.requireNonNull(abilityId, "abilityId");
        }

        @Override
        public Type type() {
            return Type.USE_ABILITY;
        }
    }

    record MoveTo(HexCoordinate destination) implements BehaviorAction {
        public MoveTo {
            Objects.requireNonNull(destination, "destination");
        }

        @Override
        public Type type() {
            return Type.MOVE_TO;
        }
    }

    record Hold() implements BehaviorAction {
        @Override
        public Type type() {
            return Type.HOLD;
        }
    }
}
