package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;

/**
 * A predicate over the deciding monster and what it can see.
 *
 * @author hal.hildebrand
 */
public sealed interface BehaviorCondition
permits BehaviorCondition.HealthBelow, BehaviorCondition.HealthAbove, BehaviorCondition.EnemyCountAtLeast,
        BehaviorCondition.AllyCountAtLeast, BehaviorCondition.EnemyWithin, BehaviorCondition.AllyInDanger,
        BehaviorCondition.RoundAtLeast {

    boolean test(CombatEntity self, DecisionContext context);

    /**
     * @param fraction HP fraction in [0, 1]
     */
    record HealthBelow(double fraction) implements BehaviorCondition {
        public HealthBelow {
            requireFraction(fraction);
        }

        @Override
        public boolean test(CombatEntity self, DecisionContext context) {
            return self.getHpFraction() < fraction;
        }
    }

    record HealthAbove(double fraction) implements BehaviorCondition {
        public HealthAbove {
            requireFraction(fraction);
        }

        @Override
        public boolean test(CombatEntity self, DecisionContext context) {
            return self.getHpFraction() > fraction;
        }
    }

    record EnemyCountAtLeast(int count) implements BehaviorCondition {
        @Override
        public boolean test(CombatEntity self, DecisionContext context) {
            return context.targetableEnemies().size() >= count;
        }
    }

    record AllyCountAtLeast(int count) implements BehaviorCondition {
        @Override
        public boolean test(CombatEntity self, DecisionContext context) {
            return context.livingAllies().size() >= count;
        }
    }

    /**
     * @param range hex distance
     */
    record EnemyWithin(int range) implements BehaviorCondition {
        @Override
        public boolean test(CombatEntity self, DecisionContext context) {
            return context.targetableEnemies().stream().anyMatch(e -> self.distanceTo(e) <= range);
        }
    }

    /**
     * Some living ally is below the HP fraction.
     */
    record AllyInDanger(double fraction) implements BehaviorCondition {
        public AllyInDanger {
            requireFraction(fraction);
        }

        @Override
        public boolean test(CombatEntity self, DecisionContext context) {
            return context.livingAllies().stream().anyMatch(a -> a.getHpFraction() < fraction);
        }
    }

    record RoundAtLeast(int round) implements BehaviorCondition {
        @Override
        public boolean test(CombatEntity self, DecisionContext context) {
            return context.round() >= round;
        }
    }

    private static void requireFraction(double fraction) {
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("HP fraction must be within [0, 1]: " + fraction);
        }
    }
}
