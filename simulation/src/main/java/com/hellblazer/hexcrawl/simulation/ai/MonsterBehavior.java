package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A scripted rule: when every condition holds, perform the action.
 *
 * @param priority higher rules are evaluated first
 * @author hal.hildebrand
 */
public record MonsterBehavior(String id, String name, int priority, List<BehaviorCondition> conditions,
                              BehaviorAction action) {

    /** Highest priority first, declaration order among equals */
    public static final Comparator<MonsterBehavior> BY_PRIORITY = Comparator.comparingInt(MonsterBehavior::priority)
                                                                            .reversed();

    public MonsterBehavior {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Behavior id is required");
        }
        name = name == null ? id : name;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        Objects.requireNonNull(action, "action");
    }

    public boolean matches(CombatEntity self, DecisionContext context) {
        return conditions.stream().allMatch(c -> c.test(self, context));
    }
}
