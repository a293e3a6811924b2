package com.hellblazer.hexcrawl.simulation.loop;

import java.util.List;

/**
 * Consistency report of a {@link GameState}.
 *
 * @author hal.hildebrand
 */
public record StateValidation(List<String> issues) {

    public StateValidation {
        issues = List.copyOf(issues);
    }

    public boolean valid() {
        return issues.isEmpty();
    }
}
