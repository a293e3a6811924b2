package com.hellblazer.hexcrawl.simulation.threat;

/**
 * Outcome of a target selection.
 *
 * @param target     the chosen candidate, null when nothing could be chosen
 * @param reason     human readable explanation
 * @param confidence 0 when no target, otherwise how decisive the choice was
 * @param <T>        candidate type
 * @author hal.hildebrand
 */
public record TargetingResult<T extends Targetable>(T target, String reason, double confidence) {

    public static <T extends Targetable> TargetingResult<T> none(String reason) {
        return new TargetingResult<>(null, reason, 0.0);
    }

    public static <T extends Targetable> TargetingResult<T> of(T target, String reason, double confidence) {
        return new TargetingResult<>(target, reason, confidence);
    }

    public boolean hasTarget() {
        return target != null;
    }
}
