package com.hellblazer.hexcrawl.simulation.loop;

/**
 * Whether a submitted player action was buffered.
 *
 * @param reason why it was rejected, null when accepted
 * @author hal.hildebrand
 */
public record SubmissionResult(boolean success, String reason) {

    private static final SubmissionResult ACCEPTED = new SubmissionResult(true, null);

    public static SubmissionResult accepted() {
        return ACCEPTED;
    }

    public static SubmissionResult rejected(String reason) {
        return new SubmissionResult(false, reason);
    }
}
