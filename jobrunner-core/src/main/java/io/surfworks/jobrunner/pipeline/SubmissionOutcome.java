package io.surfworks.jobrunner.pipeline;

import io.surfworks.jobrunner.job.Dependency;

import java.util.List;
import java.util.Objects;

/**
 * What generating a node produced.
 *
 * @param externalIds  Ids a successor must depend on, in declared order
 * @param failedJobIds Jobs below the node whose submission failed, in declared order
 */
public record SubmissionOutcome(List<String> externalIds, List<String> failedJobIds) {

    private static final SubmissionOutcome EMPTY = new SubmissionOutcome(List.of(), List.of());

    public SubmissionOutcome {
        Objects.requireNonNull(externalIds, "externalIds cannot be null");
        Objects.requireNonNull(failedJobIds, "failedJobIds cannot be null");

        externalIds = List.copyOf(externalIds);
        failedJobIds = List.copyOf(failedJobIds);
    }

    /**
     * Outcome of a single accepted submission.
     */
    public static SubmissionOutcome of(String externalId) {
        return new SubmissionOutcome(List.of(externalId), List.of());
    }

    /**
     * Outcome forwarding already known ids.
     */
    public static SubmissionOutcome of(List<String> externalIds) {
        return new SubmissionOutcome(externalIds, List.of());
    }

    /**
     * Outcome that produced nothing.
     */
    public static SubmissionOutcome empty() {
        return EMPTY;
    }

    /**
     * Returns the ids joined with the AND separator, e.g. {@code 12,13}.
     */
    public String joinedId() {
        return String.join(Dependency.AND, externalIds);
    }

    /**
     * Returns true if at least one id was produced.
     */
    public boolean hasIds() {
        return !externalIds.isEmpty();
    }

    /**
     * Returns true if any job below the node failed to submit.
     */
    public boolean hasFailures() {
        return !failedJobIds.isEmpty();
    }
}
