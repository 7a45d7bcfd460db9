package io.surfworks.jobrunner.pipeline;

import java.util.Locale;

/**
 * Lifecycle of a job inside a pipeline run.
 */
public enum NodeStatus {
    /** Not submitted in this run (not yet reached, or reached after a failure upstream) */
    PENDING,

    /** Accepted by the scheduler, outcome not yet observed */
    SUBMITTED,

    /** Observed as completed successfully */
    SUCCEEDED,

    /** Rejected at submission, or observed as failed/cancelled/timed out */
    FAILED,

    /** Succeeded in a previous run and carried over without resubmission */
    SKIPPED;

    /**
     * Returns the snapshot spelling ("pending", "submitted", ...).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the snapshot spelling.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static NodeStatus fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns true if a rerun must submit a job in this state again.
     */
    public boolean needsResubmission() {
        return this == PENDING || this == SUBMITTED || this == FAILED;
    }
}
