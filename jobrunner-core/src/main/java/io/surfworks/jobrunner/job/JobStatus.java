package io.surfworks.jobrunner.job;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Status of a submitted job as observed on the scheduler.
 *
 * @param externalId        Scheduler-assigned job ID
 * @param state             Current state of the job
 * @param observedAt        When this status was read
 * @param nodeName          Node where job is/was running (null if not yet scheduled)
 * @param elapsed           Time elapsed since job started running
 * @param message           Human-readable status message
 * @param schedulerMetadata Scheduler-specific metadata (e.g. the raw Slurm state)
 */
public record JobStatus(
        String externalId,
        JobState state,
        Instant observedAt,
        String nodeName,
        Duration elapsed,
        String message,
        Map<String, String> schedulerMetadata
) {

    public JobStatus {
        Objects.requireNonNull(externalId, "externalId cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(observedAt, "observedAt cannot be null");

        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        message = message == null ? state.name() : message;
        schedulerMetadata = schedulerMetadata == null ? Map.of() : Map.copyOf(schedulerMetadata);
    }

    /**
     * Creates a status with only the state known.
     */
    public static JobStatus of(String externalId, JobState state) {
        return new JobStatus(externalId, state, Instant.now(), null, Duration.ZERO, null, Map.of());
    }

    /**
     * Returns true if the job is in a terminal state.
     */
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Returns true if the job completed successfully.
     */
    public boolean isSuccess() {
        return state.isSuccess();
    }
}
