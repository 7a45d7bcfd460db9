package io.surfworks.jobrunner.pipeline;

import io.surfworks.jobrunner.scheduler.SchedulerException;

/**
 * The scheduler could not be queried during reconciliation.
 *
 * <p>Transient: job statuses are left untouched and the caller may retry.
 */
public class StatusQueryException extends PipelineException {

    private final String externalId;

    public StatusQueryException(String jobId, String externalId, SchedulerException cause) {
        super(jobId, "status query for " + externalId + " failed: " + cause.getMessage(), cause);
        this.externalId = externalId;
    }

    /**
     * Returns the scheduler id whose status could not be read.
     */
    public String externalId() {
        return externalId;
    }
}
