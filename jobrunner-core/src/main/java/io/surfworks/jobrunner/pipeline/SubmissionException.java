package io.surfworks.jobrunner.pipeline;

import java.util.List;

/**
 * The scheduler, or the directive compiler before it, rejected a job:
 * unknown profile, bad script reference, quota, unreachable scheduler.
 *
 * <p>Also raised by a {@link Sequential} that stopped because a child
 * reported failures; {@link #failedJobIds()} then lists every job that failed
 * below it.
 */
public class SubmissionException extends PipelineException {

    private final List<String> failedJobIds;

    public SubmissionException(String jobId, String message) {
        this(jobId, message, null);
    }

    public SubmissionException(String jobId, String message, Throwable cause) {
        super(jobId, message, cause);
        this.failedJobIds = List.of(jobId);
    }

    public SubmissionException(List<String> failedJobIds, String message) {
        super(message);
        this.failedJobIds = List.copyOf(failedJobIds);
    }

    /**
     * Returns the ids of the jobs whose submission failed.
     */
    public List<String> failedJobIds() {
        return failedJobIds;
    }
}
