package io.surfworks.jobrunner.pipeline;

/**
 * Checked exception for job tree errors.
 *
 * <p>Carries the pipeline-local id of the job involved, when there is one.
 */
public class PipelineException extends Exception {

    private final String jobId;

    public PipelineException(String message) {
        super(message);
        this.jobId = null;
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
        this.jobId = null;
    }

    public PipelineException(String jobId, String message, Throwable cause) {
        super(jobId + ": " + message, cause);
        this.jobId = jobId;
    }

    /**
     * Returns the job where the error occurred (may be null).
     */
    public String jobId() {
        return jobId;
    }
}
