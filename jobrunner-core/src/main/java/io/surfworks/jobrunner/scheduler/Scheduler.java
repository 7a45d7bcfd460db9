package io.surfworks.jobrunner.scheduler;

import io.surfworks.jobrunner.job.JobStatus;
import io.surfworks.jobrunner.job.JobSubmission;

/**
 * Service Provider Interface for batch schedulers.
 *
 * <p>The job tree only ever submits directives and reads back states; it never
 * runs anything itself. Implementations handle the scheduler-specific
 * transport (SSH + sbatch for Slurm).
 */
public interface Scheduler extends AutoCloseable {

    /**
     * Returns the name of this scheduler (e.g. "slurm", "dry-run").
     */
    String name();

    /**
     * Submits a directive.
     *
     * @param submission the directive to submit
     * @return external job ID assigned by the scheduler
     * @throws SchedulerException if the scheduler rejects the directive or is unreachable
     */
    String submit(JobSubmission submission) throws SchedulerException;

    /**
     * Gets the current status of a job.
     *
     * @param externalId the scheduler-assigned job ID
     * @return current job status
     * @throws SchedulerException if the scheduler cannot be queried
     */
    JobStatus status(String externalId) throws SchedulerException;

    /**
     * Cancels a pending or running job.
     *
     * @param externalId the scheduler-assigned job ID
     * @return true if cancellation was accepted
     * @throws SchedulerException if the scheduler cannot be reached
     */
    boolean cancel(String externalId) throws SchedulerException;

    /**
     * Tests connection to the scheduler.
     */
    boolean isConnected();

    /**
     * Closes this scheduler and releases any resources.
     */
    @Override
    void close();
}
