package io.surfworks.jobrunner.testing;

import io.surfworks.jobrunner.job.JobState;
import io.surfworks.jobrunner.job.JobStatus;
import io.surfworks.jobrunner.job.JobSubmission;
import io.surfworks.jobrunner.scheduler.Scheduler;
import io.surfworks.jobrunner.scheduler.SchedulerException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory scheduler for tests and dry runs.
 *
 * <p>Hands out Slurm-like numeric ids, records every directive, and can be
 * told to reject submissions or to report a given outcome per job.
 */
public final class MockScheduler implements Scheduler {

    private final AtomicInteger jobCounter;
    private final Map<String, JobState> states = new ConcurrentHashMap<>();
    private final List<JobSubmission> submissions = new ArrayList<>();
    private final Set<String> rejectedJobIds = new HashSet<>();

    private boolean connected = true;
    private Function<JobSubmission, JobState> outcome = s -> JobState.COMPLETED;
    private SchedulerException statusException;

    public MockScheduler() {
        this(1000);
    }

    /**
     * Creates a scheduler whose first id is {@code firstId + 1}.
     */
    public MockScheduler(int firstId) {
        this.jobCounter = new AtomicInteger(firstId);
    }

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public synchronized String submit(JobSubmission submission) throws SchedulerException {
        if (rejectedJobIds.contains(submission.jobId()) || rejectedJobIds.contains(submission.script())) {
            throw new SchedulerException("sbatch: error: Batch job submission failed: Invalid job "
                    + submission.jobId());
        }

        String externalId = String.valueOf(jobCounter.incrementAndGet());
        states.put(externalId, outcome.apply(submission));
        submissions.add(submission);
        return externalId;
    }

    @Override
    public JobStatus status(String externalId) throws SchedulerException {
        if (statusException != null) {
            throw statusException;
        }
        JobState state = states.get(externalId);
        if (state == null) {
            throw new SchedulerException("Invalid job id specified: " + externalId);
        }
        return JobStatus.of(externalId, state);
    }

    @Override
    public boolean cancel(String externalId) {
        JobState state = states.get(externalId);
        if (state == null) {
            return false;
        }
        if (!state.isTerminal()) {
            states.put(externalId, JobState.CANCELLED);
        }
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void close() {
        // No-op for mock
    }

    // ===== Test configuration methods =====

    /**
     * Sets whether the scheduler appears connected.
     */
    public MockScheduler setConnected(boolean connected) {
        this.connected = connected;
        return this;
    }

    /**
     * Rejects submissions whose job id or script matches.
     */
    public MockScheduler reject(String jobIdOrScript) {
        rejectedJobIds.add(jobIdOrScript);
        return this;
    }

    /**
     * Sets the outcome reported for every job.
     */
    public MockScheduler setDefaultOutcome(JobState state) {
        this.outcome = s -> state;
        return this;
    }

    /**
     * Sets a function deciding each job's reported outcome from its directive.
     */
    public MockScheduler setOutcomeFunction(Function<JobSubmission, JobState> function) {
        this.outcome = function;
        return this;
    }

    /**
     * Makes status() throw (null to restore).
     */
    public MockScheduler setStatusException(SchedulerException exception) {
        this.statusException = exception;
        return this;
    }

    /**
     * Forces the reported state of a job.
     */
    public void completeJob(String externalId, JobState state) {
        states.computeIfPresent(externalId, (id, previous) -> state);
    }

    // ===== Test assertion methods =====

    /**
     * Returns all directives received, in submission order.
     */
    public synchronized List<JobSubmission> getSubmissions() {
        return List.copyOf(submissions);
    }

    /**
     * Returns the number of directives received.
     */
    public synchronized int getSubmissionCount() {
        return submissions.size();
    }

    /**
     * Returns the job ids of the directives received, in submission order.
     */
    public synchronized List<String> submittedJobIds() {
        return submissions.stream().map(JobSubmission::jobId).toList();
    }

    /**
     * Returns the directive submitted for a job id.
     */
    public synchronized Optional<JobSubmission> submissionFor(String jobId) {
        return submissions.stream().filter(s -> s.jobId().equals(jobId)).findFirst();
    }
}
