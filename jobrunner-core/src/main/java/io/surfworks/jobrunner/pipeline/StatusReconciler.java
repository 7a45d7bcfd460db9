package io.surfworks.jobrunner.pipeline;

import io.surfworks.jobrunner.job.JobState;
import io.surfworks.jobrunner.job.JobStatus;
import io.surfworks.jobrunner.scheduler.Scheduler;
import io.surfworks.jobrunner.scheduler.SchedulerException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Folds outcomes observed on the scheduler back into a pipeline's tree.
 *
 * <p>Only jobs in {@link NodeStatus#SUBMITTED} are queried. Every query is
 * made before any status changes, so a failed query leaves the whole tree in
 * its last known state.
 */
public final class StatusReconciler {

    private static final Logger LOG = Logger.getLogger(StatusReconciler.class.getName());

    private final Scheduler scheduler;

    public StatusReconciler(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    /**
     * Queries every submitted job and records terminal outcomes.
     *
     * @return number of jobs whose status changed
     * @throws StatusQueryException if any query fails; no status is changed then
     */
    public int reconcile(Pipeline pipeline) throws StatusQueryException {
        // pairs, not a map: a Job's hash covers the status updated below
        List<Map.Entry<Job, NodeStatus>> updates = new ArrayList<>();

        for (Job job : pipeline.jobs()) {
            if (job.status() != NodeStatus.SUBMITTED || job.externalId() == null) {
                continue;
            }
            JobStatus observed;
            try {
                observed = scheduler.status(job.externalId());
            } catch (SchedulerException e) {
                LOG.warning("Status of " + job.jobId() + " (" + job.externalId() + ") unavailable: " + e.getMessage());
                throw new StatusQueryException(job.jobId(), job.externalId(), e);
            }
            NodeStatus next = toNodeStatus(observed.state());
            if (next != job.status()) {
                updates.add(Map.entry(job, next));
            }
        }

        for (Map.Entry<Job, NodeStatus> update : updates) {
            Job job = update.getKey();
            NodeStatus status = update.getValue();
            LOG.info(() -> "Job " + job.jobId() + " (" + job.externalId() + ") is now " + status.wireName());
            job.updateStatus(status);
        }
        return updates.size();
    }

    /**
     * Returns true when no job of the pipeline is waiting for an outcome.
     */
    public static boolean isSettled(Pipeline pipeline) {
        return pipeline.jobs().stream().noneMatch(j -> j.status() == NodeStatus.SUBMITTED);
    }

    /**
     * Maps a scheduler state onto the job lifecycle; non-terminal states keep the job submitted.
     */
    static NodeStatus toNodeStatus(JobState state) {
        return switch (state) {
            case PENDING, RUNNING -> NodeStatus.SUBMITTED;
            case COMPLETED -> NodeStatus.SUCCEEDED;
            case FAILED, CANCELLED, TIMEOUT -> NodeStatus.FAILED;
        };
    }
}
