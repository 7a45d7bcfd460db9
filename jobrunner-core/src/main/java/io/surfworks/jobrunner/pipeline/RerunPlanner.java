package io.surfworks.jobrunner.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the tree of the next run from a run whose outcomes were reconciled.
 *
 * <p>The new tree keeps the shape of the old one. Succeeded jobs become
 * {@link Skip} markers, every other job is kept under the same job id with a
 * fresh {@link NodeStatus#PENDING} status, and composites with nothing left
 * to run collapse into a {@link PassThrough} carrying the ids they produced.
 */
public final class RerunPlanner {

    private static final Logger LOG = Logger.getLogger(RerunPlanner.class.getName());

    private RerunPlanner() {
    }

    /**
     * Plans the next run of a pipeline, under the same name and run id.
     */
    public static Pipeline rerun(Pipeline pipeline) {
        JobNode planned = plan(pipeline.definition());
        Pipeline next = new Pipeline(pipeline.name(), planned, pipeline.jobId());
        LOG.info(() -> "Rerun of " + pipeline.name() + ": " + resubmittableJobs(planned)
                + " of " + pipeline.statusByJobId().size() + " jobs to resubmit");
        return next;
    }

    /**
     * Plans the next run of a subtree.
     */
    public static JobNode plan(JobNode node) {
        if (node instanceof Job job) {
            return job.status().needsResubmission() ? job.resubmittable() : Skip.of(job);
        }
        if (node instanceof Skip || node instanceof PassThrough) {
            return node;
        }
        if (node instanceof Sequential sequential) {
            return needsResubmission(sequential)
                    ? new Sequential(sequential.name(), planChildren(sequential))
                    : new PassThrough(sequential.name(), priorIds(sequential));
        }
        if (node instanceof Parallel parallel) {
            return needsResubmission(parallel)
                    ? new Parallel(parallel.name(), planChildren(parallel))
                    : new PassThrough(parallel.name(), priorIds(parallel));
        }
        throw new IllegalStateException("Unknown node type: " + node.getClass().getName());
    }

    /**
     * Returns true if any job below the node still has to run.
     */
    public static boolean needsResubmission(JobNode node) {
        if (node instanceof Job job) {
            return job.status().needsResubmission();
        }
        for (JobNode child : node.children()) {
            if (needsResubmission(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Counts the jobs a run of this tree would submit.
     */
    public static int resubmittableJobs(JobNode node) {
        int count = node instanceof Job job && job.status().needsResubmission() ? 1 : 0;
        for (JobNode child : node.children()) {
            count += resubmittableJobs(child);
        }
        return count;
    }

    /**
     * Returns the ids the node produced in its last run: a sequence's last
     * step, every branch of a fan-out.
     */
    static List<String> priorIds(JobNode node) {
        if (node instanceof Job job) {
            return job.externalId() == null ? List.of() : List.of(job.externalId());
        }
        if (node instanceof Skip skip) {
            return skip.externalId() == null ? List.of() : List.of(skip.externalId());
        }
        if (node instanceof PassThrough passThrough) {
            return passThrough.externalIds();
        }
        if (node instanceof Sequential sequential) {
            List<JobNode> steps = sequential.children();
            return steps.isEmpty() ? List.of() : priorIds(steps.get(steps.size() - 1));
        }
        List<String> ids = new ArrayList<>();
        for (JobNode child : node.children()) {
            ids.addAll(priorIds(child));
        }
        return ids;
    }

    private static List<JobNode> planChildren(JobNode node) {
        List<JobNode> planned = new ArrayList<>();
        for (JobNode child : node.children()) {
            planned.add(plan(child));
        }
        return planned;
    }
}
