package io.surfworks.jobrunner.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.job.JobSubmission;
import io.surfworks.jobrunner.snapshot.JobNodeCodec;

import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * One submittable unit: a script run under a resource profile.
 *
 * <p>{@code jobId} identifies the job inside its pipeline and survives reruns.
 * {@code externalId} and {@code status} change only when the job is submitted
 * and when its outcome is reconciled.
 */
public final class Job implements JobNode {

    private static final Logger LOG = Logger.getLogger(Job.class.getName());

    private final String script;
    private final String profile;
    private String jobId;
    private String externalId;
    private NodeStatus status;

    public Job(String script, String profile) {
        this(script, profile, null, null, NodeStatus.PENDING);
    }

    public Job(String script, String profile, String jobId) {
        this(script, profile, jobId, null, NodeStatus.PENDING);
    }

    public Job(String script, String profile, String jobId, String externalId, NodeStatus status) {
        this.script = Objects.requireNonNull(script, "script cannot be null");
        this.profile = Objects.requireNonNull(profile, "profile cannot be null");
        this.jobId = jobId == null ? null : PathSegments.require(jobId, "jobId");
        this.externalId = externalId;
        this.status = status == null ? NodeStatus.PENDING : status;
    }

    public String script() {
        return script;
    }

    public String profile() {
        return profile;
    }

    /**
     * Returns the pipeline-local id (null until assigned).
     */
    public String jobId() {
        return jobId;
    }

    /**
     * Returns the scheduler id (null until submitted).
     */
    public String externalId() {
        return externalId;
    }

    public NodeStatus status() {
        return status;
    }

    /**
     * Returns a fresh, never-submitted copy with the same identity.
     */
    public Job resubmittable() {
        return new Job(script, profile, jobId);
    }

    @Override
    public SubmissionOutcome generate(DependencyContext context) throws SubmissionException {
        if (status != NodeStatus.PENDING) {
            throw new IllegalStateException("Job " + jobId + " was already generated (status " + status + ")");
        }

        try {
            JobSubmission directive = context.compiler().compile(this, context);
            String id = context.compiler().submit(directive);
            this.externalId = id;
            this.status = NodeStatus.SUBMITTED;
            LOG.info(() -> "Submitted " + jobId + " as " + id
                    + directive.dependencyClause().map(d -> " (" + d.toClause() + ")").orElse(""));
            return SubmissionOutcome.of(id);
        } catch (SubmissionException e) {
            this.externalId = null;
            this.status = NodeStatus.FAILED;
            LOG.warning("Submission of " + jobId + " failed: " + e.getMessage());
            throw e;
        }
    }

    @Override
    public Path outputDir(Path root) {
        return root.resolve(jobId);
    }

    @Override
    public ObjectNode toSnapshot() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JobNodeCodec.TYPE, JobNodeCodec.TYPE_JOB);
        node.put(JobNodeCodec.SCRIPT, script);
        node.put(JobNodeCodec.PROFILE, profile);
        node.put(JobNodeCodec.JOB_ID, jobId);
        node.put(JobNodeCodec.EXTERNAL_ID, externalId);
        node.put(JobNodeCodec.STATUS, status.wireName());
        return node;
    }

    void assignJobId(String jobId) {
        if (this.jobId != null) {
            throw new IllegalStateException("Job " + this.jobId + " already has an id");
        }
        this.jobId = PathSegments.require(jobId, "jobId");
    }

    void updateStatus(NodeStatus status) {
        this.status = status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Job that)) return false;
        return script.equals(that.script)
                && profile.equals(that.profile)
                && Objects.equals(jobId, that.jobId)
                && Objects.equals(externalId, that.externalId)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(script, profile, jobId, externalId, status);
    }

    @Override
    public String toString() {
        return "Job[" + jobId + ", script=" + script + ", profile=" + profile
                + ", status=" + status + (externalId != null ? ", externalId=" + externalId : "") + "]";
    }
}
