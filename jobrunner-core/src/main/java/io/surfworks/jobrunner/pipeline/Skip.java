package io.surfworks.jobrunner.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.snapshot.JobNodeCodec;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A job that succeeded in an earlier run.
 *
 * <p>Never submitted again. Generating it yields the recorded external id so
 * that pending successors still depend on it.
 */
public final class Skip implements JobNode {

    private final String script;
    private final String profile;
    private final String jobId;
    private final String externalId;

    public Skip(String script, String profile, String jobId, String externalId) {
        this.script = Objects.requireNonNull(script, "script cannot be null");
        this.profile = Objects.requireNonNull(profile, "profile cannot be null");
        this.jobId = jobId == null ? null : PathSegments.require(jobId, "jobId");
        this.externalId = externalId;
    }

    /**
     * Creates the marker for a job of an earlier run.
     */
    public static Skip of(Job job) {
        return new Skip(job.script(), job.profile(), job.jobId(), job.externalId());
    }

    public String script() {
        return script;
    }

    public String profile() {
        return profile;
    }

    public String jobId() {
        return jobId;
    }

    public String externalId() {
        return externalId;
    }

    public NodeStatus status() {
        return NodeStatus.SKIPPED;
    }

    @Override
    public SubmissionOutcome generate(DependencyContext context) {
        return externalId == null ? SubmissionOutcome.empty() : SubmissionOutcome.of(externalId);
    }

    @Override
    public Path outputDir(Path root) {
        return root.resolve(jobId);
    }

    @Override
    public ObjectNode toSnapshot() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JobNodeCodec.TYPE, JobNodeCodec.TYPE_SKIP);
        node.put(JobNodeCodec.SCRIPT, script);
        node.put(JobNodeCodec.PROFILE, profile);
        node.put(JobNodeCodec.JOB_ID, jobId);
        node.put(JobNodeCodec.EXTERNAL_ID, externalId);
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Skip that)) return false;
        return script.equals(that.script)
                && profile.equals(that.profile)
                && Objects.equals(jobId, that.jobId)
                && Objects.equals(externalId, that.externalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(script, profile, jobId, externalId);
    }

    @Override
    public String toString() {
        return "Skip[" + jobId + ", externalId=" + externalId + "]";
    }
}
