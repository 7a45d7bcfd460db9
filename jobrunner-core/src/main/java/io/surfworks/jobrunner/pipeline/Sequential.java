package io.surfworks.jobrunner.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.snapshot.JobNodeCodec;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Children run strictly in order: child {@code i+1} is released only after
 * child {@code i} succeeded.
 *
 * <p>The first child inherits the incoming dependency. A child that fails to
 * submit stops the chain; later children stay {@link NodeStatus#PENDING}.
 * A partially failed last step is returned with its failures instead.
 */
public final class Sequential implements JobNode {

    /** Output directory segment when none is given */
    public static final String DEFAULT_NAME = "S";

    private final String name;
    private final List<JobNode> jobs;

    public Sequential(String name, List<JobNode> jobs) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.jobs = List.copyOf(Objects.requireNonNull(jobs, "jobs cannot be null"));
        PathSegments.require(name, "name");
    }

    /**
     * Creates a sequence with the default name.
     */
    public static Sequential of(JobNode... jobs) {
        return new Sequential(DEFAULT_NAME, List.of(jobs));
    }

    /**
     * Creates a named sequence.
     */
    public static Sequential named(String name, JobNode... jobs) {
        return new Sequential(name, List.of(jobs));
    }

    public String name() {
        return name;
    }

    @Override
    public List<JobNode> children() {
        return jobs;
    }

    @Override
    public SubmissionOutcome generate(DependencyContext context) throws PipelineException {
        DependencyContext inner = context.nested(name);
        DependencyContext childContext = inner;
        SubmissionOutcome last = SubmissionOutcome.of(context.dependsOn());

        for (int i = 0; i < jobs.size(); i++) {
            last = jobs.get(i).generate(childContext);

            // a partial last step is returned as is; nothing here depends on it
            if (i + 1 < jobs.size()) {
                if (last.hasFailures()) {
                    throw new SubmissionException(last.failedJobIds(),
                            "sequence '" + name + "' stopped at step " + i + ": failed jobs " + last.failedJobIds());
                }
                if (!last.hasIds()) {
                    throw new DependencyResolutionException(
                            "sequence '" + name + "': step " + i + " produced no job id for step " + (i + 1) + " to depend on");
                }
                childContext = inner.afterOk(last.externalIds());
            }
        }
        return last;
    }

    @Override
    public Path outputDir(Path root) {
        return root.resolve(name);
    }

    @Override
    public ObjectNode toSnapshot() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JobNodeCodec.TYPE, JobNodeCodec.TYPE_SEQUENTIAL);
        node.put(JobNodeCodec.NAME, name);
        ArrayNode children = node.putArray(JobNodeCodec.JOBS);
        for (JobNode job : jobs) {
            children.add(job.toSnapshot());
        }
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequential that)) return false;
        return name.equals(that.name) && jobs.equals(that.jobs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, jobs);
    }

    @Override
    public String toString() {
        return "Sequential[" + name + ", " + jobs + "]";
    }
}
