package io.surfworks.jobrunner.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.snapshot.JobNodeCodec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Children share the same upstream dependency and are independent of each other.
 *
 * <p>Children are submitted one at a time in declared order. A child that
 * fails to submit is recorded and its siblings still go out; whether the
 * partial result is acceptable is up to whatever depends on this node.
 */
public final class Parallel implements JobNode {

    private static final Logger LOG = Logger.getLogger(Parallel.class.getName());

    /** Output directory segment when none is given */
    public static final String DEFAULT_NAME = "P";

    private final String name;
    private final List<JobNode> jobs;

    // last generate() result, not persisted
    private SubmissionOutcome outcome;

    public Parallel(String name, List<JobNode> jobs) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.jobs = List.copyOf(Objects.requireNonNull(jobs, "jobs cannot be null"));
        PathSegments.require(name, "name");
    }

    /**
     * Creates a fan-out with the default name.
     */
    public static Parallel of(JobNode... jobs) {
        return new Parallel(DEFAULT_NAME, List.of(jobs));
    }

    /**
     * Creates a named fan-out.
     */
    public static Parallel named(String name, JobNode... jobs) {
        return new Parallel(name, List.of(jobs));
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
        if (jobs.isEmpty()) {
            outcome = SubmissionOutcome.of(context.dependsOn());
            return outcome;
        }

        DependencyContext inner = context.nested(name);
        List<String> ids = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (JobNode job : jobs) {
            try {
                SubmissionOutcome child = job.generate(inner);
                ids.addAll(child.externalIds());
                failed.addAll(child.failedJobIds());
            } catch (SubmissionException e) {
                LOG.warning("Branch of '" + name + "' failed, siblings continue: " + e.getMessage());
                failed.addAll(e.failedJobIds());
            }
        }

        outcome = new SubmissionOutcome(ids, failed);
        return outcome;
    }

    /**
     * Returns the ids of the last generation joined with the AND separator.
     *
     * @throws DependencyResolutionException if this node was not generated yet
     */
    public String joinedId() throws DependencyResolutionException {
        if (outcome == null) {
            throw new DependencyResolutionException("parallel '" + name + "' has not been generated");
        }
        return outcome.joinedId();
    }

    /**
     * Returns the jobs that failed to submit during the last generation.
     */
    public List<String> failedJobIds() {
        return outcome == null ? List.of() : outcome.failedJobIds();
    }

    @Override
    public Path outputDir(Path root) {
        return root.resolve(name);
    }

    @Override
    public ObjectNode toSnapshot() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JobNodeCodec.TYPE, JobNodeCodec.TYPE_PARALLEL);
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
        if (!(o instanceof Parallel that)) return false;
        return name.equals(that.name) && jobs.equals(that.jobs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, jobs);
    }

    @Override
    public String toString() {
        return "Parallel[" + name + ", " + jobs + "]";
    }
}
