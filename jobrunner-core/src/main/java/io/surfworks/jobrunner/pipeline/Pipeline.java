package io.surfworks.jobrunner.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.snapshot.JobNodeCodec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * A pipeline run: a job tree, the name its output lives under, and the run id.
 *
 * <p>The run as a whole is never submitted, so its {@code jobId} is known only
 * to the job runner. The pipeline exclusively owns its tree; callers serialize
 * {@link #schedule}, reconciliation and reruns on one instance.
 *
 * <p>Jobs built without an id get one derived from their position in the
 * tree: the child indices joined with '.', then the script, e.g.
 * {@code 3.1-run}.
 */
public final class Pipeline {

    private static final Logger LOG = Logger.getLogger(Pipeline.class.getName());

    private final String name;
    private final JobNode definition;
    private final String jobId;

    public Pipeline(String name, JobNode definition, String jobId) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.definition = Objects.requireNonNull(definition, "definition cannot be null");
        this.jobId = jobId;

        PathSegments.require(name, "name");
        assignJobIds(definition, new ArrayList<>());
        checkUniqueJobIds(definition);
    }

    /**
     * Creates a pipeline with a fresh run id.
     */
    public static Pipeline create(String name, JobNode definition) {
        return new Pipeline(name, definition, UUID.randomUUID().toString().substring(0, 8));
    }

    public String name() {
        return name;
    }

    public JobNode definition() {
        return definition;
    }

    /**
     * Returns the run id (may be null).
     */
    public String jobId() {
        return jobId;
    }

    /**
     * Returns {@code root/name}; every node's directory nests under it.
     */
    public Path outputDir(Path root) {
        return root.resolve(name);
    }

    /**
     * Submits the whole tree.
     *
     * @return ids of the last jobs of the run, and jobs that failed inside a fan-out
     * @throws SubmissionException if a submission failure stopped a sequence
     * @throws DependencyResolutionException if a step had nothing to depend on
     */
    public SubmissionOutcome schedule(DependencyCompiler compiler) throws PipelineException {
        DependencyContext context = DependencyContext.root(outputDir(Path.of("")), compiler);
        LOG.info(() -> "Scheduling pipeline " + name + " (run " + jobId + ", " + jobs().size() + " jobs)");

        try {
            SubmissionOutcome outcome = definition.generate(context);
            LOG.info(() -> "Pipeline " + name + " scheduled, final ids [" + outcome.joinedId() + "]"
                    + (outcome.hasFailures() ? ", failed " + outcome.failedJobIds() : ""));
            return outcome;
        } catch (PipelineException e) {
            LOG.warning("Pipeline " + name + " stopped: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Returns every {@link Job} leaf in tree order.
     */
    public List<Job> jobs() {
        List<Job> jobs = new ArrayList<>();
        collectJobs(definition, jobs);
        return Collections.unmodifiableList(jobs);
    }

    /**
     * Finds a job by its pipeline-local id.
     */
    public Optional<Job> job(String jobId) {
        return jobs().stream().filter(j -> j.jobId().equals(jobId)).findFirst();
    }

    /**
     * Returns the status of every job and skip marker, keyed by job id, in tree order.
     */
    public Map<String, NodeStatus> statusByJobId() {
        Map<String, NodeStatus> statuses = new LinkedHashMap<>();
        collectStatuses(definition, statuses);
        return Collections.unmodifiableMap(statuses);
    }

    /**
     * Returns the snapshot record of this run.
     */
    public ObjectNode toSnapshot() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JobNodeCodec.TYPE, JobNodeCodec.TYPE_PIPELINE);
        node.put(JobNodeCodec.NAME, name);
        node.put(JobNodeCodec.JOB_ID, jobId);
        node.set(JobNodeCodec.DEFINITION, definition.toSnapshot());
        return node;
    }

    private static void assignJobIds(JobNode node, List<Integer> position) {
        if (node instanceof Job job) {
            if (job.jobId() == null) {
                job.assignJobId(positionId(position, job.script()));
            }
            return;
        }
        List<JobNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            position.add(i);
            assignJobIds(children.get(i), position);
            position.remove(position.size() - 1);
        }
    }

    private static String positionId(List<Integer> position, String script) {
        if (position.isEmpty()) {
            return script;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < position.size(); i++) {
            if (i > 0) sb.append('.');
            sb.append(position.get(i));
        }
        return sb.append('-').append(script).toString();
    }

    private static void checkUniqueJobIds(JobNode root) {
        Set<String> seen = new HashSet<>();
        List<JobNode> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            JobNode node = stack.remove(stack.size() - 1);
            String id = null;
            if (node instanceof Job job) {
                id = job.jobId();
            } else if (node instanceof Skip skip) {
                id = skip.jobId();
            }
            if (id != null && !seen.add(id)) {
                throw new IllegalArgumentException("Duplicate job id in pipeline: " + id);
            }
            stack.addAll(node.children());
        }
    }

    private static void collectJobs(JobNode node, List<Job> jobs) {
        if (node instanceof Job job) {
            jobs.add(job);
        }
        for (JobNode child : node.children()) {
            collectJobs(child, jobs);
        }
    }

    private static void collectStatuses(JobNode node, Map<String, NodeStatus> statuses) {
        if (node instanceof Job job) {
            statuses.put(job.jobId(), job.status());
        } else if (node instanceof Skip skip && skip.jobId() != null) {
            statuses.put(skip.jobId(), skip.status());
        }
        for (JobNode child : node.children()) {
            collectStatuses(child, statuses);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pipeline that)) return false;
        return name.equals(that.name)
                && Objects.equals(jobId, that.jobId)
                && definition.equals(that.definition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, jobId, definition);
    }

    @Override
    public String toString() {
        return "Pipeline[" + name + ", run=" + jobId + ", " + definition + "]";
    }
}
