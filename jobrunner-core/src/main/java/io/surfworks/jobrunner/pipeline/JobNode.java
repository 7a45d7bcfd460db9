package io.surfworks.jobrunner.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.List;

/**
 * A node of a job tree.
 *
 * <p>The variant set is closed: {@link Job} is the submittable leaf,
 * {@link Sequential} and {@link Parallel} compose, and {@link Skip} and
 * {@link PassThrough} stand in for work a previous run already completed.
 * Decoding lives in {@code JobNodeCodec}.
 */
public sealed interface JobNode permits Job, Sequential, Parallel, Skip, PassThrough {

    /**
     * Submits every job below this node and returns the ids a successor must depend on.
     *
     * @param context predecessor ids, release condition and enclosing output directory
     * @throws SubmissionException if a submission failure stops this node
     * @throws DependencyResolutionException if a successor would have nothing to depend on
     */
    SubmissionOutcome generate(DependencyContext context) throws PipelineException;

    /**
     * Returns this node's output directory under its parent's.
     */
    Path outputDir(Path root);

    /**
     * Returns the snapshot record of this node and everything below it.
     */
    ObjectNode toSnapshot();

    /**
     * Returns the direct children, in declared order.
     */
    default List<JobNode> children() {
        return List.of();
    }
}
