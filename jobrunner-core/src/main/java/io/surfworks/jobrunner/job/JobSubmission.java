package io.surfworks.jobrunner.job;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A submission directive for one job: what to run, under which profile,
 * after which predecessors, and where its output goes.
 *
 * @param jobId       Pipeline-local job id, also used as the scheduler job name
 * @param script      Script reference the body was resolved from
 * @param scriptBody  Batch script body
 * @param profile     Resolved resource profile
 * @param outputDir   Output directory, relative to the scheduler's work directory
 * @param dependency  Dependency clause (null when the job has no predecessor)
 * @param submittedBy Username of the submitter
 * @param submittedAt Timestamp the directive was built
 */
public record JobSubmission(
        String jobId,
        String script,
        String scriptBody,
        ResourceProfile profile,
        Path outputDir,
        Dependency dependency,
        String submittedBy,
        Instant submittedAt
) {

    public JobSubmission {
        Objects.requireNonNull(jobId, "jobId cannot be null");
        Objects.requireNonNull(script, "script cannot be null");
        Objects.requireNonNull(scriptBody, "scriptBody cannot be null");
        Objects.requireNonNull(profile, "profile cannot be null");
        Objects.requireNonNull(outputDir, "outputDir cannot be null");
        Objects.requireNonNull(submittedBy, "submittedBy cannot be null");
        Objects.requireNonNull(submittedAt, "submittedAt cannot be null");

        if (jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be blank");
        }
        if (outputDir.isAbsolute()) {
            throw new IllegalArgumentException("outputDir must be relative: " + outputDir);
        }
    }

    /**
     * Creates a directive submitted by the current user.
     */
    public static JobSubmission of(String jobId, String script, String scriptBody,
                                   ResourceProfile profile, Path outputDir, Dependency dependency) {
        return new JobSubmission(
                jobId, script, scriptBody, profile, outputDir, dependency,
                System.getProperty("user.name", "unknown"),
                Instant.now()
        );
    }

    /**
     * Returns the dependency clause, if any.
     */
    public Optional<Dependency> dependencyClause() {
        return Optional.ofNullable(dependency);
    }

    /**
     * Returns the scheduler arguments for this directive, with output paths
     * resolved under the given work directory.
     *
     * <p>Order: job name, output, error, profile arguments, dependency.
     */
    public List<String> batchArguments(Path workDir) {
        Path out = workDir.resolve(outputDir);
        List<String> args = new ArrayList<>();
        args.add("--job-name=" + jobId);
        args.add("--output=" + out.resolve("slurm-%j.out"));
        args.add("--error=" + out.resolve("slurm-%j.err"));
        args.addAll(profile.sbatchArgs());
        if (dependency != null) {
            args.add(dependency.toArgument());
        }
        return args;
    }
}
