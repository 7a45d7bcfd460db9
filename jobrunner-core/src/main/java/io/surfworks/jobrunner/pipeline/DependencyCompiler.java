package io.surfworks.jobrunner.pipeline;

import io.surfworks.jobrunner.job.Dependency;
import io.surfworks.jobrunner.job.JobSubmission;
import io.surfworks.jobrunner.job.ResourceProfile;
import io.surfworks.jobrunner.profile.ProfileRegistry;
import io.surfworks.jobrunner.profile.ScriptTemplates;
import io.surfworks.jobrunner.scheduler.Scheduler;
import io.surfworks.jobrunner.scheduler.SchedulerException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns a {@link Job} and its {@link DependencyContext} into a submission
 * directive and hands it to the scheduler.
 *
 * <p>The tree walk itself lives in each node's {@code generate}; this class
 * holds what every job submission needs: the scheduler, the profile registry,
 * the script templates and the local work directory that output directories
 * are materialized under.
 */
public final class DependencyCompiler {

    private static final Logger LOG = Logger.getLogger(DependencyCompiler.class.getName());

    private final Scheduler scheduler;
    private final ProfileRegistry profiles;
    private final ScriptTemplates templates;
    private final Path localWorkDir;

    public DependencyCompiler(Scheduler scheduler, ProfileRegistry profiles,
                              ScriptTemplates templates, Path localWorkDir) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
        this.templates = Objects.requireNonNull(templates, "templates cannot be null");
        this.localWorkDir = Objects.requireNonNull(localWorkDir, "localWorkDir cannot be null");
    }

    /**
     * Returns the scheduler directives are submitted to.
     */
    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Returns the local directory output directories are created under.
     */
    public Path localWorkDir() {
        return localWorkDir;
    }

    /**
     * Builds the directive for a job.
     *
     * @throws SubmissionException if the profile or script cannot be resolved
     */
    public JobSubmission compile(Job job, DependencyContext context) throws SubmissionException {
        String jobId = job.jobId();
        if (jobId == null) {
            throw new IllegalStateException("Job '" + job.script() + "' has no job id; build it inside a Pipeline");
        }

        ResourceProfile profile = profiles.find(job.profile())
                .orElseThrow(() -> new SubmissionException(jobId,
                        "unknown profile '" + job.profile() + "' (known: " + profiles.names() + ")"));

        String body;
        try {
            body = templates.read(job.script());
        } catch (IllegalArgumentException e) {
            throw new SubmissionException(jobId, e.getMessage(), e);
        } catch (IOException e) {
            throw new SubmissionException(jobId, "cannot read script: " + e.getMessage(), e);
        }

        Dependency dependency = context.dependency().orElse(null);
        return JobSubmission.of(jobId, job.script(), body, profile, job.outputDir(context.outputDir()), dependency);
    }

    /**
     * Materializes the directive's local output directory, then submits it.
     *
     * @return the external id assigned by the scheduler
     * @throws SubmissionException if the directory cannot be created or the scheduler rejects the directive
     */
    public String submit(JobSubmission submission) throws SubmissionException {
        Path local = localWorkDir.resolve(submission.outputDir());
        try {
            Files.createDirectories(local);
        } catch (IOException e) {
            throw new SubmissionException(submission.jobId(), "cannot create output directory " + local, e);
        }

        LOG.fine(() -> "Submitting " + submission.jobId() + " to " + scheduler.name()
                + " with " + submission.batchArguments(Path.of("")));

        String externalId;
        try {
            externalId = scheduler.submit(submission);
        } catch (SchedulerException e) {
            throw new SubmissionException(submission.jobId(), "rejected by " + scheduler.name() + ": " + e.getMessage(), e);
        }

        if (!Dependency.isValidId(externalId)) {
            throw new SubmissionException(submission.jobId(),
                    "scheduler returned an unusable job id '" + externalId + "'");
        }
        return externalId;
    }
}
