package io.surfworks.jobrunner.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.surfworks.jobrunner.config.JobRunnerConfig;
import io.surfworks.jobrunner.config.JobRunnerConfigLoader;
import io.surfworks.jobrunner.job.ResourceProfile;
import io.surfworks.jobrunner.pipeline.DependencyCompiler;
import io.surfworks.jobrunner.pipeline.Job;
import io.surfworks.jobrunner.pipeline.NodeStatus;
import io.surfworks.jobrunner.pipeline.Pipeline;
import io.surfworks.jobrunner.pipeline.PipelineException;
import io.surfworks.jobrunner.pipeline.RerunPlanner;
import io.surfworks.jobrunner.pipeline.StandardRuns;
import io.surfworks.jobrunner.pipeline.StatusQueryException;
import io.surfworks.jobrunner.pipeline.StatusReconciler;
import io.surfworks.jobrunner.pipeline.SubmissionOutcome;
import io.surfworks.jobrunner.profile.ProfileRegistry;
import io.surfworks.jobrunner.profile.ScriptTemplates;
import io.surfworks.jobrunner.scheduler.Scheduler;
import io.surfworks.jobrunner.scheduler.SchedulerException;
import io.surfworks.jobrunner.scheduler.SchedulerRegistry;
import io.surfworks.jobrunner.scheduler.slurm.SlurmScheduler;
import io.surfworks.jobrunner.snapshot.JobNodeCodec;
import io.surfworks.jobrunner.snapshot.PipelineStore;
import io.surfworks.jobrunner.testing.MockScheduler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Job runner CLI - submits job trees to a batch scheduler and reruns what failed.
 *
 * <p>Commands:
 * <ul>
 *   <li>submit - Schedule a pipeline and store the run</li>
 *   <li>status - Reconcile a stored run with the scheduler</li>
 *   <li>rerun - Resubmit the failed and unreached jobs of a run</li>
 *   <li>show - Print a stored run without contacting the scheduler</li>
 *   <li>cancel - Cancel the submitted jobs of a run</li>
 *   <li>runs - List stored runs</li>
 *   <li>template - Manage stored pipeline definitions</li>
 *   <li>profiles - List resource profiles</li>
 *   <li>config - Show configuration</li>
 * </ul>
 */
public class JobRunnerCli {

    private static final String VERSION = "0.1.0";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final int STATUS_ATTEMPTS = 3;
    private static final long STATUS_BACKOFF_MILLIS = 2000;

    public static void main(String[] args) {
        if (args.length == 0) {
            printHelp();
            return;
        }

        String command = args[0];

        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return;
        }
        if (command.equals("--version") || command.equals("-v")) {
            System.out.println("jobrunner " + VERSION);
            return;
        }
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            switch (command) {
                case "submit" -> handleSubmit(commandArgs);
                case "status" -> handleStatus(commandArgs);
                case "rerun" -> handleRerun(commandArgs);
                case "show" -> handleShow(commandArgs);
                case "cancel" -> handleCancel(commandArgs);
                case "runs" -> handleRuns(commandArgs);
                case "template" -> handleTemplate(commandArgs);
                case "profiles" -> handleProfiles(commandArgs);
                case "config" -> handleConfig(commandArgs);
                default -> {
                    System.err.println("Unknown command: " + command);
                    System.err.println("Run 'jobrunner --help' for usage.");
                    System.exit(1);
                }
            }
        } catch (SchedulerException e) {
            System.err.println("Scheduler error: " + e.getMessage());
            System.exit(1);
        } catch (PipelineException e) {
            System.err.println("Pipeline error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            System.exit(1);
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void handleSubmit(String[] args) throws PipelineException, IOException {
        if (hasFlag(args, "--help")) {
            printSubmitHelp();
            return;
        }

        String file = getFlagValue(args, "--file");
        String template = getFlagValue(args, "--template");
        String runName = getFlagValue(args, "--name");
        boolean json = hasFlag(args, "--json");

        JobRunnerConfig config = loadConfig(args);
        PipelineStore store = new PipelineStore(config.cacheDir());

        Pipeline definition;
        if (file != null) {
            definition = JobNodeCodec.readPipeline(Files.readString(Path.of(file), StandardCharsets.UTF_8));
        } else if (template != null) {
            definition = store.loadTemplate(template);
        } else if (hasFlag(args, "--standard")) {
            definition = new Pipeline("benchmark", StandardRuns.benchmark(), null);
        } else {
            System.err.println("Error: one of --file, --template or --standard is required");
            printSubmitHelp();
            System.exit(1);
            return;
        }

        // Fresh run: new id, nothing submitted yet
        Pipeline run = Pipeline.create(
                runName != null ? runName : definition.name(),
                RerunPlanner.plan(definition.definition()));

        try (Scheduler scheduler = getScheduler(getFlagValue(args, "--scheduler"), config)) {
            scheduleAndStore(run, compiler(scheduler, config), store, json);
        }
    }

    private static void handleStatus(String[] args) throws PipelineException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            System.out.println("Usage: jobrunner status <run-id> [--scheduler <name>] [--config <file>] [--json]");
            if (args.length == 0) System.exit(1);
            return;
        }

        JobRunnerConfig config = loadConfig(args);
        PipelineStore store = new PipelineStore(config.cacheDir());
        Pipeline run = store.load(args[0]);

        try (Scheduler scheduler = getScheduler(getFlagValue(args, "--scheduler"), config)) {
            reconcileWithRetry(new StatusReconciler(scheduler), run);
        }
        store.save(run);
        printRun(run, hasFlag(args, "--json"));
    }

    private static void handleRerun(String[] args) throws PipelineException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            System.out.println("Usage: jobrunner rerun <run-id> [--scheduler <name>] [--config <file>] [--json]");
            if (args.length == 0) System.exit(1);
            return;
        }

        boolean json = hasFlag(args, "--json");
        JobRunnerConfig config = loadConfig(args);
        PipelineStore store = new PipelineStore(config.cacheDir());
        Pipeline previous = store.load(args[0]);

        try (Scheduler scheduler = getScheduler(getFlagValue(args, "--scheduler"), config)) {
            reconcileWithRetry(new StatusReconciler(scheduler), previous);
            store.save(previous);

            if (!StatusReconciler.isSettled(previous)) {
                System.err.println("Error: run " + previous.jobId() + " still has jobs in flight; retry once they finish");
                System.exit(1);
                return;
            }

            Pipeline next = RerunPlanner.rerun(previous);
            if (RerunPlanner.resubmittableJobs(next.definition()) == 0) {
                System.out.println("Nothing to rerun: every job of " + previous.jobId() + " succeeded.");
                return;
            }
            scheduleAndStore(next, compiler(scheduler, config), store, json);
        }
    }

    private static void handleShow(String[] args) throws PipelineException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            System.out.println("Usage: jobrunner show <run-id> [--config <file>] [--json]");
            if (args.length == 0) System.exit(1);
            return;
        }

        JobRunnerConfig config = loadConfig(args);
        printRun(new PipelineStore(config.cacheDir()).load(args[0]), hasFlag(args, "--json"));
    }

    private static void handleCancel(String[] args) throws PipelineException, SchedulerException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            System.out.println("Usage: jobrunner cancel <run-id> [--scheduler <name>] [--config <file>]");
            if (args.length == 0) System.exit(1);
            return;
        }

        JobRunnerConfig config = loadConfig(args);
        Pipeline run = new PipelineStore(config.cacheDir()).load(args[0]);

        try (Scheduler scheduler = getScheduler(getFlagValue(args, "--scheduler"), config)) {
            for (Job job : run.jobs()) {
                if (job.status() != NodeStatus.SUBMITTED) {
                    continue;
                }
                boolean cancelled = scheduler.cancel(job.externalId());
                System.out.println((cancelled ? "Cancelled " : "Could not cancel ") + job.jobId()
                        + " (" + job.externalId() + ")");
            }
        }
        System.out.println("Run 'jobrunner status " + args[0] + "' to record the outcome.");
    }

    private static void handleRuns(String[] args) throws IOException {
        JobRunnerConfig config = loadConfig(args);
        List<String> runs = new PipelineStore(config.cacheDir()).listRuns();
        if (runs.isEmpty()) {
            System.out.println("No runs stored in " + config.cacheDir());
        } else {
            runs.forEach(System.out::println);
        }
    }

    private static void handleTemplate(String[] args) throws PipelineException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            System.out.println("Usage: jobrunner template list");
            System.out.println("       jobrunner template save <name> <pipeline.json>");
            System.out.println("       jobrunner template show <name>");
            if (args.length == 0) System.exit(1);
            return;
        }

        JobRunnerConfig config = loadConfig(args);
        PipelineStore store = new PipelineStore(config.cacheDir());

        switch (args[0]) {
            case "list" -> {
                store.listTemplates().forEach(System.out::println);
                System.out.println("Scripts in " + config.templatesDir() + ": "
                        + new ScriptTemplates(config.templatesDir()).list());
            }
            case "save" -> {
                if (args.length < 3) {
                    throw new IllegalArgumentException("template save needs <name> <pipeline.json>");
                }
                Pipeline pipeline = JobNodeCodec.readPipeline(Files.readString(Path.of(args[2]), StandardCharsets.UTF_8));
                System.out.println("Saved " + store.saveTemplate(args[1], pipeline));
            }
            case "show" -> {
                if (args.length < 2) {
                    throw new IllegalArgumentException("template show needs <name>");
                }
                System.out.println(JobNodeCodec.write(store.loadTemplate(args[1])));
            }
            default -> throw new IllegalArgumentException("Unknown template command: " + args[0]);
        }
    }

    private static void handleProfiles(String[] args) throws IOException {
        JobRunnerConfig config = loadConfig(args);
        ProfileRegistry profiles = loadProfiles(config);
        if (profiles.names().isEmpty()) {
            System.out.println("No profiles defined in " + config.profilesFile());
            return;
        }
        for (String name : profiles.names()) {
            ResourceProfile profile = profiles.find(name).orElseThrow();
            System.out.printf("%-12s %-4s %s%n", name, profile.requestsGpu() ? "gpu" : "cpu",
                    String.join(" ", profile.sbatchArgs()));
        }
    }

    private static void handleConfig(String[] args) throws IOException {
        JobRunnerConfig config = loadConfig(args);

        if (hasFlag(args, "--init")) {
            Path file = JobRunnerConfig.configFile();
            JobRunnerConfigLoader.save(config, file);
            System.out.println("Wrote " + file);
            return;
        }

        System.out.println("Configuration");
        System.out.println("-".repeat(40));
        System.out.println("Scheduler: " + config.defaultScheduler());
        System.out.println("Work dir: " + config.workDir());
        System.out.println("Cache dir: " + config.cacheDir());
        System.out.println("Templates: " + config.templatesDir());
        System.out.println("Profiles: " + config.profilesFile());
        if (config.slurmConfig() != null) {
            System.out.println("Slurm: " + config.slurmConfig().sshTarget()
                    + " (remote work dir " + config.slurmConfig().remoteWorkDir() + ")");
        } else {
            System.out.println("Slurm: (not configured)");
        }
    }

    // ===== Helpers =====

    private static void scheduleAndStore(Pipeline run, DependencyCompiler compiler, PipelineStore store, boolean json)
            throws PipelineException, IOException {
        try {
            SubmissionOutcome outcome = run.schedule(compiler);
            if (!json) {
                System.out.println("Run " + run.jobId() + " submitted, final job ids: " + outcome.joinedId());
            }
        } finally {
            // the tree is stored whatever happened, so the failure is visible and rerunnable
            Path saved = store.save(run);
            if (!json) {
                System.out.println("Stored " + saved);
            }
            printRun(run, json);
        }
    }

    private static void reconcileWithRetry(StatusReconciler reconciler, Pipeline run)
            throws StatusQueryException {
        long backoff = STATUS_BACKOFF_MILLIS;
        for (int attempt = 1; ; attempt++) {
            try {
                reconciler.reconcile(run);
                return;
            } catch (StatusQueryException e) {
                if (attempt >= STATUS_ATTEMPTS) {
                    throw e;
                }
                System.err.println("Status query failed (attempt " + attempt + "), retrying: " + e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                backoff *= 2;
            }
        }
    }

    private static void printRun(Pipeline run, boolean json) throws IOException {
        if (json) {
            System.out.println(JSON.writeValueAsString(run.toSnapshot()));
            return;
        }

        System.out.println("Run " + run.jobId() + " (" + run.name() + ")");
        System.out.println("-".repeat(60));
        Map<String, NodeStatus> statuses = run.statusByJobId();
        for (Map.Entry<String, NodeStatus> entry : statuses.entrySet()) {
            String externalId = run.job(entry.getKey()).map(Job::externalId).orElse(null);
            System.out.printf("  %-24s  %-10s  %s%n",
                    entry.getKey(),
                    entry.getValue().wireName(),
                    externalId != null ? externalId : "-");
        }
    }

    private static DependencyCompiler compiler(Scheduler scheduler, JobRunnerConfig config) throws IOException {
        return new DependencyCompiler(
                scheduler,
                loadProfiles(config),
                new ScriptTemplates(config.templatesDir()),
                config.workDir());
    }

    private static ProfileRegistry loadProfiles(JobRunnerConfig config) throws IOException {
        if (!Files.exists(config.profilesFile())) {
            return ProfileRegistry.empty();
        }
        return ProfileRegistry.load(config.profilesFile());
    }

    private static JobRunnerConfig loadConfig(String[] args) {
        String configFile = getFlagValue(args, "--config");
        return configFile != null
                ? JobRunnerConfigLoader.load(Path.of(configFile))
                : JobRunnerConfigLoader.load();
    }

    private static Scheduler getScheduler(String name, JobRunnerConfig config) {
        if (config.slurmConfig() != null && !SchedulerRegistry.isRegistered("slurm")) {
            SchedulerRegistry.register("slurm", () -> new SlurmScheduler(config.slurmConfig()));
        }
        if (!SchedulerRegistry.isRegistered("dry-run")) {
            SchedulerRegistry.register("dry-run", MockScheduler::new);
        }
        return SchedulerRegistry.get(name != null ? name : config.defaultScheduler());
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    // ===== Help output =====

    private static void printHelp() {
        System.out.println("jobrunner - submit job trees to a batch scheduler and rerun what failed");
        System.out.println();
        System.out.println("Usage: jobrunner <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  submit     Schedule a pipeline and store the run");
        System.out.println("  status     Reconcile a stored run with the scheduler");
        System.out.println("  rerun      Resubmit the failed and unreached jobs of a run");
        System.out.println("  show       Print a stored run");
        System.out.println("  cancel     Cancel the submitted jobs of a run");
        System.out.println("  runs       List stored runs");
        System.out.println("  template   Manage stored pipeline definitions");
        System.out.println("  profiles   List resource profiles");
        System.out.println("  config     Show configuration (--init writes it)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -h, --help    Show help for a command");
        System.out.println("  -v, --version Show version");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  jobrunner submit --standard --name nightly");
        System.out.println("  jobrunner status 1c9e2f4a");
        System.out.println("  jobrunner rerun 1c9e2f4a");
    }

    private static void printSubmitHelp() {
        System.out.println("Usage: jobrunner submit [options]");
        System.out.println();
        System.out.println("Schedule a pipeline under a fresh run id and store the run.");
        System.out.println();
        System.out.println("Pipeline source (one required):");
        System.out.println("  --file <path>         Pipeline snapshot JSON");
        System.out.println("  --template <name>     Stored pipeline definition");
        System.out.println("  --standard            Standard benchmark pipeline");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --name <name>         Run name (default: the pipeline's)");
        System.out.println("  --scheduler <name>    Scheduler to use (slurm, dry-run)");
        System.out.println("  --config <file>       Config file (default: ~/.config/jobrunner/jobrunner.json)");
        System.out.println("  --json                Output the run snapshot as JSON");
    }
}
