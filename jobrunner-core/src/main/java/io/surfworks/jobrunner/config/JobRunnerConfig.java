package io.surfworks.jobrunner.config;

import io.surfworks.jobrunner.scheduler.slurm.SlurmConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the job runner.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/jobrunner/jobrunner.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param defaultScheduler scheduler name ("slurm", "dry-run")
 * @param workDir          local directory job output directories are materialized under
 * @param cacheDir         directory pipeline snapshots are stored in
 * @param templatesDir     directory of batch script templates
 * @param profilesFile     JSON file of resource profiles
 * @param slurmConfig      Slurm connection (may be null)
 */
public record JobRunnerConfig(
        String defaultScheduler,
        Path workDir,
        Path cacheDir,
        Path templatesDir,
        Path profilesFile,
        SlurmConfig slurmConfig
) {

    /** Default scheduler when none is configured */
    public static final String DEFAULT_SCHEDULER = "slurm";

    public static final Path DEFAULT_WORK_DIR = Path.of("scratch", "jobrunner");
    public static final Path DEFAULT_CACHE_DIR = Path.of("data");
    public static final Path DEFAULT_TEMPLATES_DIR = Path.of("scripts", "slurm");
    public static final Path DEFAULT_PROFILES_FILE = Path.of("config", "slurm-profiles.json");

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "jobrunner"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "jobrunner.json";

    public JobRunnerConfig {
        Objects.requireNonNull(defaultScheduler, "defaultScheduler cannot be null");
        Objects.requireNonNull(workDir, "workDir cannot be null");
        Objects.requireNonNull(cacheDir, "cacheDir cannot be null");
        Objects.requireNonNull(templatesDir, "templatesDir cannot be null");
        Objects.requireNonNull(profilesFile, "profilesFile cannot be null");

        if (defaultScheduler.isBlank()) {
            throw new IllegalArgumentException("defaultScheduler cannot be blank");
        }
    }

    /**
     * Returns the default configuration.
     */
    public static JobRunnerConfig defaults() {
        return new JobRunnerConfig(
                DEFAULT_SCHEDULER,
                DEFAULT_WORK_DIR,
                DEFAULT_CACHE_DIR,
                DEFAULT_TEMPLATES_DIR,
                DEFAULT_PROFILES_FILE,
                null
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public JobRunnerConfig withScheduler(String scheduler) {
        return new JobRunnerConfig(scheduler, workDir, cacheDir, templatesDir, profilesFile, slurmConfig);
    }

    public JobRunnerConfig withWorkDir(Path dir) {
        return new JobRunnerConfig(defaultScheduler, dir, cacheDir, templatesDir, profilesFile, slurmConfig);
    }

    public JobRunnerConfig withCacheDir(Path dir) {
        return new JobRunnerConfig(defaultScheduler, workDir, dir, templatesDir, profilesFile, slurmConfig);
    }

    public JobRunnerConfig withTemplatesDir(Path dir) {
        return new JobRunnerConfig(defaultScheduler, workDir, cacheDir, dir, profilesFile, slurmConfig);
    }

    public JobRunnerConfig withProfilesFile(Path file) {
        return new JobRunnerConfig(defaultScheduler, workDir, cacheDir, templatesDir, file, slurmConfig);
    }

    public JobRunnerConfig withSlurm(SlurmConfig slurm) {
        return new JobRunnerConfig(defaultScheduler, workDir, cacheDir, templatesDir, profilesFile, slurm);
    }
}
