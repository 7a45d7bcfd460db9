package io.surfworks.jobrunner.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.scheduler.slurm.SlurmConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads and saves JobRunnerConfig.
 *
 * <p>CLI arguments are handled by the caller and merged into the config.
 */
public final class JobRunnerConfigLoader {

    private static final Logger LOG = Logger.getLogger(JobRunnerConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private JobRunnerConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static JobRunnerConfig load() {
        return load(JobRunnerConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * <p>A missing file yields defaults. An unreadable file is logged and also yields defaults.
     */
    public static JobRunnerConfig load(Path configFile) {
        JobRunnerConfig config = JobRunnerConfig.defaults();
        if (!Files.exists(configFile)) {
            return config;
        }
        try {
            return loadFromFile(configFile, config);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warning("Ignoring unreadable config " + configFile + ": " + e.getMessage());
            return config;
        }
    }

    /**
     * Saves configuration to the default config file.
     */
    public static void save(JobRunnerConfig config) throws IOException {
        save(config, JobRunnerConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     */
    public static void save(JobRunnerConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("defaultScheduler", config.defaultScheduler());
        root.put("workDir", config.workDir().toString());
        root.put("cacheDir", config.cacheDir().toString());
        root.put("templatesDir", config.templatesDir().toString());
        root.put("profilesFile", config.profilesFile().toString());

        if (config.slurmConfig() != null) {
            SlurmConfig s = config.slurmConfig();
            ObjectNode slurm = root.putObject("slurm");
            slurm.put("host", s.sshHost());
            slurm.put("user", s.sshUser());
            if (s.sshKeyPath() != null) {
                slurm.put("keyPath", s.sshKeyPath().toString());
            }
            if (s.partition() != null) {
                slurm.put("partition", s.partition());
            }
            slurm.put("workDir", s.remoteWorkDir().toString());
            slurm.put("connectTimeout", s.sshConnectTimeoutSeconds());
        }

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static JobRunnerConfig loadFromFile(Path configFile, JobRunnerConfig base) throws IOException {
        JsonNode root = JSON.readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Config root must be a JSON object");
        }

        JobRunnerConfig config = base
                .withScheduler(getStringOrDefault(root, "defaultScheduler", base.defaultScheduler()))
                .withWorkDir(getPathOrDefault(root, "workDir", base.workDir()))
                .withCacheDir(getPathOrDefault(root, "cacheDir", base.cacheDir()))
                .withTemplatesDir(getPathOrDefault(root, "templatesDir", base.templatesDir()))
                .withProfilesFile(getPathOrDefault(root, "profilesFile", base.profilesFile()));

        if (root.has("slurm")) {
            JsonNode slurmNode = root.get("slurm");
            if (slurmNode.has("host") && slurmNode.has("user")) {
                SlurmConfig slurm = new SlurmConfig(
                        slurmNode.get("host").asText(),
                        slurmNode.get("user").asText(),
                        slurmNode.has("keyPath") ? Path.of(slurmNode.get("keyPath").asText()) : null,
                        slurmNode.has("partition") ? slurmNode.get("partition").asText() : null,
                        getPathOrDefault(slurmNode, "workDir", SlurmConfig.DEFAULT_WORK_DIR),
                        slurmNode.has("connectTimeout")
                                ? slurmNode.get("connectTimeout").asInt()
                                : SlurmConfig.DEFAULT_SSH_TIMEOUT);
                config = config.withSlurm(slurm);
            } else {
                LOG.warning("Ignoring 'slurm' block without host and user in " + configFile);
            }
        }

        return config;
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.has(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }

    private static Path getPathOrDefault(JsonNode node, String field, Path defaultValue) {
        if (node.has(field)) {
            return Path.of(node.get(field).asText());
        }
        return defaultValue;
    }
}
