package io.surfworks.jobrunner.scheduler.slurm;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the Slurm scheduler.
 *
 * @param sshHost                  SSH hostname for the Slurm login node
 * @param sshUser                  SSH username
 * @param sshKeyPath               Path to SSH private key (null = use default)
 * @param partition                Slurm partition name (null = cluster default)
 * @param remoteWorkDir            Remote directory that job output directories are created under
 * @param sshConnectTimeoutSeconds SSH connection timeout in seconds
 */
public record SlurmConfig(
        String sshHost,
        String sshUser,
        Path sshKeyPath,
        String partition,
        Path remoteWorkDir,
        int sshConnectTimeoutSeconds
) {

    /** Default SSH connection timeout */
    public static final int DEFAULT_SSH_TIMEOUT = 10;

    /** Default remote work directory, relative to the remote home */
    public static final Path DEFAULT_WORK_DIR = Path.of("scratch", "jobrunner");

    public SlurmConfig {
        Objects.requireNonNull(sshHost, "sshHost cannot be null");
        Objects.requireNonNull(sshUser, "sshUser cannot be null");
        Objects.requireNonNull(remoteWorkDir, "remoteWorkDir cannot be null");

        if (sshHost.isBlank()) {
            throw new IllegalArgumentException("sshHost cannot be blank");
        }
        if (sshUser.isBlank()) {
            throw new IllegalArgumentException("sshUser cannot be blank");
        }
        if (sshConnectTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("sshConnectTimeoutSeconds must be positive");
        }
    }

    /**
     * Creates a config for connecting to a Slurm cluster.
     */
    public static SlurmConfig of(String host, String user) {
        return new SlurmConfig(host, user, null, null, DEFAULT_WORK_DIR, DEFAULT_SSH_TIMEOUT);
    }

    /**
     * Returns a new config with specified SSH key.
     */
    public SlurmConfig withKey(Path keyPath) {
        return new SlurmConfig(sshHost, sshUser, keyPath, partition, remoteWorkDir, sshConnectTimeoutSeconds);
    }

    /**
     * Returns a new config with specified partition.
     */
    public SlurmConfig withPartition(String partition) {
        return new SlurmConfig(sshHost, sshUser, sshKeyPath, partition, remoteWorkDir, sshConnectTimeoutSeconds);
    }

    /**
     * Returns a new config with specified work directory.
     */
    public SlurmConfig withWorkDir(Path workDir) {
        return new SlurmConfig(sshHost, sshUser, sshKeyPath, partition, workDir, sshConnectTimeoutSeconds);
    }

    /**
     * Returns the SSH connection string (user@host).
     */
    public String sshTarget() {
        return sshUser + "@" + sshHost;
    }
}
