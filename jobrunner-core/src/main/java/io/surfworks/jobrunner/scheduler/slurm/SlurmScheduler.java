package io.surfworks.jobrunner.scheduler.slurm;

import io.surfworks.jobrunner.job.JobState;
import io.surfworks.jobrunner.job.JobStatus;
import io.surfworks.jobrunner.job.JobSubmission;
import io.surfworks.jobrunner.scheduler.Scheduler;
import io.surfworks.jobrunner.scheduler.SchedulerException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slurm scheduler using SSH + sbatch/squeue/sacct/scancel commands.
 *
 * <p>Each directive is rendered into a batch script with one {@code #SBATCH}
 * line per argument, written into the job's remote output directory and
 * submitted from there.
 */
public final class SlurmScheduler implements Scheduler {

    private static final Logger LOG = Logger.getLogger(SlurmScheduler.class.getName());

    private static final Pattern JOB_ID_PATTERN = Pattern.compile("Submitted batch job (\\d+)");

    private final SlurmConfig config;
    private volatile boolean closed;

    /**
     * Creates a Slurm scheduler with the given configuration.
     */
    public SlurmScheduler(SlurmConfig config) {
        this.config = config;
        this.closed = false;
    }

    @Override
    public String name() {
        return "slurm";
    }

    @Override
    public String submit(JobSubmission submission) throws SchedulerException {
        ensureOpen();

        Path remoteDir = config.remoteWorkDir().resolve(submission.outputDir());
        String remotePath = remoteDir.resolve(submission.jobId() + ".sbatch").toString();
        String batchScript = renderBatchScript(submission, config);

        sshExec("mkdir -p " + quote(remoteDir.toString()));
        sshExecWithInput("cat > " + quote(remotePath), batchScript);

        String output = sshExec("cd " + quote(remoteDir.toString()) + " && sbatch " + quote(remotePath));
        String externalId = parseJobId(output);
        LOG.fine(() -> "sbatch accepted " + submission.jobId() + " as " + externalId);
        return externalId;
    }

    @Override
    public JobStatus status(String externalId) throws SchedulerException {
        ensureOpen();

        // squeue only knows queued and running jobs
        String output = sshExec("squeue -j " + externalId + " -o '%T|%M|%N' -h 2>/dev/null || true");
        if (!output.isBlank()) {
            return parseStatusLine(externalId, output);
        }

        output = sshExec("sacct -j " + externalId
                + " -X -o 'State,Elapsed,NodeList' -n -P 2>/dev/null || echo 'UNKNOWN||'");
        return parseStatusLine(externalId, output);
    }

    @Override
    public boolean cancel(String externalId) throws SchedulerException {
        ensureOpen();

        try {
            sshExec("scancel " + externalId);
            return true;
        } catch (SchedulerException e) {
            LOG.warning("scancel " + externalId + " failed: " + e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        if (closed) return false;

        try {
            String output = sshExec("echo ok");
            return "ok".equals(output.trim());
        } catch (SchedulerException e) {
            LOG.fine(() -> "Slurm host unreachable: " + e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Renders the batch script for a directive.
     */
    static String renderBatchScript(JobSubmission submission, SlurmConfig config) {
        StringBuilder sb = new StringBuilder();
        sb.append("#!/bin/bash\n");

        if (config.partition() != null && !config.partition().isBlank()) {
            sb.append("#SBATCH --partition=").append(config.partition()).append("\n");
        }
        for (String arg : submission.batchArguments(config.remoteWorkDir())) {
            sb.append("#SBATCH ").append(arg).append("\n");
        }

        sb.append("\n");
        sb.append("export JOBRUNNER_JOB_ID=").append(submission.jobId()).append("\n");
        sb.append("export JOBRUNNER_OUTPUT=")
                .append(config.remoteWorkDir().resolve(submission.outputDir())).append("\n");
        sb.append("\n");

        // Template bodies may carry their own shebang
        String body = submission.scriptBody();
        if (body.startsWith("#!")) {
            int eol = body.indexOf('\n');
            body = eol < 0 ? "" : body.substring(eol + 1);
        }
        sb.append(body);
        if (!body.endsWith("\n")) {
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Extracts the job id from sbatch output.
     */
    static String parseJobId(String output) throws SchedulerException {
        Matcher matcher = JOB_ID_PATTERN.matcher(output);
        if (matcher.find()) {
            return matcher.group(1);
        }
        throw new SchedulerException("Failed to parse Slurm job ID from: " + output);
    }

    /**
     * Parses a {@code state|elapsed|nodes} line from squeue or sacct.
     */
    static JobStatus parseStatusLine(String externalId, String output) {
        String firstLine = output.trim().split("\n")[0];
        String[] parts = firstLine.split("\\|", -1);
        String stateStr = parts.length > 0 && !parts[0].isBlank() ? parts[0].trim() : "UNKNOWN";
        String elapsed = parts.length > 1 ? parts[1].trim() : "0:00";
        String nodeName = parts.length > 2 ? parts[2].trim() : null;

        return new JobStatus(
                externalId,
                mapSlurmState(stateStr),
                Instant.now(),
                nodeName != null && !nodeName.isBlank() && !"None assigned".equals(nodeName) ? nodeName : null,
                parseElapsed(elapsed),
                stateStr,
                Map.of("slurm_state", stateStr)
        );
    }

    static JobState mapSlurmState(String slurmState) {
        // sacct reports e.g. "CANCELLED by 1234"
        String state = slurmState.trim().split("\\s+")[0].toUpperCase();
        return switch (state) {
            case "PENDING", "CONFIGURING", "REQUEUED", "RESIZING" -> JobState.PENDING;
            case "RUNNING", "COMPLETING", "STAGE_OUT", "SUSPENDED" -> JobState.RUNNING;
            case "COMPLETED" -> JobState.COMPLETED;
            case "FAILED", "NODE_FAIL", "OUT_OF_MEMORY", "BOOT_FAIL", "DEADLINE" -> JobState.FAILED;
            case "CANCELLED", "PREEMPTED", "REVOKED" -> JobState.CANCELLED;
            case "TIMEOUT" -> JobState.TIMEOUT;
            default -> JobState.PENDING;
        };
    }

    static Duration parseElapsed(String elapsed) {
        // Formats like "0:05", "1:23:45", "1-12:34:56"
        try {
            if (elapsed.contains("-")) {
                String[] dayTime = elapsed.split("-");
                int days = Integer.parseInt(dayTime[0]);
                return Duration.ofDays(days).plus(parseHMS(dayTime[1]));
            }
            return parseHMS(elapsed);
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            return Duration.ZERO;
        }
    }

    private static Duration parseHMS(String hms) {
        String[] parts = hms.split(":");
        if (parts.length == 2) {
            return Duration.ofMinutes(Long.parseLong(parts[0]))
                    .plusSeconds(Long.parseLong(parts[1]));
        } else if (parts.length == 3) {
            return Duration.ofHours(Long.parseLong(parts[0]))
                    .plusMinutes(Long.parseLong(parts[1]))
                    .plusSeconds(Long.parseLong(parts[2]));
        }
        return Duration.ZERO;
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private String sshExec(String command) throws SchedulerException {
        return sshExecWithInput(command, null);
    }

    private String sshExecWithInput(String command, String stdin) throws SchedulerException {
        try {
            List<String> cmd = new ArrayList<>();
            cmd.add("ssh");
            cmd.add("-o");
            cmd.add("ConnectTimeout=" + config.sshConnectTimeoutSeconds());
            cmd.add("-o");
            cmd.add("BatchMode=yes");
            if (config.sshKeyPath() != null) {
                cmd.add("-i");
                cmd.add(config.sshKeyPath().toString());
            }
            cmd.add(config.sshTarget());
            cmd.add(command);

            ProcessBuilder pb = new ProcessBuilder(cmd);
            pb.redirectErrorStream(true);
            Process p = pb.start();

            if (stdin != null) {
                p.getOutputStream().write(stdin.getBytes(StandardCharsets.UTF_8));
            }
            p.getOutputStream().close();

            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append("\n");
                }
            }

            int exitCode = p.waitFor();
            if (exitCode != 0) {
                throw new SchedulerException("SSH command failed (exit " + exitCode + "): " + output);
            }

            return output.toString().trim();

        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new SchedulerException("SSH execution failed", e);
        }
    }

    private void ensureOpen() throws SchedulerException {
        if (closed) {
            throw new SchedulerException("Scheduler is closed");
        }
    }
}
