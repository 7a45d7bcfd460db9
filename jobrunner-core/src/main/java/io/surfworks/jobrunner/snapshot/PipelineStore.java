package io.surfworks.jobrunner.snapshot;

import io.surfworks.jobrunner.pipeline.Pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory of pipeline snapshots.
 *
 * <p>Layout under the root:
 * <ul>
 *   <li>{@code runs/<run id>.json} - scheduled runs, rewritten after every status change</li>
 *   <li>{@code pipelines/<name>.json} - reusable pipeline definitions</li>
 * </ul>
 */
public final class PipelineStore {

    private static final String RUNS = "runs";
    private static final String TEMPLATES = "pipelines";
    private static final String EXTENSION = ".json";

    private final Path root;

    public PipelineStore(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    // ===== Runs =====

    /**
     * Writes a run snapshot, replacing the previous one.
     *
     * @throws IllegalArgumentException if the pipeline has no run id
     */
    public Path save(Pipeline pipeline) throws IOException {
        if (pipeline.jobId() == null) {
            throw new IllegalArgumentException("Pipeline " + pipeline.name() + " has no run id");
        }
        return write(root.resolve(RUNS), pipeline.jobId(), pipeline);
    }

    /**
     * Reads a run snapshot.
     *
     * @throws java.nio.file.NoSuchFileException if there is no such run
     * @throws SnapshotException if the snapshot cannot be decoded
     */
    public Pipeline load(String runId) throws IOException, SnapshotException {
        return read(root.resolve(RUNS), runId);
    }

    /**
     * Lists stored run ids, sorted.
     */
    public List<String> listRuns() throws IOException {
        return list(root.resolve(RUNS));
    }

    // ===== Pipeline definitions =====

    /**
     * Stores a pipeline definition under a name.
     */
    public Path saveTemplate(String name, Pipeline pipeline) throws IOException {
        return write(root.resolve(TEMPLATES), name, pipeline);
    }

    /**
     * Reads a stored pipeline definition.
     *
     * @throws java.nio.file.NoSuchFileException if there is no such definition
     * @throws SnapshotException if the snapshot cannot be decoded
     */
    public Pipeline loadTemplate(String name) throws IOException, SnapshotException {
        return read(root.resolve(TEMPLATES), name);
    }

    /**
     * Lists stored pipeline definition names, sorted.
     */
    public List<String> listTemplates() throws IOException {
        return list(root.resolve(TEMPLATES));
    }

    private static Path write(Path dir, String key, Pipeline pipeline) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(fileName(key));
        Path tmp = dir.resolve(fileName(key) + ".tmp");
        Files.writeString(tmp, JobNodeCodec.write(pipeline), StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return file;
    }

    private static Pipeline read(Path dir, String key) throws IOException, SnapshotException {
        String json = Files.readString(dir.resolve(fileName(key)), StandardCharsets.UTF_8);
        return JobNodeCodec.readPipeline(json);
    }

    private static List<String> list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static String fileName(String key) {
        if (key.isBlank() || key.contains("/") || key.contains("\\") || key.contains("..")) {
            throw new IllegalArgumentException("Invalid snapshot name: '" + key + "'");
        }
        return key + EXTENSION;
    }
}
