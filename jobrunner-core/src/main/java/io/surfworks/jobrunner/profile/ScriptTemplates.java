package io.surfworks.jobrunner.profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory of batch script templates.
 *
 * <p>A job's script reference {@code install} maps to {@code <dir>/install.sh}.
 * References are plain names: separators and {@code ..} are rejected.
 */
public final class ScriptTemplates {

    /** Template file extension */
    public static final String EXTENSION = ".sh";

    private final Path directory;

    public ScriptTemplates(Path directory) {
        this.directory = directory;
    }

    /**
     * Returns the template directory.
     */
    public Path directory() {
        return directory;
    }

    /**
     * Returns true if the reference is a plain template name.
     */
    public static boolean isWellFormed(String script) {
        return script != null
                && !script.isBlank()
                && !script.contains("/")
                && !script.contains("\\")
                && !script.contains("..");
    }

    /**
     * Locates the template file for a reference.
     *
     * @return the template path, or empty if no such template exists
     * @throws IllegalArgumentException if the reference is malformed
     */
    public Optional<Path> locate(String script) {
        if (!isWellFormed(script)) {
            throw new IllegalArgumentException("Malformed script reference: '" + script + "'");
        }
        Path file = directory.resolve(script + EXTENSION);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    /**
     * Reads a template body.
     *
     * @throws IOException if the template is missing or unreadable
     * @throws IllegalArgumentException if the reference is malformed
     */
    public String read(String script) throws IOException {
        Path file = locate(script)
                .orElseThrow(() -> new IOException("No template '" + script + "' in " + directory));
        return Files.readString(file);
    }

    /**
     * Lists template names, sorted.
     */
    public List<String> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
