package io.surfworks.jobrunner.pipeline;

import io.surfworks.jobrunner.job.Dependency;
import io.surfworks.jobrunner.job.DependencyEvent;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a node depends on while the tree is being generated.
 *
 * <p>Transient: rebuilt on every pass and never persisted.
 *
 * @param dependsOn    Predecessor external ids (empty at the root)
 * @param dependsEvent Release condition against {@code dependsOn}
 * @param outputDir    Output directory of the enclosing node, relative to the work directory
 * @param compiler     Turns jobs into submitted directives
 */
public record DependencyContext(
        List<String> dependsOn,
        DependencyEvent dependsEvent,
        Path outputDir,
        DependencyCompiler compiler
) {

    public DependencyContext {
        Objects.requireNonNull(dependsOn, "dependsOn cannot be null");
        Objects.requireNonNull(dependsEvent, "dependsEvent cannot be null");
        Objects.requireNonNull(outputDir, "outputDir cannot be null");
        Objects.requireNonNull(compiler, "compiler cannot be null");

        dependsOn = List.copyOf(dependsOn);
    }

    /**
     * Creates the context of a tree root: no predecessor.
     */
    public static DependencyContext root(Path outputDir, DependencyCompiler compiler) {
        return new DependencyContext(List.of(), DependencyEvent.AFTER_OK, outputDir, compiler);
    }

    /**
     * Returns this context with the output directory nested one level deeper.
     */
    public DependencyContext nested(String segment) {
        return new DependencyContext(dependsOn, dependsEvent, outputDir.resolve(segment), compiler);
    }

    /**
     * Returns a context depending on the given ids succeeding.
     */
    public DependencyContext afterOk(List<String> externalIds) {
        return new DependencyContext(externalIds, DependencyEvent.AFTER_OK, outputDir, compiler);
    }

    /**
     * Returns the dependency clause to embed, or empty when there is no predecessor.
     */
    public Optional<Dependency> dependency() {
        if (dependsOn.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Dependency.on(dependsEvent, dependsOn));
    }
}
