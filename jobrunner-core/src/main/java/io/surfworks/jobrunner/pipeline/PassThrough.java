package io.surfworks.jobrunner.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.snapshot.JobNodeCodec;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A composite whose every job succeeded in an earlier run.
 *
 * <p>Forwards the ids the composite produced back then, so successors keep
 * their dependency wiring.
 */
public final class PassThrough implements JobNode {

    private final String name;
    private final List<String> externalIds;

    public PassThrough(String name, List<String> externalIds) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        PathSegments.require(name, "name");
        this.externalIds = List.copyOf(Objects.requireNonNull(externalIds, "externalIds cannot be null"));
    }

    public String name() {
        return name;
    }

    public List<String> externalIds() {
        return externalIds;
    }

    @Override
    public SubmissionOutcome generate(DependencyContext context) {
        return SubmissionOutcome.of(externalIds);
    }

    @Override
    public Path outputDir(Path root) {
        return root.resolve(name);
    }

    @Override
    public ObjectNode toSnapshot() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JobNodeCodec.TYPE, JobNodeCodec.TYPE_PASSTHROUGH);
        node.put(JobNodeCodec.NAME, name);
        ArrayNode ids = node.putArray(JobNodeCodec.EXTERNAL_IDS);
        externalIds.forEach(ids::add);
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PassThrough that)) return false;
        return name.equals(that.name) && externalIds.equals(that.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, externalIds);
    }

    @Override
    public String toString() {
        return "PassThrough[" + name + ", " + externalIds + "]";
    }
}
