package io.surfworks.jobrunner.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.jobrunner.pipeline.Job;
import io.surfworks.jobrunner.pipeline.JobNode;
import io.surfworks.jobrunner.pipeline.NodeStatus;
import io.surfworks.jobrunner.pipeline.Parallel;
import io.surfworks.jobrunner.pipeline.PassThrough;
import io.surfworks.jobrunner.pipeline.Pipeline;
import io.surfworks.jobrunner.pipeline.Sequential;
import io.surfworks.jobrunner.pipeline.Skip;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts job trees to and from their persisted JSON form.
 *
 * <p>Every record carries a {@value #TYPE} discriminator naming its variant:
 * <pre>
 * { "type": "job", "script": "install", "profile": "install", "job_id": "1-install", "external_id": "4242", "status": "submitted" }
 * { "type": "sequential", "name": "S", "jobs": [ ... ] }
 * { "type": "parallel", "name": "P", "jobs": [ ... ] }
 * { "type": "skip", "script": "pin", "profile": "pin", "job_id": "0-pin", "external_id": "4241" }
 * { "type": "passthrough", "name": "P", "external_ids": ["4243", "4244"] }
 * { "type": "pipeline", "name": "nightly", "job_id": "1c9e2f4a", "definition": { ... } }
 * </pre>
 * A job's {@code status} may be omitted and then reads as pending.
 */
public final class JobNodeCodec {

    public static final String TYPE = "type";
    public static final String TYPE_JOB = "job";
    public static final String TYPE_SEQUENTIAL = "sequential";
    public static final String TYPE_PARALLEL = "parallel";
    public static final String TYPE_SKIP = "skip";
    public static final String TYPE_PASSTHROUGH = "passthrough";
    public static final String TYPE_PIPELINE = "pipeline";

    public static final String NAME = "name";
    public static final String JOBS = "jobs";
    public static final String SCRIPT = "script";
    public static final String PROFILE = "profile";
    public static final String JOB_ID = "job_id";
    public static final String EXTERNAL_ID = "external_id";
    public static final String EXTERNAL_IDS = "external_ids";
    public static final String STATUS = "status";
    public static final String DEFINITION = "definition";

    private static final ObjectMapper JSON = new ObjectMapper();

    private JobNodeCodec() {
    }

    // ===== Encoding =====

    /**
     * Returns the snapshot of a tree.
     */
    public static JsonNode encode(JobNode node) {
        return node.toSnapshot();
    }

    /**
     * Returns the snapshot of a run.
     */
    public static JsonNode encode(Pipeline pipeline) {
        return pipeline.toSnapshot();
    }

    /**
     * Returns the snapshot of a run as pretty-printed JSON.
     */
    public static String write(Pipeline pipeline) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(pipeline.toSnapshot());
        } catch (JsonProcessingException e) {
            // tree nodes always serialize
            throw new IllegalStateException("Cannot serialize pipeline " + pipeline.name(), e);
        }
    }

    // ===== Decoding =====

    /**
     * Parses a run snapshot from JSON text.
     *
     * @throws SnapshotException if the text is not JSON or not a valid run record
     */
    public static Pipeline readPipeline(String json) throws SnapshotException {
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return decodePipeline(root);
    }

    /**
     * Decodes a run record.
     *
     * @throws UnknownVariantException if the record's type is unknown
     * @throws MalformedRecordException if the record is not a valid run record
     */
    public static Pipeline decodePipeline(JsonNode record) throws SnapshotException {
        String type = type(record);
        if (!TYPE_PIPELINE.equals(type)) {
            if (!isKnownType(type)) {
                throw new UnknownVariantException(type);
            }
            throw new MalformedRecordException("Expected a pipeline record, got '" + type + "'");
        }

        String name = requiredText(record, NAME, type);
        String jobId = optionalText(record, JOB_ID, type);
        JsonNode definition = record.get(DEFINITION);
        if (definition == null || definition.isNull()) {
            throw new MalformedRecordException("pipeline record is missing '" + DEFINITION + "'");
        }

        JobNode tree = decodeNode(definition);
        try {
            return new Pipeline(name, tree, jobId);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException("Invalid pipeline '" + name + "': " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a node record and everything below it.
     *
     * @throws UnknownVariantException if any record's type is unknown
     * @throws MalformedRecordException if any record lacks a required field
     */
    public static JobNode decodeNode(JsonNode record) throws SnapshotException {
        String type = type(record);
        try {
            switch (type) {
                case TYPE_JOB:
                    return new Job(
                            requiredText(record, SCRIPT, type),
                            requiredText(record, PROFILE, type),
                            optionalText(record, JOB_ID, type),
                            optionalText(record, EXTERNAL_ID, type),
                            status(record));
                case TYPE_SEQUENTIAL:
                    return new Sequential(requiredText(record, NAME, type), children(record, type));
                case TYPE_PARALLEL:
                    return new Parallel(requiredText(record, NAME, type), children(record, type));
                case TYPE_SKIP:
                    return new Skip(
                            requiredText(record, SCRIPT, type),
                            requiredText(record, PROFILE, type),
                            optionalText(record, JOB_ID, type),
                            optionalText(record, EXTERNAL_ID, type));
                case TYPE_PASSTHROUGH:
                    return new PassThrough(requiredText(record, NAME, type), textArray(record, EXTERNAL_IDS, type));
                case TYPE_PIPELINE:
                    throw new MalformedRecordException("A pipeline record cannot appear inside a job tree");
                default:
                    throw new UnknownVariantException(type);
            }
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException("Invalid " + type + " record: " + e.getMessage(), e);
        }
    }

    private static boolean isKnownType(String type) {
        return List.of(TYPE_JOB, TYPE_SEQUENTIAL, TYPE_PARALLEL, TYPE_SKIP, TYPE_PASSTHROUGH, TYPE_PIPELINE)
                .contains(type);
    }

    private static String type(JsonNode record) throws MalformedRecordException {
        if (record == null || !record.isObject()) {
            throw new MalformedRecordException("Expected a JSON object record, got " + describe(record));
        }
        JsonNode type = record.get(TYPE);
        if (type == null || !type.isTextual()) {
            throw new MalformedRecordException("Record is missing its '" + TYPE + "' discriminator");
        }
        return type.asText();
    }

    private static List<JobNode> children(JsonNode record, String type) throws SnapshotException {
        JsonNode jobs = record.get(JOBS);
        if (jobs == null || !jobs.isArray()) {
            throw new MalformedRecordException(type + " record is missing its '" + JOBS + "' array");
        }
        List<JobNode> children = new ArrayList<>();
        for (JsonNode child : jobs) {
            children.add(decodeNode(child));
        }
        return children;
    }

    private static NodeStatus status(JsonNode record) throws MalformedRecordException {
        String value = optionalText(record, STATUS, TYPE_JOB);
        if (value == null) {
            return NodeStatus.PENDING;
        }
        try {
            return NodeStatus.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException("Unknown job status '" + value + "'", e);
        }
    }

    private static String requiredText(JsonNode record, String field, String type) throws MalformedRecordException {
        String value = optionalText(record, field, type);
        if (value == null) {
            throw new MalformedRecordException(type + " record is missing '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode record, String field, String type) throws MalformedRecordException {
        JsonNode value = record.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedRecordException(type + " record field '" + field + "' must be a string, got "
                    + describe(value));
        }
        return value.asText();
    }

    private static List<String> textArray(JsonNode record, String field, String type) throws MalformedRecordException {
        JsonNode values = record.get(field);
        if (values == null || !values.isArray()) {
            throw new MalformedRecordException(type + " record is missing its '" + field + "' array");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode value : values) {
            if (!value.isTextual()) {
                throw new MalformedRecordException(type + " record '" + field + "' must hold strings");
            }
            result.add(value.asText());
        }
        return result;
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
