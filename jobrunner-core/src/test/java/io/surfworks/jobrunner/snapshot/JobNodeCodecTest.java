package io.surfworks.jobrunner.snapshot;

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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobNodeCodecTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static Pipeline roundTrip(Pipeline pipeline) throws SnapshotException {
        return JobNodeCodec.readPipeline(JobNodeCodec.write(pipeline));
    }

    // ===== Round trips =====

    @Test
    void singleJobSurvivesRoundTrip() throws SnapshotException {
        Pipeline pipeline = new Pipeline("solo",
                new Job("install", "install", "install", "4242", NodeStatus.SUBMITTED), "run1");

        Pipeline decoded = roundTrip(pipeline);

        assertEquals(pipeline, decoded);
        Job job = assertInstanceOf(Job.class, decoded.definition());
        assertEquals("4242", job.externalId());
        assertEquals(NodeStatus.SUBMITTED, job.status());
    }

    @Test
    void sequenceOfFanOutSurvivesRoundTrip() throws SnapshotException {
        Pipeline pipeline = new Pipeline("bench", Sequential.of(
                new Job("pin", "pin", "0-pin", "11", NodeStatus.SUCCEEDED),
                Parallel.of(
                        new Job("run", "A100", "1.0-run", "12", NodeStatus.FAILED),
                        new Job("run", "H100", "1.1-run", "13", NodeStatus.SUBMITTED))), "run1");

        assertEquals(pipeline, roundTrip(pipeline));
    }

    @Test
    void fanOutOfSequencesSurvivesRoundTrip() throws SnapshotException {
        Pipeline pipeline = new Pipeline("bench", Parallel.named("gpus",
                Sequential.named("a100", new Job("prepare", "A100"), new Job("run", "A100")),
                Sequential.named("h100", new Job("prepare", "H100"), new Job("run", "H100"))), null);

        Pipeline decoded = roundTrip(pipeline);

        assertEquals(pipeline, decoded);
        assertEquals(List.of("0.0-prepare", "0.1-run", "1.0-prepare", "1.1-run"),
                decoded.jobs().stream().map(Job::jobId).toList());
    }

    @Test
    void deepTreeWithMarkersSurvivesRoundTrip() throws SnapshotException {
        JobNode tree = Sequential.of(
                new Skip("pin", "pin", "0-pin", "11"),
                Parallel.of(
                        Sequential.of(
                                new PassThrough("P", List.of("12", "13")),
                                Parallel.of(new Job("run", "A100"), new Job("run", "H100"))),
                        new Job("report", "cpu")),
                new Job("collect", "cpu"));
        Pipeline pipeline = new Pipeline("deep", tree, "run7");

        assertEquals(pipeline, roundTrip(pipeline));
    }

    // ===== Encoding =====

    @Test
    void recordsUseSnakeCaseFields() {
        JsonNode encoded = JobNodeCodec.encode(new Job("a", "cpu", "0-a", "11", NodeStatus.SUBMITTED));

        assertEquals("job", encoded.get("type").asText());
        assertEquals("0-a", encoded.get("job_id").asText());
        assertEquals("11", encoded.get("external_id").asText());
        assertEquals("submitted", encoded.get("status").asText());
    }

    @Test
    void pipelineRecordCarriesItsDefinition() {
        JsonNode encoded = JobNodeCodec.encode(new Pipeline("p", new PassThrough("P", List.of("1")), "r"));

        assertEquals("pipeline", encoded.get("type").asText());
        assertEquals("r", encoded.get("job_id").asText());
        assertEquals("passthrough", encoded.get("definition").get("type").asText());
        assertTrue(encoded.get("definition").get("external_ids").isArray());
    }

    // ===== Decoding =====

    @Test
    void missingStatusReadsAsPending() throws Exception {
        JobNode node = JobNodeCodec.decodeNode(JSON.readTree(
                "{\"type\":\"job\",\"script\":\"a\",\"profile\":\"cpu\",\"job_id\":\"x\"}"));

        assertEquals(NodeStatus.PENDING, ((Job) node).status());
    }

    @Test
    void unknownTypeIsReportedByName() throws Exception {
        JsonNode record = JSON.readTree(
                "{\"type\":\"sequential\",\"name\":\"S\",\"jobs\":[{\"type\":\"branch\",\"name\":\"B\"}]}");

        UnknownVariantException e = assertThrows(UnknownVariantException.class,
                () -> JobNodeCodec.decodeNode(record));
        assertEquals("branch", e.type());
    }

    @Test
    void unknownTopLevelTypeIsAnUnknownVariant() {
        assertThrows(UnknownVariantException.class,
                () -> JobNodeCodec.readPipeline("{\"type\":\"workflow\",\"name\":\"w\"}"));
    }

    @Test
    void jobWithoutScriptIsMalformed() throws Exception {
        JsonNode record = JSON.readTree("{\"type\":\"job\",\"profile\":\"cpu\"}");
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.decodeNode(record));
    }

    @Test
    void compositeWithoutJobsIsMalformed() throws Exception {
        JsonNode record = JSON.readTree("{\"type\":\"parallel\",\"name\":\"P\"}");
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.decodeNode(record));
    }

    @Test
    void recordWithoutTypeIsMalformed() throws Exception {
        JsonNode record = JSON.readTree("{\"script\":\"a\",\"profile\":\"cpu\"}");
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.decodeNode(record));
    }

    @Test
    void unknownStatusIsMalformed() throws Exception {
        JsonNode record = JSON.readTree("{\"type\":\"job\",\"script\":\"a\",\"profile\":\"cpu\",\"status\":\"lost\"}");
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.decodeNode(record));
    }

    @Test
    void nestedPipelineIsMalformed() throws Exception {
        JsonNode record = JSON.readTree(
                "{\"type\":\"sequential\",\"name\":\"S\",\"jobs\":[{\"type\":\"pipeline\",\"name\":\"inner\"}]}");
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.decodeNode(record));
    }

    @Test
    void nodeRecordIsNotAPipeline() {
        assertThrows(MalformedRecordException.class,
                () -> JobNodeCodec.readPipeline("{\"type\":\"job\",\"script\":\"a\",\"profile\":\"cpu\"}"));
    }

    @Test
    void duplicateJobIdsAreMalformed() {
        String json = "{\"type\":\"pipeline\",\"name\":\"p\",\"definition\":{\"type\":\"parallel\",\"name\":\"P\",\"jobs\":["
                + "{\"type\":\"job\",\"script\":\"a\",\"profile\":\"cpu\",\"job_id\":\"x\"},"
                + "{\"type\":\"job\",\"script\":\"b\",\"profile\":\"cpu\",\"job_id\":\"x\"}]}}";
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.readPipeline(json));
    }

    @Test
    void nonStringFieldNamesItsJsonType() throws Exception {
        JsonNode record = JSON.readTree("{\"type\":\"job\",\"script\":7,\"profile\":\"cpu\"}");

        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> JobNodeCodec.decodeNode(record));
        assertTrue(e.getMessage().endsWith("got number"), e.getMessage());
    }

    @Test
    void jobIdThatLeavesTheOutputTreeIsMalformed() throws Exception {
        JsonNode record = JSON.readTree(
                "{\"type\":\"job\",\"script\":\"a\",\"profile\":\"cpu\",\"job_id\":\"../../escaped\"}");
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.decodeNode(record));
    }

    @Test
    void compositeNameWithSeparatorIsMalformed() throws Exception {
        JsonNode record = JSON.readTree("{\"type\":\"sequential\",\"name\":\"a/b\",\"jobs\":[]}");
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.decodeNode(record));
    }

    @Test
    void pipelineNameWithSeparatorIsMalformed() {
        String json = "{\"type\":\"pipeline\",\"name\":\"..\",\"definition\":"
                + "{\"type\":\"job\",\"script\":\"a\",\"profile\":\"cpu\"}}";
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.readPipeline(json));
    }

    @Test
    void invalidJsonIsMalformed() {
        assertThrows(MalformedRecordException.class, () -> JobNodeCodec.readPipeline("{not json"));
    }
}
