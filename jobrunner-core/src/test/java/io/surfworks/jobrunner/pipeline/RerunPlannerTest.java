package io.surfworks.jobrunner.pipeline;

import io.surfworks.jobrunner.testing.MockScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RerunPlannerTest {

    @TempDir
    Path tempDir;

    private static Job job(String script, String jobId, String externalId, NodeStatus status) {
        return new Job(script, "cpu", jobId, externalId, status);
    }

    @Test
    void fullySucceededRunHasNothingToResubmit() {
        Pipeline pipeline = new Pipeline("p", Sequential.of(
                job("a", "0-a", "11", NodeStatus.SUCCEEDED),
                Parallel.of(
                        job("b", "1.0-b", "12", NodeStatus.SUCCEEDED),
                        job("c", "1.1-c", "13", NodeStatus.SUCCEEDED))), "r");

        Pipeline rerun = RerunPlanner.rerun(pipeline);

        assertEquals(0, RerunPlanner.resubmittableJobs(rerun.definition()));
        assertEquals(new PassThrough("S", List.of("12", "13")), rerun.definition());
    }

    @Test
    void failedLeafOfFanOutKeepsItsJobId() {
        Pipeline pipeline = new Pipeline("p", Parallel.of(
                job("a", "0-a", "11", NodeStatus.SUCCEEDED),
                job("b", "1-b", "12", NodeStatus.FAILED),
                job("c", "2-c", "13", NodeStatus.SUCCEEDED)), "r");

        JobNode planned = RerunPlanner.rerun(pipeline).definition();

        assertEquals(Parallel.of(
                new Skip("a", "cpu", "0-a", "11"),
                new Job("b", "cpu", "1-b"),
                new Skip("c", "cpu", "2-c", "13")), planned);
        assertEquals(1, RerunPlanner.resubmittableJobs(planned));
    }

    @Test
    void submittedJobsAreResubmitted() {
        Job stillOut = job("a", "0-a", "11", NodeStatus.SUBMITTED);

        assertTrue(RerunPlanner.needsResubmission(stillOut));
        JobNode planned = RerunPlanner.plan(stillOut);

        assertEquals(new Job("a", "cpu", "0-a"), planned);
    }

    @Test
    void markersPassThroughUnchanged() {
        Skip skip = new Skip("a", "cpu", "0-a", "11");
        PassThrough passThrough = new PassThrough("P", List.of("12"));

        assertSame(skip, RerunPlanner.plan(skip));
        assertSame(passThrough, RerunPlanner.plan(passThrough));
        assertFalse(RerunPlanner.needsResubmission(skip));
    }

    @Test
    void priorIdsOfSequenceAreItsLastStep() {
        Sequential sequence = Sequential.of(
                job("a", "0-a", "11", NodeStatus.SUCCEEDED),
                job("b", "1-b", "12", NodeStatus.SUCCEEDED));

        assertEquals(List.of("12"), RerunPlanner.priorIds(sequence));
        assertEquals(List.of(), RerunPlanner.priorIds(Sequential.of()));
    }

    @Test
    void successorOfCollapsedFanOutDependsOnItsPriorIds() throws PipelineException, IOException {
        Pipeline pipeline = new Pipeline("p", Sequential.of(
                Parallel.of(
                        job("a", "0.0-a", "11", NodeStatus.SUCCEEDED),
                        job("b", "0.1-b", "12", NodeStatus.SUCCEEDED)),
                job("c", "1-c", null, NodeStatus.FAILED)), "r");

        Pipeline rerun = RerunPlanner.rerun(pipeline);
        assertEquals(Sequential.of(
                new PassThrough("P", List.of("11", "12")),
                new Job("c", "cpu", "1-c")), rerun.definition());

        MockScheduler scheduler = new MockScheduler();
        rerun.schedule(CompilerFixture.create(scheduler, tempDir));

        assertEquals(List.of("1-c"), scheduler.submittedJobIds());
        assertEquals("afterok:11,12",
                scheduler.submissionFor("1-c").orElseThrow().dependency().toClause());
    }

    @Test
    void rerunOfRerunKeepsSkips() {
        Pipeline first = new Pipeline("p", Sequential.of(
                job("a", "0-a", "11", NodeStatus.SUCCEEDED),
                job("b", "1-b", null, NodeStatus.FAILED)), "r");

        Pipeline second = RerunPlanner.rerun(RerunPlanner.rerun(first));

        assertEquals(Sequential.of(
                new Skip("a", "cpu", "0-a", "11"),
                new Job("b", "cpu", "1-b")), second.definition());
    }
}
