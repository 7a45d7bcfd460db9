package io.surfworks.jobrunner.job;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the job model records.
 */
class JobModelTest {

    // ===== JobState =====

    @Test
    void terminalStates() {
        assertFalse(JobState.PENDING.isTerminal());
        assertFalse(JobState.RUNNING.isTerminal());
        assertTrue(JobState.COMPLETED.isTerminal());
        assertTrue(JobState.FAILED.isTerminal());
        assertTrue(JobState.CANCELLED.isTerminal());
        assertTrue(JobState.TIMEOUT.isTerminal());
        assertTrue(JobState.COMPLETED.isSuccess());
        assertFalse(JobState.TIMEOUT.isSuccess());
    }

    @Test
    void statusDefaultsOptionalFields() {
        JobStatus status = JobStatus.of("42", JobState.RUNNING);

        assertEquals("RUNNING", status.message());
        assertTrue(status.schedulerMetadata().isEmpty());
        assertFalse(status.isTerminal());
    }

    // ===== Dependency =====

    @Test
    void afterOkJoinsIdsWithAnd() {
        Dependency dependency = Dependency.afterOk("12", "13");

        assertEquals("12,13", dependency.joinedIds());
        assertEquals("afterok:12,13", dependency.toClause());
        assertEquals("--dependency=afterok:12,13", dependency.toArgument());
    }

    @Test
    void singletonTakesNoIds() {
        Dependency dependency = Dependency.on(DependencyEvent.SINGLETON, List.of());
        assertEquals("singleton", dependency.toClause());
    }

    @Test
    void idEventsNeedIds() {
        assertThrows(IllegalArgumentException.class, () -> Dependency.on(DependencyEvent.AFTER_ANY, List.of()));
    }

    @Test
    void idsWithSeparatorsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Dependency.afterOk("12,13"));
        assertThrows(IllegalArgumentException.class, () -> Dependency.afterOk("12?13"));
        assertThrows(IllegalArgumentException.class, () -> Dependency.afterOk(" "));
        assertTrue(Dependency.isValidId("4242"));
    }

    @Test
    void eventsParseFromKeywordOrName() {
        assertEquals(DependencyEvent.AFTER_OK, DependencyEvent.fromKeyword("afterok"));
        assertEquals(DependencyEvent.AFTER_NOT_OK, DependencyEvent.fromKeyword("AFTER_NOT_OK"));
        assertThrows(IllegalArgumentException.class, () -> DependencyEvent.fromKeyword("before"));
    }

    // ===== JobSubmission =====

    @Test
    void batchArgumentsAreOrdered() {
        JobSubmission submission = JobSubmission.of("1-install", "install", "pip install .",
                ResourceProfile.of("install", "--cpus-per-task=8", "--mem=16G"),
                Path.of("bench", "S", "1-install"),
                Dependency.afterOk("11"));

        assertEquals(List.of(
                "--job-name=1-install",
                "--output=scratch/bench/S/1-install/slurm-%j.out",
                "--error=scratch/bench/S/1-install/slurm-%j.err",
                "--cpus-per-task=8",
                "--mem=16G",
                "--dependency=afterok:11"), submission.batchArguments(Path.of("scratch")));
    }

    @Test
    void submissionWithoutDependency() {
        JobSubmission submission = JobSubmission.of("pin", "pin", "echo", ResourceProfile.of("pin"),
                Path.of("bench", "pin"), null);

        assertTrue(submission.dependencyClause().isEmpty());
        assertEquals(3, submission.batchArguments(Path.of("w")).size());
    }

    @Test
    void absoluteOutputDirIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JobSubmission.of("pin", "pin", "echo",
                ResourceProfile.of("pin"), Path.of("/abs"), null));
    }

    @Test
    void blankProfileNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ResourceProfile.of(" "));
    }
}
