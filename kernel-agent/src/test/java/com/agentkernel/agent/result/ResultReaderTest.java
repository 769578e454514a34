package com.agentkernel.agent.result;

import com.agentkernel.agent.runtime.TaskDirectories;
import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.core.model.ClaimMode;
import com.agentkernel.core.test.TimeController;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ResultReaderTest {

    @TempDir
    Path runtimeDir;

    private TaskDirectories directories;
    private ResultReader reader;
    private TaskDirectory dir;

    @BeforeEach
    void setUp() throws IOException {
        directories = new TaskDirectories(runtimeDir, new ObjectMapper(),
            TimeController.frozenAt(Instant.parse("2025-03-01T10:00:00Z")));
        reader = new ResultReader(directories, new ObjectMapper());
        dir = directories.forTask("T-1");
        Files.createDirectories(dir.path());
    }

    @Test
    @DisplayName("A work result artifact decides the outcome over the exit code")
    void testResultArtifactWins() throws IOException {
        Files.writeString(dir.resultFile(), "{\"outcome\": \"done\", \"reason\": \"implemented\"}");
        directories.writeExitCode(dir, 1);

        WorkerResult result = reader.read(dir, ClaimMode.WORK);

        assertThat(result.outcome()).isEqualTo(WorkerOutcome.SUCCESS);
        assertThat(result.source()).isEqualTo(ResultSource.RESULT_ARTIFACT);
        assertThat(result.summary()).isEqualTo("implemented");
        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Work outcomes map to success, failure and continuation")
    void testWorkOutcomes() throws IOException {
        Files.writeString(dir.resultFile(), "{\"outcome\": \"failed\", \"reason\": \"tests red\"}");
        assertThat(reader.read(dir, ClaimMode.WORK))
            .extracting(WorkerResult::outcome, WorkerResult::summary)
            .containsExactly(WorkerOutcome.FAILURE, "tests red");

        Files.writeString(dir.resultFile(), "{\"outcome\": \"needs_continuation\"}");
        assertThat(reader.read(dir, ClaimMode.WORK).outcome()).isEqualTo(WorkerOutcome.NEEDS_CONTINUATION);

        Files.writeString(dir.resultFile(), "{\"outcome\": \"sideways\"}");
        assertThat(reader.read(dir, ClaimMode.WORK).outcome()).isEqualTo(WorkerOutcome.FAILURE);
    }

    @Test
    @DisplayName("Review results carry the decision and comment")
    void testReviewResults() throws IOException {
        Files.writeString(dir.resultFile(),
            "{\"status\": \"success\", \"decision\": \"reject\", \"comment\": \"missing tests\"}");
        WorkerResult rejected = reader.read(dir, ClaimMode.REVIEW);
        assertThat(rejected.decision()).isEqualTo(ReviewDecision.REJECT);
        assertThat(rejected.summary()).isEqualTo("missing tests");

        Files.writeString(dir.resultFile(), "{\"status\": \"failure\", \"message\": \"could not check out\"}");
        WorkerResult failed = reader.read(dir, ClaimMode.REVIEW);
        assertThat(failed.outcome()).isEqualTo(WorkerOutcome.FAILURE);
        assertThat(failed.decision()).isNull();
        assertThat(failed.summary()).isEqualTo("could not check out");
    }

    @Test
    @DisplayName("Malformed result.json is a failure, not an exception")
    void testMalformedArtifact() throws IOException {
        Files.writeString(dir.resultFile(), "{not json");

        WorkerResult result = reader.read(dir, ClaimMode.WORK);

        assertThat(result.outcome()).isEqualTo(WorkerOutcome.FAILURE);
        assertThat(result.summary()).startsWith("invalid result.json");
    }

    @Test
    @DisplayName("Without an artifact the exit code decides, and notes signal continuation")
    void testExitCodeFallback() throws IOException {
        directories.writeExitCode(dir, 2);
        WorkerResult crashed = reader.read(dir, ClaimMode.WORK);
        assertThat(crashed.outcome()).isEqualTo(WorkerOutcome.FAILURE);
        assertThat(crashed.source()).isEqualTo(ResultSource.EXIT_CODE);
        assertThat(crashed.summary()).contains("code 2");

        directories.writeExitCode(dir, 0);
        Files.writeString(dir.notesFile(), "halfway through the migration");
        assertThat(reader.read(dir, ClaimMode.WORK).outcome()).isEqualTo(WorkerOutcome.NEEDS_CONTINUATION);
    }

    @Test
    @DisplayName("No signal at all falls back to a degraded failure")
    void testDegradedDefault() {
        WorkerResult result = reader.read(dir, ClaimMode.WORK);

        assertThat(result.outcome()).isEqualTo(WorkerOutcome.FAILURE);
        assertThat(result.source()).isEqualTo(ResultSource.DEGRADED_DEFAULT);
        assertThat(result.exitCode()).isNull();
    }
}
