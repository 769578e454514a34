package com.agentkernel.agent.result;

import com.agentkernel.agent.runtime.TaskDirectories;
import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.core.model.ClaimMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Reads the outcome of a finished worker.
 *
 * Signals are tried in order of strength: result.json, then the recorded
 * exit code, then a degraded default. Falling through to the default is
 * logged at WARN because it means the worker left no trace.
 *
 * <p>Work results:
 * <pre>{"outcome": "done" | "failed" | "needs_continuation", "reason": "..."}</pre>
 * Review results:
 * <pre>{"status": "success", "decision": "approve" | "reject", "comment": "..."}
 *{"status": "failure", "message": "..."}</pre>
 */
public class ResultReader {

    private static final Logger log = LoggerFactory.getLogger(ResultReader.class);

    private final TaskDirectories directories;
    private final ObjectMapper objectMapper;

    public ResultReader(TaskDirectories directories, ObjectMapper objectMapper) {
        this.directories = directories;
        this.objectMapper = objectMapper;
    }

    public WorkerResult read(TaskDirectory dir, ClaimMode mode) {
        OptionalInt exitCode = directories.readExitCode(dir);
        Integer code = exitCode.isPresent() ? exitCode.getAsInt() : null;

        if (Files.isRegularFile(dir.resultFile())) {
            return fromArtifact(dir, mode).withExitCode(code);
        }

        if (exitCode.isPresent()) {
            if (mode == ClaimMode.WORK && code == 0 && directories.hasNotes(dir)) {
                return new WorkerResult(WorkerOutcome.NEEDS_CONTINUATION, null,
                    "exited without a result but left notes", ResultSource.EXIT_CODE, code);
            }
            String reason = code == 0
                ? "worker exited without writing a result"
                : "worker exited with code " + code + " without writing a result";
            return WorkerResult.failure(reason, ResultSource.EXIT_CODE).withExitCode(code);
        }

        log.warn("Worker for task {} left neither a result nor an exit code, assuming it crashed", dir.taskId());
        return WorkerResult.failure("worker died without a result or exit code", ResultSource.DEGRADED_DEFAULT);
    }

    private WorkerResult fromArtifact(TaskDirectory dir, ClaimMode mode) {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(dir.resultFile()));
        } catch (IOException e) {
            log.warn("Unreadable result for task {}: {}", dir.taskId(), e.getMessage());
            return WorkerResult.failure("invalid result.json: " + e.getMessage(), ResultSource.RESULT_ARTIFACT);
        }
        if (root == null || !root.isObject()) {
            return WorkerResult.failure("invalid result.json: not an object", ResultSource.RESULT_ARTIFACT);
        }
        return mode == ClaimMode.REVIEW ? reviewResult(root) : workResult(root);
    }

    private static WorkerResult workResult(JsonNode root) {
        String outcome = text(root, "outcome");
        if (outcome == null) {
            outcome = text(root, "status");
        }
        String reason = text(root, "reason");
        if (reason == null) {
            reason = text(root, "message");
        }
        if (outcome == null) {
            return WorkerResult.failure("result.json has no outcome", ResultSource.RESULT_ARTIFACT);
        }
        return switch (outcome.toLowerCase(Locale.ROOT)) {
            case "done", "success", "submitted" -> WorkerResult.success(reason, ResultSource.RESULT_ARTIFACT);
            case "needs_continuation", "continue" -> new WorkerResult(WorkerOutcome.NEEDS_CONTINUATION, null,
                reason, ResultSource.RESULT_ARTIFACT, null);
            case "failed", "failure", "error" -> WorkerResult.failure(
                reason != null ? reason : "worker reported " + outcome, ResultSource.RESULT_ARTIFACT);
            default -> WorkerResult.failure("unknown outcome '" + outcome + "'", ResultSource.RESULT_ARTIFACT);
        };
    }

    private static WorkerResult reviewResult(JsonNode root) {
        String status = text(root, "status");
        if ("failure".equalsIgnoreCase(status)) {
            String message = text(root, "message");
            return WorkerResult.failure(message != null ? message : "review failed", ResultSource.RESULT_ARTIFACT);
        }
        return ReviewDecision.parse(text(root, "decision"))
            .map(decision -> WorkerResult.review(decision, text(root, "comment")))
            .orElseGet(() -> WorkerResult.failure(
                "review result has no usable decision", ResultSource.RESULT_ARTIFACT));
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
