package com.agentkernel.agent.runtime;

import com.agentkernel.core.exception.SpawnFailureException;
import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.core.model.ClaimMode;
import com.agentkernel.core.model.Task;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Creates, reads and archives task runtime directories under
 * {@code {runtimeDir}/tasks/{taskId}}.
 */
public class TaskDirectories {

    private static final Logger log = LoggerFactory.getLogger(TaskDirectories.class);

    private static final DateTimeFormatter ARCHIVE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final Path tasksRoot;
    private final Path archiveRoot;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TaskDirectories(Path runtimeDir, ObjectMapper objectMapper, Clock clock) {
        this.tasksRoot = runtimeDir.resolve("tasks");
        this.archiveRoot = runtimeDir.resolve("archive");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TaskDirectory forTask(String taskId) {
        return new TaskDirectory(taskId, tasksRoot.resolve(taskId));
    }

    /**
     * Prepare the directory for a new worker run. Results and exit codes of
     * earlier runs are removed so they can never be read for this one;
     * notes are kept across runs.
     *
     * @param environment variables the worker is started with, mirrored into env.sh
     */
    public TaskDirectory prepare(Task task, AgentBlueprint blueprint, Map<String, String> environment) {
        TaskDirectory dir = forTask(task.id());
        try {
            Files.createDirectories(dir.path());
            Files.deleteIfExists(dir.resultFile());
            Files.deleteIfExists(dir.exitCodeFile());
            Files.deleteIfExists(dir.workerFile());
            if (!Files.exists(dir.notesFile())) {
                Files.createFile(dir.notesFile());
            }
            Files.writeString(dir.stdoutLog(), "");
            Files.writeString(dir.stderrLog(), "");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.taskFile().toFile(), describe(task, blueprint));
            Files.writeString(dir.envFile(), envScript(environment));
        } catch (IOException e) {
            throw new SpawnFailureException(blueprint.name(), task.id(), e);
        }
        log.debug("Prepared task directory {}", dir.path());
        return dir;
    }

    private ObjectNode describe(Task task, AgentBlueprint blueprint) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", task.id());
        node.put("title", task.title());
        node.put("role", task.role());
        node.put("cluster", task.cluster());
        node.put("flow", task.flow());
        node.put("queue", task.queue());
        node.put("claimSource", task.claimSource());
        node.put("priority", task.priority().name());
        node.put("branch", task.branch());
        node.put("prReference", task.prReference());
        node.put("attemptCount", task.attemptCount());
        node.put("rejectionCount", task.rejectionCount());
        node.put("lastError", task.lastError());
        node.putPOJO("checks", task.checks());
        node.put("agent", blueprint.name());
        node.put("claimMode", blueprint.spawn().claimMode().name());
        node.put("check", blueprint.spawn().check());
        return node;
    }

    static String envScript(Map<String, String> environment) {
        return "#!/bin/sh\n" + environment.entrySet().stream()
            .map(e -> "export " + e.getKey() + "='" + e.getValue().replace("'", "'\\''") + "'")
            .collect(Collectors.joining("\n")) + "\n";
    }

    /**
     * Ids of every task that currently has a runtime directory.
     */
    public List<String> listTaskIds() {
        if (!Files.isDirectory(tasksRoot)) {
            return List.of();
        }
        try (var entries = Files.list(tasksRoot)) {
            return entries.filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + tasksRoot, e);
        }
    }

    /**
     * Record a worker's exit status. Called from the process exit hook.
     */
    public void writeExitCode(TaskDirectory dir, int exitCode) {
        try {
            Files.writeString(dir.exitCodeFile(), Integer.toString(exitCode));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write exit code for " + dir.taskId(), e);
        }
    }

    public OptionalInt readExitCode(TaskDirectory dir) {
        if (!Files.isRegularFile(dir.exitCodeFile())) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(Files.readString(dir.exitCodeFile()).trim()));
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable exit code for {}: {}", dir.taskId(), e.getMessage());
            return OptionalInt.empty();
        }
    }

    /**
     * Record the worker just started in {@code dir}.
     */
    public void writeWorker(TaskDirectory dir, WorkerStamp stamp) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("pid", stamp.pid());
        node.put("agent", stamp.agentName());
        node.put("claimMode", stamp.claimMode().name());
        node.put("sourceQueue", stamp.sourceQueue());
        node.put("check", stamp.check());
        node.put("claimedAt", stamp.claimedAt() != null ? stamp.claimedAt().toString() : null);
        node.put("worktree", stamp.worktree() != null ? stamp.worktree().toString() : null);
        node.put("startedAt", stamp.startedAt().toString());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.workerFile().toFile(), node);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot record worker for " + dir.taskId(), e);
        }
    }

    /**
     * The worker last started in {@code dir}, if its record is present and readable.
     */
    public Optional<WorkerStamp> readWorker(TaskDirectory dir) {
        if (!Files.isRegularFile(dir.workerFile())) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(dir.workerFile().toFile());
            return Optional.of(new WorkerStamp(
                node.path("pid").asLong(),
                node.path("agent").asText(),
                ClaimMode.valueOf(node.path("claimMode").asText()),
                textOrNull(node, "sourceQueue"),
                textOrNull(node, "check"),
                instantOrNull(node, "claimedAt"),
                node.hasNonNull("worktree") ? Path.of(node.get("worktree").asText()) : null,
                Instant.parse(node.path("startedAt").asText())));
        } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
            log.warn("Unreadable worker record for {}: {}", dir.taskId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static Instant instantOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? Instant.parse(node.get(field).asText()) : null;
    }

    public boolean hasNotes(TaskDirectory dir) {
        try {
            return Files.isRegularFile(dir.notesFile()) && !Files.readString(dir.notesFile()).isBlank();
        } catch (IOException e) {
            log.warn("Unreadable notes for {}: {}", dir.taskId(), e.getMessage());
            return false;
        }
    }

    /**
     * Move logs, notes and the last result of a task into the archive and
     * delete its runtime directory.
     *
     * @return the archive directory, or empty when the task had no directory
     */
    public Optional<Path> archive(String taskId) {
        TaskDirectory dir = forTask(taskId);
        if (!Files.isDirectory(dir.path())) {
            return Optional.empty();
        }
        Path target = archiveRoot.resolve(taskId + "-" + ARCHIVE_STAMP.format(clock.instant()));
        try {
            Files.createDirectories(target);
            for (String name : List.of(TaskDirectory.STDOUT_LOG, TaskDirectory.STDERR_LOG,
                    TaskDirectory.NOTES_FILE, TaskDirectory.RESULT_FILE, TaskDirectory.TASK_FILE)) {
                Path source = dir.path().resolve(name);
                if (Files.exists(source)) {
                    Files.move(source, target.resolve(name), StandardCopyOption.REPLACE_EXISTING);
                }
            }
            for (String name : List.of(TaskDirectory.ENV_FILE, TaskDirectory.EXIT_CODE_FILE,
                    TaskDirectory.WORKER_FILE)) {
                Files.deleteIfExists(dir.path().resolve(name));
            }
            deleteIfEmpty(dir.path());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot archive task directory " + dir.path(), e);
        }
        log.info("Archived runtime files of {} to {}", taskId, target);
        return Optional.of(target);
    }

    private static void deleteIfEmpty(Path dir) throws IOException {
        try (var entries = Files.list(dir)) {
            if (entries.findAny().isEmpty()) {
                Files.delete(dir);
            }
        }
    }

    /**
     * Environment shared by every worker; callers add their own keys.
     */
    public static Map<String, String> baseEnvironment(Task task, AgentBlueprint blueprint, TaskDirectory dir,
                                                      Path worktree, String orchestratorId) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("KERNEL_AGENT_NAME", blueprint.name());
        env.put("KERNEL_ORCHESTRATOR_ID", orchestratorId);
        env.put("KERNEL_TASK_ID", task.id());
        env.put("KERNEL_TASK_TITLE", task.title() != null ? task.title() : "");
        env.put("KERNEL_BASE_BRANCH", task.branch());
        env.put("KERNEL_CLAIM_MODE", blueprint.spawn().claimMode().name());
        if (task.claimSource() != null) {
            env.put("KERNEL_CLAIM_SOURCE", task.claimSource());
        }
        if (blueprint.spawn().check() != null) {
            env.put("KERNEL_CHECK", blueprint.spawn().check());
        }
        env.put("KERNEL_TASK_DIR", dir.path().toString());
        env.put("KERNEL_RESULT_FILE", dir.resultFile().toString());
        env.put("KERNEL_NOTES_FILE", dir.notesFile().toString());
        if (worktree != null) {
            env.put("KERNEL_WORKTREE", worktree.toString());
        }
        return env;
    }
}
