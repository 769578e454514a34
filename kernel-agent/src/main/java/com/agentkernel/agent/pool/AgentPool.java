package com.agentkernel.agent.pool;

import com.agentkernel.agent.process.AgentLauncher;
import com.agentkernel.agent.process.LaunchedWorker;
import com.agentkernel.agent.runtime.TaskDirectories;
import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.core.exception.KernelException;
import com.agentkernel.core.exception.SpawnFailureException;
import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.core.model.Task;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.agentkernel.workspace.git.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Starts workers for claimed tasks.
 *
 * There is one spawn path for every blueprint; its {@code SpawnDescriptor}
 * decides whether a worktree is prepared.
 */
public class AgentPool {

    private static final Logger log = LoggerFactory.getLogger(AgentPool.class);

    private final WorkspaceManager workspaces;
    private final TaskDirectories directories;
    private final AgentLauncher launcher;
    private final InstanceRegistry registry;
    private final KernelMetrics metrics;
    private final Clock clock;
    private final String orchestratorId;

    public AgentPool(WorkspaceManager workspaces, TaskDirectories directories, AgentLauncher launcher,
                     InstanceRegistry registry, KernelMetrics metrics, Clock clock, String orchestratorId) {
        this.workspaces = workspaces;
        this.directories = directories;
        this.launcher = launcher;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.orchestratorId = orchestratorId;
    }

    /**
     * Start a worker for a task already claimed by {@code blueprint}.
     *
     * @return the registered instance
     * @throws SpawnFailureException if any preparation step or the launch fails
     */
    public InstanceRecord spawn(AgentBlueprint blueprint, Task task) {
        try (var ctx = LoggingContext.forTask(task.id(), blueprint.name())) {
            try {
                Path worktree = null;
                if (blueprint.spawn().needsWorkspace()) {
                    if (workspaces == null) {
                        throw new IllegalStateException("no workspace root configured");
                    }
                    worktree = workspaces.prepare(task).path();
                }

                TaskDirectory dir = directories.forTask(task.id());
                Map<String, String> env = TaskDirectories.baseEnvironment(task, blueprint, dir, worktree, orchestratorId);
                directories.prepare(task, blueprint, env);

                Path workingDir = worktree != null ? worktree : dir.path();
                LaunchedWorker worker = launcher.launch(blueprint, dir, workingDir, env);

                InstanceRecord record = InstanceRecord.running(blueprint.name(), task.id(), worker.pid(),
                    blueprint.spawn().claimMode(), task.claimSource(), blueprint.spawn().check(),
                    task.claimedAt(), dir, worktree, clock.instant());
                CompletableFuture<Void> exitRecorded = worker.exit().handle((code, error) -> {
                    onExit(record, dir, code, error);
                    return null;
                });
                registry.register(record, exitRecorded);
                stamp(record);

                metrics.spawned(blueprint.name());
                metrics.setTrackedInstances(registry.size());
                log.info("Spawned {} for task {} (pid {})", blueprint.name(), task.id(), worker.pid());
                return record;
            } catch (SpawnFailureException e) {
                metrics.spawnFailed(blueprint.name());
                throw e;
            } catch (KernelException | IllegalStateException e) {
                metrics.spawnFailed(blueprint.name());
                throw new SpawnFailureException(blueprint.name(), task.id(), e);
            }
        }
    }

    private void stamp(InstanceRecord record) {
        try {
            directories.writeWorker(record.directory(), record.stamp());
        } catch (UncheckedIOException e) {
            log.warn("Worker pid {} for task {} cannot be re-adopted after a restart: {}", record.pid(),
                record.taskId(), e.getMessage());
        }
    }

    private void onExit(InstanceRecord record, TaskDirectory dir, Integer code, Throwable error) {
        if (error != null) {
            log.warn("Lost exit status of pid {} for task {}: {}", record.pid(), record.taskId(), error.getMessage());
            return;
        }
        try {
            directories.writeExitCode(dir, code);
        } catch (UncheckedIOException e) {
            log.warn("Could not record exit code {} for task {}: {}", code, record.taskId(), e.getMessage());
            return;
        }
        log.debug("pid {} for task {} exited with {}", record.pid(), record.taskId(), code);
    }

    public InstanceRegistry registry() {
        return registry;
    }
}
