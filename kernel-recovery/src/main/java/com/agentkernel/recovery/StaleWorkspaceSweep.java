package com.agentkernel.recovery;

import com.agentkernel.agent.runtime.TaskDirectories;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskQueue;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.workspace.git.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Removes worktrees and runtime directories of tasks nobody will work on
 * again.
 *
 * <ul>
 *   <li>done or failed for longer than the grace period: logs archived,
 *       worktree removed, and for done tasks without a pending rebase the
 *       remote task branch deleted</li>
 *   <li>rejected back to incoming and unclaimed for longer than the grace
 *       period: worktree removed, the next claim starts fresh</li>
 *   <li>unknown to the store: worktree removed</li>
 * </ul>
 */
public class StaleWorkspaceSweep implements HousekeepingJob {

    private static final Logger log = LoggerFactory.getLogger(StaleWorkspaceSweep.class);

    private final TaskRepository taskRepository;
    private final WorkspaceManager workspaces;
    private final TaskDirectories directories;
    private final Clock clock;
    private final Duration grace;

    public StaleWorkspaceSweep(TaskRepository taskRepository, WorkspaceManager workspaces,
                               TaskDirectories directories, Clock clock, Duration grace) {
        this.taskRepository = taskRepository;
        this.workspaces = workspaces;
        this.directories = directories;
        this.clock = clock;
        this.grace = grace;
    }

    @Override
    public String name() {
        return "stale-workspace";
    }

    @Override
    public int run() {
        Instant cutoff = clock.instant().minus(grace);
        TreeSet<String> taskIds = new TreeSet<>(directories.listTaskIds());
        if (workspaces != null) {
            taskIds.addAll(workspaces.listWorkspaceTaskIds());
        }

        int swept = 0;
        for (String taskId : taskIds) {
            try (var ctx = LoggingContext.forJob(name())) {
                if (sweep(taskId, taskRepository.findById(taskId), cutoff)) {
                    swept++;
                }
            }
        }
        return swept;
    }

    private boolean sweep(String taskId, Optional<Task> stored, Instant cutoff) {
        if (stored.isEmpty()) {
            log.info("Removing workspace of unknown task {}", taskId);
            directories.archive(taskId);
            removeWorktree(taskId);
            return true;
        }

        Task task = stored.get();
        if (task.updatedAt() == null || task.updatedAt().isAfter(cutoff)) {
            return false;
        }

        if (task.isTerminal()) {
            directories.archive(taskId);
            removeWorktree(taskId);
            if (workspaces != null && task.isInQueue(TaskQueue.DONE) && !task.needsRebase()) {
                workspaces.deleteRemoteBranch(workspaces.branchNameFor(task));
            }
            log.info("Cleaned up {} task {}", task.queue(), taskId);
            return true;
        }

        if (task.isInQueue(TaskQueue.INCOMING) && !task.isClaimed() && task.rejectionCount() > 0
                && workspaces != null && workspaces.exists(taskId)) {
            workspaces.cleanup(taskId);
            log.info("Removed worktree of rejected task {}", taskId);
            return true;
        }
        return false;
    }

    private void removeWorktree(String taskId) {
        if (workspaces != null && workspaces.exists(taskId)) {
            workspaces.cleanup(taskId);
        }
    }
}
