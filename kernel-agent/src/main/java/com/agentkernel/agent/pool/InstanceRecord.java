package com.agentkernel.agent.pool;

import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.agent.runtime.WorkerStamp;
import com.agentkernel.core.model.ClaimMode;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One worker process tracked by this orchestrator.
 *
 * The claim it was started under is identified by agent and claimedAt, so
 * a result can be recognised as stale once the task was claimed again.
 */
public record InstanceRecord(
    String instanceId,
    String agentName,
    String taskId,
    long pid,
    ClaimMode claimMode,
    String sourceQueue,
    String check,
    Instant claimedAt,
    TaskDirectory directory,
    Path worktree,
    Instant startedAt,
    InstanceStatus status,
    int stepFailures
) {
    public static InstanceRecord running(String agentName, String taskId, long pid, ClaimMode claimMode,
                                         String sourceQueue, String check, Instant claimedAt,
                                         TaskDirectory directory, Path worktree, Instant startedAt) {
        return new InstanceRecord(agentName + "-" + taskId + "-" + pid, agentName, taskId, pid, claimMode,
            sourceQueue, check, claimedAt, directory, worktree, startedAt, InstanceStatus.RUNNING, 0);
    }

    /**
     * A worker started by an earlier run of the orchestrator, rebuilt from
     * what its task directory recorded.
     */
    public static InstanceRecord adopted(String taskId, TaskDirectory directory, WorkerStamp stamp) {
        return running(stamp.agentName(), taskId, stamp.pid(), stamp.claimMode(), stamp.sourceQueue(),
            stamp.check(), stamp.claimedAt(), directory, stamp.worktree(), stamp.startedAt());
    }

    public WorkerStamp stamp() {
        return new WorkerStamp(pid, agentName, claimMode, sourceQueue, check, claimedAt, worktree, startedAt);
    }

    public boolean isRunning() {
        return status == InstanceStatus.RUNNING;
    }

    public InstanceRecord finished() {
        return new InstanceRecord(instanceId, agentName, taskId, pid, claimMode, sourceQueue, check,
            claimedAt, directory, worktree, startedAt, InstanceStatus.FINISHED, stepFailures);
    }

    public InstanceRecord withStepFailure() {
        return new InstanceRecord(instanceId, agentName, taskId, pid, claimMode, sourceQueue, check,
            claimedAt, directory, worktree, startedAt, status, stepFailures + 1);
    }
}
