package com.agentkernel.agent.runtime;

import com.agentkernel.core.model.ClaimMode;

import java.nio.file.Path;
import java.time.Instant;

/**
 * What a task directory records about the worker started in it, enough to
 * track that worker again after the orchestrator restarts.
 *
 * @param claimedAt claim the worker was started under
 * @param worktree  null when the worker has no worktree
 */
public record WorkerStamp(
    long pid,
    String agentName,
    ClaimMode claimMode,
    String sourceQueue,
    String check,
    Instant claimedAt,
    Path worktree,
    Instant startedAt
) {
    public boolean belongsTo(String claimedBy, Instant taskClaimedAt) {
        return agentName.equals(claimedBy) && claimedAt != null && claimedAt.equals(taskClaimedAt);
    }
}
