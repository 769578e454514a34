package com.agentkernel.workspace.git;

import java.nio.file.Path;

/**
 * A prepared worktree for one task.
 *
 * @param taskId       owning task
 * @param path         worktree directory
 * @param originRef    reference the worktree was created from
 * @param originCommit commit that reference pointed at on creation
 * @param reused       whether an existing worktree was kept
 */
public record Workspace(
    String taskId,
    Path path,
    String originRef,
    String originCommit,
    boolean reused
) {
}
