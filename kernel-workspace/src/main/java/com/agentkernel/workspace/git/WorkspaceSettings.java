package com.agentkernel.workspace.git;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where worktrees live and how task branches are named.
 *
 * @param repoRoot     the main checkout that owns the worktrees
 * @param root         directory holding one sub-directory per task
 * @param remote       remote name pushes and fetches go to
 * @param branchPrefix prefix of task branch names
 */
public record WorkspaceSettings(
    Path repoRoot,
    Path root,
    String remote,
    String branchPrefix
) {
    public static final String DEFAULT_REMOTE = "origin";
    public static final String DEFAULT_BRANCH_PREFIX = "agent/";

    public WorkspaceSettings {
        Objects.requireNonNull(repoRoot, "repoRoot");
        Objects.requireNonNull(root, "root");
        remote = remote == null || remote.isBlank() ? DEFAULT_REMOTE : remote;
        branchPrefix = branchPrefix == null ? DEFAULT_BRANCH_PREFIX : branchPrefix;
    }
}
