package com.agentkernel.workspace.pr;

import java.nio.file.Path;

/**
 * Code-host operations on pull requests.
 */
public interface PullRequestClient {

    /**
     * Open a PR for {@code branch} against {@code baseBranch}, or return the
     * one already open for it.
     *
     * @param worktree   checkout used as the working directory
     * @param branch     head branch, already pushed
     * @param baseBranch target branch
     * @param title      PR title
     * @param body       PR body
     * @return the PR
     * @throws com.agentkernel.core.exception.WorkspaceException if the host refuses
     */
    PullRequest createOrFind(Path worktree, String branch, String baseBranch, String title, String body);

    /**
     * Merge a PR.
     *
     * @param worktree  checkout used as the working directory
     * @param reference PR URL or number
     * @return whether the PR merged or was refused for conflicts
     * @throws com.agentkernel.core.exception.WorkspaceException for any other refusal
     */
    MergeOutcome merge(Path worktree, String reference);

    enum MergeOutcome {
        MERGED,
        CONFLICT
    }
}
