package com.agentkernel.workspace.git;

/**
 * Outcome of rebasing a task branch onto its base. On conflict the rebase
 * has already been aborted and {@code conflictOutput} holds git's report.
 */
public record RebaseResult(
    RebaseStatus status,
    String message,
    String conflictOutput
) {
    public static RebaseResult of(RebaseStatus status, String message) {
        return new RebaseResult(status, message, "");
    }

    public boolean isClean() {
        return status == RebaseStatus.SUCCESS || status == RebaseStatus.UP_TO_DATE;
    }
}
