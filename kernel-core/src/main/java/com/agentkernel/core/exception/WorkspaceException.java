package com.agentkernel.core.exception;

/**
 * Thrown when a worktree operation fails or the worktree is in an
 * unexpected state.
 */
public class WorkspaceException extends KernelException {

    public static final String ERROR_CODE = "WORKSPACE_ERROR";

    public WorkspaceException(String message) {
        super(ERROR_CODE, message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
