package com.agentkernel.core.exception;

/**
 * Thrown when a post-transition step (push, PR, merge) fails.
 * The transition it belongs to has already been committed.
 */
public class SideEffectException extends KernelException {

    public static final String ERROR_CODE = "SIDE_EFFECT_FAILED";

    public SideEffectException(String step, String taskId, String message) {
        this(ERROR_CODE, step, taskId, message, null);
    }

    public SideEffectException(String step, String taskId, String message, Throwable cause) {
        this(ERROR_CODE, step, taskId, message, cause);
    }

    protected SideEffectException(String errorCode, String step, String taskId, String message, Throwable cause) {
        super(errorCode, String.format("Step %s failed for task %s: %s", step, taskId, message), cause);
    }
}
