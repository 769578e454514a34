package com.agentkernel.core.exception;

/**
 * Thrown when a task branch cannot be merged mechanically into its base.
 */
public class MergeConflictException extends SideEffectException {

    public static final String ERROR_CODE = "MERGE_CONFLICT";

    public MergeConflictException(String step, String taskId, String message) {
        super(ERROR_CODE, step, taskId, message, null);
    }
}
