package com.agentkernel.core.exception;

/**
 * Thrown when a queue transition is not permitted by the task's flow.
 * Always raised before any mutation.
 */
public class InvalidTransitionException extends KernelException {

    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String taskId, String fromQueue, String toQueue, String flowKey) {
        super(ERROR_CODE, String.format(
            "Invalid transition for task %s: %s -> %s is not allowed by flow %s",
            taskId, fromQueue, toQueue, flowKey
        ));
    }

    public InvalidTransitionException(String taskId, String message) {
        super(ERROR_CODE, String.format("Invalid transition for task %s: %s", taskId, message));
    }
}
