package com.agentkernel.core.exception;

/**
 * Thrown when a worker could not be started: workspace preparation,
 * task directory setup or process launch failed.
 */
public class SpawnFailureException extends KernelException {

    public static final String ERROR_CODE = "SPAWN_FAILURE";

    public SpawnFailureException(String agentName, String taskId, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Failed to spawn %s for task %s: %s", agentName, taskId, cause.getMessage()
        ), cause);
    }
}
