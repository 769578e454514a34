package com.agentkernel.core.exception;

/**
 * Thrown when creating a task whose id already exists.
 */
public class DuplicateTaskException extends KernelException {

    public static final String ERROR_CODE = "DUPLICATE_TASK";

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super(ERROR_CODE, String.format("Task already exists: %s", taskId));
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
