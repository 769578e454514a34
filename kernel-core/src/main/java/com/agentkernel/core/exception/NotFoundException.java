package com.agentkernel.core.exception;

/**
 * Thrown when a requested entity is not found.
 */
public class NotFoundException extends KernelException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId));
    }

    public static NotFoundException task(String taskId) {
        return new NotFoundException("Task", taskId);
    }

    public static NotFoundException flow(String name, String cluster) {
        return new NotFoundException("Flow", name + "@" + cluster);
    }
}
