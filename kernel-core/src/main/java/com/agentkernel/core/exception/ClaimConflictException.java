package com.agentkernel.core.exception;

/**
 * Thrown when a conditional claim update affected zero rows because another
 * claimer changed the task first. Callers treat it as "no task available".
 */
public class ClaimConflictException extends KernelException {

    public static final String ERROR_CODE = "CLAIM_CONFLICT";

    public ClaimConflictException(String taskId, String sourceQueue, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Claim conflict on task %s: no longer in queue '%s' at version %d",
            taskId, sourceQueue, expectedVersion
        ));
    }
}
