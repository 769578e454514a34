package com.agentkernel.core.exception;

/**
 * Thrown when a task record fails validation at the store boundary.
 */
public class MalformedTaskException extends KernelException {

    public static final String ERROR_CODE = "MALFORMED_TASK";

    public MalformedTaskException(String message) {
        super(ERROR_CODE, message);
    }

    public MalformedTaskException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
