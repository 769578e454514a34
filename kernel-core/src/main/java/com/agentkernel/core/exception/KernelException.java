package com.agentkernel.core.exception;

/**
 * Base exception for all kernel errors.
 */
public class KernelException extends RuntimeException {

    private final String errorCode;

    public KernelException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public KernelException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
