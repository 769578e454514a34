package com.agentkernel.core.exception;

import java.util.List;

/**
 * Thrown when flow definition validation fails.
 */
public class FlowValidationException extends KernelException {

    public static final String ERROR_CODE = "FLOW_VALIDATION_FAILED";

    private final List<String> validationErrors;

    public FlowValidationException(String flowKey, List<String> errors) {
        super(ERROR_CODE, String.format(
            "Flow validation failed for %s: %s",
            flowKey, String.join("; ", errors)
        ));
        this.validationErrors = List.copyOf(errors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
