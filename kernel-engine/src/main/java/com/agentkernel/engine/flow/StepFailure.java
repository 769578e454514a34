package com.agentkernel.engine.flow;

import com.agentkernel.core.model.SideEffect;

/**
 * A side-effect step that failed after its transition was committed.
 */
public record StepFailure(
    SideEffect step,
    String errorCode,
    String message
) {
    public String describe() {
        return step.wireName() + ": " + message;
    }
}
