package com.agentkernel.engine.flow;

import com.agentkernel.core.model.Task;

import java.util.List;

/**
 * Outcome of a committed transition. The state change itself always
 * succeeded; {@code failures} lists the steps that did not.
 */
public record TransitionResult(
    Task task,
    String fromQueue,
    List<StepFailure> failures
) {
    public TransitionResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean sideEffectsSucceeded() {
        return failures.isEmpty();
    }
}
