package com.agentkernel.engine.flow;

import com.agentkernel.core.model.SideEffect;
import com.agentkernel.core.model.Task;

/**
 * Runs the steps a flow transition declares, after the transition has been
 * committed.
 */
public interface SideEffectExecutor {

    /**
     * Execute one step for a task.
     *
     * @param step The step to run
     * @param task The task as committed, including data produced by earlier steps
     * @return The task carrying any data the step produced (e.g. a PR reference)
     * @throws com.agentkernel.core.exception.SideEffectException if the step fails
     * @throws com.agentkernel.core.exception.MergeConflictException if the branch no longer merges cleanly
     */
    Task execute(SideEffect step, Task task);

    /**
     * Executor for deployments without a repository: every step is a no-op.
     */
    static SideEffectExecutor noop() {
        return (step, task) -> task;
    }
}
