package com.agentkernel.agent.result;

public enum WorkerOutcome {
    SUCCESS,
    FAILURE,
    NEEDS_CONTINUATION
}
