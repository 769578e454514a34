package com.agentkernel.agent.pool;

public enum ReapOutcome {
    /** The result moved the task. */
    APPLIED,
    /** The task had moved on; the result was dropped. */
    DISCARDED
}
