package com.agentkernel.agent.pool;

public enum InstanceStatus {
    RUNNING,
    /** Confirmed dead; the result has not been applied yet. */
    FINISHED
}
