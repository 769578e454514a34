package com.agentkernel.agent.process;

public enum Liveness {
    ALIVE,
    DEAD,
    /** The probe itself failed; the instance must not be treated as finished. */
    UNKNOWN
}
