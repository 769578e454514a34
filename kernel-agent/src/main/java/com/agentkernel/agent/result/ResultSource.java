package com.agentkernel.agent.result;

/**
 * Which signal decided a worker's outcome, strongest first.
 */
public enum ResultSource {
    /** The worker wrote result.json. */
    RESULT_ARTIFACT("result"),
    /** No result artifact; the recorded exit code decided. */
    EXIT_CODE("exit_code"),
    /** Neither signal was present. */
    DEGRADED_DEFAULT("degraded");

    private final String tag;

    ResultSource(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
