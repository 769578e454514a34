package com.agentkernel.core.model;

import java.time.Instant;

/**
 * Outcome of one named review gate on a task.
 */
public record CheckResult(
    CheckStatus status,
    String summary,
    Instant recordedAt
) {
    public static CheckResult pass(String summary, Instant at) {
        return new CheckResult(CheckStatus.PASS, summary, at);
    }

    public static CheckResult fail(String summary, Instant at) {
        return new CheckResult(CheckStatus.FAIL, summary, at);
    }

    public boolean passed() {
        return status == CheckStatus.PASS;
    }
}
