package com.agentkernel.agent.result;

import java.util.Locale;
import java.util.Optional;

public enum ReviewDecision {
    APPROVE,
    REJECT;

    public static Optional<ReviewDecision> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "approve", "approved", "pass" -> Optional.of(APPROVE);
            case "reject", "rejected", "fail" -> Optional.of(REJECT);
            default -> Optional.empty();
        };
    }
}
