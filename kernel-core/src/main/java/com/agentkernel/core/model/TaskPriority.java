package com.agentkernel.core.model;

/**
 * Claim priority. Declaration order is claim order: P0 is picked first.
 */
public enum TaskPriority {
    P0,
    P1,
    P2,
    P3;

    public static TaskPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return P2;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
