package com.agentkernel.core.model;

public enum CheckStatus {
    PASS,
    FAIL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static CheckStatus parse(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
