package com.agentkernel.core.model;

public enum ConditionType {
    SCRIPT,
    AGENT,
    MANUAL
}
