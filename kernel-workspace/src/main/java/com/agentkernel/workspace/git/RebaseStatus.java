package com.agentkernel.workspace.git;

public enum RebaseStatus {
    SUCCESS,
    CONFLICT,
    UP_TO_DATE,
    ERROR
}
