package com.agentkernel.core.model;

/**
 * What a claimer intends to do with the task it claims.
 */
public enum ClaimMode {
    /** First work: the task moves from its source queue into claimed. */
    WORK,
    /** Re-inspection: the task stays in its source queue, only the lease changes. */
    REVIEW
}
