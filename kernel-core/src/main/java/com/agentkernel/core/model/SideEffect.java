package com.agentkernel.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Mechanical steps a transition may run after its state change commits.
 */
public enum SideEffect {
    PUSH_BRANCH("push_branch"),
    CREATE_PR("create_pr"),
    MERGE_PR("merge_pr"),
    REBASE_ON_BASE("rebase_on_base"),
    CHECK_MERGEABLE("check_mergeable");

    private final String wireName;

    SideEffect(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SideEffect> fromWireName(String name) {
        return Arrays.stream(values())
            .filter(s -> s.wireName.equals(name))
            .findFirst();
    }
}
