package com.agentkernel.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in queue vocabulary.
 *
 * Tasks carry their queue as a plain string because flows may define
 * additional cluster-specific queues; these constants name the queues
 * the kernel itself reasons about.
 */
public enum TaskQueue {
    INCOMING("incoming"),
    CLAIMED("claimed"),
    PROVISIONAL("provisional"),
    DONE("done"),
    FAILED("failed"),
    BLOCKED("blocked"),
    NEEDS_CONTINUATION("needs_continuation");

    private final String wireName;

    TaskQueue(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Terminal queues are append-only: nothing leaves them.
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public static Optional<TaskQueue> fromWireName(String name) {
        return Arrays.stream(values())
            .filter(q -> q.wireName.equals(name))
            .findFirst();
    }

    public static boolean isTerminal(String queue) {
        return fromWireName(queue).map(TaskQueue::isTerminal).orElse(false);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
