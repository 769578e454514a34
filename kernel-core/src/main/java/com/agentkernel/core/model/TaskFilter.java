package com.agentkernel.core.model;

/**
 * Optional criteria for listing tasks. Null fields match everything.
 */
public record TaskFilter(
    String queue,
    String role,
    String cluster,
    String claimedBy,
    String orchestratorId,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;

    public TaskFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static TaskFilter all() {
        return new TaskFilter(null, null, null, null, null, DEFAULT_LIMIT);
    }

    public static TaskFilter inQueue(String queue) {
        return new TaskFilter(queue, null, null, null, null, DEFAULT_LIMIT);
    }

    public static TaskFilter ownedBy(String orchestratorId) {
        return new TaskFilter(null, null, null, null, orchestratorId, DEFAULT_LIMIT);
    }

    public TaskFilter withLimit(int newLimit) {
        return new TaskFilter(queue, role, cluster, claimedBy, orchestratorId, newLimit);
    }

    public boolean matches(Task task) {
        return (queue == null || queue.equals(task.queue()))
            && (role == null || role.equals(task.role()))
            && (cluster == null || cluster.equals(task.cluster()))
            && (claimedBy == null || claimedBy.equals(task.claimedBy()))
            && (orchestratorId == null || orchestratorId.equals(task.orchestratorId()));
    }
}
