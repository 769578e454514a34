package com.agentkernel.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one claim attempt, supplied by the caller.
 *
 * The target queue is derived from the mode and never defaulted: a review
 * claim targets its own source queue, a work claim targets {@code claimed}.
 * Work claims resume {@code needs_continuation} tasks before taking fresh
 * ones from the source queue.
 */
public record ClaimIntent(
    String agentName,
    String orchestratorId,
    ClaimMode mode,
    String sourceQueue,
    String role,
    String cluster,
    String pendingCheck,
    Duration leaseDuration
) {
    public ClaimIntent {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(orchestratorId, "orchestratorId");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(sourceQueue, "sourceQueue");
        Objects.requireNonNull(leaseDuration, "leaseDuration");
        if (leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
    }

    public static ClaimIntent forWork(String agentName, String orchestratorId, String role, Duration lease) {
        return new ClaimIntent(agentName, orchestratorId, ClaimMode.WORK,
            TaskQueue.INCOMING.wireName(), role, null, null, lease);
    }

    public static ClaimIntent forReview(String agentName, String orchestratorId, String sourceQueue,
                                        String check, Duration lease) {
        return new ClaimIntent(agentName, orchestratorId, ClaimMode.REVIEW,
            sourceQueue, null, null, check, lease);
    }

    public ClaimIntent inCluster(String clusterName) {
        return new ClaimIntent(agentName, orchestratorId, mode, sourceQueue, role, clusterName,
            pendingCheck, leaseDuration);
    }

    /**
     * Queues searched for candidates, in order.
     */
    public List<String> sourceQueues() {
        return sourceQueues(mode, sourceQueue);
    }

    public static List<String> sourceQueues(ClaimMode mode, String sourceQueue) {
        String continuation = TaskQueue.NEEDS_CONTINUATION.wireName();
        if (mode == ClaimMode.REVIEW || continuation.equals(sourceQueue)) {
            return List.of(sourceQueue);
        }
        return List.of(continuation, sourceQueue);
    }

    public String targetQueue() {
        return mode == ClaimMode.REVIEW ? sourceQueue : TaskQueue.CLAIMED.wireName();
    }

    public boolean isReview() {
        return mode == ClaimMode.REVIEW;
    }
}
