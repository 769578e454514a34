package com.agentkernel.core.model;

import com.agentkernel.core.exception.MalformedTaskException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The unit of work, as held by the task store.
 *
 * Built once at the store boundary and validated there; every layer above
 * works with this record and never with raw payloads.
 *
 * Invariants:
 * - version strictly increases on every stored mutation
 * - claimedBy, claimedAt and leaseExpiresAt are set together or not at all
 * - queue == claimed implies a lease
 * - a review claim keeps the source queue (claimSource == queue)
 */
public record Task(
    // Identity
    String id,
    String title,
    String role,
    String cluster,
    String flow,

    // State
    String queue,
    TaskPriority priority,
    long version,

    // Lease
    String claimedBy,
    Instant claimedAt,
    Instant leaseExpiresAt,
    String orchestratorId,
    String claimSource,

    // Counters
    int attemptCount,
    int rejectionCount,

    // Review gates
    List<String> checks,
    Map<String, CheckResult> checkResults,

    // Dependencies and delivery
    String blockedBy,
    String branch,
    String prReference,
    boolean needsRebase,
    String lastError,

    // Timing
    Instant createdAt,
    Instant updatedAt
) {
    public static final String DEFAULT_CLUSTER = "default";
    public static final String DEFAULT_FLOW = "default";
    public static final String DEFAULT_BRANCH = "main";

    public Task {
        if (id == null || id.isBlank()) {
            throw new MalformedTaskException("Task id is required");
        }
        if (queue == null || queue.isBlank()) {
            throw new MalformedTaskException("Task " + id + " has no queue");
        }
        if (version < 0 || attemptCount < 0 || rejectionCount < 0) {
            throw new MalformedTaskException("Task " + id + " has a negative counter");
        }
        boolean anyClaimField = claimedBy != null || claimedAt != null || leaseExpiresAt != null;
        boolean allClaimFields = claimedBy != null && claimedAt != null && leaseExpiresAt != null;
        if (anyClaimField && !allClaimFields) {
            throw new MalformedTaskException("Task " + id + " has a partial claim");
        }
        if (TaskQueue.CLAIMED.wireName().equals(queue) && !allClaimFields) {
            throw new MalformedTaskException("Task " + id + " is claimed without a lease");
        }
        cluster = blankToDefault(cluster, DEFAULT_CLUSTER);
        flow = blankToDefault(flow, DEFAULT_FLOW);
        branch = blankToDefault(branch, DEFAULT_BRANCH);
        priority = priority != null ? priority : TaskPriority.P2;
        checks = checks != null ? List.copyOf(checks) : List.of();
        checkResults = checkResults != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(checkResults))
            : Map.of();
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Create a new task in the incoming queue.
     */
    public static Task create(String id, String title, String role, Instant now) {
        return builder()
            .id(id)
            .title(title)
            .role(role)
            .queue(TaskQueue.INCOMING.wireName())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean isClaimed() {
        return claimedBy != null;
    }

    public boolean isTerminal() {
        return TaskQueue.isTerminal(queue);
    }

    public boolean isInQueue(TaskQueue q) {
        return q.wireName().equals(queue);
    }

    /**
     * A review claim holds a lease without moving the task out of its queue.
     */
    public boolean isReviewClaim() {
        return isClaimed() && !isInQueue(TaskQueue.CLAIMED);
    }

    public boolean isLeaseExpired(Instant now) {
        return leaseExpiresAt != null && leaseExpiresAt.isBefore(now);
    }

    public boolean hasPassed(String check) {
        CheckResult result = checkResults.get(check);
        return result != null && result.passed();
    }

    public boolean allChecksPassed() {
        return checks.stream().allMatch(this::hasPassed);
    }

    public List<String> pendingChecks() {
        List<String> pending = new ArrayList<>();
        for (String check : checks) {
            if (!hasPassed(check)) {
                pending.add(check);
            }
        }
        return pending;
    }

    /**
     * Copy with a claim granted. The target queue equals the current queue
     * for review claims.
     */
    public Task withClaim(String agent, String orchestrator, String targetQueue, Instant now, Duration lease) {
        return toBuilder()
            .claimSource(queue)
            .queue(targetQueue)
            .claimedBy(agent)
            .claimedAt(now)
            .leaseExpiresAt(now.plus(lease))
            .orchestratorId(orchestrator)
            .updatedAt(now)
            .build();
    }

    public Task withLeaseExtended(Instant expiresAt, Instant now) {
        return toBuilder().leaseExpiresAt(expiresAt).updatedAt(now).build();
    }

    /**
     * Copy with the claim fields cleared. Only valid outside the claimed
     * queue, i.e. for review claims; use {@link #withQueueReleased} otherwise.
     */
    public Task withClaimCleared(Instant now) {
        return withQueueReleased(queue, now);
    }

    /**
     * Copy moved to {@code newQueue} with the claim fields cleared in the
     * same step.
     */
    public Task withQueueReleased(String newQueue, Instant now) {
        return toBuilder()
            .queue(newQueue)
            .claimedBy(null)
            .claimedAt(null)
            .leaseExpiresAt(null)
            .orchestratorId(null)
            .claimSource(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Copy returned to incoming with no owner. Used by requeue paths.
     */
    public Task withRequeued(boolean countAttempt, Instant now) {
        return withQueueReleased(TaskQueue.INCOMING.wireName(), now).toBuilder()
            .attemptCount(countAttempt ? attemptCount + 1 : attemptCount)
            .build();
    }

    public Task withQueue(String newQueue, Instant now) {
        return toBuilder().queue(newQueue).updatedAt(now).build();
    }

    public Task withCheckResult(String check, CheckResult result) {
        Map<String, CheckResult> results = new LinkedHashMap<>(checkResults);
        results.put(check, result);
        return toBuilder().checkResults(results).updatedAt(result.recordedAt()).build();
    }

    public Task withLastError(String error, Instant now) {
        return toBuilder().lastError(error).updatedAt(now).build();
    }

    public Task withNeedsRebase(boolean flag, Instant now) {
        return toBuilder().needsRebase(flag).updatedAt(now).build();
    }

    public Task withPrReference(String reference, Instant now) {
        return toBuilder().prReference(reference).updatedAt(now).build();
    }

    public Task withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    public static final class Builder {
        private String id;
        private String title;
        private String role;
        private String cluster;
        private String flow;
        private String queue;
        private TaskPriority priority;
        private long version;
        private String claimedBy;
        private Instant claimedAt;
        private Instant leaseExpiresAt;
        private String orchestratorId;
        private String claimSource;
        private int attemptCount;
        private int rejectionCount;
        private List<String> checks = List.of();
        private Map<String, CheckResult> checkResults = Map.of();
        private String blockedBy;
        private String branch;
        private String prReference;
        private boolean needsRebase;
        private String lastError;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        private Builder(Task t) {
            this.id = t.id;
            this.title = t.title;
            this.role = t.role;
            this.cluster = t.cluster;
            this.flow = t.flow;
            this.queue = t.queue;
            this.priority = t.priority;
            this.version = t.version;
            this.claimedBy = t.claimedBy;
            this.claimedAt = t.claimedAt;
            this.leaseExpiresAt = t.leaseExpiresAt;
            this.orchestratorId = t.orchestratorId;
            this.claimSource = t.claimSource;
            this.attemptCount = t.attemptCount;
            this.rejectionCount = t.rejectionCount;
            this.checks = t.checks;
            this.checkResults = t.checkResults;
            this.blockedBy = t.blockedBy;
            this.branch = t.branch;
            this.prReference = t.prReference;
            this.needsRebase = t.needsRebase;
            this.lastError = t.lastError;
            this.createdAt = t.createdAt;
            this.updatedAt = t.updatedAt;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder role(String role) { this.role = role; return this; }
        public Builder cluster(String cluster) { this.cluster = cluster; return this; }
        public Builder flow(String flow) { this.flow = flow; return this; }
        public Builder queue(String queue) { this.queue = queue; return this; }
        public Builder priority(TaskPriority priority) { this.priority = priority; return this; }
        public Builder version(long version) { this.version = version; return this; }
        public Builder claimedBy(String claimedBy) { this.claimedBy = claimedBy; return this; }
        public Builder claimedAt(Instant claimedAt) { this.claimedAt = claimedAt; return this; }
        public Builder leaseExpiresAt(Instant leaseExpiresAt) { this.leaseExpiresAt = leaseExpiresAt; return this; }
        public Builder orchestratorId(String orchestratorId) { this.orchestratorId = orchestratorId; return this; }
        public Builder claimSource(String claimSource) { this.claimSource = claimSource; return this; }
        public Builder attemptCount(int attemptCount) { this.attemptCount = attemptCount; return this; }
        public Builder rejectionCount(int rejectionCount) { this.rejectionCount = rejectionCount; return this; }
        public Builder checks(List<String> checks) { this.checks = checks; return this; }
        public Builder checkResults(Map<String, CheckResult> checkResults) { this.checkResults = checkResults; return this; }
        public Builder blockedBy(String blockedBy) { this.blockedBy = blockedBy; return this; }
        public Builder branch(String branch) { this.branch = branch; return this; }
        public Builder prReference(String prReference) { this.prReference = prReference; return this; }
        public Builder needsRebase(boolean needsRebase) { this.needsRebase = needsRebase; return this; }
        public Builder lastError(String lastError) { this.lastError = lastError; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }

        public Task build() {
            return new Task(
                id, title, role, cluster, flow,
                queue, priority, version,
                claimedBy, claimedAt, leaseExpiresAt, orchestratorId, claimSource,
                attemptCount, rejectionCount,
                checks, checkResults,
                blockedBy, branch, prReference, needsRebase, lastError,
                createdAt, updatedAt
            );
        }
    }
}
