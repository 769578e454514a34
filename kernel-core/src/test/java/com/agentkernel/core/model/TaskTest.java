package com.agentkernel.core.model;

import com.agentkernel.core.exception.MalformedTaskException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void create_shouldSetCorrectDefaults() {
        Task task = Task.create("t-1", "Fix parser", "implement", NOW);

        assertEquals("incoming", task.queue());
        assertEquals(Task.DEFAULT_CLUSTER, task.cluster());
        assertEquals(Task.DEFAULT_FLOW, task.flow());
        assertEquals(Task.DEFAULT_BRANCH, task.branch());
        assertEquals(TaskPriority.P2, task.priority());
        assertEquals(0L, task.version());
        assertFalse(task.isClaimed());
        assertTrue(task.checks().isEmpty());
    }

    @Test
    void construct_shouldRejectMissingId() {
        assertThrows(MalformedTaskException.class, () -> Task.builder().queue("incoming").build());
    }

    @Test
    void construct_shouldRejectClaimedQueueWithoutLease() {
        assertThrows(MalformedTaskException.class, () -> Task.builder()
            .id("t-1")
            .queue("claimed")
            .build());
    }

    @Test
    void construct_shouldRejectPartialClaim() {
        assertThrows(MalformedTaskException.class, () -> Task.builder()
            .id("t-1")
            .queue("incoming")
            .claimedBy("agent-1")
            .build());
    }

    @Test
    void withClaim_shouldSetLeaseFieldsAndTargetQueue() {
        Task task = Task.create("t-1", "Fix parser", "implement", NOW);

        Task claimed = task.withClaim("impl-1", "orch-a", "claimed", NOW, Duration.ofMinutes(5));

        assertEquals("claimed", claimed.queue());
        assertEquals("incoming", claimed.claimSource());
        assertEquals("impl-1", claimed.claimedBy());
        assertEquals("orch-a", claimed.orchestratorId());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), claimed.leaseExpiresAt());
        assertFalse(claimed.isReviewClaim());
    }

    @Test
    void withClaim_reviewShouldKeepQueue() {
        Task provisional = Task.create("t-1", "Fix parser", "implement", NOW).withQueue("provisional", NOW);

        Task claimed = provisional.withClaim("reviewer", "orch-a", "provisional", NOW, Duration.ofMinutes(5));

        assertEquals("provisional", claimed.queue());
        assertTrue(claimed.isReviewClaim());
    }

    @Test
    void withRequeued_shouldClearClaimAndCountAttempt() {
        Task claimed = Task.create("t-1", "Fix parser", "implement", NOW)
            .withClaim("impl-1", "orch-a", "claimed", NOW, Duration.ofMinutes(5));

        Task requeued = claimed.withRequeued(true, NOW.plusSeconds(60));

        assertEquals("incoming", requeued.queue());
        assertNull(requeued.claimedBy());
        assertNull(requeued.claimedAt());
        assertNull(requeued.leaseExpiresAt());
        assertNull(requeued.orchestratorId());
        assertEquals(1, requeued.attemptCount());
    }

    @Test
    void isLeaseExpired_shouldCompareAgainstGivenTime() {
        Task claimed = Task.create("t-1", "Fix parser", "implement", NOW)
            .withClaim("impl-1", "orch-a", "claimed", NOW, Duration.ofMinutes(5));

        assertFalse(claimed.isLeaseExpired(NOW.plus(Duration.ofMinutes(4))));
        assertTrue(claimed.isLeaseExpired(NOW.plus(Duration.ofMinutes(6))));
    }

    @Test
    void checks_shouldReportPendingUntilAllPass() {
        Task task = Task.create("t-1", "Fix parser", "implement", NOW).toBuilder()
            .checks(List.of("lint", "review"))
            .build();

        Task oneFailed = task.withCheckResult("lint", CheckResult.fail("2 errors", NOW));
        assertEquals(List.of("lint", "review"), oneFailed.pendingChecks());
        assertFalse(oneFailed.allChecksPassed());

        Task allPassed = oneFailed
            .withCheckResult("lint", CheckResult.pass("clean", NOW))
            .withCheckResult("review", CheckResult.pass("lgtm", NOW));
        assertTrue(allPassed.allChecksPassed());
        assertTrue(allPassed.pendingChecks().isEmpty());
    }

    @Test
    void checkResults_shouldBeImmutable() {
        Task task = Task.create("t-1", "Fix parser", "implement", NOW)
            .withCheckResult("lint", CheckResult.pass("clean", NOW));

        assertThrows(UnsupportedOperationException.class,
            () -> task.checkResults().put("other", CheckResult.pass("x", NOW)));
    }
}
