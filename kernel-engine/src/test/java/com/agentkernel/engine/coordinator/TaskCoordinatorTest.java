package com.agentkernel.engine.coordinator;

import com.agentkernel.core.exception.DuplicateTaskException;
import com.agentkernel.core.exception.InvalidTransitionException;
import com.agentkernel.core.model.CheckStatus;
import com.agentkernel.core.model.ClaimIntent;
import com.agentkernel.core.model.FlowDefinition;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.test.TimeController;
import com.agentkernel.engine.flow.FlowStateMachine;
import com.agentkernel.engine.flow.SideEffectExecutor;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.agentkernel.engine.persistence.InMemoryFlowDefinitionRepository;
import com.agentkernel.engine.persistence.InMemoryTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskCoordinatorTest {

    private static final Duration LEASE = Duration.ofMinutes(30);

    private TimeController time;
    private InMemoryTaskRepository repository;
    private ClaimCoordinator claims;
    private TaskCoordinator tasks;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2025-03-01T10:00:00Z"));
        repository = new InMemoryTaskRepository();
        InMemoryFlowDefinitionRepository flows = new InMemoryFlowDefinitionRepository();
        flows.save(FlowDefinition.standard("default"));
        KernelMetrics metrics = new KernelMetrics();
        FlowStateMachine stateMachine = new FlowStateMachine(flows, repository, SideEffectExecutor.noop(), metrics, time);
        claims = new ClaimCoordinator(repository, metrics, time);
        tasks = new TaskCoordinator(repository, stateMachine, time, 3);
    }

    private Task provisionalWithChecks(String id, List<String> checks) {
        tasks.create(Task.create(id, "feature", "implement", time.now()).toBuilder()
            .checks(checks)
            .branch("release/2.0")
            .build());
        claims.claim(ClaimIntent.forWork("implementer", "orch", null, LEASE));
        tasks.submit(id);
        return tasks.get(id);
    }

    @Test
    @DisplayName("Tasks without checks inherit the review gates of their flow")
    void testCreateDerivesChecksFromFlow() {
        Task created = tasks.create(Task.create("T-1", "t", "implement", time.now()));

        assertThat(created.checks()).containsExactly("gatekeeper-review");
        assertThat(created.version()).isZero();
        assertThatThrownBy(() -> tasks.create(Task.create("T-1", "again", "implement", time.now())))
            .isInstanceOf(DuplicateTaskException.class);
    }

    @Test
    @DisplayName("Submit moves a claimed task along its flow and clears the claim")
    void testSubmit() {
        Task task = provisionalWithChecks("T-1", List.of("A"));

        assertThat(task.queue()).isEqualTo("provisional");
        assertThat(task.isClaimed()).isFalse();
        assertThat(task.branch()).isEqualTo("release/2.0");
    }

    @Test
    @DisplayName("A passing check keeps the task provisional until every check passed")
    void testChecksGateAcceptance() {
        provisionalWithChecks("T-1", List.of("A", "B"));

        Task afterA = tasks.recordCheckResult("T-1", "A", CheckStatus.PASS, "looks good");
        assertThat(afterA.queue()).isEqualTo("provisional");
        assertThat(afterA.pendingChecks()).containsExactly("B");
        assertThatThrownBy(() -> tasks.accept("T-1"))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("B");

        tasks.recordCheckResult("T-1", "B", CheckStatus.PASS, "ok");
        Task accepted = tasks.accept("T-1").task();

        assertThat(accepted.queue()).isEqualTo("done");
        assertThat(accepted.allChecksPassed()).isTrue();
    }

    @Test
    @DisplayName("A failing check rejects the task back to incoming and keeps its branch")
    void testFailingCheckRejects() {
        provisionalWithChecks("T-1", List.of("A", "B"));
        claims.claim(ClaimIntent.forReview("reviewer-b", "orch", "provisional", "B", LEASE));

        Task rejected = tasks.recordCheckResult("T-1", "B", CheckStatus.FAIL, "tests missing");

        assertThat(rejected.queue()).isEqualTo("incoming");
        assertThat(rejected.rejectionCount()).isEqualTo(1);
        assertThat(rejected.isClaimed()).isFalse();
        assertThat(rejected.branch()).isEqualTo("release/2.0");
        assertThat(rejected.lastError()).contains("tests missing");
        assertThat(rejected.checkResults().get("B").passed()).isFalse();
    }

    @Test
    @DisplayName("Reject increments the rejection count, clears the claim and keeps the branch")
    void testReject() {
        provisionalWithChecks("T-1", List.of("A"));

        Task rejected = tasks.reject("T-1", "scope creep");

        assertThat(rejected.queue()).isEqualTo("incoming");
        assertThat(rejected.rejectionCount()).isEqualTo(1);
        assertThat(rejected.claimedBy()).isNull();
        assertThat(rejected.leaseExpiresAt()).isNull();
        assertThat(rejected.branch()).isEqualTo("release/2.0");
    }

    @Test
    @DisplayName("Failures requeue until the retry budget is spent, then fail with the last reason")
    void testRetryBudget() {
        tasks.create(Task.create("T-1", "flaky", "implement", time.now()));

        for (int attempt = 1; attempt <= 2; attempt++) {
            claims.claim(ClaimIntent.forWork("implementer", "orch", null, LEASE));
            Task requeued = tasks.failAttempt("T-1", "attempt " + attempt + " failed");
            assertThat(requeued.queue()).isEqualTo("incoming");
            assertThat(requeued.attemptCount()).isEqualTo(attempt);
        }

        claims.claim(ClaimIntent.forWork("implementer", "orch", null, LEASE));
        Task failed = tasks.failAttempt("T-1", "attempt 3 failed");

        assertThat(failed.queue()).isEqualTo("failed");
        assertThat(failed.attemptCount()).isEqualTo(3);
        assertThat(failed.lastError()).isEqualTo("attempt 3 failed");
        assertThat(failed.isClaimed()).isFalse();
    }

    @Test
    @DisplayName("Administrative requeue bypasses the flow but never leaves a terminal state")
    void testRequeue() {
        provisionalWithChecks("T-1", List.of("A"));

        Task requeued = tasks.requeue("T-1", "operator reset", false);
        assertThat(requeued.queue()).isEqualTo("incoming");
        assertThat(requeued.attemptCount()).isZero();

        tasks.fail("T-1", "abandoned");
        assertThatThrownBy(() -> tasks.requeue("T-1", null, false))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Recording an undeclared check is refused")
    void testUndeclaredCheck() {
        provisionalWithChecks("T-1", List.of("A"));

        assertThatThrownBy(() -> tasks.recordCheckResult("T-1", "Z", CheckStatus.PASS, "?"))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("needs_rebase and last_error are plain field updates")
    void testFieldUpdates() {
        provisionalWithChecks("T-1", List.of("A"));

        Task flagged = tasks.markNeedsRebase("T-1", true, "base moved");
        assertThat(flagged.needsRebase()).isTrue();
        assertThat(flagged.lastError()).isEqualTo("base moved");
        assertThat(tasks.recordError("T-1", "push failed").lastError()).isEqualTo("push failed");
    }
}
