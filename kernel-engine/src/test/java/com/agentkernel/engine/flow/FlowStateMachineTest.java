package com.agentkernel.engine.flow;

import com.agentkernel.core.exception.InvalidTransitionException;
import com.agentkernel.core.exception.MergeConflictException;
import com.agentkernel.core.exception.NotFoundException;
import com.agentkernel.core.exception.SideEffectException;
import com.agentkernel.core.model.FlowDefinition;
import com.agentkernel.core.model.FlowTransition;
import com.agentkernel.core.model.SideEffect;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.test.TimeController;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.agentkernel.engine.persistence.InMemoryFlowDefinitionRepository;
import com.agentkernel.engine.persistence.InMemoryTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowStateMachineTest {

    private TimeController time;
    private InMemoryTaskRepository tasks;
    private InMemoryFlowDefinitionRepository flows;
    private RecordingExecutor executor;
    private FlowStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2025-03-01T10:00:00Z"));
        tasks = new InMemoryTaskRepository();
        flows = new InMemoryFlowDefinitionRepository();
        flows.save(FlowDefinition.standard("default"));
        executor = new RecordingExecutor();
        stateMachine = new FlowStateMachine(flows, tasks, executor, new KernelMetrics(), time);
    }

    private Task claimedTask(String id, String cluster) {
        Task task = Task.create(id, "t", "implement", time.now()).toBuilder().cluster(cluster).build()
            .withClaim("implementer", "orch", "claimed", time.now(), Duration.ofMinutes(30));
        tasks.save(task);
        return task;
    }

    @Test
    @DisplayName("Transitions are looked up by flow name and cluster, with no fallback")
    void testClusterScopedLookup() {
        FlowDefinition review = FlowDefinition.builder()
            .name("default")
            .cluster("docs")
            .states(List.of("incoming", "claimed", "in_review", "done", "failed"))
            .transition(FlowTransition.of("incoming", "claimed"))
            .transition(FlowTransition.of("claimed", "in_review"))
            .transition(FlowTransition.of("in_review", "done"))
            .build();
        flows.save(review);

        assertThat(stateMachine.canTransition("default", "docs", "claimed", "in_review")).isTrue();
        assertThat(stateMachine.canTransition("default", "default", "claimed", "in_review")).isFalse();
        assertThat(stateMachine.canTransition("default", "docs", "claimed", "provisional")).isFalse();
        assertThatThrownBy(() -> stateMachine.canTransition("default", "ops", "claimed", "provisional"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Side effects run in declared order after the commit and see the committed task")
    void testSideEffectsAfterCommit() {
        claimedTask("T-1", "default");

        TransitionResult result = stateMachine.applyTransition(tasks.findById("T-1").orElseThrow(), "provisional");

        assertThat(result.sideEffectsSucceeded()).isTrue();
        assertThat(executor.steps).containsExactly(
            SideEffect.PUSH_BRANCH, SideEffect.CREATE_PR, SideEffect.CHECK_MERGEABLE);
        assertThat(executor.queuesSeen).containsOnly("provisional");
        Task stored = tasks.findById("T-1").orElseThrow();
        assertThat(stored.queue()).isEqualTo("provisional");
        assertThat(stored.isClaimed()).isFalse();
        assertThat(stored.prReference()).isEqualTo("PR-T-1");
    }

    @Test
    @DisplayName("A failing step is recorded on the task and the transition stays committed")
    void testSideEffectFailureIsNotRolledBack() {
        claimedTask("T-1", "default");
        executor.failOn = SideEffect.CREATE_PR;

        TransitionResult result = stateMachine.applyTransition(tasks.findById("T-1").orElseThrow(), "provisional");

        assertThat(result.sideEffectsSucceeded()).isFalse();
        assertThat(result.failures()).extracting(StepFailure::step).containsExactly(SideEffect.CREATE_PR);
        assertThat(executor.steps).containsExactly(SideEffect.PUSH_BRANCH, SideEffect.CREATE_PR);
        Task stored = tasks.findById("T-1").orElseThrow();
        assertThat(stored.queue()).isEqualTo("provisional");
        assertThat(stored.lastError()).contains("create_pr");
    }

    @Test
    @DisplayName("A merge conflict flags needs_rebase and leaves the logical state")
    void testMergeConflictSetsNeedsRebase() {
        claimedTask("T-1", "default");
        executor.conflictOn = SideEffect.CHECK_MERGEABLE;

        TransitionResult result = stateMachine.applyTransition(tasks.findById("T-1").orElseThrow(), "provisional");

        assertThat(result.failures()).hasSize(1);
        Task stored = tasks.findById("T-1").orElseThrow();
        assertThat(stored.queue()).isEqualTo("provisional");
        assertThat(stored.needsRebase()).isTrue();
        assertThat(stored.prReference()).isEqualTo("PR-T-1");
    }

    @Test
    @DisplayName("A transition outside the table fails before any mutation")
    void testInvalidTransitionHasNoEffect() {
        Task task = claimedTask("T-1", "default");

        assertThatThrownBy(() -> stateMachine.applyTransition(task, "done"))
            .isInstanceOf(InvalidTransitionException.class);

        Task stored = tasks.findById("T-1").orElseThrow();
        assertThat(stored.version()).isEqualTo(task.version());
        assertThat(stored.queue()).isEqualTo("claimed");
        assertThat(executor.steps).isEmpty();
    }

    @Test
    @DisplayName("Terminal states are one-way")
    void testTerminalStatesAreOneWay() {
        tasks.save(Task.create("T-1", "t", "implement", time.now()).withQueue("done", time.now()));

        assertThatThrownBy(() -> stateMachine.applyTransition(tasks.findById("T-1").orElseThrow(), "incoming"))
            .isInstanceOf(InvalidTransitionException.class);
        assertThat(stateMachine.failureTarget("default", "default", "provisional")).isEqualTo("incoming");
        assertThat(stateMachine.failureTarget("default", "default", "claimed")).isEqualTo("failed");
        assertThat(stateMachine.successTarget("default", "default", "claimed")).contains("provisional");
    }

    private static class RecordingExecutor implements SideEffectExecutor {
        final List<SideEffect> steps = new ArrayList<>();
        final List<String> queuesSeen = new ArrayList<>();
        SideEffect failOn;
        SideEffect conflictOn;

        @Override
        public Task execute(SideEffect step, Task task) {
            steps.add(step);
            queuesSeen.add(task.queue());
            if (step == failOn) {
                throw new SideEffectException(step.wireName(), task.id(), "remote rejected");
            }
            if (step == conflictOn) {
                throw new MergeConflictException(step.wireName(), task.id(), "conflicts with main");
            }
            if (step == SideEffect.CREATE_PR) {
                return task.withPrReference("PR-" + task.id(), task.updatedAt());
            }
            return task;
        }
    }
}
