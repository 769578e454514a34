package com.agentkernel.engine.flow;

import com.agentkernel.core.exception.InvalidTransitionException;
import com.agentkernel.core.exception.KernelException;
import com.agentkernel.core.exception.MergeConflictException;
import com.agentkernel.core.exception.NotFoundException;
import com.agentkernel.core.exception.OptimisticLockException;
import com.agentkernel.core.model.FlowDefinition;
import com.agentkernel.core.model.FlowTransition;
import com.agentkernel.core.model.SideEffect;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskQueue;
import com.agentkernel.core.repository.FlowDefinitionRepository;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.coordinator.TaskMutator;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Validates and commits queue transitions against the flow registered for
 * the task's (flow, cluster) pair, then runs the transition's side effects.
 *
 * Side effects run strictly after the commit. A failing step stops the
 * remaining steps and is recorded on the task; the transition is never
 * rolled back.
 */
public class FlowStateMachine {

    private static final Logger log = LoggerFactory.getLogger(FlowStateMachine.class);

    private final FlowDefinitionRepository flowRepository;
    private final TaskRepository taskRepository;
    private final SideEffectExecutor sideEffects;
    private final KernelMetrics metrics;
    private final Clock clock;
    private final TaskMutator mutator;

    public FlowStateMachine(FlowDefinitionRepository flowRepository, TaskRepository taskRepository,
                            SideEffectExecutor sideEffects, KernelMetrics metrics, Clock clock) {
        this.flowRepository = flowRepository;
        this.taskRepository = taskRepository;
        this.sideEffects = sideEffects;
        this.metrics = metrics;
        this.clock = clock;
        this.mutator = new TaskMutator(taskRepository);
    }

    /**
     * The flow governing a task. No fallback to another cluster.
     *
     * @throws NotFoundException if the (flow, cluster) pair is not registered
     */
    public FlowDefinition flowFor(String flowName, String cluster) {
        return flowRepository.find(flowName, cluster)
            .orElseThrow(() -> NotFoundException.flow(flowName, cluster));
    }

    public FlowDefinition flowFor(Task task) {
        return flowFor(task.flow(), task.cluster());
    }

    public boolean canTransition(String flowName, String cluster, String from, String to) {
        return flowFor(flowName, cluster).canTransition(from, to);
    }

    public Optional<String> successTarget(String flowName, String cluster, String from) {
        return flowFor(flowName, cluster).successTarget(from);
    }

    public String failureTarget(String flowName, String cluster, String from) {
        return flowFor(flowName, cluster).failureTarget(from);
    }

    public TransitionResult applyTransition(Task task, String to) {
        return applyTransition(task, to, UnaryOperator.identity());
    }

    /**
     * Move {@code task} to {@code to}, applying {@code change} to the record
     * in the same conditional update.
     *
     * @throws InvalidTransitionException if the pair is not in the table; nothing is written
     * @throws OptimisticLockException    if the task changed since it was read
     */
    public TransitionResult applyTransition(Task task, String to, UnaryOperator<Task> change) {
        FlowDefinition flow = flowFor(task);
        String from = task.queue();
        if (!flow.canTransition(from, to)) {
            throw new InvalidTransitionException(task.id(), from, to, flow.key());
        }
        if (TaskQueue.CLAIMED.wireName().equals(to)) {
            throw new InvalidTransitionException(task.id(), "tasks enter claimed only through a claim");
        }
        FlowTransition transition = flow.findTransition(from, to).orElseThrow();

        Instant now = clock.instant();
        Task next = change.apply(task.withQueueReleased(to, now));
        Task committed = taskRepository.compareAndSet(next, from, task.version())
            .orElseThrow(() -> new OptimisticLockException("Task", task.id(), task.version()));

        metrics.transitioned(from, to);
        try (var ctx = LoggingContext.forTask(task.id(), task.claimedBy())) {
            log.info("Task {} moved {} -> {} in {}", task.id(), from, to, flow.key());
            return runSideEffects(committed, from, transition.runs());
        }
    }

    private TransitionResult runSideEffects(Task committed, String from, List<SideEffect> steps) {
        if (steps.isEmpty()) {
            return new TransitionResult(committed, from, List.of());
        }

        List<StepFailure> failures = new ArrayList<>();
        Task current = committed;
        boolean conflicted = false;

        for (SideEffect step : steps) {
            try {
                current = sideEffects.execute(step, current);
                log.debug("Step {} completed for task {}", step.wireName(), committed.id());
            } catch (MergeConflictException e) {
                log.warn("Step {} hit a merge conflict for task {}: {}", step.wireName(), committed.id(), e.getMessage());
                failures.add(new StepFailure(step, e.getErrorCode(), e.getMessage()));
                metrics.sideEffectFailed(step.wireName());
                conflicted = true;
                break;
            } catch (KernelException e) {
                log.error("Step {} failed for task {}", step.wireName(), committed.id(), e);
                failures.add(new StepFailure(step, e.getErrorCode(), e.getMessage()));
                metrics.sideEffectFailed(step.wireName());
                break;
            } catch (RuntimeException e) {
                log.error("Step {} failed unexpectedly for task {}", step.wireName(), committed.id(), e);
                failures.add(new StepFailure(step, "SIDE_EFFECT_FAILED", String.valueOf(e.getMessage())));
                metrics.sideEffectFailed(step.wireName());
                break;
            }
        }

        Task outcome = current;
        String error = failures.isEmpty() ? null
            : failures.stream().map(StepFailure::describe).collect(Collectors.joining("; "));
        boolean needsRebase = conflicted || outcome.needsRebase();
        boolean changed = error != null
            || needsRebase != committed.needsRebase()
            || !Objects.equals(outcome.prReference(), committed.prReference());

        Task stored = committed;
        if (changed) {
            stored = recordStepOutcome(committed, from, outcome.prReference(), needsRebase, error);
        }
        return new TransitionResult(stored, from, failures);
    }

    private Task recordStepOutcome(Task committed, String from, String prReference,
                                   boolean needsRebase, String error) {
        Instant now = clock.instant();
        try {
            return mutator.mutateIf(committed.id(),
                    t -> t.queue().equals(committed.queue()),
                    t -> t.toBuilder()
                        .prReference(prReference)
                        .needsRebase(needsRebase)
                        .lastError(error != null ? error : t.lastError())
                        .updatedAt(now)
                        .build())
                .orElseGet(() -> {
                    log.warn("Task {} left {} before step results of {} -> {} were recorded",
                        committed.id(), committed.queue(), from, committed.queue());
                    return committed;
                });
        } catch (OptimisticLockException e) {
            log.error("Could not record step results for task {}", committed.id(), e);
            return committed;
        }
    }
}
