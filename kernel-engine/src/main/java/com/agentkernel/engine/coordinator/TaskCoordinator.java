package com.agentkernel.engine.coordinator;

import com.agentkernel.core.exception.InvalidTransitionException;
import com.agentkernel.core.exception.NotFoundException;
import com.agentkernel.core.model.CheckResult;
import com.agentkernel.core.model.CheckStatus;
import com.agentkernel.core.model.ConditionType;
import com.agentkernel.core.model.FlowCondition;
import com.agentkernel.core.model.FlowDefinition;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import com.agentkernel.core.model.TaskQueue;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.flow.FlowStateMachine;
import com.agentkernel.engine.flow.TransitionResult;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Coordinator for task lifecycle operations.
 * Every mutation goes through the conditional update; flow-governed moves go
 * through the state machine.
 */
public class TaskCoordinator implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    private static final String INCOMING = TaskQueue.INCOMING.wireName();
    private static final String DONE = TaskQueue.DONE.wireName();
    private static final String FAILED = TaskQueue.FAILED.wireName();

    private final TaskRepository taskRepository;
    private final FlowStateMachine stateMachine;
    private final TaskMutator mutator;
    private final Clock clock;
    private final int maxAttempts;

    public TaskCoordinator(TaskRepository taskRepository, FlowStateMachine stateMachine,
                           Clock clock, int maxAttempts) {
        this.taskRepository = taskRepository;
        this.stateMachine = stateMachine;
        this.mutator = new TaskMutator(taskRepository);
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Task create(Task task) {
        FlowDefinition flow = stateMachine.flowFor(task);
        if (!flow.hasState(task.queue())) {
            throw new InvalidTransitionException(task.id(),
                "queue '" + task.queue() + "' is not a state of flow " + flow.key());
        }
        if (task.isClaimed()) {
            throw new InvalidTransitionException(task.id(), "new tasks cannot carry a claim");
        }

        Instant now = clock.instant();
        Task.Builder builder = task.toBuilder()
            .version(0)
            .createdAt(task.createdAt() != null ? task.createdAt() : now)
            .updatedAt(now);
        if (task.checks().isEmpty()) {
            builder.checks(reviewGates(flow));
        }
        Task created = builder.build();
        taskRepository.save(created);

        try (var ctx = LoggingContext.forTask(created.id(), null)) {
            log.info("Created task {} in {} (flow {}, priority {}, checks {})",
                created.id(), created.queue(), flow.key(), created.priority(), created.checks());
        }
        return created;
    }

    /**
     * Agent and script conditions guarding the exits of provisional are the
     * checks a task must pass before acceptance.
     */
    private static List<String> reviewGates(FlowDefinition flow) {
        return flow.transitionsFrom(TaskQueue.PROVISIONAL.wireName()).stream()
            .flatMap(t -> t.conditions().stream())
            .filter(c -> c.type() != ConditionType.MANUAL)
            .map(FlowCondition::name)
            .distinct()
            .toList();
    }

    @Override
    public Task get(String taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> NotFoundException.task(taskId));
    }

    @Override
    public List<Task> list(TaskFilter filter) {
        return taskRepository.find(filter);
    }

    @Override
    public TransitionResult submit(String taskId) {
        Task task = get(taskId);
        String target = stateMachine.flowFor(task).successTarget(task.queue())
            .orElseThrow(() -> new InvalidTransitionException(taskId,
                "no transition leaves '" + task.queue() + "'"));
        return stateMachine.applyTransition(task, target);
    }

    @Override
    public TransitionResult transition(String taskId, String toQueue) {
        if (DONE.equals(toQueue)) {
            return accept(taskId);
        }
        return stateMachine.applyTransition(get(taskId), toQueue);
    }

    @Override
    public TransitionResult accept(String taskId) {
        Task task = get(taskId);
        if (!task.allChecksPassed()) {
            throw new InvalidTransitionException(taskId,
                "checks not passed: " + String.join(", ", task.pendingChecks()));
        }
        return stateMachine.applyTransition(task, DONE);
    }

    @Override
    public Task reject(String taskId, String reason) {
        Task task = get(taskId);
        Task rejected = stateMachine.applyTransition(task, INCOMING, t -> withRejection(t, reason)).task();
        log.info("Task {} rejected from {} (rejection #{}): {}",
            taskId, task.queue(), rejected.rejectionCount(), reason);
        return rejected;
    }

    private Task withRejection(Task task, String reason) {
        return task.toBuilder()
            .rejectionCount(task.rejectionCount() + 1)
            .lastError(reason)
            .build();
    }

    @Override
    public Task requeue(String taskId, String reason, boolean countAttempt) {
        Instant now = clock.instant();
        Task requeued = mutator.mutate(taskId, t -> {
            if (t.isTerminal()) {
                throw new InvalidTransitionException(taskId, "terminal task in '" + t.queue() + "' cannot be requeued");
            }
            Task next = t.withRequeued(countAttempt, now);
            return reason != null ? next.withLastError(reason, now) : next;
        });
        log.info("Requeued task {} (attempt {}): {}", taskId, requeued.attemptCount(), reason);
        return requeued;
    }

    @Override
    public Task failAttempt(String taskId, String reason) {
        Task task = get(taskId);
        if (task.attemptCount() + 1 < maxAttempts) {
            return requeue(taskId, reason, true);
        }

        String target = stateMachine.flowFor(task).failureTarget(task.queue());
        log.warn("Task {} exhausted its retry budget ({} attempts), moving to {}: {}",
            taskId, maxAttempts, target, reason);
        if (stateMachine.flowFor(task).canTransition(task.queue(), target)
            && !TaskQueue.CLAIMED.wireName().equals(target)) {
            return stateMachine.applyTransition(task, target, t -> t.toBuilder()
                .attemptCount(t.attemptCount() + 1)
                .lastError(reason)
                .build()).task();
        }
        Instant now = clock.instant();
        return mutator.mutate(taskId, t -> t.withQueueReleased(FAILED, now).toBuilder()
            .attemptCount(t.attemptCount() + 1)
            .lastError(reason)
            .build());
    }

    @Override
    public Task recordCheckResult(String taskId, String check, CheckStatus status, String summary) {
        Task task = get(taskId);
        if (!task.checks().contains(check)) {
            throw new InvalidTransitionException(taskId, "check '" + check + "' is not declared");
        }
        if (task.isTerminal()) {
            throw new InvalidTransitionException(taskId, "task is already " + task.queue());
        }

        Instant now = clock.instant();
        CheckResult result = status == CheckStatus.PASS ? CheckResult.pass(summary, now) : CheckResult.fail(summary, now);
        log.info("Check {} on task {}: {} ({})", check, taskId, status, summary);

        if (status == CheckStatus.FAIL) {
            Task rejected = stateMachine.applyTransition(task, INCOMING,
                t -> withRejection(t.withCheckResult(check, result), "check " + check + " failed: " + summary)).task();
            log.info("Task {} rejected by check {} (rejection #{})", taskId, check, rejected.rejectionCount());
            return rejected;
        }

        return mutator.mutate(taskId, t -> {
            Task recorded = t.withCheckResult(check, result);
            return recorded.isReviewClaim() ? recorded.withClaimCleared(now) : recorded;
        });
    }

    @Override
    public Task markNeedsRebase(String taskId, boolean needsRebase, String reason) {
        Instant now = clock.instant();
        return mutator.mutate(taskId, t -> {
            Task flagged = t.withNeedsRebase(needsRebase, now);
            return reason != null ? flagged.withLastError(reason, now) : flagged;
        });
    }

    @Override
    public Task recordError(String taskId, String error) {
        Instant now = clock.instant();
        return mutator.mutate(taskId, t -> t.withLastError(error, now));
    }

    @Override
    public Task fail(String taskId, String reason) {
        Instant now = clock.instant();
        Task failed = mutator.mutate(taskId, t -> {
            if (t.isTerminal()) {
                throw new InvalidTransitionException(taskId, "task is already " + t.queue());
            }
            return t.withQueueReleased(FAILED, now).withLastError(reason, now);
        });
        log.warn("Task {} moved to failed: {}", taskId, reason);
        return failed;
    }
}
