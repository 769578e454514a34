package com.agentkernel.engine.coordinator;

import com.agentkernel.core.exception.ClaimConflictException;
import com.agentkernel.core.model.ClaimIntent;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskQueue;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.agentkernel.engine.service.ClaimService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Coordinator for the claim and lease protocol.
 * Selects candidates in claim order and wins a task with one conditional
 * update on (id, queue, version).
 */
public class ClaimCoordinator implements ClaimService {

    private static final Logger log = LoggerFactory.getLogger(ClaimCoordinator.class);

    private static final int CANDIDATE_BATCH = 20;
    private static final int MAX_SELECTION_ROUNDS = 3;

    private final TaskRepository taskRepository;
    private final TaskMutator mutator;
    private final KernelMetrics metrics;
    private final Clock clock;

    public ClaimCoordinator(TaskRepository taskRepository, KernelMetrics metrics, Clock clock) {
        this.taskRepository = taskRepository;
        this.mutator = new TaskMutator(taskRepository);
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Optional<Task> claim(ClaimIntent intent, Predicate<Task> admissible) {
        for (String queue : intent.sourceQueues()) {
            Optional<Task> claimed = claimFrom(queue, intent, admissible);
            if (claimed.isPresent()) {
                return claimed;
            }
        }
        metrics.claimNoneAvailable(intent.agentName());
        return Optional.empty();
    }

    private Optional<Task> claimFrom(String queue, ClaimIntent intent, Predicate<Task> admissible) {
        for (int round = 1; round <= MAX_SELECTION_ROUNDS; round++) {
            List<Task> candidates = taskRepository.findClaimCandidates(
                queue, intent.role(), intent.cluster(), CANDIDATE_BATCH);
            boolean lostRace = false;

            for (Task candidate : candidates) {
                if (!isEligible(candidate, intent) || !admissible.test(candidate)) {
                    continue;
                }
                try {
                    Task claimed = tryClaim(candidate, intent);
                    metrics.claimWon(intent.agentName());
                    try (var ctx = LoggingContext.forTask(claimed.id(), intent.agentName())) {
                        log.info("Claimed task {} from {} (mode {}, lease until {})",
                            claimed.id(), queue, intent.mode(), claimed.leaseExpiresAt());
                    }
                    return Optional.of(claimed);
                } catch (ClaimConflictException e) {
                    log.debug("{}", e.getMessage());
                    metrics.claimConflict(intent.agentName());
                    lostRace = true;
                }
            }

            if (!lostRace) {
                break;
            }
        }
        return Optional.empty();
    }

    private Task tryClaim(Task candidate, ClaimIntent intent) {
        Instant now = clock.instant();
        Task updated = candidate.withClaim(
            intent.agentName(), intent.orchestratorId(), intent.targetQueue(), now, intent.leaseDuration());
        return taskRepository.compareAndSet(updated, candidate.queue(), candidate.version())
            .orElseThrow(() -> new ClaimConflictException(candidate.id(), candidate.queue(), candidate.version()));
    }

    private boolean isEligible(Task task, ClaimIntent intent) {
        if (task.isClaimed()) {
            return false;
        }
        if (task.blockedBy() != null && !isResolved(task.blockedBy())) {
            log.debug("Task {} is blocked by {}", task.id(), task.blockedBy());
            return false;
        }
        if (intent.isReview() && intent.pendingCheck() != null) {
            return task.checks().contains(intent.pendingCheck()) && !task.hasPassed(intent.pendingCheck());
        }
        return true;
    }

    private boolean isResolved(String blockerId) {
        return taskRepository.findById(blockerId)
            .map(blocker -> blocker.isInQueue(TaskQueue.DONE))
            .orElse(false);
    }

    @Override
    public Optional<Task> renew(String taskId, String agentName, Duration extension) {
        Instant now = clock.instant();
        return mutator.mutateIf(taskId,
            t -> agentName.equals(t.claimedBy()) && !t.isLeaseExpired(now),
            t -> t.withLeaseExtended(now.plus(extension), now));
    }

    @Override
    public Optional<Task> releaseReviewClaim(String taskId) {
        Instant now = clock.instant();
        Optional<Task> released = mutator.mutateIf(taskId, Task::isReviewClaim, t -> t.withClaimCleared(now));
        released.ifPresent(t -> log.info("Released review claim on task {}", taskId));
        return released;
    }
}
