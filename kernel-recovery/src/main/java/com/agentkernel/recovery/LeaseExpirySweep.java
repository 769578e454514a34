package com.agentkernel.recovery;

import com.agentkernel.agent.pool.ProcessTracker;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.coordinator.TaskMutator;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Recovers claims whose lease ran out.
 *
 * Work claims go back to incoming with one more attempt; review claims are
 * released in place. Tasks whose worker already finished are left for
 * result application. Each recovery is conditional on the lease still
 * being expired when it is written, so a renewal that lands in between
 * wins.
 */
public class LeaseExpirySweep implements HousekeepingJob {

    private static final Logger log = LoggerFactory.getLogger(LeaseExpirySweep.class);

    private static final int BATCH_SIZE = 100;

    private final TaskRepository taskRepository;
    private final TaskMutator mutator;
    private final ProcessTracker tracker;
    private final KernelMetrics metrics;
    private final Clock clock;

    public LeaseExpirySweep(TaskRepository taskRepository, ProcessTracker tracker, KernelMetrics metrics, Clock clock) {
        this.taskRepository = taskRepository;
        this.mutator = new TaskMutator(taskRepository);
        this.tracker = tracker;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "lease-expiry";
    }

    @Override
    public int run() {
        Instant now = clock.instant();
        List<Task> expired = taskRepository.findExpiredClaims(now, BATCH_SIZE);
        if (expired.isEmpty()) {
            return 0;
        }
        log.info("Found {} expired claim(s)", expired.size());

        int recovered = 0;
        for (Task task : expired) {
            try (var ctx = LoggingContext.forTask(task.id(), task.claimedBy())) {
                if (tracker.hasPendingResult(task.id())) {
                    log.debug("Lease of {} expired but its result is pending, leaving it", task.id());
                    continue;
                }
                if (recover(task.id(), now).isPresent()) {
                    recovered++;
                    metrics.leaseExpired();
                }
            }
        }
        return recovered;
    }

    private Optional<Task> recover(String taskId, Instant now) {
        return mutator.mutateIf(taskId,
            t -> t.isClaimed() && t.isLeaseExpired(now),
            t -> {
                String reason = "lease of " + t.claimedBy() + " expired at " + t.leaseExpiresAt();
                if (t.isReviewClaim()) {
                    log.info("Releasing expired review claim on {} held by {}", t.id(), t.claimedBy());
                    return t.withClaimCleared(now);
                }
                log.info("Requeueing {} after {}", t.id(), reason);
                return t.withRequeued(true, now).withLastError(reason, now);
            });
    }
}
