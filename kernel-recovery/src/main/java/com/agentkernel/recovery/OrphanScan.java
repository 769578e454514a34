package com.agentkernel.recovery;

import com.agentkernel.agent.pool.InstanceRecord;
import com.agentkernel.agent.pool.InstanceRegistry;
import com.agentkernel.agent.process.Liveness;
import com.agentkernel.agent.process.ProcessProbe;
import com.agentkernel.agent.runtime.TaskDirectories;
import com.agentkernel.agent.runtime.TaskDirectory;
import com.agentkernel.agent.runtime.WorkerStamp;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.coordinator.TaskMutator;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Resolves claims this orchestrator holds but does not track a worker for,
 * e.g. after a restart. Claims younger than the grace period are left
 * alone so a spawn in progress is never mistaken for an orphan.
 *
 * A worker stamped in the task directory under the task's current claim
 * is adopted back into the registry when it is still running or has left
 * a result. Any other orphaned work claim is requeued without consuming an
 * attempt; review claims are released in place.
 */
public class OrphanScan implements HousekeepingJob {

    private static final Logger log = LoggerFactory.getLogger(OrphanScan.class);

    private static final int BATCH_SIZE = 100;

    private final TaskRepository taskRepository;
    private final TaskMutator mutator;
    private final InstanceRegistry registry;
    private final TaskDirectories directories;
    private final ProcessProbe probe;
    private final KernelMetrics metrics;
    private final Clock clock;
    private final String orchestratorId;
    private final Duration grace;

    public OrphanScan(TaskRepository taskRepository, InstanceRegistry registry, TaskDirectories directories,
                      ProcessProbe probe, KernelMetrics metrics, Clock clock, String orchestratorId,
                      Duration grace) {
        this.taskRepository = taskRepository;
        this.mutator = new TaskMutator(taskRepository);
        this.registry = registry;
        this.directories = directories;
        this.probe = probe;
        this.metrics = metrics;
        this.clock = clock;
        this.orchestratorId = orchestratorId;
        this.grace = grace;
    }

    @Override
    public String name() {
        return "orphan-scan";
    }

    @Override
    public int run() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(grace);
        int resolved = 0;
        for (Task task : taskRepository.find(TaskFilter.ownedBy(orchestratorId).withLimit(BATCH_SIZE))) {
            if (!task.isClaimed() || registry.hasTask(task.id()) || task.claimedAt().isAfter(cutoff)) {
                continue;
            }
            try (var ctx = LoggingContext.forTask(task.id(), task.claimedBy())) {
                if (adopt(task)) {
                    resolved++;
                } else if (release(task, now)) {
                    resolved++;
                }
            }
        }
        return resolved;
    }

    private boolean adopt(Task task) {
        TaskDirectory dir = directories.forTask(task.id());
        Optional<WorkerStamp> stamp = directories.readWorker(dir)
            .filter(s -> s.belongsTo(task.claimedBy(), task.claimedAt()));
        if (stamp.isEmpty()) {
            return false;
        }
        long pid = stamp.get().pid();
        Liveness liveness = probe.probe(pid);
        if (liveness == Liveness.DEAD && !Files.isRegularFile(dir.resultFile())) {
            log.info("Worker pid {} for {} is gone without a result", pid, task.id());
            return false;
        }
        registry.register(InstanceRecord.adopted(task.id(), dir, stamp.get()));
        metrics.orphanAdopted();
        metrics.setTrackedInstances(registry.size());
        log.info("Adopted worker pid {} ({}) for task {} held by {}", pid, liveness, task.id(), task.claimedBy());
        return true;
    }

    private boolean release(Task task, Instant now) {
        boolean changed = mutator.mutateIf(task.id(),
            t -> t.isClaimed() && orchestratorId.equals(t.orchestratorId()) && !registry.hasTask(t.id()),
            t -> t.isReviewClaim()
                ? t.withClaimCleared(now)
                : t.withRequeued(false, now).withLastError("no worker process for claim by " + t.claimedBy(), now))
            .isPresent();
        if (changed) {
            metrics.orphanRequeued();
            log.warn("Released orphaned claim on {} held by {}", task.id(), task.claimedBy());
        }
        return changed;
    }
}
