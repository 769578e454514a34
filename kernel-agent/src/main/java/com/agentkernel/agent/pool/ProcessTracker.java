package com.agentkernel.agent.pool;

import com.agentkernel.agent.process.Liveness;
import com.agentkernel.agent.process.ProcessProbe;
import com.agentkernel.agent.result.ResultReader;
import com.agentkernel.agent.result.WorkerResult;
import com.agentkernel.core.exception.KernelException;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.agentkernel.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Watches tracked workers and applies the results of finished ones.
 */
public class ProcessTracker {

    private static final Logger log = LoggerFactory.getLogger(ProcessTracker.class);

    public static final int DEFAULT_MAX_STEP_FAILURES = 3;

    /** How long a dead worker's exit hook gets to record the exit code. */
    static final Duration EXIT_RECORD_WAIT = Duration.ofSeconds(2);

    private final InstanceRegistry registry;
    private final ProcessProbe probe;
    private final ResultReader resultReader;
    private final ResultHandler resultHandler;
    private final TaskService taskService;
    private final KernelMetrics metrics;
    private final int maxStepFailures;

    public ProcessTracker(InstanceRegistry registry, ProcessProbe probe, ResultReader resultReader,
                          ResultHandler resultHandler, TaskService taskService, KernelMetrics metrics,
                          int maxStepFailures) {
        this.registry = registry;
        this.probe = probe;
        this.resultReader = resultReader;
        this.resultHandler = resultHandler;
        this.taskService = taskService;
        this.metrics = metrics;
        this.maxStepFailures = maxStepFailures;
    }

    /**
     * Probe running instances and collect every finished one with its result.
     * Instances whose probe fails stay running. A dead worker's result is
     * read only after its exit code has been recorded, or after
     * {@link #EXIT_RECORD_WAIT} if the exit hook lags.
     */
    public List<FinishedInstance> poll() {
        List<FinishedInstance> finished = new ArrayList<>();
        for (InstanceRecord record : registry.all()) {
            if (record.isRunning()) {
                Liveness liveness = probe.probe(record.pid());
                if (liveness != Liveness.DEAD) {
                    continue;
                }
                registry.markFinished(record.instanceId());
            }
            awaitExitRecorded(record);
            WorkerResult result = resultReader.read(record.directory(), record.claimMode());
            finished.add(new FinishedInstance(record, result));
        }
        return finished;
    }

    private void awaitExitRecorded(InstanceRecord record) {
        Optional<CompletableFuture<Void>> exitRecorded = registry.exitRecorded(record.instanceId());
        if (exitRecorded.isEmpty()) {
            return;
        }
        try {
            exitRecorded.get().get(EXIT_RECORD_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Exit code of pid {} for task {} not recorded within {}, reading its result without it",
                record.pid(), record.taskId(), EXIT_RECORD_WAIT);
        } catch (ExecutionException e) {
            log.warn("Exit hook of pid {} for task {} failed: {}", record.pid(), record.taskId(),
                e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for the exit code of pid {} for task {}", record.pid(), record.taskId());
        }
    }

    /**
     * Apply the results of all finished instances.
     *
     * @return number of instances whose record was removed
     */
    public int reap() {
        int reaped = 0;
        for (FinishedInstance instance : poll()) {
            InstanceRecord record = instance.record();
            try (var ctx = LoggingContext.forTask(record.taskId(), record.agentName())) {
                if (handle(instance)) {
                    reaped++;
                }
            }
        }
        metrics.setTrackedInstances(registry.size());
        return reaped;
    }

    private boolean handle(FinishedInstance instance) {
        InstanceRecord record = instance.record();
        WorkerResult result = instance.result();
        try {
            ReapOutcome outcome = resultHandler.apply(record, result);
            registry.remove(record.instanceId());
            metrics.reaped(record.agentName(),
                outcome == ReapOutcome.DISCARDED ? "stale" : result.metricOutcome(), result.source().tag());
            log.info("Reaped {} for task {}: {} from {}", record.agentName(), record.taskId(),
                outcome == ReapOutcome.DISCARDED ? "stale" : result.metricOutcome(), result.source().tag());
            return true;
        } catch (RuntimeException e) {
            InstanceRecord updated = registry.recordStepFailure(record.instanceId());
            int failures = updated != null ? updated.stepFailures() : record.stepFailures() + 1;
            log.warn("Applying result of {} for task {} failed ({}/{}): {}", record.agentName(), record.taskId(),
                failures, maxStepFailures, e.getMessage());
            if (failures < maxStepFailures) {
                return false;
            }
            giveUp(record, e);
            return true;
        }
    }

    private void giveUp(InstanceRecord record, RuntimeException cause) {
        try {
            taskService.fail(record.taskId(), "result could not be applied: " + cause.getMessage());
        } catch (KernelException e) {
            log.error("Could not move task {} to failed after {} attempts: {}", record.taskId(),
                maxStepFailures, e.getMessage());
        }
        registry.remove(record.instanceId());
        metrics.reaped(record.agentName(), "step_failures", "result");
    }

    /**
     * Whether a task has a finished worker whose result is not applied yet.
     */
    public boolean hasPendingResult(String taskId) {
        return registry.findByTask(taskId)
            .filter(r -> !r.isRunning() || Files.isRegularFile(r.directory().resultFile()))
            .isPresent();
    }
}
