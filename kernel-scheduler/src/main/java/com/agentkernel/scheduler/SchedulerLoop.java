package com.agentkernel.scheduler;

import com.agentkernel.agent.pool.AgentPool;
import com.agentkernel.agent.pool.InstanceRecord;
import com.agentkernel.core.exception.KernelException;
import com.agentkernel.core.exception.SpawnFailureException;
import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import com.agentkernel.engine.service.ClaimService;
import com.agentkernel.engine.service.TaskService;
import com.agentkernel.recovery.HousekeepingRunner;
import com.agentkernel.scheduler.guard.GuardChain;
import com.agentkernel.scheduler.guard.GuardResult;
import com.agentkernel.scheduler.guard.TickState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The orchestrator's main loop.
 *
 * Each tick runs housekeeping, then, unless paused, walks the blueprints
 * in their configured order and fills their free slots: guard chain,
 * claim, spawn. A slot that is blocked, finds nothing to claim or fails
 * to spawn ends that blueprint's turn for the tick.
 *
 * A task whose earlier worker is still tracked is never claimed again
 * until that worker has been reaped, so two workers never share a task
 * directory or worktree.
 *
 * Ticks never overlap: {@link #tick()} is synchronized and the background
 * schedule uses a single thread with a fixed delay.
 */
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final SchedulerSettings settings;
    private final List<AgentBlueprint> blueprints;
    private final GuardChain guards;
    private final HousekeepingRunner housekeeping;
    private final ClaimService claimService;
    private final TaskService taskService;
    private final TaskRepository taskRepository;
    private final AgentPool pool;
    private final KernelMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong(0);
    private volatile ScheduledExecutorService executor;

    public SchedulerLoop(SchedulerSettings settings, List<AgentBlueprint> blueprints, GuardChain guards,
                         HousekeepingRunner housekeeping, ClaimService claimService, TaskService taskService,
                         TaskRepository taskRepository, AgentPool pool, KernelMetrics metrics, Clock clock) {
        this.settings = settings;
        this.blueprints = List.copyOf(blueprints);
        this.guards = guards;
        this.housekeeping = housekeeping;
        this.claimService = claimService;
        this.taskService = taskService;
        this.taskRepository = taskRepository;
        this.pool = pool;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run one tick now.
     */
    public synchronized TickReport tick() {
        long tick = ticks.incrementAndGet();
        long started = System.nanoTime();
        try (var ctx = LoggingContext.forTick(settings.orchestratorId(), tick)) {
            Map<String, Integer> housekept = housekeeping.runAll();

            boolean isPaused = paused.get();
            List<String> spawned = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            if (!isPaused) {
                TickState state = new TickState(tick, clock.instant(), false, taskRepository);
                for (AgentBlueprint blueprint : blueprints) {
                    fillSlots(blueprint, state, spawned, failed);
                }
            }

            if (!spawned.isEmpty() || !failed.isEmpty()) {
                log.info("Tick {} spawned {} worker(s), {} spawn failure(s)", tick, spawned.size(), failed.size());
            }
            return new TickReport(tick, isPaused, housekept, spawned, failed);
        } finally {
            metrics.recordTick((System.nanoTime() - started) / 1_000_000);
            LoggingContext.clearAll();
        }
    }

    private void fillSlots(AgentBlueprint blueprint, TickState state, List<String> spawned, List<String> failed) {
        for (int slot = 0; slot < blueprint.maxInstances(); slot++) {
            GuardResult verdict = guards.evaluate(blueprint, slot, state);
            if (verdict.blocked()) {
                return;
            }

            Optional<Task> claimed = claimService.claim(blueprint.claimIntent(settings.orchestratorId()),
                this::hasNoTrackedWorker);
            if (claimed.isEmpty()) {
                return;
            }

            Task task = claimed.get();
            try {
                pool.spawn(blueprint, task);
                spawned.add(task.id());
            } catch (SpawnFailureException e) {
                failed.add(task.id());
                log.error("Could not start {} for task {}: {}", blueprint.name(), task.id(), e.getMessage());
                undoClaim(blueprint, task, e);
                return;
            }
        }
    }

    private boolean hasNoTrackedWorker(Task task) {
        Optional<InstanceRecord> previous = pool.registry().findByTask(task.id());
        previous.ifPresent(r -> log.debug("Skipping {}: pid {} of {} is still tracked", task.id(), r.pid(),
            r.agentName()));
        return previous.isEmpty();
    }

    /**
     * Give a claim back after a failed spawn. Work claims consume an
     * attempt so a task that can never start ends up failed.
     */
    private void undoClaim(AgentBlueprint blueprint, Task task, SpawnFailureException cause) {
        try (var ctx = LoggingContext.forTask(task.id(), blueprint.name())) {
            if (blueprint.spawn().isReview()) {
                claimService.releaseReviewClaim(task.id());
                taskService.recordError(task.id(), cause.getMessage());
            } else {
                taskService.failAttempt(task.id(), cause.getMessage());
            }
        } catch (KernelException e) {
            log.error("Could not return task {} after spawn failure, leaving it to lease expiry: {}",
                task.id(), e.getMessage());
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Scheduler loop already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "kernel-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        long delay = settings.tickInterval().toMillis();
        executor.scheduleWithFixedDelay(this::safeTick, 0, delay, TimeUnit.MILLISECONDS);
        log.info("Scheduler loop started for {} (tick every {} ms, {} blueprint(s))",
            settings.orchestratorId(), delay, blueprints.size());
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    /**
     * Stop scheduling ticks and wait for a tick in progress to finish.
     * Worker processes are not touched.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledExecutorService current = executor;
        current.shutdown();
        try {
            if (!current.awaitTermination(30, TimeUnit.SECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler loop stopped after {} tick(s)", ticks.get());
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Scheduler paused: no new claims until resumed");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Scheduler resumed");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public long tickCount() {
        return ticks.get();
    }

    public List<AgentBlueprint> blueprints() {
        return blueprints;
    }
}
