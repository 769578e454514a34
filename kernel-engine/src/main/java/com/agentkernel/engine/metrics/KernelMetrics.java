package com.agentkernel.engine.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the orchestration kernel.
 *
 * Metrics exposed:
 * - Claim outcomes (won, conflict, none available)
 * - Spawns and spawn failures per agent
 * - Reaped instances by outcome and by the signal that decided it
 * - Lease expirations and orphan requeues
 * - Guard blocks per guard
 * - Housekeeping and side-effect failures
 *
 * Safe to call before {@link #bindTo}: a simple registry is used until a
 * real one is bound.
 */
public class KernelMetrics implements MeterBinder {

    // Metric names
    public static final String CLAIMS = "kernel.claims";
    public static final String SPAWNS = "kernel.spawns";
    public static final String SPAWN_FAILURES = "kernel.spawn.failures";
    public static final String REAPS = "kernel.reaps";
    public static final String TRANSITIONS = "kernel.transitions";
    public static final String SIDE_EFFECT_FAILURES = "kernel.side_effect.failures";
    public static final String LEASE_EXPIRATIONS = "kernel.lease.expirations";
    public static final String ORPHANS_REQUEUED = "kernel.orphans.requeued";
    public static final String ORPHANS_ADOPTED = "kernel.orphans.adopted";
    public static final String GUARD_BLOCKS = "kernel.guard.blocks";
    public static final String HOUSEKEEPING_FAILURES = "kernel.housekeeping.failures";
    public static final String TRACKED_INSTANCES = "kernel.instances.tracked";
    public static final String TICK_DURATION = "kernel.tick.duration";

    private volatile MeterRegistry registry = new SimpleMeterRegistry();
    private final AtomicInteger trackedInstances = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        this.registry = meterRegistry;
        Gauge.builder(TRACKED_INSTANCES, trackedInstances, AtomicInteger::get)
            .description("Worker processes currently tracked by this orchestrator")
            .register(meterRegistry);
    }

    // ========== Claim Metrics ==========

    public void claimWon(String agent) {
        claim(agent, "won");
    }

    public void claimConflict(String agent) {
        claim(agent, "conflict");
    }

    public void claimNoneAvailable(String agent) {
        claim(agent, "none");
    }

    private void claim(String agent, String outcome) {
        Counter.builder(CLAIMS)
            .tag("agent", agent)
            .tag("outcome", outcome)
            .description("Claim attempts by outcome")
            .register(registry)
            .increment();
    }

    // ========== Agent Metrics ==========

    public void spawned(String agent) {
        Counter.builder(SPAWNS)
            .tag("agent", agent)
            .description("Worker processes started")
            .register(registry)
            .increment();
    }

    public void spawnFailed(String agent) {
        Counter.builder(SPAWN_FAILURES)
            .tag("agent", agent)
            .description("Worker processes that failed to start")
            .register(registry)
            .increment();
    }

    /**
     * @param source which signal decided the outcome: result, exit_code or degraded
     */
    public void reaped(String agent, String outcome, String source) {
        Counter.builder(REAPS)
            .tag("agent", agent)
            .tag("outcome", outcome)
            .tag("source", source)
            .description("Finished worker processes by outcome")
            .register(registry)
            .increment();
    }

    public void setTrackedInstances(int count) {
        trackedInstances.set(count);
    }

    // ========== Flow Metrics ==========

    public void transitioned(String from, String to) {
        Counter.builder(TRANSITIONS)
            .tag("from", from)
            .tag("to", to)
            .description("Committed queue transitions")
            .register(registry)
            .increment();
    }

    public void sideEffectFailed(String step) {
        Counter.builder(SIDE_EFFECT_FAILURES)
            .tag("step", step)
            .description("Post-transition steps that failed")
            .register(registry)
            .increment();
    }

    // ========== Recovery Metrics ==========

    public void leaseExpired() {
        Counter.builder(LEASE_EXPIRATIONS)
            .description("Claims requeued after lease expiry")
            .register(registry)
            .increment();
    }

    public void orphanAdopted() {
        Counter.builder(ORPHANS_ADOPTED)
            .description("Workers from an earlier orchestrator run tracked again")
            .register(registry)
            .increment();
    }

    public void orphanRequeued() {
        Counter.builder(ORPHANS_REQUEUED)
            .description("Claims requeued because no local process owned them")
            .register(registry)
            .increment();
    }

    public void housekeepingFailed(String job) {
        Counter.builder(HOUSEKEEPING_FAILURES)
            .tag("job", job)
            .description("Housekeeping job runs that raised")
            .register(registry)
            .increment();
    }

    // ========== Scheduler Metrics ==========

    public void guardBlocked(String guard) {
        Counter.builder(GUARD_BLOCKS)
            .tag("guard", guard)
            .description("Scheduling slots skipped by a guard")
            .register(registry)
            .increment();
    }

    public void recordTick(long durationMs) {
        Timer.builder(TICK_DURATION)
            .description("Scheduler tick duration")
            .register(registry)
            .record(java.time.Duration.ofMillis(durationMs));
    }

    public double count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }
}
