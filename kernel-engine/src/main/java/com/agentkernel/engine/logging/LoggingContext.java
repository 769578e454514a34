package com.agentkernel.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures kernel logs carry the task, agent and tick they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(task.id(), blueprint.name())) {
 *     log.info("Spawning worker"); // Automatically includes taskId, agent
 * }
 * </pre>
 *
 * Only the keys a context put are removed on close, so contexts nest: a
 * task context opened inside a tick context leaves the tick key in place.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String AGENT = "agent";
    public static final String ORCHESTRATOR_ID = "orchestratorId";
    public static final String TICK = "tick";
    public static final String JOB = "job";
    public static final String TRACE_ID = "traceId";

    private final List<String> keys = new ArrayList<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for one scheduler tick.
     */
    public static LoggingContext forTick(String orchestratorId, long tick) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(ORCHESTRATOR_ID, orchestratorId);
        ctx.put(TICK, String.valueOf(tick));
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for task-level operations.
     */
    public static LoggingContext forTask(String taskId, String agent) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(TASK_ID, taskId);
        ctx.put(AGENT, agent);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a housekeeping job.
     */
    public static LoggingContext forJob(String jobName) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(JOB, jobName);
        ensureTraceId();
        return ctx;
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (value != null && MDC.get(key) == null) {
            MDC.put(key, value);
            keys.add(key);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        // Keep TRACE_ID for the enclosing tick
    }

    /**
     * Clear all MDC context. Call at the end of a scheduler loop iteration.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
