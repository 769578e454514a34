package com.agentkernel.scheduler;

import com.agentkernel.agent.pool.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

/**
 * Stops the scheduler loop when the application context closes.
 *
 * On shutdown:
 * 1. Stops scheduling ticks and waits for the current one
 * 2. Leaves worker processes running
 *
 * Claims of those workers are recovered after restart by the orphan scan
 * or by lease expiry.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final SchedulerLoop loop;
    private final InstanceRegistry registry;

    public GracefulShutdownHandler(SchedulerLoop loop, InstanceRegistry registry) {
        this.loop = loop;
        this.registry = registry;
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        log.info("Initiating graceful shutdown");
        loop.stop();
        int tracked = registry.size();
        if (tracked > 0) {
            log.warn("Leaving {} worker process(es) running; their claims recover by orphan scan or lease expiry",
                tracked);
        }
        log.info("Graceful shutdown complete");
    }
}
