package com.agentkernel.scheduler.guard;

import com.agentkernel.core.model.AgentBlueprint;
import com.agentkernel.engine.metrics.KernelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Evaluates guards in order and stops at the first one that blocks.
 */
public class GuardChain {

    private static final Logger log = LoggerFactory.getLogger(GuardChain.class);

    private final List<Guard> guards;
    private final KernelMetrics metrics;

    public GuardChain(List<Guard> guards, KernelMetrics metrics) {
        this.guards = List.copyOf(guards);
        this.metrics = metrics;
    }

    public GuardResult evaluate(AgentBlueprint blueprint, int slot, TickState state) {
        for (Guard guard : guards) {
            GuardResult result = guard.evaluate(blueprint, slot, state);
            if (result.blocked()) {
                metrics.guardBlocked(guard.name());
                log.debug("{} slot {} blocked by {}: {}", blueprint.name(), slot, guard.name(), result.reason());
                return result;
            }
        }
        return GuardResult.pass();
    }

    public List<Guard> guards() {
        return guards;
    }
}
