package com.agentkernel.scheduler.guard;

import com.agentkernel.agent.pool.InstanceRegistry;
import com.agentkernel.core.model.AgentBlueprint;

public class PoolCapacityGuard implements Guard {

    private final InstanceRegistry registry;

    public PoolCapacityGuard(InstanceRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "pool-capacity";
    }

    @Override
    public GuardResult evaluate(AgentBlueprint blueprint, int slot, TickState state) {
        long running = registry.countRunning(blueprint.name());
        if (running >= blueprint.maxInstances()) {
            return block(running + "/" + blueprint.maxInstances() + " instances running");
        }
        return GuardResult.pass();
    }
}
