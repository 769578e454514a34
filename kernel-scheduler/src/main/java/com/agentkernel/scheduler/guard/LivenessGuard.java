package com.agentkernel.scheduler.guard;

import com.agentkernel.agent.pool.InstanceRecord;
import com.agentkernel.agent.pool.InstanceRegistry;
import com.agentkernel.agent.process.Liveness;
import com.agentkernel.agent.process.ProcessProbe;
import com.agentkernel.core.model.AgentBlueprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes the blueprint's running workers before capacity is counted.
 * Only a confirmed-dead process is marked finished; a probe that fails
 * blocks the slot rather than freeing it.
 */
public class LivenessGuard implements Guard {

    private static final Logger log = LoggerFactory.getLogger(LivenessGuard.class);

    private final InstanceRegistry registry;
    private final ProcessProbe probe;

    public LivenessGuard(InstanceRegistry registry, ProcessProbe probe) {
        this.registry = registry;
        this.probe = probe;
    }

    @Override
    public String name() {
        return "liveness";
    }

    @Override
    public GuardResult evaluate(AgentBlueprint blueprint, int slot, TickState state) {
        for (InstanceRecord record : registry.forAgent(blueprint.name())) {
            if (!record.isRunning()) {
                continue;
            }
            Liveness liveness = probe.probe(record.pid());
            if (liveness == Liveness.UNKNOWN) {
                return block("cannot probe pid " + record.pid() + " of task " + record.taskId());
            }
            if (liveness == Liveness.DEAD) {
                log.info("Worker pid {} for task {} has exited", record.pid(), record.taskId());
                registry.markFinished(record.instanceId());
            }
        }
        return GuardResult.pass();
    }
}
