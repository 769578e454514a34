package com.agentkernel.scheduler.guard;

import com.agentkernel.core.model.AgentBlueprint;

/**
 * A precondition for filling one slot of a blueprint.
 */
public interface Guard {

    String name();

    /**
     * @param blueprint the agent about to claim
     * @param slot      zero-based slot index within this tick
     * @param state     state shared by all guards during the tick
     */
    GuardResult evaluate(AgentBlueprint blueprint, int slot, TickState state);

    default GuardResult block(String reason) {
        return GuardResult.block(name(), reason);
    }
}
