package com.agentkernel.scheduler.guard;

import com.agentkernel.core.model.AgentBlueprint;

public class PauseGuard implements Guard {

    @Override
    public String name() {
        return "pause";
    }

    @Override
    public GuardResult evaluate(AgentBlueprint blueprint, int slot, TickState state) {
        if (state.systemPaused()) {
            return block("scheduler paused");
        }
        if (blueprint.paused()) {
            return block("blueprint " + blueprint.name() + " paused");
        }
        return GuardResult.pass();
    }
}
