package com.agentkernel.scheduler.guard;

import com.agentkernel.core.model.AgentBlueprint;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lets a blueprint run at most once per its interval. The first slot of a
 * tick decides; later slots of the same tick follow it.
 */
public class IntervalGuard implements Guard {

    private final Map<String, Instant> lastEvaluated = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "interval";
    }

    @Override
    public GuardResult evaluate(AgentBlueprint blueprint, int slot, TickState state) {
        if (slot > 0 || blueprint.interval().isZero()) {
            return GuardResult.pass();
        }
        Instant last = lastEvaluated.get(blueprint.name());
        if (last != null) {
            Duration elapsed = Duration.between(last, state.now());
            if (elapsed.compareTo(blueprint.interval()) < 0) {
                return block("last run " + elapsed.toSeconds() + "s ago, interval " + blueprint.interval().toSeconds() + "s");
            }
        }
        lastEvaluated.put(blueprint.name(), state.now());
        return GuardResult.pass();
    }
}
