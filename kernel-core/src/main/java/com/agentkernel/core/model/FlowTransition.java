package com.agentkernel.core.model;

import java.util.List;

/**
 * One row of a flow's transition table.
 */
public record FlowTransition(
    String from,
    String to,
    String agent,
    List<SideEffect> runs,
    List<FlowCondition> conditions
) {
    public FlowTransition {
        runs = runs != null ? List.copyOf(runs) : List.of();
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static FlowTransition of(String from, String to) {
        return new FlowTransition(from, to, null, List.of(), List.of());
    }

    public FlowTransition withRuns(SideEffect... steps) {
        return new FlowTransition(from, to, agent, List.of(steps), conditions);
    }

    public FlowTransition withConditions(FlowCondition... gates) {
        return new FlowTransition(from, to, agent, runs, List.of(gates));
    }

    public FlowTransition withAgent(String agentName) {
        return new FlowTransition(from, to, agentName, runs, conditions);
    }

    public boolean matches(String fromQueue, String toQueue) {
        return from.equals(fromQueue) && to.equals(toQueue);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
