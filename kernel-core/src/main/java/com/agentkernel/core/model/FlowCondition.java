package com.agentkernel.core.model;

/**
 * A gate attached to a transition. {@code onFail} names the queue a task
 * goes to when the gate fails.
 */
public record FlowCondition(
    String name,
    ConditionType type,
    String script,
    String agent,
    String onFail
) {
    public static FlowCondition agent(String name, String agent, String onFail) {
        return new FlowCondition(name, ConditionType.AGENT, null, agent, onFail);
    }

    public static FlowCondition script(String name, String script, String onFail) {
        return new FlowCondition(name, ConditionType.SCRIPT, script, null, onFail);
    }

    public static FlowCondition manual(String name) {
        return new FlowCondition(name, ConditionType.MANUAL, null, null, null);
    }
}
