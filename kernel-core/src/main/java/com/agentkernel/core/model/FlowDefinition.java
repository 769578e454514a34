package com.agentkernel.core.model;

import com.agentkernel.core.exception.FlowValidationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative state machine for tasks of one flow in one cluster.
 *
 * Primary Key: {name}@{cluster}
 *
 * Invariants:
 * - every transition endpoint is a declared state
 * - no transition leaves a terminal state (done, failed)
 * - every on_fail target is a declared state
 */
public record FlowDefinition(
    String name,
    String cluster,
    List<String> states,
    List<FlowTransition> transitions
) {
    public FlowDefinition {
        states = states != null ? List.copyOf(states) : List.of();
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
    }

    /**
     * Construct the unique identifier for this flow definition.
     */
    public String key() {
        return key(name, cluster);
    }

    public static String key(String name, String cluster) {
        return name + "@" + cluster;
    }

    public boolean hasState(String state) {
        return states.contains(state);
    }

    /**
     * Whether the table contains {@code from -> to}. Terminal sources never
     * transition, whatever the table says.
     */
    public boolean canTransition(String from, String to) {
        if (TaskQueue.isTerminal(from)) {
            return false;
        }
        return findTransition(from, to).isPresent();
    }

    public Optional<FlowTransition> findTransition(String from, String to) {
        return transitions.stream()
            .filter(t -> t.matches(from, to))
            .findFirst();
    }

    public List<FlowTransition> transitionsFrom(String from) {
        return transitions.stream()
            .filter(t -> t.from().equals(from))
            .toList();
    }

    /**
     * The queue a successful worker moves a task to: the first transition
     * declared from {@code from}.
     */
    public Optional<String> successTarget(String from) {
        return transitionsFrom(from).stream()
            .map(FlowTransition::to)
            .findFirst();
    }

    /**
     * The queue a failed task moves to: the first on_fail declared on a
     * condition of a transition from {@code from}, else failed.
     */
    public String failureTarget(String from) {
        return transitionsFrom(from).stream()
            .flatMap(t -> t.conditions().stream())
            .map(FlowCondition::onFail)
            .filter(target -> target != null && !target.isBlank())
            .findFirst()
            .orElse(TaskQueue.FAILED.wireName());
    }

    /**
     * Validate the definition.
     *
     * @return list of problems, empty when valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("flow name is required");
        }
        if (cluster == null || cluster.isBlank()) {
            errors.add("flow cluster is required");
        }
        if (states.isEmpty()) {
            errors.add("flow declares no states");
        }
        Set<String> seen = new HashSet<>();
        for (String state : states) {
            if (!seen.add(state)) {
                errors.add("duplicate state '" + state + "'");
            }
        }
        for (FlowTransition t : transitions) {
            if (!hasState(t.from())) {
                errors.add("transition '" + t + "' starts from undeclared state '" + t.from() + "'");
            }
            if (!hasState(t.to())) {
                errors.add("transition '" + t + "' targets undeclared state '" + t.to() + "'");
            }
            if (TaskQueue.isTerminal(t.from())) {
                errors.add("transition '" + t + "' leaves terminal state '" + t.from() + "'");
            }
            for (FlowCondition c : t.conditions()) {
                if (c.type() == ConditionType.SCRIPT && (c.script() == null || c.script().isBlank())) {
                    errors.add("condition '" + c.name() + "' on '" + t + "': script conditions must name a script");
                }
                if (c.type() == ConditionType.AGENT && (c.agent() == null || c.agent().isBlank())) {
                    errors.add("condition '" + c.name() + "' on '" + t + "': agent conditions must name an agent");
                }
                if (c.onFail() != null && !hasState(c.onFail())) {
                    errors.add("condition '" + c.name() + "' on '" + t + "': on_fail targets undeclared state '"
                        + c.onFail() + "'");
                }
            }
        }
        return errors;
    }

    public FlowDefinition validated() {
        List<String> errors = validate();
        if (!errors.isEmpty()) {
            throw new FlowValidationException(key(), errors);
        }
        return this;
    }

    /**
     * The built-in flow: implement, submit for review, accept.
     */
    public static FlowDefinition standard(String cluster) {
        String incoming = TaskQueue.INCOMING.wireName();
        String claimed = TaskQueue.CLAIMED.wireName();
        String provisional = TaskQueue.PROVISIONAL.wireName();
        String done = TaskQueue.DONE.wireName();
        String failed = TaskQueue.FAILED.wireName();
        String continuation = TaskQueue.NEEDS_CONTINUATION.wireName();

        return builder()
            .name(Task.DEFAULT_FLOW)
            .cluster(cluster)
            .states(List.of(incoming, claimed, provisional, done, failed, continuation))
            .transition(FlowTransition.of(incoming, claimed).withAgent("implementer"))
            .transition(FlowTransition.of(claimed, provisional)
                .withRuns(SideEffect.PUSH_BRANCH, SideEffect.CREATE_PR, SideEffect.CHECK_MERGEABLE))
            .transition(FlowTransition.of(claimed, continuation))
            .transition(FlowTransition.of(claimed, failed))
            .transition(FlowTransition.of(claimed, incoming))
            .transition(FlowTransition.of(continuation, claimed))
            .transition(FlowTransition.of(provisional, done)
                .withConditions(FlowCondition.agent("gatekeeper-review", "gatekeeper", incoming))
                .withRuns(SideEffect.MERGE_PR))
            .transition(FlowTransition.of(provisional, incoming))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String cluster = Task.DEFAULT_CLUSTER;
        private List<String> states = List.of();
        private final List<FlowTransition> transitions = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder cluster(String cluster) {
            this.cluster = cluster;
            return this;
        }

        public Builder states(List<String> states) {
            this.states = states;
            return this;
        }

        public Builder transition(FlowTransition transition) {
            this.transitions.add(transition);
            return this;
        }

        public Builder transitions(List<FlowTransition> transitions) {
            this.transitions.addAll(transitions);
            return this;
        }

        public FlowDefinition build() {
            return new FlowDefinition(name, cluster, states, transitions);
        }
    }
}
