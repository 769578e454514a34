package com.agentkernel.core.model;

import com.agentkernel.core.exception.FlowValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowDefinitionTest {

    @Test
    void standardFlow_shouldBeValid() {
        FlowDefinition flow = FlowDefinition.standard("default");

        assertTrue(flow.validate().isEmpty());
        assertEquals("default@default", flow.key());
    }

    @Test
    void canTransition_shouldFollowTable() {
        FlowDefinition flow = FlowDefinition.standard("default");

        assertTrue(flow.canTransition("claimed", "provisional"));
        assertTrue(flow.canTransition("provisional", "incoming"));
        assertFalse(flow.canTransition("incoming", "done"));
        assertFalse(flow.canTransition("done", "incoming"));
    }

    @Test
    void successTarget_shouldBeFirstDeclaredTransition() {
        FlowDefinition flow = FlowDefinition.standard("default");

        assertEquals("provisional", flow.successTarget("claimed").orElseThrow());
        assertTrue(flow.successTarget("done").isEmpty());
    }

    @Test
    void failureTarget_shouldPreferConditionOnFail() {
        FlowDefinition flow = FlowDefinition.standard("default");

        assertEquals("incoming", flow.failureTarget("provisional"));
        assertEquals("failed", flow.failureTarget("claimed"));
    }

    @Test
    void validate_shouldRejectTransitionOutOfTerminalState() {
        FlowDefinition flow = FlowDefinition.builder()
            .name("broken")
            .cluster("team-a")
            .states(List.of("incoming", "done"))
            .transition(FlowTransition.of("done", "incoming"))
            .build();

        FlowValidationException e = assertThrows(FlowValidationException.class, flow::validated);
        assertTrue(e.getValidationErrors().stream().anyMatch(m -> m.contains("terminal")));
    }

    @Test
    void validate_shouldRejectUndeclaredStates() {
        FlowDefinition flow = FlowDefinition.builder()
            .name("broken")
            .cluster("team-a")
            .states(List.of("incoming", "claimed"))
            .transition(FlowTransition.of("claimed", "review"))
            .build();

        List<String> errors = flow.validate();
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("review"));
    }

    @Test
    void validate_shouldRequireAgentOnAgentCondition() {
        FlowDefinition flow = FlowDefinition.builder()
            .name("gated")
            .cluster("team-a")
            .states(List.of("provisional", "done", "incoming"))
            .transition(FlowTransition.of("provisional", "done")
                .withConditions(new FlowCondition("review", ConditionType.AGENT, null, null, "incoming")))
            .build();

        assertFalse(flow.validate().isEmpty());
    }
}
