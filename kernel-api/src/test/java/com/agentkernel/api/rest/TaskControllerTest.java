package com.agentkernel.api.rest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Task endpoints against the in-memory store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"memory", "test"})
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Created tasks land in incoming with the flow's review gates")
    void testCreateTask() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "API-1", "title": "Add retry to fetcher", "role": "implement", "priority": "P1"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("API-1"))
            .andExpect(jsonPath("$.queue").value("incoming"))
            .andExpect(jsonPath("$.priority").value("P1"))
            .andExpect(jsonPath("$.branch").value("main"))
            .andExpect(jsonPath("$.checks[0]").value("gatekeeper-review"));

        mockMvc.perform(get("/api/v1/tasks/API-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("Add retry to fetcher"));
    }

    @Test
    @DisplayName("Creating the same id twice is a conflict")
    void testDuplicateTask() throws Exception {
        String body = """
            {"id": "API-2", "title": "twice", "role": "implement"}
            """;
        mockMvc.perform(post("/api/v1/tasks").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/tasks").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("DUPLICATE_TASK"));
    }

    @Test
    @DisplayName("Unknown tasks are 404 with an error code")
    void testUnknownTask() throws Exception {
        mockMvc.perform(get("/api/v1/tasks/NOPE-1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
            .andExpect(jsonPath("$.path").value("/api/v1/tasks/NOPE-1"));
    }

    @Test
    @DisplayName("Accepting a task with pending checks is refused")
    void testAcceptWithPendingChecks() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "API-3", "title": "not reviewed", "role": "implement"}
                    """))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/tasks/API-3/accept"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("Failed tasks cannot be requeued")
    void testRequeueTerminalTask() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "API-4", "title": "doomed", "role": "implement"}
                    """))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/v1/tasks/API-4/fail")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"reason": "out of scope"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queue").value("failed"))
            .andExpect(jsonPath("$.lastError").value("out of scope"));

        mockMvc.perform(post("/api/v1/tasks/API-4/requeue"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("Listing by queue returns matching tasks")
    void testListByQueue() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "API-5", "title": "listed", "role": "implement"}
                    """))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/v1/tasks").param("queue", "incoming"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].id", hasItem("API-5")));
    }

    @Test
    @DisplayName("Bad input maps to 400")
    void testBadInput() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id": "API-6", "title": "urgent", "role": "implement", "priority": "P9"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_ARGUMENT"));

        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"title": "no id", "role": "implement"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("MALFORMED_TASK"));
    }
}
