package com.repairline.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.api.TestAgentConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "repairline.engine.retry.max-attempts=1")
@AutoConfigureMockMvc
@Import(TestAgentConfiguration.class)
class WorkflowControllerTest {

    private static final String REPAIR_WORKFLOW = """
        {
          "name": "belt-repair",
          "failurePolicy": "FAIL_FAST",
          "tasks": [
            {"id": "inspect", "capability": "diagnose"},
            {"id": "report", "capability": "diagnose", "dependencies": ["inspect"]}
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createWorkflow(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode created = objectMapper.readTree(result.getResponse().getContentAsString());
        return created.get("id").asText();
    }

    @Nested
    @DisplayName("Workflows")
    class Workflows {

        @Test
        @DisplayName("should create, fetch and delete a workflow")
        void createFetchDelete() throws Exception {
            String workflowId = createWorkflow(REPAIR_WORKFLOW);
            assertThat(workflowId).startsWith("workflow_");

            mockMvc.perform(get("/api/v1/workflows/{id}", workflowId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("belt-repair"))
                .andExpect(jsonPath("$.tasks.length()").value(2));

            mockMvc.perform(delete("/api/v1/workflows/{id}", workflowId))
                .andExpect(status().isNoContent());

            mockMvc.perform(get("/api/v1/workflows/{id}", workflowId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        @DisplayName("should reject a cyclic workflow with 400")
        void rejectsCycle() throws Exception {
            String cyclic = """
                {
                  "name": "loop",
                  "tasks": [
                    {"id": "a", "capability": "diagnose", "dependencies": ["b"]},
                    {"id": "b", "capability": "diagnose", "dependencies": ["a"]}
                  ]
                }
                """;

            mockMvc.perform(post("/api/v1/workflows")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(cyclic))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("CIRCULAR_DEPENDENCY"));
        }

        @Test
        @DisplayName("should reject a workflow without tasks with 400")
        void rejectsEmptyWorkflow() throws Exception {
            mockMvc.perform(post("/api/v1/workflows")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"empty\", \"tasks\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
        }
    }

    @Nested
    @DisplayName("Executions")
    class Executions {

        @Test
        @DisplayName("should execute a workflow to completion and expose the execution")
        void executesWorkflow() throws Exception {
            String workflowId = createWorkflow(REPAIR_WORKFLOW);

            MvcResult result = mockMvc.perform(post("/api/v1/workflows/{id}/execute", workflowId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"input\": {\"ticket\": \"T-9\"}, \"tenantId\": \"acme\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.completedTasks.length()").value(2))
                .andReturn();
            String executionId = objectMapper.readTree(result.getResponse().getContentAsString())
                .get("id").asText();

            mockMvc.perform(get("/api/v1/executions/{id}", executionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value("acme"))
                .andExpect(jsonPath("$.output.report.diagnosis").value("worn belt"));

            mockMvc.perform(get("/api/v1/workflows/{id}/executions", workflowId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(executionId));
        }

        @Test
        @DisplayName("should answer 409 when cancelling a finished execution")
        void cancelFinishedIsConflict() throws Exception {
            String workflowId = createWorkflow(REPAIR_WORKFLOW);
            MvcResult result = mockMvc.perform(post("/api/v1/workflows/{id}/execute", workflowId))
                .andExpect(status().isOk())
                .andReturn();
            String executionId = objectMapper.readTree(result.getResponse().getContentAsString())
                .get("id").asText();

            mockMvc.perform(post("/api/v1/executions/{id}/cancel", executionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));
        }

        @Test
        @DisplayName("should answer 404 for an unknown execution")
        void unknownExecution() throws Exception {
            mockMvc.perform(get("/api/v1/executions/{id}", "exec_missing"))
                .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("Agents")
    class Agents {

        @Test
        @DisplayName("should list agents by capability and toggle health")
        void listsAndTogglesHealth() throws Exception {
            MvcResult result = mockMvc.perform(get("/api/v1/agents").param("capability", "diagnose"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("diagnoser"))
                .andExpect(jsonPath("$[0].healthy").value(true))
                .andReturn();
            String agentId = objectMapper.readTree(result.getResponse().getContentAsString())
                .get(0).get("id").asText();

            mockMvc.perform(put("/api/v1/agents/{id}/health", agentId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"healthy\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(false));

            mockMvc.perform(put("/api/v1/agents/{id}/health", agentId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"healthy\": true}"))
                .andExpect(status().isOk());
        }

        @Test
        @DisplayName("should create a pool and invoke a capability directly")
        void poolsAndInvoke() throws Exception {
            mockMvc.perform(post("/api/v1/pools")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"bench\", \"strategy\": \"LEAST_BUSY\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(org.hamcrest.Matchers.startsWith("pool_")))
                .andExpect(jsonPath("$.strategy").value("LEAST_BUSY"));

            mockMvc.perform(post("/api/v1/capabilities/{capability}/invoke", "diagnose")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"input\": {\"ticket\": \"T-1\"}, \"tenantId\": \"acme\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.output.diagnosis").value("worn belt"));
        }
    }
}
