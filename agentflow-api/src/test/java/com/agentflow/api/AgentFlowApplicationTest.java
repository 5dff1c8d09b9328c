package com.agentflow.api;

import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.examples.development.DevelopmentWorkers;
import com.agentflow.examples.development.DevelopmentWorkflows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Boots the whole service: YAML catalog, built-in workers, engine and REST layer.
 */
@SpringBootTest
@AutoConfigureMockMvc
class AgentFlowApplicationTest {

    @Autowired MockMvc mockMvc;
    @Autowired WorkflowService workflowService;
    @Autowired WorkerRegistry workerRegistry;

    @Test
    @DisplayName("Startup registers the development workers and the catalog workflows")
    void testCatalogLoaded() {
        assertThat(workerRegistry.findAll()).hasSize(DevelopmentWorkers.descriptors().size());
        assertThat(workflowService.listWorkflows())
            .extracting(WorkflowDefinition::name)
            .contains(DevelopmentWorkflows.API_FIRST, DevelopmentWorkflows.DEBUG_SESSION,
                DevelopmentWorkflows.FULL_STACK_FEATURE, DevelopmentWorkflows.QUALITY_SPRINT);
    }

    @Test
    @DisplayName("Catalog workflows match the programmatic definitions")
    void testCatalogMatchesDefinitions() {
        for (WorkflowDefinition definition : DevelopmentWorkflows.all()) {
            WorkflowDefinition loaded = workflowService.getWorkflow(definition.name());
            assertThat(loaded.phaseIds()).isEqualTo(definition.phaseIds());
            for (String phaseId : definition.phaseIds()) {
                assertThat(loaded.getPhase(phaseId).workers()).isEqualTo(definition.getPhase(phaseId).workers());
                assertThat(loaded.getPhase(phaseId).maxIterations()).isEqualTo(definition.getPhase(phaseId).maxIterations());
            }
        }
    }

    @Test
    @DisplayName("A synchronous api-first run over REST succeeds")
    void testRunOverRest() throws Exception {
        mockMvc.perform(post("/api/v1/workflows/{name}/runs", DevelopmentWorkflows.API_FIRST)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"argument\": \"orders and customers\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCEEDED"))
            .andExpect(jsonPath("$.exitCode").value(0))
            .andExpect(jsonPath("$.phases.length()").value(4));
    }

    @Test
    @DisplayName("Health reports registered workers")
    void testHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.orchestrator.details.workers").value(11));
    }
}
