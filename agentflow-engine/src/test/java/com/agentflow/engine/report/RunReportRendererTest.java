package com.agentflow.engine.report;

import com.agentflow.core.model.FinalResult;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.RunOptions;
import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.engine.test.EngineHarness;
import com.agentflow.engine.test.ScriptedWorker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RunReportRendererTest {

    private final RunReportRenderer renderer = new RunReportRenderer();
    private EngineHarness harness;
    private FinalResult result;

    @BeforeEach
    void setUp() {
        harness = EngineHarness.create();
        harness.register("code-reviewer", ScriptedWorker.returning(ctx -> ScriptedWorker.withCritical(1)))
            .register("security-auditor", ScriptedWorker.failing("AUDIT_CRASHED"))
            .register("documentation-writer", ScriptedWorker.succeeding());

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("quality-sprint")
            .phase(PhaseDefinition.builder("review")
                .workers("code-reviewer", "security-auditor").parallel(true).build())
            .phase(PhaseDefinition.builder("document").workers("documentation-writer").build())
            .build();
        result = harness.orchestrator().runWorkflow(definition, "src/", RunOptions.defaults());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        harness.close();
    }

    @Test
    void toJson_shouldCarryStatusCountsAndPhases() {
        JsonNode report = renderer.toJson(result);

        assertThat(report.get("workflow").asText()).isEqualTo("quality-sprint");
        assertThat(report.get("status").asText()).isEqualTo("FAILED");
        assertThat(report.get("exitCode").asInt()).isEqualTo(1);
        assertThat(report.get("severityCounts").get("critical").asLong()).isEqualTo(1);
        assertThat(report.get("severityCounts").get("low").asLong()).isZero();

        JsonNode phases = report.get("phases");
        assertThat(phases).hasSize(2);
        assertThat(phases.get(0).get("outcomes").get(0).get("workerId").asText()).isEqualTo("code-reviewer");
        assertThat(phases.get(0).get("outcomes").get(1).get("errorCode").asText()).isEqualTo("AUDIT_CRASHED");
        assertThat(phases.get(1).get("status").asText()).isEqualTo("SKIPPED");
        assertThat(report.get("failures").get(0).get("workerId").asText()).isEqualTo("security-auditor");
    }

    @Test
    void renderJson_shouldProduceParseableDocument() throws Exception {
        String json = renderer.renderJson(result);

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.get("runId").asText()).isEqualTo(result.runId());
        assertThat(parsed.get("completedAt").isTextual()).isTrue();
    }

    @Test
    void renderText_shouldSummarizeRun() {
        String text = renderer.renderText(result);

        assertThat(text)
            .contains("Workflow quality-sprint")
            .contains("review: FAILED")
            .contains("security-auditor FAILURE [AUDIT_CRASHED]")
            .contains("Findings: critical=1 high=0 medium=0 low=0")
            .endsWith("Exit code: 1\n");
    }
}
