package com.agentflow.api.rest;

import com.agentflow.core.model.Focus;
import com.agentflow.core.model.FinalResult;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.RunOptions;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.core.model.WorkflowRun;
import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.engine.definition.CatalogLoader;
import com.agentflow.engine.definition.WorkflowCatalog;
import com.agentflow.engine.report.RunReportRenderer;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.engine.service.WorkflowService.StartRunRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for workflow definitions and invocations.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    static final String CATALOG_SOURCE = "request";

    private final WorkflowService workflowService;
    private final WorkerRegistry workerRegistry;
    private final CatalogLoader catalogLoader;
    private final RunReportRenderer reportRenderer;

    public WorkflowController(
            WorkflowService workflowService,
            WorkerRegistry workerRegistry,
            CatalogLoader catalogLoader,
            RunReportRenderer reportRenderer) {
        this.workflowService = workflowService;
        this.workerRegistry = workerRegistry;
        this.catalogLoader = catalogLoader;
        this.reportRenderer = reportRenderer;
    }

    /**
     * List registered workflows.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowSummary>> listWorkflows() {
        List<WorkflowSummary> summaries = workflowService.listWorkflows().stream()
            .map(WorkflowSummary::from)
            .toList();
        return ResponseEntity.ok(summaries);
    }

    /**
     * Get a workflow definition by name.
     */
    @GetMapping("/{name}")
    public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable String name) {
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.getWorkflow(name)));
    }

    /**
     * Register the workers and workflows of a catalog document (YAML or JSON).
     * Workers are registered first so the workflows can reference them.
     */
    @PostMapping(consumes = {"application/yaml", "application/x-yaml", "text/yaml", "application/json", "text/plain"})
    public ResponseEntity<CatalogResponse> registerCatalog(@RequestBody String document) {
        WorkflowCatalog catalog = catalogLoader.load(
            new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8)), CATALOG_SOURCE);

        for (WorkerDescriptor worker : catalog.workers()) {
            workerRegistry.register(worker, true);
        }
        List<String> workflows = catalog.workflows().stream()
            .map(workflowService::registerWorkflow)
            .map(WorkflowDefinition::name)
            .toList();

        return ResponseEntity.status(HttpStatus.CREATED).body(new CatalogResponse(
            catalog.workers().stream().map(WorkerDescriptor::id).toList(),
            workflows
        ));
    }

    /**
     * Invoke a workflow.
     * Synchronous invocations answer with the run report; asynchronous ones with the run id.
     */
    @PostMapping("/{name}/runs")
    public ResponseEntity<?> runWorkflow(
            @PathVariable String name,
            @RequestBody(required = false) RunRequestDto request) {

        RunRequestDto body = request != null ? request : RunRequestDto.EMPTY;
        StartRunRequest startRequest = new StartRunRequest(name, body.argument(), body.toOptions());

        if (body.isAsync()) {
            WorkflowRun run = workflowService.startRun(startRequest);
            return ResponseEntity.accepted()
                .location(URI.create("/api/v1/runs/" + run.runId()))
                .body(new RunAcceptedResponse(run.runId(), run.workflowName(), run.status().name()));
        }

        FinalResult result = workflowService.runWorkflow(startRequest);
        return ResponseEntity.ok(reportRenderer.toJson(result));
    }

    // ========== DTOs ==========

    public record RunRequestDto(
        String argument,
        Focus focus,
        Boolean interactive,
        Integer maxIterations,
        Duration workerTimeout,
        Boolean async
    ) {
        static final RunRequestDto EMPTY = new RunRequestDto(null, null, null, null, null, null);

        RunOptions toOptions() {
            return new RunOptions(focus, Boolean.TRUE.equals(interactive), maxIterations, workerTimeout);
        }

        boolean isAsync() {
            // Interactive runs block on their approval gates, so they always run in the background
            return Boolean.TRUE.equals(async) || Boolean.TRUE.equals(interactive);
        }
    }

    public record RunAcceptedResponse(
        String runId,
        String workflowName,
        String status
    ) {}

    public record CatalogResponse(
        List<String> workers,
        List<String> workflows
    ) {}

    public record WorkflowSummary(
        String name,
        String description,
        List<String> phases,
        Map<String, String> labels
    ) {
        public static WorkflowSummary from(WorkflowDefinition definition) {
            return new WorkflowSummary(
                definition.name(),
                definition.description(),
                definition.phaseIds(),
                definition.labels()
            );
        }
    }

    public record WorkflowResponse(
        String name,
        String description,
        List<PhaseResponse> phases,
        Map<String, String> labels,
        Instant createdAt
    ) {
        public static WorkflowResponse from(WorkflowDefinition definition) {
            return new WorkflowResponse(
                definition.name(),
                definition.description(),
                definition.phases().stream()
                    .map(phase -> PhaseResponse.from(phase, definition.dependenciesOf(phase.phaseId())))
                    .toList(),
                definition.labels(),
                definition.createdAt()
            );
        }
    }

    public record PhaseResponse(
        String id,
        String description,
        List<String> workers,
        boolean parallel,
        String loopUntil,
        int maxIterations,
        List<String> dependsOn
    ) {
        public static PhaseResponse from(PhaseDefinition phase, List<String> dependsOn) {
            return new PhaseResponse(
                phase.phaseId(),
                phase.description(),
                phase.workers(),
                phase.parallel(),
                phase.loopUntil() != null ? phase.loopUntil().describe() : null,
                phase.maxIterations(),
                dependsOn
            );
        }
    }
}
