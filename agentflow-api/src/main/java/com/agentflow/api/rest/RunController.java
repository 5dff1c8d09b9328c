package com.agentflow.api.rest;

import com.agentflow.core.model.FollowUp;
import com.agentflow.core.model.PhaseRecord;
import com.agentflow.core.model.PhaseStatus;
import com.agentflow.core.model.RunFailure;
import com.agentflow.core.model.RunOptions;
import com.agentflow.core.model.RunStatus;
import com.agentflow.core.model.WorkflowRun;
import com.agentflow.engine.report.RunReportRenderer;
import com.agentflow.engine.service.WorkflowService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for inspecting and steering runs.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final WorkflowService workflowService;
    private final RunReportRenderer reportRenderer;

    public RunController(WorkflowService workflowService, RunReportRenderer reportRenderer) {
        this.workflowService = workflowService;
        this.reportRenderer = reportRenderer;
    }

    /**
     * Query runs, most recent first.
     */
    @GetMapping
    public ResponseEntity<List<RunResponse>> listRuns(
            @RequestParam(required = false) String workflow,
            @RequestParam(required = false) RunStatus status,
            @RequestParam(defaultValue = "50") int limit) {

        List<RunResponse> responses = workflowService.listRuns(workflow, status, limit).stream()
            .map(RunResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Get the current state of a run.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(RunResponse.from(workflowService.getRun(runId)));
    }

    /**
     * Get the report of a finished run.
     */
    @GetMapping("/{runId}/report")
    public ResponseEntity<ObjectNode> getReport(@PathVariable String runId) {
        return ResponseEntity.ok(reportRenderer.toJson(workflowService.getResult(runId)));
    }

    /**
     * Cancel an executing run.
     */
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelRun(
            @PathVariable String runId,
            @RequestBody(required = false) CancelRequest request) {

        String reason = request != null ? request.reason() : "cancelled through the API";
        boolean cancelled = workflowService.cancelRun(runId, reason);

        return ResponseEntity.ok(Map.of(
            "runId", runId,
            "cancelled", cancelled
        ));
    }

    /**
     * Approve the gate after a phase of an interactive run.
     */
    @PostMapping("/{runId}/phases/{phaseId}/approve")
    public ResponseEntity<Map<String, Object>> approvePhase(
            @PathVariable String runId,
            @PathVariable String phaseId) {
        return decide(runId, phaseId, true);
    }

    /**
     * Decline the gate after a phase of an interactive run. The run ends cancelled.
     */
    @PostMapping("/{runId}/phases/{phaseId}/reject")
    public ResponseEntity<Map<String, Object>> rejectPhase(
            @PathVariable String runId,
            @PathVariable String phaseId) {
        return decide(runId, phaseId, false);
    }

    private ResponseEntity<Map<String, Object>> decide(String runId, String phaseId, boolean approved) {
        workflowService.decideApproval(runId, phaseId, approved);
        return ResponseEntity.ok(Map.of(
            "runId", runId,
            "phaseId", phaseId,
            "approved", approved
        ));
    }

    // ========== DTOs ==========

    public record CancelRequest(String reason) {}

    public record RunResponse(
        String runId,
        String workflowName,
        String argument,
        RunOptions options,
        RunStatus status,
        List<PhaseStateResponse> phases,
        List<RunFailure> failures,
        List<FollowUp> followUps,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Integer exitCode
    ) {
        public static RunResponse from(WorkflowRun run) {
            return new RunResponse(
                run.runId(),
                run.workflowName(),
                run.argument(),
                run.options(),
                run.status(),
                run.phases().values().stream().map(PhaseStateResponse::from).toList(),
                run.failures(),
                run.followUps(),
                run.createdAt(),
                run.startedAt(),
                run.completedAt(),
                run.isTerminal() ? run.status().exitCode() : null
            );
        }
    }

    public record PhaseStateResponse(
        String phaseId,
        PhaseStatus status,
        int iterations,
        int outcomes,
        List<String> skippedWorkers,
        String failureReason,
        Instant startedAt,
        Instant completedAt
    ) {
        public static PhaseStateResponse from(PhaseRecord phase) {
            return new PhaseStateResponse(
                phase.phaseId(),
                phase.status(),
                phase.iterations(),
                phase.outcomes().size(),
                phase.skippedWorkers(),
                phase.failureReason(),
                phase.startedAt(),
                phase.completedAt()
            );
        }
    }
}
