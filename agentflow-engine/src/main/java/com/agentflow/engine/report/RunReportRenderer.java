package com.agentflow.engine.report;

import com.agentflow.core.model.FinalResult;
import com.agentflow.core.model.FollowUp;
import com.agentflow.core.model.PhaseSummary;
import com.agentflow.core.model.RunFailure;
import com.agentflow.core.model.Severity;
import com.agentflow.core.model.WorkerOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;

/**
 * Renders a final result as the run report, in JSON or as plain text.
 */
public class RunReportRenderer {

    private final ObjectMapper objectMapper;

    public RunReportRenderer() {
        this(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public RunReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Build the report document.
     */
    public ObjectNode toJson(FinalResult result) {
        ObjectNode report = objectMapper.createObjectNode();
        report.put("runId", result.runId());
        report.put("workflow", result.workflowName());
        report.put("status", result.status().name());
        report.put("exitCode", result.exitCode());
        if (result.startedAt() != null) {
            report.put("startedAt", result.startedAt().toString());
        }
        if (result.completedAt() != null) {
            report.put("completedAt", result.completedAt().toString());
        }

        ObjectNode counts = report.putObject("severityCounts");
        for (Severity severity : Severity.counted()) {
            counts.put(severity.tag(), result.severityCounts().getOrDefault(severity, 0L));
        }

        ArrayNode phases = report.putArray("phases");
        for (PhaseSummary phase : result.phases()) {
            ObjectNode node = phases.addObject();
            node.put("phaseId", phase.phaseId());
            node.put("status", phase.status().name());
            node.put("iterations", phase.iterations());
            if (phase.failureReason() != null) {
                node.put("failureReason", phase.failureReason());
            }
            ArrayNode outcomes = node.putArray("outcomes");
            for (WorkerOutcome outcome : phase.outcomes()) {
                outcomes.add(objectMapper.valueToTree(outcome));
            }
            ArrayNode skipped = node.putArray("skippedWorkers");
            phase.skippedWorkers().forEach(skipped::add);
            node.set("diagnostics", objectMapper.valueToTree(phase.diagnostics()));
        }

        ArrayNode failures = report.putArray("failures");
        for (RunFailure failure : result.failures()) {
            failures.add(objectMapper.valueToTree(failure));
        }
        ArrayNode followUps = report.putArray("followUps");
        for (FollowUp followUp : result.followUps()) {
            followUps.add(objectMapper.valueToTree(followUp));
        }
        return report;
    }

    /**
     * Render the report as indented JSON text.
     */
    public String renderJson(FinalResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render report for run " + result.runId(), e);
        }
    }

    /**
     * Render a short human-readable summary.
     */
    public String renderText(FinalResult result) {
        StringBuilder out = new StringBuilder();
        out.append("Workflow ").append(result.workflowName())
            .append(" (run ").append(result.runId()).append("): ")
            .append(result.status()).append('\n');

        for (PhaseSummary phase : result.phases()) {
            out.append("  ").append(phase.phaseId()).append(": ").append(phase.status());
            if (phase.iterations() > 1) {
                out.append(" after ").append(phase.iterations()).append(" iterations");
            }
            if (phase.failureReason() != null) {
                out.append(" (").append(phase.failureReason()).append(')');
            }
            out.append('\n');
            for (WorkerOutcome outcome : phase.outcomes()) {
                out.append("    #").append(outcome.iteration()).append(' ')
                    .append(outcome.workerId()).append(' ').append(outcome.status());
                if (outcome.errorCode() != null) {
                    out.append(" [").append(outcome.errorCode()).append("] ").append(outcome.errorMessage());
                }
                out.append('\n');
            }
            if (!phase.skippedWorkers().isEmpty()) {
                out.append("    skipped: ").append(String.join(", ", phase.skippedWorkers())).append('\n');
            }
        }

        out.append("Findings:");
        for (Severity severity : Severity.counted()) {
            out.append(' ').append(severity.tag()).append('=')
                .append(result.severityCounts().getOrDefault(severity, 0L));
        }
        out.append('\n');

        for (RunFailure failure : result.failures()) {
            out.append("Failure: ").append(failure.phaseId());
            if (failure.workerId() != null) {
                out.append('/').append(failure.workerId());
            }
            out.append(" [").append(failure.errorCode()).append("] ").append(failure.message()).append('\n');
        }
        for (FollowUp followUp : result.followUps()) {
            out.append("Follow-up: ").append(followUp.workerId())
                .append(" after ").append(followUp.completedWorkerId())
                .append(" (").append(followUp.mode()).append(")\n");
        }
        out.append("Exit code: ").append(result.exitCode()).append('\n');
        return out.toString();
    }
}
