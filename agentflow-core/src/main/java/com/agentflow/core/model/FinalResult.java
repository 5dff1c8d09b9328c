package com.agentflow.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a terminal run.
 * Per-phase summaries follow workflow declaration order; outcomes within a phase follow
 * worker declaration order, independent of completion timing.
 */
public record FinalResult(
    String runId,
    String workflowName,
    RunStatus status,
    List<PhaseSummary> phases,
    Diagnostics mergedDiagnostics,
    Map<Severity, Long> severityCounts,
    List<RunFailure> failures,
    List<FollowUp> followUps,
    Instant startedAt,
    Instant completedAt,
    int exitCode
) {
    public FinalResult {
        phases = phases == null ? List.of() : List.copyOf(phases);
        severityCounts = severityCounts == null || severityCounts.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(severityCounts));
        failures = failures == null ? List.of() : List.copyOf(failures);
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
    }

    public PhaseSummary getPhase(String phaseId) {
        return phases.stream()
            .filter(p -> p.phaseId().equals(phaseId))
            .findFirst()
            .orElse(null);
    }
}
