package com.agentflow.core.model;

import java.util.List;

/**
 * Per-phase section of a final result.
 */
public record PhaseSummary(
    String phaseId,
    PhaseStatus status,
    int iterations,
    List<WorkerOutcome> outcomes,
    List<String> skippedWorkers,
    Diagnostics diagnostics,
    String failureReason
) {
    public PhaseSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        skippedWorkers = skippedWorkers == null ? List.of() : List.copyOf(skippedWorkers);
    }

    public static PhaseSummary of(PhaseRecord record) {
        return new PhaseSummary(
            record.phaseId(),
            record.status(),
            record.iterations(),
            record.outcomes(),
            record.skippedWorkers(),
            record.diagnostics(),
            record.failureReason()
        );
    }
}
