package com.agentflow.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Execution record of one phase within a run, across all of its iterations.
 *
 * Invariants:
 * - outcomes are ordered by iteration, then by worker declaration order
 * - iterations equals the highest iteration id recorded
 */
public record PhaseRecord(
    String phaseId,
    PhaseStatus status,
    int iterations,
    List<WorkerOutcome> outcomes,
    List<String> skippedWorkers,
    Diagnostics lastIterationDiagnostics,
    String failureReason,
    Instant startedAt,
    Instant completedAt
) {
    public PhaseRecord {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        skippedWorkers = skippedWorkers == null ? List.of() : List.copyOf(skippedWorkers);
        lastIterationDiagnostics = lastIterationDiagnostics == null ? Diagnostics.empty() : lastIterationDiagnostics;
    }

    public static PhaseRecord pending(String phaseId) {
        return new PhaseRecord(phaseId, PhaseStatus.PENDING, 0, List.of(), List.of(),
            Diagnostics.empty(), null, null, null);
    }

    /**
     * Create a copy in RUNNING state.
     */
    public PhaseRecord start() {
        return new PhaseRecord(phaseId, PhaseStatus.RUNNING, iterations, outcomes, skippedWorkers,
            lastIterationDiagnostics, failureReason, startedAt != null ? startedAt : Instant.now(), null);
    }

    /**
     * Create a copy with one more iteration recorded.
     *
     * @param iterationOutcomes Outcomes of the iteration in declaration order
     * @param skipped Workers not dispatched in this iteration
     * @param diagnostics Merged diagnostics of the iteration
     */
    public PhaseRecord withIteration(
            int iteration,
            List<WorkerOutcome> iterationOutcomes,
            List<String> skipped,
            Diagnostics diagnostics) {
        List<WorkerOutcome> all = new ArrayList<>(outcomes);
        all.addAll(iterationOutcomes);
        return new PhaseRecord(phaseId, status, iteration, all, skipped, diagnostics,
            failureReason, startedAt, completedAt);
    }

    /**
     * Create a copy in a terminal state.
     */
    public PhaseRecord complete(PhaseStatus terminalStatus, String reason) {
        return new PhaseRecord(phaseId, terminalStatus, iterations, outcomes, skippedWorkers,
            lastIterationDiagnostics, reason, startedAt, Instant.now());
    }

    public PhaseRecord skip(String reason) {
        return complete(PhaseStatus.SKIPPED, reason);
    }

    /**
     * Outcomes of a single iteration.
     */
    public List<WorkerOutcome> outcomesOf(int iteration) {
        return outcomes.stream().filter(o -> o.iteration() == iteration).toList();
    }

    /**
     * All diagnostics of the phase, concatenated over every iteration.
     */
    public Diagnostics diagnostics() {
        return Diagnostics.mergeAll(outcomes.stream().map(WorkerOutcome::diagnostics).toList());
    }
}
