package com.agentflow.core.model;

/**
 * Which phase/worker failed and why. Every failure of a run is listed in its report.
 *
 * @param workerId null when the failure belongs to the phase or run rather than one worker
 */
public record RunFailure(
    String phaseId,
    String workerId,
    int iteration,
    String errorCode,
    String message
) {
    public static RunFailure of(WorkerOutcome outcome) {
        return new RunFailure(
            outcome.phaseId(),
            outcome.workerId(),
            outcome.iteration(),
            outcome.errorCode(),
            outcome.errorMessage()
        );
    }
}
