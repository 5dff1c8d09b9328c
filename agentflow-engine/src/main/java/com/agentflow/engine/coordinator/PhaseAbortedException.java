package com.agentflow.engine.coordinator;

import com.agentflow.core.exception.OrchestratorException;
import com.agentflow.core.model.WorkerOutcome;

import java.util.List;

/**
 * A context contract violation stopped a phase iteration.
 * Carries the outcomes that completed before the violation so they stay on record.
 */
public class PhaseAbortedException extends RuntimeException {

    private final String workerId;
    private final OrchestratorException violation;
    private final List<WorkerOutcome> completedOutcomes;

    public PhaseAbortedException(String workerId, OrchestratorException violation, List<WorkerOutcome> completedOutcomes) {
        super(violation.getMessage(), violation);
        this.workerId = workerId;
        this.violation = violation;
        this.completedOutcomes = List.copyOf(completedOutcomes);
    }

    public String getWorkerId() {
        return workerId;
    }

    public OrchestratorException getViolation() {
        return violation;
    }

    public String getErrorCode() {
        return violation.getErrorCode();
    }

    public List<WorkerOutcome> getCompletedOutcomes() {
        return completedOutcomes;
    }
}
