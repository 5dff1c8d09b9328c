package com.agentflow.engine.approval;

import com.agentflow.core.model.WorkflowRun;

/**
 * Decision point inserted after each phase of an interactive run.
 * A declined gate cancels the run.
 */
public interface ApprovalGate {

    /**
     * Block until the phase is approved or declined.
     *
     * @param run The run, with the completed phase recorded
     * @param phaseId The phase that just completed
     * @return true to continue with the next phase
     */
    boolean awaitApproval(WorkflowRun run, String phaseId);

    /**
     * Record an external decision for a pending gate.
     *
     * @return true if a gate was waiting for this decision
     */
    default boolean decide(String runId, String phaseId, boolean approved) {
        return false;
    }

    /**
     * Release any gate a run is waiting on, as a decline.
     * Gates the run reaches afterwards decline immediately.
     */
    default void release(String runId) {
    }

    /**
     * Drop what the gate keeps for a finished run.
     */
    default void forget(String runId) {
    }
}
