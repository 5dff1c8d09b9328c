package com.agentflow.core.model;

/**
 * A worker selected by the trigger evaluator in reaction to a worker completing inside a run.
 * Follow-ups are reported, never dispatched within the same run.
 */
public record FollowUp(
    String phaseId,
    int iteration,
    String completedWorkerId,
    String workerId,
    TriggerMode mode,
    String matchedBy
) {
}
