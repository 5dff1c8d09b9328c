package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A worker selected by the trigger evaluator for one event.
 *
 * @param workerId  The selected worker
 * @param mode      Whether it fires directly or awaits confirmation
 * @param matchedBy Description of the predicate (or command) that selected it
 */
public record TriggerMatch(
    String workerId,
    TriggerMode mode,
    String matchedBy
) {
    @JsonIgnore
    public boolean isAutomatic() {
        return mode == TriggerMode.AUTOMATIC;
    }
}
