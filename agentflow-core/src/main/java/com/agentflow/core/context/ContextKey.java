package com.agentflow.core.context;

import java.util.Objects;

/**
 * Address of one context bus slot. Re-running a phase uses a new iteration id,
 * so loop iterations never collide with earlier writes.
 */
public record ContextKey(
    String phaseId,
    int iteration,
    String workerId,
    String field
) {
    public ContextKey {
        Objects.requireNonNull(phaseId, "phaseId");
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(field, "field");
        if (iteration < 1) {
            throw new IllegalArgumentException("iteration must be >= 1, was " + iteration);
        }
    }

    @Override
    public String toString() {
        return phaseId + "#" + iteration + "/" + workerId + "/" + field;
    }
}
