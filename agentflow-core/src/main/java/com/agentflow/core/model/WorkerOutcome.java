package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recorded result of a single worker invocation within one phase iteration.
 *
 * Invariants:
 * - errorCode set iff status == FAILURE
 * - producedFields were written to the context bus under (phaseId, iteration, workerId)
 */
public record WorkerOutcome(
    String workerId,
    String phaseId,
    int iteration,
    OutcomeStatus status,
    Map<String, JsonNode> producedFields,
    Diagnostics diagnostics,
    String errorCode,
    String errorMessage,
    Instant startedAt,
    Instant completedAt
) {
    public static final String ERROR_CANCELLED = "CANCELLED";

    public WorkerOutcome {
        producedFields = producedFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(producedFields));
        diagnostics = diagnostics == null ? Diagnostics.empty() : diagnostics;
    }

    /**
     * Create a failed outcome carrying the error code and message.
     */
    public static WorkerOutcome failure(
            String workerId,
            String phaseId,
            int iteration,
            String errorCode,
            String errorMessage,
            Instant startedAt) {
        return new WorkerOutcome(
            workerId,
            phaseId,
            iteration,
            OutcomeStatus.FAILURE,
            Map.of(),
            Diagnostics.empty(),
            errorCode,
            errorMessage,
            startedAt,
            Instant.now()
        );
    }

    @JsonIgnore
    public boolean isFailure() {
        return status.isFailure();
    }

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
