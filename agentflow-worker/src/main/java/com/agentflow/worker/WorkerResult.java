package com.agentflow.worker;

import com.agentflow.core.model.Diagnostics;
import com.agentflow.core.model.OutcomeStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a worker hands back: a status, the fields to publish on the context bus
 * and its diagnostics. Also the JSON reply shape of remote workers.
 */
public record WorkerResult(
    OutcomeStatus status,
    Map<String, JsonNode> producedFields,
    Diagnostics diagnostics,
    String errorCode,
    String errorMessage
) {
    public WorkerResult {
        if (status == null) {
            throw new IllegalArgumentException("Worker result status is required");
        }
        producedFields = producedFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(producedFields));
        diagnostics = diagnostics == null ? Diagnostics.empty() : diagnostics;
    }

    public static Builder success() {
        return new Builder(OutcomeStatus.SUCCESS);
    }

    public static Builder needsFollowUp() {
        return new Builder(OutcomeStatus.NEEDS_FOLLOW_UP);
    }

    public static Builder failure(String errorCode, String errorMessage) {
        Builder builder = new Builder(OutcomeStatus.FAILURE);
        builder.errorCode = errorCode;
        builder.errorMessage = errorMessage;
        return builder;
    }

    public static class Builder {
        private final OutcomeStatus status;
        private final Map<String, JsonNode> producedFields = new LinkedHashMap<>();
        private Diagnostics diagnostics = Diagnostics.empty();
        private String errorCode;
        private String errorMessage;

        private Builder(OutcomeStatus status) {
            this.status = status;
        }

        public Builder field(String name, JsonNode value) {
            producedFields.put(name, value);
            return this;
        }

        public Builder field(String name, String value) {
            return field(name, TextNode.valueOf(value));
        }

        public Builder diagnostics(Diagnostics diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public WorkerResult build() {
            return new WorkerResult(status, producedFields, diagnostics, errorCode, errorMessage);
        }
    }
}
