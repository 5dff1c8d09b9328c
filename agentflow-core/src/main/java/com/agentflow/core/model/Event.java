package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Something observed by the system that may cause workers to fire.
 * Transient: events are evaluated and dropped, never persisted beyond a run.
 */
public record Event(
    UUID eventId,
    EventKind kind,
    JsonNode payload,
    Instant occurredAt,
    String source
) {
    public static final String FIELD_PATH = "path";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_WORKER_ID = "workerId";
    public static final String FIELD_ARGUMENT = "argument";
    public static final String FIELD_RUN_ID = "runId";
    public static final String FIELD_PHASE_ID = "phaseId";
    public static final String FIELD_ITERATION = "iteration";
    public static final String FIELD_STATUS = "status";

    public static final String SOURCE_EXTERNAL = "external";
    public static final String SOURCE_ORCHESTRATOR = "orchestrator";

    public Event {
        if (kind == null) {
            throw new IllegalArgumentException("Event kind is required");
        }
        if (payload == null) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Create a new event with a generated id.
     */
    public static Event of(EventKind kind, JsonNode payload, String source) {
        return new Event(UUID.randomUUID(), kind, payload, Instant.now(), source);
    }

    public static Event fileChanged(String path) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put(FIELD_PATH, path);
        return of(EventKind.FILE_CHANGED, payload, SOURCE_EXTERNAL);
    }

    public static Event errorObserved(String message) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put(FIELD_MESSAGE, message);
        return of(EventKind.ERROR_OBSERVED, payload, SOURCE_EXTERNAL);
    }

    public static Event explicitCommand(String workerId, String argument) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put(FIELD_WORKER_ID, workerId);
        if (argument != null) {
            payload.put(FIELD_ARGUMENT, argument);
        }
        return of(EventKind.EXPLICIT_COMMAND, payload, SOURCE_EXTERNAL);
    }

    /**
     * Event re-entering the trigger evaluator after a worker finished inside a run.
     */
    public static Event workerCompleted(WorkerOutcome outcome, String runId) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put(FIELD_RUN_ID, runId);
        payload.put(FIELD_PHASE_ID, outcome.phaseId());
        payload.put(FIELD_ITERATION, outcome.iteration());
        payload.put(FIELD_WORKER_ID, outcome.workerId());
        payload.put(FIELD_STATUS, outcome.status().name());
        for (Severity severity : Severity.counted()) {
            payload.put(severity.countKey(), outcome.diagnostics().count(severity.countKey()));
        }
        return of(EventKind.WORKER_COMPLETED, payload, SOURCE_ORCHESTRATOR);
    }

    /**
     * Get a payload field as text. Accepts a plain field name or a JSON pointer ("/a/b").
     *
     * @return The field text, or null if absent
     */
    public String payloadField(String name) {
        JsonNode node = name.startsWith("/") ? payload.at(name) : payload.get(name);
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    /**
     * The whole payload rendered as text, used when a predicate names no field.
     */
    public String payloadText() {
        return payload.isValueNode() ? payload.asText() : payload.toString();
    }
}
