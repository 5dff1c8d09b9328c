package com.agentflow.core.model;

/**
 * Kinds of events the trigger evaluator reacts to.
 */
public enum EventKind {
    /**
     * A file was created or modified. Payload carries {@code path}.
     */
    FILE_CHANGED,

    /**
     * An error was observed (build failure, stack trace, failing test).
     * Payload carries {@code message}.
     */
    ERROR_OBSERVED,

    /**
     * A user explicitly asked for a worker by id.
     * Payload carries {@code workerId} and an optional {@code argument}.
     */
    EXPLICIT_COMMAND,

    /**
     * Emitted by the orchestrator each time a worker finishes inside a run.
     * Payload carries {@code runId}, {@code phaseId}, {@code workerId} and {@code status}.
     */
    WORKER_COMPLETED
}
