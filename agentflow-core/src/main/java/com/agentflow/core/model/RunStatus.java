package com.agentflow.core.model;

/**
 * Lifecycle states for a workflow run.
 * PENDING -> RUNNING -> {SUCCEEDED, PARTIALLY_FAILED, FAILED, CANCELLED}
 */
public enum RunStatus {
    /**
     * Run created, worker references resolved, nothing dispatched yet.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Phases are being executed.
     * Transitions: -> SUCCEEDED, PARTIALLY_FAILED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Every executed phase succeeded. Terminal state.
     */
    SUCCEEDED,

    /**
     * At least one phase exhausted its loop or lost an advisory worker. Terminal state.
     */
    PARTIALLY_FAILED,

    /**
     * A phase failed and the run was aborted. Terminal state.
     */
    FAILED,

    /**
     * Stopped by a cancellation signal or a declined approval gate. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == PARTIALLY_FAILED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(RunStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == SUCCEEDED || target == PARTIALLY_FAILED ||
                           target == FAILED || target == CANCELLED;
            case SUCCEEDED, PARTIALLY_FAILED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Exit code for command-line front ends: 0 succeeded, 1 failed or cancelled, 2 partially failed.
     *
     * @throws IllegalStateException if the status is not terminal
     */
    public int exitCode() {
        return switch (this) {
            case SUCCEEDED -> 0;
            case FAILED, CANCELLED -> 1;
            case PARTIALLY_FAILED -> 2;
            case PENDING, RUNNING -> throw new IllegalStateException("No exit code for non-terminal status " + this);
        };
    }
}
