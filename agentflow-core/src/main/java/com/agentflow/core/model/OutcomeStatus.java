package com.agentflow.core.model;

/**
 * Result status of one worker invocation.
 */
public enum OutcomeStatus {
    SUCCESS,
    FAILURE,

    /**
     * Completed, but the worker asks for further work (e.g. issues remain open).
     */
    NEEDS_FOLLOW_UP;

    public boolean isFailure() {
        return this == FAILURE;
    }
}
