package com.agentflow.core.model;

/**
 * Per-phase status within a workflow run.
 */
public enum PhaseStatus {
    /**
     * Waiting for dependencies.
     */
    PENDING,

    /**
     * Workers of the current iteration are being dispatched.
     */
    RUNNING,

    /**
     * All dispatched workers succeeded and the loop condition (if any) was satisfied.
     */
    SUCCEEDED,

    /**
     * Loop cap reached with the condition unsatisfied, or only advisory workers failed.
     */
    PARTIALLY_FAILED,

    /**
     * A critical worker failed. Aborts the run.
     */
    FAILED,

    /**
     * Never executed: the run aborted first, or the focus filter left no workers.
     */
    SKIPPED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /**
     * Check if successor phases may start once this phase has ended.
     */
    public boolean satisfiesDependency() {
        return this == SUCCEEDED || this == PARTIALLY_FAILED || this == SKIPPED;
    }
}
