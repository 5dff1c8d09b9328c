package com.agentflow.core.model;

/**
 * How a matched trigger predicate selects its worker.
 */
public enum TriggerMode {
    /**
     * Fire the worker without asking.
     */
    AUTOMATIC,

    /**
     * Propose the worker; a user has to confirm before it runs.
     */
    CONFIRM
}
