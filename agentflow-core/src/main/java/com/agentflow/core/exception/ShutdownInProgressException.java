package com.agentflow.core.exception;

/**
 * Thrown when a run is submitted while the engine drains for shutdown.
 */
public class ShutdownInProgressException extends OrchestratorException {
    
    public static final String ERROR_CODE = "SHUTTING_DOWN";
    
    public ShutdownInProgressException(String runId) {
        super(ERROR_CODE, String.format("Cannot accept run %s: engine is shutting down", runId));
    }
}
