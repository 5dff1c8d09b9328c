package com.agentflow.core.exception;

/**
 * Thrown when a worker id or capability reference cannot be resolved against the registry.
 */
public class UnknownWorkerException extends OrchestratorException {
    
    public static final String ERROR_CODE = "UNKNOWN_WORKER";
    
    private final String workerId;
    
    public UnknownWorkerException(String workerId) {
        super(ERROR_CODE, String.format("Unknown worker: %s", workerId));
        this.workerId = workerId;
    }
    
    public UnknownWorkerException(String reference, String reason) {
        super(ERROR_CODE, String.format("Cannot resolve worker reference '%s': %s", reference, reason));
        this.workerId = reference;
    }
    
    public String getWorkerId() {
        return workerId;
    }
}
