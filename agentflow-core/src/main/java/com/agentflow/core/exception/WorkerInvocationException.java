package com.agentflow.core.exception;

/**
 * Wraps any failure surfaced by an external capability while it was invoked.
 */
public class WorkerInvocationException extends OrchestratorException {
    
    public static final String ERROR_CODE = "WORKER_INVOCATION_FAILED";
    
    private final String workerId;
    
    public WorkerInvocationException(String workerId, String message) {
        super(ERROR_CODE, String.format("Worker '%s' failed: %s", workerId, message));
        this.workerId = workerId;
    }
    
    public WorkerInvocationException(String workerId, String message, Throwable cause) {
        super(ERROR_CODE, String.format("Worker '%s' failed: %s", workerId, message), cause);
        this.workerId = workerId;
    }
    
    public String getWorkerId() {
        return workerId;
    }
}
