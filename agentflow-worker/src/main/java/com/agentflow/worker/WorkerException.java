package com.agentflow.worker;

import com.agentflow.core.model.Diagnostics;

/**
 * Exception thrown by workers on a controlled failure.
 * Recorded as a FAILURE outcome; never crashes the orchestrator.
 */
public class WorkerException extends Exception {
    
    public static final String DEFAULT_ERROR_CODE = "WORKER_FAILED";
    
    private final String errorCode;
    private final Diagnostics diagnostics;
    
    public WorkerException(String errorCode, String message) {
        this(errorCode, message, Diagnostics.empty());
    }
    
    public WorkerException(String errorCode, String message, Diagnostics diagnostics) {
        super(message);
        this.errorCode = errorCode;
        this.diagnostics = diagnostics;
    }
    
    public WorkerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.diagnostics = Diagnostics.empty();
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    /**
     * Findings gathered before the failure, kept in the outcome.
     */
    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
    
    public static WorkerException failed(String message) {
        return new WorkerException(DEFAULT_ERROR_CODE, message);
    }
}
