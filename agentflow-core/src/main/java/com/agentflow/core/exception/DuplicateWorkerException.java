package com.agentflow.core.exception;

/**
 * Thrown when a worker is registered under an id that is already taken
 * and the caller did not ask for replacement.
 */
public class DuplicateWorkerException extends OrchestratorException {
    
    public static final String ERROR_CODE = "DUPLICATE_WORKER";
    
    public DuplicateWorkerException(String workerId) {
        super(ERROR_CODE, String.format(
            "Worker '%s' is already registered (use replace to overwrite)",
            workerId
        ));
    }
}
