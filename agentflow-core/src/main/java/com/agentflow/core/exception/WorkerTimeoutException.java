package com.agentflow.core.exception;

import java.time.Duration;

/**
 * Raised when a worker invocation exceeds its deadline.
 * The orchestrator records it as a FAILURE outcome rather than propagating it.
 */
public class WorkerTimeoutException extends OrchestratorException {
    
    public static final String ERROR_CODE = "TIMEOUT";
    
    public WorkerTimeoutException(String workerId, Duration timeout) {
        super(ERROR_CODE, String.format(
            "Worker '%s' did not complete within %d ms",
            workerId, timeout.toMillis()
        ));
    }
}
