package com.agentflow.core.exception;

import com.agentflow.core.model.RunStatus;

/**
 * Thrown when a result is requested for a run that has not finished.
 */
public class RunNotTerminalException extends OrchestratorException {
    
    public static final String ERROR_CODE = "RUN_NOT_TERMINAL";
    
    public RunNotTerminalException(String runId, RunStatus status) {
        super(ERROR_CODE, String.format(
            "Run %s is still %s; results are only available for terminal runs",
            runId, status
        ));
    }
}
