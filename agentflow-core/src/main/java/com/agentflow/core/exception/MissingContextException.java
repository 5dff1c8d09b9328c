package com.agentflow.core.exception;

/**
 * Thrown when a worker reads a context field that nothing has written
 * and its input contract declares no default.
 */
public class MissingContextException extends OrchestratorException {
    
    public static final String ERROR_CODE = "MISSING_CONTEXT";
    
    private final String field;
    
    public MissingContextException(String field) {
        super(ERROR_CODE, String.format("No value written for context field '%s'", field));
        this.field = field;
    }
    
    public MissingContextException(String field, String workerId) {
        super(ERROR_CODE, String.format(
            "Worker '%s' requires context field '%s' but nothing has written it",
            workerId, field
        ));
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
