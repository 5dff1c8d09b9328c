package com.agentflow.core.exception;

import com.agentflow.core.context.ContextKey;

/**
 * Thrown when a context bus key is written twice.
 * Signals a workflow definition bug: two workers claim the same output slot.
 */
public class KeyCollisionException extends OrchestratorException {
    
    public static final String ERROR_CODE = "KEY_COLLISION";
    
    private final ContextKey key;
    
    public KeyCollisionException(ContextKey key) {
        super(ERROR_CODE, String.format("Context key already written: %s", key));
        this.key = key;
    }
    
    public ContextKey getKey() {
        return key;
    }
}
