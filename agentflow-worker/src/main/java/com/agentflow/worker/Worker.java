package com.agentflow.worker;

/**
 * Interface for capability implementations.
 * Every worker exposes this single operation; specializations are selected by id or
 * capability tag, never by type.
 */
@FunctionalInterface
public interface Worker {
    
    /**
     * Invoke the capability.
     * 
     * @param context Context snapshot, declared inputs and utilities
     * @return The worker result
     * @throws WorkerException if the capability fails in a controlled way
     */
    WorkerResult invoke(WorkerContext context) throws WorkerException;
}
