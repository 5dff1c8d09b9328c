package com.agentflow.core.repository;

import com.agentflow.core.model.WorkerDescriptor;
import java.util.List;

/**
 * Registry of worker descriptors.
 * Populated at process start; descriptors are immutable once registered.
 */
public interface WorkerRegistry {

    /**
     * Register a new worker.
     * 
     * @param descriptor The worker descriptor
     * @throws com.agentflow.core.exception.DuplicateWorkerException if the id is already registered
     */
    default void register(WorkerDescriptor descriptor) {
        register(descriptor, false);
    }

    /**
     * Register a worker, optionally replacing an existing one with the same id.
     * A replaced worker keeps its original registration position.
     * 
     * @param descriptor The worker descriptor
     * @param replace Replace an existing registration instead of failing
     * @throws com.agentflow.core.exception.DuplicateWorkerException if the id exists and replace is false
     */
    void register(WorkerDescriptor descriptor, boolean replace);

    /**
     * Look up a worker by id.
     * 
     * @param workerId The worker id
     * @return The descriptor
     * @throws com.agentflow.core.exception.UnknownWorkerException if no worker has this id
     */
    WorkerDescriptor lookup(String workerId);

    /**
     * Find workers carrying a capability tag.
     * 
     * @param tag The capability tag
     * @return Matching descriptors in registration order; empty if none
     */
    List<WorkerDescriptor> findByCapability(String tag);

    /**
     * List all workers in registration order.
     */
    List<WorkerDescriptor> findAll();

    /**
     * Check if a worker is registered.
     */
    boolean contains(String workerId);
}
