package com.agentflow.engine.persistence;

import com.agentflow.core.exception.DuplicateWorkerException;
import com.agentflow.core.exception.UnknownWorkerException;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.repository.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of WorkerRegistry.
 * Keeps registration order, which drives trigger evaluation and capability fallback.
 */
@Repository
public class InMemoryWorkerRegistry implements WorkerRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkerRegistry.class);
    
    // Guarded by this; LinkedHashMap keeps the original position when a key is replaced
    private final Map<String, WorkerDescriptor> workers = new LinkedHashMap<>();
    
    @Override
    public synchronized void register(WorkerDescriptor descriptor, boolean replace) {
        WorkerDescriptor existing = workers.get(descriptor.id());
        if (existing != null && !replace) {
            throw new DuplicateWorkerException(descriptor.id());
        }
        workers.put(descriptor.id(), descriptor);
        if (existing != null) {
            log.info("Replaced worker {}", descriptor.id());
        } else {
            log.info("Registered worker {} with capabilities {}", descriptor.id(), descriptor.capabilities());
        }
    }
    
    @Override
    public synchronized WorkerDescriptor lookup(String workerId) {
        WorkerDescriptor descriptor = workers.get(workerId);
        if (descriptor == null) {
            throw new UnknownWorkerException(workerId);
        }
        return descriptor;
    }
    
    @Override
    public synchronized List<WorkerDescriptor> findByCapability(String tag) {
        return workers.values().stream()
            .filter(w -> w.hasCapability(tag))
            .toList();
    }
    
    @Override
    public synchronized List<WorkerDescriptor> findAll() {
        return new ArrayList<>(workers.values());
    }
    
    @Override
    public synchronized boolean contains(String workerId) {
        return workers.containsKey(workerId);
    }
}
