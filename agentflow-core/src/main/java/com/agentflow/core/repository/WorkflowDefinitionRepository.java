package com.agentflow.core.repository;

import com.agentflow.core.model.WorkflowDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition storage.
 * Workflow definitions are immutable once stored.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a workflow definition, replacing any definition with the same name.
     * 
     * @param definition The workflow definition to store
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a workflow definition by name.
     * 
     * @param name The workflow name
     * @return The workflow definition if found
     */
    Optional<WorkflowDefinition> findByName(String name);

    /**
     * List all workflow definitions ordered by name.
     */
    List<WorkflowDefinition> findAll();

    /**
     * Check if a workflow definition exists.
     */
    boolean exists(String name);
}
