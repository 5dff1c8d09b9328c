package com.agentflow.engine.definition;

import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.model.WorkflowDefinition;

import java.util.List;

/**
 * Worker descriptors and workflow definitions read from one catalog document.
 *
 * @param source Where the catalog was read from, for log and error messages
 */
public record WorkflowCatalog(
    String source,
    List<WorkerDescriptor> workers,
    List<WorkflowDefinition> workflows
) {
    public WorkflowCatalog {
        workers = workers == null ? List.of() : List.copyOf(workers);
        workflows = workflows == null ? List.of() : List.copyOf(workflows);
    }
}
