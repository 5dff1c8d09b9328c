package com.agentflow.core.repository;

import com.agentflow.core.model.RunStatus;
import com.agentflow.core.model.WorkflowRun;
import java.util.List;
import java.util.Optional;

/**
 * Repository for active and archived workflow runs.
 */
public interface WorkflowRunRepository {

    /**
     * Save or replace a run snapshot.
     * A snapshot older than the stored one (lower sequence number) is ignored.
     * 
     * @param run The run to save
     */
    void save(WorkflowRun run);

    /**
     * Find a run by id.
     * 
     * @param runId The run id
     * @return The run if found
     */
    Optional<WorkflowRun> findById(String runId);

    /**
     * Find runs by status, most recently created first.
     * 
     * @param status The run status
     * @param limit Maximum number of results
     * @return Runs in the given status
     */
    List<WorkflowRun> findByStatus(RunStatus status, int limit);

    /**
     * Find runs of one workflow, most recently created first.
     */
    List<WorkflowRun> findByWorkflow(String workflowName, int limit);

    /**
     * Count runs that have not reached a terminal status.
     */
    long countActive();

    /**
     * Drop the oldest terminal runs beyond the retention limit.
     * 
     * @param retain Number of terminal runs to keep
     * @return Number of evicted runs
     */
    int evictTerminal(int retain);
}
