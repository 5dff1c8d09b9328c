package com.agentflow.engine.service;

import com.agentflow.core.model.FinalResult;
import com.agentflow.core.model.RunOptions;
import com.agentflow.core.model.RunStatus;
import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.core.model.WorkflowRun;
import java.util.List;

/**
 * Core service for workflow orchestration.
 * Registers workflow definitions, executes runs and exposes their results.
 */
public interface WorkflowService {

    /**
     * Register a workflow definition, replacing one with the same name.
     * 
     * @param definition The workflow definition
     * @return The registered definition
     * @throws com.agentflow.core.exception.WorkflowValidationException if the definition is malformed
     */
    WorkflowDefinition registerWorkflow(WorkflowDefinition definition);

    /**
     * Get a workflow definition by name.
     * 
     * @throws com.agentflow.core.exception.NotFoundException if no workflow has this name
     */
    WorkflowDefinition getWorkflow(String name);

    /**
     * List registered workflow definitions ordered by name.
     */
    List<WorkflowDefinition> listWorkflows();

    /**
     * Execute a registered workflow on the calling thread.
     * 
     * @param request The start request
     * @return The aggregated result of the terminal run
     * @throws com.agentflow.core.exception.UnknownWorkerException if a worker reference does not resolve;
     *         no run executes in that case
     */
    FinalResult runWorkflow(StartRunRequest request);

    /**
     * Execute an unregistered workflow definition on the calling thread.
     */
    FinalResult runWorkflow(WorkflowDefinition definition, String argument, RunOptions options);

    /**
     * Start a registered workflow in the background.
     * Worker references are resolved before this method returns.
     * 
     * @return The run in PENDING state
     */
    WorkflowRun startRun(StartRunRequest request);

    /**
     * Get the latest snapshot of a run.
     * 
     * @throws com.agentflow.core.exception.NotFoundException if the run is unknown or evicted
     */
    WorkflowRun getRun(String runId);

    /**
     * Get the final result of a terminal run.
     * 
     * @throws com.agentflow.core.exception.RunNotTerminalException if the run is still executing
     */
    FinalResult getResult(String runId);

    /**
     * List runs, most recent first.
     * 
     * @param workflowName Restrict to one workflow; null for all
     * @param status Restrict to one status; null for all
     * @param limit Maximum number of results
     */
    List<WorkflowRun> listRuns(String workflowName, RunStatus status, int limit);

    /**
     * Cancel an executing run. In-flight invocations are interrupted and recorded as cancelled.
     * 
     * @return false if the run had already finished
     */
    boolean cancelRun(String runId, String reason);

    /**
     * Answer the approval gate of an interactive run.
     * 
     * @throws com.agentflow.core.exception.NotFoundException if the run is not waiting at that phase
     */
    void decideApproval(String runId, String phaseId, boolean approved);

    /**
     * Request to run a registered workflow.
     */
    record StartRunRequest(
        String workflowName,
        String argument,
        RunOptions options
    ) {
        public StartRunRequest {
            if (options == null) {
                options = RunOptions.defaults();
            }
        }

        public static StartRunRequest of(String workflowName, String argument) {
            return new StartRunRequest(workflowName, argument, RunOptions.defaults());
        }
    }
}
