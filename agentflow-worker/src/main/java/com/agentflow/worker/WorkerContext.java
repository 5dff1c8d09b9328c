package com.agentflow.worker;

import com.agentflow.core.context.ContextSnapshot;
import com.agentflow.core.model.WorkerDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Context provided to workers during one invocation.
 * Workers read only through this object and never talk to each other directly.
 */
public class WorkerContext {
    
    private final String runId;
    private final String workflowName;
    private final String phaseId;
    private final int iteration;
    private final WorkerDescriptor descriptor;
    private final String argument;
    private final ContextSnapshot snapshot;
    private final Map<String, JsonNode> inputs;
    private final ObjectMapper objectMapper;
    private final BooleanSupplier cancellationCheck;
    
    public WorkerContext(
            String runId,
            String workflowName,
            String phaseId,
            int iteration,
            WorkerDescriptor descriptor,
            String argument,
            ContextSnapshot snapshot,
            Map<String, JsonNode> inputs,
            ObjectMapper objectMapper,
            BooleanSupplier cancellationCheck) {
        this.runId = runId;
        this.workflowName = workflowName;
        this.phaseId = phaseId;
        this.iteration = iteration;
        this.descriptor = descriptor;
        this.argument = argument;
        this.snapshot = snapshot;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.objectMapper = objectMapper;
        this.cancellationCheck = cancellationCheck;
    }
    
    public String getRunId() {
        return runId;
    }
    
    public String getWorkflowName() {
        return workflowName;
    }
    
    public String getPhaseId() {
        return phaseId;
    }
    
    /**
     * Get the iteration number of the phase, starting at 1.
     */
    public int getIteration() {
        return iteration;
    }
    
    public String getWorkerId() {
        return descriptor.id();
    }
    
    public WorkerDescriptor getDescriptor() {
        return descriptor;
    }
    
    /**
     * Get the free-form argument the workflow was invoked with (file reference, error text, description).
     */
    public String getArgument() {
        return argument;
    }
    
    /**
     * Get the most-recent-value view of the run's context bus.
     */
    public ContextSnapshot getSnapshot() {
        return snapshot;
    }
    
    /**
     * Get the declared inputs resolved for this invocation, defaults applied.
     */
    public Map<String, JsonNode> getInputs() {
        return inputs;
    }
    
    public Optional<JsonNode> getInput(String field) {
        return Optional.ofNullable(inputs.get(field));
    }
    
    /**
     * Get a declared input as a specific type.
     */
    public <T> Optional<T> getInput(String field, Class<T> type) {
        return getInput(field).map(node -> objectMapper.convertValue(node, type));
    }
    
    /**
     * Check if the run was cancelled. Long-running workers should poll this.
     */
    public boolean isCancelled() {
        return cancellationCheck.getAsBoolean() || Thread.currentThread().isInterrupted();
    }
    
    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object value) {
        return objectMapper.valueToTree(value);
    }
    
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
