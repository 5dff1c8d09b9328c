package com.agentflow.engine.health;

import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.core.repository.WorkflowDefinitionRepository;
import com.agentflow.core.repository.WorkflowRunRepository;
import com.agentflow.engine.lifecycle.GracefulShutdownHandler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicator for the orchestrator.
 * Reports health status based on:
 * - Registered workers and workflows
 * - Active runs
 * - Shutdown state
 */
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final WorkerRegistry workerRegistry;
    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowRunRepository runRepository;
    private final GracefulShutdownHandler shutdownHandler;

    public OrchestratorHealthIndicator(
            WorkerRegistry workerRegistry,
            WorkflowDefinitionRepository definitionRepository,
            WorkflowRunRepository runRepository,
            GracefulShutdownHandler shutdownHandler) {
        this.workerRegistry = workerRegistry;
        this.definitionRepository = definitionRepository;
        this.runRepository = runRepository;
        this.shutdownHandler = shutdownHandler;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        
        try {
            int workers = workerRegistry.findAll().size();
            details.put("workers", workers);
            details.put("workflows", definitionRepository.findAll().size());
            details.put("activeRuns", runRepository.countActive());

            if (shutdownHandler.isShuttingDown()) {
                details.put("shutdown", "in progress");
                return Health.outOfService()
                    .withDetails(details)
                    .build();
            }

            if (workers == 0) {
                details.put("workerWarning", "No workers registered - every run will fail to resolve");
            }

            return Health.up()
                .withDetails(details)
                .build();
                
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
