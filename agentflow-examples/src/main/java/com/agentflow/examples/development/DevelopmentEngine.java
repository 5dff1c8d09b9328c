package com.agentflow.examples.development;

import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.engine.aggregation.OutcomeAggregator;
import com.agentflow.engine.approval.AutoApprovalGate;
import com.agentflow.engine.coordinator.PhaseExecutor;
import com.agentflow.engine.coordinator.WorkflowOrchestrator;
import com.agentflow.engine.definition.WorkflowDefinitionValidator;
import com.agentflow.engine.lifecycle.GracefulShutdownHandler;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.engine.persistence.InMemoryWorkerRegistry;
import com.agentflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.agentflow.engine.persistence.InMemoryWorkflowRunRepository;
import com.agentflow.engine.trigger.TriggerEvaluator;
import com.agentflow.worker.invoker.LocalWorkerInvoker;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Standalone orchestrator (no Spring context) with the development workers and
 * workflows registered. Interactive runs are approved automatically.
 */
public class DevelopmentEngine implements AutoCloseable {

    private static final Duration WORKER_TIMEOUT = Duration.ofMinutes(1);
    private static final int RUN_RETENTION = 20;

    private final InMemoryWorkerRegistry registry = new InMemoryWorkerRegistry();
    private final LocalWorkerInvoker invoker = new LocalWorkerInvoker();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ExecutorService workerPool;
    private final ExecutorService runPool;
    private final WorkflowOrchestrator orchestrator;

    public DevelopmentEngine(int workerThreads) {
        this.workerPool = Executors.newFixedThreadPool(workerThreads);
        this.runPool = Executors.newSingleThreadExecutor();
        WorkflowMetrics metrics = new WorkflowMetrics(meterRegistry);
        this.orchestrator = new WorkflowOrchestrator(
            new InMemoryWorkflowDefinitionRepository(),
            new InMemoryWorkflowRunRepository(),
            registry,
            new WorkflowDefinitionValidator(),
            new PhaseExecutor(invoker, workerPool, new ObjectMapper(), metrics, WORKER_TIMEOUT),
            new TriggerEvaluator(),
            new OutcomeAggregator(),
            new AutoApprovalGate(),
            metrics,
            new GracefulShutdownHandler(Duration.ofSeconds(5)),
            runPool,
            RUN_RETENTION
        );

        DevelopmentWorkers.register(registry, invoker);
        for (WorkflowDefinition workflow : DevelopmentWorkflows.all()) {
            orchestrator.registerWorkflow(workflow);
        }
    }

    public WorkflowOrchestrator orchestrator() {
        return orchestrator;
    }

    public InMemoryWorkerRegistry registry() {
        return registry;
    }

    public LocalWorkerInvoker invoker() {
        return invoker;
    }

    public SimpleMeterRegistry meterRegistry() {
        return meterRegistry;
    }

    @Override
    public void close() {
        runPool.shutdown();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
    }
}
