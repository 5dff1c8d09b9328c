package com.agentflow.engine.config;

import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.core.repository.WorkflowDefinitionRepository;
import com.agentflow.core.repository.WorkflowRunRepository;
import com.agentflow.engine.aggregation.OutcomeAggregator;
import com.agentflow.engine.approval.ApprovalGate;
import com.agentflow.engine.approval.SignalApprovalGate;
import com.agentflow.engine.coordinator.PhaseExecutor;
import com.agentflow.engine.coordinator.WorkflowOrchestrator;
import com.agentflow.engine.definition.CatalogLoader;
import com.agentflow.engine.definition.WorkflowDefinitionValidator;
import com.agentflow.engine.health.OrchestratorHealthIndicator;
import com.agentflow.engine.lifecycle.GracefulShutdownHandler;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.engine.report.RunReportRenderer;
import com.agentflow.engine.service.EventDispatchService;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.engine.trigger.TriggerEvaluator;
import com.agentflow.worker.invoker.CompositeWorkerInvoker;
import com.agentflow.worker.invoker.HttpWorkerInvoker;
import com.agentflow.worker.invoker.LocalWorkerInvoker;
import com.agentflow.worker.invoker.WorkerInvoker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the orchestrator, its worker pool and the invocation boundary.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class EngineConfiguration {

    public static final String WORKER_POOL = "agentflowWorkerPool";
    public static final String RUN_POOL = "agentflowRunPool";

    // ========== Executors ==========

    @Bean(name = WORKER_POOL, destroyMethod = "shutdownNow")
    public ExecutorService workerPool(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerPoolSize(),
            new CustomizableThreadFactory("agentflow-worker-"));
    }

    @Bean(name = RUN_POOL, destroyMethod = "shutdownNow")
    public ExecutorService runPool(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(properties.getRunPoolSize(),
            new CustomizableThreadFactory("agentflow-run-"));
    }

    // ========== Invocation Boundary ==========

    @Bean
    public LocalWorkerInvoker localWorkerInvoker() {
        return new LocalWorkerInvoker();
    }

    @Bean
    public HttpWorkerInvoker httpWorkerInvoker(ObjectMapper objectMapper, OrchestratorProperties properties) {
        return new HttpWorkerInvoker(objectMapper, properties.getDefaultWorkerTimeout());
    }

    @Bean
    @Primary
    public WorkerInvoker workerInvoker(LocalWorkerInvoker local, HttpWorkerInvoker http) {
        return new CompositeWorkerInvoker(List.of(local, http));
    }

    // ========== Orchestration ==========

    @Bean
    public PhaseExecutor phaseExecutor(
            WorkerInvoker workerInvoker,
            @Qualifier(WORKER_POOL) ExecutorService workerPool,
            ObjectMapper objectMapper,
            WorkflowMetrics metrics,
            OrchestratorProperties properties) {
        return new PhaseExecutor(workerInvoker, workerPool, objectMapper, metrics,
            properties.getDefaultWorkerTimeout());
    }

    @Bean
    public SignalApprovalGate approvalGate(OrchestratorProperties properties) {
        return new SignalApprovalGate(properties.getApprovalTimeout());
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(OrchestratorProperties properties) {
        return new GracefulShutdownHandler(properties.getShutdownGracePeriod());
    }

    @Bean
    public WorkflowOrchestrator workflowOrchestrator(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowRunRepository runRepository,
            WorkerRegistry workerRegistry,
            WorkflowDefinitionValidator validator,
            PhaseExecutor phaseExecutor,
            TriggerEvaluator triggerEvaluator,
            OutcomeAggregator aggregator,
            ApprovalGate approvalGate,
            WorkflowMetrics metrics,
            GracefulShutdownHandler shutdownHandler,
            @Qualifier(RUN_POOL) ExecutorService runPool,
            OrchestratorProperties properties) {
        return new WorkflowOrchestrator(definitionRepository, runRepository, workerRegistry, validator,
            phaseExecutor, triggerEvaluator, aggregator, approvalGate, metrics, shutdownHandler,
            runPool, properties.getRunRetention());
    }

    @Bean
    public EventDispatchService eventDispatchService(
            TriggerEvaluator triggerEvaluator,
            WorkerRegistry workerRegistry,
            WorkflowService workflowService,
            WorkflowMetrics metrics) {
        return new EventDispatchService(triggerEvaluator, workerRegistry, workflowService, metrics);
    }

    @Bean
    public RunReportRenderer runReportRenderer(ObjectMapper objectMapper) {
        return new RunReportRenderer(objectMapper);
    }

    @Bean
    public OrchestratorHealthIndicator orchestratorHealthIndicator(
            WorkerRegistry workerRegistry,
            WorkflowDefinitionRepository definitionRepository,
            WorkflowRunRepository runRepository,
            GracefulShutdownHandler shutdownHandler) {
        return new OrchestratorHealthIndicator(workerRegistry, definitionRepository, runRepository, shutdownHandler);
    }

    // ========== Catalogs ==========

    @Bean
    public CatalogLoader catalogLoader() {
        return new CatalogLoader();
    }

    @Bean
    public ApplicationRunner catalogInitializer(
            CatalogLoader catalogLoader,
            WorkerRegistry workerRegistry,
            WorkflowService workflowService,
            OrchestratorProperties properties) {
        return new CatalogInitializer(catalogLoader, workerRegistry, workflowService, properties.getCatalogLocations());
    }
}
