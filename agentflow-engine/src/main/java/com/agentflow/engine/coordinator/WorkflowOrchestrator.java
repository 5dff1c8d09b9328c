package com.agentflow.engine.coordinator;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.UnknownWorkerException;
import com.agentflow.core.model.*;
import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.core.repository.WorkflowDefinitionRepository;
import com.agentflow.core.repository.WorkflowRunRepository;
import com.agentflow.engine.aggregation.OutcomeAggregator;
import com.agentflow.engine.approval.ApprovalGate;
import com.agentflow.engine.definition.WorkflowDefinitionValidator;
import com.agentflow.engine.lifecycle.GracefulShutdownHandler;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.engine.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Core workflow orchestrator responsible for executing workflow runs.
 * Resolves worker references, schedules phases, drives validation loops,
 * records outcomes and decides the terminal status of each run.
 * 
 * Phases execute one at a time in declaration order once their dependencies have finished;
 * the workers inside a phase fan out through the {@link PhaseExecutor}.
 */
public class WorkflowOrchestrator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowRunRepository runRepository;
    private final WorkerRegistry workerRegistry;
    private final WorkflowDefinitionValidator validator;
    private final PhaseExecutor phaseExecutor;
    private final TriggerEvaluator triggerEvaluator;
    private final OutcomeAggregator aggregator;
    private final ApprovalGate approvalGate;
    private final WorkflowMetrics metrics;
    private final GracefulShutdownHandler shutdownHandler;
    private final ExecutorService runExecutor;
    private final int runRetention;

    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public WorkflowOrchestrator(
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
            ExecutorService runExecutor,
            int runRetention) {
        this.definitionRepository = definitionRepository;
        this.runRepository = runRepository;
        this.workerRegistry = workerRegistry;
        this.validator = validator;
        this.phaseExecutor = phaseExecutor;
        this.triggerEvaluator = triggerEvaluator;
        this.aggregator = aggregator;
        this.approvalGate = approvalGate;
        this.metrics = metrics;
        this.shutdownHandler = shutdownHandler;
        this.runExecutor = runExecutor;
        this.runRetention = runRetention;
    }

    // ========== Definitions ==========

    @Override
    public WorkflowDefinition registerWorkflow(WorkflowDefinition definition) {
        log.info("Registering workflow: {}", definition.name());
        validator.validate(definition);
        definitionRepository.save(definition);
        log.info("Registered workflow {} with phases {}", definition.name(), definition.phaseIds());
        return definition;
    }

    @Override
    public WorkflowDefinition getWorkflow(String name) {
        return definitionRepository.findByName(name)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", name));
    }

    @Override
    public List<WorkflowDefinition> listWorkflows() {
        return definitionRepository.findAll();
    }

    // ========== Runs ==========

    @Override
    public FinalResult runWorkflow(StartRunRequest request) {
        return runWorkflow(getWorkflow(request.workflowName()), request.argument(), request.options());
    }

    @Override
    public FinalResult runWorkflow(WorkflowDefinition definition, String argument, RunOptions options) {
        validator.validate(definition);
        Map<String, List<WorkerDescriptor>> plan = resolvePlan(definition, options);
        WorkflowRun run = WorkflowRun.create(definition, argument, options);
        RunHandle handle = admit(run);
        return aggregator.aggregate(execute(run, plan, handle));
    }

    @Override
    public WorkflowRun startRun(StartRunRequest request) {
        WorkflowDefinition definition = getWorkflow(request.workflowName());
        Map<String, List<WorkerDescriptor>> plan = resolvePlan(definition, request.options());
        WorkflowRun run = WorkflowRun.create(definition, request.argument(), request.options());
        RunHandle handle = admit(run);

        runExecutor.execute(() -> {
            try {
                execute(run, plan, handle);
            } catch (RuntimeException e) {
                log.error("Run {} of {} ended with an unexpected error", run.runId(), run.workflowName(), e);
            }
        });
        log.info("Started run {} of workflow {}", run.runId(), run.workflowName());
        return run;
    }

    @Override
    public WorkflowRun getRun(String runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("WorkflowRun", runId));
    }

    @Override
    public FinalResult getResult(String runId) {
        return aggregator.aggregate(getRun(runId));
    }

    @Override
    public List<WorkflowRun> listRuns(String workflowName, RunStatus status, int limit) {
        if (workflowName != null) {
            return runRepository.findByWorkflow(workflowName, Integer.MAX_VALUE).stream()
                .filter(r -> status == null || r.status() == status)
                .limit(limit)
                .toList();
        }
        if (status != null) {
            return runRepository.findByStatus(status, limit);
        }
        List<WorkflowRun> all = new ArrayList<>();
        for (RunStatus each : RunStatus.values()) {
            all.addAll(runRepository.findByStatus(each, limit));
        }
        all.sort(Comparator.comparing(WorkflowRun::createdAt).reversed());
        return all.stream().limit(limit).toList();
    }

    @Override
    public boolean cancelRun(String runId, String reason) {
        RunHandle handle = activeRuns.get(runId);
        if (handle == null) {
            WorkflowRun run = getRun(runId);
            log.info("Run {} is not executing (status {}); nothing to cancel", runId, run.status());
            return false;
        }
        String effectiveReason = reason != null ? reason : "cancelled by request";
        boolean signalled = handle.cancel(effectiveReason);
        if (signalled) {
            log.info("Cancelling run {}: {}", runId, effectiveReason);
            approvalGate.release(runId);
        }
        return signalled;
    }

    @Override
    public void decideApproval(String runId, String phaseId, boolean approved) {
        if (!approvalGate.decide(runId, phaseId, approved)) {
            throw new NotFoundException("ApprovalGate", runId + "/" + phaseId);
        }
    }

    /**
     * Number of runs currently executing in this process.
     */
    public int getActiveRunCount() {
        return activeRuns.size();
    }

    // ========== Planning ==========

    /**
     * Resolve every worker reference of the workflow, then apply the focus filter.
     * 
     * @return Dispatch list per phase, in declaration order; an empty list means the phase is skipped
     * @throws UnknownWorkerException if a reference does not resolve
     */
    Map<String, List<WorkerDescriptor>> resolvePlan(WorkflowDefinition definition, RunOptions options) {
        Map<String, List<WorkerDescriptor>> plan = new LinkedHashMap<>();
        for (PhaseDefinition phase : definition.phases()) {
            List<WorkerDescriptor> workers = new ArrayList<>();
            for (String reference : phase.workers()) {
                workers.add(resolveReference(reference));
            }
            if (options.focus() != null) {
                workers.removeIf(w -> !options.focus().matches(w.capabilities()));
            }
            plan.put(phase.phaseId(), workers);
        }
        return plan;
    }

    private WorkerDescriptor resolveReference(String reference) {
        if (!PhaseDefinition.isCapabilityReference(reference)) {
            return workerRegistry.lookup(reference);
        }
        String tag = PhaseDefinition.capabilityOf(reference);
        List<WorkerDescriptor> candidates = workerRegistry.findByCapability(tag);
        if (candidates.isEmpty()) {
            throw new UnknownWorkerException(reference, "no registered worker has capability " + tag);
        }
        return candidates.get(0);
    }

    // ========== Execution ==========

    private RunHandle admit(WorkflowRun run) {
        RunHandle handle = new RunHandle(run.runId());
        shutdownHandler.registerActiveRun(run.runId(), reason -> {
            if (handle.cancel(reason)) {
                approvalGate.release(run.runId());
            }
        });
        activeRuns.put(run.runId(), handle);
        runRepository.save(run);
        return handle;
    }

    private WorkflowRun execute(WorkflowRun initial, Map<String, List<WorkerDescriptor>> plan, RunHandle handle) {
        WorkflowRun run = initial;
        try (LoggingContext ctx = LoggingContext.forRun(run.runId(), run.workflowName())) {
            if (handle.isCancelled()) {
                return finish(run.withStatus(RunStatus.CANCELLED));
            }
            run = save(run.withStatus(RunStatus.RUNNING));
            metrics.runStarted(run.workflowName());
            log.info("Run {} of workflow {} started (options: {})", run.runId(), run.workflowName(), run.options());

            run = executePhases(run, plan, handle);
            return finish(run);
        } catch (RuntimeException e) {
            log.error("Run {} aborted by an unexpected error", run.runId(), e);
            WorkflowRun latest = runRepository.findById(run.runId()).orElse(run);
            if (latest.status() == RunStatus.RUNNING) {
                latest = latest.withFailure(new RunFailure(null, null, 0, "INTERNAL_ERROR", e.getMessage()));
                finish(skipRemaining(latest, "run aborted").withStatus(RunStatus.FAILED));
            }
            throw e;
        } finally {
            activeRuns.remove(initial.runId());
            shutdownHandler.unregisterActiveRun(initial.runId());
            approvalGate.forget(initial.runId());
        }
    }

    private WorkflowRun executePhases(WorkflowRun run, Map<String, List<WorkerDescriptor>> plan, RunHandle handle) {
        WorkflowDefinition definition = run.definition();
        int executed = 0;

        while (true) {
            if (handle.isCancelled()) {
                return skipRemaining(run, "run cancelled").withStatus(RunStatus.CANCELLED);
            }
            List<String> ready = readyPhases(run);
            if (ready.isEmpty()) {
                break;
            }
            run = save(run.withPhaseCursor(ready));

            String phaseId = ready.get(0);
            run = executePhase(run, definition.getPhase(phaseId), plan.get(phaseId), handle);
            executed++;
            PhaseRecord record = run.getPhase(phaseId);
            metrics.phaseFinished(run.workflowName(), phaseId, record.status());

            if (handle.isCancelled()) {
                return skipRemaining(run, "run cancelled").withStatus(RunStatus.CANCELLED);
            }
            if (record.status() == PhaseStatus.FAILED) {
                log.warn("Phase {} failed ({}); aborting run", phaseId, record.failureReason());
                return skipRemaining(run, "aborted after phase " + phaseId + " failed").withStatus(RunStatus.FAILED);
            }

            if (run.options().interactive() && hasPendingSuccessor(run, phaseId)) {
                if (!approvalGate.awaitApproval(run, phaseId)) {
                    String reason = handle.isCancelled()
                        ? "run cancelled"
                        : "approval declined after phase " + phaseId;
                    log.info("Stopping at the gate after phase {}: {}", phaseId, reason);
                    handle.cancel(reason);
                    return skipRemaining(run, reason).withStatus(RunStatus.CANCELLED);
                }
            }
        }

        // Phases whose dependencies can never be met (only reachable through a failed phase)
        run = skipRemaining(run, "dependencies not satisfied");
        log.debug("Executed {} phases", executed);

        boolean degraded = run.phases().values().stream()
            .anyMatch(p -> p.status() == PhaseStatus.PARTIALLY_FAILED);
        return run.withStatus(degraded ? RunStatus.PARTIALLY_FAILED : RunStatus.SUCCEEDED);
    }

    private WorkflowRun executePhase(
            WorkflowRun run,
            PhaseDefinition phase,
            List<WorkerDescriptor> workers,
            RunHandle handle) {
        PhaseRecord record = run.getPhase(phase.phaseId());

        if (workers.isEmpty()) {
            String reason = "no workers match focus " + run.options().focus().tag();
            log.info("Skipping phase {}: {}", phase.phaseId(), reason);
            return save(run.withPhase(record.skip(reason)));
        }

        record = record.start();
        run = save(run.withPhase(record));
        int maxIterations = phase.effectiveMaxIterations(run.options());

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            try (LoggingContext ctx = LoggingContext.forPhase(run.runId(), run.workflowName(), phase.phaseId(), iteration)) {
                metrics.phaseIteration(run.workflowName(), phase.phaseId(), iteration);
                log.info("Executing phase {} iteration {}/{} with workers {}", phase.phaseId(), iteration,
                    maxIterations, workers.stream().map(WorkerDescriptor::id).toList());

                PhaseExecutor.IterationResult result;
                try {
                    result = phaseExecutor.execute(run, phase, workers, iteration, handle);
                } catch (PhaseAbortedException e) {
                    List<WorkerOutcome> completed = e.getCompletedOutcomes();
                    record = record.withIteration(iteration, completed, List.of(),
                        Diagnostics.mergeAll(completed.stream().map(WorkerOutcome::diagnostics).toList()));
                    run = recordOutcomes(run, completed);
                    run = run.withFailure(new RunFailure(phase.phaseId(), e.getWorkerId(), iteration,
                        e.getErrorCode(), e.getMessage()));
                    return save(run.withPhase(record.complete(PhaseStatus.FAILED, e.getMessage())));
                }

                record = record.withIteration(iteration, result.outcomes(), result.skipped(), result.diagnostics());
                run = recordOutcomes(run, result.outcomes());

                if (handle.isCancelled()) {
                    return save(run.withPhase(record.complete(PhaseStatus.FAILED, "cancelled")));
                }

                Optional<WorkerOutcome> criticalFailure = result.outcomes().stream()
                    .filter(o -> o.isFailure() && isCritical(o.workerId(), workers))
                    .findFirst();
                if (criticalFailure.isPresent()) {
                    WorkerOutcome failed = criticalFailure.get();
                    String reason = "critical worker " + failed.workerId() + " failed: " + failed.errorCode();
                    return save(run.withPhase(record.complete(PhaseStatus.FAILED, reason)));
                }
                boolean advisoryFailure = result.outcomes().stream().anyMatch(WorkerOutcome::isFailure);

                if (!phase.isLooping() || phase.loopUntil().isSatisfied(result.diagnostics())) {
                    if (phase.isLooping()) {
                        log.info("Loop condition {} satisfied after iteration {}", phase.loopUntil().describe(), iteration);
                    }
                    return save(run.withPhase(advisoryFailure
                        ? record.complete(PhaseStatus.PARTIALLY_FAILED, "advisory worker failed")
                        : record.complete(PhaseStatus.SUCCEEDED, null)));
                }

                if (iteration == maxIterations) {
                    String reason = String.format("loop condition %s not met after %d iterations",
                        phase.loopUntil().describe(), iteration);
                    log.warn("Phase {}: {}", phase.phaseId(), reason);
                    return save(run.withPhase(record.complete(PhaseStatus.PARTIALLY_FAILED, reason)));
                }

                run = save(run.withPhase(record));
                log.info("Loop condition {} not met; re-entering phase {}", phase.loopUntil().describe(), phase.phaseId());
            }
        }
        throw new IllegalStateException("Phase " + phase.phaseId() + " left its iteration loop without a status");
    }

    /**
     * Record failures and evaluate follow-up triggers for each completed worker.
     */
    private WorkflowRun recordOutcomes(WorkflowRun run, List<WorkerOutcome> outcomes) {
        List<FollowUp> followUps = new ArrayList<>();
        for (WorkerOutcome outcome : outcomes) {
            if (outcome.isFailure()) {
                run = run.withFailure(RunFailure.of(outcome));
            }
            Event completed = Event.workerCompleted(outcome, run.runId());
            for (TriggerMatch match : triggerEvaluator.evaluateMatches(completed, workerRegistry)) {
                followUps.add(new FollowUp(outcome.phaseId(), outcome.iteration(), outcome.workerId(),
                    match.workerId(), match.mode(), match.matchedBy()));
            }
        }
        if (!followUps.isEmpty()) {
            log.info("Workers completed in phase produced follow-ups: {}",
                followUps.stream().map(FollowUp::workerId).toList());
        }
        return run.withFollowUps(followUps);
    }

    private List<String> readyPhases(WorkflowRun run) {
        WorkflowDefinition definition = run.definition();
        List<String> ready = new ArrayList<>();
        for (String phaseId : definition.phaseIds()) {
            if (run.getPhase(phaseId).status() != PhaseStatus.PENDING) {
                continue;
            }
            boolean satisfied = definition.dependenciesOf(phaseId).stream()
                .map(run::getPhase)
                .allMatch(p -> p.status().satisfiesDependency());
            if (satisfied) {
                ready.add(phaseId);
            }
        }
        return ready;
    }

    private boolean hasPendingSuccessor(WorkflowRun run, String phaseId) {
        return run.definition().successorsOf(phaseId).stream()
            .anyMatch(s -> run.getPhase(s).status() == PhaseStatus.PENDING);
    }

    private WorkflowRun skipRemaining(WorkflowRun run, String reason) {
        for (PhaseRecord record : run.phases().values()) {
            if (record.status() == PhaseStatus.PENDING) {
                run = run.withPhase(record.skip(reason));
            }
        }
        return run;
    }

    private static boolean isCritical(String workerId, List<WorkerDescriptor> workers) {
        return workers.stream()
            .filter(w -> w.id().equals(workerId))
            .findFirst()
            .map(WorkerDescriptor::critical)
            .orElse(true);
    }

    private WorkflowRun save(WorkflowRun run) {
        runRepository.save(run);
        return run;
    }

    private WorkflowRun finish(WorkflowRun run) {
        save(run);
        Duration duration = run.startedAt() != null && run.completedAt() != null
            ? Duration.between(run.startedAt(), run.completedAt())
            : Duration.ZERO;
        if (run.startedAt() != null) {
            metrics.runFinished(run.workflowName(), run.status(), duration);
        }
        log.info("Run {} of workflow {} finished {} in {} ms", run.runId(), run.workflowName(),
            run.status(), duration.toMillis());

        int evicted = runRepository.evictTerminal(runRetention);
        if (evicted > 0) {
            log.debug("Evicted {} archived runs", evicted);
        }
        return run;
    }
}
