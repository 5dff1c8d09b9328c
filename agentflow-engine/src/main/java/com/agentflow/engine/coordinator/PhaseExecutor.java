package com.agentflow.engine.coordinator;

import com.agentflow.core.context.ContextBus;
import com.agentflow.core.context.ContextSnapshot;
import com.agentflow.core.exception.KeyCollisionException;
import com.agentflow.core.exception.MissingContextException;
import com.agentflow.core.exception.OrchestratorException;
import com.agentflow.core.exception.WorkerTimeoutException;
import com.agentflow.core.model.DiagnosticEntry;
import com.agentflow.core.model.Diagnostics;
import com.agentflow.core.model.FieldSpec;
import com.agentflow.core.model.OutcomeStatus;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.Severity;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.model.WorkerOutcome;
import com.agentflow.core.model.WorkflowRun;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;
import com.agentflow.worker.invoker.WorkerInvoker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one iteration of a phase: resolves inputs, dispatches workers on the worker pool,
 * enforces deadlines and publishes produced fields to the run's context bus.
 *
 * Inputs are resolved and outputs written on the calling thread, in worker declaration order,
 * so the resulting outcome list and bus contents do not depend on completion timing.
 * Parallel workers all see the bus as it was when the iteration started; sequential workers
 * see the outputs of the workers before them.
 */
public class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private static final long START_POLL_MILLIS = 50;

    private final WorkerInvoker invoker;
    private final ExecutorService workerPool;
    private final ObjectMapper objectMapper;
    private final WorkflowMetrics metrics;
    private final Duration defaultTimeout;

    public PhaseExecutor(
            WorkerInvoker invoker,
            ExecutorService workerPool,
            ObjectMapper objectMapper,
            WorkflowMetrics metrics,
            Duration defaultTimeout) {
        this.invoker = invoker;
        this.workerPool = workerPool;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Outcome of one phase iteration.
     *
     * @param outcomes    Outcomes in worker declaration order
     * @param skipped     Workers not dispatched because a sequential predecessor failed
     * @param diagnostics Merged diagnostics of the iteration
     */
    public record IterationResult(
        List<WorkerOutcome> outcomes,
        List<String> skipped,
        Diagnostics diagnostics
    ) {
        public IterationResult {
            outcomes = List.copyOf(outcomes);
            skipped = List.copyOf(skipped);
        }
    }

    /**
     * Run one iteration of the phase.
     *
     * @throws PhaseAbortedException on a key collision or a missing required input
     */
    public IterationResult execute(
            WorkflowRun run,
            PhaseDefinition phase,
            List<WorkerDescriptor> workers,
            int iteration,
            RunHandle handle) {
        List<WorkerOutcome> outcomes = phase.parallel()
            ? executeParallel(run, phase, workers, iteration, handle)
            : new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        if (!phase.parallel()) {
            for (int i = 0; i < workers.size(); i++) {
                WorkerDescriptor worker = workers.get(i);
                Map<String, JsonNode> inputs = resolveInputs(run.contextBus(), worker, outcomes);
                Invocation invocation = submit(run, phase, worker, iteration, inputs, handle);
                WorkerOutcome outcome = await(invocation, worker, phase, iteration, timeoutFor(worker, run), handle);
                publish(run, outcome, outcomes);
                outcomes.add(outcome);

                if (outcome.isFailure()) {
                    for (int j = i + 1; j < workers.size(); j++) {
                        skipped.add(workers.get(j).id());
                    }
                    if (!skipped.isEmpty()) {
                        log.info("Sequential phase {} stopped after {} failed; skipping {}",
                            phase.phaseId(), worker.id(), skipped);
                    }
                    break;
                }
            }
        }

        Diagnostics merged = Diagnostics.mergeAll(outcomes.stream().map(WorkerOutcome::diagnostics).toList());
        return new IterationResult(outcomes, skipped, merged);
    }

    private List<WorkerOutcome> executeParallel(
            WorkflowRun run,
            PhaseDefinition phase,
            List<WorkerDescriptor> workers,
            int iteration,
            RunHandle handle) {
        // Resolve everything before dispatching anything
        List<Map<String, JsonNode>> inputs = new ArrayList<>();
        for (WorkerDescriptor worker : workers) {
            inputs.add(resolveInputs(run.contextBus(), worker, List.of()));
        }

        List<Invocation> invocations = new ArrayList<>();
        for (int i = 0; i < workers.size(); i++) {
            invocations.add(submit(run, phase, workers.get(i), iteration, inputs.get(i), handle));
        }
        log.debug("Dispatched {} workers in parallel", workers.size());

        List<WorkerOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < workers.size(); i++) {
            WorkerDescriptor worker = workers.get(i);
            outcomes.add(await(invocations.get(i), worker, phase, iteration, timeoutFor(worker, run), handle));
        }

        // Publish in declaration order once every invocation has settled
        List<WorkerOutcome> published = new ArrayList<>();
        for (WorkerOutcome outcome : outcomes) {
            publish(run, outcome, published);
            published.add(outcome);
        }
        return published;
    }

    // ========== Inputs & Outputs ==========

    private Map<String, JsonNode> resolveInputs(ContextBus bus, WorkerDescriptor worker, List<WorkerOutcome> completed) {
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        for (FieldSpec spec : worker.inputContract()) {
            try {
                bus.read(spec, worker.id()).ifPresent(value -> inputs.put(spec.name(), value));
            } catch (MissingContextException e) {
                log.error("Worker {} cannot start: {}", worker.id(), e.getMessage());
                throw new PhaseAbortedException(worker.id(), e, completed);
            }
        }
        return inputs;
    }

    private void publish(WorkflowRun run, WorkerOutcome outcome, List<WorkerOutcome> completed) {
        if (outcome.isFailure()) {
            return;
        }
        for (Map.Entry<String, JsonNode> field : outcome.producedFields().entrySet()) {
            try {
                run.contextBus().write(outcome.phaseId(), outcome.iteration(), outcome.workerId(),
                    field.getKey(), field.getValue());
            } catch (KeyCollisionException e) {
                metrics.keyCollision(run.workflowName());
                log.error("Context key collision in run {}: {}", run.runId(), e.getKey());
                List<WorkerOutcome> recorded = new ArrayList<>(completed);
                recorded.add(outcome);
                throw new PhaseAbortedException(outcome.workerId(), e, recorded);
            }
        }
    }

    // ========== Invocation ==========

    /**
     * A submitted worker task. Its deadline runs from the moment it gets a pool thread;
     * time queued behind other workers does not count.
     */
    private static final class Invocation {

        private final CountDownLatch started = new CountDownLatch(1);
        private volatile Instant startedAt;
        private volatile Future<WorkerOutcome> future;

        void markStarted() {
            startedAt = Instant.now();
            started.countDown();
        }

        /**
         * Wait until the task holds a thread.
         *
         * @return false if the task finished without ever starting (cancelled while queued)
         */
        boolean awaitStart() throws InterruptedException {
            while (!started.await(START_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (future.isDone()) {
                    return false;
                }
            }
            return true;
        }
    }

    private Invocation submit(
            WorkflowRun run,
            PhaseDefinition phase,
            WorkerDescriptor worker,
            int iteration,
            Map<String, JsonNode> inputs,
            RunHandle handle) {
        ContextSnapshot snapshot = run.contextBus().snapshot();
        WorkerContext context = new WorkerContext(
            run.runId(),
            run.workflowName(),
            phase.phaseId(),
            iteration,
            worker,
            run.argument(),
            snapshot,
            inputs,
            objectMapper,
            handle::isCancelled
        );
        Invocation invocation = new Invocation();
        invocation.future = workerPool.submit(LoggingContext.propagate(() -> {
            invocation.markStarted();
            return invoke(worker, context);
        }));
        handle.track(invocation.future);
        return invocation;
    }

    private WorkerOutcome invoke(WorkerDescriptor worker, WorkerContext context) {
        Instant startedAt = Instant.now();
        try (LoggingContext ctx = LoggingContext.forWorker(worker.id())) {
            log.debug("Invoking worker {}", worker.id());
            WorkerResult result = invoker.invoke(worker, context);
            if (result == null) {
                return failure(worker, context, WorkerException.DEFAULT_ERROR_CODE,
                    "Worker returned no result", Diagnostics.empty(), startedAt);
            }
            if (result.status() == OutcomeStatus.FAILURE) {
                String code = result.errorCode() != null ? result.errorCode() : WorkerException.DEFAULT_ERROR_CODE;
                return failure(worker, context, code, result.errorMessage(), result.diagnostics(), startedAt);
            }
            for (String field : result.producedFields().keySet()) {
                if (!worker.declaresOutput(field)) {
                    log.warn("Worker {} produced undeclared field '{}'", worker.id(), field);
                }
            }
            return new WorkerOutcome(
                worker.id(),
                context.getPhaseId(),
                context.getIteration(),
                result.status(),
                result.producedFields(),
                result.diagnostics().withSource(worker.id()),
                null,
                null,
                startedAt,
                Instant.now()
            );
        } catch (WorkerException e) {
            log.warn("Worker {} failed [{}]: {}", worker.id(), e.getErrorCode(), e.getMessage());
            return failure(worker, context, e.getErrorCode(), e.getMessage(), e.getDiagnostics(), startedAt);
        } catch (OrchestratorException e) {
            log.warn("Worker {} could not be invoked [{}]: {}", worker.id(), e.getErrorCode(), e.getMessage());
            return failure(worker, context, e.getErrorCode(), e.getMessage(), Diagnostics.empty(), startedAt);
        } catch (RuntimeException e) {
            log.error("Worker {} threw unexpectedly", worker.id(), e);
            return failure(worker, context, WorkerException.DEFAULT_ERROR_CODE,
                e.getClass().getSimpleName() + ": " + e.getMessage(), Diagnostics.empty(), startedAt);
        }
    }

    private WorkerOutcome await(
            Invocation invocation,
            WorkerDescriptor worker,
            PhaseDefinition phase,
            int iteration,
            Duration timeout,
            RunHandle handle) {
        Future<WorkerOutcome> future = invocation.future;
        Instant startedAt = Instant.now();
        WorkerOutcome outcome;
        try {
            if (invocation.awaitStart()) {
                startedAt = invocation.startedAt;
            }
            long remaining = Duration.between(Instant.now(), startedAt.plus(timeout)).toMillis();
            outcome = future.get(Math.max(0, remaining), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.workerTimedOut(worker.id());
            WorkerTimeoutException timeoutError = new WorkerTimeoutException(worker.id(), timeout);
            log.warn(timeoutError.getMessage());
            Diagnostics diagnostics = Diagnostics.builder()
                .entry(DiagnosticEntry.of(Severity.HIGH, WorkerTimeoutException.ERROR_CODE, timeoutError.getMessage())
                    .withSource(worker.id()))
                .build();
            outcome = new WorkerOutcome(worker.id(), phase.phaseId(), iteration, OutcomeStatus.FAILURE,
                Map.of(), diagnostics, WorkerTimeoutException.ERROR_CODE, timeoutError.getMessage(),
                startedAt, Instant.now());
        } catch (CancellationException e) {
            outcome = cancelled(worker, phase, iteration, startedAt, handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            outcome = cancelled(worker, phase, iteration, startedAt, handle);
        } catch (ExecutionException e) {
            // invoke() recovers every exception, so this is a bug in the wrapper itself
            log.error("Invocation of worker {} failed outside the worker", worker.id(), e.getCause());
            outcome = WorkerOutcome.failure(worker.id(), phase.phaseId(), iteration,
                WorkerException.DEFAULT_ERROR_CODE, String.valueOf(e.getCause()), startedAt);
        } finally {
            handle.untrack(future);
        }

        if (handle.isCancelled() && outcome.isFailure() && !WorkerOutcome.ERROR_CANCELLED.equals(outcome.errorCode())
                && !WorkerTimeoutException.ERROR_CODE.equals(outcome.errorCode())) {
            // Interrupted workers usually fail with their own error; report them as cancelled
            outcome = cancelled(worker, phase, iteration, startedAt, handle);
        }
        metrics.workerInvoked(worker.id(), outcome.status(), outcome.errorCode(), outcome.duration());
        return outcome;
    }

    private Duration timeoutFor(WorkerDescriptor worker, WorkflowRun run) {
        if (worker.timeout() != null) {
            return worker.timeout();
        }
        Duration override = run.options().workerTimeout();
        return override != null ? override : defaultTimeout;
    }

    private WorkerOutcome failure(
            WorkerDescriptor worker,
            WorkerContext context,
            String errorCode,
            String message,
            Diagnostics diagnostics,
            Instant startedAt) {
        return new WorkerOutcome(
            worker.id(),
            context.getPhaseId(),
            context.getIteration(),
            OutcomeStatus.FAILURE,
            Map.of(),
            diagnostics.withSource(worker.id()),
            errorCode,
            message,
            startedAt,
            Instant.now()
        );
    }

    private WorkerOutcome cancelled(
            WorkerDescriptor worker,
            PhaseDefinition phase,
            int iteration,
            Instant startedAt,
            RunHandle handle) {
        String reason = handle.getCancelReason() != null ? handle.getCancelReason() : "run cancelled";
        log.info("Worker {} cancelled: {}", worker.id(), reason);
        return WorkerOutcome.failure(worker.id(), phase.phaseId(), iteration,
            WorkerOutcome.ERROR_CANCELLED, reason, startedAt);
    }
}
