package com.agentflow.engine.metrics;

import com.agentflow.core.model.OutcomeStatus;
import com.agentflow.core.model.PhaseStatus;
import com.agentflow.core.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the orchestrator.
 * 
 * Metrics exposed:
 * - Runs started and finished, by terminal status
 * - Run duration
 * - Phase iterations and phase outcomes
 * - Worker invocations by outcome, with latency
 * - Worker timeouts and context key collisions
 * - Active runs gauge
 */
@Component
public class WorkflowMetrics {

    // Metric names
    public static final String RUNS_STARTED = "agentflow.runs.started";
    public static final String RUNS_FINISHED = "agentflow.runs.finished";
    public static final String RUN_DURATION = "agentflow.run.duration";
    public static final String RUNS_ACTIVE = "agentflow.runs.active";

    public static final String PHASE_ITERATIONS = "agentflow.phase.iterations";
    public static final String PHASES_FINISHED = "agentflow.phases.finished";

    public static final String WORKER_INVOCATIONS = "agentflow.worker.invocations";
    public static final String WORKER_DURATION = "agentflow.worker.duration";
    public static final String WORKER_TIMEOUTS = "agentflow.worker.timeouts";

    public static final String KEY_COLLISIONS = "agentflow.context.collisions";
    public static final String EVENTS_DISPATCHED = "agentflow.events.dispatched";

    private final MeterRegistry registry;
    private final AtomicInteger activeRuns = new AtomicInteger(0);

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(RUNS_ACTIVE, activeRuns, AtomicInteger::get)
            .description("Number of runs currently executing")
            .register(registry);
    }

    // ========== Run Metrics ==========

    public void runStarted(String workflowName) {
        Counter.builder(RUNS_STARTED)
            .tag("workflow", workflowName)
            .description("Total runs started")
            .register(registry)
            .increment();
        
        activeRuns.incrementAndGet();
    }

    public void runFinished(String workflowName, RunStatus status, Duration duration) {
        Counter.builder(RUNS_FINISHED)
            .tag("workflow", workflowName)
            .tag("status", status.name())
            .description("Total runs finished, by terminal status")
            .register(registry)
            .increment();
        
        Timer.builder(RUN_DURATION)
            .tag("workflow", workflowName)
            .tag("status", status.name())
            .description("Run execution duration")
            .register(registry)
            .record(duration);
        
        activeRuns.updateAndGet(v -> Math.max(0, v - 1));
    }

    // ========== Phase Metrics ==========

    public void phaseIteration(String workflowName, String phaseId, int iteration) {
        Counter.builder(PHASE_ITERATIONS)
            .tag("workflow", workflowName)
            .tag("phase", phaseId)
            .tag("reentry", String.valueOf(iteration > 1))
            .description("Phase iterations executed; re-entries come from validation loops")
            .register(registry)
            .increment();
    }

    public void phaseFinished(String workflowName, String phaseId, PhaseStatus status) {
        Counter.builder(PHASES_FINISHED)
            .tag("workflow", workflowName)
            .tag("phase", phaseId)
            .tag("status", status.name())
            .description("Phases finished, by status")
            .register(registry)
            .increment();
    }

    // ========== Worker Metrics ==========

    public void workerInvoked(String workerId, OutcomeStatus status, String errorCode, Duration duration) {
        Counter.builder(WORKER_INVOCATIONS)
            .tag("worker", workerId)
            .tag("status", status.name())
            .tag("error_code", errorCode != null ? errorCode : "none")
            .description("Worker invocations by outcome")
            .register(registry)
            .increment();
        
        Timer.builder(WORKER_DURATION)
            .tag("worker", workerId)
            .tag("status", status.name())
            .description("Worker invocation latency")
            .register(registry)
            .record(duration);
    }

    public void workerTimedOut(String workerId) {
        Counter.builder(WORKER_TIMEOUTS)
            .tag("worker", workerId)
            .description("Worker invocations that exceeded their deadline")
            .register(registry)
            .increment();
    }

    // ========== Context & Event Metrics ==========

    public void keyCollision(String workflowName) {
        Counter.builder(KEY_COLLISIONS)
            .tag("workflow", workflowName)
            .description("Rejected duplicate writes to the context bus")
            .register(registry)
            .increment();
    }

    public void eventDispatched(String kind, int automatic, int proposed) {
        Counter.builder(EVENTS_DISPATCHED)
            .tag("kind", kind)
            .tag("outcome", automatic > 0 ? "dispatched" : proposed > 0 ? "proposed" : "ignored")
            .description("Events evaluated by the dispatch service")
            .register(registry)
            .increment();
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }
}
