package com.agentflow.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures every log line of a run carries its run, phase and worker identifiers.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forPhase(runId, workflow, phaseId, iteration)) {
 *     log.info("Dispatching workers"); // Automatically includes runId, phaseId, iteration
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [agentflow-worker-1] INFO  c.a.e.c.PhaseExecutor - Worker completed
 *   runId=abc-123 workflow=quality-sprint phaseId=review iteration=2 workerId=code-reviewer
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String WORKFLOW = "workflow";
    public static final String PHASE_ID = "phaseId";
    public static final String ITERATION = "iteration";
    public static final String WORKER_ID = "workerId";

    private static final String[] KEYS = {RUN_ID, WORKFLOW, PHASE_ID, ITERATION, WORKER_ID};

    private final Map<String, String> previous;

    private LoggingContext() {
        this.previous = MDC.getCopyOfContextMap();
    }

    /**
     * Create a logging context for run-level operations.
     */
    public static LoggingContext forRun(String runId, String workflowName) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(RUN_ID, runId);
        putIfPresent(WORKFLOW, workflowName);
        return ctx;
    }

    /**
     * Create a logging context for one phase iteration.
     */
    public static LoggingContext forPhase(String runId, String workflowName, String phaseId, int iteration) {
        LoggingContext ctx = forRun(runId, workflowName);
        putIfPresent(PHASE_ID, phaseId);
        MDC.put(ITERATION, String.valueOf(iteration));
        return ctx;
    }

    /**
     * Create a logging context for a single worker invocation.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(WORKER_ID, workerId);
        return ctx;
    }

    /**
     * Get current run ID from context.
     */
    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    /**
     * Wrap a task so it runs on a pool thread with the caller's MDC.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> before = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return task.call();
            } finally {
                if (before != null) {
                    MDC.setContextMap(before);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        for (String key : KEYS) {
            String value = previous != null ? previous.get(key) : null;
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        }
    }
}
