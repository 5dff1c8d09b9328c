package com.agentflow.engine.coordinator;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation handle of one executing run.
 * Tracks the in-flight invocations of the current phase so that a cancel can interrupt them.
 */
public class RunHandle {

    private final String runId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile String cancelReason;

    public RunHandle(String runId) {
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Signal cancellation and interrupt every tracked invocation.
     *
     * @return false if the run was already cancelled
     */
    public boolean cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.cancelReason = reason;
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getCancelReason() {
        return cancelReason;
    }

    /**
     * Track an invocation. A future registered after cancel() is cancelled immediately.
     */
    void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
