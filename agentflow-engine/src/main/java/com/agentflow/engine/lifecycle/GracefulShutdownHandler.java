package com.agentflow.engine.lifecycle;

import com.agentflow.core.exception.ShutdownInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Manages graceful shutdown for the orchestrator.
 * 
 * On shutdown:
 * 1. Stops accepting new runs
 * 2. Waits for in-flight runs to complete (up to the grace period)
 * 3. Cancels the runs still executing
 * 4. Logs shutdown status
 * 
 * Cancelled runs end CANCELLED with their completed phases on record.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);
    private static final long POLL_INTERVAL_MILLIS = 100;

    private final Duration gracePeriod;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Map<String, Consumer<String>> activeRuns = new ConcurrentHashMap<>();

    public GracefulShutdownHandler(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Check if new runs can be accepted.
     */
    public boolean canAcceptRuns() {
        return !shuttingDown.get();
    }

    /**
     * Register a run as active.
     * 
     * @param runId The run id
     * @param canceller Called with a reason if the run is still active when the grace period ends
     * @throws ShutdownInProgressException during shutdown
     */
    public void registerActiveRun(String runId, Consumer<String> canceller) {
        if (shuttingDown.get()) {
            throw new ShutdownInProgressException(runId);
        }
        activeRuns.put(runId, canceller);
        log.debug("Registered active run: {}", runId);
    }

    /**
     * Unregister a run once it reached a terminal status.
     */
    public void unregisterActiveRun(String runId) {
        activeRuns.remove(runId);
        log.debug("Unregistered active run: {}", runId);
    }

    /**
     * Get the count of currently active runs.
     */
    public int getActiveRunCount() {
        return activeRuns.size();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0) // Run early in shutdown sequence
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * Stop accepting runs, wait for active ones, then cancel what is left.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown with {} active runs", activeRuns.size());

        waitForActiveRuns();
        cancelRemainingRuns();

        log.info("Graceful shutdown complete");
    }

    private void waitForActiveRuns() {
        if (activeRuns.isEmpty()) {
            log.info("No active runs to wait for");
            return;
        }

        log.info("Waiting for {} active runs to complete (timeout: {})", activeRuns.size(), gracePeriod);

        long deadline = System.currentTimeMillis() + gracePeriod.toMillis();
        while (!activeRuns.isEmpty() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(POLL_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for runs to complete");
                break;
            }
        }
    }

    private void cancelRemainingRuns() {
        if (activeRuns.isEmpty()) {
            log.info("All active runs completed");
            return;
        }

        log.warn("Grace period over with {} runs still active: {}", activeRuns.size(), activeRuns.keySet());
        activeRuns.forEach((runId, canceller) -> {
            try {
                canceller.accept("shutdown");
            } catch (RuntimeException e) {
                log.error("Failed to cancel run {}: {}", runId, e.getMessage());
            }
        });
    }
}
