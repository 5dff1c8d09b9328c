package com.agentflow.engine.approval;

import com.agentflow.core.model.WorkflowRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gate answered by an external signal (REST approve/reject).
 * A gate left unanswered past the timeout counts as declined.
 */
public class SignalApprovalGate implements ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(SignalApprovalGate.class);

    private final Duration timeout;
    private final Map<String, CompletableFuture<Boolean>> pending = new ConcurrentHashMap<>();
    // Runs released before reaching their next gate
    private final Set<String> released = ConcurrentHashMap.newKeySet();

    public SignalApprovalGate(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public boolean awaitApproval(WorkflowRun run, String phaseId) {
        String key = key(run.runId(), phaseId);
        CompletableFuture<Boolean> decision = pending.computeIfAbsent(key, k -> new CompletableFuture<>());
        if (released.contains(run.runId())) {
            decision.complete(false);
        }
        log.info("Run {} waiting for approval after phase {} (timeout: {})", run.runId(), phaseId, timeout);
        
        try {
            boolean approved = decision.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Phase {} of run {} {}", phaseId, run.runId(), approved ? "approved" : "declined");
            return approved;
        } catch (TimeoutException e) {
            log.warn("Approval for phase {} of run {} timed out after {}", phaseId, run.runId(), timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for approval of phase {} in run {}", phaseId, run.runId());
            return false;
        } catch (ExecutionException e) {
            log.error("Approval of phase {} in run {} failed", phaseId, run.runId(), e.getCause());
            return false;
        } finally {
            pending.remove(key);
        }
    }

    @Override
    public boolean decide(String runId, String phaseId, boolean approved) {
        CompletableFuture<Boolean> decision = pending.get(key(runId, phaseId));
        if (decision == null) {
            log.warn("No approval pending for phase {} of run {}", phaseId, runId);
            return false;
        }
        return decision.complete(approved);
    }

    @Override
    public void release(String runId) {
        released.add(runId);
        String prefix = runId + ":";
        pending.forEach((key, decision) -> {
            if (key.startsWith(prefix)) {
                decision.complete(false);
            }
        });
    }

    @Override
    public void forget(String runId) {
        released.remove(runId);
    }

    /**
     * Check if a run is currently waiting at a gate.
     */
    public boolean isWaiting(String runId, String phaseId) {
        return pending.containsKey(key(runId, phaseId));
    }

    private static String key(String runId, String phaseId) {
        return runId + ":" + phaseId;
    }
}
