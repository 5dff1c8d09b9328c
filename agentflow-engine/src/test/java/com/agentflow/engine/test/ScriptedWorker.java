package com.agentflow.engine.test;

import com.agentflow.core.model.Diagnostics;
import com.agentflow.worker.Worker;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Test worker driven by a script: one result per call (the last one repeats),
 * with optional latency and a latch to hold invocations open.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * ScriptedWorker reviewer = ScriptedWorker.returning(
 *     ctx -> WorkerResult.success().diagnostics(critical(2)).build(),
 *     ctx -> WorkerResult.success().diagnostics(critical(0)).build());
 * harness.register("code-reviewer", reviewer, "code-review");
 * }</pre>
 */
public class ScriptedWorker implements Worker {

    private final List<Function<WorkerContext, WorkerResult>> script;
    private final List<Invocation> invocations = Collections.synchronizedList(new ArrayList<>());
    private volatile Duration delay = Duration.ZERO;
    private volatile CountDownLatch gate;
    private final CountDownLatch started = new CountDownLatch(1);

    /**
     * What the worker saw on one call.
     */
    public record Invocation(
        String phaseId,
        int iteration,
        String argument,
        Map<String, JsonNode> inputs,
        long startedAtNanos
    ) {}

    @SafeVarargs
    private ScriptedWorker(Function<WorkerContext, WorkerResult>... script) {
        this.script = List.of(script);
    }

    @SafeVarargs
    public static ScriptedWorker returning(Function<WorkerContext, WorkerResult>... script) {
        return new ScriptedWorker(script);
    }

    /**
     * Worker that always succeeds and publishes the given field with a text value.
     */
    public static ScriptedWorker producing(String field, String value) {
        return returning(ctx -> WorkerResult.success().field(field, value).build());
    }

    public static ScriptedWorker succeeding() {
        return returning(ctx -> WorkerResult.success().build());
    }

    public static ScriptedWorker failing(String errorCode) {
        return returning(ctx -> WorkerResult.failure(errorCode, "scripted failure").build());
    }

    public static ScriptedWorker throwing(String errorCode) {
        return new ScriptedWorker() {
            @Override
            protected WorkerResult respond(WorkerContext context) throws WorkerException {
                throw new WorkerException(errorCode, "scripted exception");
            }
        };
    }

    /**
     * Sleep before answering.
     */
    public ScriptedWorker withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    /**
     * Block every invocation until the latch opens.
     */
    public ScriptedWorker blockingOn(CountDownLatch gate) {
        this.gate = gate;
        return this;
    }

    @Override
    public WorkerResult invoke(WorkerContext context) throws WorkerException {
        invocations.add(new Invocation(context.getPhaseId(), context.getIteration(), context.getArgument(),
            context.getInputs(), System.nanoTime()));
        started.countDown();
        try {
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
            if (gate != null) {
                gate.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("INTERRUPTED", "worker interrupted");
        }
        return respond(context);
    }

    protected WorkerResult respond(WorkerContext context) throws WorkerException {
        int call = Math.min(invocations.size(), script.size()) - 1;
        return script.get(Math.max(call, 0)).apply(context);
    }

    /**
     * Wait until the first invocation has started.
     */
    public boolean awaitStarted(Duration timeout) throws InterruptedException {
        return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<Invocation> getInvocations() {
        return List.copyOf(invocations);
    }

    public int getInvocationCount() {
        return invocations.size();
    }

    // ========== Result Helpers ==========

    public static Diagnostics critical(long count) {
        return Diagnostics.builder().count("criticalCount", count).build();
    }

    public static WorkerResult withCritical(long count) {
        return WorkerResult.success().diagnostics(critical(count)).build();
    }
}
