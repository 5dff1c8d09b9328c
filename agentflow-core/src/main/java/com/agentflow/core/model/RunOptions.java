package com.agentflow.core.model;

import java.time.Duration;

/**
 * Flags chosen when a workflow is invoked.
 *
 * @param focus          Restricts dispatched workers to a capability family; null dispatches all
 * @param interactive    Insert an approval gate after each phase that has successors
 * @param maxIterations  Overrides the iteration cap of every looping phase; null keeps the definition's
 * @param workerTimeout  Overrides the default per-invocation deadline; null keeps the engine's
 */
public record RunOptions(
    Focus focus,
    boolean interactive,
    Integer maxIterations,
    Duration workerTimeout
) {
    private static final RunOptions DEFAULTS = new RunOptions(null, false, null, null);

    public RunOptions {
        if (maxIterations != null && maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, was " + maxIterations);
        }
        if (workerTimeout != null && (workerTimeout.isNegative() || workerTimeout.isZero())) {
            throw new IllegalArgumentException("workerTimeout must be positive");
        }
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public RunOptions withFocus(Focus focus) {
        return new RunOptions(focus, interactive, maxIterations, workerTimeout);
    }

    public RunOptions withInteractive(boolean interactive) {
        return new RunOptions(focus, interactive, maxIterations, workerTimeout);
    }

    public RunOptions withMaxIterations(Integer maxIterations) {
        return new RunOptions(focus, interactive, maxIterations, workerTimeout);
    }

    public RunOptions withWorkerTimeout(Duration workerTimeout) {
        return new RunOptions(focus, interactive, maxIterations, workerTimeout);
    }
}
