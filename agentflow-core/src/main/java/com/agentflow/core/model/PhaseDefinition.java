package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a workflow graph: a set of worker invocations with a dispatch policy.
 *
 * Invariants:
 * - phaseId is non-empty and unique within the workflow
 * - workers is non-empty; entries are worker ids or "capability:&lt;tag&gt;" references
 * - maxIterations >= 1; a phase without loopUntil runs exactly once
 * - dependsOn == null means "depends on the phase declared before this one"
 */
public record PhaseDefinition(
    String phaseId,
    String description,
    List<String> workers,
    boolean parallel,
    LoopCondition loopUntil,
    int maxIterations,
    List<String> dependsOn
) {
    public static final String CAPABILITY_PREFIX = "capability:";

    public PhaseDefinition {
        workers = workers == null ? List.of() : List.copyOf(workers);
        dependsOn = dependsOn == null ? null : List.copyOf(dependsOn);
    }

    @JsonIgnore
    public boolean isLooping() {
        return loopUntil != null;
    }

    /**
     * Iteration cap for one run, honoring the run-level override for looping phases.
     */
    public int effectiveMaxIterations(RunOptions options) {
        if (!isLooping()) {
            return 1;
        }
        if (options != null && options.maxIterations() != null) {
            return options.maxIterations();
        }
        return maxIterations;
    }

    public boolean hasExplicitDependencies() {
        return dependsOn != null;
    }

    public static boolean isCapabilityReference(String reference) {
        return reference.startsWith(CAPABILITY_PREFIX);
    }

    public static String capabilityOf(String reference) {
        return reference.substring(CAPABILITY_PREFIX.length());
    }

    public static Builder builder(String phaseId) {
        return new Builder().phaseId(phaseId);
    }

    public static class Builder {
        private String phaseId;
        private String description;
        private final List<String> workers = new ArrayList<>();
        private boolean parallel;
        private LoopCondition loopUntil;
        private int maxIterations = 1;
        private List<String> dependsOn;

        public Builder phaseId(String phaseId) {
            this.phaseId = phaseId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder workers(String... workerRefs) {
            Collections.addAll(this.workers, workerRefs);
            return this;
        }

        public Builder workers(List<String> workerRefs) {
            this.workers.addAll(workerRefs);
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder loopUntil(LoopCondition loopUntil, int maxIterations) {
            this.loopUntil = loopUntil;
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder loopUntil(LoopCondition loopUntil) {
            this.loopUntil = loopUntil;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder dependsOn(String... phaseIds) {
            this.dependsOn = List.of(phaseIds);
            return this;
        }

        public Builder dependsOn(List<String> phaseIds) {
            this.dependsOn = phaseIds;
            return this;
        }

        public PhaseDefinition build() {
            return new PhaseDefinition(
                phaseId, description, workers, parallel, loopUntil, maxIterations, dependsOn
            );
        }
    }
}
