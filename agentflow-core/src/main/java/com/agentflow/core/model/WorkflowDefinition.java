package com.agentflow.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Declarative definition of a named workflow: an ordered list of phases plus ordering edges.
 * Instantiated per invocation as a {@link WorkflowRun}.
 *
 * Invariants:
 * - phase ids are unique
 * - every dependency target exists
 * - the dependency graph is acyclic; loops exist only as bounded phase re-entries
 */
public record WorkflowDefinition(
    String name,
    String description,
    List<PhaseDefinition> phases,
    Map<String, String> labels,
    Instant createdAt
) {
    public WorkflowDefinition {
        phases = phases == null ? List.of() : List.copyOf(phases);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    /**
     * Get a phase definition by ID.
     */
    public PhaseDefinition getPhase(String phaseId) {
        return phases.stream()
            .filter(p -> p.phaseId().equals(phaseId))
            .findFirst()
            .orElse(null);
    }

    public List<String> phaseIds() {
        return phases.stream().map(PhaseDefinition::phaseId).toList();
    }

    /**
     * Resolve the ordering edges into a phase.
     * Phases without explicit dependencies follow the phase declared before them.
     */
    public List<String> dependenciesOf(String phaseId) {
        for (int i = 0; i < phases.size(); i++) {
            PhaseDefinition phase = phases.get(i);
            if (phase.phaseId().equals(phaseId)) {
                if (phase.hasExplicitDependencies()) {
                    return phase.dependsOn();
                }
                return i == 0 ? List.of() : List.of(phases.get(i - 1).phaseId());
            }
        }
        return List.of();
    }

    /**
     * Phases that list the given phase among their dependencies, in declaration order.
     */
    public List<String> successorsOf(String phaseId) {
        List<String> successors = new ArrayList<>();
        for (PhaseDefinition phase : phases) {
            if (dependenciesOf(phase.phaseId()).contains(phaseId)) {
                successors.add(phase.phaseId());
            }
        }
        return successors;
    }

    /**
     * Upper bound on phase executions for one run: the sum of all iteration caps.
     */
    public int maxPhaseExecutions(RunOptions options) {
        return phases.stream().mapToInt(p -> p.effectiveMaxIterations(options)).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private final List<PhaseDefinition> phases = new ArrayList<>();
        private Map<String, String> labels = Map.of();
        private Instant createdAt = Instant.now();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder phase(PhaseDefinition phase) {
            this.phases.add(phase);
            return this;
        }

        public Builder phases(List<PhaseDefinition> phases) {
            this.phases.addAll(phases);
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(name, description, phases, labels, createdAt);
        }
    }
}
