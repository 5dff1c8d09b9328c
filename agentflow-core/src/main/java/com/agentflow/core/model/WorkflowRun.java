package com.agentflow.core.model;

import com.agentflow.core.context.ContextBus;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single execution of a WorkflowDefinition.
 * Owned by the orchestrator for its duration; archived once terminal.
 *
 * Invariants:
 * - status transitions follow the RunStatus state machine
 * - phases keep workflow declaration order
 * - the context bus is never shared between runs
 * - sequenceNumber is monotonically increasing
 */
public record WorkflowRun(
    // Identity
    String runId,
    String workflowName,

    // Definition (reference, not owned)
    @JsonIgnore
    WorkflowDefinition definition,

    // Invocation
    String argument,
    RunOptions options,

    // State
    RunStatus status,
    @JsonIgnore
    ContextBus contextBus,
    Map<String, PhaseRecord> phases,
    List<String> phaseCursor,
    List<RunFailure> failures,
    List<FollowUp> followUps,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,

    // Versioning
    long sequenceNumber
) {
    public WorkflowRun {
        phases = phases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(phases));
        phaseCursor = phaseCursor == null ? List.of() : List.copyOf(phaseCursor);
        failures = failures == null ? List.of() : List.copyOf(failures);
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
        options = options == null ? RunOptions.defaults() : options;
    }

    /**
     * Create a new run in PENDING state with a fresh context bus.
     */
    public static WorkflowRun create(WorkflowDefinition definition, String argument, RunOptions options) {
        Map<String, PhaseRecord> phases = new LinkedHashMap<>();
        for (PhaseDefinition phase : definition.phases()) {
            phases.put(phase.phaseId(), PhaseRecord.pending(phase.phaseId()));
        }
        return new WorkflowRun(
            UUID.randomUUID().toString(),
            definition.name(),
            definition,
            argument,
            options,
            RunStatus.PENDING,
            new ContextBus(),
            phases,
            List.of(),
            List.of(),
            List.of(),
            Instant.now(),
            null,
            null,
            0L
        );
    }

    /**
     * Check if the run is in a terminal state.
     */
    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public PhaseRecord getPhase(String phaseId) {
        return phases.get(phaseId);
    }

    /**
     * Create a copy with updated status.
     *
     * @throws InvalidStateTransitionException if the state machine forbids the transition
     */
    public WorkflowRun withStatus(RunStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidStateTransitionException(status, newStatus);
        }
        Builder builder = toBuilder().status(newStatus);
        if (newStatus == RunStatus.RUNNING) {
            builder.startedAt(Instant.now());
        }
        if (newStatus.isTerminal()) {
            builder.completedAt(Instant.now()).phaseCursor(List.of());
        }
        return builder.incrementSequence().build();
    }

    /**
     * Create a copy with one phase record replaced.
     */
    public WorkflowRun withPhase(PhaseRecord record) {
        Map<String, PhaseRecord> updated = new LinkedHashMap<>(phases);
        updated.put(record.phaseId(), record);
        return toBuilder().phases(updated).incrementSequence().build();
    }

    public WorkflowRun withPhaseCursor(List<String> readyPhases) {
        return toBuilder().phaseCursor(readyPhases).incrementSequence().build();
    }

    public WorkflowRun withFailure(RunFailure failure) {
        List<RunFailure> updated = new ArrayList<>(failures);
        updated.add(failure);
        return toBuilder().failures(updated).incrementSequence().build();
    }

    public WorkflowRun withFollowUps(List<FollowUp> added) {
        if (added.isEmpty()) {
            return this;
        }
        List<FollowUp> updated = new ArrayList<>(followUps);
        updated.addAll(added);
        return toBuilder().followUps(updated).incrementSequence().build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String runId;
        private final String workflowName;
        private final WorkflowDefinition definition;
        private final String argument;
        private final RunOptions options;
        private RunStatus status;
        private final ContextBus contextBus;
        private Map<String, PhaseRecord> phases;
        private List<String> phaseCursor;
        private List<RunFailure> failures;
        private List<FollowUp> followUps;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private long sequenceNumber;

        public Builder(WorkflowRun run) {
            this.runId = run.runId();
            this.workflowName = run.workflowName();
            this.definition = run.definition();
            this.argument = run.argument();
            this.options = run.options();
            this.status = run.status();
            this.contextBus = run.contextBus();
            this.phases = run.phases();
            this.phaseCursor = run.phaseCursor();
            this.failures = run.failures();
            this.followUps = run.followUps();
            this.createdAt = run.createdAt();
            this.startedAt = run.startedAt();
            this.completedAt = run.completedAt();
            this.sequenceNumber = run.sequenceNumber();
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder phases(Map<String, PhaseRecord> phases) {
            this.phases = phases;
            return this;
        }

        public Builder phaseCursor(List<String> phaseCursor) {
            this.phaseCursor = phaseCursor;
            return this;
        }

        public Builder failures(List<RunFailure> failures) {
            this.failures = failures;
            return this;
        }

        public Builder followUps(List<FollowUp> followUps) {
            this.followUps = followUps;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder incrementSequence() {
            this.sequenceNumber++;
            return this;
        }

        public WorkflowRun build() {
            return new WorkflowRun(
                runId, workflowName, definition, argument, options, status, contextBus,
                phases, phaseCursor, failures, followUps, createdAt, startedAt, completedAt,
                sequenceNumber
            );
        }
    }
}
