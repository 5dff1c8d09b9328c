package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Metadata of a capability module known to the registry.
 * Describes what the worker reads and writes, not how it works.
 *
 * Invariants:
 * - id is non-empty and unique within the registry
 * - capabilities keep their declaration order
 * - timeout, if set, is positive
 */
public record WorkerDescriptor(
    String id,
    String description,
    Set<String> capabilities,
    List<TriggerPredicate> triggerPredicates,
    List<FieldSpec> inputContract,
    List<String> outputContract,

    // Failures of critical workers fail their phase; advisory ones only degrade it
    boolean critical,

    Duration timeout,

    // Remote capability endpoint, null for in-process workers
    URI endpoint
) {
    public WorkerDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Worker id cannot be empty");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Worker timeout must be positive: " + id);
        }
        capabilities = capabilities == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        triggerPredicates = triggerPredicates == null ? List.of() : List.copyOf(triggerPredicates);
        inputContract = inputContract == null ? List.of() : List.copyOf(inputContract);
        outputContract = outputContract == null ? List.of() : List.copyOf(outputContract);
    }

    public boolean hasCapability(String tag) {
        return capabilities.contains(tag);
    }

    public boolean declaresOutput(String field) {
        return outputContract.contains(field);
    }

    public Optional<FieldSpec> inputSpec(String field) {
        return inputContract.stream().filter(f -> f.name().equals(field)).findFirst();
    }

    @JsonIgnore
    public boolean isRemote() {
        return endpoint != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String description;
        private final Set<String> capabilities = new LinkedHashSet<>();
        private final List<TriggerPredicate> triggerPredicates = new ArrayList<>();
        private final List<FieldSpec> inputContract = new ArrayList<>();
        private final List<String> outputContract = new ArrayList<>();
        private boolean critical = true;
        private Duration timeout;
        private URI endpoint;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder capabilities(String... tags) {
            Collections.addAll(this.capabilities, tags);
            return this;
        }

        public Builder capabilities(Set<String> tags) {
            this.capabilities.addAll(tags);
            return this;
        }

        public Builder trigger(TriggerPredicate predicate) {
            this.triggerPredicates.add(predicate);
            return this;
        }

        public Builder triggers(List<TriggerPredicate> predicates) {
            this.triggerPredicates.addAll(predicates);
            return this;
        }

        public Builder input(FieldSpec field) {
            this.inputContract.add(field);
            return this;
        }

        public Builder inputs(List<FieldSpec> fields) {
            this.inputContract.addAll(fields);
            return this;
        }

        public Builder outputs(String... fields) {
            Collections.addAll(this.outputContract, fields);
            return this;
        }

        public Builder outputs(List<String> fields) {
            this.outputContract.addAll(fields);
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder advisory() {
            this.critical = false;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public WorkerDescriptor build() {
            return new WorkerDescriptor(
                id, description, capabilities, triggerPredicates,
                inputContract, outputContract, critical, timeout, endpoint
            );
        }
    }
}
