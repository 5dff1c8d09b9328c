package com.agentflow.core.context;

import com.agentflow.core.exception.KeyCollisionException;
import com.agentflow.core.exception.MissingContextException;
import com.agentflow.core.model.FieldSpec;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only key/value store scoped to one workflow run.
 * The only channel through which workers exchange data.
 *
 * Thread-safety: writes are atomic per key, so parallel workers of one phase may write
 * concurrently. Two writes to the same key never both succeed.
 */
public class ContextBus {

    private final ConcurrentHashMap<ContextKey, ContextEntry> entries = new ConcurrentHashMap<>();

    // field -> most recent entry for that field, across phases and iterations
    private final ConcurrentHashMap<String, ContextEntry> latestByField = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    // ========== Writes ==========

    /**
     * Write a value under (phaseId, iteration, workerId, field).
     *
     * @throws KeyCollisionException if the key already holds a value
     */
    public ContextEntry write(String phaseId, int iteration, String workerId, String field, JsonNode value) {
        return write(new ContextKey(phaseId, iteration, workerId, field), value);
    }

    /**
     * Write a value under the given key.
     *
     * @throws KeyCollisionException if the key already holds a value
     */
    public ContextEntry write(ContextKey key, JsonNode value) {
        if (value == null) {
            throw new IllegalArgumentException("Context value cannot be null: " + key);
        }
        ContextEntry entry = new ContextEntry(key, value.deepCopy(), sequence.incrementAndGet(), Instant.now());
        ContextEntry existing = entries.putIfAbsent(key, entry);
        if (existing != null) {
            throw new KeyCollisionException(key);
        }
        latestByField.merge(key.field(), entry,
            (current, candidate) -> candidate.sequence() > current.sequence() ? candidate : current);
        return entry;
    }

    // ========== Reads ==========

    /**
     * Most recent value written for the field, across all phases and iterations.
     *
     * @throws MissingContextException if the field was never written
     */
    public JsonNode read(String field) {
        return readOptional(field).orElseThrow(() -> new MissingContextException(field));
    }

    /**
     * Read a field on behalf of a worker's input contract. The declared default applies
     * when the field was never written.
     *
     * @throws MissingContextException if the field is absent, required and has no default
     */
    public Optional<JsonNode> read(FieldSpec spec, String workerId) {
        Optional<JsonNode> value = readOptional(spec.name());
        if (value.isPresent()) {
            return value;
        }
        if (spec.hasDefault()) {
            return Optional.of(spec.defaultValue().deepCopy());
        }
        if (spec.required()) {
            throw new MissingContextException(spec.name(), workerId);
        }
        return Optional.empty();
    }

    public Optional<JsonNode> readOptional(String field) {
        ContextEntry entry = latestByField.get(field);
        return entry == null ? Optional.empty() : Optional.of(entry.value().deepCopy());
    }

    /**
     * Value stored under an exact key.
     */
    public Optional<JsonNode> get(ContextKey key) {
        ContextEntry entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value().deepCopy());
    }

    public boolean contains(String field) {
        return latestByField.containsKey(field);
    }

    public boolean containsKey(ContextKey key) {
        return entries.containsKey(key);
    }

    /**
     * Immutable most-recent-value view of every field written so far.
     */
    public ContextSnapshot snapshot() {
        Map<String, JsonNode> latest = new HashMap<>();
        latestByField.forEach((field, entry) -> latest.put(field, entry.value()));
        return new ContextSnapshot(latest);
    }

    /**
     * All writes in write order.
     */
    public List<ContextEntry> entries() {
        return entries.values().stream()
            .sorted(Comparator.comparingLong(ContextEntry::sequence))
            .map(e -> new ContextEntry(e.key(), e.value().deepCopy(), e.sequence(), e.writtenAt()))
            .toList();
    }

    /**
     * Writes made under one phase iteration, in write order.
     */
    public List<ContextEntry> entriesOf(String phaseId, int iteration) {
        return entries().stream()
            .filter(e -> e.key().phaseId().equals(phaseId) && e.key().iteration() == iteration)
            .toList();
    }

    public int size() {
        return entries.size();
    }
}
