package com.agentflow.core.context;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable most-recent-value view of a context bus, handed to workers.
 */
public final class ContextSnapshot {

    private static final ContextSnapshot EMPTY = new ContextSnapshot(Map.of());

    private final Map<String, JsonNode> values;

    public ContextSnapshot(Map<String, JsonNode> values) {
        Map<String, JsonNode> copy = new TreeMap<>();
        values.forEach((field, value) -> copy.put(field, value.deepCopy()));
        this.values = Collections.unmodifiableMap(copy);
    }

    public static ContextSnapshot empty() {
        return EMPTY;
    }

    public Optional<JsonNode> get(String field) {
        JsonNode value = values.get(field);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    public Set<String> fields() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * Deep copies of all values, keyed by field name in sorted order.
     */
    public Map<String, JsonNode> asMap() {
        Map<String, JsonNode> copy = new TreeMap<>();
        values.forEach((field, value) -> copy.put(field, value.deepCopy()));
        return copy;
    }

    @Override
    public String toString() {
        return "ContextSnapshot" + values.keySet();
    }
}
