package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a worker's input contract.
 * A field with a default never raises a missing-context error.
 */
public record FieldSpec(
    String name,
    boolean required,
    JsonNode defaultValue
) {
    public static FieldSpec required(String name) {
        return new FieldSpec(name, true, null);
    }

    public static FieldSpec optional(String name) {
        return new FieldSpec(name, false, null);
    }

    public static FieldSpec withDefault(String name, JsonNode defaultValue) {
        return new FieldSpec(name, false, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
