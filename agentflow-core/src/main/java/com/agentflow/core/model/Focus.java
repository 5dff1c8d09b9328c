package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Locale;

/**
 * Invocation option that narrows which workers a phase dispatches.
 * A worker matches when one of its capability tags equals the focus tag
 * or starts with it followed by a dash ("security" matches "security-review").
 */
public enum Focus {
    SECURITY,
    PERFORMANCE,
    QUALITY;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean matches(Collection<String> capabilities) {
        String tag = tag();
        for (String capability : capabilities) {
            if (capability.equals(tag) || capability.startsWith(tag + "-")) {
                return true;
            }
        }
        return false;
    }

    @JsonCreator
    public static Focus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Focus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
