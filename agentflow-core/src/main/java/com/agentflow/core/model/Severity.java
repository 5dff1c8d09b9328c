package com.agentflow.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Severity of a diagnostic entry, most severe first.
 */
public enum Severity {
    CRITICAL("criticalCount"),
    HIGH("highCount"),
    MEDIUM("mediumCount"),
    LOW("lowCount"),
    INFO(null);

    private static final List<Severity> COUNTED = List.of(CRITICAL, HIGH, MEDIUM, LOW);

    private final String countKey;

    Severity(String countKey) {
        this.countKey = countKey;
    }

    /**
     * Name of the diagnostics counter for this severity, or null for INFO.
     */
    public String countKey() {
        return countKey;
    }

    /**
     * Lower-case name used in reports ("critical", "high", ...).
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }

    /**
     * The severities reported in run summaries (critical, high, medium, low).
     */
    public static List<Severity> counted() {
        return COUNTED;
    }

    /**
     * Resolve a counter name such as "criticalCount" back to its severity.
     *
     * @return The severity, or null if the key is not a severity counter
     */
    public static Severity forCountKey(String key) {
        for (Severity severity : COUNTED) {
            if (severity.countKey.equals(key)) {
                return severity;
            }
        }
        return null;
    }
}
