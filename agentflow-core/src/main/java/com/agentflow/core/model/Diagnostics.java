package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Structured detail attached to a worker outcome: named counters plus individual findings.
 * Loop conditions are evaluated against it.
 *
 * Invariants:
 * - counts and entries are immutable
 * - merging never overwrites: counters are summed, entries concatenated in order
 */
public record Diagnostics(
    Map<String, Long> counts,
    List<DiagnosticEntry> entries
) {
    private static final Diagnostics EMPTY = new Diagnostics(Map.of(), List.of());

    public Diagnostics {
        counts = counts == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(counts));
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static Diagnostics empty() {
        return EMPTY;
    }

    /**
     * Get a counter value.
     * An explicit counter wins; the four severity counters fall back to counting entries.
     */
    public long count(String key) {
        Long explicit = counts.get(key);
        if (explicit != null) {
            return explicit;
        }
        Severity severity = Severity.forCountKey(key);
        if (severity == null) {
            return 0L;
        }
        return entries.stream().filter(e -> e.severity() == severity).count();
    }

    /**
     * Number of findings at or above the given severity.
     */
    public long countAtOrAbove(Severity threshold) {
        long total = 0;
        for (Severity severity : Severity.counted()) {
            if (severity.isAtLeast(threshold)) {
                total += count(severity.countKey());
            }
        }
        return total;
    }

    /**
     * Critical/high/medium/low totals, in that order.
     */
    public Map<Severity, Long> severityCounts() {
        Map<Severity, Long> result = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.counted()) {
            result.put(severity, count(severity.countKey()));
        }
        return result;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return counts.isEmpty() && entries.isEmpty();
    }

    /**
     * Combine with another diagnostics block. Counters are summed, entries concatenated.
     */
    public Diagnostics merge(Diagnostics other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        TreeSet<String> keys = new TreeSet<>(counts.keySet());
        keys.addAll(other.counts.keySet());
        for (Severity severity : Severity.counted()) {
            if (count(severity.countKey()) > 0 || other.count(severity.countKey()) > 0) {
                keys.add(severity.countKey());
            }
        }
        Map<String, Long> mergedCounts = new TreeMap<>();
        for (String key : keys) {
            mergedCounts.put(key, count(key) + other.count(key));
        }
        List<DiagnosticEntry> mergedEntries = new ArrayList<>(entries);
        mergedEntries.addAll(other.entries);
        return new Diagnostics(mergedCounts, mergedEntries);
    }

    /**
     * Merge a collection in iteration order.
     */
    public static Diagnostics mergeAll(Collection<Diagnostics> all) {
        Diagnostics result = EMPTY;
        for (Diagnostics diagnostics : all) {
            result = result.merge(diagnostics);
        }
        return result;
    }

    /**
     * Stamp entries that carry no source with the given worker id.
     */
    public Diagnostics withSource(String source) {
        if (entries.stream().allMatch(e -> e.source() != null)) {
            return this;
        }
        List<DiagnosticEntry> stamped = entries.stream()
            .map(e -> e.source() == null ? e.withSource(source) : e)
            .toList();
        return new Diagnostics(counts, stamped);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Long> counts = new TreeMap<>();
        private final List<DiagnosticEntry> entries = new ArrayList<>();

        public Builder count(String key, long value) {
            counts.put(key, value);
            return this;
        }

        public Builder count(Severity severity, long value) {
            return count(severity.countKey(), value);
        }

        public Builder entry(Severity severity, String code, String message) {
            entries.add(DiagnosticEntry.of(severity, code, message));
            return this;
        }

        public Builder entry(DiagnosticEntry entry) {
            entries.add(entry);
            return this;
        }

        public Diagnostics build() {
            return new Diagnostics(counts, entries);
        }
    }
}
