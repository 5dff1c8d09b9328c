package com.agentflow.core.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Condition over an incoming event that selects a worker without explicit naming.
 * Matches when the event kind is equal and the pattern is found in the chosen payload field
 * (or in the whole payload when no field is named).
 */
public record TriggerPredicate(
    EventKind eventKind,
    String field,
    @JsonSerialize(using = ToStringSerializer.class)
    Pattern pattern,
    TriggerMode mode
) {
    public TriggerPredicate {
        Objects.requireNonNull(eventKind, "eventKind");
        Objects.requireNonNull(pattern, "pattern");
        if (mode == null) {
            mode = TriggerMode.AUTOMATIC;
        }
    }

    public static TriggerPredicate on(EventKind eventKind, String regex) {
        return new TriggerPredicate(eventKind, null, Pattern.compile(regex), TriggerMode.AUTOMATIC);
    }

    public static TriggerPredicate on(EventKind eventKind, String field, String regex) {
        return new TriggerPredicate(eventKind, field, Pattern.compile(regex), TriggerMode.AUTOMATIC);
    }

    /**
     * Copy of this predicate that only proposes the worker.
     */
    public TriggerPredicate requiringConfirmation() {
        return new TriggerPredicate(eventKind, field, pattern, TriggerMode.CONFIRM);
    }

    public boolean matches(Event event) {
        if (event.kind() != eventKind) {
            return false;
        }
        String text = field == null ? event.payloadText() : event.payloadField(field);
        return text != null && pattern.matcher(text).find();
    }

    public String describe() {
        return eventKind + (field != null ? "[" + field + "]" : "") + " ~ /" + pattern.pattern() + "/";
    }

    // Pattern has identity equality; compare by source text instead.
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TriggerPredicate other)) {
            return false;
        }
        return eventKind == other.eventKind
            && Objects.equals(field, other.field)
            && pattern.pattern().equals(other.pattern.pattern())
            && pattern.flags() == other.pattern.flags()
            && mode == other.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventKind, field, pattern.pattern(), pattern.flags(), mode);
    }

    @Override
    public String toString() {
        return describe() + " (" + mode + ")";
    }
}
