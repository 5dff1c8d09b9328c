package com.agentflow.core.model;

/**
 * A single finding reported by a worker.
 *
 * @param source Id of the worker that reported it
 */
public record DiagnosticEntry(
    Severity severity,
    String code,
    String message,
    String source
) {
    public static DiagnosticEntry of(Severity severity, String code, String message) {
        return new DiagnosticEntry(severity, code, message, null);
    }

    public DiagnosticEntry withSource(String source) {
        return new DiagnosticEntry(severity, code, message, source);
    }
}
