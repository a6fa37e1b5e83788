package com.flowchart.fsmc.api;

import java.util.Objects;

/**
 * A single finding produced by the parser, the validators or the orchestrator.
 *
 * <p>
 * The shape is shared by every stage so callers can merge and report them
 * uniformly. {@code kind} is a short stable title ("Invalid state name",
 * "Dead-end state") that tests and CI gates can match on; {@code message} is
 * the human readable detail.
 *
 * @param kind       short title of the finding
 * @param message    detail text
 * @param line       1-based source line, or {@code null} when not line-bound
 * @param severity   error or warning
 * @param suggestion optional remediation hint, may be {@code null}
 */
public record Diagnostic(String kind, String message, Integer line, Severity severity, String suggestion) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
    }

    public static Diagnostic error(String kind, String message, Integer line, String suggestion) {
        return new Diagnostic(kind, message, line, Severity.ERROR, suggestion);
    }

    public static Diagnostic warning(String kind, String message, Integer line, String suggestion) {
        return new Diagnostic(kind, message, line, Severity.WARNING, suggestion);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** Returns a copy with the severity replaced. */
    public Diagnostic withSeverity(Severity newSeverity) {
        return new Diagnostic(kind, message, line, newSeverity, suggestion);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(96);
        sb.append(severity.label()).append(": ").append(kind).append(" - ").append(message);
        if (line != null)
            sb.append(" (line ").append(line).append(')');
        if (suggestion != null)
            sb.append(" [").append(suggestion).append(']');
        return sb.toString();
    }
}
