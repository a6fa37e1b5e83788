package com.flowchart.fsmc.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Explicit accumulator for {@link Diagnostic}s.
 *
 * <p>
 * Every stage that can report problems takes a {@code Diagnostics} argument
 * instead of keeping findings in its own fields, so a single parser or
 * validator instance is safe to reuse across inputs. Insertion order is kept.
 */
public final class Diagnostics {
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics add(Diagnostic diagnostic) {
        entries.add(diagnostic);
        return this;
    }

    public Diagnostics addAll(Collection<Diagnostic> diagnostics) {
        entries.addAll(diagnostics);
        return this;
    }

    public Diagnostics error(String kind, String message, Integer line, String suggestion) {
        return add(Diagnostic.error(kind, message, line, suggestion));
    }

    public Diagnostics error(String kind, String message, Integer line) {
        return error(kind, message, line, null);
    }

    public Diagnostics warning(String kind, String message, Integer line, String suggestion) {
        return add(Diagnostic.warning(kind, message, line, suggestion));
    }

    public Diagnostics warning(String kind, String message, Integer line) {
        return warning(kind, message, line, null);
    }

    public boolean hasErrors() {
        for (Diagnostic d : entries)
            if (d.isError())
                return true;
        return false;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<Diagnostic> errors() {
        return entries.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return entries.stream().filter(d -> !d.isError()).toList();
    }

    /** Immutable snapshot in insertion order. */
    public List<Diagnostic> toList() {
        return List.copyOf(entries);
    }

    @Override
    public String toString() {
        return "Diagnostics[errors=" + errors().size() + ", warnings=" + warnings().size() + "]";
    }
}
