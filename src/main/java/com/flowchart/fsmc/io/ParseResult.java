package com.flowchart.fsmc.io;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.model.ParsedMachine;

import java.util.List;

/**
 * Outcome of parsing one diagram source.
 *
 * @param sourceName   file name or caller-supplied name
 * @param machines     machines in block order
 * @param diagnostics  findings in source order
 * @param lineCount    number of lines in the source text
 * @param lastModified file modification time in epoch millis, or {@code 0} for in-memory text
 */
public record ParseResult(String sourceName, List<ParsedMachine> machines, List<Diagnostic> diagnostics,
        int lineCount, long lastModified) {

    public ParseResult {
        machines = List.copyOf(machines);
        diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
