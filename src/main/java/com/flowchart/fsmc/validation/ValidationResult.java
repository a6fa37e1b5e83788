package com.flowchart.fsmc.validation;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.Diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Scored outcome of a validator run. A result is valid when it has no errors;
 * warnings do not affect validity.
 */
public record ValidationResult(List<Diagnostic> errors, List<Diagnostic> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(Diagnostics diagnostics) {
        return new ValidationResult(diagnostics.errors(), diagnostics.warnings());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public int warningCount() {
        return warnings.size();
    }

    public int totalIssues() {
        return errors.size() + warnings.size();
    }

    /** Errors followed by warnings. */
    public List<Diagnostic> all() {
        List<Diagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }

    /** Returns the diagnostics of the given kind. */
    public List<Diagnostic> ofKind(String kind) {
        return all().stream().filter(d -> d.kind().equals(kind)).toList();
    }
}
