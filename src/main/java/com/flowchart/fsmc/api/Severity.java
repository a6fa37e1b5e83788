package com.flowchart.fsmc.api;

import java.util.Locale;

/** Severity of a {@link Diagnostic}. Warnings never block emission. */
public enum Severity {
    ERROR,
    WARNING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
