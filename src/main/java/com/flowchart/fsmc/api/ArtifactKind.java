package com.flowchart.fsmc.api;

import java.util.Locale;

/** Kind of a generated artifact as seen by the file-writing collaborator. */
public enum ArtifactKind {
    MACHINE,
    TEST,
    DEMO,
    SERVICE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
