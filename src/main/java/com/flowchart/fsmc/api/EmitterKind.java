package com.flowchart.fsmc.api;

import java.util.Locale;

/** The closed set of per-machine artifacts the compiler can emit. */
public enum EmitterKind {
    MACHINE(ArtifactKind.MACHINE, ""),
    SMOKE_TEST(ArtifactKind.TEST, "Test"),
    TRANSITION_TEST(ArtifactKind.TEST, "TransitionsTest"),
    ERROR_TEST(ArtifactKind.TEST, "ErrorsTest"),
    DEMO(ArtifactKind.DEMO, "Demo"),
    SERVICE(ArtifactKind.SERVICE, "Service");

    private final ArtifactKind artifactKind;
    private final String suffix;

    EmitterKind(ArtifactKind artifactKind, String suffix) {
        this.artifactKind = artifactKind;
        this.suffix = suffix;
    }

    public ArtifactKind artifactKind() {
        return artifactKind;
    }

    /** Java type name of the artifact for a machine class: {@code LoginMachine -> LoginMachineTest}. */
    public String typeName(String machineClassName) {
        return machineClassName + suffix;
    }

    public String fileName(String machineClassName) {
        return typeName(machineClassName) + ".java";
    }

    public static EmitterKind fromString(String name) {
        if (name == null)
            throw new IllegalArgumentException("Emitter kind must not be null");
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
