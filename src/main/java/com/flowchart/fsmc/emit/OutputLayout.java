package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.engine.Identifiers;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.model.MachineCategory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where generated artifacts go: directories on disk and Java packages.
 *
 * <p>
 * Machines, tests and demos live under {@code outputDir/<category dir>} in
 * {@code basePackage.<category segment>}; services live under
 * {@code serviceDir/<category dir>} in {@code servicePackage.<category segment>}.
 */
public record OutputLayout(String outputDir, String serviceDir, String basePackage, String servicePackage) {
    public static final String CATALOG_CLASS = "GeneratedMachines";
    public static final String MANIFEST_FILE = ".generation-manifest.json";

    public OutputLayout {
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(serviceDir, "serviceDir");
        Objects.requireNonNull(basePackage, "basePackage");
        Objects.requireNonNull(servicePackage, "servicePackage");
    }

    public String machinePackage(MachineCategory category) {
        return basePackage + "." + Identifiers.packageSegment(category.directory());
    }

    public String servicePackage(MachineCategory category) {
        return servicePackage + "." + Identifiers.packageSegment(category.directory());
    }

    /** Fully qualified name of a machine class. */
    public String machineClass(GeneratedMachine m) {
        return machinePackage(m.category()) + "." + m.className();
    }

    /** Target path of an artifact of the given kind. */
    public String path(EmitterKind kind, GeneratedMachine m) {
        String root = kind == EmitterKind.SERVICE ? serviceDir : outputDir;
        return Path.of(root, m.category().directory(), kind.fileName(m.className())).toString();
    }

    public String catalogPath() {
        return Path.of(outputDir, CATALOG_CLASS + ".java").toString();
    }

    public Path manifestPath() {
        return Path.of(outputDir, MANIFEST_FILE);
    }
}
