package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.ArtifactKind;
import com.flowchart.fsmc.api.GeneratedFile;
import com.flowchart.fsmc.ir.GeneratedMachine;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Renders {@code GeneratedMachines}, the index of every machine in a batch,
 * keyed by machine id. Machine classes are referenced by fully qualified name
 * since two categories may hold classes with the same simple name.
 */
public final class MachineCatalogEmitter {
    private final OutputLayout layout;

    public MachineCatalogEmitter(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public GeneratedFile file(List<GeneratedMachine> machines) {
        return GeneratedFile.of(layout.catalogPath(), ArtifactKind.MACHINE, render(machines));
    }

    public String render(List<GeneratedMachine> machines) {
        // last definition of an id wins, output sorted by id
        Map<String, GeneratedMachine> byId = new TreeMap<>(Comparator.naturalOrder());
        for (GeneratedMachine m : machines)
            byId.put(m.id(), m);

        CodeWriter w = new CodeWriter();
        w.line("// Generated machine index (" + byId.size() + " machines).");
        w.line("// Do not edit: regenerate from the diagrams instead.");
        w.line("package " + layout.basePackage() + ";").line();
        w.line("import java.util.Collections;");
        w.line("import java.util.LinkedHashMap;");
        w.line("import java.util.Map;");
        w.line("import java.util.Set;");
        w.line("import java.util.function.Supplier;").line();
        w.doc("Factories of every generated machine, keyed by machine id.");
        w.open("public final class " + OutputLayout.CATALOG_CLASS);
        w.line("private static final Map<String, Supplier<Object>> FACTORIES;");
        w.line();
        w.open("static");
        w.line("Map<String, Supplier<Object>> factories = new LinkedHashMap<>();");
        for (GeneratedMachine m : byId.values())
            w.line("factories.put(" + CodeWriter.quote(m.id()) + ", " + layout.machineClass(m) + "::new);");
        w.line("FACTORIES = Collections.unmodifiableMap(factories);");
        w.close();
        w.line();
        w.open("private " + OutputLayout.CATALOG_CLASS + "()");
        w.close();
        w.line();
        w.open("public static Map<String, Supplier<Object>> factories()");
        w.line("return FACTORIES;");
        w.close();
        w.line();
        w.open("public static Set<String> ids()");
        w.line("return FACTORIES.keySet();");
        w.close();
        w.line();
        w.doc("Creates a machine by id.");
        w.open("public static Object create(String id)");
        w.line("Supplier<Object> factory = FACTORIES.get(id);");
        w.line("if (factory == null)");
        w.line("    throw new IllegalArgumentException(\"Unknown machine: \" + id);");
        w.line("return factory.get();");
        w.close();
        w.close();
        return w.toString();
    }
}
