package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.engine.SemanticGenerator;
import com.flowchart.fsmc.io.DiagramParser;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.model.ParsedMachine;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** Machines built from the diagrams under {@code src/test/resources/diagrams}. */
final class EmitterFixtures {
    static final OutputLayout LAYOUT = new OutputLayout("generated/machines", "generated/services",
            "com.flowchart.generated.machines", "com.flowchart.generated.services");

    private EmitterFixtures() {
    }

    static String diagram(String name) {
        try (InputStream in = EmitterFixtures.class.getResourceAsStream("/diagrams/" + name + ".md")) {
            if (in == null)
                throw new IllegalArgumentException("Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Every machine of a fixture diagram, in block order. */
    static List<GeneratedMachine> machines(String name) {
        return fromText(diagram(name), name);
    }

    static GeneratedMachine machine(String name) {
        return machines(name).get(0);
    }

    static List<GeneratedMachine> fromText(String text, String sourceName) {
        SemanticGenerator generator = new SemanticGenerator();
        List<GeneratedMachine> out = new ArrayList<>();
        for (ParsedMachine pm : new DiagramParser().parse(text, sourceName).machines())
            out.add(generator.generate(pm));
        return out;
    }

    static GeneratedMachine single(String text) {
        return fromText(text, "sample").get(0);
    }
}
