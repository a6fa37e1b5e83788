package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.ArtifactKind;
import com.flowchart.fsmc.api.GeneratedFile;
import com.flowchart.fsmc.ir.GeneratedMachine;

import org.junit.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class MachineCatalogEmitterTest {

    private final MachineCatalogEmitter emitter = new MachineCatalogEmitter(EmitterFixtures.LAYOUT);

    @Test
    public void testEntriesSortedById() {
        List<GeneratedMachine> machines = new ArrayList<>(EmitterFixtures.machines("agent-two-blocks"));
        machines.add(EmitterFixtures.machine("ussd-menu"));
        String src = emitter.render(machines);

        assertTrue(src.startsWith("// Generated machine index (3 machines)."));
        assertTrue(src.contains("package com.flowchart.generated.machines;"));
        int second = src.indexOf("factories.put(\"agenttwoblocks2Machine\", "
                + "com.flowchart.generated.machines.agent.Agenttwoblocks2Machine::new);");
        int first = src.indexOf("factories.put(\"agenttwoblocksMachine\", "
                + "com.flowchart.generated.machines.agent.AgenttwoblocksMachine::new);");
        int ussd = src.indexOf("factories.put(\"ussdmenuMachine\", "
                + "com.flowchart.generated.machines.userservices.UssdmenuMachine::new);");
        assertTrue(second > 0);
        assertTrue(second < first);
        assertTrue(first < ussd);
    }

    @Test
    public void testDuplicateIdsCollapse() {
        GeneratedMachine m = EmitterFixtures.machine("ussd-menu");
        String src = emitter.render(List.of(m, EmitterFixtures.machine("ussd-menu")));
        assertTrue(src.startsWith("// Generated machine index (1 machines)."));
        assertEquals(src.indexOf("factories.put("), src.lastIndexOf("factories.put("));
    }

    @Test
    public void testFile() {
        GeneratedFile file = emitter.file(List.of());
        assertEquals(Path.of("generated/machines", "GeneratedMachines.java").toString(), file.path());
        assertEquals(ArtifactKind.MACHINE, file.kind());
        assertTrue(file.content().contains("public final class GeneratedMachines {"));
        assertFalse(file.content().contains("factories.put("));
    }
}
