package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.model.MachineCategory;

import org.junit.Test;

import java.nio.file.Path;

import static org.junit.Assert.*;

public class OutputLayoutTest {

    private final OutputLayout layout = new OutputLayout("out", "svc", "com.acme.m", "com.acme.s");

    @Test
    public void testPackages() {
        assertEquals("com.acme.m.userservices", layout.machinePackage(MachineCategory.USER));
        assertEquals("com.acme.m.userservices", layout.machinePackage(MachineCategory.ACCOUNT));
        assertEquals("com.acme.m.core", layout.machinePackage(MachineCategory.CORE));
        assertEquals("com.acme.s.information", layout.servicePackage(MachineCategory.INFO));
    }

    @Test
    public void testPaths() {
        GeneratedMachine m = EmitterFixtures.machine("ussd-menu");
        assertEquals("com.acme.m.userservices.UssdmenuMachine", layout.machineClass(m));
        assertEquals(Path.of("out", "user-services", "UssdmenuMachine.java").toString(),
                layout.path(EmitterKind.MACHINE, m));
        assertEquals(Path.of("out", "user-services", "UssdmenuMachineTransitionsTest.java").toString(),
                layout.path(EmitterKind.TRANSITION_TEST, m));
        assertEquals(Path.of("svc", "user-services", "UssdmenuMachineService.java").toString(),
                layout.path(EmitterKind.SERVICE, m));
        assertEquals(Path.of("out", "GeneratedMachines.java").toString(), layout.catalogPath());
        assertEquals(Path.of("out", ".generation-manifest.json"), layout.manifestPath());
    }

    @Test(expected = NullPointerException.class)
    public void testRequiresDirectories() {
        new OutputLayout(null, "svc", "a", "b");
    }
}
