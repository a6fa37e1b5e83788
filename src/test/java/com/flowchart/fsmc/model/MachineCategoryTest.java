package com.flowchart.fsmc.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class MachineCategoryTest {

    @Test
    public void testFromString() {
        assertEquals(MachineCategory.USER, MachineCategory.fromString("user"));
        assertEquals(MachineCategory.AGENT, MachineCategory.fromString(" Agent-Machine "));
        assertNull(MachineCategory.fromString("billing"));
        assertNull(MachineCategory.fromString(null));
    }

    @Test
    public void testFromTagRequiresSuffix() {
        assertEquals(MachineCategory.CORE, MachineCategory.fromTag("core-machine"));
        assertNull(MachineCategory.fromTag("core"));
        assertNull(MachineCategory.fromTag("highlight"));
    }

    @Test
    public void testTagAndDirectory() {
        for (MachineCategory c : MachineCategory.values())
            assertEquals(c, MachineCategory.fromTag(c.tag()));
        assertEquals("user-services", MachineCategory.USER.directory());
        assertEquals("user-services", MachineCategory.ACCOUNT.directory());
        assertEquals("information", MachineCategory.INFO.directory());
    }
}
