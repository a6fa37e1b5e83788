package com.flowchart.fsmc.engine;

import org.junit.Test;

import static org.junit.Assert.*;

public class IdentifiersTest {

    private static final String[] RAW_IDS = {
            "login", "Login-Flow", "user_menu", "2fa", "Machine", "loginMachine", "", "   ", "!!!",
            "über-menü", "a b c", "agentMachineMachine", "9", "_", "ussd-2" };

    @Test
    public void testMachineId() {
        assertEquals("loginMachine", Identifiers.machineId("login"));
        assertEquals("loginflowMachine", Identifiers.machineId("Login-Flow"));
        assertEquals("_2faMachine", Identifiers.machineId("2fa"));
        assertEquals("loginMachine", Identifiers.machineId("loginMachine"));
        assertEquals("Machine", Identifiers.machineId(""));
        assertEquals("Machine", Identifiers.machineId(null));
    }

    @Test
    public void testMachineIdIsIdempotentAndValid() {
        for (String raw : RAW_IDS) {
            String id = Identifiers.machineId(raw);
            assertFalse(raw, id.isEmpty());
            char first = id.charAt(0);
            assertTrue(raw, Character.isLetter(first) || first == '_');
            assertEquals(raw, id, Identifiers.machineId(id));
        }
    }

    @Test
    public void testClassNameAndDisplayName() {
        assertEquals("LoginMachine", Identifiers.className("loginMachine"));
        assertEquals("Ussd Main Menu", Identifiers.displayName("ussd-main_MENU"));
        assertEquals("Ussd 2", Identifiers.displayName("ussd-2"));
        assertEquals("", Identifiers.displayName("  "));
    }

    @Test
    public void testStateNames() {
        assertTrue(Identifiers.isValidStateName("Start"));
        assertTrue(Identifiers.isValidStateName("main-menu_2"));
        assertFalse(Identifiers.isValidStateName("1bad"));
        assertFalse(Identifiers.isValidStateName("_hidden"));
        assertFalse(Identifiers.isValidStateName(""));
        assertFalse(Identifiers.isValidStateName(null));
    }

    @Test
    public void testEventType() {
        assertEquals("SELECT_OPTION", Identifiers.eventType("select option"));
        assertEquals("PIN_OK", Identifiers.eventType("  pin -- ok! "));
        assertEquals("SUBMIT", Identifiers.eventType("submit guard:isValid do:save"));
        assertEquals("", Identifiers.eventType("guard:isAdult do:logAccess"));
        assertEquals("", Identifiers.eventType(null));
    }

    @Test
    public void testJavaConstant() {
        assertEquals("MainMenu", Identifiers.javaConstant("MainMenu"));
        assertEquals("main_menu", Identifiers.javaConstant("main-menu"));
        assertEquals("_1", Identifiers.javaConstant("1"));
        assertEquals("__", Identifiers.javaConstant(""));
        assertEquals("class_", Identifiers.javaConstant("class"));
        assertEquals("__", Identifiers.javaConstant("_"));
    }

    @Test
    public void testConditionalGuardAndPackageSegment() {
        assertEquals("isConfirmValid", Identifiers.conditionalGuard("is", "CONFIRM"));
        assertEquals("Valid", Identifiers.conditionalGuard(null, null));
        assertEquals("userservices", Identifiers.packageSegment("user-services"));
        assertEquals("core", Identifiers.packageSegment("core"));
    }
}
