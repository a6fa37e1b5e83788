package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.ir.GeneratedMachine;

import org.junit.Test;

import static org.junit.Assert.*;

public class TransitionTestEmitterTest {

    private final TransitionTestEmitter emitter = new TransitionTestEmitter(EmitterFixtures.LAYOUT);

    @Test
    public void testOneTestPerFiringTransition() {
        String src = emitter.render(EmitterFixtures.machine("ussd-menu"));

        assertTrue(src.contains("public class UssdmenuMachineTransitionsTest {"));
        assertTrue(src.contains("public void transition01_Start_Unknown()"));
        assertTrue(src.contains("public void transition02_Login_VerifyPin()"));
        assertTrue(src.contains("public void transition07_Balance_Back()"));
        assertFalse(src.contains("transition08_"));
        assertTrue(src.contains("assertTrue(machine.trace().contains(\"enter:MainMenu\"));"));
    }

    @Test
    public void testFinalStatesAndPaths() {
        String src = emitter.render(EmitterFixtures.machine("ussd-menu"));

        assertTrue(src.contains("public void finalStateDoneIgnoresEvents()"));
        assertTrue(src.contains("public void pathToDone()"));
        int path = src.indexOf("public void pathToDone()");
        String body = src.substring(path, src.indexOf("}\n", path));
        int unknown = body.indexOf("EventType.UNKNOWN");
        int verify = body.indexOf("EventType.VERIFY_PIN");
        int exit = body.indexOf("EventType.EXIT");
        assertTrue(unknown > 0 && unknown < verify && verify < exit);
        assertTrue(body.contains("assertTrue(machine.isDone());"));
    }

    @Test
    public void testRegistrationAndReachability() {
        String src = emitter.render(EmitterFixtures.machine("ussd-menu"));
        assertTrue(src.contains("machine.withGuard(\"unusedGuard\""));
        assertTrue(src.contains(".withAction(\"logStateEntry\", (context, event) -> calls[0]++)"));
        assertTrue(src.contains("assertEquals(6, seen.size());"));
    }

    @Test
    public void testGuardRejection() {
        GeneratedMachine m = EmitterFixtures.single("flowchart TD\nStart -->|PAY guard:hasFunds| Paid((Paid))");
        String src = emitter.render(m);
        assertTrue(src.contains("public void guardRejectsStartPay()"));
        assertTrue(src.contains(".withGuard(\"hasFunds\", (context, event) -> false)"));
        assertTrue(src.contains("machine.withGuard(\"hasFunds\", (context, event) -> {"));
    }

    @Test
    public void testDeadEndAndUnreachable() {
        GeneratedMachine m = EmitterFixtures.single("flowchart TD\nStart -->|GO| Stuck\nIsland --> Start");
        String src = emitter.render(m);
        assertTrue(src.contains("public void deadEndStuckIgnoresEvents()"));
        assertFalse(src.contains("pathToIsland"));
        assertTrue(src.contains("assertEquals(2, seen.size());"));
    }

    @Test
    public void testShadowedRowsAreSkipped() {
        // Second GO row from Start can never fire
        GeneratedMachine m = EmitterFixtures.single("flowchart TD\nStart -->|GO| A\nStart -->|GO| B");
        String src = emitter.render(m);
        assertTrue(src.contains("transition01_Start_Go()"));
        assertFalse(src.contains("transition02_"));
        assertFalse(src.contains("pathToB"));
    }
}
