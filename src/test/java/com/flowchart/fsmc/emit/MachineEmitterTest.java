package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.ir.GeneratedMachine;

import org.junit.Test;

import static org.junit.Assert.*;

public class MachineEmitterTest {

    private final MachineEmitter emitter = new MachineEmitter(EmitterFixtures.LAYOUT);

    @Test
    public void testRenderIsIdempotent() {
        GeneratedMachine m = EmitterFixtures.machine("ussd-menu");
        String first = emitter.render(m);
        assertEquals(first, emitter.render(m));
        assertEquals(first, new MachineEmitter(EmitterFixtures.LAYOUT).render(EmitterFixtures.machine("ussd-menu")));
        assertEquals(EmitterKind.MACHINE, emitter.kind());
    }

    @Test
    public void testUserMachine() {
        String src = emitter.render(EmitterFixtures.machine("ussd-menu"));

        assertTrue(src.startsWith("// Generated state machine for \"Ussd Menu\" (ussdmenuMachine)."));
        assertTrue(src.contains("package com.flowchart.generated.machines.userservices;"));
        assertTrue(src.contains("import java.util.regex.Pattern;"));
        assertTrue(src.contains("public final class UssdmenuMachine {"));
        assertTrue(src.contains("public static final String MACHINE_ID = \"ussdmenuMachine\";"));
        assertTrue(src.contains("public static final String CATEGORY = \"user\";"));
        assertTrue(src.contains("public static final State INITIAL_STATE = State.Start;"));
        assertTrue(src.contains("private static final Pattern PHONE_NUMBER"));

        assertTrue(src.contains("MainMenu(\"MainMenu\", false),"));
        assertTrue(src.contains("Done(\"Done\", true);"));
        assertTrue(src.contains("VERIFY_PIN(\"VERIFY_PIN\", \"data\"),"));
        assertTrue(src.contains("SELECT_BALANCE(\"SELECT_BALANCE\", \"input\"),"));
        assertTrue(src.contains("UNKNOWN(\"UNKNOWN\");"));

        assertTrue(src.contains("private String phoneNumber = \"\";"));
        assertTrue(src.contains("private int currentStep = 1;"));
        assertTrue(src.contains("private String error = null;"));
        assertTrue(src.contains("private String userInput = \"\";"));
        assertTrue(src.contains("context.setCurrentStep(context.getCurrentStep() + 1);"));

        assertTrue(src.contains("new Transition(EventType.UNKNOWN, State.Login, null, List.of())"));
        assertTrue(src.contains("ENTRY_ACTIONS.put(State.Login, List.of(\"logStateEntry\", \"validateUserSession\"));"));
        assertTrue(src.contains("EXIT_ACTIONS.put(State.Done, List.of(\"cleanupSession\"));"));
        assertTrue(src.contains("actions.put(\"validateUserSession\", (ctx, event) -> {"));
        assertTrue(src.contains("ctx.setError(\"Invalid phone number\");"));
    }

    @Test
    public void testCoreMachine() {
        String src = emitter.render(EmitterFixtures.machine("core-router"));
        assertTrue(src.contains("package com.flowchart.generated.machines.core;"));
        assertTrue(src.contains("public static final State INITIAL_STATE = State.Idle;"));
        assertTrue(src.contains("private String route = \"\";"));
        assertFalse(src.contains("PHONE_NUMBER"));
        assertFalse(src.contains("import java.util.regex.Pattern;"));
    }

    @Test
    public void testAgentMachine() {
        String src = emitter.render(EmitterFixtures.machine("agent-two-blocks"));
        assertTrue(src.contains("private boolean agentVerified = false;"));
        assertTrue(src.contains("ctx.setAgentVerified(ctx.getAgentId() != null && !ctx.getAgentId().isEmpty());"));
    }

    @Test
    public void testGuardAndActionAnnotations() {
        String src = emitter.render(EmitterFixtures.single(
                "flowchart TD\nStart -->|SUBMIT guard:isAdult do:logAccess| Granted((Granted))"));
        assertTrue(src.contains("new Transition(EventType.SUBMIT, State.Granted, \"isAdult\", List.of(\"logAccess\"))"));
        assertTrue(src.contains("guards.put(\"isAdult\", (ctx, event) -> true);"));
        assertTrue(src.contains("actions.put(\"logAccess\", (ctx, event) -> trace.add(\"action:logAccess\"));"));
        assertTrue(src.contains("public static final List<String> GUARDS = List.of(\"isAdult\");"));
    }

    @Test
    public void testStateSymbolsAreValidAndUnique() {
        String src = emitter.render(EmitterFixtures.single(
                "flowchart TD\nStart --> my-state\nmy-state --> my_state\nmy_state --> class"));
        assertTrue(src.contains("my_state(\"my-state\", false),"));
        assertTrue(src.contains("my_state_2(\"my_state\", false),"));
        assertTrue(src.contains("class_(\"class\", false);"));
    }

    @Test
    public void testStatesNamedLikeEnumFields() {
        String src = emitter.render(EmitterFixtures.single(
                "flowchart TD\nStart -->|GO| id\nid -->|NEXT| terminal\nterminal --> stateId"));
        assertTrue(src.contains("id(\"id\", false),"));
        assertTrue(src.contains("terminal(\"terminal\", false),"));
        assertTrue(src.contains("stateId_2(\"stateId\", false);"));
        assertTrue(src.contains("private final String stateId;"));
        assertTrue(src.contains("private final boolean finalState;"));
        assertFalse(src.contains("private final String id;"));
        assertFalse(src.contains("private final boolean terminal;"));
    }

    @Test
    public void testEmptyEventCatalog() {
        String src = emitter.render(EmitterFixtures.single("flowchart TD\n"));
        assertTrue(src.contains("    public enum EventType {\n        ;\n"));
        assertTrue(src.contains("EmptyState(\"EmptyState\", false);"));
    }

    @Test(expected = NullPointerException.class)
    public void testNullMachineRejected() {
        emitter.render(null);
    }
}
