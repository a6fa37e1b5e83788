package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.ir.GeneratedMachine;

import java.util.Objects;

/**
 * Renders the error and boundary JUnit 4 suite. The suite is the same for
 * every machine: each {@link BoundaryCases} value is sent as payload of every
 * event type, followed by lifecycle abuse tests.
 */
public final class ErrorTestEmitter implements Emitter {
    static final String UNKNOWN_TYPE = "__NOT_AN_EVENT__";
    static final int REPEATS = 100;
    static final int FLOOD = 1000;

    private final OutputLayout layout;

    public ErrorTestEmitter(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public EmitterKind kind() {
        return EmitterKind.ERROR_TEST;
    }

    @Override
    public String render(GeneratedMachine m) {
        Objects.requireNonNull(m, "machine");
        String cls = m.className();
        CodeWriter w = new CodeWriter();
        Sources.fileHeader(w, m, "error and boundary tests");
        w.line("package " + layout.machinePackage(m.category()) + ";").line();
        w.line("import org.junit.Test;").line();
        w.line("import java.util.HashMap;");
        w.line("import java.util.Map;").line();
        w.line("import static org.junit.Assert.assertEquals;");
        w.line("import static org.junit.Assert.assertFalse;");
        w.line("import static org.junit.Assert.assertNotNull;");
        w.line("import static org.junit.Assert.assertNull;");
        w.line("import static org.junit.Assert.assertTrue;").line();
        w.open("public class " + EmitterKind.ERROR_TEST.typeName(cls));

        helpers(w, cls);
        for (BoundaryCases c : BoundaryCases.values()) {
            w.line("@Test");
            w.open("public void boundary" + c.testName() + "()");
            w.line(cls + " machine = new " + cls + "().start();");
            w.line("sendAll(machine, " + (c.isMissingPayload() ? "null" : "payload(" + c.expression() + ")") + ");");
            w.line("assertNotNull(machine.state());");
            w.close();
            w.line();
        }
        lifecycle(w, cls);
        w.close();
        return w.toString();
    }

    private static void helpers(CodeWriter w, String cls) {
        w.open("private static Map<String, Object> payload(Object value)");
        w.line("Map<String, Object> payload = new HashMap<>();");
        w.line("payload.put(\"input\", value);");
        w.line("payload.put(\"error\", value);");
        w.line("payload.put(\"data\", value);");
        w.line("return payload;");
        w.close();
        w.line();
        w.open("private static void sendAll(" + cls + " machine, Map<String, ?> payload)");
        w.open("for (" + cls + ".EventType type : " + cls + ".EventType.values())");
        w.line("machine.send(" + cls + ".Event.of(type, payload));");
        w.line("assertNotNull(machine.state());");
        w.close();
        w.close();
        w.line();
    }

    private static void lifecycle(CodeWriter w, String cls) {
        String types = cls + ".EventType.values()";

        w.line("@Test");
        w.open("public void eventsIgnoredBeforeStart()");
        w.line(cls + " machine = new " + cls + "();");
        w.line("for (" + cls + ".EventType type : " + types + ")");
        w.line("    assertFalse(machine.send(type));");
        w.line("assertEquals(" + cls + ".INITIAL_STATE, machine.state());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void eventsIgnoredWhenStopped()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("machine.stop();");
        w.line("for (" + cls + ".EventType type : " + types + ")");
        w.line("    assertFalse(machine.send(type));");
        w.line("assertFalse(machine.isRunning());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void rapidStartStop()");
        w.line(cls + " machine = new " + cls + "();");
        w.open("for (int i = 0; i < " + REPEATS + "; i++)");
        w.line("machine.start();");
        w.line("assertTrue(machine.isRunning());");
        w.line("machine.stop();");
        w.line("assertFalse(machine.isRunning());");
        w.close();
        w.line("assertEquals(" + cls + ".INITIAL_STATE, machine.state());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void repeatedEvents()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.open("for (" + cls + ".EventType type : " + types + ")");
        w.line("for (int i = 0; i < " + REPEATS + "; i++)");
        w.line("    machine.send(type);");
        w.close();
        w.line("assertNotNull(machine.state());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void eventFlood()");
        w.line(cls + ".EventType[] all = " + types + ";");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("if (all.length == 0)");
        w.line("    return;");
        w.line("for (int i = 0; i < " + FLOOD + "; i++)");
        w.line("    machine.send(all[i % all.length]);");
        w.line("assertNotNull(machine.state());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void restartReturnsToInitialState()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("for (" + cls + ".EventType type : " + types + ")");
        w.line("    machine.send(type);");
        w.line("machine.stop();");
        w.line("machine.start();");
        w.line("assertTrue(machine.isRunning());");
        w.line("assertEquals(" + cls + ".INITIAL_STATE, machine.state());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void unknownEventTypeResolvesToNull()");
        w.line("assertNull(" + cls + ".EventType.fromType(" + CodeWriter.quote(UNKNOWN_TYPE) + "));");
        w.line("assertNull(" + cls + ".EventType.fromType(null));");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void machinesAreIndependent()");
        w.line(cls + " a = new " + cls + "().start();");
        w.line(cls + " b = new " + cls + "().start();");
        w.line("for (" + cls + ".EventType type : " + types + ")");
        w.line("    a.send(type);");
        w.line("assertEquals(" + cls + ".INITIAL_STATE, b.state());");
        w.line("assertNull(b.context().getError());");
        w.close();
        w.line();

        w.line("@Test(expected = IllegalArgumentException.class)");
        w.open("public void nullGuardRejected()");
        w.line("new " + cls + "().withGuard(\"guard\", null);");
        w.close();
        w.line();

        w.line("@Test(expected = IllegalArgumentException.class)");
        w.open("public void nullStartStateRejected()");
        w.line("new " + cls + "().startAt(null);");
        w.close();
    }
}
