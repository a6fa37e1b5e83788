package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.engine.SemanticGenerator;
import com.flowchart.fsmc.ir.ContextField;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.ir.StateSpec;
import com.flowchart.fsmc.ir.TransitionSpec;

import java.util.List;
import java.util.Objects;

/**
 * Renders the basic JUnit 4 suite of a machine: lifecycle, context defaults
 * and event handling. {@link TestStyle#COMPREHENSIVE} adds determinism, final
 * state and context copy checks.
 */
public final class TestSuiteEmitter implements Emitter {
    private final OutputLayout layout;
    private final TestStyle style;

    public TestSuiteEmitter(OutputLayout layout) {
        this(layout, TestStyle.SMOKE);
    }

    public TestSuiteEmitter(OutputLayout layout, TestStyle style) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.style = Objects.requireNonNull(style, "style");
    }

    @Override
    public EmitterKind kind() {
        return EmitterKind.SMOKE_TEST;
    }

    @Override
    public String render(GeneratedMachine m) {
        Objects.requireNonNull(m, "machine");
        String cls = m.className();
        CodeWriter w = new CodeWriter();
        Sources.fileHeader(w, m, style == TestStyle.SMOKE ? "smoke tests" : "tests");
        w.line("package " + layout.machinePackage(m.category()) + ";").line();
        w.line("import org.junit.Test;").line();
        if (style == TestStyle.COMPREHENSIVE)
            w.line("import java.util.List;").line();
        w.line("import static org.junit.Assert.assertEquals;");
        w.line("import static org.junit.Assert.assertFalse;");
        w.line("import static org.junit.Assert.assertNotSame;");
        w.line("import static org.junit.Assert.assertNull;");
        w.line("import static org.junit.Assert.assertTrue;").line();
        w.open("public class " + EmitterKind.SMOKE_TEST.typeName(cls));

        lifecycle(w, m, cls);
        contextDefaults(w, m, cls);
        events(w, m, cls);
        if (style == TestStyle.COMPREHENSIVE)
            comprehensive(w, m, cls);
        w.close();
        return w.toString();
    }

    private static void lifecycle(CodeWriter w, GeneratedMachine m, String cls) {
        w.line("@Test");
        w.open("public void testCreation()");
        w.line(cls + " machine = new " + cls + "();");
        w.line("assertFalse(machine.isRunning());");
        w.line("assertEquals(" + cls + ".INITIAL_STATE, machine.state());");
        w.line("assertEquals(" + CodeWriter.quote(m.id()) + ", " + cls + ".MACHINE_ID);");
        w.line("assertEquals(" + m.states().size() + ", " + cls + ".State.values().length);");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void testStart()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("assertTrue(machine.isRunning());");
        w.line("assertEquals(" + cls + ".State." + m.initial().symbol() + ", machine.state());");
        if (tracesEntry(m, m.initial()))
            w.line("assertEquals(" + CodeWriter.quote(Sources.TRACE_ENTER + m.initialState())
                    + ", machine.trace().get(0));");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void testStop()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("machine.stop();");
        w.line("assertFalse(machine.isRunning());");
        w.close();
        w.line();
    }

    private static void contextDefaults(CodeWriter w, GeneratedMachine m, String cls) {
        w.line("@Test");
        w.open("public void testContextDefaults()");
        w.line(cls + ".Context context = new " + cls + "().context();");
        for (ContextField f : m.contextFields())
            w.line(Sources.defaultAssertion(f, "context." + Sources.getter(f) + "()"));
        w.close();
        w.line();
    }

    private static void events(CodeWriter w, GeneratedMachine m, String cls) {
        w.line("@Test");
        w.open("public void testNullEventIgnored()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("assertFalse(machine.send((" + cls + ".Event) null));");
        w.line("assertFalse(machine.send((" + cls + ".EventType) null));");
        w.line("assertEquals(" + cls + ".INITIAL_STATE, machine.state());");
        w.close();
        w.line();

        List<TransitionSpec> initialRows = Sources.effectiveTransitions(m).get(m.initialState());
        if (initialRows.isEmpty())
            return;
        TransitionSpec first = initialRows.get(0);
        String target = m.stateSymbol(first.target());
        String event = cls + ".EventType." + m.eventSymbol(first.event());

        w.line("@Test");
        w.open("public void testEventsIgnoredBeforeStart()");
        w.line(cls + " machine = new " + cls + "();");
        w.line("assertFalse(machine.send(" + event + "));");
        w.line("assertEquals(" + cls + ".INITIAL_STATE, machine.state());");
        w.close();
        w.line();

        if (target == null)
            return;
        w.line("@Test");
        w.open("public void testFirstTransition()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("assertTrue(machine.send(" + event + "));");
        w.line("assertEquals(" + cls + ".State." + target + ", machine.state());");
        w.close();
        w.line();
    }

    private static void comprehensive(CodeWriter w, GeneratedMachine m, String cls) {
        w.line("@Test");
        w.open("public void testDeterminism()");
        w.line(cls + " a = new " + cls + "().start();");
        w.line(cls + " b = new " + cls + "().start();");
        w.open("for (" + cls + ".EventType type : " + cls + ".EventType.values())");
        w.line("assertEquals(a.send(type), b.send(type));");
        w.line("assertEquals(a.state(), b.state());");
        w.close();
        w.line("assertEquals(a.trace(), b.trace());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void testAvailableEventsFromInitialState()");
        w.line(cls + " machine = new " + cls + "().start();");
        StringBuilder expected = new StringBuilder("List.of(");
        List<String> events = Sources.eventsOf(m.initial());
        for (int i = 0; i < events.size(); i++)
            expected.append(i > 0 ? ", " : "").append(cls).append(".EventType.").append(m.eventSymbol(events.get(i)));
        w.line("assertEquals(" + expected + "), machine.availableEvents());");
        w.close();
        w.line();

        w.line("@Test");
        w.open("public void testContextCopyIsIndependent()");
        w.line(cls + ".Context context = new " + cls + "().context();");
        w.line(cls + ".Context copy = context.copy();");
        w.line("assertNotSame(context, copy);");
        w.line("copy.setError(\"changed\");");
        w.line("assertNull(context.getError());");
        w.line("assertEquals(context.toMap().keySet(), copy.toMap().keySet());");
        w.close();
        w.line();

        for (StateSpec s : m.states()) {
            if (!s.isFinal())
                continue;
            w.line("@Test");
            w.open("public void testFinalState" + Sources.camel(s.symbol()) + "()");
            w.line(cls + " machine = new " + cls + "().startAt(" + cls + ".State." + s.symbol() + ");");
            w.line("assertTrue(machine.isDone());");
            w.line("for (" + cls + ".EventType type : " + cls + ".EventType.values())");
            w.line("    assertFalse(machine.send(type));");
            if (s.exit().contains(SemanticGenerator.CLEANUP_ACTION)
                    && m.actions().contains(SemanticGenerator.CLEANUP_ACTION)) {
                w.line("machine.stop();");
                w.line("assertTrue(machine.trace().contains(" + CodeWriter.quote(Sources.TRACE_CLEANUP + s.name())
                        + "));");
            }
            w.close();
            w.line();
        }
    }

    static boolean tracesEntry(GeneratedMachine m, StateSpec s) {
        return s.entry().contains(SemanticGenerator.TRACE_ACTION)
                && m.actions().contains(SemanticGenerator.TRACE_ACTION);
    }
}
