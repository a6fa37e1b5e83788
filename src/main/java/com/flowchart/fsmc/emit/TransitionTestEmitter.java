package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.engine.StateTopology;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.ir.StateSpec;
import com.flowchart.fsmc.ir.TransitionSpec;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a JUnit 4 suite covering the transition table.
 *
 * <p>
 * One test per transition that can fire, one per guarded transition with its
 * guard rejected, one per final and dead-end state, and one replaying the
 * shortest event path to every state reachable within {@link #MAX_PATH_DEPTH}
 * steps. A final test re-computes reachability at runtime from the machine's
 * own table.
 */
public final class TransitionTestEmitter implements Emitter {
    static final int MAX_PATH_DEPTH = 5;

    private final OutputLayout layout;

    public TransitionTestEmitter(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public EmitterKind kind() {
        return EmitterKind.TRANSITION_TEST;
    }

    @Override
    public String render(GeneratedMachine m) {
        Objects.requireNonNull(m, "machine");
        String cls = m.className();
        CodeWriter w = new CodeWriter();
        Sources.fileHeader(w, m, "transition tests");
        w.line("package " + layout.machinePackage(m.category()) + ";").line();
        w.line("import org.junit.Test;").line();
        w.line("import java.util.ArrayDeque;");
        w.line("import java.util.Deque;");
        w.line("import java.util.EnumSet;");
        w.line("import java.util.Set;").line();
        w.line("import static org.junit.Assert.assertEquals;");
        w.line("import static org.junit.Assert.assertFalse;");
        w.line("import static org.junit.Assert.assertTrue;").line();
        w.open("public class " + EmitterKind.TRANSITION_TEST.typeName(cls));

        Map<String, List<TransitionSpec>> effective = Sources.effectiveTransitions(m);
        transitions(w, m, cls, effective);
        guards(w, m, cls, effective);
        terminals(w, m, cls);
        paths(w, m, cls);
        registration(w, m, cls, effective);
        reachability(w, m, cls);

        w.close();
        return w.toString();
    }

    private static String state(GeneratedMachine m, String cls, String name) {
        return cls + ".State." + m.stateSymbol(name);
    }

    private static String event(GeneratedMachine m, String cls, String event) {
        return cls + ".EventType." + m.eventSymbol(event);
    }

    // --- One test per firing transition ---

    private static void transitions(CodeWriter w, GeneratedMachine m, String cls,
            Map<String, List<TransitionSpec>> effective) {
        int n = 0;
        for (StateSpec s : m.states()) {
            for (TransitionSpec t : effective.get(s.name())) {
                if (m.stateSymbol(t.target()) == null)
                    continue;
                n++;
                w.line("@Test");
                w.open(String.format("public void transition%02d_%s_%s()", n, Sources.camel(s.symbol()),
                        Sources.camel(m.eventSymbol(t.event()))));
                w.line(cls + " machine = new " + cls + "().startAt(" + state(m, cls, s.name()) + ");");
                w.line("assertTrue(machine.send(" + event(m, cls, t.event()) + "));");
                w.line("assertEquals(" + state(m, cls, t.target()) + ", machine.state());");
                if (TestSuiteEmitter.tracesEntry(m, m.state(t.target())))
                    w.line("assertTrue(machine.trace().contains("
                            + CodeWriter.quote(Sources.TRACE_ENTER + t.target()) + "));");
                w.close();
                w.line();
            }
        }
    }

    private static void guards(CodeWriter w, GeneratedMachine m, String cls,
            Map<String, List<TransitionSpec>> effective) {
        for (StateSpec s : m.states()) {
            for (TransitionSpec t : effective.get(s.name())) {
                // only when no other row could take over the event
                if (t.guard() == null || Sources.rowsFor(s, t.event()) != 1)
                    continue;
                w.line("@Test");
                w.open("public void guardRejects" + Sources.camel(s.symbol()) + Sources.camel(m.eventSymbol(t.event()))
                        + "()");
                w.line(cls + " machine = new " + cls + "()");
                w.line("        .withGuard(" + CodeWriter.quote(t.guard()) + ", (context, event) -> false)");
                w.line("        .startAt(" + state(m, cls, s.name()) + ");");
                w.line("assertFalse(machine.send(" + event(m, cls, t.event()) + "));");
                w.line("assertEquals(" + state(m, cls, s.name()) + ", machine.state());");
                w.close();
                w.line();
            }
        }
    }

    private static void terminals(CodeWriter w, GeneratedMachine m, String cls) {
        for (StateSpec s : m.states()) {
            boolean deadEnd = !s.isFinal() && s.transitions().isEmpty();
            if (!s.isFinal() && !deadEnd)
                continue;
            w.line("@Test");
            w.open("public void " + (s.isFinal() ? "finalState" : "deadEnd") + Sources.camel(s.symbol())
                    + "IgnoresEvents()");
            w.line(cls + " machine = new " + cls + "().startAt(" + state(m, cls, s.name()) + ");");
            if (s.isFinal())
                w.line("assertTrue(machine.isDone());");
            w.line("for (" + cls + ".EventType type : " + cls + ".EventType.values())");
            w.line("    assertFalse(machine.send(type));");
            w.line("assertEquals(" + state(m, cls, s.name()) + ", machine.state());");
            w.close();
            w.line();
        }
    }

    // --- Shortest paths from the initial state ---

    private static void paths(CodeWriter w, GeneratedMachine m, String cls) {
        StateTopology topo = Sources.effectiveTopology(m);
        int[] pred = topo.shortestPathTree(m.initialState());
        for (StateSpec s : m.states()) {
            if (s.name().equals(m.initialState()))
                continue;
            List<TransitionSpec> path = Sources.pathTo(m, topo, pred, s.name());
            if (path == null || path.isEmpty() || path.size() > MAX_PATH_DEPTH)
                continue;
            w.line("@Test");
            w.open("public void pathTo" + Sources.camel(s.symbol()) + "()");
            w.line(cls + " machine = new " + cls + "().start();");
            for (TransitionSpec t : path)
                w.line("assertTrue(machine.send(" + event(m, cls, t.event()) + "));");
            w.line("assertEquals(" + state(m, cls, s.name()) + ", machine.state());");
            if (s.isFinal())
                w.line("assertTrue(machine.isDone());");
            w.close();
            w.line();
        }
    }

    // --- Guard and action registration ---

    private static void registration(CodeWriter w, GeneratedMachine m, String cls,
            Map<String, List<TransitionSpec>> effective) {
        List<TransitionSpec> initialRows = effective.get(m.initialState());
        if (initialRows.isEmpty() || m.stateSymbol(initialRows.get(0).target()) == null)
            return;
        TransitionSpec first = initialRows.get(0);
        List<String> entry = m.state(first.target()).entry();
        String entryAction = entry.isEmpty() ? null : entry.get(0);

        w.line("@Test");
        w.open("public void customGuardIsConsulted()");
        w.line("int[] calls = new int[1];");
        w.line(cls + " machine = new " + cls + "().start();");
        if (first.guard() != null) {
            w.line("machine.withGuard(" + CodeWriter.quote(first.guard()) + ", (context, event) -> {");
            w.line("    calls[0]++;");
            w.line("    return true;");
            w.line("});");
            w.line("assertTrue(machine.send(" + event(m, cls, first.event()) + "));");
            w.line("assertEquals(1, calls[0]);");
        } else {
            w.line("machine.withGuard(\"unusedGuard\", (context, event) -> {");
            w.line("    calls[0]++;");
            w.line("    return false;");
            w.line("});");
            w.line("assertTrue(machine.send(" + event(m, cls, first.event()) + "));");
            w.line("assertEquals(0, calls[0]);");
        }
        w.close();
        w.line();

        if (entryAction == null)
            return;
        w.line("@Test");
        w.open("public void customActionRunsOnEntry()");
        w.line("int[] calls = new int[1];");
        w.line(cls + " machine = new " + cls + "()");
        w.line("        .withAction(" + CodeWriter.quote(entryAction) + ", (context, event) -> calls[0]++)");
        w.line("        .start();");
        w.line("int before = calls[0];");
        w.line("assertTrue(machine.send(" + event(m, cls, first.event()) + "));");
        w.line("assertEquals(before + 1, calls[0]);");
        w.close();
        w.line();
    }

    private static void reachability(CodeWriter w, GeneratedMachine m, String cls) {
        BitSet reachable = Sources.effectiveTopology(m).reachableFrom(m.initialState());
        w.line("@Test");
        w.open("public void reachableStateCount()");
        w.line("Set<" + cls + ".State> seen = EnumSet.of(" + cls + ".INITIAL_STATE);");
        w.line("Deque<" + cls + ".State> queue = new ArrayDeque<>(seen);");
        w.open("while (!queue.isEmpty())");
        w.line(cls + ".State current = queue.poll();");
        w.line("if (current.isFinal())");
        w.line("    continue;");
        w.line("Set<" + cls + ".EventType> fired = EnumSet.noneOf(" + cls + ".EventType.class);");
        w.open("for (" + cls + ".Transition t : " + cls + ".transitionsFrom(current))");
        w.line("if (fired.add(t.event()) && t.target() != null && seen.add(t.target()))");
        w.line("    queue.add(t.target());");
        w.close();
        w.close();
        w.line("assertEquals(" + reachable.cardinality() + ", seen.size());");
        w.close();
    }
}
