package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.engine.StateTopology;
import com.flowchart.fsmc.ir.ContextField;
import com.flowchart.fsmc.ir.FieldKind;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.ir.StateSpec;
import com.flowchart.fsmc.ir.TransitionSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conventions shared by the emitters: file headers, trace markers written by
 * generated machines, and accessors of the generated API.
 */
final class Sources {
    /** Trace entry recorded by the generated tracing action: {@code enter:<state>}. */
    static final String TRACE_ENTER = "enter:";
    /** Trace entry recorded by the generated cleanup action. */
    static final String TRACE_CLEANUP = "cleanup:";
    /** Trace entry recorded by any other default action: {@code action:<name>}. */
    static final String TRACE_ACTION = "action:";

    static final String PHONE_PATTERN = "^\\+?[0-9]{7,15}$";

    private Sources() {
    }

    static void fileHeader(CodeWriter w, GeneratedMachine m, String what) {
        w.line("// Generated " + what + " for \"" + m.displayName() + "\" (" + m.id() + ").");
        w.line("// Do not edit: regenerate from the diagram instead.");
    }

    /** {@code phoneNumber -> getPhoneNumber}. */
    static String getter(ContextField f) {
        return "get" + capitalize(f.name());
    }

    static String setter(ContextField f) {
        return "set" + capitalize(f.name());
    }

    static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    static ContextField field(GeneratedMachine m, String name) {
        for (ContextField f : m.contextFields())
            if (f.name().equals(name))
                return f;
        return null;
    }

    /** JUnit assertion that {@code expr} holds the field's default. */
    static String defaultAssertion(ContextField f, String expr) {
        if (f.nullable())
            return "assertNull(" + expr + ");";
        if (f.kind() == FieldKind.BOOL)
            return ("true".equals(f.defaultLiteral()) ? "assertTrue(" : "assertFalse(") + expr + ");";
        return "assertEquals(" + f.defaultLiteral() + ", " + expr + ");";
    }

    /**
     * Transitions that can actually fire: for each (state, event) pair only the
     * first row counts, since the dispatcher stops at the first match.
     * Final states fire nothing.
     */
    static Map<String, List<TransitionSpec>> effectiveTransitions(GeneratedMachine m) {
        Map<String, List<TransitionSpec>> out = new LinkedHashMap<>();
        for (StateSpec s : m.states()) {
            List<TransitionSpec> rows = new ArrayList<>();
            if (!s.isFinal()) {
                List<String> seen = new ArrayList<>();
                for (TransitionSpec t : s.transitions())
                    if (!seen.contains(t.event())) {
                        seen.add(t.event());
                        rows.add(t);
                    }
            }
            out.put(s.name(), rows);
        }
        return out;
    }

    /** Number of rows of {@code s} with the given event. */
    static int rowsFor(StateSpec s, String event) {
        int n = 0;
        for (TransitionSpec t : s.transitions())
            if (t.event().equals(event))
                n++;
        return n;
    }

    static String stringList(Iterable<String> values) {
        StringBuilder sb = new StringBuilder("List.of(");
        boolean first = true;
        for (String v : values) {
            if (!first)
                sb.append(", ");
            sb.append(CodeWriter.quote(v));
            first = false;
        }
        return sb.append(')').toString();
    }

    /** Topology over the transitions that can fire, skipping targets outside the machine. */
    static StateTopology effectiveTopology(GeneratedMachine m) {
        StateTopology.Builder b = StateTopology.builder();
        for (StateSpec s : m.states())
            b.addState(s.name());
        for (Map.Entry<String, List<TransitionSpec>> e : effectiveTransitions(m).entrySet())
            for (TransitionSpec t : e.getValue())
                if (t.target() != null && b.hasState(t.target()))
                    b.addTransition(e.getKey(), t.target());
        return b.build();
    }

    /**
     * Transitions leading from the initial state to {@code target} along the
     * breadth-first predecessor table {@code pred}, or {@code null} when the
     * target is unreachable.
     */
    static List<TransitionSpec> pathTo(GeneratedMachine m, StateTopology topo, int[] pred, String target) {
        Map<String, List<TransitionSpec>> rows = effectiveTransitions(m);
        int curr = topo.index(target);
        if (pred[curr] == -2)
            return null;
        List<TransitionSpec> path = new ArrayList<>();
        while (pred[curr] >= 0) {
            String from = topo.name(pred[curr]);
            String to = topo.name(curr);
            for (TransitionSpec t : rows.get(from))
                if (to.equals(t.target())) {
                    path.add(t);
                    break;
                }
            curr = pred[curr];
        }
        Collections.reverse(path);
        return path;
    }

    /** Distinct events of a state's rows, in declaration order. */
    static List<String> eventsOf(StateSpec s) {
        List<String> events = new ArrayList<>();
        for (TransitionSpec t : s.transitions())
            if (!events.contains(t.event()))
                events.add(t.event());
        return events;
    }

    /** Method-name fragment for a constant: {@code SELECT_OPTION -> SelectOption}. */
    static String camel(String symbol) {
        StringBuilder sb = new StringBuilder();
        for (String part : symbol.split("_+")) {
            if (part.isEmpty())
                continue;
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.length() == 0 ? "State" : sb.toString();
    }
}
