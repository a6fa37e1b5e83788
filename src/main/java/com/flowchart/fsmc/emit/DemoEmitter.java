package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.ir.TransitionSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders an interactive console harness for a machine. Lines typed on stdin
 * are commands or event types; {@code --auto} replays a scripted walk through
 * the diagram instead.
 */
public final class DemoEmitter implements Emitter {
    static final int MAX_SCENARIO_STEPS = 10;

    private final OutputLayout layout;

    public DemoEmitter(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public EmitterKind kind() {
        return EmitterKind.DEMO;
    }

    @Override
    public String render(GeneratedMachine m) {
        Objects.requireNonNull(m, "machine");
        String cls = m.className();
        String demo = EmitterKind.DEMO.typeName(cls);
        CodeWriter w = new CodeWriter();
        Sources.fileHeader(w, m, "demo");
        w.line("package " + layout.machinePackage(m.category()) + ";").line();
        w.line("import java.io.BufferedReader;");
        w.line("import java.io.IOException;");
        w.line("import java.io.InputStreamReader;");
        w.line("import java.nio.charset.StandardCharsets;");
        w.line("import java.util.Locale;").line();
        w.doc("Interactive demo of " + m.displayName() + ". Run with --auto for the scripted scenario.");
        w.open("public final class " + demo);
        scenario(w, m, cls);
        w.open("private " + demo + "()");
        w.close();
        w.line();

        main(w, cls);
        dispatch(w, cls);
        printing(w, m, cls);
        w.close();
        return w.toString();
    }

    /** Greedy walk from the initial state preferring unvisited targets. */
    static List<TransitionSpec> scenario(GeneratedMachine m) {
        Map<String, List<TransitionSpec>> rows = Sources.effectiveTransitions(m);
        List<TransitionSpec> walk = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String current = m.initialState();
        visited.add(current);
        while (walk.size() < MAX_SCENARIO_STEPS) {
            List<TransitionSpec> out = rows.get(current);
            if (out == null || out.isEmpty())
                break;
            TransitionSpec next = null;
            for (TransitionSpec t : out)
                if (m.stateSymbol(t.target()) != null && !visited.contains(t.target())) {
                    next = t;
                    break;
                }
            if (next == null)
                break;
            walk.add(next);
            visited.add(next.target());
            current = next.target();
        }
        return walk;
    }

    private static void scenario(CodeWriter w, GeneratedMachine m, String cls) {
        List<TransitionSpec> walk = scenario(m);
        w.open("private static final " + cls + ".EventType[] SCENARIO =");
        for (TransitionSpec t : walk)
            w.line(cls + ".EventType." + m.eventSymbol(t.event()) + ",");
        w.close(";");
        w.line();
    }

    private static void main(CodeWriter w, String cls) {
        w.open("public static void main(String[] args) throws IOException");
        w.open("if (args.length > 0 && \"--auto\".equals(args[0]))");
        w.line("runScenario();");
        w.line("return;");
        w.close();
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("printHelp();");
        w.line("printState(machine);");
        w.line("BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));");
        w.line("String line;");
        w.open("while ((line = in.readLine()) != null)");
        w.line("String command = line.trim();");
        w.line("if (command.isEmpty())");
        w.line("    continue;");
        w.open("switch (command.toLowerCase(Locale.ROOT))");
        w.line("case \"help\" -> printHelp();");
        w.line("case \"state\" -> printState(machine);");
        w.line("case \"context\" -> System.out.println(machine.context().toMap());");
        w.line("case \"events\" -> System.out.println(\"Available: \" + machine.availableEvents());");
        w.line("case \"states\" -> printStates();");
        w.open("case \"reset\" ->");
        w.line("machine = new " + cls + "().start();");
        w.line("printState(machine);");
        w.close();
        w.open("case \"quit\", \"exit\" ->");
        w.line("machine.stop();");
        w.line("return;");
        w.close();
        w.line("default -> send(machine, command);");
        w.close();
        w.close();
        w.close();
        w.line();

        w.open("private static void runScenario()");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("printState(machine);");
        w.open("for (" + cls + ".EventType type : SCENARIO)");
        w.line("System.out.println(\"> \" + type.type());");
        w.line("if (!machine.send(type))");
        w.line("    System.out.println(\"Event not accepted: \" + type.type());");
        w.line("printState(machine);");
        w.close();
        w.line("machine.stop();");
        w.line("System.out.println(\"Trace: \" + machine.trace());");
        w.close();
        w.line();
    }

    private static void dispatch(CodeWriter w, String cls) {
        w.open("private static void send(" + cls + " machine, String command)");
        w.line(cls + ".EventType type = " + cls + ".EventType.fromType(command.toUpperCase(Locale.ROOT));");
        w.open("if (type == null)");
        w.line("System.out.println(\"Unknown command or event: \" + command);");
        w.line("return;");
        w.close();
        w.line("if (machine.send(type))");
        w.line("    printState(machine);");
        w.line("else");
        w.line("    System.out.println(\"Event \" + type.type() + \" not accepted in \" + machine.state().id());");
        w.close();
        w.line();
    }

    private static void printing(CodeWriter w, GeneratedMachine m, String cls) {
        w.open("private static void printHelp()");
        w.line("System.out.println(" + CodeWriter.quote(m.displayName() + " demo") + ");");
        w.line("System.out.println(\"Commands: help, state, context, events, states, reset, quit\");");
        w.line("System.out.println(\"Any other input is sent as an event type.\");");
        w.close();
        w.line();
        w.open("private static void printState(" + cls + " machine)");
        w.line("System.out.println(\"State: \" + machine.state().id() + (machine.isDone() ? \" (final)\" : \"\"));");
        w.close();
        w.line();
        w.open("private static void printStates()");
        w.line("for (" + cls + ".State s : " + cls + ".State.values())");
        w.line("    System.out.println((s.isFinal() ? \"* \" : \"  \") + s.id());");
        w.close();
    }
}
