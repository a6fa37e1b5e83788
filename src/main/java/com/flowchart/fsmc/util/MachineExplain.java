package com.flowchart.fsmc.util;

import java.util.List;
import java.util.Objects;

import com.flowchart.fsmc.engine.StateTopology;
import com.flowchart.fsmc.model.Edge;
import com.flowchart.fsmc.model.Node;
import com.flowchart.fsmc.model.ParsedMachine;

/**
 * Diagnostic utility for inspecting a parsed machine.
 *
 * <p>
 * Produces a text report of states and transitions, and re-renders the
 * machine as flowchart text so a parse can be compared with its source.
 * <b>Usage:</b> debugging and log output only.
 */
public final class MachineExplain {
    private final ParsedMachine machine;
    private final StateTopology topology;

    public MachineExplain(ParsedMachine machine) {
        this.machine = Objects.requireNonNull(machine, "machine");
        StateTopology.Builder b = StateTopology.builder();
        for (Node n : machine.nodes())
            b.addState(n.id());
        for (Edge e : machine.edges())
            if (b.hasState(e.from()) && b.hasState(e.to()))
                b.addTransition(e.from(), e.to());
        this.topology = b.build();
    }

    /**
     * Dumps states in diagram order with their flags and outgoing transitions.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Machine ").append(machine.id()).append(" (").append(machine.category().id()).append(", ")
                .append(machine.nodes().size()).append(" states, ").append(machine.edges().size())
                .append(" transitions):\n");
        List<String> unreachable = machine.initialNodeId() != null && topology.contains(machine.initialNodeId())
                ? topology.unreachableFrom(machine.initialNodeId())
                : List.of();
        for (int i = 0; i < machine.nodes().size(); i++) {
            Node n = machine.nodes().get(i);
            sb.append("  [").append(i).append("] ").append(n.id());
            if (n.id().equals(machine.initialNodeId()))
                sb.append(" (INITIAL)");
            if (machine.isFinal(n.id()))
                sb.append(" (FINAL)");
            if (unreachable.contains(n.id()))
                sb.append(" (UNREACHABLE)");
            List<Edge> out = machine.outgoing(n.id());
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < out.size(); j++) {
                    Edge e = out.get(j);
                    sb.append(e.to());
                    if (e.hasLabel())
                        sb.append(" [").append(e.label()).append(']');
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Re-renders the machine as a top-down flowchart.
     */
    public String toFlowchart() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("flowchart TD\n");

        // 1. Nodes with their shapes
        for (Node n : machine.nodes()) {
            String label = n.label() == null ? n.id() : n.label().replace("\"", "'");
            sb.append("  ").append(sanitize(n.id())).append(n.shape().open()).append('"').append(label).append('"')
                    .append(n.shape().close()).append('\n');
        }

        // 2. Edges
        for (Edge e : machine.edges()) {
            sb.append("  ").append(sanitize(e.from()));
            if (e.hasLabel())
                sb.append(" -->|").append(e.label().replace("|", "/")).append("| ");
            else
                sb.append(" --> ");
            sb.append(sanitize(e.to())).append('\n');
        }

        // 3. Class assignments
        for (Node n : machine.nodes())
            for (String cssClass : n.cssClasses())
                sb.append("  class ").append(sanitize(n.id())).append(' ').append(cssClass).append('\n');
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
