package com.flowchart.fsmc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A complete machine as recovered from one diagram block.
 *
 * <p>
 * Node ids are unique and every edge endpoint names a node of this machine.
 * Exactly one node is flagged initial and {@code initialNodeId} names it.
 */
public record ParsedMachine(String id, String displayName, MachineCategory category,
        List<Node> nodes, List<Edge> edges, String initialNodeId, Set<String> finalNodeIds) {

    public ParsedMachine {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        finalNodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(finalNodeIds));
    }

    /** Returns the node with the given id, or {@code null}. */
    public Node node(String nodeId) {
        for (Node n : nodes)
            if (n.id().equals(nodeId))
                return n;
        return null;
    }

    /** Edges leaving the given node, in declaration order. */
    public List<Edge> outgoing(String nodeId) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges)
            if (e.from().equals(nodeId))
                out.add(e);
        return out;
    }

    public boolean isFinal(String nodeId) {
        return finalNodeIds.contains(nodeId);
    }
}
