package com.flowchart.fsmc.io;

import com.flowchart.fsmc.api.Diagnostics;
import com.flowchart.fsmc.io.DraftGraph.DraftEdge;
import com.flowchart.fsmc.io.DraftGraph.DraftNode;
import com.flowchart.fsmc.io.Statement.StyleDirective;
import com.flowchart.fsmc.model.Edge;
import com.flowchart.fsmc.model.EdgeLabels;
import com.flowchart.fsmc.model.MachineCategory;
import com.flowchart.fsmc.model.Node;
import com.flowchart.fsmc.model.NodeShape;
import com.flowchart.fsmc.model.ParsedMachine;
import com.flowchart.fsmc.model.TransitionKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a {@link DraftGraph} into a {@link ParsedMachine}.
 *
 * <p>
 * Resolution steps, in order:
 * <ol>
 * <li>apply deferred style directives (shape and class overrides)</li>
 * <li>infer final states</li>
 * <li>derive the category from the most frequent category tag</li>
 * <li>pick the initial state</li>
 * <li>classify edges and extract guard/action annotations</li>
 * </ol>
 */
public final class GraphAssembler {
    static final Set<String> INITIAL_NAMES = Set.of("start", "idle", "initial", "begin");
    static final List<String> FINAL_KEYWORDS = List.of("end", "final", "close", "exit", "goodbye", "session");

    static final String PLACEHOLDER_ID = "EmptyState";
    static final String PLACEHOLDER_LABEL = "Empty State";

    private final boolean placeholderForEmpty;

    public GraphAssembler(boolean placeholderForEmpty) {
        this.placeholderForEmpty = placeholderForEmpty;
    }

    /**
     * @return the assembled machine, or {@code null} for an empty block when
     *         placeholders are disabled
     */
    ParsedMachine assemble(DraftGraph draft, String id, String displayName, Diagnostics diagnostics) {
        if (draft.isEmpty()) {
            if (!placeholderForEmpty)
                return null;
            diagnostics.warning("Empty diagram", "Diagram block produced no states; using placeholder state '"
                    + PLACEHOLDER_ID + "'", draft.startLine, "Add states and transitions to the diagram");
            Node placeholder = new Node(PLACEHOLDER_ID, PLACEHOLDER_LABEL, NodeShape.RECTANGLE, List.of(),
                    true, false, null);
            return new ParsedMachine(id, displayName, MachineCategory.USER, List.of(placeholder), List.of(),
                    PLACEHOLDER_ID, Set.of());
        }

        // 1. Style directives apply after the whole block has been seen
        for (StyleDirective sd : draft.styles)
            applyStyle(draft, sd, diagnostics);

        // 2. Final states
        Set<String> finals = new LinkedHashSet<>();
        for (DraftNode n : draft.nodes.values())
            if (isFinal(n))
                finals.add(n.id);

        // 3. Category and 4. initial state
        MachineCategory category = dominantCategory(draft);
        String initialId = pickInitial(draft);

        List<Node> nodes = new ArrayList<>(draft.nodes.size());
        for (DraftNode n : draft.nodes.values())
            nodes.add(new Node(n.id, n.label, n.shape, new ArrayList<>(n.classes),
                    n.id.equals(initialId), finals.contains(n.id), n.line));

        // 5. Edges
        List<Edge> edges = new ArrayList<>(draft.edges.size());
        for (DraftEdge e : draft.edges) {
            if (finals.contains(e.from()))
                diagnostics.warning("Transition from final state",
                        "Final state '" + e.from() + "' has an outgoing transition to '" + e.to() + "'",
                        e.line(), "Final states should not have outgoing transitions");
            edges.add(new Edge(e.from(), e.to(), e.label(), TransitionKind.classify(e.label()),
                    EdgeLabels.guardOf(e.label()), EdgeLabels.actionOf(e.label()), e.line()));
        }
        return new ParsedMachine(id, displayName, category, nodes, edges, initialId, finals);
    }

    private static void applyStyle(DraftGraph draft, StyleDirective sd, Diagnostics diagnostics) {
        DraftNode node = draft.nodes.get(sd.id());
        if (node == null) {
            diagnostics.warning("Unknown styled node", "Style directive refers to unknown state '" + sd.id() + "'",
                    sd.line(), "Declare the state before styling it");
            return;
        }
        if (sd.shapeName() != null) {
            NodeShape shape = NodeShape.fromName(sd.shapeName());
            if (shape == null) {
                diagnostics.warning("Unknown shape", "Unknown shape '" + sd.shapeName() + "' for state '"
                        + sd.id() + "'", sd.line(), "Use rect, rounded, circle, diamond, hexagon or stadium");
            } else {
                node.shape = shape;
            }
        }
        if (sd.classes() != null) {
            node.classes.clear();
            node.classes.addAll(sd.classes());
        }
    }

    /**
     * Circle always finalizes; the keyword rule only applies to nodes written
     * with an explicit bracket shape.
     */
    static boolean isFinal(DraftNode n) {
        if (n.shape == NodeShape.CIRCLE)
            return true;
        if (!n.declared)
            return false;
        String label = n.label.toLowerCase(Locale.ROOT);
        for (String keyword : FINAL_KEYWORDS)
            if (label.contains(keyword))
                return true;
        return false;
    }

    static MachineCategory dominantCategory(DraftGraph draft) {
        Map<MachineCategory, Integer> counts = new EnumMap<>(MachineCategory.class);
        for (DraftNode n : draft.nodes.values())
            for (String cls : n.classes) {
                MachineCategory c = MachineCategory.fromTag(cls);
                if (c != null)
                    counts.merge(c, 1, Integer::sum);
            }
        MachineCategory best = null;
        int bestCount = 0;
        // EnumMap iterates in declaration order, which is the tie-break order
        for (var entry : counts.entrySet())
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        return best != null ? best : MachineCategory.USER;
    }

    static String pickInitial(DraftGraph draft) {
        for (DraftNode n : draft.nodes.values())
            if (INITIAL_NAMES.contains(n.id.toLowerCase(Locale.ROOT)))
                return n.id;
        return draft.nodes.keySet().iterator().next();
    }
}
