package com.flowchart.fsmc.io;

import com.flowchart.fsmc.io.Statement.StyleDirective;
import com.flowchart.fsmc.model.NodeShape;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable graph collected while scanning one diagram block. Node order is
 * first-mention order; {@link GraphAssembler} resolves it into an immutable
 * {@link com.flowchart.fsmc.model.ParsedMachine}.
 */
final class DraftGraph {

    static final class DraftNode {
        final String id;
        String label;
        NodeShape shape;
        boolean declared;
        final Set<String> classes = new LinkedHashSet<>();
        final int line;

        DraftNode(String id, int line) {
            this.id = id;
            this.label = id;
            this.shape = NodeShape.RECTANGLE;
            this.line = line;
        }
    }

    record DraftEdge(String from, String to, String label, int line) {
    }

    final int startLine;
    final Map<String, DraftNode> nodes = new LinkedHashMap<>();
    final List<DraftEdge> edges = new ArrayList<>();
    final Map<String, String> classDefs = new LinkedHashMap<>();
    final List<StyleDirective> styles = new ArrayList<>();

    DraftGraph(int startLine) {
        this.startLine = startLine;
    }

    /** Returns the node, creating a bare rectangle if it has not been seen. */
    DraftNode ensure(String id, int line) {
        return nodes.computeIfAbsent(id, k -> new DraftNode(k, line));
    }

    boolean isEmpty() {
        return nodes.isEmpty();
    }
}
