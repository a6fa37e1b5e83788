package com.flowchart.fsmc.model;

import java.util.Objects;

/**
 * A resolved transition between two nodes.
 *
 * @param from      source node id
 * @param to        target node id
 * @param label     raw label text, {@code null} when unlabeled
 * @param kind      inferred transition kind
 * @param guardName guard embedded in the label, may be {@code null}
 * @param actionName action embedded in the label, may be {@code null}
 * @param line      source line
 */
public record Edge(String from, String to, String label, TransitionKind kind,
        String guardName, String actionName, Integer line) {

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
