package com.flowchart.fsmc.model;

import java.util.List;
import java.util.Objects;

/**
 * A resolved diagram node, later a machine state.
 *
 * @param id         identifier token, unique within its machine
 * @param label      display text
 * @param shape      bracket shape
 * @param cssClasses ordered, duplicate-free class tags
 * @param initial    whether this is the machine's initial state
 * @param finalState whether this is a final state
 * @param line       declaring source line, or {@code null} for synthetic nodes
 */
public record Node(String id, String label, NodeShape shape, List<String> cssClasses,
        boolean initial, boolean finalState, Integer line) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(shape, "shape");
        label = label == null ? id : label;
        cssClasses = List.copyOf(cssClasses);
    }

    public boolean hasClass(String cssClass) {
        return cssClasses.contains(cssClass);
    }
}
