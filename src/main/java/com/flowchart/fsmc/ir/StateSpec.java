package com.flowchart.fsmc.ir;

import java.util.List;
import java.util.Objects;

/**
 * A generated state.
 *
 * @param name        state name as written in the diagram
 * @param symbol      Java constant naming the state, unique within the machine
 * @param kind        state kind
 * @param entry       entry action names
 * @param exit        exit action names
 * @param transitions outgoing transitions in declaration order
 * @param doc         one-line description
 */
public record StateSpec(String name, String symbol, StateKind kind, List<String> entry, List<String> exit,
        List<TransitionSpec> transitions, String doc) {

    public StateSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(kind, "kind");
        entry = List.copyOf(entry);
        exit = List.copyOf(exit);
        transitions = List.copyOf(transitions);
    }

    public boolean isFinal() {
        return kind == StateKind.FINAL;
    }
}
