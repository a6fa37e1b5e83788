package com.flowchart.fsmc.validation;

import com.flowchart.fsmc.model.Edge;
import com.flowchart.fsmc.model.MachineCategory;
import com.flowchart.fsmc.model.Node;
import com.flowchart.fsmc.model.ParsedMachine;

import java.util.ArrayList;
import java.util.List;

/**
 * Validator-facing shape of a machine. Unlike {@link ParsedMachine} it may
 * hold inconsistent data (duplicate states, dangling targets), which is what
 * the business-rule validator exists to detect.
 */
public record MachineView(String id, String name, MachineCategory category, String initialState,
        List<StateView> states) {

    public static final String DEFAULT_EVENT = "NEXT";

    public MachineView {
        states = List.copyOf(states);
    }

    public record StateView(String name, boolean finalState, List<TransitionView> transitions) {
        public StateView {
            transitions = List.copyOf(transitions);
        }
    }

    public record TransitionView(String event, String target) {
    }

    /** Converts a parsed machine; unlabeled edges get the event {@value #DEFAULT_EVENT}. */
    public static MachineView of(ParsedMachine pm) {
        List<StateView> states = new ArrayList<>(pm.nodes().size());
        for (Node n : pm.nodes()) {
            List<TransitionView> transitions = new ArrayList<>();
            for (Edge e : pm.outgoing(n.id()))
                transitions.add(new TransitionView(e.hasLabel() ? e.label() : DEFAULT_EVENT, e.to()));
            states.add(new StateView(n.id(), n.finalState(), transitions));
        }
        return new MachineView(pm.id(), pm.displayName(), pm.category(), pm.initialNodeId(), states);
    }
}
