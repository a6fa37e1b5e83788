package com.flowchart.fsmc.ir;

import java.util.List;
import java.util.Objects;

/**
 * One row of a state's transition table.
 *
 * @param event   event type, {@code UNKNOWN} for unlabeled edges
 * @param target  target state name, {@code null} for an internal transition
 * @param guard   guard name, may be {@code null}
 * @param actions action names run on the transition
 */
public record TransitionSpec(String event, String target, String guard, List<String> actions) {

    public TransitionSpec {
        Objects.requireNonNull(event, "event");
        actions = List.copyOf(actions);
    }
}
