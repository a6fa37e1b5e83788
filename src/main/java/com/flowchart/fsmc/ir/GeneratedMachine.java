package com.flowchart.fsmc.ir;

import com.flowchart.fsmc.model.MachineCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Emitter-agnostic intermediate representation of one machine.
 *
 * <p>
 * Built once per parsed machine by the semantic generator and immutable
 * afterwards. Emitters read everything they need from here, including the
 * Java class name and the symbols for states and events, so they never
 * repeat any derivation.
 *
 * @param id              sanitized machine id ({@code loginMachine})
 * @param className       Java class name of the generated machine
 * @param displayName     human readable name
 * @param category        machine category
 * @param description     one-sentence description
 * @param initialState    name of the initial state
 * @param contextFields   context fields in declaration order
 * @param events          event catalog, one entry per distinct label
 * @param eventSymbols    every event used by a transition or listed in the
 *                        catalog mapped to its Java constant, catalog first
 * @param states          states in diagram order
 * @param guards          guard names
 * @param actions         action names
 * @param actors          actor names
 * @param requiredImports fully qualified imports of the machine source, sorted
 */
public record GeneratedMachine(String id, String className, String displayName, MachineCategory category,
        String description, String initialState, List<ContextField> contextFields, List<EventSpec> events,
        Map<String, String> eventSymbols, List<StateSpec> states, Set<String> guards, Set<String> actions,
        Set<String> actors, List<String> requiredImports) {

    public GeneratedMachine {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(initialState, "initialState");
        contextFields = List.copyOf(contextFields);
        events = List.copyOf(events);
        eventSymbols = Collections.unmodifiableMap(new LinkedHashMap<>(eventSymbols));
        states = List.copyOf(states);
        guards = Collections.unmodifiableSet(new LinkedHashSet<>(guards));
        actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        actors = Collections.unmodifiableSet(new LinkedHashSet<>(actors));
        requiredImports = List.copyOf(requiredImports);
    }

    /** Returns the state with the given name, or {@code null}. */
    public StateSpec state(String name) {
        for (StateSpec s : states)
            if (s.name().equals(name))
                return s;
        return null;
    }

    public StateSpec initial() {
        return state(initialState);
    }

    /** Symbol of a state name; names not in the machine yield {@code null}. */
    public String stateSymbol(String name) {
        StateSpec s = state(name);
        return s == null ? null : s.symbol();
    }

    /** Symbol of an event name, or {@code null}. */
    public String eventSymbol(String event) {
        return eventSymbols.get(event);
    }

    public boolean hasContextField(String name) {
        for (ContextField f : contextFields)
            if (f.name().equals(name))
                return true;
        return false;
    }

    public int transitionCount() {
        int n = 0;
        for (StateSpec s : states)
            n += s.transitions().size();
        return n;
    }
}
