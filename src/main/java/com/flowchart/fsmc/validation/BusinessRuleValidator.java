package com.flowchart.fsmc.validation;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.Diagnostics;
import com.flowchart.fsmc.api.Severity;
import com.flowchart.fsmc.engine.StateTopology;
import com.flowchart.fsmc.model.MachineCategory;
import com.flowchart.fsmc.model.ParsedMachine;
import com.flowchart.fsmc.validation.MachineView.StateView;
import com.flowchart.fsmc.validation.MachineView.TransitionView;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Structural and domain checks over assembled machines.
 *
 * <p>
 * Checks run per machine (metadata, state table, transitions, reachability,
 * category heuristics, naming) and then across the batch (duplicate machine
 * names, missing user or core machines). The validator is stateless; all
 * findings go to the returned {@link ValidationResult}.
 */
@Log4j2
public final class BusinessRuleValidator {
    static final List<String> AUTH_HINTS = List.of("auth", "login", "session", "pin");
    static final List<String> MENU_HINTS = List.of("menu", "main");
    static final List<String> AGENT_HINTS = List.of("permission", "authorize", "verify");
    static final List<String> ACCOUNT_HINTS = List.of("balance", "account", "validate");
    static final List<String> ROUTING_HINTS = List.of("route", "dispatch", "select");
    static final List<String> RECOVERY_HINTS = List.of("error", "invalid", "back", "cancel", "retry");
    static final int INFO_COMPLEXITY_LIMIT = 10;

    private final ValidationConfig config;

    public BusinessRuleValidator() {
        this(new ValidationConfig());
    }

    public BusinessRuleValidator(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Validates parsed machines as one batch. */
    public ValidationResult validateMachines(List<ParsedMachine> machines) {
        List<MachineView> views = new ArrayList<>(machines.size());
        for (ParsedMachine pm : machines)
            views.add(MachineView.of(pm));
        return validate(views);
    }

    public ValidationResult validate(List<MachineView> machines) {
        Diagnostics diagnostics = new Diagnostics();
        if (machines.isEmpty()) {
            diagnostics.warning("No machines", "No machines to validate", null, "Check the diagram source");
            return ValidationResult.of(diagnostics);
        }
        for (MachineView m : machines)
            validate(m, diagnostics);
        validateBatch(machines, diagnostics);
        ValidationResult result = ValidationResult.of(diagnostics);
        log.debug("Business rules over {} machine(s): {} error(s), {} warning(s)", machines.size(),
                result.errorCount(), result.warningCount());
        return result;
    }

    /** Validates a single machine into the given accumulator. */
    public void validate(MachineView m, Diagnostics diagnostics) {
        String name = m.name() == null || m.name().isBlank() ? String.valueOf(m.id()) : m.name();
        if (reportNamelessStates(m, name, diagnostics))
            return;
        boolean initialOk = validateStructure(m, name, diagnostics);
        validateStates(m, name, diagnostics);
        validateTransitions(m, name, diagnostics);
        if (initialOk)
            validateReachability(m, name, diagnostics);
        if (config.isCheckBusinessRules() && m.category() != null)
            validateCategoryRules(m, name, diagnostics);
        if (config.isValidateNaming())
            validateNaming(m, name, diagnostics);
    }

    // --- Structure ---

    /** The remaining checks key on state names, so a machine with a nameless state stops here. */
    private static boolean reportNamelessStates(MachineView m, String name, Diagnostics d) {
        boolean found = false;
        for (int i = 0; i < m.states().size(); i++) {
            String state = m.states().get(i).name();
            if (state == null || state.isBlank()) {
                d.error("Missing state name", "State #" + (i + 1) + " of machine '" + name + "' has no name", null);
                found = true;
            }
        }
        return found;
    }

    /** @return whether the initial state is present among the states */
    private boolean validateStructure(MachineView m, String name, Diagnostics d) {
        if (m.id() == null || m.id().isBlank())
            d.error("Missing machine id", "Machine '" + name + "' has no id", null);
        if (m.name() == null || m.name().isBlank())
            d.error("Missing machine name", "Machine '" + name + "' has no name", null);
        if (m.category() == null)
            d.error("Missing category", "Machine '" + name + "' has no category", null,
                    "Tag states with a category class such as user-machine");
        else if (!config.getAllowedCategories().contains(m.category()))
            d.error("Invalid category", "Machine '" + name + "' has category '" + m.category().id()
                    + "' which is not allowed", null, "Allowed: " + config.getAllowedCategories());

        if (m.states().isEmpty()) {
            d.error("No states", "Machine '" + name + "' has no states", null);
            return false;
        }
        if (m.states().size() > config.getMaxStatesPerMachine())
            d.warning("Too many states", "Machine '" + name + "' has " + m.states().size()
                    + " states (limit " + config.getMaxStatesPerMachine() + ")", null,
                    "Split the flow into several machines");

        if (m.initialState() == null || m.initialState().isBlank()) {
            d.error("Missing initial state", "Machine '" + name + "' has no initial state", null);
            return false;
        }
        for (StateView s : m.states())
            if (s.name().equals(m.initialState()))
                return true;
        d.error("Invalid initial state", "Initial state '" + m.initialState() + "' of machine '" + name
                + "' is not a declared state", null);
        return false;
    }

    private void validateStates(MachineView m, String name, Diagnostics d) {
        Set<String> seen = new HashSet<>();
        int finals = 0;
        for (StateView s : m.states()) {
            if (!seen.add(s.name()))
                d.error("Duplicate state", "State '" + s.name() + "' is declared more than once in machine '"
                        + name + "'", null);
            if (s.finalState())
                finals++;
        }
        if (finals == 0 && m.category() == MachineCategory.USER)
            d.warning("No final state", "User machine '" + name + "' has no final state", null,
                    "Mark an exit state with a circle shape or an end/exit label");
        if (finals > config.getMaxFinalStates())
            d.warning("Too many final states", "Machine '" + name + "' has " + finals + " final states", null,
                    "Consider merging exit states");
    }

    private void validateTransitions(MachineView m, String name, Diagnostics d) {
        Set<String> names = new HashSet<>();
        for (StateView s : m.states())
            names.add(s.name());
        for (StateView s : m.states()) {
            int count = s.transitions().size();
            if (count > config.getMaxTransitionsPerState())
                d.warning("Too many transitions", "State '" + s.name() + "' has " + count + " transitions (limit "
                        + config.getMaxTransitionsPerState() + ")", null, "Introduce an intermediate menu state");
            if (s.finalState() && count > 0)
                d.error("Final state with transitions", "Final state '" + s.name() + "' in machine '" + name
                        + "' has " + count + " outgoing transition(s)", null,
                        "Remove the transitions or make the state non-final");
            if (!s.finalState() && count == 0)
                d.warning("Dead-end state", "State '" + s.name() + "' in machine '" + name
                        + "' has no outgoing transitions and is not final", null,
                        "Add a transition or mark the state as final");
            for (TransitionView t : s.transitions())
                if (t.target() == null || !names.contains(t.target()))
                    d.error("Invalid transition target", "Transition '" + t.event() + "' from '" + s.name()
                            + "' targets unknown state '" + t.target() + "'", null);
        }
    }

    private void validateReachability(MachineView m, String name, Diagnostics d) {
        StateTopology.Builder b = StateTopology.builder();
        for (StateView s : m.states())
            b.addState(s.name());
        for (StateView s : m.states())
            for (TransitionView t : s.transitions())
                if (t.target() != null && b.hasState(t.target()))
                    b.addTransition(s.name(), t.target());
        for (String unreachable : b.build().unreachableFrom(m.initialState()))
            d.warning("Unreachable state", "State '" + unreachable + "' in machine '" + name
                    + "' is not reachable from '" + m.initialState() + "'", null,
                    "Add a transition leading to it or remove it");
    }

    // --- Category heuristics ---

    private void validateCategoryRules(MachineView m, String name, Diagnostics d) {
        switch (m.category()) {
            case USER -> {
                if (!anyStateMatches(m, AUTH_HINTS))
                    d.warning("Missing authentication", "User machine '" + name + "' has no authentication state",
                            null, "Add a state such as Login or Authenticate");
                if (!anyStateMatches(m, MENU_HINTS))
                    d.warning("Missing menu", "User machine '" + name + "' has no menu state", null,
                            "Add a MainMenu state");
                validateInputRecovery(m, name, d);
            }
            case AGENT -> {
                if (!anyStateMatches(m, AGENT_HINTS))
                    d.warning("Missing authorization", "Agent machine '" + name
                            + "' has no permission or authorization state", null, "Add an AuthorizeAgent state");
            }
            case ACCOUNT -> {
                if (!anyStateMatches(m, ACCOUNT_HINTS))
                    d.warning("Missing account validation", "Account machine '" + name
                            + "' has no balance or account validation state", null, "Add a ValidateAccount state");
            }
            case INFO -> {
                if (m.states().size() > INFO_COMPLEXITY_LIMIT)
                    d.warning("Complex information machine", "Information machine '" + name + "' has "
                            + m.states().size() + " states", null, "Information flows should stay simple");
            }
            case CORE -> {
                if (!anyStateMatches(m, ROUTING_HINTS))
                    d.warning("Missing routing", "Core machine '" + name + "' has no routing state", null,
                            "Add a Route or Dispatch state");
            }
        }
    }

    private static void validateInputRecovery(MachineView m, String name, Diagnostics d) {
        for (StateView s : m.states()) {
            if (!contains(s.name(), List.of("input", "enter")) || s.finalState())
                continue;
            boolean recovers = false;
            for (TransitionView t : s.transitions())
                if (contains(t.event(), RECOVERY_HINTS) || contains(t.target(), RECOVERY_HINTS))
                    recovers = true;
            if (!recovers)
                d.warning("Missing error handling", "Input state '" + s.name() + "' in machine '" + name
                        + "' has no error, back or cancel transition", null, "Add an ERROR or BACK transition");
        }
    }

    private static boolean anyStateMatches(MachineView m, List<String> hints) {
        for (StateView s : m.states())
            if (contains(s.name(), hints))
                return true;
        return false;
    }

    private static boolean contains(String text, List<String> hints) {
        if (text == null)
            return false;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String h : hints)
            if (lower.contains(h))
                return true;
        return false;
    }

    // --- Naming ---

    private void validateNaming(MachineView m, String name, Diagnostics d) {
        Severity severity = config.namingIsError() ? Severity.ERROR : Severity.WARNING;
        for (StateView s : m.states()) {
            if (!DiagramValidator.PASCAL_CASE.matcher(s.name()).matches())
                d.add(new Diagnostic("State naming convention", "State '" + s.name() + "' in machine '" + name
                        + "' is not PascalCase", null, severity, "Rename to " + DiagramValidator.toPascalCase(s.name())));
            for (TransitionView t : s.transitions())
                if (t.event() != null && !DiagramValidator.UPPER_SNAKE.matcher(t.event()).matches())
                    d.add(new Diagnostic("Event naming convention", "Event '" + t.event() + "' from '" + s.name()
                            + "' is not UPPER_SNAKE_CASE", null, severity, "Use UPPER_SNAKE_CASE event names"));
        }
    }

    // --- Batch ---

    private static void validateBatch(List<MachineView> machines, Diagnostics d) {
        Map<String, Integer> byName = new HashMap<>();
        Set<MachineCategory> categories = new HashSet<>();
        for (MachineView m : machines) {
            if (m.name() != null && byName.merge(m.name(), 1, Integer::sum) == 2)
                d.error("Duplicate machine name", "Machine name '" + m.name() + "' is used more than once", null,
                        "Give every diagram a distinct name");
            if (m.category() != null)
                categories.add(m.category());
        }
        if (!categories.contains(MachineCategory.USER))
            d.warning("Missing user machine", "Batch contains no user machine", null,
                    "Tag a diagram's states with user-machine");
        if (!categories.contains(MachineCategory.CORE))
            d.warning("Missing core machine", "Batch contains no core routing machine", null,
                    "Tag a diagram's states with core-machine");
    }
}
