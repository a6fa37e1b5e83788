package com.flowchart.fsmc.engine;

import com.flowchart.fsmc.ir.ContextField;
import com.flowchart.fsmc.ir.EventSpec;
import com.flowchart.fsmc.ir.FieldKind;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.ir.PayloadField;
import com.flowchart.fsmc.ir.StateKind;
import com.flowchart.fsmc.ir.StateSpec;
import com.flowchart.fsmc.ir.TransitionSpec;
import com.flowchart.fsmc.model.Edge;
import com.flowchart.fsmc.model.MachineCategory;
import com.flowchart.fsmc.model.Node;
import com.flowchart.fsmc.model.ParsedMachine;
import com.flowchart.fsmc.model.TransitionKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts a {@link ParsedMachine} into a {@link GeneratedMachine}.
 *
 * <p>
 * A pure function of its input and configuration: no I/O, no shared state,
 * so one instance may serve many machines, also concurrently.
 */
public final class SemanticGenerator {
    public static final String TRACE_ACTION = "logStateEntry";
    public static final String CLEANUP_ACTION = "cleanupSession";
    public static final String USER_VALIDATION = "validateUserSession";
    public static final String AGENT_VALIDATION = "validateAgentCredentials";
    public static final String EXTERNAL_ACTOR = "externalService";

    static final List<String> BASE_IMPORTS = List.of(
            "java.util.ArrayList",
            "java.util.Collections",
            "java.util.EnumMap",
            "java.util.LinkedHashMap",
            "java.util.List",
            "java.util.Map",
            "java.util.function.BiConsumer",
            "java.util.function.BiPredicate");

    private final GeneratorConfig config;

    public SemanticGenerator() {
        this(new GeneratorConfig());
    }

    public SemanticGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GeneratedMachine generate(ParsedMachine pm) {
        Objects.requireNonNull(pm, "machine");
        String id = Identifiers.machineId(pm.id());
        String displayName = Identifiers.displayName(
                pm.displayName() == null || pm.displayName().isBlank() ? pm.id() : pm.displayName());
        MachineCategory category = pm.category();

        List<ContextField> context = contextFields(pm);
        List<EventSpec> events = config.isInferEvents() ? events(pm) : List.of();
        List<StateSpec> states = states(pm);

        Map<String, String> eventSymbols = new LinkedHashMap<>();
        Set<String> usedSymbols = new HashSet<>(Identifiers.EVENT_ENUM_MEMBERS);
        for (EventSpec e : events) {
            eventSymbols.put(e.type(), e.symbol());
            usedSymbols.add(e.symbol());
        }
        for (StateSpec s : states)
            for (TransitionSpec t : s.transitions())
                if (!eventSymbols.containsKey(t.event()))
                    eventSymbols.put(t.event(), uniqueSymbol(t.event(), usedSymbols));

        String description = "Auto-generated " + category.description() + " machine with " + pm.nodes().size()
                + " states and " + pm.edges().size() + " transitions.";

        return new GeneratedMachine(id, Identifiers.className(id), displayName, category, description,
                pm.initialNodeId(), context, events, eventSymbols, states,
                config.isGenerateGuards() ? guards(pm) : Set.of(),
                config.isGenerateActions() ? actions(pm, states) : Set.of(),
                config.isGenerateActors() ? actors(pm) : Set.of(),
                imports(category));
    }

    // --- Context ---

    private List<ContextField> contextFields(ParsedMachine pm) {
        List<ContextField> fields = new ArrayList<>();
        if (config.isGenerateContext()) {
            fields.addAll(categoryFields(pm.category()));
            if (pm.nodes().size() > 3)
                fields.add(new ContextField("currentStep", FieldKind.NUMBER, "1", false, "Current step in the flow"));
        }
        fields.add(new ContextField("error", FieldKind.TEXT, "null", true, "Last error message"));
        if (config.isGenerateContext() && pm.edges().stream().anyMatch(e -> e.kind() == TransitionKind.USER_INPUT))
            fields.add(new ContextField("userInput", FieldKind.TEXT, "\"\"", true, "Last user input"));
        return fields;
    }

    /** Default context fields for a category. */
    static List<ContextField> categoryFields(MachineCategory category) {
        return switch (category) {
            case USER -> List.of(
                    new ContextField("phoneNumber", FieldKind.TEXT, "\"\"", false, "Subscriber phone number"),
                    new ContextField("sessionId", FieldKind.TEXT, "\"\"", false, "Session identifier"));
            case AGENT -> List.of(
                    new ContextField("agentId", FieldKind.TEXT, "\"\"", false, "Agent identifier"),
                    new ContextField("agentVerified", FieldKind.BOOL, "false", false, "Whether the agent is verified"));
            case INFO -> List.of(
                    new ContextField("currentPage", FieldKind.NUMBER, "1", false, "Current page"),
                    new ContextField("totalPages", FieldKind.NUMBER, "1", false, "Total number of pages"));
            case ACCOUNT -> List.of(
                    new ContextField("accountId", FieldKind.TEXT, "\"\"", false, "Account identifier"),
                    new ContextField("balance", FieldKind.NUMBER, "0", true, "Account balance"));
            case CORE -> List.of(
                    new ContextField("route", FieldKind.TEXT, "\"\"", false, "Selected route"));
        };
    }

    // --- Events ---

    private static List<EventSpec> events(ParsedMachine pm) {
        Map<String, EventSpec> byType = new LinkedHashMap<>();
        Set<String> usedSymbols = new HashSet<>(Identifiers.EVENT_ENUM_MEMBERS);
        for (Edge e : pm.edges()) {
            if (!e.hasLabel())
                continue;
            String type = Identifiers.eventType(e.label());
            if (type.isEmpty() || byType.containsKey(type))
                continue;
            byType.put(type, new EventSpec(type, uniqueSymbol(type, usedSymbols), payloadFor(e.kind()),
                    "Triggered by '" + e.label() + "' from " + e.from()));
        }
        return new ArrayList<>(byType.values());
    }

    static List<PayloadField> payloadFor(TransitionKind kind) {
        return switch (kind) {
            case USER_INPUT -> List.of(PayloadField.text("input"));
            case ERROR -> List.of(PayloadField.text("error"));
            case EXTERNAL -> List.of(PayloadField.opaque("data"));
            default -> List.of();
        };
    }

    private String eventFor(Edge e) {
        if (!config.isInferEvents() || !e.hasLabel())
            return Identifiers.UNKNOWN_EVENT;
        String type = Identifiers.eventType(e.label());
        return type.isEmpty() ? Identifiers.UNKNOWN_EVENT : type;
    }

    // --- States ---

    private List<StateSpec> states(ParsedMachine pm) {
        List<StateSpec> states = new ArrayList<>(pm.nodes().size());
        Set<String> usedSymbols = new HashSet<>(Identifiers.STATE_ENUM_MEMBERS);
        for (Node n : pm.nodes()) {
            List<TransitionSpec> transitions = new ArrayList<>();
            for (Edge e : pm.outgoing(n.id()))
                transitions.add(new TransitionSpec(eventFor(e), e.to(), e.guardName(),
                        e.actionName() != null ? List.of(e.actionName()) : List.of()));

            List<String> entry = new ArrayList<>();
            entry.add(TRACE_ACTION);
            if (n.hasClass(MachineCategory.USER.tag()))
                entry.add(USER_VALIDATION);
            if (n.hasClass(MachineCategory.AGENT.tag()))
                entry.add(AGENT_VALIDATION);

            boolean fin = n.finalState();
            states.add(new StateSpec(n.id(), uniqueSymbol(n.id(), usedSymbols),
                    fin ? StateKind.FINAL : StateKind.NORMAL, entry,
                    fin ? List.of(CLEANUP_ACTION) : List.of(), transitions, "State: " + n.label()));
        }
        return states;
    }

    // --- Guards, actions, actors, imports ---

    private Set<String> guards(ParsedMachine pm) {
        Set<String> guards = new LinkedHashSet<>();
        for (Edge e : pm.edges()) {
            if (e.guardName() != null)
                guards.add(e.guardName());
            if (e.kind() == TransitionKind.CONDITIONAL)
                guards.add(Identifiers.conditionalGuard(config.getGuardPrefix(), e.from()));
        }
        return guards;
    }

    private static Set<String> actions(ParsedMachine pm, List<StateSpec> states) {
        Set<String> actions = new LinkedHashSet<>();
        actions.add(TRACE_ACTION);
        actions.add(CLEANUP_ACTION);
        if (pm.category() == MachineCategory.USER)
            actions.add(USER_VALIDATION);
        if (pm.category() == MachineCategory.AGENT)
            actions.add(AGENT_VALIDATION);
        for (StateSpec s : states)
            actions.addAll(s.entry());
        for (Edge e : pm.edges())
            if (e.actionName() != null)
                actions.add(e.actionName());
        return actions;
    }

    private static Set<String> actors(ParsedMachine pm) {
        Set<String> actors = new LinkedHashSet<>();
        if (pm.edges().stream().anyMatch(e -> e.kind() == TransitionKind.EXTERNAL))
            actors.add(EXTERNAL_ACTOR);
        if (pm.category() == MachineCategory.USER)
            actors.add("userService");
        if (pm.category() == MachineCategory.AGENT)
            actors.add("agentService");
        return actors;
    }

    private List<String> imports(MachineCategory category) {
        Set<String> imports = new TreeSet<>(BASE_IMPORTS);
        if (category == MachineCategory.USER)
            imports.add("java.util.regex.Pattern");
        if (config.getAdditionalImports() != null)
            for (String imp : config.getAdditionalImports())
                if (imp != null && !imp.isBlank())
                    imports.add(imp.trim());
        return new ArrayList<>(imports);
    }

    private static String uniqueSymbol(String name, Set<String> used) {
        String base = Identifiers.javaConstant(name);
        String symbol = base;
        for (int i = 2; !used.add(symbol); i++)
            symbol = base + "_" + i;
        return symbol;
    }
}
