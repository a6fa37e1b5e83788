package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.engine.SemanticGenerator;
import com.flowchart.fsmc.ir.ContextField;
import com.flowchart.fsmc.ir.EventSpec;
import com.flowchart.fsmc.ir.FieldKind;
import com.flowchart.fsmc.ir.GeneratedMachine;
import com.flowchart.fsmc.ir.PayloadField;
import com.flowchart.fsmc.ir.StateSpec;
import com.flowchart.fsmc.ir.TransitionSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the machine class itself.
 *
 * <p>
 * The generated class is self-contained: {@code State} and {@code EventType}
 * enums, an immutable {@code Event}, a mutable {@code Context}, a static
 * transition table and instance registries of guards and actions, with
 * {@code start}, {@code startAt}, {@code stop} and {@code send} as its API.
 */
public final class MachineEmitter implements Emitter {
    private final OutputLayout layout;

    public MachineEmitter(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public EmitterKind kind() {
        return EmitterKind.MACHINE;
    }

    @Override
    public String render(GeneratedMachine m) {
        Objects.requireNonNull(m, "machine");
        String cls = m.className();
        CodeWriter w = new CodeWriter();

        Sources.fileHeader(w, m, "state machine");
        w.line("package " + layout.machinePackage(m.category()) + ";").line();
        for (String imp : m.requiredImports())
            w.line("import " + imp + ";");
        w.line();

        w.line("/**");
        w.line(" * " + CodeWriter.docText(m.displayName()) + " state machine.");
        w.line(" * <p>");
        w.line(" * " + CodeWriter.docText(m.description()));
        w.line(" */");
        w.open("public final class " + cls);
        constants(w, m);
        stateEnum(w, m);
        eventEnum(w, m);
        eventClass(w);
        contextClass(w, m);
        transitionClass(w);
        tables(w, m);
        instance(w, m, cls);
        w.close();
        return w.toString();
    }

    // --- Constants ---

    private static void constants(CodeWriter w, GeneratedMachine m) {
        w.line("public static final String MACHINE_ID = " + CodeWriter.quote(m.id()) + ";");
        w.line("public static final String DISPLAY_NAME = " + CodeWriter.quote(m.displayName()) + ";");
        w.line("public static final String CATEGORY = " + CodeWriter.quote(m.category().id()) + ";");
        w.line("public static final State INITIAL_STATE = State." + m.stateSymbol(m.initialState()) + ";");
        w.line("public static final List<String> GUARDS = " + Sources.stringList(m.guards()) + ";");
        w.line("public static final List<String> ACTIONS = " + Sources.stringList(m.actions()) + ";");
        w.line("public static final List<String> ACTORS = " + Sources.stringList(m.actors()) + ";");
        if (validatesPhone(m))
            w.line("private static final Pattern PHONE_NUMBER = Pattern.compile("
                    + CodeWriter.quote(Sources.PHONE_PATTERN) + ");");
        w.line();
    }

    private static boolean validatesPhone(GeneratedMachine m) {
        ContextField phone = Sources.field(m, "phoneNumber");
        return phone != null && phone.kind() == FieldKind.TEXT
                && m.requiredImports().contains("java.util.regex.Pattern");
    }

    // --- Enums ---

    private static void stateEnum(CodeWriter w, GeneratedMachine m) {
        w.doc("Machine states.");
        w.open("public enum State");
        List<StateSpec> states = m.states();
        for (int i = 0; i < states.size(); i++) {
            StateSpec s = states.get(i);
            w.doc(s.doc());
            w.line(s.symbol() + "(" + CodeWriter.quote(s.name()) + ", " + s.isFinal() + ")"
                    + (i < states.size() - 1 ? "," : ";"));
        }
        w.line();
        // field names are kept out of the state symbols by Identifiers.STATE_ENUM_MEMBERS
        w.line("private final String stateId;");
        w.line("private final boolean finalState;");
        w.line();
        w.open("State(String stateId, boolean finalState)");
        w.line("this.stateId = stateId;");
        w.line("this.finalState = finalState;");
        w.close();
        w.line();
        w.open("public String id()");
        w.line("return stateId;");
        w.close();
        w.line();
        w.open("public boolean isFinal()");
        w.line("return finalState;");
        w.close();
        w.close();
        w.line();
    }

    private static void eventEnum(CodeWriter w, GeneratedMachine m) {
        w.doc("Event types accepted by the machine.");
        w.open("public enum EventType");
        List<Map.Entry<String, String>> entries = new ArrayList<>(m.eventSymbols().entrySet());
        if (entries.isEmpty())
            w.line(";");
        for (int i = 0; i < entries.size(); i++) {
            String type = entries.get(i).getKey();
            EventSpec spec = eventSpec(m, type);
            StringBuilder args = new StringBuilder(CodeWriter.quote(type));
            if (spec != null) {
                w.doc(spec.doc());
                for (PayloadField p : spec.payload())
                    args.append(", ").append(CodeWriter.quote(p.name()));
            } else {
                w.doc("Unlabeled transition");
            }
            w.line(entries.get(i).getValue() + "(" + args + ")" + (i < entries.size() - 1 ? "," : ";"));
        }
        w.line();
        w.line("private final String type;");
        w.line("private final List<String> payloadFields;");
        w.line();
        w.open("EventType(String type, String... payloadFields)");
        w.line("this.type = type;");
        w.line("this.payloadFields = List.of(payloadFields);");
        w.close();
        w.line();
        w.open("public String type()");
        w.line("return type;");
        w.close();
        w.line();
        w.doc("Names of the payload entries this event carries.");
        w.open("public List<String> payloadFields()");
        w.line("return payloadFields;");
        w.close();
        w.line();
        w.doc("Resolves an event type by name, or returns null.");
        w.open("public static EventType fromType(String type)");
        w.open("for (EventType e : values())");
        w.line("if (e.type.equals(type))");
        w.line("    return e;");
        w.close();
        w.line("return null;");
        w.close();
        w.close();
        w.line();
    }

    private static EventSpec eventSpec(GeneratedMachine m, String type) {
        for (EventSpec e : m.events())
            if (e.type().equals(type))
                return e;
        return null;
    }

    // --- Nested classes ---

    private static void eventClass(CodeWriter w) {
        w.doc("An event with its payload. Payload values may be null.");
        w.open("public static final class Event");
        w.line("private final EventType type;");
        w.line("private final Map<String, Object> payload;");
        w.line();
        w.open("private Event(EventType type, Map<String, Object> payload)");
        w.line("this.type = type;");
        w.line("this.payload = payload;");
        w.close();
        w.line();
        w.open("public static Event of(EventType type)");
        w.line("return new Event(type, Collections.<String, Object>emptyMap());");
        w.close();
        w.line();
        w.open("public static Event of(EventType type, Map<String, ?> payload)");
        w.line("if (payload == null)");
        w.line("    return of(type);");
        w.line("return new Event(type, Collections.unmodifiableMap(new LinkedHashMap<String, Object>(payload)));");
        w.close();
        w.line();
        w.open("public EventType type()");
        w.line("return type;");
        w.close();
        w.line();
        w.open("public Map<String, Object> payload()");
        w.line("return payload;");
        w.close();
        w.line();
        w.open("public Object get(String key)");
        w.line("return payload.get(key);");
        w.close();
        w.close();
        w.line();
    }

    private static void contextClass(CodeWriter w, GeneratedMachine m) {
        w.doc("Mutable machine context.");
        w.open("public static final class Context");
        for (ContextField f : m.contextFields()) {
            w.doc(f.doc() + (f.optional() ? " (optional)" : ""));
            w.line("private " + f.javaType() + " " + f.name() + " = " + f.defaultLiteral() + ";");
        }
        for (ContextField f : m.contextFields()) {
            w.line();
            w.open("public " + f.javaType() + " " + Sources.getter(f) + "()");
            w.line("return " + f.name() + ";");
            w.close();
            w.line();
            w.open("public void " + Sources.setter(f) + "(" + f.javaType() + " " + f.name() + ")");
            w.line("this." + f.name() + " = " + f.name() + ";");
            w.close();
        }
        w.line();
        w.doc("Returns an independent copy.");
        w.open("public Context copy()");
        w.line("Context copy = new Context();");
        for (ContextField f : m.contextFields())
            w.line("copy." + f.name() + " = " + f.name() + ";");
        w.line("return copy;");
        w.close();
        w.line();
        w.doc("Field values keyed by field name.");
        w.open("public Map<String, Object> toMap()");
        w.line("Map<String, Object> map = new LinkedHashMap<>();");
        for (ContextField f : m.contextFields())
            w.line("map.put(" + CodeWriter.quote(f.name()) + ", " + f.name() + ");");
        w.line("return map;");
        w.close();
        w.close();
        w.line();
    }

    private static void transitionClass(CodeWriter w) {
        w.doc("One row of the transition table. A null target keeps the current state.");
        w.open("public static final class Transition");
        w.line("private final EventType event;");
        w.line("private final State target;");
        w.line("private final String guard;");
        w.line("private final List<String> actions;");
        w.line();
        w.open("Transition(EventType event, State target, String guard, List<String> actions)");
        w.line("this.event = event;");
        w.line("this.target = target;");
        w.line("this.guard = guard;");
        w.line("this.actions = actions;");
        w.close();
        w.line();
        for (String[] accessor : new String[][] {
                { "EventType", "event" }, { "State", "target" }, { "String", "guard" }, { "List<String>", "actions" } }) {
            w.open("public " + accessor[0] + " " + accessor[1] + "()");
            w.line("return " + accessor[1] + ";");
            w.close();
            w.line();
        }
        w.close();
        w.line();
    }

    // --- Tables ---

    private static void tables(CodeWriter w, GeneratedMachine m) {
        w.line("private static final Map<State, List<Transition>> TRANSITIONS = new EnumMap<>(State.class);");
        w.line("private static final Map<State, List<String>> ENTRY_ACTIONS = new EnumMap<>(State.class);");
        w.line("private static final Map<State, List<String>> EXIT_ACTIONS = new EnumMap<>(State.class);");
        w.line();
        w.open("static");
        for (StateSpec s : m.states()) {
            String key = "State." + s.symbol();
            if (s.transitions().isEmpty()) {
                w.line("TRANSITIONS.put(" + key + ", List.of());");
            } else {
                w.line("TRANSITIONS.put(" + key + ", List.of(");
                w.indent().indent();
                List<TransitionSpec> rows = s.transitions();
                for (int i = 0; i < rows.size(); i++)
                    w.line(transitionLiteral(m, rows.get(i)) + (i < rows.size() - 1 ? "," : "));"));
                w.outdent().outdent();
            }
            w.line("ENTRY_ACTIONS.put(" + key + ", " + Sources.stringList(s.entry()) + ");");
            w.line("EXIT_ACTIONS.put(" + key + ", " + Sources.stringList(s.exit()) + ");");
        }
        w.close();
        w.line();
    }

    private static String transitionLiteral(GeneratedMachine m, TransitionSpec t) {
        String targetSymbol = t.target() == null ? null : m.stateSymbol(t.target());
        return "new Transition(EventType." + m.eventSymbol(t.event()) + ", "
                + (targetSymbol == null ? "null" : "State." + targetSymbol) + ", "
                + CodeWriter.quote(t.guard()) + ", " + Sources.stringList(t.actions()) + ")";
    }

    // --- Instance API ---

    private static void instance(CodeWriter w, GeneratedMachine m, String cls) {
        w.line("private final Context context;");
        w.line("private final Map<String, BiPredicate<Context, Event>> guards = new LinkedHashMap<>();");
        w.line("private final Map<String, BiConsumer<Context, Event>> actions = new LinkedHashMap<>();");
        w.line("private final List<String> trace = new ArrayList<>();");
        w.line("private State state = INITIAL_STATE;");
        w.line("private boolean running;");
        w.line();
        w.open("public " + cls + "()");
        w.line("this(new Context());");
        w.close();
        w.line();
        w.open("public " + cls + "(Context context)");
        w.line("this.context = context != null ? context : new Context();");
        w.line("registerDefaults();");
        w.close();
        w.line();
        registerDefaults(w, m);
        w.doc("Replaces a guard implementation.");
        w.open("public " + cls + " withGuard(String name, BiPredicate<Context, Event> guard)");
        w.line("if (name == null || guard == null)");
        w.line("    throw new IllegalArgumentException(\"guard name and implementation are required\");");
        w.line("guards.put(name, guard);");
        w.line("return this;");
        w.close();
        w.line();
        w.doc("Replaces an action implementation.");
        w.open("public " + cls + " withAction(String name, BiConsumer<Context, Event> action)");
        w.line("if (name == null || action == null)");
        w.line("    throw new IllegalArgumentException(\"action name and implementation are required\");");
        w.line("actions.put(name, action);");
        w.line("return this;");
        w.close();
        w.line();
        w.doc("Starts in the initial state and runs its entry actions.");
        w.open("public " + cls + " start()");
        w.line("return startAt(INITIAL_STATE);");
        w.close();
        w.line();
        w.doc("Starts in the given state and runs its entry actions.");
        w.open("public " + cls + " startAt(State from)");
        w.line("if (from == null)");
        w.line("    throw new IllegalArgumentException(\"state must not be null\");");
        w.line("state = from;");
        w.line("running = true;");
        w.line("runActions(ENTRY_ACTIONS.get(state), null);");
        w.line("return this;");
        w.close();
        w.line();
        w.doc("Stops the machine, running the exit actions of a final state.");
        w.open("public void stop()");
        w.line("if (running && state.isFinal())");
        w.line("    runActions(EXIT_ACTIONS.get(state), null);");
        w.line("running = false;");
        w.close();
        w.line();
        simpleGetter(w, "boolean", "isRunning", "running");
        simpleGetter(w, "boolean", "isDone", "state.isFinal()");
        simpleGetter(w, "State", "state", "state");
        simpleGetter(w, "Context", "context", "context");
        simpleGetter(w, "List<String>", "trace", "Collections.unmodifiableList(trace)");
        w.doc("Transitions leaving a state, in declaration order.");
        w.open("public static List<Transition> transitionsFrom(State from)");
        w.line("List<Transition> rows = TRANSITIONS.get(from);");
        w.line("return rows != null ? rows : Collections.<Transition>emptyList();");
        w.close();
        w.line();
        w.doc("Event types with at least one transition from the current state.");
        w.open("public List<EventType> availableEvents()");
        w.line("List<EventType> events = new ArrayList<>();");
        w.line("for (Transition t : transitionsFrom(state))");
        w.line("    if (!events.contains(t.event()))");
        w.line("        events.add(t.event());");
        w.line("return events;");
        w.close();
        w.line();
        w.open("public boolean send(EventType type)");
        w.line("return send(type == null ? null : Event.of(type));");
        w.close();
        w.line();
        w.line("/**");
        w.line(" * Dispatches an event. The first transition whose event matches and whose");
        w.line(" * guard passes fires. Events are ignored while stopped or in a final state.");
        w.line(" *");
        w.line(" * @return true if a transition fired");
        w.line(" */");
        w.open("public boolean send(Event event)");
        w.line("if (!running || event == null || event.type() == null || state.isFinal())");
        w.line("    return false;");
        w.line("capture(event);");
        w.open("for (Transition t : transitionsFrom(state))");
        w.line("if (t.event() != event.type())");
        w.line("    continue;");
        w.line("if (t.guard() != null && !guardPasses(t.guard(), event))");
        w.line("    continue;");
        w.line("runActions(EXIT_ACTIONS.get(state), event);");
        w.line("runActions(t.actions(), event);");
        w.line("if (t.target() != null)");
        w.line("    state = t.target();");
        ContextField step = Sources.field(m, "currentStep");
        if (step != null && !step.nullable())
            w.line("context.setCurrentStep(context.getCurrentStep() + 1);");
        w.line("runActions(ENTRY_ACTIONS.get(state), event);");
        w.line("return true;");
        w.close();
        w.line("return false;");
        w.close();
        w.line();
        capture(w, m);
        w.open("private boolean guardPasses(String name, Event event)");
        w.line("BiPredicate<Context, Event> guard = guards.get(name);");
        w.line("return guard == null || guard.test(context, event);");
        w.close();
        w.line();
        w.open("private void runActions(List<String> names, Event event)");
        w.line("if (names == null)");
        w.line("    return;");
        w.open("for (String name : names)");
        w.line("BiConsumer<Context, Event> action = actions.get(name);");
        w.line("if (action != null)");
        w.line("    action.accept(context, event);");
        w.close();
        w.close();
    }

    private static void simpleGetter(CodeWriter w, String type, String name, String expr) {
        w.open("public " + type + " " + name + "()");
        w.line("return " + expr + ";");
        w.close();
        w.line();
    }

    private static void registerDefaults(CodeWriter w, GeneratedMachine m) {
        w.open("private void registerDefaults()");
        for (String g : m.guards())
            w.line("guards.put(" + CodeWriter.quote(g) + ", (ctx, event) -> true);");
        for (String a : m.actions()) {
            String name = CodeWriter.quote(a);
            if (a.equals(SemanticGenerator.TRACE_ACTION)) {
                w.line("actions.put(" + name + ", (ctx, event) -> trace.add("
                        + CodeWriter.quote(Sources.TRACE_ENTER) + " + state.id()));");
            } else if (a.equals(SemanticGenerator.CLEANUP_ACTION)) {
                w.line("actions.put(" + name + ", (ctx, event) -> trace.add("
                        + CodeWriter.quote(Sources.TRACE_CLEANUP) + " + state.id()));");
            } else if (a.equals(SemanticGenerator.USER_VALIDATION) && validatesPhone(m)) {
                w.open("actions.put(" + name + ", (ctx, event) ->");
                w.line("String phone = ctx.getPhoneNumber();");
                w.line("if (phone != null && !phone.isEmpty() && !PHONE_NUMBER.matcher(phone).matches())");
                w.line("    ctx.setError(\"Invalid phone number\");");
                w.line("trace.add(" + CodeWriter.quote(Sources.TRACE_ACTION + a) + ");");
                w.close(");");
            } else if (a.equals(SemanticGenerator.AGENT_VALIDATION) && m.hasContextField("agentId")
                    && m.hasContextField("agentVerified")) {
                w.open("actions.put(" + name + ", (ctx, event) ->");
                w.line("ctx.setAgentVerified(ctx.getAgentId() != null && !ctx.getAgentId().isEmpty());");
                w.line("trace.add(" + CodeWriter.quote(Sources.TRACE_ACTION + a) + ");");
                w.close(");");
            } else {
                w.line("actions.put(" + name + ", (ctx, event) -> trace.add("
                        + CodeWriter.quote(Sources.TRACE_ACTION + a) + "));");
            }
        }
        w.close();
        w.line();
    }

    private static void capture(CodeWriter w, GeneratedMachine m) {
        w.doc("Copies well-known payload entries into the context.");
        w.open("private void capture(Event event)");
        ContextField error = Sources.field(m, "error");
        if (error != null && error.kind() == FieldKind.TEXT) {
            w.line("Object error = event.get(\"error\");");
            w.line("if (error instanceof String)");
            w.line("    context." + Sources.setter(error) + "((String) error);");
        }
        ContextField input = Sources.field(m, "userInput");
        if (input != null && input.kind() == FieldKind.TEXT) {
            w.line("Object input = event.get(\"input\");");
            w.line("if (input instanceof String)");
            w.line("    context." + Sources.setter(input) + "((String) input);");
        }
        w.close();
        w.line();
    }
}
