package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;
import com.flowchart.fsmc.ir.FieldKind;
import com.flowchart.fsmc.ir.GeneratedMachine;

import java.util.Objects;

/**
 * Renders a thin session-keyed service over a machine. Each session owns one
 * machine instance; helpers specific to the machine's category are added
 * when the matching context fields exist.
 */
public final class ServiceEmitter implements Emitter {
    /** Longest user input accepted by generated services. */
    static final int MAX_INPUT_LENGTH = 182;

    private final OutputLayout layout;

    public ServiceEmitter(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public EmitterKind kind() {
        return EmitterKind.SERVICE;
    }

    @Override
    public String render(GeneratedMachine m) {
        Objects.requireNonNull(m, "machine");
        String cls = m.className();
        String svc = EmitterKind.SERVICE.typeName(cls);
        CodeWriter w = new CodeWriter();
        Sources.fileHeader(w, m, "service");
        w.line("package " + layout.servicePackage(m.category()) + ";").line();
        w.line("import " + layout.machineClass(m) + ";").line();
        w.line("import java.util.Collections;");
        w.line("import java.util.Locale;");
        w.line("import java.util.Map;");
        w.line("import java.util.Set;");
        w.line("import java.util.concurrent.ConcurrentHashMap;").line();
        w.doc("Session-keyed service for " + m.displayName() + ".");
        w.open("public class " + svc);
        w.line("public static final int MAX_INPUT_LENGTH = " + MAX_INPUT_LENGTH + ";");
        w.line();
        w.line("private final Map<String, " + cls + "> sessions = new ConcurrentHashMap<>();");
        w.line();
        response(w);
        exception(w);
        sessions(w, cls);
        input(w, cls);
        categoryHelpers(w, m, cls);
        w.open("private " + cls + " require(String sessionId)");
        w.line(cls + " machine = sessionId == null ? null : sessions.get(sessionId);");
        w.line("if (machine == null)");
        w.line("    throw new ServiceException(\"Unknown session: \" + sessionId);");
        w.line("return machine;");
        w.close();
        w.line();
        w.open("private static Response response(String sessionId, " + cls + " machine, boolean accepted, String message)");
        w.line("return new Response(sessionId, machine.state().id(), accepted, machine.isDone(), message);");
        w.close();
        w.close();
        return w.toString();
    }

    private static void response(CodeWriter w) {
        w.doc("Outcome of a service call.");
        w.open("public static final class Response");
        String[][] fields = { { "String", "sessionId" }, { "String", "state" }, { "boolean", "accepted" },
                { "boolean", "done" }, { "String", "message" } };
        for (String[] f : fields)
            w.line("private final " + f[0] + " " + f[1] + ";");
        w.line();
        w.open("public Response(String sessionId, String state, boolean accepted, boolean done, String message)");
        for (String[] f : fields)
            w.line("this." + f[1] + " = " + f[1] + ";");
        w.close();
        for (String[] f : fields) {
            w.line();
            w.open("public " + f[0] + " " + ("boolean".equals(f[0]) ? "is" : "get") + Sources.capitalize(f[1]) + "()");
            w.line("return " + f[1] + ";");
            w.close();
        }
        w.close();
        w.line();
    }

    private static void exception(CodeWriter w) {
        w.doc("Raised for unknown sessions, unknown events and rejected input.");
        w.open("public static class ServiceException extends RuntimeException");
        w.line("private static final long serialVersionUID = 1L;");
        w.line();
        w.open("public ServiceException(String message)");
        w.line("super(message);");
        w.close();
        w.close();
        w.line();
    }

    private static void sessions(CodeWriter w, String cls) {
        w.open("public Response startSession(String sessionId)");
        w.line("if (sessionId == null || sessionId.isBlank())");
        w.line("    throw new ServiceException(\"Session id is required\");");
        w.line(cls + " machine = new " + cls + "().start();");
        w.line("if (sessions.putIfAbsent(sessionId, machine) != null)");
        w.line("    throw new ServiceException(\"Session already active: \" + sessionId);");
        w.line("return response(sessionId, machine, true, \"Session started\");");
        w.close();
        w.line();
        w.doc("Sends an event to a session's machine. Unknown event types are rejected.");
        w.open("public Response handle(String sessionId, String eventType, Map<String, ?> payload)");
        w.line(cls + " machine = require(sessionId);");
        w.line(cls + ".EventType type = eventType == null ? null");
        w.line("        : " + cls + ".EventType.fromType(eventType.trim().toUpperCase(Locale.ROOT));");
        w.line("if (type == null)");
        w.line("    throw new ServiceException(\"Unknown event: \" + eventType);");
        w.line("boolean accepted = machine.send(" + cls + ".Event.of(type, payload));");
        w.line("return response(sessionId, machine, accepted, accepted ? \"OK\" : \"Event not accepted\");");
        w.close();
        w.line();
        w.open("public boolean endSession(String sessionId)");
        w.line(cls + " machine = sessionId == null ? null : sessions.remove(sessionId);");
        w.line("if (machine == null)");
        w.line("    return false;");
        w.line("machine.stop();");
        w.line("return true;");
        w.close();
        w.line();
        w.open("public Set<String> activeSessions()");
        w.line("return Collections.unmodifiableSet(sessions.keySet());");
        w.close();
        w.line();
        w.open("public " + cls + ".State currentState(String sessionId)");
        w.line("return require(sessionId).state();");
        w.close();
        w.line();
    }

    private static void input(CodeWriter w, String cls) {
        w.doc("Trims and checks raw user input.");
        w.open("public String validateUserInput(String input)");
        w.line("if (input == null)");
        w.line("    throw new ServiceException(\"Input is required\");");
        w.line("String trimmed = input.trim();");
        w.line("if (trimmed.length() > MAX_INPUT_LENGTH)");
        w.line("    throw new ServiceException(\"Input longer than \" + MAX_INPUT_LENGTH + \" characters\");");
        w.line("return trimmed;");
        w.close();
        w.line();
        w.doc("Records an error on the session's context.");
        w.open("public Response handleError(String sessionId, Throwable error)");
        w.line(cls + " machine = require(sessionId);");
        w.line("String message = error == null || error.getMessage() == null ? \"Unknown error\" : error.getMessage();");
        w.line("machine.context().setError(message);");
        w.line("return response(sessionId, machine, false, message);");
        w.close();
        w.line();
    }

    private static boolean has(GeneratedMachine m, String name, FieldKind kind) {
        return Sources.field(m, name) != null && Sources.field(m, name).kind() == kind
                && !Sources.field(m, name).nullable();
    }

    private static void categoryHelpers(CodeWriter w, GeneratedMachine m, String cls) {
        switch (m.category()) {
            case USER -> {
                if (!has(m, "phoneNumber", FieldKind.TEXT))
                    return;
                w.open("public Response registerPhoneNumber(String sessionId, String phoneNumber)");
                w.line(cls + " machine = require(sessionId);");
                w.line("machine.context().setPhoneNumber(validateUserInput(phoneNumber));");
                w.line("return response(sessionId, machine, true, \"Phone number registered\");");
                w.close();
                w.line();
            }
            case AGENT -> {
                if (!has(m, "agentId", FieldKind.TEXT) || !has(m, "agentVerified", FieldKind.BOOL))
                    return;
                w.open("public Response authenticateAgent(String sessionId, String agentId)");
                w.line(cls + " machine = require(sessionId);");
                w.line("String id = validateUserInput(agentId);");
                w.line("machine.context().setAgentId(id);");
                w.line("machine.context().setAgentVerified(!id.isEmpty());");
                w.line("return response(sessionId, machine, !id.isEmpty(), id.isEmpty() ? \"Agent id is required\" : \"Agent verified\");");
                w.close();
                w.line();
            }
            case INFO -> {
                if (!has(m, "currentPage", FieldKind.NUMBER) || !has(m, "totalPages", FieldKind.NUMBER))
                    return;
                w.open("public Response nextPage(String sessionId)");
                w.line(cls + ".Context context = require(sessionId).context();");
                w.line("boolean moved = context.getCurrentPage() < context.getTotalPages();");
                w.line("if (moved)");
                w.line("    context.setCurrentPage(context.getCurrentPage() + 1);");
                w.line("return response(sessionId, require(sessionId), moved, \"Page \" + context.getCurrentPage());");
                w.close();
                w.line();
            }
            case ACCOUNT -> {
                if (!has(m, "balance", FieldKind.NUMBER))
                    return;
                w.open("public int balance(String sessionId)");
                w.line("return require(sessionId).context().getBalance();");
                w.close();
                w.line();
            }
            case CORE -> {
                if (!has(m, "route", FieldKind.TEXT))
                    return;
                w.open("public Response route(String sessionId, String route)");
                w.line(cls + " machine = require(sessionId);");
                w.line("machine.context().setRoute(validateUserInput(route));");
                w.line("return response(sessionId, machine, true, \"Routed to \" + machine.context().getRoute());");
                w.close();
                w.line();
            }
        }
    }
}
