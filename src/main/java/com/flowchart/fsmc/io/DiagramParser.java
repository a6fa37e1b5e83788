package com.flowchart.fsmc.io;

import com.flowchart.fsmc.api.Diagnostics;
import com.flowchart.fsmc.engine.Identifiers;
import com.flowchart.fsmc.io.DraftGraph.DraftEdge;
import com.flowchart.fsmc.io.DraftGraph.DraftNode;
import com.flowchart.fsmc.io.Statement.ClassAssign;
import com.flowchart.fsmc.io.Statement.ClassDef;
import com.flowchart.fsmc.io.Statement.EdgeDecl;
import com.flowchart.fsmc.io.Statement.NodeDecl;
import com.flowchart.fsmc.io.Statement.StyleDirective;
import com.flowchart.fsmc.model.ParsedMachine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Parses diagram text into {@link ParsedMachine}s.
 *
 * <p>
 * Every {@code flowchart <DIR>} or {@code graph <DIR>} line opens a new block;
 * a Markdown fence closes the current one. Lines outside blocks are ignored.
 * Inside a block each line is lexed and parsed into {@link Statement}s which
 * are applied to a {@link DraftGraph}; the {@link GraphAssembler} then turns
 * each draft into a machine.
 *
 * <p>
 * Malformed statements are reported as warnings and skipped; invalid state
 * identifiers are errors and the offending statement is dropped. Neither
 * stops the scan. The parser is stateless and may be shared.
 */
@Log4j2
public final class DiagramParser {
    public static final String DEFAULT_SOURCE_NAME = "ussd";
    static final int MAX_LABEL_LENGTH = 50;

    /** Opens a block anywhere, even inside another block. */
    private static final Pattern HEADER = Pattern.compile("^(flowchart|graph)(\\s+(TD|TB|BT|RL|LR))?\\s*;?$");
    /** Opens a block only outside one; inside, such a line is a statement about a node named graph. */
    private static final Pattern LOOSE_HEADER = Pattern.compile("^(flowchart|graph)(\\s+.*)?$");
    private static final Pattern LABEL_SPECIAL = Pattern.compile("[<>{}\\[\\]\\\\]");
    private static final String NAME_HINT = "State names must start with a letter and contain only letters, digits, '_' or '-'";

    private final GraphAssembler assembler;

    public DiagramParser() {
        this(true);
    }

    /**
     * @param placeholderForEmpty whether a block without states yields a machine
     *                            with a single placeholder state
     */
    public DiagramParser(boolean placeholderForEmpty) {
        this.assembler = new GraphAssembler(placeholderForEmpty);
    }

    /** Reads and parses a diagram file. */
    public ParseResult parseFile(Path path) throws IOException {
        String text = Files.readString(path);
        long modified = Files.getLastModifiedTime(path).toMillis();
        ParseResult r = parse(text, baseName(path));
        return new ParseResult(path.toString(), r.machines(), r.diagnostics(), r.lineCount(), modified);
    }

    /**
     * Parses diagram text.
     *
     * @param sourceName base for machine ids; {@code null} uses {@value #DEFAULT_SOURCE_NAME}
     */
    public ParseResult parse(String text, String sourceName) {
        String base = sourceName == null || sourceName.isBlank() ? DEFAULT_SOURCE_NAME : sourceName;
        Diagnostics diagnostics = new Diagnostics();
        List<ParsedMachine> machines = new ArrayList<>();
        String[] lines = text == null ? new String[0] : text.split("\r?\n", -1);

        DraftGraph draft = null;
        int subgraphDepth = 0;
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i].trim();

            if (line.startsWith("```")) {
                if (draft != null) {
                    finish(draft, base, machines, diagnostics);
                    draft = null;
                }
                continue;
            }
            if (HEADER.matcher(line).matches() || draft == null && LOOSE_HEADER.matcher(line).matches()) {
                if (draft != null)
                    finish(draft, base, machines, diagnostics);
                draft = new DraftGraph(lineNo);
                subgraphDepth = 0;
                continue;
            }
            if (draft == null || line.isEmpty() || isComment(line))
                continue;

            if (line.startsWith("subgraph")) {
                subgraphDepth++;
                diagnostics.warning("Unsupported subgraph", "Subgraph grouping is ignored: " + line, lineNo,
                        "States inside the subgraph are still parsed as part of the machine");
                continue;
            }
            if (line.equals("end")) {
                if (subgraphDepth > 0)
                    subgraphDepth--;
                continue;
            }
            if (isPresentationOnly(line))
                continue;

            try {
                if (StatementParser.isKeywordLine(line)) {
                    apply(draft, StatementParser.parseKeyword(line, lineNo), diagnostics);
                } else {
                    for (Statement st : StatementParser.parse(line, lineNo))
                        apply(draft, st, diagnostics);
                }
            } catch (DiagramSyntaxException e) {
                diagnostics.warning("Unparseable statement", e.getMessage() + ": " + line, lineNo,
                        e.suggestion() != null ? e.suggestion()
                                : "Use format: StateA --> StateB or StateA -->|label| StateB");
            }
        }
        if (draft != null)
            finish(draft, base, machines, diagnostics);

        log.debug("Parsed {}: {} machine(s), {}", base, machines.size(), diagnostics);
        return new ParseResult(base, machines, diagnostics.toList(), lines.length, 0L);
    }

    private void finish(DraftGraph draft, String base, List<ParsedMachine> machines, Diagnostics diagnostics) {
        String id = machines.isEmpty() ? base : base + "-" + (machines.size() + 1);
        ParsedMachine m = assembler.assemble(draft, id, Identifiers.displayName(id), diagnostics);
        if (m != null)
            machines.add(m);
    }

    // --- Statement application ---

    private static void apply(DraftGraph draft, Statement st, Diagnostics diagnostics) {
        if (st instanceof NodeDecl nd) {
            declareNode(draft, nd, diagnostics);
        } else if (st instanceof EdgeDecl ed) {
            addEdge(draft, ed, diagnostics);
        } else if (st instanceof ClassDef cd) {
            if (draft.classDefs.putIfAbsent(cd.name(), cd.styles()) != null)
                diagnostics.warning("Duplicate class definition", "Class '" + cd.name() + "' is already defined",
                        cd.line(), "Keeping the first definition");
        } else if (st instanceof ClassAssign ca) {
            for (String id : ca.ids()) {
                if (!requireName(id, "state", ca.line(), diagnostics))
                    continue;
                draft.ensure(id, ca.line()).classes.add(ca.className());
            }
        } else if (st instanceof StyleDirective sd) {
            if (requireName(sd.id(), "state", sd.line(), diagnostics))
                draft.styles.add(sd);
        }
    }

    private static void declareNode(DraftGraph draft, NodeDecl nd, Diagnostics diagnostics) {
        if (!requireName(nd.id(), "state", nd.line(), diagnostics))
            return;
        String label = nd.shaped() ? checkLabel(nd, diagnostics) : nd.id();
        DraftNode existing = draft.nodes.get(nd.id());
        if (existing != null) {
            if (!existing.declared && nd.shaped()) {
                existing.label = label;
                existing.shape = nd.shape();
                existing.declared = true;
            } else if (existing.declared && nd.shaped() && !nd.inline()) {
                diagnostics.warning("Duplicate state", "Duplicate state definition: " + nd.id(), nd.line(),
                        "State already defined, using first definition");
            }
            return;
        }
        DraftNode node = draft.ensure(nd.id(), nd.line());
        if (nd.shaped()) {
            node.label = label;
            node.shape = nd.shape();
            node.declared = true;
        }
    }

    private static String checkLabel(NodeDecl nd, Diagnostics diagnostics) {
        String label = nd.label();
        if (label == null || label.isBlank()) {
            diagnostics.warning("Empty label", "State '" + nd.id() + "' has an empty label", nd.line(),
                    "Using the state id as its label");
            return nd.id();
        }
        if (label.length() > MAX_LABEL_LENGTH)
            diagnostics.warning("Long label", "Label of state '" + nd.id() + "' exceeds " + MAX_LABEL_LENGTH
                    + " characters", nd.line(), "Shorten the label");
        if (LABEL_SPECIAL.matcher(label).find())
            diagnostics.warning("Special characters in label", "Label of state '" + nd.id()
                    + "' contains special characters", nd.line(), "Avoid <>{}[]\\ in labels");
        return label;
    }

    private static void addEdge(DraftGraph draft, EdgeDecl ed, Diagnostics diagnostics) {
        boolean ok = requireName(ed.from(), "source state", ed.line(), diagnostics);
        ok &= requireName(ed.to(), "target state", ed.line(), diagnostics);
        if (!ok)
            return;
        draft.ensure(ed.from(), ed.line());
        draft.ensure(ed.to(), ed.line());
        if (ed.from().equals(ed.to()))
            diagnostics.warning("Self-transition", "State '" + ed.from() + "' transitions to itself", ed.line(),
                    "Consider if this is intentional");
        draft.edges.add(new DraftEdge(ed.from(), ed.to(), ed.label(), ed.line()));
    }

    private static boolean requireName(String id, String what, int line, Diagnostics diagnostics) {
        if (Identifiers.isValidStateName(id))
            return true;
        diagnostics.error("Invalid state name", "Invalid " + what + " name: " + id, line, NAME_HINT);
        return false;
    }

    // --- Line classification ---

    private static boolean isComment(String line) {
        return line.startsWith("%%") || line.startsWith("//") || line.startsWith("#");
    }

    private static boolean isPresentationOnly(String line) {
        return line.startsWith("style ") || line.startsWith("linkStyle ") || line.startsWith("click ")
                || line.startsWith("direction ");
    }

    /** File name without its extension, used as the machine id base. */
    public static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
