package com.flowchart.fsmc.validation;

import com.flowchart.fsmc.api.Diagnostic;
import com.flowchart.fsmc.api.Diagnostics;
import com.flowchart.fsmc.api.Severity;
import com.flowchart.fsmc.engine.Identifiers;
import com.flowchart.fsmc.io.DiagramSyntaxException;
import com.flowchart.fsmc.io.Statement;
import com.flowchart.fsmc.io.Statement.ArrowForm;
import com.flowchart.fsmc.io.Statement.EdgeDecl;
import com.flowchart.fsmc.io.Statement.NodeDecl;
import com.flowchart.fsmc.io.StatementParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Syntax-level checker for diagram documents, usable on its own as a linter.
 *
 * <p>
 * Works on raw text: it extracts fenced {@code mermaid} blocks (or treats the
 * whole text as one block when it has no fences), then checks each block's
 * declaration line and re-tokenizes every statement. It never looks at parsed
 * machines and keeps no state between calls.
 */
@Log4j2
public final class DiagramValidator {
    static final Pattern DECLARATION = Pattern.compile("^(flowchart|graph)\\s+(TD|TB|BT|RL|LR)\\s*;?$");
    static final Pattern DECLARATION_KEYWORD = Pattern.compile("^(flowchart|graph)\\b.*$");
    static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    static final Pattern UPPER_SNAKE = Pattern.compile("^[A-Z_][A-Z0-9_]*$");
    static final Pattern CLASS_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_-]*$");
    static final Pattern CLASS_DEF = Pattern.compile("^classDef\\s+(\\S+)\\s+(.+)$");
    static final Pattern CLASS_ASSIGN = Pattern.compile("^class\\s+(.+?)\\s+(\\S+)\\s*;?$");
    static final Pattern STYLE_PROPERTY = Pattern.compile("^[\\w-]+\\s*:\\s*[^,:]+$");
    static final Set<String> RESERVED = Set.of("start", "end", "initial", "final", "error", "done");
    static final int MAX_NAME_LENGTH = 50;

    private final ValidationConfig config;

    public DiagramValidator() {
        this(new ValidationConfig());
    }

    public DiagramValidator(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** A diagram block: 1-based line of the first content line, and its lines. */
    record Block(int firstLine, List<String> lines) {
    }

    public ValidationResult validate(String content) {
        Diagnostics diagnostics = new Diagnostics();
        List<Block> blocks = extractBlocks(content == null ? "" : content, diagnostics);
        boolean anyContent = false;
        for (Block block : blocks) {
            if (block.lines().stream().anyMatch(l -> !l.isBlank())) {
                anyContent = true;
                validateBlock(block, diagnostics);
            }
        }
        if (!anyContent && !diagnostics.hasErrors())
            diagnostics.warning("No Mermaid content", "No diagram content found", null,
                    "Add a ```mermaid block starting with 'flowchart TD'");
        ValidationResult result = ValidationResult.of(diagnostics);
        log.debug("Validated diagram text: {} error(s), {} warning(s)", result.errorCount(), result.warningCount());
        return result;
    }

    // --- Block extraction ---

    static List<Block> extractBlocks(String content, Diagnostics diagnostics) {
        String[] lines = content.split("\r?\n", -1);
        List<Block> blocks = new ArrayList<>();
        boolean hasFences = false;
        for (String l : lines)
            if (l.trim().startsWith("```")) {
                hasFences = true;
                break;
            }
        if (!hasFences) {
            blocks.add(new Block(1, List.of(lines)));
            return blocks;
        }

        boolean inMermaid = false, inOther = false;
        int start = 0;
        List<String> current = null;
        for (int i = 0; i < lines.length; i++) {
            String t = lines[i].trim();
            int lineNo = i + 1;
            if (!t.startsWith("```")) {
                if (inMermaid)
                    current.add(lines[i]);
                continue;
            }
            String info = t.substring(3).trim();
            if (inOther) {
                if (info.isEmpty())
                    inOther = false;
            } else if (inMermaid) {
                if (info.isEmpty()) {
                    if (current.stream().allMatch(String::isBlank))
                        diagnostics.error("Empty Mermaid block", "Mermaid block has no content", start,
                                "Add a flowchart declaration and states");
                    blocks.add(new Block(start + 1, current));
                    inMermaid = false;
                } else {
                    diagnostics.error("Nested Mermaid blocks", "Code fence opened inside a Mermaid block", lineNo,
                            "Close the current block before opening another");
                }
            } else if (info.equals("mermaid")) {
                inMermaid = true;
                start = lineNo;
                current = new ArrayList<>();
            } else if (!info.isEmpty()) {
                inOther = true;
            }
        }
        if (inMermaid)
            diagnostics.error("Unclosed Mermaid block", "Mermaid block opened here is never closed", start,
                    "Close the block with ```");
        return blocks;
    }

    // --- Block checks ---

    private void validateBlock(Block block, Diagnostics diagnostics) {
        boolean declared = false;
        Set<String> checkedNames = new HashSet<>();
        for (int i = 0; i < block.lines().size(); i++) {
            String line = block.lines().get(i).trim();
            int lineNo = block.firstLine() + i;
            if (line.isEmpty() || line.startsWith("%%") || line.startsWith("//") || line.startsWith("#"))
                continue;

            if (!declared) {
                declared = true;
                if (!DECLARATION.matcher(line).matches()) {
                    diagnostics.error("Invalid flowchart declaration", "Expected 'flowchart <DIR>' but found: "
                            + line, lineNo, "Use: flowchart TD (or TB, BT, RL, LR)");
                    if (!DECLARATION_KEYWORD.matcher(line).matches())
                        validateStatement(line, lineNo, checkedNames, diagnostics);
                }
                continue;
            }
            if (DECLARATION_KEYWORD.matcher(line).matches()) {
                diagnostics.error("Multiple diagram declarations", "Block declares more than one diagram: " + line,
                        lineNo, "Use one ```mermaid block per diagram");
                continue;
            }
            validateStatement(line, lineNo, checkedNames, diagnostics);
        }
        if (!declared)
            diagnostics.error("Missing flowchart declaration", "Block has no diagram declaration",
                    block.firstLine(), "Start the block with: flowchart TD");
    }

    private void validateStatement(String line, int lineNo, Set<String> checkedNames, Diagnostics diagnostics) {
        if (line.startsWith("subgraph")) {
            diagnostics.warning("Subgraph usage", "Subgraphs are not converted to states", lineNo,
                    "Flatten the subgraph into plain states");
            return;
        }
        if (line.equals("end") || line.startsWith("style ") || line.startsWith("linkStyle ")
                || line.startsWith("click ") || line.startsWith("direction "))
            return;
        if (line.startsWith("classDef ")) {
            validateClassDef(line, lineNo, diagnostics);
            return;
        }
        if (line.startsWith("class ")) {
            validateClassAssign(line, lineNo, checkedNames, diagnostics);
            return;
        }

        List<Statement> statements;
        try {
            statements = StatementParser.parse(line, lineNo);
        } catch (DiagramSyntaxException e) {
            boolean transition = line.contains("->") || line.contains("--");
            diagnostics.error(transition ? "Invalid transition syntax" : "Invalid syntax", e.getMessage() + ": "
                    + line, lineNo, e.suggestion() != null ? e.suggestion()
                            : "Use format: StateA --> StateB or StateA -->|EVENT| StateB");
            return;
        }
        for (Statement st : statements) {
            if (st instanceof NodeDecl nd) {
                checkStateName(nd.id(), lineNo, checkedNames, diagnostics);
            } else if (st instanceof EdgeDecl ed) {
                checkStateName(ed.from(), lineNo, checkedNames, diagnostics);
                checkStateName(ed.to(), lineNo, checkedNames, diagnostics);
                checkEventLabel(ed, lineNo, diagnostics);
            } else if (st instanceof Statement.StyleDirective sd) {
                checkStateName(sd.id(), lineNo, checkedNames, diagnostics);
            }
        }
    }

    private void checkStateName(String name, int lineNo, Set<String> checked, Diagnostics diagnostics) {
        if (!checked.add(name))
            return;
        if (!Identifiers.isValidStateName(name)) {
            diagnostics.error("Invalid state name", "Invalid state name: " + name, lineNo,
                    "State names must start with a letter");
            return;
        }
        if (RESERVED.contains(name))
            diagnostics.warning("Reserved state name", "State name '" + name + "' is a reserved word", lineNo,
                    "Use a more descriptive name, e.g. " + Identifiers.capitalize(name) + "State");
        if (name.length() > MAX_NAME_LENGTH)
            diagnostics.warning("Long state name", "State name '" + name + "' exceeds " + MAX_NAME_LENGTH
                    + " characters", lineNo, "Shorten the state name");
        if (config.isValidateNaming() && !PASCAL_CASE.matcher(name).matches())
            naming(diagnostics, "State naming convention", "State '" + name + "' is not PascalCase", lineNo,
                    "Rename to " + toPascalCase(name));
    }

    private void checkEventLabel(EdgeDecl ed, int lineNo, Diagnostics diagnostics) {
        if (ed.label() == null) {
            if (ed.form() == ArrowForm.LABELED_PIPE || ed.form() == ArrowForm.DASHED_LABEL)
                diagnostics.warning("Empty transition label", "Transition " + ed.from() + " -> " + ed.to()
                        + " has an empty label", lineNo, "Name the event, e.g. -->|NEXT|");
            return;
        }
        if (config.isValidateNaming() && !UPPER_SNAKE.matcher(ed.label()).matches())
            naming(diagnostics, "Event naming convention", "Event '" + ed.label() + "' is not UPPER_SNAKE_CASE",
                    lineNo, "Rename to " + Identifiers.eventType(ed.label()));
    }

    private void validateClassDef(String line, int lineNo, Diagnostics diagnostics) {
        Matcher m = CLASS_DEF.matcher(line);
        if (!m.matches()) {
            diagnostics.error("Invalid syntax", "Malformed classDef: " + line, lineNo,
                    "Use: classDef name fill:#fff,stroke:#000");
            return;
        }
        checkClassName(m.group(1), lineNo, diagnostics);
        for (String prop : m.group(2).split(",")) {
            if (!STYLE_PROPERTY.matcher(prop.trim().replaceAll(";$", "")).matches()) {
                diagnostics.warning("Invalid class style", "Style '" + prop.trim() + "' of class '" + m.group(1)
                        + "' is not a property:value pair", lineNo, "Use property:value pairs separated by commas");
                break;
            }
        }
    }

    private void validateClassAssign(String line, int lineNo, Set<String> checkedNames, Diagnostics diagnostics) {
        Matcher m = CLASS_ASSIGN.matcher(line);
        if (!m.matches()) {
            diagnostics.error("Invalid syntax", "Malformed class assignment: " + line, lineNo,
                    "Use: class StateA,StateB className");
            return;
        }
        checkClassName(m.group(2), lineNo, diagnostics);
        for (String id : m.group(1).split(","))
            if (!id.isBlank())
                checkStateName(id.trim(), lineNo, checkedNames, diagnostics);
    }

    private static void checkClassName(String name, int lineNo, Diagnostics diagnostics) {
        if (!CLASS_NAME.matcher(name).matches())
            diagnostics.error("Invalid class name", "Invalid class name: " + name, lineNo,
                    "Class names must start with a letter and contain letters, digits, '_' or '-'");
    }

    private void naming(Diagnostics diagnostics, String kind, String message, int lineNo, String suggestion) {
        Severity severity = config.namingIsError() ? Severity.ERROR : Severity.WARNING;
        diagnostics.add(new Diagnostic(kind, message, lineNo, severity, suggestion));
    }

    static String toPascalCase(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (String part : name.split("[-_\\s]+"))
            sb.append(Identifiers.capitalize(part));
        return sb.toString();
    }
}
