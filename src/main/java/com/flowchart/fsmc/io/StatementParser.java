package com.flowchart.fsmc.io;

import com.flowchart.fsmc.io.Statement.ArrowForm;
import com.flowchart.fsmc.io.Statement.ClassAssign;
import com.flowchart.fsmc.io.Statement.ClassDef;
import com.flowchart.fsmc.io.Statement.EdgeDecl;
import com.flowchart.fsmc.io.Statement.NodeDecl;
import com.flowchart.fsmc.io.Statement.StyleDirective;
import com.flowchart.fsmc.model.NodeShape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser turning one diagram line into typed statements.
 *
 * <p>
 * Grammar of graph lines (after lexing):
 *
 * <pre>
 * line    := nodeRef STYLE | nodeRef (link nodeRef)*
 * nodeRef := IDENT SHAPE?
 * link    := ARROW PIPE_TEXT? | THIN_ARROW PIPE_TEXT? | LINK_TEXT ARROW
 * </pre>
 *
 * {@code classDef} and {@code class} lines are keyword statements and are
 * matched before lexing. A chained line {@code A --> B --> C} yields one
 * {@link EdgeDecl} per link, preceded by a {@link NodeDecl} for every endpoint
 * written with brackets.
 */
public final class StatementParser {
    private static final Pattern CLASS_DEF = Pattern.compile("^classDef\\s+([\\w-]+)\\s+(.+)$");
    private static final Pattern CLASS_ASSIGN = Pattern.compile("^class\\s+([\\w\\-,\\s]+?)\\s+([\\w-]+)\\s*;?$");

    private StatementParser() {
        // Utility class
    }

    /** Returns true if the line starts with a keyword handled by {@link #parseKeyword}. */
    public static boolean isKeywordLine(String line) {
        return line.startsWith("classDef ") || line.startsWith("class ");
    }

    /**
     * Parses a {@code classDef} or {@code class} line.
     *
     * @throws DiagramSyntaxException if the line does not have the expected parts
     */
    public static Statement parseKeyword(String line, int lineNo) {
        if (line.startsWith("classDef ")) {
            Matcher m = CLASS_DEF.matcher(line);
            if (!m.matches())
                throw new DiagramSyntaxException("Could not parse classDef", 1,
                        "Use format: classDef name fill:#fff,stroke:#000");
            return new ClassDef(m.group(1), m.group(2).trim(), lineNo);
        }
        Matcher m = CLASS_ASSIGN.matcher(line);
        if (!m.matches())
            throw new DiagramSyntaxException("Could not parse class assignment", 1,
                    "Use format: class StateA,StateB className");
        List<String> ids = new ArrayList<>();
        for (String id : m.group(1).split(","))
            if (!id.isBlank())
                ids.add(id.trim());
        return new ClassAssign(ids, m.group(2), lineNo);
    }

    /** Parses a node, edge or style line. */
    public static List<Statement> parse(String line, int lineNo) {
        return new Parser(DiagramLexer.tokenize(line), lineNo).statementLine();
    }

    /** Splits a style directive body into its shape name and class list. */
    static StyleDirective styleDirective(String id, String body, int lineNo) {
        String shapeName = null;
        List<String> classes = null;
        for (String part : body.split("[,;]")) {
            int colon = part.indexOf(':');
            if (colon < 0)
                continue;
            String key = part.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = DiagramLexer.unquote(part.substring(colon + 1).trim());
            if (key.equals("shape")) {
                shapeName = value;
            } else if (key.equals("class")) {
                classes = Arrays.stream(value.split("\\s+")).filter(c -> !c.isEmpty()).toList();
            }
        }
        return new StyleDirective(id, shapeName, classes, lineNo);
    }

    private record NodeRef(String id, Token shape) {
    }

    private record Link(String label, ArrowForm form) {
    }

    private static final class Parser {
        private final List<Token> tokens;
        private final int lineNo;
        private int pos;

        Parser(List<Token> tokens, int lineNo) {
            this.tokens = tokens;
            this.lineNo = lineNo;
        }

        List<Statement> statementLine() {
            List<Statement> out = new ArrayList<>();
            if (tokens.isEmpty())
                return out;

            NodeRef first = nodeRef();
            if (peek(Token.Type.STYLE)) {
                Token style = next();
                expectEnd();
                out.add(styleDirective(first.id(), style.text(), lineNo));
                return out;
            }
            if (pos == tokens.size()) {
                out.add(declare(first, false));
                return out;
            }

            List<NodeRef> refs = new ArrayList<>();
            List<Link> links = new ArrayList<>();
            refs.add(first);
            while (pos < tokens.size()) {
                links.add(link());
                refs.add(nodeRef());
            }

            for (NodeRef ref : refs)
                if (ref.shape() != null)
                    out.add(declare(ref, true));
            for (int i = 0; i < links.size(); i++) {
                NodeRef from = refs.get(i), to = refs.get(i + 1);
                Link link = links.get(i);
                ArrowForm form = link.form();
                if (form == ArrowForm.PLAIN && (from.shape() != null || to.shape() != null))
                    form = ArrowForm.INLINE_BRACKET;
                out.add(new EdgeDecl(from.id(), to.id(), link.label(), form, lineNo));
            }
            return out;
        }

        private NodeDecl declare(NodeRef ref, boolean inline) {
            if (ref.shape() == null)
                return new NodeDecl(ref.id(), ref.id(), NodeShape.RECTANGLE, false, inline, lineNo);
            return new NodeDecl(ref.id(), ref.shape().text(), ref.shape().shape(), true, inline, lineNo);
        }

        private NodeRef nodeRef() {
            Token id = expect(Token.Type.IDENT, "Expected node identifier");
            Token shape = peek(Token.Type.SHAPE) ? next() : null;
            return new NodeRef(id.text(), shape);
        }

        private Link link() {
            Token t = next();
            switch (t.type()) {
                case ARROW:
                    if (peek(Token.Type.PIPE_TEXT))
                        return new Link(emptyToNull(next().text()), ArrowForm.LABELED_PIPE);
                    return new Link(null, ArrowForm.PLAIN);
                case THIN_ARROW:
                    String label = peek(Token.Type.PIPE_TEXT) ? emptyToNull(next().text()) : null;
                    return new Link(label, ArrowForm.SINGLE_DASH);
                case LINK_TEXT:
                    expect(Token.Type.ARROW, "Expected --> after link text");
                    return new Link(emptyToNull(t.text()), ArrowForm.DASHED_LABEL);
                default:
                    throw new DiagramSyntaxException("Expected arrow but found '" + t.text() + "'", t.column(),
                            "Use format: StateA --> StateB or StateA -->|label| StateB");
            }
        }

        private boolean peek(Token.Type type) {
            return pos < tokens.size() && tokens.get(pos).is(type);
        }

        private Token next() {
            if (pos >= tokens.size())
                throw new DiagramSyntaxException("Unexpected end of statement", columnAtEnd(),
                        "Use format: StateA --> StateB or StateA -->|label| StateB");
            return tokens.get(pos++);
        }

        private Token expect(Token.Type type, String message) {
            if (!peek(type)) {
                int col = pos < tokens.size() ? tokens.get(pos).column() : columnAtEnd();
                throw new DiagramSyntaxException(message, col);
            }
            return tokens.get(pos++);
        }

        private void expectEnd() {
            if (pos < tokens.size())
                throw new DiagramSyntaxException("Unexpected trailing input", tokens.get(pos).column());
        }

        private int columnAtEnd() {
            if (tokens.isEmpty())
                return 1;
            Token last = tokens.get(tokens.size() - 1);
            return last.column() + last.text().length();
        }

        private static String emptyToNull(String s) {
            return s == null || s.isEmpty() ? null : s;
        }
    }
}
