package com.flowchart.fsmc.io;

import com.flowchart.fsmc.model.NodeShape;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-written scanner for a single diagram statement line.
 *
 * <p>
 * Identifiers may contain {@code -} as long as the dash is followed by an
 * identifier character, so {@code my-state-->next} splits at the arrow.
 * Bracket labels honor double quotes and nested brackets of the same kind.
 * Any malformed construct raises {@link DiagramSyntaxException}.
 */
public final class DiagramLexer {

    private DiagramLexer() {
        // Utility class
    }

    public static List<Token> tokenize(String line) {
        return new Scanner(line).scan();
    }

    static boolean isIdentChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static final class Scanner {
        private final String s;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;

        Scanner(String s) {
            this.s = s;
        }

        List<Token> scan() {
            while (pos < s.length()) {
                char c = s.charAt(pos);
                if (Character.isWhitespace(c) || c == ';') {
                    pos++;
                } else if (isIdentChar(c)) {
                    ident();
                } else if (c == '-') {
                    link();
                } else if (c == '|') {
                    pipeText();
                } else if (c == '[' || c == '(' || c == '{') {
                    shape();
                } else if (c == '@') {
                    style();
                } else if (c == '&') {
                    throw err("Node groups with '&' are not supported", "Write one edge per line");
                } else {
                    throw err("Unexpected character '" + c + "'", null);
                }
            }
            return tokens;
        }

        private void ident() {
            int start = pos;
            while (pos < s.length()) {
                char c = s.charAt(pos);
                if (isIdentChar(c)) {
                    pos++;
                } else if (c == '-' && pos + 1 < s.length() && isIdentChar(s.charAt(pos + 1))) {
                    pos++;
                } else {
                    break;
                }
            }
            tokens.add(new Token(Token.Type.IDENT, s.substring(start, pos), null, start + 1));
        }

        private void link() {
            int start = pos;
            int dashes = 0;
            while (pos + dashes < s.length() && s.charAt(pos + dashes) == '-')
                dashes++;
            boolean arrowHead = pos + dashes < s.length() && s.charAt(pos + dashes) == '>';
            if (arrowHead) {
                pos += dashes + 1;
                Token.Type type = dashes >= 2 ? Token.Type.ARROW : Token.Type.THIN_ARROW;
                tokens.add(new Token(type, s.substring(start, pos), null, start + 1));
                return;
            }
            if (dashes < 2)
                throw err("Dangling '-'", "Use --> or -> for transitions");
            // "-- text -->": everything up to the closing arrow is link text
            int end = s.indexOf("-->", pos + dashes);
            if (end < 0)
                throw err("Unterminated link text", "Close the link with -->, e.g. A -- label --> B");
            String text = s.substring(pos + dashes, end).trim();
            tokens.add(new Token(Token.Type.LINK_TEXT, text, null, start + 1));
            pos = end;
        }

        private void pipeText() {
            int start = pos;
            int end = s.indexOf('|', pos + 1);
            if (end < 0)
                throw err("Unterminated |label|", "Close the label with a second '|'");
            tokens.add(new Token(Token.Type.PIPE_TEXT, s.substring(pos + 1, end).trim(), null, start + 1));
            pos = end + 1;
        }

        private void shape() {
            int start = pos;
            NodeShape shape = openerAt(pos);
            int bodyStart = pos + shape.open().length();
            int close = findClose(bodyStart, shape);
            if (close < 0)
                throw err("Unbalanced brackets in node label", "Close the label with " + shape.close());
            String label = unquote(s.substring(bodyStart, close).trim());
            tokens.add(new Token(Token.Type.SHAPE, label, shape, start + 1));
            pos = close + shape.close().length();
        }

        private NodeShape openerAt(int i) {
            if (s.startsWith("((", i))
                return NodeShape.CIRCLE;
            if (s.startsWith("([", i))
                return NodeShape.STADIUM;
            if (s.startsWith("{{", i))
                return NodeShape.HEXAGON;
            return switch (s.charAt(i)) {
                case '(' -> NodeShape.ROUNDED;
                case '{' -> NodeShape.DIAMOND;
                default -> NodeShape.RECTANGLE;
            };
        }

        private int findClose(int from, NodeShape shape) {
            String close = shape.close();
            char openChar = shape.open().charAt(0);
            boolean quoted = false;
            int depth = 0;
            for (int i = from; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == '"') {
                    quoted = !quoted;
                } else if (!quoted) {
                    if (depth == 0 && s.startsWith(close, i))
                        return i;
                    if (close.length() == 1) {
                        if (c == openChar)
                            depth++;
                        else if (c == close.charAt(0))
                            depth--;
                    }
                }
            }
            return -1;
        }

        private void style() {
            int start = pos;
            if (pos + 1 >= s.length() || s.charAt(pos + 1) != '{')
                throw err("Expected '{' after '@'", "Use id@{ shape: circle, class: tag }");
            int end = s.indexOf('}', pos + 2);
            if (end < 0)
                throw err("Unterminated style directive", "Close the directive with '}'");
            tokens.add(new Token(Token.Type.STYLE, s.substring(pos + 2, end).trim(), null, start + 1));
            pos = end + 1;
        }

        private DiagramSyntaxException err(String msg, String suggestion) {
            return new DiagramSyntaxException(msg, pos + 1, suggestion);
        }
    }

    static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\''))
                return text.substring(1, text.length() - 1).trim();
        }
        return text;
    }
}
