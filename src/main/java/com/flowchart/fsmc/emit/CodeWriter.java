package com.flowchart.fsmc.emit;

/**
 * Indentation-aware line builder for generated Java source. Output always
 * uses {@code '\n'} line endings and four-space indentation.
 */
final class CodeWriter {
    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder(8192);
    private int depth;

    CodeWriter line(String text) {
        if (!text.isEmpty())
            sb.append(INDENT.repeat(depth)).append(text);
        sb.append('\n');
        return this;
    }

    CodeWriter line() {
        sb.append('\n');
        return this;
    }

    /** Writes {@code header {} and indents. */
    CodeWriter open(String header) {
        line(header + " {");
        depth++;
        return this;
    }

    /** Outdents and writes a closing brace. */
    CodeWriter close() {
        return close("");
    }

    /** Outdents and writes a closing brace followed by {@code suffix}, e.g. {@code ";"}. */
    CodeWriter close(String suffix) {
        depth--;
        return line("}" + suffix);
    }

    CodeWriter indent() {
        depth++;
        return this;
    }

    CodeWriter outdent() {
        depth--;
        return this;
    }

    /** Single-line Javadoc comment. */
    CodeWriter doc(String text) {
        return line("/** " + docText(text) + " */");
    }

    static String docText(String text) {
        return text == null ? "" : text.replace("*/", "*&#47;").replace('\n', ' ');
    }

    /** Java string literal for {@code s}, or {@code null} for a null reference. */
    static String quote(String s) {
        if (s == null)
            return "null";
        StringBuilder q = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> q.append("\\\"");
                case '\\' -> q.append("\\\\");
                case '\n' -> q.append("\\n");
                case '\r' -> q.append("\\r");
                case '\t' -> q.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7e)
                        q.append(String.format("\\u%04x", (int) c));
                    else
                        q.append(c);
                }
            }
        }
        return q.append('"').toString();
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
