package com.flowchart.fsmc.io;

/**
 * Raised by the lexer and statement parser for a single malformed statement.
 * The diagram parser turns it into a warning diagnostic and moves on to the
 * next line.
 */
public class DiagramSyntaxException extends IllegalArgumentException {
    private final int column;
    private final String suggestion;

    public DiagramSyntaxException(String message, int column, String suggestion) {
        super(message + " at column " + column);
        this.column = column;
        this.suggestion = suggestion;
    }

    public DiagramSyntaxException(String message, int column) {
        this(message, column, null);
    }

    public int column() {
        return column;
    }

    public String suggestion() {
        return suggestion;
    }
}
