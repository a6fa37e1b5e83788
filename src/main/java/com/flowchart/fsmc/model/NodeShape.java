package com.flowchart.fsmc.model;

import java.util.Locale;

/**
 * Bracket shape of a diagram node. Circle carries meaning: a circle node is a
 * final state.
 */
public enum NodeShape {
    RECTANGLE("[", "]", "rect", "rectangle"),
    ROUNDED("(", ")", "round", "rounded"),
    CIRCLE("((", "))", "circle", "circ"),
    DIAMOND("{", "}", "diamond", "decision", "diam"),
    HEXAGON("{{", "}}", "hex", "hexagon"),
    STADIUM("([", "])", "stadium", "pill");

    private final String open;
    private final String close;
    private final String[] aliases;

    NodeShape(String open, String close, String... aliases) {
        this.open = open;
        this.close = close;
        this.aliases = aliases;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    /**
     * Resolves a style-directive shape name ({@code shape: circle}).
     *
     * @return the shape, or {@code null} if the name is not recognized
     */
    public static NodeShape fromName(String name) {
        if (name == null)
            return null;
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (NodeShape shape : values())
            for (String alias : shape.aliases)
                if (alias.equals(key))
                    return shape;
        return null;
    }
}
