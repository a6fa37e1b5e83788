package com.flowchart.fsmc.io;

import com.flowchart.fsmc.model.NodeShape;

/**
 * A lexical token of one diagram statement.
 *
 * @param type   token type
 * @param text   identifier, label or directive text (already unquoted for shapes)
 * @param shape  bracket shape for {@link Type#SHAPE} tokens, otherwise {@code null}
 * @param column 1-based column of the first character
 */
public record Token(Type type, String text, NodeShape shape, int column) {

    public enum Type {
        /** Node identifier. */
        IDENT,
        /** Bracketed node label, {@code [..]}, {@code ((..))} and friends. */
        SHAPE,
        /** {@code -->} (any run of two or more dashes followed by {@code >}). */
        ARROW,
        /** {@code ->}. */
        THIN_ARROW,
        /** Text of a dashed link, the {@code text} in {@code A -- text --> B}. */
        LINK_TEXT,
        /** Text between pipes, {@code |text|}. */
        PIPE_TEXT,
        /** Body of a node styling directive, {@code @{ ... }}. */
        STYLE
    }

    public boolean is(Type t) {
        return type == t;
    }
}
