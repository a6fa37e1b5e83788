package com.flowchart.fsmc.ir;

import java.util.Objects;

/** A field carried by an event. */
public record PayloadField(String name, FieldKind kind, boolean optional) {

    public PayloadField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static PayloadField text(String name) {
        return new PayloadField(name, FieldKind.TEXT, false);
    }

    public static PayloadField opaque(String name) {
        return new PayloadField(name, FieldKind.OPAQUE, true);
    }
}
