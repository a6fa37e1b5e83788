package com.flowchart.fsmc.ir;

import java.util.Objects;

/**
 * A field of the generated machine's context.
 *
 * @param name           field name, a valid Java identifier
 * @param kind           semantic type
 * @param defaultLiteral initial value as a source literal ({@code ""}, {@code 1}, {@code false}, {@code null})
 * @param optional       whether the field may be left unset
 * @param doc            one-line description
 */
public record ContextField(String name, FieldKind kind, String defaultLiteral, boolean optional, String doc) {

    public ContextField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(defaultLiteral, "defaultLiteral");
    }

    /** Whether the default is {@code null}, which forces a boxed type. */
    public boolean nullable() {
        return "null".equals(defaultLiteral);
    }

    /** Java type of the field as declared in generated code. */
    public String javaType() {
        return nullable() ? kind.boxedType() : kind.javaType();
    }
}
