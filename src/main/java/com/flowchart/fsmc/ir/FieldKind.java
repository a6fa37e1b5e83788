package com.flowchart.fsmc.ir;

/** Semantic type of a context or payload field. */
public enum FieldKind {
    TEXT("String", "String"),
    NUMBER("int", "Integer"),
    BOOL("boolean", "Boolean"),
    OPAQUE("Object", "Object");

    private final String javaType;
    private final String boxedType;

    FieldKind(String javaType, String boxedType) {
        this.javaType = javaType;
        this.boxedType = boxedType;
    }

    /** Java type used for a required field. */
    public String javaType() {
        return javaType;
    }

    /** Java type used where {@code null} must be representable. */
    public String boxedType() {
        return boxedType;
    }
}
