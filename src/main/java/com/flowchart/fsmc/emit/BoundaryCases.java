package com.flowchart.fsmc.emit;

/**
 * Fixed catalog of malformed and extreme payload values applied to every
 * machine by the error suite. Each case is rendered as a Java expression.
 */
enum BoundaryCases {
    NULL_PAYLOAD("NullPayload", null),
    NULL_VALUE("NullValue", "null"),
    EMPTY_STRING("EmptyString", "\"\""),
    BLANK_STRING("BlankString", "\"   \""),
    OVERSIZED_STRING("OversizedString", "\"x\".repeat(10_000)"),
    INT_MIN("IntMin", "Integer.MIN_VALUE"),
    INT_MAX("IntMax", "Integer.MAX_VALUE"),
    ZERO("Zero", "0"),
    NEGATIVE("Negative", "-1"),
    NOT_A_NUMBER("NotANumber", "Double.NaN"),
    INFINITY("Infinity", "Double.POSITIVE_INFINITY"),
    MARKUP("Markup", "\"<script>alert(1)</script>\""),
    QUERY_INJECTION("QueryInjection", "\"'; DROP TABLE sessions; --\""),
    CONTROL_CHARACTERS("ControlCharacters", "\"\\u0000\\r\\n\\t\""),
    NON_ASCII("NonAscii", "\"\\u00e9\\u4e2d\\ud83d\\ude00\""),
    PATH_TRAVERSAL("PathTraversal", "\"../../etc/passwd\""),
    WRONG_TYPE("WrongType", "new Object()");

    private final String testName;
    private final String expression;

    BoundaryCases(String testName, String expression) {
        this.testName = testName;
        this.expression = expression;
    }

    /** Suffix of the generated test method. */
    String testName() {
        return testName;
    }

    /** Java expression of the value, or {@code null} for a missing payload map. */
    String expression() {
        return expression;
    }

    boolean isMissingPayload() {
        return expression == null;
    }
}
