package com.flowchart.fsmc.engine;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.flowchart.fsmc.model.EdgeLabels;

/**
 * Identifier derivation shared by the parser, the semantic generator and every
 * emitter. All functions are total: they never throw, whatever the input.
 */
public final class Identifiers {
    public static final String MACHINE_SUFFIX = "Machine";
    public static final String UNKNOWN_EVENT = "UNKNOWN";

    private static final Pattern STATE_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_-]*$");
    private static final Pattern WORD_SPLIT = Pattern.compile("[-_\\s]+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]");

    /** Field names of the generated {@code State} enum; no state constant may use them. */
    public static final Set<String> STATE_ENUM_MEMBERS = Set.of("stateId", "finalState");
    /** Field names of the generated {@code EventType} enum. */
    public static final Set<String> EVENT_ENUM_MEMBERS = Set.of("type", "payloadFields");

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield", "sealed", "permits",
            "_");

    private Identifiers() {
        // Utility class
    }

    /** Whether {@code name} is an acceptable diagram state identifier. */
    public static boolean isValidStateName(String name) {
        return name != null && STATE_NAME.matcher(name).matches();
    }

    /**
     * Sanitized machine identifier.
     * <p>
     * One trailing {@value #MACHINE_SUFFIX} is removed, non-alphanumerics are
     * stripped, a leading digit gets an underscore prefix, the result is
     * lower-cased and the suffix is appended. Applying it to its own output
     * returns the same string.
     */
    public static String machineId(String raw) {
        String base = raw == null ? "" : raw;
        if (base.endsWith(MACHINE_SUFFIX))
            base = base.substring(0, base.length() - MACHINE_SUFFIX.length());
        base = NON_ALNUM.matcher(base).replaceAll("");
        if (!base.isEmpty() && Character.isDigit(base.charAt(0)))
            base = "_" + base;
        return base.toLowerCase(Locale.ROOT) + MACHINE_SUFFIX;
    }

    /** Java class name for a sanitized machine id: {@code loginMachine -> LoginMachine}. */
    public static String className(String machineId) {
        return capitalize(machineId);
    }

    /** Human readable name: words split on dashes, underscores and spaces, each capitalized. */
    public static String displayName(String raw) {
        if (raw == null || raw.isBlank())
            return "";
        StringBuilder sb = new StringBuilder(raw.length());
        for (String word : WORD_SPLIT.split(raw.trim())) {
            if (word.isEmpty())
                continue;
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * Event type for an edge label: annotations stripped, upper-cased,
     * non-alphanumerics replaced by {@code _}, repeats collapsed and the ends
     * trimmed. Returns an empty string when nothing is left.
     */
    public static String eventType(String label) {
        String text = EdgeLabels.stripAnnotations(label).toUpperCase(Locale.ROOT);
        text = text.replaceAll("[^A-Z0-9]", "_").replaceAll("_+", "_");
        int start = 0, end = text.length();
        while (start < end && text.charAt(start) == '_')
            start++;
        while (end > start && text.charAt(end - 1) == '_')
            end--;
        return text.substring(start, end);
    }

    /** Guard name synthesized for a conditional edge: {@code is + Source + Valid}. */
    public static String conditionalGuard(String prefix, String fromState) {
        String p = prefix == null ? "" : prefix;
        if (fromState == null || fromState.isEmpty())
            return p + "Valid";
        return p + Character.toUpperCase(fromState.charAt(0))
                + fromState.substring(1).toLowerCase(Locale.ROOT) + "Valid";
    }

    /**
     * Java constant for a state or event name. Characters outside
     * {@code [A-Za-z0-9_]} become {@code _}; a leading digit, an empty result
     * or a reserved word gets an underscore.
     */
    public static String javaConstant(String name) {
        String s = name == null ? "" : name.replaceAll("[^A-Za-z0-9_]", "_");
        if (s.isEmpty() || Character.isDigit(s.charAt(0)))
            s = "_" + s;
        if (JAVA_KEYWORDS.contains(s))
            s = s + "_";
        return s;
    }

    /** Package segment for an output directory: {@code user-services -> userservices}. */
    public static String packageSegment(String directory) {
        String s = NON_ALNUM.matcher(directory == null ? "" : directory).replaceAll("").toLowerCase(Locale.ROOT);
        if (s.isEmpty() || Character.isDigit(s.charAt(0)))
            s = "_" + s;
        return s;
    }

    /** Upper-cases the first character only. */
    public static String capitalize(String s) {
        if (s == null || s.isEmpty())
            return "";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
