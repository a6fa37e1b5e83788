package com.flowchart.fsmc.model;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sub-parsing of edge labels.
 *
 * <p>
 * A label may embed a guard reference ({@code guard:NAME}, {@code [NAME]},
 * {@code when NAME}) and an action reference ({@code action:NAME},
 * {@code do:NAME}, {@code execute:NAME}). Patterns are tried in that priority
 * order and the first match wins.
 */
public final class EdgeLabels {
    private static final List<Pattern> GUARD_PATTERNS = List.of(
            Pattern.compile("guard:\\s*(\\w+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[([^\\]]+)\\]"),
            Pattern.compile("\\bwhen\\s+(\\w+)", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> ACTION_PATTERNS = List.of(
            Pattern.compile("\\baction:\\s*(\\w+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdo:\\s*(\\w+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bexecute:\\s*(\\w+)", Pattern.CASE_INSENSITIVE));

    private EdgeLabels() {
        // Utility class
    }

    /** Guard name embedded in the label, or {@code null}. */
    public static String guardOf(String label) {
        return firstGroup(GUARD_PATTERNS, label);
    }

    /** Action name embedded in the label, or {@code null}. */
    public static String actionOf(String label) {
        return firstGroup(ACTION_PATTERNS, label);
    }

    /** Removes every guard and action annotation, leaving the event text. */
    public static String stripAnnotations(String label) {
        if (label == null)
            return "";
        String text = label;
        for (Pattern p : GUARD_PATTERNS)
            text = p.matcher(text).replaceAll(" ");
        for (Pattern p : ACTION_PATTERNS)
            text = p.matcher(text).replaceAll(" ");
        return text.trim();
    }

    private static String firstGroup(List<Pattern> patterns, String label) {
        if (label == null || label.isEmpty())
            return null;
        for (Pattern p : patterns) {
            Matcher m = p.matcher(label);
            if (m.find()) {
                String name = m.group(1).trim();
                if (!name.isEmpty())
                    return name;
            }
        }
        return null;
    }
}
