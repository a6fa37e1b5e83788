package com.flowchart.fsmc.model;

import java.util.Locale;

/**
 * Classification of an edge, inferred from keywords in its label.
 */
public enum TransitionKind {
    USER_INPUT("user_input", "input", "select"),
    ERROR("error", "error", "fail"),
    TIMEOUT("timeout", "timeout"),
    EXTERNAL("external", "verify", "check"),
    CONDITIONAL("conditional", "yes", "no", "if"),
    SYSTEM_ACTION("system_action");

    private final String id;
    private final String[] keywords;

    TransitionKind(String id, String... keywords) {
        this.id = id;
        this.keywords = keywords;
    }

    public String id() {
        return id;
    }

    /**
     * Classifies a raw edge label. Keywords are matched as substrings of the
     * lower-cased label, checked in declaration order; the first hit wins.
     */
    public static TransitionKind classify(String label) {
        if (label == null || label.isBlank())
            return SYSTEM_ACTION;
        String text = label.toLowerCase(Locale.ROOT);
        for (TransitionKind kind : values())
            for (String keyword : kind.keywords)
                if (text.contains(keyword))
                    return kind;
        return SYSTEM_ACTION;
    }
}
