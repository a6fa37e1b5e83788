package com.flowchart.fsmc.model;

import java.util.Locale;

/**
 * Closed set of domain categories. A machine's category drives its default
 * context fields, actors and validation heuristics. Declaration order is the
 * tie-break order used when two category tags are equally frequent.
 */
public enum MachineCategory {
    INFO("info", "information", "information and read-only"),
    AGENT("agent", "agent", "agent-specific workflow"),
    ACCOUNT("account", "user-services", "account management"),
    USER("user", "user-services", "authenticated user service"),
    CORE("core", "core", "core system routing");

    /** Suffix that turns a category id into its class tag ({@code user-machine}). */
    public static final String TAG_SUFFIX = "-machine";

    private final String id;
    private final String directory;
    private final String description;

    MachineCategory(String id, String directory, String description) {
        this.id = id;
        this.directory = directory;
        this.description = description;
    }

    public String id() {
        return id;
    }

    /** Output subdirectory for artifacts of this category. */
    public String directory() {
        return directory;
    }

    /** Phrase used in generated machine descriptions. */
    public String description() {
        return description;
    }

    /** Class tag carried by diagram nodes, for example {@code agent-machine}. */
    public String tag() {
        return id + TAG_SUFFIX;
    }

    /**
     * Resolves a category from its id ({@code "user"}) or its class tag
     * ({@code "user-machine"}).
     *
     * @return the category, or {@code null} if unknown
     */
    public static MachineCategory fromString(String value) {
        if (value == null)
            return null;
        String key = value.trim().toLowerCase(Locale.ROOT);
        if (key.endsWith(TAG_SUFFIX))
            key = key.substring(0, key.length() - TAG_SUFFIX.length());
        for (MachineCategory category : values())
            if (category.id.equals(key))
                return category;
        return null;
    }

    /** Returns the category whose tag equals the given class name, else {@code null}. */
    public static MachineCategory fromTag(String cssClass) {
        if (cssClass == null || !cssClass.endsWith(TAG_SUFFIX))
            return null;
        return fromString(cssClass);
    }
}
