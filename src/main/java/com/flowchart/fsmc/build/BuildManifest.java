package com.flowchart.fsmc.build;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * POJO representation of the persisted generation manifest.
 *
 * <pre>
 * {"version": "1.0.0", "lastUpdate": 1700000000000,
 *  "sourceFiles": {"diagrams/menu.md": {"hash": "...", "mtime": ..., "size": ...}},
 *  "generatedFiles": {...}}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BuildManifest {
    public static final String CURRENT_VERSION = "1.0.0";

    private String version = CURRENT_VERSION;
    private long lastUpdate;
    private Map<String, FileRecord> sourceFiles = new LinkedHashMap<>();
    private Map<String, FileRecord> generatedFiles = new LinkedHashMap<>();

    /** Hash, modification time and size of one tracked file. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FileRecord {
        private String hash;
        private long mtime;
        private long size;

        public static FileRecord of(String hash, long mtime, long size) {
            FileRecord r = new FileRecord();
            r.setHash(hash);
            r.setMtime(mtime);
            r.setSize(size);
            return r;
        }
    }

    /** Replaces null sections left by a hand-edited or partial manifest. */
    BuildManifest normalize() {
        if (version == null)
            version = CURRENT_VERSION;
        if (sourceFiles == null)
            sourceFiles = new LinkedHashMap<>();
        if (generatedFiles == null)
            generatedFiles = new LinkedHashMap<>();
        return this;
    }
}
