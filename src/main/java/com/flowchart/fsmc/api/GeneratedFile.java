package com.flowchart.fsmc.api;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A generated artifact proposed to an {@link ArtifactSink}.
 *
 * @param path    target path relative to the working directory
 * @param kind    artifact kind
 * @param content full file text
 * @param size    content size in UTF-8 bytes
 */
public record GeneratedFile(String path, ArtifactKind kind, String content, int size) {

    public GeneratedFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
    }

    public static GeneratedFile of(String path, ArtifactKind kind, String content) {
        return new GeneratedFile(path, kind, content, content.getBytes(StandardCharsets.UTF_8).length);
    }

    /** Number of {@code '\n'}-separated lines in the content. */
    public int lineCount() {
        return content.split("\n", -1).length;
    }
}
