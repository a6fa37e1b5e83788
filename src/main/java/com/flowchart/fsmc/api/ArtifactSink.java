package com.flowchart.fsmc.api;

import java.io.IOException;

/**
 * Receives generated artifacts from the compiler.
 *
 * <p>
 * The compiler only proposes a path and content; overwrite and backup policy
 * belong to the implementation. Each call is independent, so a failure for
 * one file must not affect files already written.
 */
@FunctionalInterface
public interface ArtifactSink {

    /**
     * Persists a single artifact.
     *
     * @return {@code true} if the file was written, {@code false} if the sink
     *         deliberately skipped it (for example an existing file with
     *         overwrite disabled)
     * @throws IOException if the target cannot be written
     */
    boolean write(GeneratedFile file) throws IOException;
}
