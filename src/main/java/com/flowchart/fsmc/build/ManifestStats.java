package com.flowchart.fsmc.build;

import java.time.Instant;

/** Summary of what the manifest tracks. */
public record ManifestStats(int sourceFiles, int generatedFiles, long sourceBytes, long generatedBytes,
        Instant lastUpdate) {
}
