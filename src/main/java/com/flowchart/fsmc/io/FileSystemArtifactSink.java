package com.flowchart.fsmc.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import com.flowchart.fsmc.api.ArtifactSink;
import com.flowchart.fsmc.api.GeneratedFile;

import lombok.extern.log4j.Log4j2;

/**
 * Writes artifacts below a base directory, creating parent directories as
 * needed. Existing files are skipped unless overwriting is enabled, in which
 * case they may first be copied to {@code <name>.bak}.
 */
@Log4j2
public final class FileSystemArtifactSink implements ArtifactSink {
    public static final String BACKUP_SUFFIX = ".bak";

    private final Path baseDir;
    private final boolean overwrite;
    private final boolean backup;

    /** Overwriting sink relative to the working directory, without backups. */
    public FileSystemArtifactSink() {
        this(Path.of(""), true, false);
    }

    public FileSystemArtifactSink(Path baseDir, boolean overwrite, boolean backup) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.overwrite = overwrite;
        this.backup = backup;
    }

    /** Where a file with the given relative path is written. */
    public Path resolve(String path) {
        return baseDir.resolve(path);
    }

    @Override
    public boolean write(GeneratedFile file) throws IOException {
        Path target = resolve(file.path());
        if (Files.exists(target)) {
            if (!overwrite) {
                log.info("Skipping existing file {}", target);
                return false;
            }
            if (backup)
                Files.copy(target, target.resolveSibling(target.getFileName() + BACKUP_SUFFIX),
                        StandardCopyOption.REPLACE_EXISTING);
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        Files.writeString(target, file.content(), StandardCharsets.UTF_8);
        log.debug("Wrote {} ({} bytes)", target, file.size());
        return true;
    }
}
