package com.flowchart.fsmc.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowchart.fsmc.build.BuildManifest.FileRecord;
import com.flowchart.fsmc.emit.OutputLayout;

import lombok.extern.log4j.Log4j2;

/**
 * Decides whether generation can be skipped, using a manifest of content
 * hashes persisted next to the generated files.
 *
 * <p>
 * The manifest is advisory: a missing or unreadable manifest loads as empty
 * and a failed save is logged, never thrown. Paths are tracked by their string
 * form as given by the caller.
 */
@Log4j2
public final class IncrementalBuildManager {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path manifestPath;
    private final Clock clock;
    private BuildManifest manifest;

    public IncrementalBuildManager(Path outputDir) {
        this(outputDir, Clock.systemUTC());
    }

    public IncrementalBuildManager(Path outputDir, Clock clock) {
        this.manifestPath = Objects.requireNonNull(outputDir, "outputDir").resolve(OutputLayout.MANIFEST_FILE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.manifest = load(manifestPath);
    }

    public Path manifestPath() {
        return manifestPath;
    }

    // --- Queries ---

    public ChangeSet detectChanges(List<Path> sources) {
        List<String> added = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        List<String> deleted = new ArrayList<>();
        Set<String> listed = new HashSet<>();

        for (Path source : sources) {
            String key = source.toString();
            listed.add(key);
            FileRecord previous = manifest.getSourceFiles().get(key);
            if (!Files.exists(source)) {
                if (previous != null)
                    deleted.add(key);
                continue;
            }
            FileRecord current = record(source);
            if (previous == null)
                added.add(key);
            else if (current == null || !Objects.equals(current.getHash(), previous.getHash())
                    || current.getMtime() > previous.getMtime())
                modified.add(key);
        }
        for (String tracked : manifest.getSourceFiles().keySet())
            if (!listed.contains(tracked))
                deleted.add(tracked);

        ChangeSet changes = new ChangeSet(added, modified, deleted);
        log.debug("Source changes: {} added, {} modified, {} deleted", added.size(), modified.size(), deleted.size());
        return changes;
    }

    /**
     * True when every listed source exists, is tracked and is unchanged since
     * the last commit, and every tracked generated file is still on disk. A
     * missing source is never up to date, so the caller gets to report it.
     */
    public boolean isUpToDate(List<Path> sources) {
        for (Path source : sources) {
            FileRecord previous = manifest.getSourceFiles().get(source.toString());
            if (previous == null || !Files.exists(source))
                return false;
            FileRecord current = record(source);
            if (current == null)
                return false;
            if (current.getMtime() > manifest.getLastUpdate())
                return false;
            if (!Objects.equals(current.getHash(), previous.getHash()))
                return false;
        }
        return missingGeneratedFiles().isEmpty();
    }

    public List<String> filesNeedingRegeneration(List<Path> sources) {
        return detectChanges(sources).changed();
    }

    /** Tracked generated files no longer present on disk. */
    public List<String> missingGeneratedFiles() {
        List<String> missing = new ArrayList<>();
        for (String generated : manifest.getGeneratedFiles().keySet())
            if (!Files.exists(Path.of(generated)))
                missing.add(generated);
        return missing;
    }

    public ManifestStats statistics() {
        long sourceBytes = 0, generatedBytes = 0;
        for (FileRecord r : manifest.getSourceFiles().values())
            sourceBytes += r.getSize();
        for (FileRecord r : manifest.getGeneratedFiles().values())
            generatedBytes += r.getSize();
        return new ManifestStats(manifest.getSourceFiles().size(), manifest.getGeneratedFiles().size(), sourceBytes,
                generatedBytes, Instant.ofEpochMilli(manifest.getLastUpdate()));
    }

    /** Copy of the in-memory manifest. */
    public BuildManifest snapshot() {
        return MAPPER.convertValue(manifest, BuildManifest.class).normalize();
    }

    // --- Updates ---

    /**
     * Records a successful generation: the source section is replaced, the
     * generated section is merged, and the build is stamped with the clock.
     *
     * @return whether the manifest was persisted
     */
    public boolean commit(List<Path> sources, List<Path> generated) {
        Map<String, FileRecord> sourceRecords = new LinkedHashMap<>();
        for (Path source : sources) {
            FileRecord r = Files.exists(source) ? record(source) : null;
            if (r != null)
                sourceRecords.put(source.toString(), r);
        }
        manifest.setSourceFiles(sourceRecords);
        for (Path file : generated) {
            FileRecord r = Files.exists(file) ? record(file) : null;
            if (r != null)
                manifest.getGeneratedFiles().put(file.toString(), r);
        }
        manifest.setLastUpdate(clock.millis());
        log.info("Manifest updated: {} sources, {} generated files", sourceRecords.size(),
                manifest.getGeneratedFiles().size());
        return save();
    }

    /** Forgets everything, forcing a full regeneration on the next run. */
    public boolean reset() {
        manifest = new BuildManifest();
        return save();
    }

    // --- Persistence ---

    private static BuildManifest load(Path path) {
        if (!Files.exists(path))
            return new BuildManifest();
        try {
            BuildManifest loaded = MAPPER.readValue(path.toFile(), BuildManifest.class);
            return loaded == null ? new BuildManifest() : loaded.normalize();
        } catch (IOException e) {
            log.warn("Ignoring unreadable manifest {}: {}", path, e.getMessage());
            return new BuildManifest();
        }
    }

    private boolean save() {
        try {
            Path parent = manifestPath.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            MAPPER.writeValue(manifestPath.toFile(), manifest);
            return true;
        } catch (IOException e) {
            log.warn("Failed to save manifest {}: {}", manifestPath, e.getMessage());
            return false;
        }
    }

    /** Current record of a file, or {@code null} if it cannot be read. */
    private static FileRecord record(Path file) {
        try {
            byte[] content = Files.readAllBytes(file);
            return FileRecord.of(ContentHasher.sha256Hex(content), Files.getLastModifiedTime(file).toMillis(),
                    content.length);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return null;
        }
    }
}
