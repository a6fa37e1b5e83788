package com.flowchart.fsmc.build;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.Assert.*;

public class IncrementalBuildManagerTest {
    private static final Instant BUILD_TIME = Instant.parse("2100-01-01T00:00:00Z");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path out;
    private Path source;
    private Path generated;
    private Clock clock;

    @Before
    public void setUp() throws IOException {
        out = folder.newFolder("out").toPath();
        source = write(folder.getRoot().toPath().resolve("menu.md"), "flowchart TD\nA --> B\n");
        generated = write(out.resolve("MenuMachine.java"), "class MenuMachine {}\n");
        clock = Clock.fixed(BUILD_TIME, ZoneOffset.UTC);
    }

    private static Path write(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    private IncrementalBuildManager committed() {
        IncrementalBuildManager manager = new IncrementalBuildManager(out, clock);
        assertTrue(manager.commit(List.of(source), List.of(generated)));
        return manager;
    }

    @Test
    public void testNothingTrackedIsNotUpToDate() {
        IncrementalBuildManager manager = new IncrementalBuildManager(out, clock);
        assertFalse(manager.isUpToDate(List.of(source)));
        assertEquals(List.of(source.toString()), manager.detectChanges(List.of(source)).added());
    }

    @Test
    public void testCommitThenUpToDate() {
        committed();
        assertTrue(Files.exists(out.resolve(".generation-manifest.json")));

        IncrementalBuildManager reloaded = new IncrementalBuildManager(out, clock);
        assertTrue(reloaded.isUpToDate(List.of(source)));
        assertFalse(reloaded.detectChanges(List.of(source)).hasChanges());
        assertTrue(reloaded.filesNeedingRegeneration(List.of(source)).isEmpty());
    }

    @Test
    public void testDeletedGeneratedFileForcesRegeneration() throws IOException {
        IncrementalBuildManager manager = committed();
        Files.delete(generated);
        assertFalse(manager.isUpToDate(List.of(source)));
        assertEquals(List.of(generated.toString()), manager.missingGeneratedFiles());
    }

    @Test
    public void testEditedSourceDetected() throws IOException {
        IncrementalBuildManager manager = committed();
        write(source, "flowchart TD\nA --> C\n");
        assertFalse(manager.isUpToDate(List.of(source)));
        assertEquals(List.of(source.toString()), manager.detectChanges(List.of(source)).modified());
        assertEquals(List.of(source.toString()), manager.filesNeedingRegeneration(List.of(source)));
    }

    @Test
    public void testDeletedAndUnlistedSources() throws IOException {
        Path other = write(folder.getRoot().toPath().resolve("other.md"), "flowchart TD\nX --> Y\n");
        IncrementalBuildManager manager = new IncrementalBuildManager(out, clock);
        manager.commit(List.of(source, other), List.of());

        Files.delete(source);
        ChangeSet changes = manager.detectChanges(List.of(source));
        assertEquals(List.of(source.toString(), other.toString()), changes.deleted());
        assertTrue(changes.changed().isEmpty());
        assertFalse(manager.isUpToDate(List.of(source)));
    }

    @Test
    public void testMissingUntrackedSourceIsNotUpToDate() {
        IncrementalBuildManager manager = committed();
        Path missing = folder.getRoot().toPath().resolve("missing.md");
        assertFalse(manager.isUpToDate(List.of(missing)));
        assertFalse(manager.isUpToDate(List.of(source, missing)));
        assertTrue(manager.isUpToDate(List.of(source)));
    }

    @Test
    public void testCorruptManifestLoadsEmpty() throws IOException {
        committed();
        write(out.resolve(".generation-manifest.json"), "{not json");
        IncrementalBuildManager manager = new IncrementalBuildManager(out, clock);
        assertEquals(0, manager.statistics().sourceFiles());
        assertFalse(manager.isUpToDate(List.of(source)));
    }

    @Test
    public void testStatisticsAndReset() {
        IncrementalBuildManager manager = committed();
        ManifestStats stats = manager.statistics();
        assertEquals(1, stats.sourceFiles());
        assertEquals(1, stats.generatedFiles());
        assertEquals("flowchart TD\nA --> B\n".length(), stats.sourceBytes());
        assertEquals(BUILD_TIME, stats.lastUpdate());

        BuildManifest snapshot = manager.snapshot();
        assertEquals(BuildManifest.CURRENT_VERSION, snapshot.getVersion());
        snapshot.getSourceFiles().clear();
        assertEquals(1, manager.statistics().sourceFiles());

        assertTrue(manager.reset());
        assertEquals(0, manager.statistics().generatedFiles());
        assertEquals(Instant.EPOCH, manager.statistics().lastUpdate());
        assertEquals(0, new IncrementalBuildManager(out, clock).statistics().sourceFiles());
    }

    @Test
    public void testGeneratedSectionIsMerged() throws IOException {
        IncrementalBuildManager manager = committed();
        Path second = write(out.resolve("OtherMachine.java"), "class OtherMachine {}\n");
        manager.commit(List.of(source), List.of(second));
        assertEquals(2, manager.statistics().generatedFiles());
    }
}
