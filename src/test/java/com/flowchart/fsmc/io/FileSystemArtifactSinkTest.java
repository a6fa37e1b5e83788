package com.flowchart.fsmc.io;

import com.flowchart.fsmc.api.ArtifactKind;
import com.flowchart.fsmc.api.GeneratedFile;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class FileSystemArtifactSinkTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static final String PATH = "generated/machines/core/RouterMachine.java";

    @Test
    public void testCreatesParentDirectories() throws IOException {
        Path base = tmp.getRoot().toPath();
        FileSystemArtifactSink sink = new FileSystemArtifactSink(base, true, false);

        assertTrue(sink.write(GeneratedFile.of(PATH, ArtifactKind.MACHINE, "class A {}\n")));
        assertEquals("class A {}\n", Files.readString(base.resolve(PATH), StandardCharsets.UTF_8));
    }

    @Test
    public void testSkipsExistingWithoutOverwrite() throws IOException {
        Path base = tmp.getRoot().toPath();
        FileSystemArtifactSink sink = new FileSystemArtifactSink(base, false, false);
        sink.write(GeneratedFile.of(PATH, ArtifactKind.MACHINE, "first"));

        assertFalse(sink.write(GeneratedFile.of(PATH, ArtifactKind.MACHINE, "second")));
        assertEquals("first", Files.readString(base.resolve(PATH)));
    }

    @Test
    public void testBackupBeforeOverwrite() throws IOException {
        Path base = tmp.getRoot().toPath();
        FileSystemArtifactSink sink = new FileSystemArtifactSink(base, true, true);
        sink.write(GeneratedFile.of(PATH, ArtifactKind.MACHINE, "first"));

        assertTrue(sink.write(GeneratedFile.of(PATH, ArtifactKind.MACHINE, "second")));
        assertEquals("second", Files.readString(base.resolve(PATH)));
        assertEquals("first", Files.readString(base.resolve(PATH + FileSystemArtifactSink.BACKUP_SUFFIX)));
    }

    @Test
    public void testNoBackupForNewFile() throws IOException {
        Path base = tmp.getRoot().toPath();
        new FileSystemArtifactSink(base, true, true).write(GeneratedFile.of(PATH, ArtifactKind.TEST, "x"));
        assertFalse(Files.exists(base.resolve(PATH + FileSystemArtifactSink.BACKUP_SUFFIX)));
    }

    @Test(expected = IOException.class)
    public void testUnwritableTarget() throws IOException {
        Path base = tmp.getRoot().toPath();
        // A regular file where a directory is needed
        Files.writeString(base.resolve("generated"), "not a directory");
        new FileSystemArtifactSink(base, true, false).write(GeneratedFile.of(PATH, ArtifactKind.MACHINE, "x"));
    }
}
