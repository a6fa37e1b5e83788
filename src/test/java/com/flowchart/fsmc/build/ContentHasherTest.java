package com.flowchart.fsmc.build;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class ContentHasherTest {
    private static final String ABC = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testKnownDigest() throws IOException {
        assertEquals(ABC, ContentHasher.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)));
        Path file = folder.newFile("abc.txt").toPath();
        Files.writeString(file, "abc", StandardCharsets.UTF_8);
        assertEquals(ABC, ContentHasher.sha256Hex(file));
    }

    @Test
    public void testEmptyInput() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ContentHasher.sha256Hex(new byte[0]));
    }
}
