package com.photomatic.core.export;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DirectoryFileSaveTargetTest {

    @TempDir
    Path tempDir;

    @Test
    void neverOverwritesExistingExports() throws Exception {
        DirectoryFileSaveTarget target = new DirectoryFileSaveTarget(tempDir.resolve("exports"));

        Path first = Path.of(target.save("photo_mat.jpeg", new byte[] {1}));
        Path second = Path.of(target.save("photo_mat.jpeg", new byte[] {2}));
        Path third = Path.of(target.save("photo_mat.jpeg", new byte[] {3}));

        assertEquals("photo_mat.jpeg", first.getFileName().toString());
        assertEquals("photo_mat (2).jpeg", second.getFileName().toString());
        assertEquals("photo_mat (3).jpeg", third.getFileName().toString());
        assertArrayEquals(new byte[] {1}, Files.readAllBytes(first));
        assertArrayEquals(new byte[] {3}, Files.readAllBytes(third));
    }

    @Test
    void blankNameFallsBackToUntitled() throws Exception {
        DirectoryFileSaveTarget target = new DirectoryFileSaveTarget(tempDir);

        Path saved = Path.of(target.save(" ", new byte[] {9}));

        assertEquals("untitled_mat.jpeg", saved.getFileName().toString());
    }
}
