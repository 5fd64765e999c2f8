package com.photomatic.core.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes the export to a file the user already picked, replacing it if present. The suggested
 * name is ignored.
 */
public final class SingleFileSaveTarget implements FileSaveTarget {

    private final Path file;

    public SingleFileSaveTarget(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public String save(String suggestedName, byte[] data) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, data);
        return file.toAbsolutePath().toString();
    }
}
