package com.photomatic.core.export;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Saves exports into one directory without overwriting: a taken name gets a {@code " (2)"},
 * {@code " (3)"}, ... suffix before its extension.
 */
public final class DirectoryFileSaveTarget implements FileSaveTarget {

    private final Path directory;

    public DirectoryFileSaveTarget(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public String save(String suggestedName, byte[] data) throws IOException {
        Files.createDirectories(directory);
        if (!Files.isDirectory(directory)) {
            throw new IOException("Export location is not a directory: " + directory.toAbsolutePath());
        }
        String name = (suggestedName == null || suggestedName.isBlank()) ? PhotoExporter.suggestedFileName(null) : suggestedName;
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";

        File target = ensureUniqueFile(directory.toFile(), base, ext);
        Files.write(target.toPath(), data);
        return target.getAbsolutePath();
    }

    private static File ensureUniqueFile(File dir, String baseNameNoExt, String ext) {
        File candidate = new File(dir, baseNameNoExt + ext);
        if (!candidate.exists()) {
            return candidate;
        }
        int i = 2;
        while (true) {
            File alt = new File(dir, baseNameNoExt + " (" + i + ")" + ext);
            if (!alt.exists()) {
                return alt;
            }
            i++;
        }
    }
}
