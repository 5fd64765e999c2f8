package com.photomatic.core.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link PhotoSource} backed by a file on disk.
 */
public record FilePhotoSource(Path path) implements PhotoSource {

    public FilePhotoSource {
        Objects.requireNonNull(path, "path");
    }

    public static List<PhotoSource> of(List<Path> paths) {
        List<PhotoSource> sources = new ArrayList<>();
        if (paths == null) {
            return sources;
        }
        for (Path p : paths) {
            if (p != null) {
                sources.add(new FilePhotoSource(p));
            }
        }
        return sources;
    }

    @Override
    public String name() {
        Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    @Override
    public byte[] readAllBytes() throws IOException {
        return Files.readAllBytes(path);
    }
}
