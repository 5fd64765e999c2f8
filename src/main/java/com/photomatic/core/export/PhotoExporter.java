package com.photomatic.core.export;

import com.photomatic.core.image.ImageSupport;
import com.photomatic.logging.AppLogger;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.logging.Logger;

/**
 * Encodes the composited canvas as JPEG and hands it to a {@link FileSaveTarget}.
 */
public final class PhotoExporter {

    private static final Logger LOGGER = AppLogger.get();
    static final String SUFFIX = "_mat.jpeg";
    private static final String FALLBACK_NAME = "untitled";

    private final float quality;

    public PhotoExporter(float quality) {
        this.quality = quality;
    }

    /**
     * @return where the export was stored, as reported by {@code target}
     */
    public String export(BufferedImage surface, String sourceName, FileSaveTarget target) throws PhotoExportException {
        if (surface == null) {
            throw new PhotoExportException("Nothing to export");
        }
        String fileName = suggestedFileName(sourceName);
        byte[] jpeg;
        try {
            jpeg = ImageSupport.encodeJpeg(surface, quality);
        } catch (IOException | RuntimeException e) {
            throw new PhotoExportException("Unable to encode " + fileName + ": " + e.getMessage(), e);
        }
        try {
            String location = target.save(fileName, jpeg);
            LOGGER.info("Exported " + location);
            return location;
        } catch (IOException | RuntimeException e) {
            throw new PhotoExportException("Unable to save " + fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Export name for a source file: its extension is dropped and {@code _mat.jpeg} appended,
     * so {@code photo.jpg} becomes {@code photo_mat.jpeg}.
     */
    public static String suggestedFileName(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            return FALLBACK_NAME + SUFFIX;
        }
        String base = sourceName.trim();
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return base + SUFFIX;
    }
}
