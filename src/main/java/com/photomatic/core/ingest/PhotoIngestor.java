package com.photomatic.core.ingest;

import com.photomatic.config.LayoutSettings;
import com.photomatic.core.image.ImageSupport;
import com.photomatic.core.layout.FitCalculator;
import com.photomatic.core.layout.Margins;
import com.photomatic.core.layout.Placement;
import com.photomatic.core.metadata.MetadataDecoder;
import com.photomatic.core.metadata.PhotoMetadata;
import com.photomatic.core.model.PhotoRecord;
import com.photomatic.core.model.PhotoSource;
import com.photomatic.logging.AppLogger;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns one input file into a {@link PhotoRecord}: reads it, extracts exposure metadata,
 * decodes the pixels and shrinks them to fit the working canvas.
 */
public final class PhotoIngestor {

    private static final Logger LOGGER = AppLogger.get();

    private final MetadataDecoder metadataDecoder;
    private final RasterDecoder rasterDecoder;
    private final LayoutSettings settings;

    public PhotoIngestor(MetadataDecoder metadataDecoder, RasterDecoder rasterDecoder, LayoutSettings settings) {
        this.metadataDecoder = Objects.requireNonNull(metadataDecoder, "metadataDecoder");
        this.rasterDecoder = Objects.requireNonNull(rasterDecoder, "rasterDecoder");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public PhotoRecord ingest(PhotoSource source) throws PhotoDecodeException {
        String name = source.name();

        byte[] bytes;
        try {
            bytes = source.readAllBytes();
        } catch (IOException e) {
            throw new PhotoDecodeException(name, "Unable to read " + name + ": " + e.getMessage(), e);
        }

        PhotoMetadata metadata = readMetadata(name, bytes);
        BufferedImage decoded = rasterDecoder.decode(name, bytes);
        if (decoded == null) {
            throw new PhotoDecodeException(name, "Unable to load image " + name + ": decoder returned nothing");
        }

        int naturalWidth = decoded.getWidth();
        int naturalHeight = decoded.getHeight();
        if (naturalWidth <= 0 || naturalHeight <= 0) {
            throw new PhotoDecodeException(name,
                "Image " + name + " has invalid dimensions " + naturalWidth + "x" + naturalHeight);
        }

        BufferedImage fitted = fitToWorkingCanvas(decoded);

        byte[] thumbnail;
        try {
            thumbnail = ImageSupport.encodeJpeg(fitted, settings.thumbnailQuality());
        } catch (IOException e) {
            throw new PhotoDecodeException(name, "Unable to encode thumbnail for " + name + ": " + e.getMessage(), e);
        }

        LOGGER.fine(() -> "Ingested %s (%dx%d -> %dx%d)".formatted(
            name, naturalWidth, naturalHeight, fitted.getWidth(), fitted.getHeight()));
        return new PhotoRecord(source, thumbnail, fitted, metadata);
    }

    private PhotoMetadata readMetadata(String name, byte[] bytes) {
        try {
            return PhotoMetadata.fromTags(metadataDecoder.decode(bytes));
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, () -> "Metadata unavailable for " + name + ": " + e.getMessage());
            return PhotoMetadata.empty();
        }
    }

    private BufferedImage fitToWorkingCanvas(BufferedImage decoded) {
        int canvas = settings.workingCanvasSize();
        double aspect = (double) decoded.getWidth() / decoded.getHeight();
        Placement fit = FitCalculator.computeFit(canvas, canvas, Margins.uniform(settings.margin()), aspect);

        int width = Math.max(1, (int) Math.round(fit.width()));
        int height = Math.max(1, (int) Math.round(fit.height()));

        BufferedImage fitted = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = fitted.createGraphics();
        try {
            ImageSupport.setupHighQualityRendering(g);
            g.drawImage(decoded, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return fitted;
    }
}
