package com.photomatic.core.model;

import com.photomatic.core.metadata.PhotoMetadata;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * One ingested photograph: the pre-fit raster, its JPEG thumbnail and its exposure metadata.
 * Immutable once built; the raster is only ever read by the compositor.
 */
public final class PhotoRecord {
    private final PhotoSource source;
    private final byte[] displayThumbnail;
    private final BufferedImage raster;
    private final PhotoMetadata metadata;
    private final int width;
    private final int height;

    public PhotoRecord(PhotoSource source,
                       byte[] displayThumbnail,
                       BufferedImage raster,
                       PhotoMetadata metadata) {
        this.source = Objects.requireNonNull(source, "source");
        this.displayThumbnail = Objects.requireNonNull(displayThumbnail, "displayThumbnail").clone();
        this.raster = Objects.requireNonNull(raster, "raster");
        this.metadata = metadata == null ? PhotoMetadata.empty() : metadata;
        this.width = raster.getWidth();
        this.height = raster.getHeight();
    }

    public PhotoSource getSource() {
        return source;
    }

    public String getName() {
        return source.name();
    }

    /**
     * JPEG bytes of the pre-fit raster, cheap to turn into filmstrip icons.
     */
    public byte[] getDisplayThumbnail() {
        return displayThumbnail.clone();
    }

    /**
     * The fitted pixels, shared rather than copied. Callers draw from it and must never paint
     * into it; every preview and export of this record reads the same image.
     */
    public BufferedImage getRaster() {
        return raster;
    }

    public PhotoMetadata getMetadata() {
        return metadata;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getAspectRatio() {
        return (double) width / height;
    }

    @Override
    public String toString() {
        return "PhotoRecord[" + source.name() + " " + width + "x" + height + "]";
    }
}
