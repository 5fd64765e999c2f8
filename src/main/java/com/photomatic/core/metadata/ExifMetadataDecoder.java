package com.photomatic.core.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.photomatic.logging.AppLogger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MetadataDecoder} backed by metadata-extractor. Only the exposure tags of the EXIF
 * sub-IFD are read; values are rendered the way camera UIs show them ({@code 1/125},
 * {@code f/2.8}, {@code 200}, {@code 50}).
 */
public final class ExifMetadataDecoder implements MetadataDecoder {

    private static final Logger LOGGER = AppLogger.get();

    @Override
    public Map<String, MetadataTag> decode(byte[] imageBytes) {
        Map<String, MetadataTag> tags = new LinkedHashMap<>();
        if (imageBytes == null || imageBytes.length == 0) {
            return tags;
        }
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes));
            for (ExifSubIFDDirectory directory : metadata.getDirectoriesOfType(ExifSubIFDDirectory.class)) {
                putIfAbsent(tags, MetadataField.EXPOSURE_TIME,
                    describeExposure(directory.getRational(ExifSubIFDDirectory.TAG_EXPOSURE_TIME)));
                putIfAbsent(tags, MetadataField.F_NUMBER,
                    directory.getDescription(ExifSubIFDDirectory.TAG_FNUMBER));
                putIfAbsent(tags, MetadataField.ISO,
                    directory.getString(ExifSubIFDDirectory.TAG_ISO_EQUIVALENT));
                putIfAbsent(tags, MetadataField.FOCAL_LENGTH_35MM,
                    directory.getString(ExifSubIFDDirectory.TAG_35MM_FILM_EQUIV_FOCAL_LENGTH));
            }
        } catch (ImageProcessingException | IOException e) {
            LOGGER.log(Level.FINE, () -> "No EXIF metadata available: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, () -> "Malformed EXIF metadata ignored: " + e);
        }
        return tags;
    }

    /**
     * Sub-second exposures are shown as a reciprocal ({@code 1/250}), longer ones as a plain number.
     */
    static String describeExposure(Rational exposure) {
        if (exposure == null || exposure.isZero()) {
            return null;
        }
        double seconds = exposure.doubleValue();
        if (!Double.isFinite(seconds) || seconds <= 0) {
            return null;
        }
        if (seconds < 1) {
            return "1/" + Math.round(1 / seconds);
        }
        return BigDecimal.valueOf(seconds).stripTrailingZeros().toPlainString();
    }

    private static void putIfAbsent(Map<String, MetadataTag> tags, MetadataField field, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        tags.putIfAbsent(field.tagName(), new MetadataTag(sanitize(value)));
    }

    private static String sanitize(String value) {
        return value.replace("\u0000", "").trim();
    }
}
