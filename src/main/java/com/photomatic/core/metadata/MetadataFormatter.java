package com.photomatic.core.metadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats exposure metadata as the single overlay line drawn under the photo, e.g.
 * {@code 50mm | f/2.8 | ISO200 | 1/125s}.
 */
public final class MetadataFormatter {

    static final String SEPARATOR = " | ";

    private MetadataFormatter() {
    }

    /**
     * @return the overlay text, or an empty string when none of the fields is present
     */
    public static String formatOverlay(PhotoMetadata metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>(4);
        metadata.get(MetadataField.FOCAL_LENGTH_35MM).ifPresent(focal -> parts.add(focal + "mm"));
        metadata.get(MetadataField.F_NUMBER).ifPresent(parts::add);
        metadata.get(MetadataField.ISO).ifPresent(iso -> parts.add("ISO" + iso));
        metadata.get(MetadataField.EXPOSURE_TIME).ifPresent(exposure -> parts.add(exposure + "s"));
        return String.join(SEPARATOR, parts);
    }
}
