package com.photomatic.core.metadata;

/**
 * The closed set of exposure fields the overlay knows how to show, keyed by their EXIF tag name.
 */
public enum MetadataField {
    EXPOSURE_TIME("ExposureTime"),
    F_NUMBER("FNumber"),
    ISO("ISOSpeedRatings"),
    FOCAL_LENGTH_35MM("FocalLengthIn35mmFilm");

    private final String tagName;

    MetadataField(String tagName) {
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }
}
