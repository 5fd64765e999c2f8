package com.photomatic.core.metadata;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable exposure metadata of one photo. Fields without a usable value are simply absent.
 */
public final class PhotoMetadata {

    private static final PhotoMetadata EMPTY = new PhotoMetadata(new EnumMap<>(MetadataField.class));

    private final Map<MetadataField, String> values;

    private PhotoMetadata(EnumMap<MetadataField, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static PhotoMetadata empty() {
        return EMPTY;
    }

    public static PhotoMetadata of(Map<MetadataField, String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        EnumMap<MetadataField, String> copy = new EnumMap<>(MetadataField.class);
        values.forEach((field, value) -> {
            if (field != null && value != null && !value.isBlank()) {
                copy.put(field, value.trim());
            }
        });
        return copy.isEmpty() ? EMPTY : new PhotoMetadata(copy);
    }

    /**
     * Picks the known fields out of a decoder's tag map.
     */
    public static PhotoMetadata fromTags(Map<String, MetadataTag> tags) {
        if (tags == null || tags.isEmpty()) {
            return EMPTY;
        }
        EnumMap<MetadataField, String> values = new EnumMap<>(MetadataField.class);
        for (MetadataField field : MetadataField.values()) {
            MetadataTag tag = tags.get(field.tagName());
            if (tag != null && tag.description() != null) {
                values.put(field, tag.description());
            }
        }
        return of(values);
    }

    public Optional<String> get(MetadataField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<MetadataField, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PhotoMetadata other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "PhotoMetadata" + values;
    }
}
