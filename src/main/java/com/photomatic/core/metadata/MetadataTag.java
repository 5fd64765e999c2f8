package com.photomatic.core.metadata;

/**
 * One decoded tag; {@code description} is the human-readable value.
 */
public record MetadataTag(String description) {
}
