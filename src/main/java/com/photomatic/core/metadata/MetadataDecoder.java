package com.photomatic.core.metadata;

import java.util.Map;

/**
 * Extracts camera tags from the raw bytes of an image file.
 * <p>
 * Implementations return an empty or partial map for malformed input and never throw.
 */
@FunctionalInterface
public interface MetadataDecoder {

    Map<String, MetadataTag> decode(byte[] imageBytes);
}
