package com.photomatic.core.ingest;

/**
 * A file of a batch that was skipped.
 */
public record IngestFailure(String sourceName, PhotoDecodeException cause) {
}
