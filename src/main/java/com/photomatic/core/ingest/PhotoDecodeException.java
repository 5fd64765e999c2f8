package com.photomatic.core.ingest;

/**
 * A single photo could not be read or decoded; the rest of its batch carries on.
 */
public class PhotoDecodeException extends Exception {

    private final String sourceName;

    public PhotoDecodeException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public PhotoDecodeException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
