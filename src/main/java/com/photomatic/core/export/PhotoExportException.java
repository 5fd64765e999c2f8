package com.photomatic.core.export;

/**
 * The composited frame could not be encoded or saved.
 */
public class PhotoExportException extends Exception {

    public PhotoExportException(String message) {
        super(message);
    }

    public PhotoExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
