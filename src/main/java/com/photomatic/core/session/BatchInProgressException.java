package com.photomatic.core.session;

/**
 * A batch was submitted while another one (or an export) was still running. Batches are
 * never queued behind each other.
 */
public class BatchInProgressException extends IllegalStateException {

    public BatchInProgressException(String message) {
        super(message);
    }
}
