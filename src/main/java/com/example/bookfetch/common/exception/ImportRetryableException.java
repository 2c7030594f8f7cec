package com.example.bookfetch.common.exception;

/**
 * Organize failed in a way a later import attempt may fix (files not there yet, permissions).
 * The job itself is not retried; the request goes back to awaiting_import instead.
 */
public class ImportRetryableException extends JobProcessingException {

    public ImportRetryableException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
