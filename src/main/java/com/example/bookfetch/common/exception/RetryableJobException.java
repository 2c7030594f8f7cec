package com.example.bookfetch.common.exception;

/**
 * Transient failure (network blip, collaborator not reachable). Retried with backoff and never
 * changes the request status on its own.
 */
public class RetryableJobException extends JobProcessingException {

    public RetryableJobException(String message) {
        super(message);
    }

    public RetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
