package com.example.bookfetch.common.exception;

/**
 * Base of the failures a job handler reports to the queue.
 */
public abstract class JobProcessingException extends RuntimeException {

    protected JobProcessingException(String message) {
        super(message);
    }

    protected JobProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the broker may run the job again. */
    public abstract boolean isRetryable();
}
