package com.example.bookfetch.common.exception;

/**
 * Terminal failure for the job. The message is what the request will show.
 */
public class NonRetryableJobException extends JobProcessingException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
