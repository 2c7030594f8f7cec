package com.example.bookfetch.application.processor;

import com.example.bookfetch.domain.payload.JobPayload;

/**
 * Handler of one job type. Failures are reported by throwing a
 * {@link com.example.bookfetch.common.exception.JobProcessingException}; handlers never mark a
 * request failed themselves.
 */
public interface JobProcessor<P extends JobPayload> {

    JobResult process(P payload);
}
