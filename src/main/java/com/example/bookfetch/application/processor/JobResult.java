package com.example.bookfetch.application.processor;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * What a handler reports back; stored as the job ledger result.
 */
@Data
public class JobResult {

    private boolean success;

    private String message;

    private Map<String, Object> data = new LinkedHashMap<>();

    public static JobResult success(String message) {
        JobResult result = new JobResult();
        result.setSuccess(true);
        result.setMessage(message);
        return result;
    }

    /**
     * Completed without doing anything, e.g. because the request was cancelled meanwhile.
     */
    public static JobResult skipped(String message) {
        JobResult result = new JobResult();
        result.setSuccess(false);
        result.setMessage(message);
        return result;
    }

    public JobResult with(String key, Object value) {
        data.put(key, value);
        return this;
    }
}
