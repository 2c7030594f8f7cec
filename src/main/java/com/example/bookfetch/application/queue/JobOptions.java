package com.example.bookfetch.application.queue;

import lombok.Data;

/**
 * Per-enqueue overrides. Unset fields fall back to the job type defaults and {@code app.queue}.
 */
@Data
public class JobOptions {

    /** Higher runs first. */
    private Integer priority;

    private long delayMs;

    private Integer attempts;

    public static JobOptions defaults() {
        return new JobOptions();
    }

    public static JobOptions delayed(long delayMs) {
        JobOptions options = new JobOptions();
        options.setDelayMs(Math.max(0L, delayMs));
        return options;
    }

    public JobOptions withAttempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    public JobOptions withPriority(int priority) {
        this.priority = priority;
        return this;
    }
}
