package com.example.bookfetch.application.queue;

import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.payload.JobPayload;

/**
 * One unit of work as the broker sees it. {@code attemptsMade} counts started runs.
 */
public class BrokerJob {

    private final String brokerJobId;
    private final JobType type;
    private final JobPayload payload;
    private final int priority;
    private final int maxAttempts;
    private final String repeatKey;
    private volatile int attemptsMade;

    public BrokerJob(String brokerJobId, JobType type, JobPayload payload, int priority, int maxAttempts,
                     String repeatKey) {
        this.brokerJobId = brokerJobId;
        this.type = type;
        this.payload = payload;
        this.priority = priority;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.repeatKey = repeatKey;
    }

    public String getBrokerJobId() {
        return brokerJobId;
    }

    public JobType getType() {
        return type;
    }

    public JobPayload getPayload() {
        return payload;
    }

    public int getPriority() {
        return priority;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Key of the cron registration that fired this job, {@code null} for one-off jobs. */
    public String getRepeatKey() {
        return repeatKey;
    }

    public int getAttemptsMade() {
        return attemptsMade;
    }

    int nextAttempt() {
        attemptsMade++;
        return attemptsMade;
    }

    public boolean isLastAttempt() {
        return attemptsMade >= maxAttempts;
    }
}
