package com.example.bookfetch.application.queue;

import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.payload.JobPayload;
import java.util.function.Supplier;

/**
 * Distributes jobs to workers. The job ledger does not depend on the broker keeping its state:
 * everything needed to resubmit a job lives in the ledger row.
 */
public interface JobBroker {

    void setLifecycleListener(JobLifecycleListener listener);

    /**
     * Starts workers for one job type. Registering the same type twice is ignored.
     */
    void registerWorker(JobType type, int concurrency, JobHandler handler);

    /**
     * @return broker job id
     */
    String submit(JobType type, JobPayload payload, int priority, int maxAttempts, long delayMs);

    /**
     * Best-effort removal of a job that has not started yet.
     *
     * @return {@code true} when the job was still waiting
     */
    boolean remove(String brokerJobId);

    /**
     * Registers a cron-driven job under a stable key. An existing registration with the same key
     * is removed first. Every firing submits a fresh payload from {@code payloadFactory}.
     */
    void addRepeatable(String key, String cron, JobType type, Supplier<? extends JobPayload> payloadFactory,
                       int priority, int maxAttempts);

    boolean removeRepeatable(String key);

    boolean hasRepeatable(String key);

    /** Jobs submitted but not yet started, including delayed ones. */
    int waitingCount(JobType type);

    /** Jobs currently running. */
    int activeCount(JobType type);
}
