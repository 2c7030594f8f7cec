package com.example.bookfetch.common.config;

import com.example.bookfetch.domain.enumtype.JobType;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.queue")
public class AppQueueProperties {

    private int defaultAttempts = 3;

    /** First retry delay; every further retry doubles it. */
    private long backoffBaseMs = 2000L;

    /**
     * Per job type concurrency, keyed by job type code (search_indexers, organize_files, ...).
     */
    private Map<String, Integer> concurrency = new HashMap<>();

    /**
     * Handler run time after which the job is reported as stalled.
     */
    private long stalledTimeoutMs = 30L * 60L * 1000L;

    private long stalledCheckIntervalMs = 60L * 1000L;

    /**
     * Ledger rows older than this are not resubmitted on startup.
     */
    private int recoveryWindowHours = 24;

    private int recoveryBatchSize = 500;

    private int schedulerPoolSize = 2;

    public int concurrencyOf(JobType type) {
        Integer configured = concurrency.get(type.getCode());
        if (configured == null || configured <= 0) {
            return type.getDefaultConcurrency();
        }
        return configured;
    }
}
