package com.example.bookfetch.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.monitor")
public class AppMonitorProperties {

    /** Delay before the first poll after a transfer was submitted. */
    private int initialDelaySeconds = 3;

    /** Poll interval while the transfer keeps making progress. */
    private int pollIntervalSeconds = 10;

    private double stallBackoffMultiplier = 2.0D;

    /** Upper bound for the poll interval, however long a transfer stalls. */
    private int maxPollIntervalSeconds = 300;

    /**
     * How long after monitoring starts a "not found" answer from the client is still
     * treated as registration lag instead of an error.
     */
    private int notFoundGraceSeconds = 60;

    private int notFoundRetryDelaySeconds = 5;

    private int attempts = 5;
}
