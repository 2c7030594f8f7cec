package com.example.bookfetch.application.service;

import com.example.bookfetch.common.config.AppMonitorProperties;
import org.springframework.stereotype.Component;

/**
 * Poll spacing for a running transfer. Every poll without forward progress stretches the next
 * delay geometrically, up to {@code maxPollIntervalSeconds}; any progress resets it.
 */
@Component
public class StallBackoffPolicy {

    private final AppMonitorProperties properties;

    public StallBackoffPolicy(AppMonitorProperties properties) {
        this.properties = properties;
    }

    public int nextStallCount(Integer lastProgress, int currentPercent, Integer stallCount) {
        int last = lastProgress == null ? -1 : lastProgress;
        int stalls = stallCount == null ? 0 : stallCount;
        return currentPercent > last ? 0 : stalls + 1;
    }

    public long nextDelayMillis(int stallCount) {
        double base = properties.getPollIntervalSeconds();
        double multiplier = Math.max(1D, properties.getStallBackoffMultiplier());
        double seconds = base * Math.pow(multiplier, Math.max(0, stallCount));
        double capped = Math.min(properties.getMaxPollIntervalSeconds(), seconds);
        return Math.round(capped * 1000D);
    }
}
