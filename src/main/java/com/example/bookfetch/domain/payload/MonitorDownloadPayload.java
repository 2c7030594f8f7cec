package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Carries the polling loop state between self-scheduled monitor runs, so a restart loses nothing.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class MonitorDownloadPayload extends JobPayload {

    private Long requestId;

    private Long downloadHistoryId;

    /** Client-side transfer handle (torrent hash, NZB id). */
    private String downloadClientId;

    /** Which configured client owns the transfer. */
    private String downloadClient;

    private Integer lastProgress;

    private Integer stallCount;

    /** Epoch millis of the first poll of this loop; bounds the not-found grace period. */
    private Long monitorStartedAt;

    @Override
    public JobType jobType() {
        return JobType.MONITOR_DOWNLOAD;
    }

    @Override
    public Long requestId() {
        return requestId;
    }
}
