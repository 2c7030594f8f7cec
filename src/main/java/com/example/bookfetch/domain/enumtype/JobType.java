package com.example.bookfetch.domain.enumtype;

import com.example.bookfetch.domain.payload.CleanupSeededTorrentsPayload;
import com.example.bookfetch.domain.payload.DownloadTorrentPayload;
import com.example.bookfetch.domain.payload.JobPayload;
import com.example.bookfetch.domain.payload.MonitorDownloadPayload;
import com.example.bookfetch.domain.payload.OrganizeFilesPayload;
import com.example.bookfetch.domain.payload.RetryFailedImportsPayload;
import com.example.bookfetch.domain.payload.RetryMissingTorrentsPayload;
import com.example.bookfetch.domain.payload.ScanLibraryPayload;
import com.example.bookfetch.domain.payload.SearchIndexersPayload;
import com.example.bookfetch.domain.payload.SendNotificationPayload;

/**
 * Closed set of job kinds the queue knows how to run. Each kind has exactly one payload class.
 */
public enum JobType {

    SEARCH_INDEXERS("search_indexers", SearchIndexersPayload.class, 10, 3, false),
    DOWNLOAD_TORRENT("download_torrent", DownloadTorrentPayload.class, 9, 3, false),
    MONITOR_DOWNLOAD("monitor_download", MonitorDownloadPayload.class, 5, 5, false),
    ORGANIZE_FILES("organize_files", OrganizeFilesPayload.class, 8, 2, false),
    SCAN_LIBRARY("scan_library", ScanLibraryPayload.class, 7, 1, true),
    RETRY_MISSING_TORRENTS("retry_missing_torrents", RetryMissingTorrentsPayload.class, 7, 1, true),
    RETRY_FAILED_IMPORTS("retry_failed_imports", RetryFailedImportsPayload.class, 7, 1, true),
    CLEANUP_SEEDED_TORRENTS("cleanup_seeded_torrents", CleanupSeededTorrentsPayload.class, 7, 1, true),
    SEND_NOTIFICATION("send_notification", SendNotificationPayload.class, 5, 5, false);

    private final String code;
    private final Class<? extends JobPayload> payloadType;
    private final int defaultPriority;
    private final int defaultConcurrency;
    private final boolean schedulable;

    JobType(String code,
            Class<? extends JobPayload> payloadType,
            int defaultPriority,
            int defaultConcurrency,
            boolean schedulable) {
        this.code = code;
        this.payloadType = payloadType;
        this.defaultPriority = defaultPriority;
        this.defaultConcurrency = defaultConcurrency;
        this.schedulable = schedulable;
    }

    public String getCode() {
        return code;
    }

    public Class<? extends JobPayload> getPayloadType() {
        return payloadType;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    /** Whether a {@code ScheduledJob} row may fire this job type on a cron. */
    public boolean isSchedulable() {
        return schedulable;
    }

    public static JobType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Job type is required");
        }
        for (JobType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + code);
    }
}
