package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.common.config.AppQueueProperties;
import com.example.bookfetch.domain.enumtype.JobType;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes a payload to its processor. The switch covers every {@link JobType}; adding a type
 * without a branch fails at the default.
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final SearchIndexersProcessor searchIndexersProcessor;
    private final DownloadTorrentProcessor downloadTorrentProcessor;
    private final MonitorDownloadProcessor monitorDownloadProcessor;
    private final OrganizeFilesProcessor organizeFilesProcessor;
    private final ScanLibraryProcessor scanLibraryProcessor;
    private final RetryMissingTorrentsProcessor retryMissingTorrentsProcessor;
    private final RetryFailedImportsProcessor retryFailedImportsProcessor;
    private final CleanupSeededTorrentsProcessor cleanupSeededTorrentsProcessor;
    private final SendNotificationProcessor sendNotificationProcessor;

    public JobDispatcher(SearchIndexersProcessor searchIndexersProcessor,
                         DownloadTorrentProcessor downloadTorrentProcessor,
                         MonitorDownloadProcessor monitorDownloadProcessor,
                         OrganizeFilesProcessor organizeFilesProcessor,
                         ScanLibraryProcessor scanLibraryProcessor,
                         RetryMissingTorrentsProcessor retryMissingTorrentsProcessor,
                         RetryFailedImportsProcessor retryFailedImportsProcessor,
                         CleanupSeededTorrentsProcessor cleanupSeededTorrentsProcessor,
                         SendNotificationProcessor sendNotificationProcessor) {
        this.searchIndexersProcessor = searchIndexersProcessor;
        this.downloadTorrentProcessor = downloadTorrentProcessor;
        this.monitorDownloadProcessor = monitorDownloadProcessor;
        this.organizeFilesProcessor = organizeFilesProcessor;
        this.scanLibraryProcessor = scanLibraryProcessor;
        this.retryMissingTorrentsProcessor = retryMissingTorrentsProcessor;
        this.retryFailedImportsProcessor = retryFailedImportsProcessor;
        this.cleanupSeededTorrentsProcessor = cleanupSeededTorrentsProcessor;
        this.sendNotificationProcessor = sendNotificationProcessor;
    }

    /**
     * Registers one worker per job type with its configured concurrency.
     */
    public void registerAll(JobQueueService jobQueueService, AppQueueProperties queueProperties) {
        for (JobType type : JobType.values()) {
            jobQueueService.registerProcessor(type, queueProperties.concurrencyOf(type),
                    job -> dispatch(job.getPayload()));
        }
        log.info("JOB_PROCESSORS_REGISTERED types={}", JobType.values().length);
    }

    public JobResult dispatch(JobPayload payload) {
        switch (payload.jobType()) {
            case SEARCH_INDEXERS:
                return searchIndexersProcessor.process((SearchIndexersPayload) payload);
            case DOWNLOAD_TORRENT:
                return downloadTorrentProcessor.process((DownloadTorrentPayload) payload);
            case MONITOR_DOWNLOAD:
                return monitorDownloadProcessor.process((MonitorDownloadPayload) payload);
            case ORGANIZE_FILES:
                return organizeFilesProcessor.process((OrganizeFilesPayload) payload);
            case SCAN_LIBRARY:
                return scanLibraryProcessor.process((ScanLibraryPayload) payload);
            case RETRY_MISSING_TORRENTS:
                return retryMissingTorrentsProcessor.process((RetryMissingTorrentsPayload) payload);
            case RETRY_FAILED_IMPORTS:
                return retryFailedImportsProcessor.process((RetryFailedImportsPayload) payload);
            case CLEANUP_SEEDED_TORRENTS:
                return cleanupSeededTorrentsProcessor.process((CleanupSeededTorrentsPayload) payload);
            case SEND_NOTIFICATION:
                return sendNotificationProcessor.process((SendNotificationPayload) payload);
            default:
                throw new IllegalStateException("No processor for job type " + payload.jobType());
        }
    }
}
