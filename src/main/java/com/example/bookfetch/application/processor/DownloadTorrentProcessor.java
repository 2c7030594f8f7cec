package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.DownloadOrchestrator;
import com.example.bookfetch.application.service.RequestStateMachine;
import com.example.bookfetch.common.config.AppMonitorProperties;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.payload.DownloadTorrentPayload;
import com.example.bookfetch.domain.payload.MonitorDownloadPayload;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Submits the selected candidate and starts the monitor loop. A refused submit fails the job
 * without a monitor.
 */
@Component
public class DownloadTorrentProcessor implements JobProcessor<DownloadTorrentPayload> {

    private static final Logger log = LoggerFactory.getLogger(DownloadTorrentProcessor.class);

    private final RequestStateMachine requestStateMachine;
    private final DownloadOrchestrator downloadOrchestrator;
    private final JobQueueService jobQueueService;
    private final AppMonitorProperties monitorProperties;

    public DownloadTorrentProcessor(RequestStateMachine requestStateMachine,
                                    DownloadOrchestrator downloadOrchestrator,
                                    JobQueueService jobQueueService,
                                    AppMonitorProperties monitorProperties) {
        this.requestStateMachine = requestStateMachine;
        this.downloadOrchestrator = downloadOrchestrator;
        this.jobQueueService = jobQueueService;
        this.monitorProperties = monitorProperties;
    }

    @Override
    public JobResult process(DownloadTorrentPayload payload) {
        Long requestId = payload.getRequestId();
        if (!requestStateMachine.transitionWithProgress(requestId, RequestStatus.DOWNLOADING, 0)) {
            return JobResult.skipped("Request " + requestId + " is no longer waiting for a download");
        }

        DownloadHistoryEntity history = downloadOrchestrator.startDownload(requestId, payload.getTorrent(), null);

        MonitorDownloadPayload monitor = new MonitorDownloadPayload();
        monitor.setRequestId(requestId);
        monitor.setDownloadHistoryId(history.getId());
        monitor.setDownloadClientId(history.getDownloadClientId());
        monitor.setDownloadClient(history.getDownloadClient());
        monitor.setLastProgress(0);
        monitor.setStallCount(0);
        monitor.setMonitorStartedAt(System.currentTimeMillis());
        jobQueueService.addMonitorJob(monitor, monitorProperties.getInitialDelaySeconds() * 1000L);
        log.info("DOWNLOAD_MONITOR_SCHEDULED requestId={} historyId={} delaySeconds={}",
                requestId, history.getId(), monitorProperties.getInitialDelaySeconds());

        return JobResult.success("Download started")
                .with("downloadHistoryId", history.getId())
                .with("downloadClient", history.getDownloadClient())
                .with("handle", history.getDownloadClientId());
    }
}
