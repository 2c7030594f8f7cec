package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.DownloadOrchestrator;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.config.AppRequestProperties;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.DownloadSnapshot;
import com.example.bookfetch.domain.payload.RetryFailedImportsPayload;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-queues organize for requests parked in awaiting_import. The download path comes from the
 * stored history first, then from the client, then from the download dir and the transfer name.
 */
@Component
public class RetryFailedImportsProcessor implements JobProcessor<RetryFailedImportsPayload> {

    private static final Logger log = LoggerFactory.getLogger(RetryFailedImportsProcessor.class);

    private final RequestMapper requestMapper;
    private final DownloadHistoryMapper downloadHistoryMapper;
    private final DownloadOrchestrator downloadOrchestrator;
    private final JobQueueService jobQueueService;
    private final PipelineSettings pipelineSettings;
    private final AppRequestProperties requestProperties;

    public RetryFailedImportsProcessor(RequestMapper requestMapper,
                                       DownloadHistoryMapper downloadHistoryMapper,
                                       DownloadOrchestrator downloadOrchestrator,
                                       JobQueueService jobQueueService,
                                       PipelineSettings pipelineSettings,
                                       AppRequestProperties requestProperties) {
        this.requestMapper = requestMapper;
        this.downloadHistoryMapper = downloadHistoryMapper;
        this.downloadOrchestrator = downloadOrchestrator;
        this.jobQueueService = jobQueueService;
        this.pipelineSettings = pipelineSettings;
        this.requestProperties = requestProperties;
    }

    @Override
    public JobResult process(RetryFailedImportsPayload payload) {
        List<RequestEntity> requests = requestMapper.selectByStatus(
                RequestStatus.AWAITING_IMPORT.getValue(), requestProperties.getRetryImportBatchSize());
        if (requests.isEmpty()) {
            return JobResult.success("No requests awaiting import").with("triggered", 0);
        }
        int triggered = 0;
        int skipped = 0;
        for (RequestEntity request : requests) {
            DownloadHistoryEntity history = downloadHistoryMapper.selectLatestByRequestId(request.getId());
            if (history == null) {
                log.warn("RETRY_IMPORT_SKIPPED requestId={} reason=no_download_history", request.getId());
                skipped++;
                continue;
            }
            String downloadPath = resolveDownloadPath(history);
            if (TextUtil.isBlank(downloadPath)) {
                log.warn("RETRY_IMPORT_SKIPPED requestId={} reason=no_download_path historyId={}",
                        request.getId(), history.getId());
                skipped++;
                continue;
            }
            try {
                jobQueueService.addOrganizeJob(request.getId(), request.getAudiobookId(), downloadPath);
                triggered++;
            } catch (RuntimeException e) {
                log.warn("RETRY_IMPORT_ENQUEUE_FAILED requestId={}", request.getId(), e);
                skipped++;
            }
        }
        log.info("RETRY_FAILED_IMPORTS found={} triggered={} skipped={}", requests.size(), triggered, skipped);
        return JobResult.success("Triggered " + triggered + " imports")
                .with("found", requests.size())
                .with("triggered", triggered)
                .with("skipped", skipped);
    }

    String resolveDownloadPath(DownloadHistoryEntity history) {
        if (!TextUtil.isBlank(history.getDownloadPath())) {
            return history.getDownloadPath();
        }
        if (!TextUtil.isBlank(history.getDownloadClientId())) {
            try {
                DownloadSnapshot snapshot = downloadOrchestrator.poll(history.getDownloadClient(),
                        history.getDownloadClientId());
                if (snapshot != null && !TextUtil.isBlank(snapshot.getLocalPath())) {
                    return snapshot.getLocalPath();
                }
            } catch (RetryableJobException e) {
                log.warn("RETRY_IMPORT_CLIENT_LOOKUP_FAILED historyId={} msg={}", history.getId(), e.getMessage());
            }
        }
        if (TextUtil.isBlank(history.getTorrentName())) {
            return null;
        }
        return Paths.get(pipelineSettings.downloadDir(), history.getTorrentName()).toString();
    }
}
