package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.service.DownloadOrchestrator;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.config.AppRequestProperties;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.DownloadSnapshot;
import com.example.bookfetch.domain.payload.CleanupSeededTorrentsPayload;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes finished transfers (with their data) once they have seeded long enough for their indexer.
 */
@Component
public class CleanupSeededTorrentsProcessor implements JobProcessor<CleanupSeededTorrentsPayload> {

    private static final Logger log = LoggerFactory.getLogger(CleanupSeededTorrentsProcessor.class);

    private final RequestMapper requestMapper;
    private final DownloadHistoryMapper downloadHistoryMapper;
    private final DownloadOrchestrator downloadOrchestrator;
    private final PipelineSettings pipelineSettings;
    private final AppRequestProperties requestProperties;

    public CleanupSeededTorrentsProcessor(RequestMapper requestMapper,
                                          DownloadHistoryMapper downloadHistoryMapper,
                                          DownloadOrchestrator downloadOrchestrator,
                                          PipelineSettings pipelineSettings,
                                          AppRequestProperties requestProperties) {
        this.requestMapper = requestMapper;
        this.downloadHistoryMapper = downloadHistoryMapper;
        this.downloadOrchestrator = downloadOrchestrator;
        this.pipelineSettings = pipelineSettings;
        this.requestProperties = requestProperties;
    }

    @Override
    public JobResult process(CleanupSeededTorrentsPayload payload) {
        List<RequestEntity> requests = requestMapper.selectByStatuses(
                Arrays.asList(RequestStatus.AVAILABLE.getValue(), RequestStatus.DOWNLOADED.getValue()),
                requestProperties.getCleanupBatchSize());
        int cleaned = 0;
        int seeding = 0;
        int unlimited = 0;
        for (RequestEntity request : requests) {
            DownloadHistoryEntity history = downloadHistoryMapper.selectLatestCompletedByRequestId(request.getId());
            if (history == null || TextUtil.isBlank(history.getDownloadClientId())
                    || TextUtil.isBlank(history.getIndexerName())) {
                continue;
            }
            int minutes = pipelineSettings.seedingTimeMinutes(history.getIndexerName());
            if (minutes <= 0) {
                unlimited++;
                continue;
            }
            try {
                DownloadSnapshot snapshot = downloadOrchestrator.poll(history.getDownloadClient(),
                        history.getDownloadClientId());
                if (snapshot == null) {
                    // already removed from the client
                    continue;
                }
                long requiredSeconds = minutes * 60L;
                if (snapshot.getSeedingTimeSeconds() < requiredSeconds) {
                    seeding++;
                    continue;
                }
                downloadOrchestrator.cancel(history.getDownloadClient(), history.getDownloadClientId(), true);
                log.info("SEEDED_TORRENT_REMOVED requestId={} indexer={} seededMinutes={} requiredMinutes={}",
                        request.getId(), history.getIndexerName(), snapshot.getSeedingTimeSeconds() / 60L, minutes);
                cleaned++;
            } catch (IOException | RetryableJobException e) {
                log.warn("SEEDED_TORRENT_CLEANUP_FAILED requestId={} msg={}", request.getId(), TextUtil.messageOf(e));
            }
        }
        log.info("CLEANUP_SEEDED_TORRENTS checked={} cleaned={} seeding={} unlimited={}",
                requests.size(), cleaned, seeding, unlimited);
        return JobResult.success("Cleanup seeded torrents completed")
                .with("totalChecked", requests.size())
                .with("cleaned", cleaned)
                .with("seeding", seeding)
                .with("unlimited", unlimited);
    }
}
