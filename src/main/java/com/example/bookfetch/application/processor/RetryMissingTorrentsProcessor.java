package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.common.config.AppRequestProperties;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.AudiobookRef;
import com.example.bookfetch.domain.payload.RetryMissingTorrentsPayload;
import com.example.bookfetch.infrastructure.persistence.entity.AudiobookEntity;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.AudiobookMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-queues a search for every request parked in awaiting_search.
 */
@Component
public class RetryMissingTorrentsProcessor implements JobProcessor<RetryMissingTorrentsPayload> {

    private static final Logger log = LoggerFactory.getLogger(RetryMissingTorrentsProcessor.class);

    private final RequestMapper requestMapper;
    private final AudiobookMapper audiobookMapper;
    private final JobQueueService jobQueueService;
    private final AppRequestProperties requestProperties;

    public RetryMissingTorrentsProcessor(RequestMapper requestMapper,
                                         AudiobookMapper audiobookMapper,
                                         JobQueueService jobQueueService,
                                         AppRequestProperties requestProperties) {
        this.requestMapper = requestMapper;
        this.audiobookMapper = audiobookMapper;
        this.jobQueueService = jobQueueService;
        this.requestProperties = requestProperties;
    }

    @Override
    public JobResult process(RetryMissingTorrentsPayload payload) {
        List<RequestEntity> requests = requestMapper.selectByStatus(
                RequestStatus.AWAITING_SEARCH.getValue(), requestProperties.getRetryMissingBatchSize());
        int queued = 0;
        int skipped = 0;
        for (RequestEntity request : requests) {
            AudiobookEntity audiobook = audiobookMapper.selectById(request.getAudiobookId());
            if (audiobook == null) {
                log.warn("RETRY_SEARCH_SKIPPED requestId={} reason=audiobook_missing", request.getId());
                skipped++;
                continue;
            }
            try {
                jobQueueService.addSearchJob(request.getId(),
                        new AudiobookRef(audiobook.getId(), audiobook.getTitle(), audiobook.getAuthor(), audiobook.getAsin()));
                queued++;
            } catch (RuntimeException e) {
                log.warn("RETRY_SEARCH_ENQUEUE_FAILED requestId={}", request.getId(), e);
                skipped++;
            }
        }
        log.info("RETRY_MISSING_TORRENTS found={} queued={} skipped={}", requests.size(), queued, skipped);
        return JobResult.success("Queued " + queued + " searches")
                .with("found", requests.size())
                .with("queued", queued)
                .with("skipped", skipped);
    }
}
