package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.DownloadOrchestrator;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.application.service.RequestStateMachine;
import com.example.bookfetch.application.service.StallBackoffPolicy;
import com.example.bookfetch.common.config.AppMonitorProperties;
import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.DownloadSnapshot;
import com.example.bookfetch.domain.payload.MonitorDownloadPayload;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One poll of a running transfer. The loop state ({@code lastProgress}, {@code stallCount}) lives
 * in the payload; every poll that does not finish the transfer enqueues the next one with a delay.
 */
@Component
public class MonitorDownloadProcessor implements JobProcessor<MonitorDownloadPayload> {

    private static final Logger log = LoggerFactory.getLogger(MonitorDownloadProcessor.class);

    private final RequestMapper requestMapper;
    private final DownloadHistoryMapper downloadHistoryMapper;
    private final RequestStateMachine requestStateMachine;
    private final DownloadOrchestrator downloadOrchestrator;
    private final StallBackoffPolicy stallBackoffPolicy;
    private final JobQueueService jobQueueService;
    private final PipelineSettings pipelineSettings;
    private final AppMonitorProperties monitorProperties;

    public MonitorDownloadProcessor(RequestMapper requestMapper,
                                    DownloadHistoryMapper downloadHistoryMapper,
                                    RequestStateMachine requestStateMachine,
                                    DownloadOrchestrator downloadOrchestrator,
                                    StallBackoffPolicy stallBackoffPolicy,
                                    JobQueueService jobQueueService,
                                    PipelineSettings pipelineSettings,
                                    AppMonitorProperties monitorProperties) {
        this.requestMapper = requestMapper;
        this.downloadHistoryMapper = downloadHistoryMapper;
        this.requestStateMachine = requestStateMachine;
        this.downloadOrchestrator = downloadOrchestrator;
        this.stallBackoffPolicy = stallBackoffPolicy;
        this.jobQueueService = jobQueueService;
        this.pipelineSettings = pipelineSettings;
        this.monitorProperties = monitorProperties;
    }

    @Override
    public JobResult process(MonitorDownloadPayload payload) {
        Long requestId = payload.getRequestId();
        if (!requestStateMachine.isActive(requestId)) {
            return JobResult.skipped("Request " + requestId + " is no longer active");
        }
        long now = System.currentTimeMillis();
        long startedAt = payload.getMonitorStartedAt() == null ? now : payload.getMonitorStartedAt();

        DownloadSnapshot snapshot = downloadOrchestrator.poll(payload.getDownloadClient(), payload.getDownloadClientId());
        if (snapshot == null) {
            return onNotFound(payload, now, startedAt);
        }

        if (snapshot.getState() != null && snapshot.getState().isFailed()) {
            String reason = TextUtil.isBlank(snapshot.getErrorMessage())
                    ? "client reported the transfer as failed" : snapshot.getErrorMessage();
            throw new NonRetryableJobException("Download failed: " + reason);
        }

        if (snapshot.getState() != null && snapshot.getState().isComplete()) {
            return onCompleted(payload, snapshot);
        }

        int percent = snapshot.getPercent();
        requestMapper.updateDownloadProgress(requestId, percent);
        downloadHistoryMapper.updateProgress(payload.getDownloadHistoryId(), percent);

        int stallCount = stallBackoffPolicy.nextStallCount(payload.getLastProgress(), percent, payload.getStallCount());
        long delayMs = stallBackoffPolicy.nextDelayMillis(stallCount);
        if (stallCount > 0) {
            log.info("DOWNLOAD_STALLED requestId={} percent={} stallCount={} nextPollMs={}",
                    requestId, percent, stallCount, delayMs);
        } else {
            log.debug("DOWNLOAD_PROGRESS requestId={} percent={} speed={} eta={}",
                    requestId, percent, snapshot.getDownloadSpeed(), snapshot.getEta());
        }
        jobQueueService.addMonitorJob(nextPoll(payload, percent, stallCount, startedAt), delayMs);
        return JobResult.success("Progress " + percent + "%")
                .with("percent", percent)
                .with("stallCount", stallCount)
                .with("nextPollMs", delayMs);
    }

    private JobResult onNotFound(MonitorDownloadPayload payload, long now, long startedAt) {
        long graceMs = monitorProperties.getNotFoundGraceSeconds() * 1000L;
        if (now - startedAt < graceMs) {
            long delayMs = monitorProperties.getNotFoundRetryDelaySeconds() * 1000L;
            log.info("DOWNLOAD_NOT_FOUND_YET requestId={} handle={} sinceStartMs={} nextPollMs={}",
                    payload.getRequestId(), payload.getDownloadClientId(), now - startedAt, delayMs);
            MonitorDownloadPayload next = nextPoll(payload,
                    payload.getLastProgress() == null ? 0 : payload.getLastProgress(),
                    payload.getStallCount() == null ? 0 : payload.getStallCount(),
                    startedAt);
            jobQueueService.addMonitorJob(next, delayMs);
            return JobResult.success("Download not registered yet, polling again");
        }
        throw new RetryableJobException("Download " + payload.getDownloadClientId() + " not found in "
                + payload.getDownloadClient());
    }

    private JobResult onCompleted(MonitorDownloadPayload payload, DownloadSnapshot snapshot) {
        Long requestId = payload.getRequestId();
        String localPath = snapshot.getLocalPath();
        if (TextUtil.isBlank(localPath)) {
            localPath = Paths.get(pipelineSettings.downloadDir(), snapshot.getName()).toString();
        }
        downloadHistoryMapper.markCompleted(payload.getDownloadHistoryId(), localPath);
        if (!requestStateMachine.transitionWithProgress(requestId, RequestStatus.DOWNLOADED, 100)) {
            return JobResult.skipped("Request " + requestId + " left downloading before completion");
        }
        RequestEntity request = requestMapper.selectById(requestId);
        jobQueueService.addOrganizeJob(requestId, request.getAudiobookId(), localPath);
        log.info("DOWNLOAD_COMPLETED requestId={} historyId={} path={}",
                requestId, payload.getDownloadHistoryId(), localPath);
        return JobResult.success("Download completed").with("downloadPath", localPath);
    }

    private static MonitorDownloadPayload nextPoll(MonitorDownloadPayload current,
                                                   int lastProgress,
                                                   int stallCount,
                                                   long startedAt) {
        MonitorDownloadPayload next = new MonitorDownloadPayload();
        next.setRequestId(current.getRequestId());
        next.setDownloadHistoryId(current.getDownloadHistoryId());
        next.setDownloadClientId(current.getDownloadClientId());
        next.setDownloadClient(current.getDownloadClient());
        next.setLastProgress(lastProgress);
        next.setStallCount(stallCount);
        next.setMonitorStartedAt(startedAt);
        return next;
    }
}
