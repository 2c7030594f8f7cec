package com.example.bookfetch.application.queue;

import static com.example.bookfetch.common.util.TextUtil.truncate;

import com.example.bookfetch.application.service.NotificationService;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.DownloadHistoryStatus;
import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.payload.JobPayload;
import com.example.bookfetch.domain.payload.MonitorDownloadPayload;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides what a job that will not run again means for its request. This is the only place a
 * job failure turns into a request status change.
 *
 * <ul>
 *     <li>monitor_download: request failed, download closed</li>
 *     <li>any {@link NonRetryableJobException} (client error, bad template): request failed</li>
 *     <li>organize_files otherwise: import accounting, awaiting_import until the limit, then warn</li>
 *     <li>search_indexers, download_torrent otherwise: back to awaiting_search for the retry job</li>
 * </ul>
 */
@Component
public class JobFailurePolicy {

    private static final Logger log = LoggerFactory.getLogger(JobFailurePolicy.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    private final RequestMapper requestMapper;
    private final DownloadHistoryMapper downloadHistoryMapper;
    private final NotificationService notificationService;
    private final PipelineSettings pipelineSettings;

    public JobFailurePolicy(RequestMapper requestMapper,
                            DownloadHistoryMapper downloadHistoryMapper,
                            NotificationService notificationService,
                            PipelineSettings pipelineSettings) {
        this.requestMapper = requestMapper;
        this.downloadHistoryMapper = downloadHistoryMapper;
        this.notificationService = notificationService;
        this.pipelineSettings = pipelineSettings;
    }

    public void onFinalFailure(JobType type, JobPayload payload, Throwable error, int attemptsMade) {
        Long requestId = payload.requestId();
        String message = TextUtil.messageOf(error);
        if (requestId == null) {
            log.warn("JOB_FAILED_NO_REQUEST type={} attempts={} error={}", type.getCode(), attemptsMade, message);
            return;
        }
        switch (type) {
            case MONITOR_DOWNLOAD:
                onMonitorFailure((MonitorDownloadPayload) payload, error, attemptsMade);
                break;
            case ORGANIZE_FILES:
                if (error instanceof NonRetryableJobException) {
                    failRequest(requestId, message);
                } else {
                    recordImportFailure(requestId, message);
                }
                break;
            case SEARCH_INDEXERS:
            case DOWNLOAD_TORRENT:
                if (error instanceof NonRetryableJobException) {
                    failRequest(requestId, message);
                } else {
                    returnToSearch(requestId, message);
                }
                break;
            default:
                log.warn("JOB_FAILED type={} requestId={} attempts={} error={}",
                        type.getCode(), requestId, attemptsMade, message);
        }
    }

    private void onMonitorFailure(MonitorDownloadPayload payload, Throwable error, int attemptsMade) {
        String message = error instanceof NonRetryableJobException
                ? TextUtil.messageOf(error)
                : "Download monitoring failed after " + attemptsMade + " attempts: " + TextUtil.messageOf(error);
        if (payload.getDownloadHistoryId() != null) {
            downloadHistoryMapper.close(payload.getDownloadHistoryId(), DownloadHistoryStatus.FAILED.getValue(),
                    truncate(message, MAX_ERROR_LENGTH));
        }
        failRequest(payload.getRequestId(), message);
    }

    private void failRequest(Long requestId, String message) {
        int updated = requestMapper.transition(requestId, RequestStatus.activeValues(),
                RequestStatus.FAILED.getValue(), truncate(message, MAX_ERROR_LENGTH));
        if (updated == 0) {
            log.info("REQUEST_FAIL_SKIPPED requestId={} currentStatus={}",
                    requestId, requestMapper.selectStatusById(requestId));
            return;
        }
        log.warn("REQUEST_STATUS requestId={} to={} error={}", requestId, RequestStatus.FAILED.getValue(), message);
        notificationService.notifyRequestEvent(requestId, NotificationService.EVENT_ERROR, message);
    }

    private void returnToSearch(Long requestId, String message) {
        int updated = requestMapper.transition(requestId,
                RequestStatus.valuesOf(RequestStatus.PENDING, RequestStatus.SEARCHING, RequestStatus.DOWNLOADING),
                RequestStatus.AWAITING_SEARCH.getValue(), truncate(message, MAX_ERROR_LENGTH));
        if (updated > 0) {
            log.info("REQUEST_STATUS requestId={} to={} reason={}",
                    requestId, RequestStatus.AWAITING_SEARCH.getValue(), message);
        }
    }

    /**
     * Counts one failed import. Below the limit the request waits for the retry job; at the limit
     * it is parked in warn for a manual retry.
     */
    void recordImportFailure(Long requestId, String message) {
        RequestEntity request = requestMapper.selectById(requestId);
        if (request == null) {
            return;
        }
        int attempts = (request.getImportAttempts() == null ? 0 : request.getImportAttempts()) + 1;
        int max = request.getMaxImportRetries() != null && request.getMaxImportRetries() > 0
                ? request.getMaxImportRetries()
                : pipelineSettings.maxImportRetries();
        boolean exhausted = attempts >= max;
        String toStatus = exhausted ? RequestStatus.WARN.getValue() : RequestStatus.AWAITING_IMPORT.getValue();
        String errorMessage = exhausted
                ? message + ". Max retries (" + max + ") exceeded. Manual retry available."
                : message + ". Retry " + attempts + "/" + max;
        int updated = requestMapper.recordImportFailure(requestId,
                RequestStatus.valuesOf(RequestStatus.DOWNLOADED, RequestStatus.PROCESSING, RequestStatus.AWAITING_IMPORT),
                toStatus, attempts, truncate(errorMessage, MAX_ERROR_LENGTH));
        if (updated == 0) {
            log.info("IMPORT_FAILURE_SKIPPED requestId={} currentStatus={}", requestId, request.getStatus());
            return;
        }
        log.warn("REQUEST_STATUS requestId={} to={} importAttempts={}/{} error={}",
                requestId, toStatus, attempts, max, message);
        if (exhausted) {
            notificationService.notifyRequestEvent(requestId, NotificationService.EVENT_ERROR, errorMessage);
        }
    }
}
