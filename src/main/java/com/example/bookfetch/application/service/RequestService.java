package com.example.bookfetch.application.service;

import com.example.bookfetch.api.request.CreateRequestRequest;
import com.example.bookfetch.api.response.PageResponse;
import com.example.bookfetch.api.response.RequestResponse;
import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.common.config.AppRequestProperties;
import com.example.bookfetch.common.exception.BusinessException;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.DownloadHistoryStatus;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.enumtype.RequestType;
import com.example.bookfetch.domain.model.AudiobookRef;
import com.example.bookfetch.infrastructure.persistence.entity.AudiobookEntity;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.entity.UserEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.AudiobookMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.UserMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * User and admin actions on requests. Pipeline progress itself is driven by the job processors.
 */
@Service
public class RequestService {

    private static final Logger log = LoggerFactory.getLogger(RequestService.class);

    private static final String ROLE_ADMIN = "admin";

    private final RequestMapper requestMapper;
    private final AudiobookMapper audiobookMapper;
    private final UserMapper userMapper;
    private final DownloadHistoryMapper downloadHistoryMapper;
    private final RequestStateMachine requestStateMachine;
    private final JobQueueService jobQueueService;
    private final NotificationService notificationService;
    private final DownloadOrchestrator downloadOrchestrator;
    private final PipelineSettings pipelineSettings;
    private final AppRequestProperties requestProperties;

    public RequestService(RequestMapper requestMapper,
                          AudiobookMapper audiobookMapper,
                          UserMapper userMapper,
                          DownloadHistoryMapper downloadHistoryMapper,
                          RequestStateMachine requestStateMachine,
                          JobQueueService jobQueueService,
                          NotificationService notificationService,
                          DownloadOrchestrator downloadOrchestrator,
                          PipelineSettings pipelineSettings,
                          AppRequestProperties requestProperties) {
        this.requestMapper = requestMapper;
        this.audiobookMapper = audiobookMapper;
        this.userMapper = userMapper;
        this.downloadHistoryMapper = downloadHistoryMapper;
        this.requestStateMachine = requestStateMachine;
        this.jobQueueService = jobQueueService;
        this.notificationService = notificationService;
        this.downloadOrchestrator = downloadOrchestrator;
        this.pipelineSettings = pipelineSettings;
        this.requestProperties = requestProperties;
    }

    public RequestResponse create(CreateRequestRequest request) {
        UserEntity user = userMapper.selectById(request.getUserId());
        if (user == null) {
            throw BusinessException.notFound("User " + request.getUserId() + " not found");
        }
        AudiobookEntity audiobook = findOrCreateAudiobook(request);
        String type = RequestType.AUDIOBOOK.getValue();

        List<RequestEntity> fulfilled = requestMapper.selectForBook(audiobook.getId(), type, null,
                Arrays.asList(RequestStatus.AVAILABLE.getValue(), RequestStatus.COMPLETED.getValue()));
        if (!fulfilled.isEmpty()) {
            throw BusinessException.conflict("This audiobook is already available in your library", null);
        }
        List<RequestEntity> active = requestMapper.selectForBook(audiobook.getId(), type, null,
                RequestStatus.activeValues());
        if (!active.isEmpty()) {
            boolean own = user.getId().equals(active.get(0).getUserId());
            throw BusinessException.conflict(own
                            ? "You have already requested this audiobook"
                            : "This audiobook is already being requested by another user",
                    "Wait for the existing request to finish");
        }
        for (RequestEntity previous : requestMapper.selectForBook(audiobook.getId(), type, user.getId(),
                reRequestEligibleValues())) {
            requestMapper.softDelete(previous.getId());
            log.info("REQUEST_REPLACED requestId={} previousStatus={}", previous.getId(), previous.getStatus());
        }

        RequestStatus initial;
        if (needsApproval(user)) {
            initial = RequestStatus.AWAITING_APPROVAL;
        } else if (request.isSkipAutoSearch()) {
            initial = RequestStatus.AWAITING_SEARCH;
        } else {
            initial = RequestStatus.PENDING;
        }

        RequestEntity entity = new RequestEntity();
        entity.setUserId(user.getId());
        entity.setAudiobookId(audiobook.getId());
        entity.setType(type);
        entity.setStatus(initial.getValue());
        entity.setProgress(0);
        entity.setImportAttempts(0);
        entity.setMaxImportRetries(pipelineSettings.maxImportRetries());
        entity.setSearchAttempts(0);
        requestMapper.insert(entity);
        log.info("REQUEST_CREATED requestId={} userId={} audiobookId={} status={}",
                entity.getId(), user.getId(), audiobook.getId(), initial.getValue());

        notificationService.notifyRequestEvent(entity.getId(),
                initial == RequestStatus.AWAITING_APPROVAL
                        ? NotificationService.EVENT_PENDING_APPROVAL : NotificationService.EVENT_APPROVED,
                null);
        if (initial == RequestStatus.PENDING) {
            jobQueueService.addSearchJob(entity.getId(), refOf(audiobook));
        }
        return toResponse(requestMapper.selectById(entity.getId()), audiobook);
    }

    public RequestResponse get(Long id) {
        RequestEntity entity = load(id);
        return toResponse(entity, audiobookMapper.selectById(entity.getAudiobookId()));
    }

    public PageResponse<RequestResponse> list(String status, int pageNo, int pageSize) {
        String statusValue = TextUtil.isBlank(status) ? null : parseStatus(status).getValue();
        int safePageNo = Math.max(1, pageNo);
        int safePageSize = Math.max(1, Math.min(pageSize, 200));
        long total = requestMapper.countPage(statusValue);
        List<RequestResponse> records = new ArrayList<>();
        for (RequestEntity entity : requestMapper.selectPage(statusValue, safePageSize, (safePageNo - 1) * safePageSize)) {
            records.add(toResponse(entity, audiobookMapper.selectById(entity.getAudiobookId())));
        }
        return new PageResponse<>(records, total, safePageNo, safePageSize);
    }

    public RequestResponse approve(Long id) {
        RequestEntity entity = load(id);
        RequestStateMachine.requireTransition(RequestStatus.fromValue(entity.getStatus()), RequestStatus.PENDING);
        if (!requestStateMachine.transition(id, RequestStatus.PENDING, null)) {
            throw concurrentChange(id);
        }
        AudiobookEntity audiobook = audiobookMapper.selectById(entity.getAudiobookId());
        notificationService.notifyRequestEvent(id, NotificationService.EVENT_APPROVED, null);
        jobQueueService.addSearchJob(id, refOf(audiobook));
        log.info("REQUEST_APPROVED requestId={}", id);
        return toResponse(load(id), audiobook);
    }

    public RequestResponse deny(Long id) {
        RequestEntity entity = load(id);
        RequestStateMachine.requireTransition(RequestStatus.fromValue(entity.getStatus()), RequestStatus.DENIED);
        if (!requestStateMachine.transition(id, RequestStatus.DENIED, null)) {
            throw concurrentChange(id);
        }
        log.info("REQUEST_DENIED requestId={}", id);
        return get(id);
    }

    /**
     * Stops a request in any active status. Waiting jobs are cancelled; a transfer still in
     * progress is removed from its client together with its partial data.
     */
    public RequestResponse cancel(Long id) {
        RequestEntity entity = load(id);
        RequestStateMachine.requireTransition(RequestStatus.fromValue(entity.getStatus()), RequestStatus.CANCELLED);
        if (!requestStateMachine.transition(id, RequestStatus.CANCELLED, null)) {
            throw concurrentChange(id);
        }
        jobQueueService.cancelJobsForRequest(id);
        abortOpenDownload(id);
        log.info("REQUEST_CANCELLED requestId={} previousStatus={}", id, entity.getStatus());
        return get(id);
    }

    public void delete(Long id) {
        RequestEntity entity = load(id);
        if (RequestStatus.fromValue(entity.getStatus()).isActive()) {
            requestStateMachine.transition(id, RequestStatus.CANCELLED, null);
            jobQueueService.cancelJobsForRequest(id);
            abortOpenDownload(id);
        }
        requestMapper.softDelete(id);
        log.info("REQUEST_DELETED requestId={} status={}", id, entity.getStatus());
    }

    /**
     * Manual import retry for a request whose download finished but whose organize step gave up.
     */
    public RequestResponse retryImport(Long id) {
        RequestEntity entity = load(id);
        RequestStatus status = RequestStatus.fromValue(entity.getStatus());
        if (status != RequestStatus.WARN && status != RequestStatus.AWAITING_IMPORT && status != RequestStatus.FAILED) {
            throw BusinessException.badRequest("Import can only be retried for warn, awaiting_import or failed requests");
        }
        DownloadHistoryEntity history = downloadHistoryMapper.selectLatestCompletedByRequestId(id);
        if (history == null || TextUtil.isBlank(history.getDownloadPath())) {
            throw BusinessException.badRequest("Request " + id + " has no completed download to import");
        }
        requestMapper.resetImportAttempts(id);
        if (!requestStateMachine.transition(id, RequestStatus.AWAITING_IMPORT, null)) {
            throw concurrentChange(id);
        }
        jobQueueService.addOrganizeJob(id, entity.getAudiobookId(), history.getDownloadPath());
        log.info("REQUEST_IMPORT_RETRY requestId={} path={}", id, history.getDownloadPath());
        return get(id);
    }

    public RequestResponse reSearch(Long id) {
        RequestEntity entity = load(id);
        RequestStateMachine.requireTransition(RequestStatus.fromValue(entity.getStatus()), RequestStatus.AWAITING_SEARCH);
        if (!requestStateMachine.transition(id, RequestStatus.AWAITING_SEARCH, null)) {
            throw concurrentChange(id);
        }
        AudiobookEntity audiobook = audiobookMapper.selectById(entity.getAudiobookId());
        jobQueueService.addSearchJob(id, refOf(audiobook));
        log.info("REQUEST_RESEARCH requestId={} previousStatus={}", id, entity.getStatus());
        return toResponse(load(id), audiobook);
    }

    private void abortOpenDownload(Long requestId) {
        DownloadHistoryEntity history = downloadHistoryMapper.selectLatestByRequestId(requestId);
        if (history == null || !DownloadHistoryStatus.DOWNLOADING.getValue().equals(history.getDownloadStatus())) {
            return;
        }
        downloadHistoryMapper.close(history.getId(), DownloadHistoryStatus.CANCELLED.getValue(), "Request cancelled");
        if (TextUtil.isBlank(history.getDownloadClientId())) {
            return;
        }
        try {
            downloadOrchestrator.cancel(history.getDownloadClient(), history.getDownloadClientId(), true);
        } catch (IOException | RetryableJobException e) {
            log.warn("DOWNLOAD_REMOVE_FAILED requestId={} handle={} msg={}",
                    requestId, history.getDownloadClientId(), TextUtil.messageOf(e));
        }
    }

    private boolean needsApproval(UserEntity user) {
        if (ROLE_ADMIN.equalsIgnoreCase(user.getRole())) {
            return false;
        }
        if (user.getAutoApproveRequests() != null) {
            return !user.getAutoApproveRequests();
        }
        return requestProperties.isApprovalRequired();
    }

    private AudiobookEntity findOrCreateAudiobook(CreateRequestRequest request) {
        if (!TextUtil.isBlank(request.getAsin())) {
            AudiobookEntity existing = audiobookMapper.selectByAsin(request.getAsin().trim());
            if (existing != null) {
                return existing;
            }
        }
        AudiobookEntity entity = new AudiobookEntity();
        entity.setTitle(request.getTitle().trim());
        entity.setAuthor(request.getAuthor().trim());
        entity.setNarrator(request.getNarrator());
        entity.setAsin(TextUtil.isBlank(request.getAsin()) ? null : request.getAsin().trim());
        entity.setYear(request.getYear());
        entity.setSeries(request.getSeries());
        entity.setSeriesPart(request.getSeriesPart());
        entity.setDurationMinutes(request.getDurationMinutes());
        entity.setCoverArtUrl(request.getCoverArtUrl());
        entity.setStatus("requested");
        audiobookMapper.insert(entity);
        return entity;
    }

    private RequestEntity load(Long id) {
        RequestEntity entity = requestMapper.selectById(id);
        if (entity == null) {
            throw BusinessException.notFound("Request " + id + " not found");
        }
        return entity;
    }

    private static RequestStatus parseStatus(String status) {
        try {
            return RequestStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw BusinessException.badRequest(e.getMessage());
        }
    }

    private static List<String> reRequestEligibleValues() {
        List<String> values = new ArrayList<>();
        for (RequestStatus status : RequestStatus.values()) {
            if (status.isReRequestEligible()) {
                values.add(status.getValue());
            }
        }
        return values;
    }

    private static BusinessException concurrentChange(Long id) {
        return BusinessException.conflict("Request " + id + " changed status concurrently",
                "Refresh the request and try again");
    }

    private static AudiobookRef refOf(AudiobookEntity audiobook) {
        return new AudiobookRef(audiobook.getId(), audiobook.getTitle(), audiobook.getAuthor(), audiobook.getAsin());
    }

    private static RequestResponse toResponse(RequestEntity entity, AudiobookEntity audiobook) {
        return new RequestResponse(
                entity.getId(),
                entity.getUserId(),
                entity.getAudiobookId(),
                audiobook == null ? null : audiobook.getTitle(),
                audiobook == null ? null : audiobook.getAuthor(),
                entity.getType(),
                entity.getStatus(),
                entity.getProgress() == null ? 0 : entity.getProgress(),
                entity.getErrorMessage(),
                entity.getParentRequestId(),
                entity.getImportAttempts() == null ? 0 : entity.getImportAttempts(),
                entity.getMaxImportRetries(),
                entity.getCreatedAt(),
                entity.getCompletedAt());
    }
}
