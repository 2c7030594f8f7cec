package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.organize.FileOrganizer;
import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.NotificationService;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.application.service.RequestStateMachine;
import com.example.bookfetch.common.exception.ImportRetryableException;
import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.BookMetadata;
import com.example.bookfetch.domain.model.OrganizeResult;
import com.example.bookfetch.domain.payload.OrganizeFilesPayload;
import com.example.bookfetch.infrastructure.persistence.entity.AudiobookEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.AudiobookMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Places a finished download into the media library and marks the request available.
 * Failures feed the import retry accounting instead of failing the request outright.
 */
@Component
public class OrganizeFilesProcessor implements JobProcessor<OrganizeFilesPayload> {

    private static final Logger log = LoggerFactory.getLogger(OrganizeFilesProcessor.class);

    private final RequestStateMachine requestStateMachine;
    private final RequestMapper requestMapper;
    private final AudiobookMapper audiobookMapper;
    private final FileOrganizer fileOrganizer;
    private final PipelineSettings pipelineSettings;
    private final NotificationService notificationService;
    private final JobQueueService jobQueueService;

    public OrganizeFilesProcessor(RequestStateMachine requestStateMachine,
                                  RequestMapper requestMapper,
                                  AudiobookMapper audiobookMapper,
                                  FileOrganizer fileOrganizer,
                                  PipelineSettings pipelineSettings,
                                  NotificationService notificationService,
                                  JobQueueService jobQueueService) {
        this.requestStateMachine = requestStateMachine;
        this.requestMapper = requestMapper;
        this.audiobookMapper = audiobookMapper;
        this.fileOrganizer = fileOrganizer;
        this.pipelineSettings = pipelineSettings;
        this.notificationService = notificationService;
        this.jobQueueService = jobQueueService;
    }

    @Override
    public JobResult process(OrganizeFilesPayload payload) {
        Long requestId = payload.getRequestId();
        if (!requestStateMachine.transitionWithProgress(requestId, RequestStatus.PROCESSING, 100)) {
            log.info("ORGANIZE_SKIPPED requestId={} currentStatus={}",
                    requestId, requestMapper.selectStatusById(requestId));
            return JobResult.skipped("Request " + requestId + " is not ready for import");
        }

        AudiobookEntity audiobook = audiobookMapper.selectById(payload.getAudiobookId());
        if (audiobook == null) {
            throw new NonRetryableJobException("Audiobook " + payload.getAudiobookId() + " not found");
        }

        OrganizeResult result;
        try {
            result = fileOrganizer.organize(payload.getDownloadPath(), toMetadata(audiobook),
                    pipelineSettings.pathTemplate());
        } catch (IllegalArgumentException e) {
            throw new NonRetryableJobException(e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            String message = result.getErrors().isEmpty()
                    ? "Organize failed" : String.join("; ", result.getErrors());
            throw new ImportRetryableException(message);
        }

        audiobookMapper.updateFilePath(audiobook.getId(), result.getTargetPath(), "available");
        if (requestMapper.markAvailable(requestId) == 0) {
            String currentStatus = requestMapper.selectStatusById(requestId);
            log.warn("ORGANIZE_AVAILABLE_REJECTED requestId={} currentStatus={}", requestId, currentStatus);
            return JobResult.skipped("Request " + requestId + " left processing during organize")
                    .with("targetPath", result.getTargetPath())
                    .with("currentStatus", currentStatus);
        }
        log.info("ORGANIZE_COMPLETED requestId={} target={} files={} alreadyPresent={} errors={}",
                requestId, result.getTargetPath(), result.getFilesMovedCount(),
                result.getAlreadyPresentCount(), result.getErrors().size());
        notificationService.notifyRequestEvent(requestId, NotificationService.EVENT_AVAILABLE,
                audiobook.getTitle() + " is now available");

        if (pipelineSettings.libraryScanAfterImport()) {
            Optional<String> libraryId = pipelineSettings.libraryId();
            if (libraryId.isPresent()) {
                jobQueueService.addScanLibraryJob(libraryId.get());
            } else {
                log.warn("LIBRARY_SCAN_SKIPPED requestId={} reason=no_library_id", requestId);
            }
        }

        return JobResult.success("Organized " + result.getFilesMovedCount() + " files")
                .with("targetPath", result.getTargetPath())
                .with("filesMoved", result.getFilesMovedCount())
                .with("errors", result.getErrors())
                .with("notes", result.getNotes());
    }

    private static BookMetadata toMetadata(AudiobookEntity audiobook) {
        BookMetadata metadata = new BookMetadata();
        metadata.setTitle(audiobook.getTitle());
        metadata.setAuthor(audiobook.getAuthor());
        metadata.setNarrator(audiobook.getNarrator());
        metadata.setAsin(audiobook.getAsin());
        metadata.setYear(audiobook.getYear());
        metadata.setSeries(audiobook.getSeries());
        metadata.setSeriesPart(audiobook.getSeriesPart());
        metadata.setDurationMinutes(audiobook.getDurationMinutes());
        metadata.setCoverArtUrl(audiobook.getCoverArtUrl());
        metadata.setCachedCoverPath(audiobook.getCachedCoverPath());
        return metadata;
    }
}
