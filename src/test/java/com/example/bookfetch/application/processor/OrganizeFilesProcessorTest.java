package com.example.bookfetch.application.processor;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OrganizeFilesProcessorTest {

    private static final String TEMPLATE = "{author}/{title}";

    private OrganizeFilesProcessor processor;
    private RequestStateMachine requestStateMachine;
    private RequestMapper requestMapper;
    private AudiobookMapper audiobookMapper;
    private FileOrganizer fileOrganizer;
    private PipelineSettings pipelineSettings;
    private NotificationService notificationService;
    private JobQueueService jobQueueService;

    @BeforeEach
    void setUp() {
        requestStateMachine = mock(RequestStateMachine.class);
        requestMapper = mock(RequestMapper.class);
        audiobookMapper = mock(AudiobookMapper.class);
        fileOrganizer = mock(FileOrganizer.class);
        pipelineSettings = mock(PipelineSettings.class);
        notificationService = mock(NotificationService.class);
        jobQueueService = mock(JobQueueService.class);

        when(requestStateMachine.transitionWithProgress(9L, RequestStatus.PROCESSING, 100)).thenReturn(true);
        when(pipelineSettings.pathTemplate()).thenReturn(TEMPLATE);
        when(audiobookMapper.selectById(4L)).thenReturn(audiobook());
        when(requestMapper.markAvailable(9L)).thenReturn(1);

        processor = new OrganizeFilesProcessor(requestStateMachine, requestMapper, audiobookMapper,
                fileOrganizer, pipelineSettings, notificationService, jobQueueService);
    }

    @Test
    void processShouldMarkAvailableAndNotifyOnSuccess() {
        when(fileOrganizer.organize(eq("/data/downloads/Book"), any(BookMetadata.class), eq(TEMPLATE)))
                .thenReturn(success("/media/Andy Weir/Project Hail Mary"));

        JobResult result = processor.process(payload());

        assertTrue(result.isSuccess());
        verify(audiobookMapper).updateFilePath(4L, "/media/Andy Weir/Project Hail Mary", "available");
        verify(requestMapper).markAvailable(9L);
        verify(notificationService).notifyRequestEvent(eq(9L), eq(NotificationService.EVENT_AVAILABLE), anyString());
        verify(jobQueueService, never()).addScanLibraryJob(anyString());
    }

    @Test
    void processShouldQueueLibraryScanWhenEnabled() {
        when(fileOrganizer.organize(anyString(), any(BookMetadata.class), anyString()))
                .thenReturn(success("/media/Andy Weir/Project Hail Mary"));
        when(pipelineSettings.libraryScanAfterImport()).thenReturn(true);
        when(pipelineSettings.libraryId()).thenReturn(Optional.of("lib-1"));

        processor.process(payload());

        verify(jobQueueService).addScanLibraryJob("lib-1");
    }

    @Test
    void processShouldSkipLibraryScanWithoutLibraryId() {
        when(fileOrganizer.organize(anyString(), any(BookMetadata.class), anyString()))
                .thenReturn(success("/media/Andy Weir/Project Hail Mary"));
        when(pipelineSettings.libraryScanAfterImport()).thenReturn(true);
        when(pipelineSettings.libraryId()).thenReturn(Optional.empty());

        JobResult result = processor.process(payload());

        assertTrue(result.isSuccess());
        verify(jobQueueService, never()).addScanLibraryJob(anyString());
    }

    @Test
    void processShouldEndAsNoOpWhenRequestLeavesProcessingDuringOrganize() {
        when(fileOrganizer.organize(anyString(), any(BookMetadata.class), anyString()))
                .thenReturn(success("/media/Andy Weir/Project Hail Mary"));
        when(requestMapper.markAvailable(9L)).thenReturn(0);
        when(requestMapper.selectStatusById(9L)).thenReturn("cancelled");
        when(pipelineSettings.libraryScanAfterImport()).thenReturn(true);
        when(pipelineSettings.libraryId()).thenReturn(Optional.of("lib-1"));

        JobResult result = processor.process(payload());

        assertFalse(result.isSuccess());
        verify(notificationService, never()).notifyRequestEvent(anyLong(), anyString(), anyString());
        verify(jobQueueService, never()).addScanLibraryJob(anyString());
    }

    @Test
    void processShouldRaiseImportRetryableOnOrganizeFailure() {
        OrganizeResult failed = new OrganizeResult();
        failed.getErrors().add("No audio files were successfully copied");
        when(fileOrganizer.organize(anyString(), any(BookMetadata.class), anyString())).thenReturn(failed);
        OrganizeFilesPayload payload = payload();

        ImportRetryableException error = assertThrows(ImportRetryableException.class,
                () -> processor.process(payload));
        assertTrue(error.getMessage().contains("No audio files were successfully copied"));
        verify(requestMapper, never()).markAvailable(9L);
    }

    @Test
    void processShouldFailPermanentlyOnInvalidTemplate() {
        when(fileOrganizer.organize(anyString(), any(BookMetadata.class), anyString()))
                .thenThrow(new IllegalArgumentException("Invalid path template: bad"));
        OrganizeFilesPayload payload = payload();

        assertThrows(NonRetryableJobException.class, () -> processor.process(payload));
    }

    @Test
    void processShouldFailPermanentlyWhenAudiobookIsGone() {
        when(audiobookMapper.selectById(4L)).thenReturn(null);
        OrganizeFilesPayload payload = payload();

        assertThrows(NonRetryableJobException.class, () -> processor.process(payload));
    }

    @Test
    void processShouldSkipWhenRequestIsNotAwaitingImport() {
        when(requestStateMachine.transitionWithProgress(9L, RequestStatus.PROCESSING, 100)).thenReturn(false);

        JobResult result = processor.process(payload());

        assertFalse(result.isSuccess());
        verify(fileOrganizer, never()).organize(anyString(), any(BookMetadata.class), anyString());
    }

    private static OrganizeFilesPayload payload() {
        OrganizeFilesPayload payload = new OrganizeFilesPayload();
        payload.setRequestId(9L);
        payload.setAudiobookId(4L);
        payload.setDownloadPath("/data/downloads/Book");
        return payload;
    }

    private static AudiobookEntity audiobook() {
        AudiobookEntity audiobook = new AudiobookEntity();
        audiobook.setId(4L);
        audiobook.setTitle("Project Hail Mary");
        audiobook.setAuthor("Andy Weir");
        return audiobook;
    }

    private static OrganizeResult success(String target) {
        OrganizeResult result = new OrganizeResult();
        result.setSuccess(true);
        result.setTargetPath(target);
        result.setFilesMovedCount(2);
        return result;
    }
}
