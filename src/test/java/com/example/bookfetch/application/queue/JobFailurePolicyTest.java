package com.example.bookfetch.application.queue;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.bookfetch.application.service.NotificationService;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.exception.ImportRetryableException;
import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.payload.MonitorDownloadPayload;
import com.example.bookfetch.domain.payload.OrganizeFilesPayload;
import com.example.bookfetch.domain.payload.RetryMissingTorrentsPayload;
import com.example.bookfetch.domain.payload.SearchIndexersPayload;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobFailurePolicyTest {

    private JobFailurePolicy policy;
    private RequestMapper requestMapper;
    private DownloadHistoryMapper downloadHistoryMapper;
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        requestMapper = mock(RequestMapper.class);
        downloadHistoryMapper = mock(DownloadHistoryMapper.class);
        notificationService = mock(NotificationService.class);
        PipelineSettings pipelineSettings = mock(PipelineSettings.class);
        when(pipelineSettings.maxImportRetries()).thenReturn(5);
        when(requestMapper.transition(anyLong(), anyList(), anyString(), anyString())).thenReturn(1);
        when(requestMapper.recordImportFailure(anyLong(), anyList(), anyString(), anyInt(), anyString()))
                .thenReturn(1);

        policy = new JobFailurePolicy(requestMapper, downloadHistoryMapper, notificationService, pipelineSettings);
    }

    @Test
    void monitorFailureShouldCloseHistoryAndFailRequest() {
        MonitorDownloadPayload payload = new MonitorDownloadPayload();
        payload.setRequestId(3L);
        payload.setDownloadHistoryId(30L);

        policy.onFinalFailure(JobType.MONITOR_DOWNLOAD, payload,
                new RetryableJobException("Download abc not found in qbit"), 5);

        verify(downloadHistoryMapper).close(eq(30L), eq("failed"),
                startsWith("Download monitoring failed after 5 attempts"));
        verify(requestMapper).transition(eq(3L), eq(RequestStatus.activeValues()), eq("failed"),
                startsWith("Download monitoring failed after 5 attempts"));
        verify(notificationService).notifyRequestEvent(eq(3L), eq(NotificationService.EVENT_ERROR), anyString());
    }

    @Test
    void monitorFailureShouldKeepClientReasonWhenNonRetryable() {
        MonitorDownloadPayload payload = new MonitorDownloadPayload();
        payload.setRequestId(3L);
        payload.setDownloadHistoryId(30L);

        policy.onFinalFailure(JobType.MONITOR_DOWNLOAD, payload,
                new NonRetryableJobException("Download failed: tracker unreachable"), 1);

        verify(requestMapper).transition(eq(3L), anyList(), eq("failed"), eq("Download failed: tracker unreachable"));
    }

    @Test
    void organizeFailureShouldWaitForRetryBelowLimit() {
        when(requestMapper.selectById(4L)).thenReturn(request(4L, 1, 5));

        policy.onFinalFailure(JobType.ORGANIZE_FILES, organize(4L),
                new ImportRetryableException("No audio files were successfully copied"), 2);

        verify(requestMapper).recordImportFailure(eq(4L), anyList(), eq("awaiting_import"), eq(2),
                eq("No audio files were successfully copied. Retry 2/5"));
        verify(notificationService, never()).notifyRequestEvent(anyLong(), anyString(), anyString());
    }

    @Test
    void organizeFailureShouldParkRequestInWarnAtLimit() {
        when(requestMapper.selectById(4L)).thenReturn(request(4L, 4, 5));

        policy.onFinalFailure(JobType.ORGANIZE_FILES, organize(4L),
                new ImportRetryableException("copy failed"), 2);

        verify(requestMapper).recordImportFailure(eq(4L), anyList(), eq("warn"), eq(5),
                eq("copy failed. Max retries (5) exceeded. Manual retry available."));
        verify(notificationService).notifyRequestEvent(eq(4L), eq(NotificationService.EVENT_ERROR), anyString());
    }

    @Test
    void organizeFailureShouldFailRequestWhenNonRetryable() {
        policy.onFinalFailure(JobType.ORGANIZE_FILES, organize(4L),
                new NonRetryableJobException("Invalid path template: bad"), 1);

        verify(requestMapper).transition(eq(4L), anyList(), eq("failed"), eq("Invalid path template: bad"));
        verify(requestMapper, never()).recordImportFailure(anyLong(), anyList(), anyString(), anyInt(), anyString());
    }

    @Test
    void searchFailureShouldReturnRequestToAwaitingSearch() {
        SearchIndexersPayload payload = new SearchIndexersPayload();
        payload.setRequestId(6L);

        policy.onFinalFailure(JobType.SEARCH_INDEXERS, payload, new RetryableJobException("indexer timeout"), 3);

        verify(requestMapper).transition(eq(6L), eq(RequestStatus.valuesOf(
                RequestStatus.PENDING, RequestStatus.SEARCHING, RequestStatus.DOWNLOADING)),
                eq("awaiting_search"), eq("indexer timeout"));
        verifyNoInteractions(notificationService);
    }

    @Test
    void failureWithoutRequestShouldOnlyLog() {
        policy.onFinalFailure(JobType.RETRY_MISSING_TORRENTS, new RetryMissingTorrentsPayload(),
                new IllegalStateException("boom"), 1);

        verifyNoInteractions(requestMapper, downloadHistoryMapper, notificationService);
    }

    private static OrganizeFilesPayload organize(Long requestId) {
        OrganizeFilesPayload payload = new OrganizeFilesPayload();
        payload.setRequestId(requestId);
        payload.setAudiobookId(1L);
        payload.setDownloadPath("/data/downloads/Book");
        return payload;
    }

    private static RequestEntity request(Long id, int importAttempts, int maxImportRetries) {
        RequestEntity request = new RequestEntity();
        request.setId(id);
        request.setStatus("processing");
        request.setImportAttempts(importAttempts);
        request.setMaxImportRetries(maxImportRetries);
        return request;
    }
}
