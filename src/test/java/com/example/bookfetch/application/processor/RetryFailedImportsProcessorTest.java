package com.example.bookfetch.application.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.DownloadOrchestrator;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.config.AppRequestProperties;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.DownloadSnapshot;
import com.example.bookfetch.domain.payload.RetryFailedImportsPayload;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryFailedImportsProcessorTest {

    private RetryFailedImportsProcessor processor;
    private RequestMapper requestMapper;
    private DownloadHistoryMapper downloadHistoryMapper;
    private DownloadOrchestrator downloadOrchestrator;
    private JobQueueService jobQueueService;

    @BeforeEach
    void setUp() {
        requestMapper = mock(RequestMapper.class);
        downloadHistoryMapper = mock(DownloadHistoryMapper.class);
        downloadOrchestrator = mock(DownloadOrchestrator.class);
        jobQueueService = mock(JobQueueService.class);
        PipelineSettings pipelineSettings = mock(PipelineSettings.class);
        when(pipelineSettings.downloadDir()).thenReturn("/downloads");

        processor = new RetryFailedImportsProcessor(requestMapper, downloadHistoryMapper, downloadOrchestrator,
                jobQueueService, pipelineSettings, new AppRequestProperties());
    }

    @Test
    void processShouldQueueOrganizeForEveryRequestWithAKnownPath() {
        when(requestMapper.selectByStatus(RequestStatus.AWAITING_IMPORT.getValue(), 50))
                .thenReturn(Arrays.asList(request(1L, 10L), request(2L, 20L)));
        when(downloadHistoryMapper.selectLatestByRequestId(1L)).thenReturn(history("/data/one", null, null));
        when(downloadHistoryMapper.selectLatestByRequestId(2L)).thenReturn(null);

        JobResult result = processor.process(new RetryFailedImportsPayload());

        verify(jobQueueService).addOrganizeJob(1L, 10L, "/data/one");
        verify(jobQueueService, never()).addOrganizeJob(2L, 20L, null);
        assertEquals(1, result.getData().get("triggered"));
        assertEquals(1, result.getData().get("skipped"));
    }

    @Test
    void processShouldReportNothingToDoOnEmptyBatch() {
        when(requestMapper.selectByStatus(RequestStatus.AWAITING_IMPORT.getValue(), 50))
                .thenReturn(Collections.emptyList());

        JobResult result = processor.process(new RetryFailedImportsPayload());

        assertEquals(0, result.getData().get("triggered"));
        verify(jobQueueService, never()).addOrganizeJob(anyLong(), anyLong(), anyString());
    }

    @Test
    void resolveDownloadPathShouldAskClientWhenHistoryHasNoPath() {
        DownloadSnapshot snapshot = new DownloadSnapshot();
        snapshot.setLocalPath("/data/from-client");
        when(downloadOrchestrator.poll("qbit", "hash")).thenReturn(snapshot);

        assertEquals("/data/from-client", processor.resolveDownloadPath(history(null, "hash", "Book")));
    }

    @Test
    void resolveDownloadPathShouldFallBackToDownloadDirWhenClientIsUnreachable() {
        when(downloadOrchestrator.poll("qbit", "hash")).thenThrow(new RetryableJobException("down"));

        assertEquals(Paths.get("/downloads", "Book").toString(),
                processor.resolveDownloadPath(history(null, "hash", "Book")));
    }

    @Test
    void resolveDownloadPathShouldGiveUpWithoutAnyHint() {
        assertNull(processor.resolveDownloadPath(history(null, null, null)));
    }

    private static RequestEntity request(Long id, Long audiobookId) {
        RequestEntity request = new RequestEntity();
        request.setId(id);
        request.setAudiobookId(audiobookId);
        request.setStatus(RequestStatus.AWAITING_IMPORT.getValue());
        return request;
    }

    private static DownloadHistoryEntity history(String path, String handle, String torrentName) {
        DownloadHistoryEntity history = new DownloadHistoryEntity();
        history.setId(99L);
        history.setDownloadPath(path);
        history.setDownloadClient("qbit");
        history.setDownloadClientId(handle);
        history.setTorrentName(torrentName);
        return history;
    }
}
