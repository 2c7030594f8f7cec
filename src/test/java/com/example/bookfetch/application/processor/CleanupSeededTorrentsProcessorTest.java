package com.example.bookfetch.application.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bookfetch.application.service.DownloadOrchestrator;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.config.AppRequestProperties;
import com.example.bookfetch.domain.model.DownloadSnapshot;
import com.example.bookfetch.domain.payload.CleanupSeededTorrentsPayload;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CleanupSeededTorrentsProcessorTest {

    private CleanupSeededTorrentsProcessor processor;
    private RequestMapper requestMapper;
    private DownloadHistoryMapper downloadHistoryMapper;
    private DownloadOrchestrator downloadOrchestrator;
    private PipelineSettings pipelineSettings;

    @BeforeEach
    void setUp() {
        requestMapper = mock(RequestMapper.class);
        downloadHistoryMapper = mock(DownloadHistoryMapper.class);
        downloadOrchestrator = mock(DownloadOrchestrator.class);
        pipelineSettings = mock(PipelineSettings.class);
        when(pipelineSettings.seedingTimeMinutes("Tracker")).thenReturn(60);
        when(pipelineSettings.seedingTimeMinutes("Forever")).thenReturn(0);

        processor = new CleanupSeededTorrentsProcessor(requestMapper, downloadHistoryMapper, downloadOrchestrator,
                pipelineSettings, new AppRequestProperties());
    }

    @Test
    void processShouldRemoveTransfersThatSeededLongEnough() throws IOException {
        stubRequests(request(1L));
        when(downloadHistoryMapper.selectLatestCompletedByRequestId(1L)).thenReturn(history("Tracker", "h1"));
        when(downloadOrchestrator.poll("qbit", "h1")).thenReturn(seeded(3600L));

        JobResult result = processor.process(new CleanupSeededTorrentsPayload());

        verify(downloadOrchestrator).cancel("qbit", "h1", true);
        assertEquals(1, result.getData().get("cleaned"));
    }

    @Test
    void processShouldKeepTransfersStillSeeding() throws IOException {
        stubRequests(request(1L));
        when(downloadHistoryMapper.selectLatestCompletedByRequestId(1L)).thenReturn(history("Tracker", "h1"));
        when(downloadOrchestrator.poll("qbit", "h1")).thenReturn(seeded(1200L));

        JobResult result = processor.process(new CleanupSeededTorrentsPayload());

        verify(downloadOrchestrator, never()).cancel(anyString(), anyString(), anyBoolean());
        assertEquals(1, result.getData().get("seeding"));
    }

    @Test
    void processShouldNeverRemoveTransfersFromUnlimitedIndexers() throws IOException {
        stubRequests(request(1L));
        when(downloadHistoryMapper.selectLatestCompletedByRequestId(1L)).thenReturn(history("Forever", "h1"));

        JobResult result = processor.process(new CleanupSeededTorrentsPayload());

        verify(downloadOrchestrator, never()).poll(anyString(), anyString());
        assertEquals(1, result.getData().get("unlimited"));
    }

    @Test
    void processShouldContinueAfterClientError() throws IOException {
        stubRequests(request(1L), request(2L));
        when(downloadHistoryMapper.selectLatestCompletedByRequestId(1L)).thenReturn(history("Tracker", "h1"));
        when(downloadHistoryMapper.selectLatestCompletedByRequestId(2L)).thenReturn(history("Tracker", "h2"));
        when(downloadOrchestrator.poll("qbit", "h1")).thenReturn(seeded(7200L));
        when(downloadOrchestrator.poll("qbit", "h2")).thenReturn(seeded(7200L));
        doThrow(new IOException("timeout"))
                .when(downloadOrchestrator).cancel("qbit", "h1", true);

        JobResult result = processor.process(new CleanupSeededTorrentsPayload());

        verify(downloadOrchestrator).cancel(eq("qbit"), eq("h2"), eq(true));
        assertEquals(1, result.getData().get("cleaned"));
        assertEquals(2, result.getData().get("totalChecked"));
    }

    @Test
    void processShouldHandleEmptyBatch() {
        when(requestMapper.selectByStatuses(anyList(), anyInt())).thenReturn(Collections.emptyList());

        JobResult result = processor.process(new CleanupSeededTorrentsPayload());

        assertEquals(0, result.getData().get("totalChecked"));
    }

    private void stubRequests(RequestEntity... requests) {
        when(requestMapper.selectByStatuses(Arrays.asList("available", "downloaded"), 100))
                .thenReturn(Arrays.asList(requests));
    }

    private static RequestEntity request(Long id) {
        RequestEntity request = new RequestEntity();
        request.setId(id);
        return request;
    }

    private static DownloadHistoryEntity history(String indexer, String handle) {
        DownloadHistoryEntity history = new DownloadHistoryEntity();
        history.setIndexerName(indexer);
        history.setDownloadClient("qbit");
        history.setDownloadClientId(handle);
        return history;
    }

    private static DownloadSnapshot seeded(long seconds) {
        DownloadSnapshot snapshot = new DownloadSnapshot();
        snapshot.setSeedingTimeSeconds(seconds);
        return snapshot;
    }
}
