package com.example.bookfetch.application.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.DownloadOrchestrator;
import com.example.bookfetch.application.service.RequestStateMachine;
import com.example.bookfetch.common.config.AppMonitorProperties;
import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.domain.model.TorrentCandidate;
import com.example.bookfetch.domain.payload.DownloadTorrentPayload;
import com.example.bookfetch.domain.payload.MonitorDownloadPayload;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class DownloadTorrentProcessorTest {

    private DownloadTorrentProcessor processor;
    private RequestStateMachine requestStateMachine;
    private DownloadOrchestrator downloadOrchestrator;
    private JobQueueService jobQueueService;
    private TorrentCandidate torrent;

    @BeforeEach
    void setUp() {
        requestStateMachine = mock(RequestStateMachine.class);
        downloadOrchestrator = mock(DownloadOrchestrator.class);
        jobQueueService = mock(JobQueueService.class);

        AppMonitorProperties monitorProperties = new AppMonitorProperties();
        monitorProperties.setInitialDelaySeconds(3);
        processor = new DownloadTorrentProcessor(
                requestStateMachine, downloadOrchestrator, jobQueueService, monitorProperties);

        torrent = new TorrentCandidate();
        torrent.setTitle("Andy Weir - Project Hail Mary [M4B]");
        torrent.setSize(900L * 1024L * 1024L);
    }

    @Test
    void processShouldStartTransferAndScheduleFirstMonitorPoll() {
        when(requestStateMachine.transitionWithProgress(5L, RequestStatus.DOWNLOADING, 0)).thenReturn(true);
        DownloadHistoryEntity history = new DownloadHistoryEntity();
        history.setId(21L);
        history.setDownloadClient("qbit");
        history.setDownloadClientId("hash-1");
        when(downloadOrchestrator.startDownload(5L, torrent, null)).thenReturn(history);

        JobResult result = processor.process(payload());

        assertTrue(result.isSuccess());
        ArgumentCaptor<MonitorDownloadPayload> monitor = ArgumentCaptor.forClass(MonitorDownloadPayload.class);
        verify(jobQueueService).addMonitorJob(monitor.capture(), eq(3000L));
        assertEquals(5L, monitor.getValue().getRequestId());
        assertEquals(21L, monitor.getValue().getDownloadHistoryId());
        assertEquals("hash-1", monitor.getValue().getDownloadClientId());
        assertEquals("qbit", monitor.getValue().getDownloadClient());
        assertEquals(0, monitor.getValue().getStallCount());
        assertNotNull(monitor.getValue().getMonitorStartedAt());
    }

    @Test
    void processShouldSkipWhenRequestNoLongerAwaitsDownload() {
        when(requestStateMachine.transitionWithProgress(5L, RequestStatus.DOWNLOADING, 0)).thenReturn(false);

        JobResult result = processor.process(payload());

        assertFalse(result.isSuccess());
        verify(downloadOrchestrator, never()).startDownload(any(), any(), any());
        verify(jobQueueService, never()).addMonitorJob(any(MonitorDownloadPayload.class), anyLong());
    }

    @Test
    void processShouldPropagateClientRefusal() {
        when(requestStateMachine.transitionWithProgress(5L, RequestStatus.DOWNLOADING, 0)).thenReturn(true);
        when(downloadOrchestrator.startDownload(5L, torrent, null))
                .thenThrow(new NonRetryableJobException("Failed to add download: rejected"));
        DownloadTorrentPayload payload = payload();

        assertThrows(NonRetryableJobException.class, () -> processor.process(payload));
        verify(jobQueueService, never()).addMonitorJob(any(MonitorDownloadPayload.class), anyLong());
    }

    private DownloadTorrentPayload payload() {
        DownloadTorrentPayload payload = new DownloadTorrentPayload();
        payload.setRequestId(5L);
        payload.setTorrent(torrent);
        return payload;
    }
}
