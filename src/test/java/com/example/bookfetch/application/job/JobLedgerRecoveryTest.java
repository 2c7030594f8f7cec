package com.example.bookfetch.application.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.common.config.AppQueueProperties;
import com.example.bookfetch.infrastructure.persistence.entity.JobEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.JobMapper;
import java.time.LocalDateTime;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobLedgerRecoveryTest {

    private JobLedgerRecovery recovery;
    private JobMapper jobMapper;
    private JobQueueService jobQueueService;

    @BeforeEach
    void setUp() {
        jobMapper = mock(JobMapper.class);
        jobQueueService = mock(JobQueueService.class);
        AppQueueProperties properties = new AppQueueProperties();
        properties.setRecoveryBatchSize(50);
        recovery = new JobLedgerRecovery(jobMapper, jobQueueService, properties);
    }

    @Test
    void recoverShouldMarkInterruptedRowsStuckAndResubmitAll() {
        JobEntity pending = row(1L, "pending");
        JobEntity active = row(2L, "active");
        when(jobMapper.selectRecoverable(any(LocalDateTime.class), eq(50))).thenReturn(Arrays.asList(pending, active));
        when(jobMapper.markStuck(2L)).thenReturn(1);

        int resubmitted = recovery.recover();

        assertEquals(2, resubmitted);
        verify(jobMapper).markStuck(2L);
        verify(jobMapper, never()).markStuck(1L);
        verify(jobQueueService).resubmit(pending);
        verify(jobQueueService).resubmit(active);
    }

    @Test
    void recoverShouldContinuePastUnreadableRow() {
        JobEntity broken = row(1L, "pending");
        JobEntity fine = row(2L, "stuck");
        when(jobMapper.selectRecoverable(any(LocalDateTime.class), eq(50))).thenReturn(Arrays.asList(broken, fine));
        doThrow(new IllegalArgumentException("Unknown job type")).when(jobQueueService).resubmit(broken);

        int resubmitted = recovery.recover();

        assertEquals(1, resubmitted);
        verify(jobQueueService).resubmit(fine);
        verify(jobMapper, never()).markStuck(anyLong());
    }

    private static JobEntity row(Long id, String status) {
        JobEntity row = new JobEntity();
        row.setId(id);
        row.setType("search_indexers");
        row.setStatus(status);
        return row;
    }
}
