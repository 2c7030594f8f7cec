package com.example.bookfetch.application.job;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.common.config.AppQueueProperties;
import com.example.bookfetch.domain.enumtype.JobStatus;
import com.example.bookfetch.infrastructure.persistence.entity.JobEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.JobMapper;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Resubmits ledger rows the previous process left behind. Rows that were active when it died
 * are marked stuck first so the ledger shows the interruption.
 */
@Component
@Order(1)
public class JobLedgerRecovery implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(JobLedgerRecovery.class);

    private final JobMapper jobMapper;
    private final JobQueueService jobQueueService;
    private final AppQueueProperties queueProperties;

    public JobLedgerRecovery(JobMapper jobMapper,
                             JobQueueService jobQueueService,
                             AppQueueProperties queueProperties) {
        this.jobMapper = jobMapper;
        this.jobQueueService = jobQueueService;
        this.queueProperties = queueProperties;
    }

    @Override
    public void run(String... args) {
        recover();
    }

    public int recover() {
        LocalDateTime since = LocalDateTime.now().minusHours(queueProperties.getRecoveryWindowHours());
        List<JobEntity> rows = jobMapper.selectRecoverable(since, queueProperties.getRecoveryBatchSize());
        int resubmitted = 0;
        int stuck = 0;
        for (JobEntity row : rows) {
            if (JobStatus.ACTIVE.getValue().equals(row.getStatus())) {
                if (jobMapper.markStuck(row.getId()) > 0) {
                    stuck++;
                }
            }
            try {
                jobQueueService.resubmit(row);
                resubmitted++;
            } catch (RuntimeException e) {
                log.warn("JOB_RECOVERY_FAILED jobId={} type={}", row.getId(), row.getType(), e);
            }
        }
        log.info("JOB_LEDGER_RECOVERED candidates={} markedStuck={} resubmitted={} since={}",
                rows.size(), stuck, resubmitted, since);
        return resubmitted;
    }
}
