package com.example.bookfetch.application.queue;

import static com.example.bookfetch.common.util.TextUtil.truncate;

import com.example.bookfetch.common.config.AppMonitorProperties;
import com.example.bookfetch.common.config.AppQueueProperties;
import com.example.bookfetch.common.exception.BusinessException;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.JobStatus;
import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.model.AudiobookRef;
import com.example.bookfetch.domain.model.TorrentCandidate;
import com.example.bookfetch.domain.payload.DownloadTorrentPayload;
import com.example.bookfetch.domain.payload.JobPayload;
import com.example.bookfetch.domain.payload.MonitorDownloadPayload;
import com.example.bookfetch.domain.payload.OrganizeFilesPayload;
import com.example.bookfetch.domain.payload.ScanLibraryPayload;
import com.example.bookfetch.domain.payload.SearchIndexersPayload;
import com.example.bookfetch.domain.payload.SendNotificationPayload;
import com.example.bookfetch.infrastructure.persistence.entity.JobEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.JobMapper;
import com.example.bookfetch.infrastructure.persistence.model.JobStatusCountRow;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Front door of the job queue. Every job gets its ledger row before the broker sees it, and the
 * row id travels inside the payload.
 */
@Service
public class JobQueueService {

    private static final Logger log = LoggerFactory.getLogger(JobQueueService.class);

    private final JobBroker jobBroker;
    private final JobMapper jobMapper;
    private final JobPayloadCodec payloadCodec;
    private final AppQueueProperties queueProperties;
    private final AppMonitorProperties monitorProperties;
    private final MeterRegistry meterRegistry;

    public JobQueueService(JobBroker jobBroker,
                           JobMapper jobMapper,
                           JobPayloadCodec payloadCodec,
                           AppQueueProperties queueProperties,
                           AppMonitorProperties monitorProperties,
                           ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.jobBroker = jobBroker;
        this.jobMapper = jobMapper;
        this.payloadCodec = payloadCodec;
        this.queueProperties = queueProperties;
        this.monitorProperties = monitorProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public void registerProcessor(JobType type, int concurrency, JobHandler handler) {
        jobBroker.registerWorker(type, concurrency, handler);
    }

    public Long enqueue(JobPayload payload, JobOptions options) {
        JobOptions effective = options == null ? JobOptions.defaults() : options;
        JobType type = payload.jobType();
        int priority = priorityOf(type, effective);
        int attempts = attemptsOf(type, effective);

        Long jobId = createLedgerRow(payload, priority, attempts);
        payload.setJobId(jobId);
        submitToBroker(jobId, type, payload, priority, attempts, effective.getDelayMs());
        log.info("JOB_ENQUEUED jobId={} type={} requestId={} priority={} attempts={} delayMs={}",
                jobId, type.getCode(), payload.requestId(), priority, attempts, effective.getDelayMs());
        recordCounter("bookfetch.job.event", "type", type.getCode(), "event", "enqueued");
        return jobId;
    }

    public Long addSearchJob(Long requestId, AudiobookRef audiobook) {
        SearchIndexersPayload payload = new SearchIndexersPayload();
        payload.setRequestId(requestId);
        payload.setAudiobook(audiobook);
        return enqueue(payload, JobOptions.defaults());
    }

    public Long addDownloadJob(Long requestId, AudiobookRef audiobook, TorrentCandidate torrent) {
        DownloadTorrentPayload payload = new DownloadTorrentPayload();
        payload.setRequestId(requestId);
        payload.setAudiobook(audiobook);
        payload.setTorrent(torrent);
        return enqueue(payload, JobOptions.defaults());
    }

    public Long addMonitorJob(MonitorDownloadPayload payload, long delayMs) {
        return enqueue(payload, JobOptions.delayed(delayMs));
    }

    public Long addOrganizeJob(Long requestId, Long audiobookId, String downloadPath) {
        OrganizeFilesPayload payload = new OrganizeFilesPayload();
        payload.setRequestId(requestId);
        payload.setAudiobookId(audiobookId);
        payload.setDownloadPath(downloadPath);
        return enqueue(payload, JobOptions.defaults());
    }

    public Long addScanLibraryJob(String libraryId) {
        ScanLibraryPayload payload = new ScanLibraryPayload();
        payload.setLibraryId(libraryId);
        return enqueue(payload, JobOptions.defaults());
    }

    public Long addNotificationJob(SendNotificationPayload payload) {
        return enqueue(payload, JobOptions.defaults());
    }

    /**
     * Inserts the pending ledger row for a payload without submitting it.
     */
    public Long createLedgerRow(JobPayload payload, int priority, int maxAttempts) {
        JobEntity entity = new JobEntity();
        entity.setRequestId(payload.requestId());
        entity.setType(payload.jobType().getCode());
        entity.setStatus(JobStatus.PENDING.getValue());
        entity.setPriority(priority);
        entity.setAttempts(0);
        entity.setMaxAttempts(maxAttempts);
        entity.setPayload(payloadCodec.encode(payload));
        jobMapper.insert(entity);
        return entity.getId();
    }

    /**
     * Returns the ledger id of a broker job, creating the row for timer-fired jobs that were
     * submitted by a cron registration without one.
     */
    public Long ensureJobRecord(BrokerJob job) {
        JobPayload payload = job.getPayload();
        if (payload.getJobId() != null) {
            return payload.getJobId();
        }
        Long jobId = createLedgerRow(payload, job.getPriority(), job.getMaxAttempts());
        payload.setJobId(jobId);
        jobMapper.updateBrokerJobId(jobId, job.getBrokerJobId());
        log.info("JOB_RECORD_CREATED jobId={} type={} brokerJobId={} repeatKey={}",
                jobId, job.getType().getCode(), job.getBrokerJobId(), job.getRepeatKey());
        return jobId;
    }

    /**
     * Submits an existing ledger row to the broker again, keeping its id.
     */
    public void resubmit(JobEntity row) {
        JobType type = JobType.fromCode(row.getType());
        JobPayload payload = payloadCodec.decode(type, row.getPayload());
        payload.setJobId(row.getId());
        int priority = row.getPriority() == null ? type.getDefaultPriority() : row.getPriority();
        int attempts = row.getMaxAttempts() == null ? queueProperties.getDefaultAttempts() : row.getMaxAttempts();
        submitToBroker(row.getId(), type, payload, priority, attempts, 0L);
        log.info("JOB_RESUBMITTED jobId={} type={} requestId={}", row.getId(), type.getCode(), row.getRequestId());
    }

    public JobEntity retryJob(Long jobId) {
        JobEntity row = getJob(jobId);
        if (jobMapper.resetForRetry(jobId) == 0) {
            throw new BusinessException("400", "Job " + jobId + " cannot be retried in status " + row.getStatus(),
                    "Only failed, stuck or cancelled jobs can be retried");
        }
        resubmit(row);
        return jobMapper.selectById(jobId);
    }

    public boolean cancelJob(Long jobId) {
        JobEntity row = getJob(jobId);
        if (jobMapper.cancel(jobId) == 0) {
            log.info("JOB_CANCEL_IGNORED jobId={} currentStatus={}", jobId, row.getStatus());
            return false;
        }
        jobBroker.remove(row.getBrokerJobId());
        log.info("JOB_CANCELLED jobId={} type={} requestId={}", jobId, row.getType(), row.getRequestId());
        recordCounter("bookfetch.job.event", "type", row.getType(), "event", "cancelled");
        return true;
    }

    /**
     * Cancels every waiting job of a request. Running handlers see the request status and stop.
     */
    public int cancelJobsForRequest(Long requestId) {
        int cancelled = 0;
        for (JobEntity row : jobMapper.selectCancellableByRequestId(requestId)) {
            if (jobMapper.cancel(row.getId()) > 0) {
                jobBroker.remove(row.getBrokerJobId());
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("REQUEST_JOBS_CANCELLED requestId={} count={}", requestId, cancelled);
        }
        return cancelled;
    }

    public JobEntity getJob(Long jobId) {
        JobEntity row = jobMapper.selectById(jobId);
        if (row == null) {
            throw BusinessException.notFound("Job " + jobId + " not found");
        }
        return row;
    }

    public List<JobEntity> listJobsForRequest(Long requestId) {
        return jobMapper.selectByRequestId(requestId);
    }

    public List<JobEntity> listJobsByStatus(String status, int limit) {
        return jobMapper.selectByStatus(status, Math.max(1, Math.min(limit, 500)));
    }

    public JobQueueStats stats() {
        JobQueueStats stats = new JobQueueStats();
        for (JobStatus status : JobStatus.values()) {
            stats.getByStatus().put(status.getValue(), 0L);
        }
        for (JobStatusCountRow row : jobMapper.countByStatus()) {
            stats.getByStatus().put(row.getStatus(), row.getTotal() == null ? 0L : row.getTotal());
        }
        for (JobType type : JobType.values()) {
            stats.getWaiting().put(type.getCode(), jobBroker.waitingCount(type));
            stats.getActive().put(type.getCode(), jobBroker.activeCount(type));
        }
        return stats;
    }

    /**
     * Registers a cron-fired job. A registration under the same key is replaced, never stacked.
     */
    public void addRepeatableJob(String key, String cron, JobType type, Supplier<? extends JobPayload> payloadFactory) {
        JobOptions defaults = JobOptions.defaults();
        jobBroker.addRepeatable(key, cron, type, payloadFactory, priorityOf(type, defaults), attemptsOf(type, defaults));
    }

    public boolean removeRepeatableJob(String key) {
        return jobBroker.removeRepeatable(key);
    }

    private void submitToBroker(Long jobId, JobType type, JobPayload payload, int priority, int attempts,
                                long delayMs) {
        String brokerJobId;
        try {
            brokerJobId = jobBroker.submit(type, payload, priority, attempts, delayMs);
        } catch (RuntimeException e) {
            jobMapper.markFailed(jobId, 0, truncate("Broker rejected job: " + TextUtil.messageOf(e), 1000),
                    truncate(TextUtil.stackTraceOf(e), 4000));
            log.warn("JOB_SUBMIT_FAILED jobId={} type={}", jobId, type.getCode(), e);
            throw new RetryableJobException("Job queue unavailable: " + TextUtil.messageOf(e), e);
        }
        jobMapper.updateBrokerJobId(jobId, brokerJobId);
    }

    int priorityOf(JobType type, JobOptions options) {
        return options.getPriority() != null ? options.getPriority() : type.getDefaultPriority();
    }

    int attemptsOf(JobType type, JobOptions options) {
        if (options.getAttempts() != null && options.getAttempts() > 0) {
            return options.getAttempts();
        }
        if (type == JobType.MONITOR_DOWNLOAD) {
            return Math.max(1, monitorProperties.getAttempts());
        }
        return Math.max(1, queueProperties.getDefaultAttempts());
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Job metric counter failed, name={}", name, ex);
        }
    }
}
