package com.example.bookfetch.application.queue;

import static com.example.bookfetch.common.util.TextUtil.truncate;

import com.example.bookfetch.application.service.CronSupport;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.payload.JobPayload;
import com.example.bookfetch.domain.payload.ScheduledPayload;
import com.example.bookfetch.infrastructure.persistence.entity.ScheduledJobEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.JobMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.ScheduledJobMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Mirrors broker events into the job ledger, one guarded single-row update per event, and hands
 * final failures to {@link JobFailurePolicy}.
 */
@Component
public class JobLedgerListener implements JobLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(JobLedgerListener.class);

    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int MAX_STACK_LENGTH = 4000;

    private final JobBroker jobBroker;
    private final JobQueueService jobQueueService;
    private final JobMapper jobMapper;
    private final ScheduledJobMapper scheduledJobMapper;
    private final JobPayloadCodec payloadCodec;
    private final JobFailurePolicy failurePolicy;
    private final MeterRegistry meterRegistry;
    private final Map<String, Long> startedNanos = new ConcurrentHashMap<>();

    public JobLedgerListener(JobBroker jobBroker,
                             JobQueueService jobQueueService,
                             JobMapper jobMapper,
                             ScheduledJobMapper scheduledJobMapper,
                             JobPayloadCodec payloadCodec,
                             JobFailurePolicy failurePolicy,
                             ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.jobBroker = jobBroker;
        this.jobQueueService = jobQueueService;
        this.jobMapper = jobMapper;
        this.scheduledJobMapper = scheduledJobMapper;
        this.payloadCodec = payloadCodec;
        this.failurePolicy = failurePolicy;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    @PostConstruct
    public void attach() {
        jobBroker.setLifecycleListener(this);
    }

    @Override
    public void onActive(BrokerJob job) {
        boolean timerFired = job.getPayload().getJobId() == null;
        Long jobId = jobQueueService.ensureJobRecord(job);
        startedNanos.put(job.getBrokerJobId(), System.nanoTime());
        if (jobMapper.markActive(jobId, job.getAttemptsMade()) == 0) {
            log.info("JOB_ACTIVE_IGNORED jobId={} type={} (ledger row no longer pending)",
                    jobId, job.getType().getCode());
        } else {
            log.info("JOB_ACTIVE jobId={} type={} attempt={}/{}",
                    jobId, job.getType().getCode(), job.getAttemptsMade(), job.getMaxAttempts());
        }
        if (timerFired) {
            stampScheduledRun(job.getPayload());
        }
        recordCounter("bookfetch.job.event", "type", job.getType().getCode(), "event", "active");
    }

    @Override
    public void onCompleted(BrokerJob job, Object result) {
        Long jobId = job.getPayload().getJobId();
        jobMapper.markCompleted(jobId, payloadCodec.write(result));
        long elapsed = elapsedNanos(job);
        log.info("JOB_COMPLETED jobId={} type={} attempt={} elapsedMs={}",
                jobId, job.getType().getCode(), job.getAttemptsMade(), TimeUnit.NANOSECONDS.toMillis(elapsed));
        recordCounter("bookfetch.job.event", "type", job.getType().getCode(), "event", "completed");
        recordDuration("bookfetch.job.duration", elapsed, "type", job.getType().getCode(), "outcome", "completed");
    }

    @Override
    public void onFailed(BrokerJob job, Throwable error, boolean finalAttempt) {
        Long jobId = job.getPayload().getJobId();
        String message = truncate(TextUtil.messageOf(error), MAX_ERROR_LENGTH);
        String stackTrace = truncate(TextUtil.stackTraceOf(error), MAX_STACK_LENGTH);
        long elapsed = elapsedNanos(job);
        recordDuration("bookfetch.job.duration", elapsed, "type", job.getType().getCode(), "outcome", "failed");
        if (!finalAttempt) {
            jobMapper.markRetrying(jobId, job.getAttemptsMade(), message, stackTrace);
            log.warn("JOB_ATTEMPT_FAILED jobId={} type={} attempt={}/{} error={}",
                    jobId, job.getType().getCode(), job.getAttemptsMade(), job.getMaxAttempts(), message);
            recordCounter("bookfetch.job.event", "type", job.getType().getCode(), "event", "retrying");
            return;
        }
        jobMapper.markFailed(jobId, job.getAttemptsMade(), message, stackTrace);
        log.warn("JOB_FAILED jobId={} type={} attempt={}/{} error={}",
                jobId, job.getType().getCode(), job.getAttemptsMade(), job.getMaxAttempts(), message);
        recordCounter("bookfetch.job.event", "type", job.getType().getCode(), "event", "failed");
        failurePolicy.onFinalFailure(job.getType(), job.getPayload(), error, job.getAttemptsMade());
    }

    @Override
    public void onStalled(BrokerJob job) {
        Long jobId = job.getPayload().getJobId();
        if (jobId != null && jobMapper.markStuck(jobId) > 0) {
            log.warn("JOB_STUCK jobId={} type={}", jobId, job.getType().getCode());
        }
        recordCounter("bookfetch.job.event", "type", job.getType().getCode(), "event", "stalled");
    }

    private void stampScheduledRun(JobPayload payload) {
        if (!(payload instanceof ScheduledPayload)) {
            return;
        }
        Long scheduledJobId = ((ScheduledPayload) payload).getScheduledJobId();
        if (scheduledJobId == null) {
            return;
        }
        ScheduledJobEntity scheduled = scheduledJobMapper.selectById(scheduledJobId);
        if (scheduled == null) {
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        scheduledJobMapper.updateRunTimes(scheduledJobId, now, CronSupport.nextRun(scheduled.getSchedule(), now));
    }

    private long elapsedNanos(BrokerJob job) {
        Long started = startedNanos.remove(job.getBrokerJobId());
        return started == null ? 0L : System.nanoTime() - started;
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

    private void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Job metric timer failed, name={}", name, ex);
        }
    }
}
