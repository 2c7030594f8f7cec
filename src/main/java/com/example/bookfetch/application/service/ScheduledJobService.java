package com.example.bookfetch.application.service;

import com.example.bookfetch.api.request.CreateScheduledJobRequest;
import com.example.bookfetch.api.request.UpdateScheduledJobRequest;
import com.example.bookfetch.application.queue.JobOptions;
import com.example.bookfetch.application.queue.JobPayloadCodec;
import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.common.exception.BusinessException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.payload.JobPayload;
import com.example.bookfetch.domain.payload.ScheduledPayload;
import com.example.bookfetch.infrastructure.persistence.entity.ScheduledJobEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.ScheduledJobMapper;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recurring job definitions. Each enabled definition is one repeatable broker registration keyed
 * by {@link #repeatKey(Long)}; edits replace the registration, disabling removes it.
 */
@Service
public class ScheduledJobService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobService.class);

    private static final List<DefaultJob> DEFAULT_JOBS;

    static {
        List<DefaultJob> defaults = new ArrayList<>();
        defaults.add(new DefaultJob("Library Scan", JobType.SCAN_LIBRARY, "0 */6 * * *", false));
        defaults.add(new DefaultJob("Retry Missing Torrents", JobType.RETRY_MISSING_TORRENTS, "0 0 * * *", true));
        defaults.add(new DefaultJob("Retry Failed Imports", JobType.RETRY_FAILED_IMPORTS, "0 */6 * * *", true));
        defaults.add(new DefaultJob("Cleanup Seeded Torrents", JobType.CLEANUP_SEEDED_TORRENTS, "*/30 * * * *", true));
        DEFAULT_JOBS = Collections.unmodifiableList(defaults);
    }

    private final ScheduledJobMapper scheduledJobMapper;
    private final JobQueueService jobQueueService;
    private final JobPayloadCodec payloadCodec;

    public ScheduledJobService(ScheduledJobMapper scheduledJobMapper,
                               JobQueueService jobQueueService,
                               JobPayloadCodec payloadCodec) {
        this.scheduledJobMapper = scheduledJobMapper;
        this.jobQueueService = jobQueueService;
        this.payloadCodec = payloadCodec;
    }

    static String repeatKey(Long scheduledJobId) {
        return "scheduled-" + scheduledJobId;
    }

    /**
     * Inserts the built-in definitions whose type has no row yet.
     */
    public int ensureDefaults() {
        int created = 0;
        LocalDateTime now = LocalDateTime.now();
        for (DefaultJob defaultJob : DEFAULT_JOBS) {
            if (scheduledJobMapper.countByType(defaultJob.type.getCode()) > 0) {
                continue;
            }
            ScheduledJobEntity entity = new ScheduledJobEntity();
            entity.setName(defaultJob.name);
            entity.setType(defaultJob.type.getCode());
            entity.setSchedule(defaultJob.schedule);
            entity.setEnabled(defaultJob.enabled);
            entity.setPayload("{}");
            entity.setNextRun(CronSupport.nextRun(defaultJob.schedule, now));
            scheduledJobMapper.insert(entity);
            created++;
            log.info("SCHEDULED_JOB_DEFAULT_CREATED id={} type={} schedule={} enabled={}",
                    entity.getId(), entity.getType(), entity.getSchedule(), entity.getEnabled());
        }
        return created;
    }

    /**
     * Registers every enabled definition and triggers the overdue ones once.
     */
    public void scheduleAll() {
        LocalDateTime now = LocalDateTime.now();
        int registered = 0;
        for (ScheduledJobEntity entity : scheduledJobMapper.selectAll()) {
            if (!Boolean.TRUE.equals(entity.getEnabled())) {
                continue;
            }
            try {
                register(entity);
                registered++;
                if (isOverdue(entity, now)) {
                    log.info("SCHEDULED_JOB_OVERDUE id={} name=\"{}\" lastRun={}",
                            entity.getId(), entity.getName(), entity.getLastRun());
                    trigger(entity);
                }
            } catch (RuntimeException e) {
                log.warn("SCHEDULED_JOB_REGISTER_FAILED id={} name=\"{}\"", entity.getId(), entity.getName(), e);
            }
        }
        log.info("SCHEDULED_JOBS_REGISTERED count={}", registered);
    }

    public List<ScheduledJobEntity> list() {
        return scheduledJobMapper.selectAll();
    }

    public ScheduledJobEntity get(Long id) {
        ScheduledJobEntity entity = scheduledJobMapper.selectById(id);
        if (entity == null) {
            throw BusinessException.notFound("Scheduled job " + id + " not found");
        }
        return entity;
    }

    public ScheduledJobEntity create(CreateScheduledJobRequest request) {
        JobType type = schedulableType(request.getType());
        CronSupport.validate(request.getSchedule());
        ScheduledJobEntity entity = new ScheduledJobEntity();
        entity.setName(request.getName().trim());
        entity.setType(type.getCode());
        entity.setSchedule(request.getSchedule().trim());
        entity.setEnabled(request.getEnabled() == null || request.getEnabled());
        entity.setPayload(request.getPayload() == null ? "{}" : payloadCodec.write(request.getPayload()));
        entity.setNextRun(CronSupport.nextRun(entity.getSchedule(), LocalDateTime.now()));
        scheduledJobMapper.insert(entity);
        log.info("SCHEDULED_JOB_CREATED id={} type={} schedule={}", entity.getId(), entity.getType(), entity.getSchedule());
        if (Boolean.TRUE.equals(entity.getEnabled())) {
            register(entity);
        }
        return entity;
    }

    public ScheduledJobEntity update(Long id, UpdateScheduledJobRequest request) {
        ScheduledJobEntity entity = get(id);
        if (!TextUtil.isBlank(request.getName())) {
            entity.setName(request.getName().trim());
        }
        if (!TextUtil.isBlank(request.getSchedule())) {
            CronSupport.validate(request.getSchedule());
            entity.setSchedule(request.getSchedule().trim());
        }
        if (request.getEnabled() != null) {
            entity.setEnabled(request.getEnabled());
        }
        if (request.getPayload() != null) {
            entity.setPayload(payloadCodec.write(request.getPayload()));
        }
        entity.setNextRun(Boolean.TRUE.equals(entity.getEnabled())
                ? CronSupport.nextRun(entity.getSchedule(), LocalDateTime.now()) : null);
        scheduledJobMapper.update(entity);

        if (Boolean.TRUE.equals(entity.getEnabled())) {
            register(entity);
        } else {
            jobQueueService.removeRepeatableJob(repeatKey(id));
        }
        log.info("SCHEDULED_JOB_UPDATED id={} schedule={} enabled={}", id, entity.getSchedule(), entity.getEnabled());
        return entity;
    }

    public void delete(Long id) {
        get(id);
        jobQueueService.removeRepeatableJob(repeatKey(id));
        scheduledJobMapper.deleteById(id);
        log.info("SCHEDULED_JOB_DELETED id={}", id);
    }

    /**
     * Runs a definition now. The ledger row is created up front and {@code lastRun} is stamped here,
     * unlike timer-fired runs which do both when they start.
     *
     * @return id of the created job ledger row
     */
    public Long triggerNow(Long id) {
        return trigger(get(id));
    }

    private Long trigger(ScheduledJobEntity entity) {
        JobPayload payload = buildPayload(entity);
        Long jobId = jobQueueService.enqueue(payload, JobOptions.defaults());
        LocalDateTime now = LocalDateTime.now();
        scheduledJobMapper.updateRunTimes(entity.getId(), now, CronSupport.nextRun(entity.getSchedule(), now));
        log.info("SCHEDULED_JOB_TRIGGERED id={} type={} jobId={}", entity.getId(), entity.getType(), jobId);
        return jobId;
    }

    private void register(ScheduledJobEntity entity) {
        JobType type = JobType.fromCode(entity.getType());
        String cron = CronSupport.normalize(entity.getSchedule());
        Long scheduledJobId = entity.getId();
        String payloadJson = entity.getPayload();
        jobQueueService.addRepeatableJob(repeatKey(scheduledJobId), cron, type,
                () -> payloadFor(type, scheduledJobId, payloadJson));
    }

    JobPayload buildPayload(ScheduledJobEntity entity) {
        return payloadFor(JobType.fromCode(entity.getType()), entity.getId(), entity.getPayload());
    }

    private JobPayload payloadFor(JobType type, Long scheduledJobId, String payloadJson) {
        String json = TextUtil.isBlank(payloadJson) ? "{}" : payloadJson;
        JobPayload payload = payloadCodec.read(json, type.getPayloadType());
        payload.setJobId(null);
        if (payload instanceof ScheduledPayload) {
            ((ScheduledPayload) payload).setScheduledJobId(scheduledJobId);
        }
        return payload;
    }

    static boolean isOverdue(ScheduledJobEntity entity, LocalDateTime now) {
        if (entity.getLastRun() == null) {
            return true;
        }
        LocalDateTime next = CronSupport.nextRun(entity.getSchedule(), entity.getLastRun());
        return next != null && !next.isAfter(now);
    }

    private static JobType schedulableType(String code) {
        JobType type;
        try {
            type = JobType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw BusinessException.badRequest("Unknown job type: " + code);
        }
        if (!type.isSchedulable()) {
            throw BusinessException.badRequest("Job type " + code + " cannot be scheduled");
        }
        return type;
    }

    private static final class DefaultJob {

        private final String name;
        private final JobType type;
        private final String schedule;
        private final boolean enabled;

        private DefaultJob(String name, JobType type, String schedule, boolean enabled) {
            this.name = name;
            this.type = type;
            this.schedule = schedule;
            this.enabled = enabled;
        }
    }
}
