package com.example.bookfetch.application.queue;

import com.example.bookfetch.common.config.AppQueueProperties;
import com.example.bookfetch.common.config.TaskExecutionConfig;
import com.example.bookfetch.common.exception.JobProcessingException;
import com.example.bookfetch.common.logging.LogContext;
import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.payload.JobPayload;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * In-process broker. Each job type gets its own bounded pool fed from a priority queue (higher
 * priority first, FIFO within a priority). Delays and retry backoff run on one shared timer;
 * cron registrations run on the {@code jobCronScheduler}.
 *
 * <p>Nothing here survives a restart. The job ledger does, and startup recovery resubmits from it.
 */
@Component
public class ExecutorJobBroker implements JobBroker {

    private static final Logger log = LoggerFactory.getLogger(ExecutorJobBroker.class);

    private static final JobLifecycleListener NO_LISTENER = new JobLifecycleListener() {
        @Override
        public void onActive(BrokerJob job) {
        }

        @Override
        public void onCompleted(BrokerJob job, Object result) {
        }

        @Override
        public void onFailed(BrokerJob job, Throwable error, boolean finalAttempt) {
        }

        @Override
        public void onStalled(BrokerJob job) {
        }
    };

    private final AppQueueProperties properties;
    private final ThreadPoolTaskScheduler jobCronScheduler;
    private final ScheduledExecutorService timer;
    private final Map<JobType, Worker> workers = new ConcurrentHashMap<>();
    private final Map<JobType, List<BrokerJob>> parked = new ConcurrentHashMap<>();
    private final Map<String, BrokerJob> waiting = new ConcurrentHashMap<>();
    private final Map<String, RunningJob> running = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> repeatables = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();
    private final AtomicLong runSequence = new AtomicLong();

    private volatile JobLifecycleListener listener = NO_LISTENER;

    public ExecutorJobBroker(AppQueueProperties properties, ThreadPoolTaskScheduler jobCronScheduler) {
        this.properties = properties;
        this.jobCronScheduler = jobCronScheduler;
        this.timer = Executors.newSingleThreadScheduledExecutor(
                new TaskExecutionConfig.NamedThreadFactory("job-timer-"));
        long checkInterval = Math.max(1000L, properties.getStalledCheckIntervalMs());
        this.timer.scheduleWithFixedDelay(this::checkStalled, checkInterval, checkInterval, TimeUnit.MILLISECONDS);
    }

    @Override
    public void setLifecycleListener(JobLifecycleListener listener) {
        this.listener = listener == null ? NO_LISTENER : listener;
    }

    @Override
    public void registerWorker(JobType type, int concurrency, JobHandler handler) {
        int threads = Math.max(1, concurrency);
        Worker worker = new Worker(type, threads, handler);
        if (workers.putIfAbsent(type, worker) != null) {
            worker.executor.shutdown();
            log.warn("JOB_WORKER_DUPLICATE type={}", type.getCode());
            return;
        }
        log.info("JOB_WORKER_REGISTERED type={} concurrency={}", type.getCode(), threads);
        List<BrokerJob> held = parked.remove(type);
        if (held != null) {
            for (BrokerJob job : held) {
                dispatch(job);
            }
        }
    }

    @Override
    public String submit(JobType type, JobPayload payload, int priority, int maxAttempts, long delayMs) {
        BrokerJob job = new BrokerJob(nextId(), type, payload, priority, maxAttempts, null);
        enqueue(job, delayMs);
        return job.getBrokerJobId();
    }

    @Override
    public boolean remove(String brokerJobId) {
        if (brokerJobId == null) {
            return false;
        }
        BrokerJob removed = waiting.remove(brokerJobId);
        if (removed != null) {
            log.info("BROKER_JOB_REMOVED brokerJobId={} type={}", brokerJobId, removed.getType().getCode());
            return true;
        }
        return false;
    }

    @Override
    public synchronized void addRepeatable(String key,
                                           String cron,
                                           JobType type,
                                           Supplier<? extends JobPayload> payloadFactory,
                                           int priority,
                                           int maxAttempts) {
        removeRepeatable(key);
        ScheduledFuture<?> future = jobCronScheduler.schedule(
                () -> fireRepeatable(key, type, payloadFactory, priority, maxAttempts),
                new CronTrigger(cron));
        repeatables.put(key, future);
        log.info("REPEATABLE_REGISTERED key={} type={} cron={}", key, type.getCode(), cron);
    }

    @Override
    public synchronized boolean removeRepeatable(String key) {
        ScheduledFuture<?> existing = repeatables.remove(key);
        if (existing == null) {
            return false;
        }
        existing.cancel(false);
        log.info("REPEATABLE_REMOVED key={}", key);
        return true;
    }

    @Override
    public boolean hasRepeatable(String key) {
        return repeatables.containsKey(key);
    }

    @Override
    public int waitingCount(JobType type) {
        int count = 0;
        for (BrokerJob job : waiting.values()) {
            if (job.getType() == type) {
                count++;
            }
        }
        return count;
    }

    @Override
    public int activeCount(JobType type) {
        int count = 0;
        for (RunningJob run : running.values()) {
            if (run.job.getType() == type) {
                count++;
            }
        }
        return count;
    }

    @PreDestroy
    public void shutdown() {
        for (String key : new ArrayList<>(repeatables.keySet())) {
            removeRepeatable(key);
        }
        timer.shutdownNow();
        for (Worker worker : workers.values()) {
            worker.executor.shutdown();
        }
        log.info("JOB_BROKER_STOPPED waiting={} running={}", waiting.size(), running.size());
    }

    private void fireRepeatable(String key,
                                JobType type,
                                Supplier<? extends JobPayload> payloadFactory,
                                int priority,
                                int maxAttempts) {
        try {
            JobPayload payload = payloadFactory.get();
            BrokerJob job = new BrokerJob(nextId(), type, payload, priority, maxAttempts, key);
            enqueue(job, 0L);
            log.info("REPEATABLE_FIRED key={} brokerJobId={}", key, job.getBrokerJobId());
        } catch (RuntimeException e) {
            log.warn("REPEATABLE_FIRE_FAILED key={} type={}", key, type.getCode(), e);
        }
    }

    private void enqueue(BrokerJob job, long delayMs) {
        waiting.put(job.getBrokerJobId(), job);
        if (delayMs > 0L) {
            timer.schedule(() -> dispatch(job), delayMs, TimeUnit.MILLISECONDS);
        } else {
            dispatch(job);
        }
    }

    private void dispatch(BrokerJob job) {
        if (!waiting.containsKey(job.getBrokerJobId())) {
            return;
        }
        Worker worker = workers.get(job.getType());
        if (worker == null) {
            List<BrokerJob> held = parked.computeIfAbsent(job.getType(), t -> new CopyOnWriteArrayList<>());
            held.add(job);
            // registration may have drained the list between the lookup and the add
            worker = workers.get(job.getType());
            if (worker == null || !held.remove(job)) {
                return;
            }
        }
        worker.executor.execute(new QueuedRun(job, worker.handler, runSequence.incrementAndGet()));
    }

    private void run(BrokerJob job, JobHandler handler) {
        if (waiting.remove(job.getBrokerJobId()) == null) {
            return;
        }
        int attempt = job.nextAttempt();
        running.put(job.getBrokerJobId(), new RunningJob(job, System.currentTimeMillis()));
        try {
            notifyActive(job);
            LogContext.enterJob(job.getPayload().getJobId(), job.getType().getCode());
            Object result = handler.handle(job);
            running.remove(job.getBrokerJobId());
            notifyCompleted(job, result);
        } catch (Exception e) {
            running.remove(job.getBrokerJobId());
            boolean retryable = !(e instanceof JobProcessingException) || ((JobProcessingException) e).isRetryable();
            boolean finalAttempt = !retryable || job.isLastAttempt();
            notifyFailed(job, e, finalAttempt);
            if (!finalAttempt) {
                long backoff = properties.getBackoffBaseMs() * (1L << Math.min(20, attempt - 1));
                log.info("JOB_RETRY_SCHEDULED brokerJobId={} type={} attempt={}/{} delayMs={}",
                        job.getBrokerJobId(), job.getType().getCode(), attempt, job.getMaxAttempts(), backoff);
                enqueue(job, backoff);
            }
        } finally {
            LogContext.exitJob();
        }
    }

    private void checkStalled() {
        long timeout = properties.getStalledTimeoutMs();
        long now = System.currentTimeMillis();
        for (RunningJob run : running.values()) {
            if (!run.stalledReported && now - run.startedAt > timeout) {
                run.stalledReported = true;
                log.warn("JOB_STALLED brokerJobId={} type={} runningMs={}",
                        run.job.getBrokerJobId(), run.job.getType().getCode(), now - run.startedAt);
                try {
                    listener.onStalled(run.job);
                } catch (RuntimeException e) {
                    log.warn("Stalled listener failed, brokerJobId={}", run.job.getBrokerJobId(), e);
                }
            }
        }
    }

    private void notifyActive(BrokerJob job) {
        try {
            listener.onActive(job);
        } catch (RuntimeException e) {
            log.warn("Active listener failed, brokerJobId={}", job.getBrokerJobId(), e);
        }
    }

    private void notifyCompleted(BrokerJob job, Object result) {
        try {
            listener.onCompleted(job, result);
        } catch (RuntimeException e) {
            log.warn("Completed listener failed, brokerJobId={}", job.getBrokerJobId(), e);
        }
    }

    private void notifyFailed(BrokerJob job, Throwable error, boolean finalAttempt) {
        try {
            listener.onFailed(job, error, finalAttempt);
        } catch (RuntimeException e) {
            log.warn("Failed listener failed, brokerJobId={}", job.getBrokerJobId(), e);
        }
    }

    private String nextId() {
        return "bj-" + idSequence.incrementAndGet();
    }

    private static final class Worker {

        private final JobHandler handler;
        private final ThreadPoolExecutor executor;

        private Worker(JobType type, int concurrency, JobHandler handler) {
            this.handler = handler;
            this.executor = new ThreadPoolExecutor(
                    concurrency,
                    concurrency,
                    60L,
                    TimeUnit.SECONDS,
                    new PriorityBlockingQueue<>(),
                    new TaskExecutionConfig.NamedThreadFactory("job-" + type.getCode() + "-"));
        }
    }

    private static final class RunningJob {

        private final BrokerJob job;
        private final long startedAt;
        private volatile boolean stalledReported;

        private RunningJob(BrokerJob job, long startedAt) {
            this.job = job;
            this.startedAt = startedAt;
        }
    }

    private final class QueuedRun implements Runnable, Comparable<QueuedRun> {

        private final BrokerJob job;
        private final JobHandler handler;
        private final long sequence;

        private QueuedRun(BrokerJob job, JobHandler handler, long sequence) {
            this.job = job;
            this.handler = handler;
            this.sequence = sequence;
        }

        @Override
        public void run() {
            ExecutorJobBroker.this.run(job, handler);
        }

        @Override
        public int compareTo(QueuedRun other) {
            int byPriority = Integer.compare(other.job.getPriority(), job.getPriority());
            if (byPriority != 0) {
                return byPriority;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}
