package com.example.bookfetch.common.config;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class TaskExecutionConfig {

    /**
     * Fires cron registrations of scheduled jobs. Handlers never run on this pool,
     * it only hands work to the broker.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler jobCronScheduler(AppQueueProperties appQueueProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, appQueueProperties.getSchedulerPoolSize()));
        scheduler.setThreadFactory(new NamedThreadFactory("job-cron-"));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    public static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        public NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
