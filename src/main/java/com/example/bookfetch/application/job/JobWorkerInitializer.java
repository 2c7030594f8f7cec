package com.example.bookfetch.application.job;

import com.example.bookfetch.application.processor.JobDispatcher;
import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.common.config.AppQueueProperties;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(0)
public class JobWorkerInitializer implements CommandLineRunner {

    private final JobDispatcher jobDispatcher;
    private final JobQueueService jobQueueService;
    private final AppQueueProperties queueProperties;

    public JobWorkerInitializer(JobDispatcher jobDispatcher,
                                JobQueueService jobQueueService,
                                AppQueueProperties queueProperties) {
        this.jobDispatcher = jobDispatcher;
        this.jobQueueService = jobQueueService;
        this.queueProperties = queueProperties;
    }

    @Override
    public void run(String... args) {
        jobDispatcher.registerAll(jobQueueService, queueProperties);
    }
}
