package com.example.bookfetch.application.job;

import com.example.bookfetch.application.service.ScheduledJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class ScheduledJobInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobInitializer.class);

    private final ScheduledJobService scheduledJobService;

    public ScheduledJobInitializer(ScheduledJobService scheduledJobService) {
        this.scheduledJobService = scheduledJobService;
    }

    @Override
    public void run(String... args) {
        int created = scheduledJobService.ensureDefaults();
        if (created > 0) {
            log.info("Default scheduled jobs created, count={}", created);
        }
        scheduledJobService.scheduleAll();
    }
}
