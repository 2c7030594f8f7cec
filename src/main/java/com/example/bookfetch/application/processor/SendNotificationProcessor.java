package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.service.NotificationService;
import com.example.bookfetch.domain.payload.SendNotificationPayload;
import org.springframework.stereotype.Component;

@Component
public class SendNotificationProcessor implements JobProcessor<SendNotificationPayload> {

    private final NotificationService notificationService;

    public SendNotificationProcessor(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Override
    public JobResult process(SendNotificationPayload payload) {
        int delivered = notificationService.deliver(payload);
        return JobResult.success("Delivered to " + delivered + " sinks")
                .with("event", payload.getEvent())
                .with("delivered", delivered);
    }
}
