package com.example.bookfetch.infrastructure.notification;

import com.example.bookfetch.domain.payload.SendNotificationPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(SendNotificationPayload event) {
        log.info("NOTIFICATION event={} requestId={} title={} author={} user={} message={}",
                event.getEvent(), event.getRequestId(), event.getTitle(), event.getAuthor(),
                event.getUserName(), event.getMessage());
    }
}
