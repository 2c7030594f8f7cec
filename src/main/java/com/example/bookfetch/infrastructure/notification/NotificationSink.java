package com.example.bookfetch.infrastructure.notification;

import com.example.bookfetch.domain.payload.SendNotificationPayload;

/**
 * Delivers request events to an outside channel. Failures are reported by exception and never
 * reach the request.
 */
public interface NotificationSink {

    String name();

    void send(SendNotificationPayload event) throws Exception;
}
