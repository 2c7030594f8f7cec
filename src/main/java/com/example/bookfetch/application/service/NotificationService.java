package com.example.bookfetch.application.service;

import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.domain.payload.SendNotificationPayload;
import com.example.bookfetch.infrastructure.notification.NotificationSink;
import com.example.bookfetch.infrastructure.persistence.entity.AudiobookEntity;
import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import com.example.bookfetch.infrastructure.persistence.entity.UserEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.AudiobookMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import com.example.bookfetch.infrastructure.persistence.mapper.UserMapper;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Queues request events for delivery and delivers them to every sink. Only the attempt to queue
 * is guaranteed; a failing sink never affects the request.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    public static final String EVENT_PENDING_APPROVAL = "request_pending_approval";
    public static final String EVENT_APPROVED = "request_approved";
    public static final String EVENT_AVAILABLE = "request_available";
    public static final String EVENT_ERROR = "request_error";

    private final JobQueueService jobQueueService;
    private final RequestMapper requestMapper;
    private final AudiobookMapper audiobookMapper;
    private final UserMapper userMapper;
    private final ObjectProvider<NotificationSink> sinkProvider;

    public NotificationService(JobQueueService jobQueueService,
                               RequestMapper requestMapper,
                               AudiobookMapper audiobookMapper,
                               UserMapper userMapper,
                               ObjectProvider<NotificationSink> sinkProvider) {
        this.jobQueueService = jobQueueService;
        this.requestMapper = requestMapper;
        this.audiobookMapper = audiobookMapper;
        this.userMapper = userMapper;
        this.sinkProvider = sinkProvider;
    }

    public void notifyRequestEvent(Long requestId, String event, String message) {
        try {
            SendNotificationPayload payload = new SendNotificationPayload();
            payload.setEvent(event);
            payload.setRequestId(requestId);
            payload.setMessage(message);
            payload.setTimestamp(System.currentTimeMillis());
            RequestEntity request = requestMapper.selectById(requestId);
            if (request != null) {
                AudiobookEntity audiobook = audiobookMapper.selectById(request.getAudiobookId());
                if (audiobook != null) {
                    payload.setTitle(audiobook.getTitle());
                    payload.setAuthor(audiobook.getAuthor());
                }
                UserEntity user = request.getUserId() == null ? null : userMapper.selectById(request.getUserId());
                if (user != null) {
                    payload.setUserName(user.getUsername());
                }
            }
            jobQueueService.addNotificationJob(payload);
        } catch (RuntimeException e) {
            log.warn("NOTIFICATION_QUEUE_FAILED requestId={} event={} error={}", requestId, event, e.getMessage());
        }
    }

    /**
     * @return number of sinks that accepted the event
     */
    public int deliver(SendNotificationPayload event) {
        List<NotificationSink> sinks = sinkProvider.orderedStream().collect(Collectors.toList());
        int delivered = 0;
        for (NotificationSink sink : sinks) {
            try {
                sink.send(event);
                delivered++;
            } catch (Exception e) {
                log.warn("NOTIFICATION_SINK_FAILED sink={} event={} requestId={} error={}",
                        sink.name(), event.getEvent(), event.getRequestId(), e.getMessage());
            }
        }
        log.info("NOTIFICATION_DELIVERED event={} requestId={} sinks={}/{}",
                event.getEvent(), event.getRequestId(), delivered, sinks.size());
        return delivered;
    }
}
