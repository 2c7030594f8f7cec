package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SendNotificationPayload extends JobPayload {

    /** request_pending_approval, request_approved, request_available, request_error */
    private String event;

    private Long requestId;

    private String title;

    private String author;

    private String userName;

    private String message;

    private Long timestamp;

    @Override
    public JobType jobType() {
        return JobType.SEND_NOTIFICATION;
    }
}
