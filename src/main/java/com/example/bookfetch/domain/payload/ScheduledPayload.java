package com.example.bookfetch.domain.payload;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Payload of a job that may be fired by a {@code ScheduledJob}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public abstract class ScheduledPayload extends JobPayload {

    private Long scheduledJobId;
}
