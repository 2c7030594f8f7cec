package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import lombok.Data;

/**
 * Base of every job payload. {@code jobId} points at the ledger row and is filled in at enqueue time,
 * or lazily for timer-fired scheduled runs.
 */
@Data
public abstract class JobPayload {

    private Long jobId;

    public abstract JobType jobType();

    /** Request this job works for, or {@code null} for request-independent jobs. */
    public Long requestId() {
        return null;
    }
}
