package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class CleanupSeededTorrentsPayload extends ScheduledPayload {

    @Override
    public JobType jobType() {
        return JobType.CLEANUP_SEEDED_TORRENTS;
    }
}
