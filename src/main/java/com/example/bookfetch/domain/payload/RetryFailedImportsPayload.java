package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class RetryFailedImportsPayload extends ScheduledPayload {

    @Override
    public JobType jobType() {
        return JobType.RETRY_FAILED_IMPORTS;
    }
}
