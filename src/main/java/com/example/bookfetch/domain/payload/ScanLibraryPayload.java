package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class ScanLibraryPayload extends ScheduledPayload {

    private String libraryId;

    @Override
    public JobType jobType() {
        return JobType.SCAN_LIBRARY;
    }
}
