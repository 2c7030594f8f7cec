package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class OrganizeFilesPayload extends JobPayload {

    private Long requestId;

    private Long audiobookId;

    /** Local path of the finished download, already mapped from the client's view. */
    private String downloadPath;

    @Override
    public JobType jobType() {
        return JobType.ORGANIZE_FILES;
    }

    @Override
    public Long requestId() {
        return requestId;
    }
}
