package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.model.AudiobookRef;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class SearchIndexersPayload extends JobPayload {

    private Long requestId;

    private AudiobookRef audiobook;

    @Override
    public JobType jobType() {
        return JobType.SEARCH_INDEXERS;
    }

    @Override
    public Long requestId() {
        return requestId;
    }
}
