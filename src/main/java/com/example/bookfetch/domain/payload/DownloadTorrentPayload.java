package com.example.bookfetch.domain.payload;

import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.model.AudiobookRef;
import com.example.bookfetch.domain.model.TorrentCandidate;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class DownloadTorrentPayload extends JobPayload {

    private Long requestId;

    private AudiobookRef audiobook;

    private TorrentCandidate torrent;

    @Override
    public JobType jobType() {
        return JobType.DOWNLOAD_TORRENT;
    }

    @Override
    public Long requestId() {
        return requestId;
    }
}
