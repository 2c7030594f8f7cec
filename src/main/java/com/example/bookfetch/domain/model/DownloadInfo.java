package com.example.bookfetch.domain.model;

import com.example.bookfetch.domain.enumtype.DownloadState;
import lombok.Data;

/**
 * Raw transfer status as a download client reports it.
 */
@Data
public class DownloadInfo {

    private String handle;

    private String name;

    private long size;

    /** In the client's own {@code ProgressUnit}. */
    private double progress;

    private DownloadState state;

    private long downloadSpeed;

    /** Seconds, or -1 when unknown. */
    private long eta = -1L;

    /** Where the client put the payload, in the client's filesystem view. */
    private String downloadPath;

    private String errorMessage;

    private long seedingTimeSeconds;
}
