package com.example.bookfetch.domain.model;

import com.example.bookfetch.domain.enumtype.DownloadState;
import lombok.Data;

/**
 * Client status after normalization: integer percent and a path in the pipeline's filesystem view.
 */
@Data
public class DownloadSnapshot {

    private String handle;

    private String name;

    private int percent;

    private DownloadState state;

    private long downloadSpeed;

    private long eta;

    private String localPath;

    private String errorMessage;

    private long seedingTimeSeconds;
}
