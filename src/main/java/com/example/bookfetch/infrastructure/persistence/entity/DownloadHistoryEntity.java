package com.example.bookfetch.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class DownloadHistoryEntity {

    private Long id;

    private Long requestId;

    private String indexerName;

    private String torrentName;

    private String torrentHash;

    private Long torrentSizeBytes;

    private Integer seeders;

    private Integer qualityScore;

    private Boolean selected;

    private String downloadClient;

    private String downloadClientId;

    private String downloadStatus;

    private Integer progress;

    private String downloadPath;

    private String errorMessage;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
