package com.example.bookfetch.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class RequestEntity {

    private Long id;

    private Long userId;

    private Long audiobookId;

    private String type;

    private String status;

    private Integer progress;

    private String errorMessage;

    private Long parentRequestId;

    private Integer importAttempts;

    private Integer maxImportRetries;

    private String selectedTransfer;

    private Integer searchAttempts;

    private LocalDateTime lastSearchAt;

    private LocalDateTime completedAt;

    private LocalDateTime deletedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
