package com.example.bookfetch.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class JobEntity {

    private Long id;

    private String brokerJobId;

    private Long requestId;

    private String type;

    private String status;

    private Integer priority;

    private Integer attempts;

    private Integer maxAttempts;

    private String payload;

    private String result;

    private String errorMessage;

    private String stackTrace;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
