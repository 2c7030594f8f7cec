package com.example.bookfetch.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ScheduledJobEntity {

    private Long id;

    private String name;

    private String type;

    private String schedule;

    private Boolean enabled;

    private String payload;

    private LocalDateTime lastRun;

    private LocalDateTime nextRun;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
