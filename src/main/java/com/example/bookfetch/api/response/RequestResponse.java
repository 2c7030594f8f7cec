package com.example.bookfetch.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RequestResponse {

    private Long id;
    private Long userId;
    private Long audiobookId;
    private String title;
    private String author;
    private String type;
    private String status;
    private int progress;
    private String errorMessage;
    private Long parentRequestId;
    private int importAttempts;
    private Integer maxImportRetries;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
}
