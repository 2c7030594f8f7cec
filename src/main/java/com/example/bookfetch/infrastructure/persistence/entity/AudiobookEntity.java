package com.example.bookfetch.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class AudiobookEntity {

    private Long id;

    private String title;

    private String author;

    private String narrator;

    private String asin;

    private Integer year;

    private String series;

    private String seriesPart;

    private Integer durationMinutes;

    private String coverArtUrl;

    private String cachedCoverPath;

    private String filePath;

    private String status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
