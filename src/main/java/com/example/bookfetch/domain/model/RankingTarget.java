package com.example.bookfetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the search is looking for.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankingTarget {

    private String title;

    private String author;

    /** Known runtime in minutes; {@code null} disables the size plausibility score. */
    private Integer durationMinutes;
}
