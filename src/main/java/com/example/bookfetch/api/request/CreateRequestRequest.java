package com.example.bookfetch.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateRequestRequest {

    @NotNull
    private Long userId;

    private String asin;

    @NotBlank
    private String title;

    @NotBlank
    private String author;

    private String narrator;

    private Integer year;

    private String series;

    private String seriesPart;

    private Integer durationMinutes;

    private String coverArtUrl;

    /** Create in awaiting_search without starting a search right away. */
    private boolean skipAutoSearch;
}
