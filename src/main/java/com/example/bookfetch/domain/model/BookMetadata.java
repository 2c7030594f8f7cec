package com.example.bookfetch.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Everything the organizer needs to know about the book being placed in the library.
 */
@Data
public class BookMetadata {

    private String title;

    private String author;

    private String narrator;

    private String asin;

    private Integer year;

    private String series;

    private String seriesPart;

    private Integer durationMinutes;

    private String coverArtUrl;

    /** Local copy of the cover kept by the metadata cache, if any. */
    private String cachedCoverPath;

    public Map<String, String> toTemplateVariables() {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("author", author);
        variables.put("title", title);
        variables.put("narrator", narrator);
        variables.put("asin", asin);
        variables.put("year", year == null ? null : String.valueOf(year));
        variables.put("series", series);
        variables.put("seriesPart", seriesPart);
        return variables;
    }
}
