package com.example.bookfetch.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class OrganizeResult {

    private boolean success;

    private String targetPath;

    private List<String> audioFiles = new ArrayList<>();

    private String coverArtFile;

    /** Files actually written by this run; already-present files are not counted. */
    private int filesMovedCount;

    private int alreadyPresentCount;

    /** Non-fatal problems, or the reason for failure when {@code success} is false. */
    private List<String> errors = new ArrayList<>();

    /** Informational entries, such as a skipped optional step. */
    private List<String> notes = new ArrayList<>();
}
