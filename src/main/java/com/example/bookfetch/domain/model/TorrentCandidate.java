package com.example.bookfetch.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A located transfer option for a requested book, before selection.
 */
@Data
public class TorrentCandidate {

    private String guid;

    private String title;

    private long size;

    /** {@code null} for protocols without a swarm (usenet). */
    private Integer seeders;

    private Integer leechers;

    private String indexer;

    private Integer indexerId;

    private String downloadUrl;

    private String infoHash;

    /** torrent or usenet */
    private String protocol = "torrent";

    private LocalDateTime publishDate;

    /** Format hint from the indexer, when it offers one. */
    private String format;

    /** {@code false} only when the indexer says the release has no chapter markers. */
    private Boolean hasChapters;

    private List<String> flags = new ArrayList<>();
}
