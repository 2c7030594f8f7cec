package com.example.bookfetch.infrastructure.client;

import com.example.bookfetch.domain.model.TorrentCandidate;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Search capability over the configured indexers.
 */
public interface IndexerClient {

    List<TorrentCandidate> search(String query) throws IOException;

    /**
     * Runs a few query variants (with and without author, without subtitle) and merges the results
     * in first-seen order. Used for interactive lookups where recall matters more than load.
     */
    default List<TorrentCandidate> searchWithVariations(String title, String author) throws IOException {
        Set<String> queries = new LinkedHashSet<>();
        String cleanTitle = title == null ? "" : title.trim();
        String shortTitle = cleanTitle.contains(":") ? cleanTitle.substring(0, cleanTitle.indexOf(':')).trim() : cleanTitle;
        if (author != null && !author.trim().isEmpty()) {
            queries.add(cleanTitle + " " + author.trim());
            queries.add(shortTitle + " " + author.trim());
        }
        queries.add(cleanTitle);
        queries.add(shortTitle);

        Map<String, TorrentCandidate> merged = new LinkedHashMap<>();
        for (String query : queries) {
            if (query.trim().isEmpty()) {
                continue;
            }
            for (TorrentCandidate candidate : search(query)) {
                String key = candidate.getGuid() != null
                        ? candidate.getGuid()
                        : String.valueOf(candidate.getTitle()).toLowerCase(Locale.ROOT) + "|" + candidate.getSize();
                merged.putIfAbsent(key, candidate);
            }
        }
        return new ArrayList<>(merged.values());
    }
}
