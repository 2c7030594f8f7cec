package com.example.bookfetch.common.config;

import com.example.bookfetch.domain.model.PathMapping;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.download")
public class AppDownloadProperties {

    private String downloadDir = "/downloads";

    /**
     * Remote-to-local path mapping keyed by download client id.
     */
    private Map<String, PathMapping> pathMappings = new HashMap<>();

    /**
     * Minimum seeding time in minutes keyed by indexer name; 0 means seed forever.
     */
    private Map<String, Integer> seedingTimeMinutes = new HashMap<>();

    public PathMapping pathMappingFor(String clientId) {
        PathMapping mapping = clientId == null ? null : pathMappings.get(clientId);
        return mapping == null ? new PathMapping(false, null, null) : mapping;
    }
}
