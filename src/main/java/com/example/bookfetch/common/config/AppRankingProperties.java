package com.example.bookfetch.common.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.ranking")
public class AppRankingProperties {

    private double formatWeight = 10D;

    private double sizeWeight = 15D;

    private double seederWeight = 15D;

    private double matchWeight = 60D;

    /** Results below this size are dropped before scoring. */
    private long minSizeBytes = 20L * 1024L * 1024L;

    /** Share of significant title words a candidate must contain. */
    private double requiredWordCoverage = 0.8D;

    /** Bitrate floor (MB per minute of runtime) for a full size score. */
    private double fullScoreMbPerMinute = 1.0D;

    /** Above this the candidate is unusually large for its runtime. */
    private double maxMbPerMinute = 12.0D;

    /** Optional preferred format (m4b, m4a, mp3); matching candidates get a bonus. */
    private String preferredFormat;

    /**
     * Indexer priority (1-25, 10 neutral) keyed by indexer name.
     */
    private Map<String, Integer> indexerPriorities = new HashMap<>();

    /**
     * Score modifiers for indexer flags (freeleech, internal, ...), as percent of base score.
     */
    private List<FlagModifier> flagModifiers = new ArrayList<>();

    @Data
    public static class FlagModifier {

        private String name;

        private int modifier;
    }
}
