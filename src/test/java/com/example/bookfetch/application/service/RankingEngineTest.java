package com.example.bookfetch.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bookfetch.common.config.AppRankingProperties;
import com.example.bookfetch.domain.model.RankedCandidate;
import com.example.bookfetch.domain.model.RankingTarget;
import com.example.bookfetch.domain.model.ScoreBreakdown;
import com.example.bookfetch.domain.model.TorrentCandidate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RankingEngineTest {

    private static final long MB = 1024L * 1024L;

    private AppRankingProperties properties;
    private RankingEngine engine;
    private RankingTarget target;

    @BeforeEach
    void setUp() {
        properties = new AppRankingProperties();
        engine = new RankingEngine(properties);
        target = new RankingTarget("Project Hail Mary", "Andy Weir", 970);
    }

    @Test
    void rankShouldDropCandidatesBelowMinimumSize() {
        TorrentCandidate tiny = candidate("Andy Weir - Project Hail Mary [M4B]", MB, 20);
        TorrentCandidate full = candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20);

        List<RankedCandidate> ranked = engine.rank(Arrays.asList(tiny, full), target);

        assertEquals(1, ranked.size());
        assertSame(full, ranked.get(0).getCandidate());
        assertEquals(1, ranked.get(0).getRank());
    }

    @Test
    void rankShouldKeepDiscoveryOrderOnEqualScores() {
        TorrentCandidate first = candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20);
        TorrentCandidate second = candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20);

        List<RankedCandidate> ranked = engine.rank(Arrays.asList(first, second), target);

        assertSame(first, ranked.get(0).getCandidate());
        assertSame(second, ranked.get(1).getCandidate());
        assertEquals(ranked.get(0).getFinalScore(), ranked.get(1).getFinalScore(), 0.0001D);
        assertEquals(0, ranked.get(0).getDiscoveryIndex());
        assertEquals(2, ranked.get(1).getRank());
    }

    @Test
    void rankShouldPreferBetterFormatRegardlessOfDiscoveryOrder() {
        TorrentCandidate mp3 = candidate("Andy Weir - Project Hail Mary [MP3]", 900 * MB, 20);
        TorrentCandidate m4b = candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20);

        List<RankedCandidate> ranked = engine.rank(Arrays.asList(mp3, m4b), target);

        assertSame(m4b, ranked.get(0).getCandidate());
    }

    @Test
    void rankShouldApplyIndexerPriorityAsPercentOfBaseScore() {
        properties.getIndexerPriorities().put("Preferred", 25);
        TorrentCandidate neutral = candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20);
        neutral.setIndexer("Other");
        TorrentCandidate preferred = candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20);
        preferred.setIndexer("Preferred");

        List<RankedCandidate> ranked = engine.rank(Arrays.asList(neutral, preferred), target);

        RankedCandidate top = ranked.get(0);
        assertSame(preferred, top.getCandidate());
        assertEquals(top.getScore() * 2D, top.getFinalScore(), 0.0001D);
        assertEquals("indexer_priority", top.getBonusModifiers().get(0).getType());
    }

    @Test
    void breakdownShouldScoreExactTitleAndAuthorMatchInFull() {
        ScoreBreakdown breakdown = engine.breakdown(
                candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20), target);

        assertEquals(60D, breakdown.getMatchScore(), 0.0001D);
        assertEquals(10D, breakdown.getFormatScore(), 0.0001D);
        assertTrue(breakdown.getNotes().contains("Excellent title/author match"));
    }

    @Test
    void breakdownShouldZeroMatchWhenRequiredTitleWordsAreMissing() {
        ScoreBreakdown breakdown = engine.breakdown(
                candidate("Andy Weir - The Martian [M4B]", 900 * MB, 20), target);

        assertEquals(0D, breakdown.getMatchScore(), 0.0001D);
        assertTrue(breakdown.getNotes().contains("Poor title/author match"));
    }

    @Test
    void breakdownShouldNotScoreSizeWhenRuntimeUnknown() {
        RankingTarget unknownRuntime = new RankingTarget("Project Hail Mary", "Andy Weir", null);

        ScoreBreakdown breakdown = engine.breakdown(
                candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, 20), unknownRuntime);

        assertEquals(0D, breakdown.getSizeScore(), 0.0001D);
        assertTrue(breakdown.getNotes().contains("Runtime unknown, size not scored"));
    }

    @Test
    void breakdownShouldGiveUsenetResultsFullSeederScore() {
        TorrentCandidate usenet = candidate("Andy Weir - Project Hail Mary [M4B]", 900 * MB, null);
        usenet.setProtocol("usenet");

        assertEquals(15D, engine.breakdown(usenet, target).getSeederScore(), 0.0001D);
    }

    @Test
    void scoreSeedersShouldGrowWithSeedersAndStayBounded() {
        assertEquals(0D, engine.scoreSeeders(0), 0.0001D);
        assertTrue(engine.scoreSeeders(10) > engine.scoreSeeders(1));
        assertTrue(engine.scoreSeeders(100) > engine.scoreSeeders(10));
        assertEquals(15D, engine.scoreSeeders(100000), 0.0001D);
    }

    @Test
    void scoreSizeShouldPenalizeUnusuallyLargeReleases() {
        TorrentCandidate bundle = candidate("Andy Weir - Project Hail Mary [M4B]", 20000L * MB, 20);

        assertEquals(5D, engine.scoreSize(bundle, 970), 0.0001D);
    }

    @Test
    void detectFormatShouldFallBackToTitle() {
        TorrentCandidate explicit = candidate("Some Release", 900 * MB, 5);
        explicit.setFormat("flac");

        assertEquals("FLAC", engine.detectFormat(explicit));
        assertEquals("M4B", engine.detectFormat(candidate("Book.M4B", 900 * MB, 5)));
        assertEquals("OTHER", engine.detectFormat(candidate("Book", 900 * MB, 5)));
    }

    private static TorrentCandidate candidate(String title, long size, Integer seeders) {
        TorrentCandidate candidate = new TorrentCandidate();
        candidate.setTitle(title);
        candidate.setSize(size);
        candidate.setSeeders(seeders);
        return candidate;
    }
}
