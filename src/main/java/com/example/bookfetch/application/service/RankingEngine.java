package com.example.bookfetch.application.service;

import com.example.bookfetch.common.config.AppRankingProperties;
import com.example.bookfetch.common.util.StringSimilarity;
import com.example.bookfetch.domain.model.BonusModifier;
import com.example.bookfetch.domain.model.RankedCandidate;
import com.example.bookfetch.domain.model.RankingTarget;
import com.example.bookfetch.domain.model.ScoreBreakdown;
import com.example.bookfetch.domain.model.TorrentCandidate;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Scores search results against the requested book.
 *
 * <p>Base score is the sum of four independent parts (defaults in brackets): format [10],
 * size per runtime minute [15], seeders [15] and title/author match [60]. Indexer priority and
 * flag modifiers are applied on top as percentages of the base score.
 */
@Component
public class RankingEngine {

    private static final double FORMAT_MAX = 10D;
    private static final double SIZE_MAX = 15D;
    private static final double SEEDER_MAX = 15D;
    private static final double MATCH_MAX = 60D;
    private static final double TITLE_MAX = 45D;
    private static final double AUTHOR_MAX = 15D;
    private static final double BYTES_PER_MB = 1024D * 1024D;
    private static final int NEUTRAL_INDEXER_PRIORITY = 10;

    private static final Set<String> STOP_WORDS = new HashSet<>(
            Arrays.asList("the", "a", "an", "of", "on", "in", "at", "by", "for"));
    private static final List<String> METADATA_MARKERS = Arrays.asList(" by ", " - ", " [", " (", " {", " :", ",");

    private static final Pattern CAMEL_CASE = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s']");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BRACKETED = Pattern.compile("[(\\[{]([^)\\]}]+)[)\\]}]");
    private static final Pattern AUTHOR_SEPARATORS = Pattern.compile(",|&| and | - ");

    private final AppRankingProperties properties;

    public RankingEngine(AppRankingProperties properties) {
        this.properties = properties;
    }

    /**
     * Ranks candidates best first. Candidates below the minimum size are dropped. Equal final scores
     * keep discovery order.
     */
    public List<RankedCandidate> rank(List<TorrentCandidate> candidates, RankingTarget target) {
        List<RankedCandidate> ranked = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            TorrentCandidate candidate = candidates.get(i);
            if (candidate.getSize() < properties.getMinSizeBytes()) {
                continue;
            }
            ranked.add(score(candidate, target, i));
        }
        // List.sort is stable, so ties stay in discovery order
        ranked.sort(Comparator.comparingDouble(RankedCandidate::getFinalScore).reversed());
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setRank(i + 1);
        }
        return ranked;
    }

    public ScoreBreakdown breakdown(TorrentCandidate candidate, RankingTarget target) {
        double formatScore = weighted(scoreFormat(candidate), FORMAT_MAX, properties.getFormatWeight());
        double sizeScore = weighted(scoreSize(candidate, target.getDurationMinutes()), SIZE_MAX,
                properties.getSizeWeight());
        double seederScore = weighted(scoreSeeders(candidate.getSeeders()), SEEDER_MAX, properties.getSeederWeight());
        double matchScore = weighted(scoreMatch(candidate, target), MATCH_MAX, properties.getMatchWeight());

        ScoreBreakdown breakdown = new ScoreBreakdown();
        breakdown.setFormatScore(formatScore);
        breakdown.setSizeScore(sizeScore);
        breakdown.setSeederScore(seederScore);
        breakdown.setMatchScore(matchScore);
        breakdown.setTotalScore(formatScore + sizeScore + seederScore + matchScore);
        breakdown.setNotes(notes(candidate, breakdown, target.getDurationMinutes()));
        return breakdown;
    }

    private RankedCandidate score(TorrentCandidate candidate, RankingTarget target, int discoveryIndex) {
        ScoreBreakdown breakdown = breakdown(candidate, target);
        double baseScore = breakdown.getTotalScore();

        List<BonusModifier> modifiers = new ArrayList<>();
        if (candidate.getIndexer() != null) {
            Integer configured = properties.getIndexerPriorities().get(candidate.getIndexer());
            int priority = configured == null ? NEUTRAL_INDEXER_PRIORITY : configured;
            double modifier = priority / 25D;
            modifiers.add(new BonusModifier("indexer_priority", modifier, baseScore * modifier,
                    "Indexer priority " + priority + "/25 (" + Math.round(modifier * 100) + "%)"));
        }
        if (candidate.getFlags() != null) {
            for (String flag : candidate.getFlags()) {
                for (AppRankingProperties.FlagModifier config : properties.getFlagModifiers()) {
                    if (config.getName() != null && config.getName().trim().equalsIgnoreCase(flag.trim())) {
                        double modifier = config.getModifier() / 100D;
                        modifiers.add(new BonusModifier("indexer_flag", modifier, baseScore * modifier,
                                "Flag \"" + flag + "\" (" + (config.getModifier() > 0 ? "+" : "")
                                        + config.getModifier() + "%)"));
                    }
                }
            }
        }
        String preferred = properties.getPreferredFormat();
        if (preferred != null && !preferred.trim().isEmpty()
                && detectFormat(candidate).equalsIgnoreCase(preferred.trim())) {
            modifiers.add(new BonusModifier("preferred_format", 0.1D, baseScore * 0.1D,
                    "Preferred format " + preferred.trim().toUpperCase(Locale.ROOT) + " (+10%)"));
        }
        double bonusPoints = 0D;
        for (BonusModifier modifier : modifiers) {
            bonusPoints += modifier.getPoints();
        }

        RankedCandidate ranked = new RankedCandidate();
        ranked.setCandidate(candidate);
        ranked.setDiscoveryIndex(discoveryIndex);
        ranked.setScore(baseScore);
        ranked.setBonusModifiers(modifiers);
        ranked.setBonusPoints(bonusPoints);
        ranked.setFinalScore(baseScore + bonusPoints);
        ranked.setBreakdown(breakdown);
        return ranked;
    }

    double scoreFormat(TorrentCandidate candidate) {
        switch (detectFormat(candidate)) {
            case "M4B":
                return Boolean.FALSE.equals(candidate.getHasChapters()) ? 9D : 10D;
            case "FLAC":
                return 7D;
            case "M4A":
                return 6D;
            case "MP3":
                return 4D;
            default:
                return 1D;
        }
    }

    /**
     * Full score from {@code fullScoreMbPerMinute} up, linear below it. Unusually large releases
     * for the runtime (often a bundle or the wrong book) get a third. Unknown runtime scores 0.
     */
    double scoreSize(TorrentCandidate candidate, Integer runtimeMinutes) {
        if (runtimeMinutes == null || runtimeMinutes <= 0) {
            return 0D;
        }
        double mbPerMinute = (candidate.getSize() / BYTES_PER_MB) / runtimeMinutes;
        if (mbPerMinute > properties.getMaxMbPerMinute()) {
            return SIZE_MAX / 3D;
        }
        if (mbPerMinute >= properties.getFullScoreMbPerMinute()) {
            return SIZE_MAX;
        }
        return (mbPerMinute / properties.getFullScoreMbPerMinute()) * SIZE_MAX;
    }

    /**
     * Logarithmic: 1 seeder ~2, 10 ~6, 100 ~12, 1000+ 15. No seeder count (usenet) is full score.
     */
    double scoreSeeders(Integer seeders) {
        if (seeders == null) {
            return SEEDER_MAX;
        }
        if (seeders <= 0) {
            return 0D;
        }
        return Math.min(SEEDER_MAX, Math.log10(seeders + 1D) * 6D);
    }

    double scoreMatch(TorrentCandidate candidate, RankingTarget target) {
        String torrentTitle = normalize(candidate.getTitle());
        String requestTitle = normalize(target.getTitle());
        List<String> authors = parseAuthors(target.getAuthor());

        String originalTitle = target.getTitle() == null ? "" : target.getTitle().toLowerCase(Locale.ROOT);
        String requiredRaw = BRACKETED.matcher(originalTitle).replaceAll(" ").trim();
        int colon = requiredRaw.indexOf(':');
        if (colon > 0 && colon < requiredRaw.length() - 1) {
            requiredRaw = requiredRaw.substring(0, colon).trim();
        }
        String requiredTitle = normalize(requiredRaw);

        List<String> requiredWords = extractWords(requiredTitle);
        if (!requiredWords.isEmpty()) {
            Set<String> torrentWords = new HashSet<>(extractWords(torrentTitle));
            long matched = requiredWords.stream().filter(torrentWords::contains).count();
            if ((double) matched / requiredWords.size() < properties.getRequiredWordCoverage()) {
                return 0D;
            }
        }
        if (!authors.isEmpty() && !isAuthorPresent(torrentTitle, authors)) {
            return 0D;
        }

        List<String> titlesToTry = new ArrayList<>();
        titlesToTry.add(requestTitle);
        if (!requiredTitle.equals(requestTitle)) {
            titlesToTry.add(requiredTitle);
        }
        String torrentTitleOriginal = WHITESPACE.matcher(candidate.getTitle().toLowerCase(Locale.ROOT))
                .replaceAll(" ").trim();
        double titleScore = -1D;
        for (String title : titlesToTry) {
            if (!title.isEmpty() && isCompleteTitleMatch(torrentTitle, torrentTitleOriginal, title, authors)) {
                titleScore = TITLE_MAX;
                break;
            }
        }
        if (titleScore < 0D) {
            double best = 0D;
            for (String title : titlesToTry) {
                best = Math.max(best, StringSimilarity.compare(title, torrentTitle));
            }
            titleScore = best * TITLE_MAX;
        }

        double authorScore = 0D;
        if (!authors.isEmpty()) {
            long authorHits = authors.stream().filter(torrentTitle::contains).count();
            if (authorHits > 0) {
                authorScore = ((double) authorHits / authors.size()) * AUTHOR_MAX;
            } else {
                authorScore = StringSimilarity.compare(String.join(" ", authors), torrentTitle) * AUTHOR_MAX;
            }
        }
        return Math.min(MATCH_MAX, titleScore + authorScore);
    }

    /**
     * The title appears as a whole: nothing but author or a separator before it, and nothing but
     * metadata (author, brackets, " by ", " - ") after it. Rejects "Title's Secret" for "Title".
     */
    private boolean isCompleteTitleMatch(String torrentTitle, String torrentTitleOriginal, String title,
                                         List<String> authors) {
        int index = torrentTitle.indexOf(title);
        if (index < 0) {
            return false;
        }
        String before = torrentTitle.substring(0, index);
        String after = torrentTitle.substring(index + title.length());

        List<String> titleWords = Arrays.stream(title.split("\\s+"))
                .filter(word -> word.length() > 2)
                .collect(Collectors.toList());
        String afterOriginal = "";
        String beforeOriginal = "";
        if (!titleWords.isEmpty()) {
            String last = titleWords.get(titleWords.size() - 1);
            int lastIdx = torrentTitleOriginal.lastIndexOf(last);
            if (lastIdx >= 0) {
                afterOriginal = torrentTitleOriginal.substring(lastIdx + last.length());
            }
            int firstIdx = torrentTitleOriginal.indexOf(titleWords.get(0));
            if (firstIdx >= 0) {
                beforeOriginal = trimEnd(torrentTitleOriginal.substring(0, firstIdx));
            }
        }

        String afterTrimmed = after.trim();
        boolean afterStartsWithAuthor = authors.stream()
                .anyMatch(author -> author.length() > 2 && afterTrimmed.startsWith(author));
        boolean metadataSuffix = after.isEmpty()
                || METADATA_MARKERS.stream().anyMatch(after::startsWith)
                || METADATA_MARKERS.stream().anyMatch(afterOriginal::startsWith)
                || afterStartsWithAuthor;

        String preceding = trimEnd(before);
        boolean noWordsBefore = extractWords(before).isEmpty();
        boolean separatorBefore = endsWithSeparator(preceding) || endsWithSeparator(beforeOriginal);
        boolean authorBefore = authors.stream().anyMatch(author -> author.length() > 2 && before.contains(author));
        return (noWordsBefore || separatorBefore || authorBefore) && metadataSuffix;
    }

    private boolean isAuthorPresent(String torrentTitle, List<String> authors) {
        for (String author : authors) {
            if (torrentTitle.contains(author)) {
                return true;
            }
            if (StringSimilarity.compare(author, torrentTitle) >= 0.85D) {
                return true;
            }
            List<String> words = Arrays.stream(author.split("\\s+"))
                    .filter(word -> word.length() > 1)
                    .collect(Collectors.toList());
            if (words.size() >= 2) {
                int firstIdx = torrentTitle.indexOf(words.get(0));
                int lastIdx = torrentTitle.indexOf(words.get(words.size() - 1));
                if (firstIdx >= 0 && lastIdx >= 0 && Math.abs(lastIdx - firstIdx) <= 30) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<String> parseAuthors(String author) {
        if (author == null) {
            return new ArrayList<>();
        }
        String raw = WHITESPACE.matcher(author.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        List<String> authors = new ArrayList<>();
        for (String part : AUTHOR_SEPARATORS.split(raw)) {
            String trimmed = part.trim();
            if (trimmed.length() > 2 && !"translator".equals(trimmed) && !"narrator".equals(trimmed)) {
                authors.add(normalize(trimmed));
            }
        }
        return authors;
    }

    String detectFormat(TorrentCandidate candidate) {
        if (candidate.getFormat() != null && !candidate.getFormat().trim().isEmpty()) {
            return candidate.getFormat().trim().toUpperCase(Locale.ROOT);
        }
        String title = candidate.getTitle() == null ? "" : candidate.getTitle().toUpperCase(Locale.ROOT);
        if (title.contains("M4B")) {
            return "M4B";
        }
        if (title.contains("M4A")) {
            return "M4A";
        }
        if (title.contains("MP3")) {
            return "MP3";
        }
        if (title.contains("FLAC")) {
            return "FLAC";
        }
        return "OTHER";
    }

    private List<String> notes(TorrentCandidate candidate, ScoreBreakdown breakdown, Integer runtimeMinutes) {
        List<String> notes = new ArrayList<>();
        String format = detectFormat(candidate);
        switch (format) {
            case "M4B":
                notes.add("Excellent format (M4B)");
                if (!Boolean.FALSE.equals(candidate.getHasChapters())) {
                    notes.add("Has chapter markers");
                }
                break;
            case "FLAC":
                notes.add("Lossless format (FLAC)");
                break;
            case "M4A":
                notes.add("Good format (M4A)");
                break;
            case "MP3":
                notes.add("Acceptable format (MP3)");
                break;
            default:
                notes.add("Unknown or uncommon format");
        }
        if (runtimeMinutes == null || runtimeMinutes <= 0) {
            notes.add("Runtime unknown, size not scored");
        } else {
            double mbPerMinute = (candidate.getSize() / BYTES_PER_MB) / runtimeMinutes;
            if (mbPerMinute > properties.getMaxMbPerMinute()) {
                notes.add("Unusually large for runtime, may be a bundle");
            } else if (mbPerMinute >= 1.5D) {
                notes.add("Premium quality (high bitrate)");
            } else if (mbPerMinute >= 1.0D) {
                notes.add("High quality");
            } else if (mbPerMinute >= 0.5D) {
                notes.add("Standard quality");
            } else if (mbPerMinute >= 0.3D) {
                notes.add("Low quality (low bitrate)");
            } else {
                notes.add("Very low quality, may be an ebook");
            }
        }
        Integer seeders = candidate.getSeeders();
        if (seeders != null) {
            if (seeders == 0) {
                notes.add("No seeders available");
            } else if (seeders < 5) {
                notes.add("Low seeders (" + seeders + ")");
            } else if (seeders >= 50) {
                notes.add("Excellent availability (" + seeders + " seeders)");
            }
        }
        double matchShare = breakdown.getMatchScore() / Math.max(1D, properties.getMatchWeight());
        if (matchShare < 0.4D) {
            notes.add("Poor title/author match");
        } else if (matchShare < 0.7D) {
            notes.add("Weak title/author match");
        } else if (matchShare >= 0.9D) {
            notes.add("Excellent title/author match");
        }
        return notes;
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String result = CAMEL_CASE.matcher(text).replaceAll("$1 $2").toLowerCase(Locale.ROOT);
        result = DIACRITICS.matcher(Normalizer.normalize(result, Normalizer.Form.NFD)).replaceAll("");
        result = result.replace('_', ' ');
        result = NON_WORD.matcher(result).replaceAll(" ");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    private static List<String> extractWords(String text) {
        List<String> words = new ArrayList<>();
        for (String word : normalize(text).split("\\s+")) {
            if (!word.isEmpty() && !STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    private static boolean endsWithSeparator(String text) {
        return text.endsWith("-") || text.endsWith(":") || text.endsWith("\u2014");
    }

    private static String trimEnd(String value) {
        int end = value.length();
        while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    private static double weighted(double raw, double defaultMax, double weight) {
        return defaultMax == weight ? raw : raw / defaultMax * weight;
    }
}
