package com.example.bookfetch.infrastructure.media;

import com.example.bookfetch.common.config.AppOrganizeProperties;
import com.example.bookfetch.domain.model.AudioTrackInfo;
import com.example.bookfetch.domain.model.BookMetadata;
import com.example.bookfetch.infrastructure.parser.AudioMetadataParser;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges parts with the ffmpeg concat demuxer and writes one chapter per part into an m4b.
 */
@Component
public class FfmpegChapterMerger implements ChapterMerger {

    private static final Logger log = LoggerFactory.getLogger(FfmpegChapterMerger.class);

    private static final Pattern NUMBER_CHUNK = Pattern.compile("(\\d+)|(\\D+)");

    private final AppOrganizeProperties appOrganizeProperties;
    private final AudioMetadataParser audioMetadataParser;
    private volatile Boolean available;

    public FfmpegChapterMerger(AppOrganizeProperties appOrganizeProperties, AudioMetadataParser audioMetadataParser) {
        this.appOrganizeProperties = appOrganizeProperties;
        this.audioMetadataParser = audioMetadataParser;
    }

    @Override
    public boolean isAvailable() {
        Boolean cached = available;
        if (cached != null) {
            return cached;
        }
        boolean result;
        try {
            Process process = new ProcessBuilder(appOrganizeProperties.getFfmpegPath(), "-version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            result = process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
            if (!result) {
                process.destroy();
            }
        } catch (IOException e) {
            log.info("ffmpeg not found at {}, chapter merge disabled", appOrganizeProperties.getFfmpegPath());
            result = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = false;
        }
        available = result;
        return result;
    }

    @Override
    public Path merge(List<Path> parts, BookMetadata metadata, Path workDir) throws Exception {
        if (parts.size() < 2) {
            throw new IllegalArgumentException("Chapter merge needs at least two parts");
        }
        Files.createDirectories(workDir);
        List<Chapter> chapters = orderParts(parts);

        Path listFile = workDir.resolve("concat.txt");
        Path metadataFile = workDir.resolve("chapters.txt");
        Path output = workDir.resolve(outputName(metadata));
        Files.write(listFile, concatList(chapters), StandardCharsets.UTF_8);
        Files.write(metadataFile, ffMetadata(chapters, metadata).getBytes(StandardCharsets.UTF_8));

        List<String> command = new ArrayList<>(Arrays.asList(
                appOrganizeProperties.getFfmpegPath(), "-y", "-hide_banner", "-loglevel", "error",
                "-f", "concat", "-safe", "0", "-i", listFile.toString(),
                "-i", metadataFile.toString(),
                "-map", "0:a", "-map_metadata", "1",
                "-c:a", "aac", "-b:a", "64k",
                "-f", "mp4", output.toString()));
        log.info("CHAPTER_MERGE_START parts={} output={}", chapters.size(), output);

        File processLog = workDir.resolve("ffmpeg.log").toFile();
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(processLog)
                .start();
        int timeoutMinutes = appOrganizeProperties.getFfmpegTimeoutMinutes();
        boolean completed = process.waitFor(timeoutMinutes, TimeUnit.MINUTES);
        if (!completed) {
            process.destroyForcibly();
            throw new IOException("ffmpeg timed out after " + timeoutMinutes + " minutes");
        }
        if (process.exitValue() != 0) {
            String logText = new String(Files.readAllBytes(processLog.toPath()), StandardCharsets.UTF_8);
            throw new IOException("ffmpeg exited with code " + process.exitValue() + ": " + lastLine(logText));
        }
        log.info("CHAPTER_MERGE_DONE parts={} output={} bytes={}", chapters.size(), output, Files.size(output));
        return output;
    }

    List<Chapter> orderParts(List<Path> parts) {
        List<Chapter> chapters = new ArrayList<>();
        for (Path part : parts) {
            AudioTrackInfo info;
            try {
                info = audioMetadataParser.parse(part.toFile());
            } catch (Exception e) {
                log.debug("Part metadata unreadable, ordering by name, file={}", part, e);
                info = new AudioTrackInfo();
            }
            chapters.add(new Chapter(part, info));
        }
        boolean allNumbered = chapters.stream().allMatch(c -> c.info.getTrackNo() != null);
        Comparator<Chapter> byName = (a, b) -> naturalCompare(
                a.path.getFileName().toString(), b.path.getFileName().toString());
        if (allNumbered) {
            chapters.sort(Comparator.<Chapter>comparingInt(c -> c.info.getDiscNo() == null ? 0 : c.info.getDiscNo())
                    .thenComparingInt(c -> c.info.getTrackNo())
                    .thenComparing(byName));
        } else {
            chapters.sort(byName);
        }
        return chapters;
    }

    private List<String> concatList(List<Chapter> chapters) {
        List<String> lines = new ArrayList<>();
        for (Chapter chapter : chapters) {
            String escaped = chapter.path.toAbsolutePath().toString().replace("'", "'\\''");
            lines.add("file '" + escaped + "'");
        }
        return lines;
    }

    private String ffMetadata(List<Chapter> chapters, BookMetadata metadata) {
        StringBuilder sb = new StringBuilder(";FFMETADATA1\n");
        appendMeta(sb, "title", metadata.getTitle());
        appendMeta(sb, "album", metadata.getTitle());
        appendMeta(sb, "artist", metadata.getAuthor());
        appendMeta(sb, "album_artist", metadata.getAuthor());
        appendMeta(sb, "composer", metadata.getNarrator());
        long startMs = 0L;
        int index = 1;
        for (Chapter chapter : chapters) {
            Integer durationSec = chapter.info.getDurationSec();
            long endMs = startMs + (durationSec == null || durationSec <= 0 ? 1000L : durationSec * 1000L);
            sb.append("[CHAPTER]\nTIMEBASE=1/1000\n")
                    .append("START=").append(startMs).append('\n')
                    .append("END=").append(endMs).append('\n');
            String title = chapter.info.getTitle();
            appendMeta(sb, "title", title == null || title.trim().isEmpty() ? "Chapter " + index : title);
            startMs = endMs;
            index++;
        }
        return sb.toString();
    }

    private void appendMeta(StringBuilder sb, String key, String value) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        String escaped = value.replaceAll("([=;#\\\\\\n])", "\\\\$1");
        sb.append(key).append('=').append(escaped).append('\n');
    }

    private String outputName(BookMetadata metadata) {
        String base = metadata.getTitle() == null ? "merged" : metadata.getTitle().replaceAll("[<>:\"/\\\\|?*]", "").trim();
        return (base.isEmpty() ? "merged" : base) + ".m4b";
    }

    private String lastLine(String text) {
        String trimmed = text.trim();
        int idx = trimmed.lastIndexOf('\n');
        return idx < 0 ? trimmed : trimmed.substring(idx + 1);
    }

    public static int naturalCompare(String a, String b) {
        Matcher ma = NUMBER_CHUNK.matcher(a.toLowerCase());
        Matcher mb = NUMBER_CHUNK.matcher(b.toLowerCase());
        while (ma.find() && mb.find()) {
            String ca = ma.group();
            String cb = mb.group();
            int result;
            if (ma.group(1) != null && mb.group(1) != null) {
                result = Long.compare(Long.parseLong(trimNumber(ca)), Long.parseLong(trimNumber(cb)));
            } else {
                result = ca.compareTo(cb);
            }
            if (result != 0) {
                return result;
            }
        }
        return a.length() - b.length();
    }

    private static String trimNumber(String digits) {
        return digits.length() > 18 ? digits.substring(digits.length() - 18) : digits;
    }

    static class Chapter {

        private final Path path;
        private final AudioTrackInfo info;

        Chapter(Path path, AudioTrackInfo info) {
            this.path = path;
            this.info = info;
        }

        Path getPath() {
            return path;
        }
    }
}
