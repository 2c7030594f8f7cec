package com.example.bookfetch.application.organize;

import com.example.bookfetch.application.service.PathTemplateEngine;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.config.AppOrganizeProperties;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.AudioFormat;
import com.example.bookfetch.domain.model.BookMetadata;
import com.example.bookfetch.domain.model.OrganizeResult;
import com.example.bookfetch.domain.model.TemplateValidationResult;
import com.example.bookfetch.infrastructure.http.CoverArtDownloader;
import com.example.bookfetch.infrastructure.media.ChapterMerger;
import com.example.bookfetch.infrastructure.media.FfmpegChapterMerger;
import com.example.bookfetch.infrastructure.tagging.MetadataTagger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves a finished download into the library layout: discover, optional chapter merge, optional
 * tagging, render the target directory, copy through the {@link CopyChain}, then cover art.
 *
 * <p>Success means at least one audio file is at its target. Cover art and tagging problems are
 * reported in {@link OrganizeResult#getErrors()} and never flip the outcome.
 */
@Service
public class FileOrganizer {

    private static final Logger log = LoggerFactory.getLogger(FileOrganizer.class);

    private final PathTemplateEngine pathTemplateEngine;
    private final PipelineSettings pipelineSettings;
    private final MetadataTagger metadataTagger;
    private final ChapterMerger chapterMerger;
    private final CoverArtDownloader coverArtDownloader;
    private final FileCopier fileCopier;
    private final AppOrganizeProperties appOrganizeProperties;
    private final CopyChain copyChain;

    public FileOrganizer(PathTemplateEngine pathTemplateEngine,
                         PipelineSettings pipelineSettings,
                         MetadataTagger metadataTagger,
                         ChapterMerger chapterMerger,
                         CoverArtDownloader coverArtDownloader,
                         FileCopier fileCopier,
                         AppOrganizeProperties appOrganizeProperties) {
        this.pathTemplateEngine = pathTemplateEngine;
        this.pipelineSettings = pipelineSettings;
        this.metadataTagger = metadataTagger;
        this.chapterMerger = chapterMerger;
        this.coverArtDownloader = coverArtDownloader;
        this.fileCopier = fileCopier;
        this.appOrganizeProperties = appOrganizeProperties;
        this.copyChain = CopyChain.taggedThenUntagged(fileCopier);
    }

    /**
     * @throws IllegalArgumentException when the template is invalid or renders outside the library
     */
    public OrganizeResult organize(String sourcePath, BookMetadata metadata, String pathTemplate) {
        TemplateValidationResult validation = pathTemplateEngine.validateTemplate(pathTemplate);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid path template: " + validation.getError());
        }

        OrganizeResult result = new OrganizeResult();
        Path source = Paths.get(sourcePath);
        if (!Files.exists(source)) {
            return fail(result, "Source path does not exist: " + sourcePath);
        }

        Discovery discovery;
        try {
            discovery = discover(source);
        } catch (IOException e) {
            return fail(result, "Cannot read source " + sourcePath + ": " + TextUtil.messageOf(e));
        }
        if (discovery.files.isEmpty()) {
            return fail(result, "No audiobook files found in " + sourcePath);
        }
        log.info("ORGANIZE_DISCOVERED source={} audioFiles={} cover={}",
                sourcePath, discovery.files.size(), discovery.cover);

        Path workDir = null;
        try {
            workDir = createWorkDir(result);
            List<SourceFile> files = discovery.files;
            if (workDir != null) {
                files = mergeChapters(files, metadata, workDir, result);
                tagFiles(files, metadata, workDir, result);
            }

            Path targetDir = resolveTargetDir(pathTemplate, metadata);
            try {
                Files.createDirectories(targetDir);
            } catch (IOException e) {
                return fail(result, "Cannot create target directory " + targetDir + ": " + TextUtil.messageOf(e));
            }
            result.setTargetPath(targetDir.toString());

            applyRenames(files, metadata);
            for (SourceFile file : files) {
                CopyOutcome outcome = copyChain.place(file, targetDir.resolve(file.targetName));
                switch (outcome.getStatus()) {
                    case COPIED:
                        result.setFilesMovedCount(result.getFilesMovedCount() + 1);
                        result.getAudioFiles().add(outcome.getTarget().toString());
                        if (outcome.getNote() != null) {
                            result.getNotes().add(outcome.getNote());
                        }
                        break;
                    case ALREADY_PRESENT:
                        result.setAlreadyPresentCount(result.getAlreadyPresentCount() + 1);
                        result.getAudioFiles().add(outcome.getTarget().toString());
                        break;
                    default:
                        result.getErrors().add(outcome.getError());
                }
            }

            placeCover(discovery.cover, metadata, targetDir, result);

            if (result.getAudioFiles().isEmpty()) {
                return fail(result, "No audio files were successfully copied");
            }
            result.setSuccess(true);
            log.info("ORGANIZE_DONE target={} copied={} alreadyPresent={} errors={}",
                    targetDir, result.getFilesMovedCount(), result.getAlreadyPresentCount(), result.getErrors().size());
            return result;
        } finally {
            deleteQuietly(workDir);
        }
    }

    Discovery discover(Path source) throws IOException {
        Discovery discovery = new Discovery();
        if (Files.isRegularFile(source)) {
            String name = source.getFileName().toString();
            if (AudioFormat.isAudioFile(name)) {
                discovery.files.add(new SourceFile(source, name, name));
            }
            return discovery;
        }

        List<Path> entries;
        try (Stream<Path> walk = Files.walk(source)) {
            entries = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        }
        Path shallowestCover = null;
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            String relative = source.relativize(entry).toString().replace('\\', '/');
            if (AudioFormat.isAudioFile(name)) {
                discovery.files.add(new SourceFile(entry, relative, name));
            } else if (AudioFormat.isCoverFile(name)
                    && (shallowestCover == null || entry.getNameCount() < shallowestCover.getNameCount())) {
                shallowestCover = entry;
            }
        }
        discovery.cover = shallowestCover;

        Map<String, Integer> nameCounts = new HashMap<>();
        for (SourceFile file : discovery.files) {
            nameCounts.merge(file.targetName.toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        for (SourceFile file : discovery.files) {
            if (nameCounts.get(file.targetName.toLowerCase(Locale.ROOT)) > 1) {
                // CD1/Track01.mp3 -> CD1-Track01.mp3
                file.targetName = file.relativePath.replace('/', '-');
            }
        }
        discovery.files.sort(Comparator.comparing(
                (SourceFile f) -> f.relativePath, FfmpegChapterMerger::naturalCompare));
        return discovery;
    }

    private List<SourceFile> mergeChapters(List<SourceFile> files, BookMetadata metadata, Path workDir,
                                           OrganizeResult result) {
        if (!pipelineSettings.chapterMergeEnabled() || files.size() < 2) {
            return files;
        }
        boolean mergeable = files.stream()
                .allMatch(f -> AudioFormat.CHAPTER_MERGE_FORMATS.contains(AudioFormat.extensionOf(f.targetName)));
        if (!mergeable) {
            result.getNotes().add("Chapter merge skipped: mixed or unsupported formats");
            return files;
        }
        if (!chapterMerger.isAvailable()) {
            result.getNotes().add("Chapter merge skipped: ffmpeg not available");
            return files;
        }
        List<Path> parts = files.stream().map(f -> f.path).collect(Collectors.toList());
        try {
            Path merged = chapterMerger.merge(parts, metadata, workDir);
            String name = merged.getFileName().toString();
            List<SourceFile> single = new ArrayList<>();
            single.add(new SourceFile(merged, name, name));
            result.getNotes().add("Merged " + files.size() + " files into " + name);
            log.info("ORGANIZE_MERGED parts={} output={}", files.size(), merged);
            return single;
        } catch (Exception e) {
            log.warn("ORGANIZE_MERGE_FAILED parts={} error={}", files.size(), e.getMessage());
            result.getNotes().add("Chapter merge failed, keeping " + files.size() + " files: "
                    + TextUtil.messageOf(e));
            return files;
        }
    }

    private void tagFiles(List<SourceFile> files, BookMetadata metadata, Path workDir, OrganizeResult result) {
        if (!pipelineSettings.metadataTaggingEnabled()) {
            return;
        }
        if (!metadataTagger.isAvailable()) {
            result.getNotes().add("Metadata tagging skipped: tagger not available");
            return;
        }
        for (SourceFile file : files) {
            if (!metadataTagger.supports(file.path)) {
                continue;
            }
            try {
                file.tagged = metadataTagger.tagCopy(file.path, metadata, workDir);
            } catch (Exception e) {
                log.warn("ORGANIZE_TAG_FAILED file={} error={}", file.path, e.getMessage());
                result.getErrors().add("Failed to tag " + file.targetName + ": " + TextUtil.messageOf(e));
            }
        }
    }

    private Path resolveTargetDir(String pathTemplate, BookMetadata metadata) {
        Map<String, String> variables = metadata.toTemplateVariables();
        String relative = pathTemplateEngine.substitute(pathTemplate, variables);
        if (relative.isEmpty()) {
            relative = pathTemplateEngine.substitute(PathTemplateEngine.DEFAULT_TEMPLATE, variables);
        }
        if (relative.isEmpty()) {
            relative = "Unknown";
        }
        Path root = Paths.get(pipelineSettings.mediaDir()).toAbsolutePath().normalize();
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Rendered path escapes the library root: " + relative);
        }
        return target;
    }

    private void applyRenames(List<SourceFile> files, BookMetadata metadata) {
        if (!pipelineSettings.fileRenameEnabled()) {
            return;
        }
        String template = pipelineSettings.fileRenameTemplate();
        TemplateValidationResult validation = pathTemplateEngine.validateFilenameTemplate(template);
        if (!validation.isValid()) {
            log.warn("ORGANIZE_RENAME_SKIPPED template={} error={}", template, validation.getError());
            return;
        }
        Map<String, String> variables = metadata.toTemplateVariables();
        for (int i = 0; i < files.size(); i++) {
            SourceFile file = files.get(i);
            Integer index = files.size() > 1 ? i + 1 : null;
            file.targetName = pathTemplateEngine.buildRenamedFilename(
                    template, variables, AudioFormat.extensionOf(file.targetName), index);
        }
    }

    /**
     * Source directory cover first, then the cached cover, then the remote URL.
     */
    private void placeCover(Path sourceCover, BookMetadata metadata, Path targetDir, OrganizeResult result) {
        try {
            if (sourceCover != null) {
                Path target = targetDir.resolve("cover." + AudioFormat.extensionOf(sourceCover.getFileName().toString()));
                if (!Files.exists(target)) {
                    fileCopier.copy(sourceCover, target);
                }
                result.setCoverArtFile(target.toString());
                return;
            }
            if (!TextUtil.isBlank(metadata.getCachedCoverPath())) {
                Path cached = Paths.get(metadata.getCachedCoverPath());
                if (Files.isRegularFile(cached)) {
                    String ext = AudioFormat.extensionOf(cached.getFileName().toString());
                    Path target = targetDir.resolve("cover." + (ext.isEmpty() ? "jpg" : ext));
                    if (!Files.exists(target)) {
                        fileCopier.copy(cached, target);
                    }
                    result.setCoverArtFile(target.toString());
                    return;
                }
            }
            if (!TextUtil.isBlank(metadata.getCoverArtUrl())) {
                Path target = targetDir.resolve("cover.jpg");
                if (!Files.exists(target)) {
                    coverArtDownloader.download(metadata.getCoverArtUrl(), target);
                }
                result.setCoverArtFile(target.toString());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("ORGANIZE_COVER_FAILED target={} error={}", targetDir, e.getMessage());
            result.getErrors().add("Failed to save cover art: " + TextUtil.messageOf(e));
        }
    }

    private Path createWorkDir(OrganizeResult result) {
        try {
            Path base = Paths.get(appOrganizeProperties.getTempDir());
            Files.createDirectories(base);
            return Files.createTempDirectory(base, "organize-");
        } catch (IOException e) {
            log.warn("ORGANIZE_WORKDIR_FAILED tempDir={} error={}", appOrganizeProperties.getTempDir(), e.getMessage());
            result.getNotes().add("Merge and tagging skipped: no temp directory");
            return null;
        }
    }

    private static OrganizeResult fail(OrganizeResult result, String error) {
        result.setSuccess(false);
        result.getErrors().add(error);
        log.warn("ORGANIZE_FAILED error={}", error);
        return result;
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Temp directory cleanup failed, dir={}", dir, e);
        }
    }

    static final class Discovery {

        private final List<SourceFile> files = new ArrayList<>();
        private Path cover;

        List<SourceFile> getFiles() {
            return files;
        }

        Path getCover() {
            return cover;
        }
    }

    static final class SourceFile {

        private final Path path;
        private final String relativePath;
        private String targetName;
        private Path tagged;

        SourceFile(Path path, String relativePath, String targetName) {
            this.path = path;
            this.relativePath = relativePath;
            this.targetName = targetName;
        }

        Path getPath() {
            return path;
        }

        String getTargetName() {
            return targetName;
        }

        Path getTagged() {
            return tagged;
        }

        void setTagged(Path tagged) {
            this.tagged = tagged;
        }
    }
}
