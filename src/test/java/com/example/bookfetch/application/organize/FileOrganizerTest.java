package com.example.bookfetch.application.organize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bookfetch.application.service.PathTemplateEngine;
import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.config.AppOrganizeProperties;
import com.example.bookfetch.domain.model.BookMetadata;
import com.example.bookfetch.domain.model.OrganizeResult;
import com.example.bookfetch.infrastructure.http.CoverArtDownloader;
import com.example.bookfetch.infrastructure.media.ChapterMerger;
import com.example.bookfetch.infrastructure.tagging.JaudiotaggerMetadataTagger;
import com.example.bookfetch.infrastructure.tagging.MetadataTagger;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileOrganizerTest {

    private static final String TEMPLATE = "{author}/{title}";

    @TempDir
    Path tempDir;

    private Path source;
    private Path library;
    private PipelineSettings pipelineSettings;
    private AppOrganizeProperties properties;
    private BookMetadata metadata;
    private MetadataTagger metadataTagger;
    private ChapterMerger chapterMerger;

    @BeforeEach
    void setUp() throws IOException {
        source = Files.createDirectories(tempDir.resolve("downloads").resolve("Project Hail Mary"));
        library = Files.createDirectories(tempDir.resolve("library"));

        pipelineSettings = mock(PipelineSettings.class);
        when(pipelineSettings.mediaDir()).thenReturn(library.toString());
        when(pipelineSettings.chapterMergeEnabled()).thenReturn(false);
        when(pipelineSettings.metadataTaggingEnabled()).thenReturn(false);
        when(pipelineSettings.fileRenameEnabled()).thenReturn(false);

        properties = new AppOrganizeProperties();
        properties.setTempDir(tempDir.resolve("work").toString());

        metadataTagger = mock(MetadataTagger.class);
        chapterMerger = mock(ChapterMerger.class);

        metadata = new BookMetadata();
        metadata.setTitle("Project Hail Mary");
        metadata.setAuthor("Andy Weir");
    }

    @Test
    void organizeShouldCopyAudioAndCoverIntoRenderedDirectory() throws IOException {
        write(source.resolve("01.mp3"));
        write(source.resolve("02.mp3"));
        write(source.resolve("cover.jpg"));
        write(source.resolve("notes.nfo"));

        OrganizeResult result = organizer(new NioFileCopier()).organize(source.toString(), metadata, TEMPLATE);

        Path expected = library.resolve("Andy Weir").resolve("Project Hail Mary").toAbsolutePath().normalize();
        assertTrue(result.isSuccess());
        assertEquals(expected.toString(), result.getTargetPath());
        assertEquals(2, result.getFilesMovedCount());
        assertTrue(Files.exists(expected.resolve("01.mp3")));
        assertTrue(Files.exists(expected.resolve("cover.jpg")));
        assertFalse(Files.exists(expected.resolve("notes.nfo")));
        assertEquals(expected.resolve("cover.jpg").toString(), result.getCoverArtFile());
    }

    @Test
    void organizeShouldBeIdempotentWhenRunTwice() throws IOException {
        write(source.resolve("01.mp3"));
        write(source.resolve("02.mp3"));
        FileOrganizer organizer = organizer(new NioFileCopier());

        organizer.organize(source.toString(), metadata, TEMPLATE);
        OrganizeResult second = organizer.organize(source.toString(), metadata, TEMPLATE);

        assertTrue(second.isSuccess());
        assertEquals(0, second.getFilesMovedCount());
        assertEquals(2, second.getAlreadyPresentCount());
        assertEquals(2, second.getAudioFiles().size());
    }

    @Test
    void organizeShouldSucceedWhenSomeCopiesFail() throws IOException {
        write(source.resolve("01.mp3"));
        write(source.resolve("02.mp3"));
        NioFileCopier delegate = new NioFileCopier();
        FileCopier flaky = (from, to) -> {
            if ("02.mp3".equals(from.getFileName().toString())) {
                throw new IOException("disk full");
            }
            delegate.copy(from, to);
        };

        OrganizeResult result = organizer(flaky).organize(source.toString(), metadata, TEMPLATE);

        Path target = library.resolve("Andy Weir").resolve("Project Hail Mary").toAbsolutePath().normalize();
        assertTrue(result.isSuccess());
        assertEquals(1, result.getFilesMovedCount());
        assertEquals(Collections.singletonList(target.resolve("01.mp3").toString()), result.getAudioFiles());
        assertTrue(result.getErrors().stream().anyMatch(e -> e.startsWith("Failed to copy 02.mp3")));
    }

    @Test
    void organizeShouldFailWhenNoAudioFileCouldBeCopied() throws IOException {
        write(source.resolve("01.mp3"));
        FileCopier broken = (from, to) -> {
            throw new IOException("read-only file system");
        };

        OrganizeResult result = organizer(broken).organize(source.toString(), metadata, TEMPLATE);

        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().contains("No audio files were successfully copied"));
    }

    @Test
    void organizeShouldFlattenDiscFoldersWithCollidingNames() throws IOException {
        write(source.resolve("CD1").resolve("Track01.mp3"));
        write(source.resolve("CD2").resolve("Track01.mp3"));

        OrganizeResult result = organizer(new NioFileCopier()).organize(source.toString(), metadata, TEMPLATE);

        Path target = library.resolve("Andy Weir").resolve("Project Hail Mary").toAbsolutePath().normalize();
        assertTrue(result.isSuccess());
        assertTrue(Files.exists(target.resolve("CD1-Track01.mp3")));
        assertTrue(Files.exists(target.resolve("CD2-Track01.mp3")));
    }

    @Test
    void organizeShouldKeepSameNamedDiscTracksDistinctWhenTagging() throws IOException {
        writeMpeg(source.resolve("CD1").resolve("Track01.mp3"), (byte) 0x11);
        writeMpeg(source.resolve("CD2").resolve("Track01.mp3"), (byte) 0x22);
        when(pipelineSettings.metadataTaggingEnabled()).thenReturn(true);
        FileOrganizer organizer = new FileOrganizer(new PathTemplateEngine(), pipelineSettings,
                new JaudiotaggerMetadataTagger(), mock(ChapterMerger.class), mock(CoverArtDownloader.class),
                new NioFileCopier(), properties);

        OrganizeResult result = organizer.organize(source.toString(), metadata, TEMPLATE);

        Path target = library.resolve("Andy Weir").resolve("Project Hail Mary").toAbsolutePath().normalize();
        assertTrue(result.isSuccess());
        assertEquals(Collections.emptyList(), result.getErrors());
        assertEquals((byte) 0x11, lastByte(target.resolve("CD1-Track01.mp3")));
        assertEquals((byte) 0x22, lastByte(target.resolve("CD2-Track01.mp3")));
    }

    @Test
    void organizeShouldKeepSeparateFilesWhenChapterMergeFails() throws Exception {
        write(source.resolve("01.mp3"));
        write(source.resolve("02.mp3"));
        when(pipelineSettings.chapterMergeEnabled()).thenReturn(true);
        when(chapterMerger.isAvailable()).thenReturn(true);
        when(chapterMerger.merge(anyList(), any(BookMetadata.class), any(Path.class)))
                .thenThrow(new IOException("ffmpeg exited with 1"));

        OrganizeResult result = organizer(new NioFileCopier()).organize(source.toString(), metadata, TEMPLATE);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getFilesMovedCount());
        assertTrue(result.getNotes().contains("Chapter merge failed, keeping 2 files: ffmpeg exited with 1"));
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void organizeShouldRecordTagFailureAndTagRemainingFiles() throws Exception {
        write(source.resolve("01.mp3"));
        write(source.resolve("02.mp3"));
        Path tagged = tempDir.resolve("tagged").resolve("02.mp3");
        Files.createDirectories(tagged.getParent());
        Files.write(tagged, "tagged 02".getBytes(StandardCharsets.UTF_8));
        when(pipelineSettings.metadataTaggingEnabled()).thenReturn(true);
        when(metadataTagger.isAvailable()).thenReturn(true);
        when(metadataTagger.supports(any(Path.class))).thenReturn(true);
        when(metadataTagger.tagCopy(eq(source.resolve("01.mp3")), any(BookMetadata.class), any(Path.class)))
                .thenThrow(new IOException("corrupt frame"));
        when(metadataTagger.tagCopy(eq(source.resolve("02.mp3")), any(BookMetadata.class), any(Path.class)))
                .thenReturn(tagged);

        OrganizeResult result = organizer(new NioFileCopier()).organize(source.toString(), metadata, TEMPLATE);

        Path target = library.resolve("Andy Weir").resolve("Project Hail Mary").toAbsolutePath().normalize();
        assertTrue(result.isSuccess());
        assertEquals(2, result.getFilesMovedCount());
        assertEquals(Collections.singletonList("Failed to tag 01.mp3: corrupt frame"), result.getErrors());
        assertEquals("audio 01.mp3", read(target.resolve("01.mp3")));
        assertEquals("tagged 02", read(target.resolve("02.mp3")));
    }

    @Test
    void organizeShouldOnlyNoteUnavailableTagger() throws Exception {
        write(source.resolve("01.mp3"));
        when(pipelineSettings.metadataTaggingEnabled()).thenReturn(true);
        when(metadataTagger.isAvailable()).thenReturn(false);

        OrganizeResult result = organizer(new NioFileCopier()).organize(source.toString(), metadata, TEMPLATE);

        assertTrue(result.isSuccess());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getNotes().contains("Metadata tagging skipped: tagger not available"));
        verify(metadataTagger, never()).tagCopy(any(Path.class), any(BookMetadata.class), any(Path.class));
    }

    @Test
    void organizeShouldFallBackToUntaggedWhenTaggedCopyFails() throws Exception {
        write(source.resolve("01.mp3"));
        Path tagged = tempDir.resolve("tagged").resolve("01.mp3");
        Files.createDirectories(tagged.getParent());
        Files.write(tagged, "tagged 01".getBytes(StandardCharsets.UTF_8));
        when(pipelineSettings.metadataTaggingEnabled()).thenReturn(true);
        when(metadataTagger.isAvailable()).thenReturn(true);
        when(metadataTagger.supports(any(Path.class))).thenReturn(true);
        when(metadataTagger.tagCopy(any(Path.class), any(BookMetadata.class), any(Path.class))).thenReturn(tagged);
        NioFileCopier delegate = new NioFileCopier();
        FileCopier rejectsTagged = (from, to) -> {
            if (from.equals(tagged)) {
                throw new IOException("tagged copy unreadable");
            }
            delegate.copy(from, to);
        };

        OrganizeResult result = organizer(rejectsTagged).organize(source.toString(), metadata, TEMPLATE);

        Path target = library.resolve("Andy Weir").resolve("Project Hail Mary").toAbsolutePath().normalize();
        assertTrue(result.isSuccess());
        assertEquals("audio 01.mp3", read(target.resolve("01.mp3")));
        assertTrue(result.getNotes().contains("Tagged copy failed for 01.mp3, used untagged"));
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void organizeShouldAcceptSingleFileSource() throws IOException {
        Path file = tempDir.resolve("downloads").resolve("Project Hail Mary.m4b");
        write(file);

        OrganizeResult result = organizer(new NioFileCopier()).organize(file.toString(), metadata, TEMPLATE);

        assertTrue(result.isSuccess());
        List<String> audioFiles = result.getAudioFiles();
        assertEquals(1, audioFiles.size());
        assertTrue(audioFiles.get(0).endsWith("Project Hail Mary.m4b"));
    }

    @Test
    void organizeShouldReportMissingSource() {
        OrganizeResult result = organizer(new NioFileCopier())
                .organize(tempDir.resolve("nowhere").toString(), metadata, TEMPLATE);

        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().get(0).startsWith("Source path does not exist"));
    }

    @Test
    void organizeShouldReportSourceWithoutAudio() throws IOException {
        write(source.resolve("readme.txt"));

        OrganizeResult result = organizer(new NioFileCopier()).organize(source.toString(), metadata, TEMPLATE);

        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().get(0).startsWith("No audiobook files found"));
    }

    @Test
    void organizeShouldRejectInvalidTemplate() {
        FileOrganizer organizer = organizer(new NioFileCopier());

        assertThrows(IllegalArgumentException.class,
                () -> organizer.organize(source.toString(), metadata, "/absolute/{title}"));
    }

    private FileOrganizer organizer(FileCopier copier) {
        return new FileOrganizer(
                new PathTemplateEngine(),
                pipelineSettings,
                metadataTagger,
                chapterMerger,
                mock(CoverArtDownloader.class),
                copier,
                properties);
    }

    private static void write(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, ("audio " + file.getFileName()).getBytes(StandardCharsets.UTF_8));
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static byte lastByte(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return bytes[bytes.length - 1];
    }

    /**
     * Writes a run of MPEG-1 Layer III frames (128 kbps, 44.1 kHz) whose payload is {@code fill}.
     */
    private static void writeMpeg(Path file, byte fill) throws IOException {
        int frameLength = 417;
        byte[] bytes = new byte[frameLength * 40];
        Arrays.fill(bytes, fill);
        for (int offset = 0; offset < bytes.length; offset += frameLength) {
            bytes[offset] = (byte) 0xFF;
            bytes[offset + 1] = (byte) 0xFB;
            bytes[offset + 2] = (byte) 0x90;
            bytes[offset + 3] = (byte) 0x64;
        }
        Files.createDirectories(file.getParent());
        Files.write(file, bytes);
    }
}
