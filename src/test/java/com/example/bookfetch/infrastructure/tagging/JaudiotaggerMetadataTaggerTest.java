package com.example.bookfetch.infrastructure.tagging;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.bookfetch.domain.model.BookMetadata;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JaudiotaggerMetadataTaggerTest {

    @TempDir
    Path tempDir;

    private JaudiotaggerMetadataTagger tagger;
    private BookMetadata metadata;

    @BeforeEach
    void setUp() {
        tagger = new JaudiotaggerMetadataTagger();
        metadata = new BookMetadata();
        metadata.setTitle("Project Hail Mary");
        metadata.setAuthor("Andy Weir");
    }

    @Test
    void tagCopyShouldGiveSameNamedSourcesTheirOwnCopy() throws Exception {
        Path first = writeMpeg(tempDir.resolve("CD1").resolve("Track01.mp3"), (byte) 0x11);
        Path second = writeMpeg(tempDir.resolve("CD2").resolve("Track01.mp3"), (byte) 0x22);
        Path workDir = tempDir.resolve("work");

        Path firstTagged = tagger.tagCopy(first, metadata, workDir);
        Path secondTagged = tagger.tagCopy(second, metadata, workDir);

        assertNotEquals(firstTagged, secondTagged);
        assertEquals("Track01.mp3", firstTagged.getFileName().toString());
        assertEquals((byte) 0x11, lastByte(firstTagged));
        assertEquals((byte) 0x22, lastByte(secondTagged));
    }

    @Test
    void tagCopyShouldWriteBookFieldsAndLeaveSourceUntouched() throws Exception {
        Path source = writeMpeg(tempDir.resolve("book.mp3"), (byte) 0x33);
        byte[] before = Files.readAllBytes(source);

        Path tagged = tagger.tagCopy(source, metadata, tempDir.resolve("work"));

        assertEquals("Project Hail Mary",
                AudioFileIO.read(tagged.toFile()).getTag().getFirst(FieldKey.ALBUM));
        assertEquals("Andy Weir",
                AudioFileIO.read(tagged.toFile()).getTag().getFirst(FieldKey.ALBUM_ARTIST));
        assertArrayEquals(before, Files.readAllBytes(source));
    }

    @Test
    void supportsShouldFollowTaggableFormats() {
        assertTrue(tagger.supports(tempDir.resolve("book.m4b")));
        assertTrue(tagger.supports(tempDir.resolve("part.MP3")));
        assertFalse(tagger.supports(tempDir.resolve("book.ogg")));
    }

    private static byte lastByte(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return bytes[bytes.length - 1];
    }

    /**
     * MPEG-1 Layer III frames at 128 kbps and 44.1 kHz, payload filled with {@code fill}.
     */
    private static Path writeMpeg(Path file, byte fill) throws IOException {
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
        return Files.write(file, bytes);
    }
}
