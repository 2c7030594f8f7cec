package com.example.bookfetch.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Audio file extensions the organizer understands, grouped by what can be done with them.
 */
public final class AudioFormat {

    public static final Set<String> AUDIO_EXTENSIONS = unmodifiable(
            ".m4b", ".m4a", ".mp3", ".mp4", ".aa", ".aax", ".flac", ".ogg");

    /** Formats ffmpeg can concatenate into a single chaptered m4b. */
    public static final Set<String> CHAPTER_MERGE_FORMATS = unmodifiable(
            "mp3", "m4a", "m4b", "mp4", "aac", "flac");

    /** Formats the tagger can write book metadata into. */
    public static final Set<String> METADATA_TAG_FORMATS = unmodifiable(
            "m4b", "m4a", "mp3", "mp4", "flac");

    public static final Set<String> COVER_FILE_NAMES = unmodifiable(
            "cover.jpg", "cover.jpeg", "cover.png", "folder.jpg", "folder.jpeg", "folder.png",
            "front.jpg", "front.jpeg", "front.png", "poster.jpg", "poster.png");

    private AudioFormat() {
    }

    public static boolean isAudioFile(String fileName) {
        return AUDIO_EXTENSIONS.contains("." + extensionOf(fileName));
    }

    public static boolean isCoverFile(String fileName) {
        return fileName != null && COVER_FILE_NAMES.contains(fileName.toLowerCase(Locale.ROOT));
    }

    /** Lower-case extension without the dot, or an empty string. */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static Set<String> unmodifiable(String... values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values)));
    }
}
