package com.example.bookfetch.infrastructure.tagging;

import com.example.bookfetch.domain.AudioFormat;
import com.example.bookfetch.domain.model.BookMetadata;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerMetadataTagger implements MetadataTagger {

    private static final Logger log = LoggerFactory.getLogger(JaudiotaggerMetadataTagger.class);

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public boolean supports(Path audioFile) {
        return AudioFormat.METADATA_TAG_FORMATS.contains(AudioFormat.extensionOf(audioFile.getFileName().toString()));
    }

    @Override
    public Path tagCopy(Path source, BookMetadata metadata, Path workDir) throws Exception {
        Files.createDirectories(workDir);
        // one directory per copy: sources from different disc folders often share a file name
        Path copyDir = Files.createTempDirectory(workDir, "tag-");
        Path target = copyDir.resolve(source.getFileName().toString());
        Files.copy(source, target);
        try {
            AudioFile audioFile = AudioFileIO.read(target.toFile());
            Tag tag = audioFile.getTagOrCreateAndSetDefault();
            setIfPresent(tag, FieldKey.ALBUM, metadata.getTitle());
            setIfPresent(tag, FieldKey.ALBUM_ARTIST, metadata.getAuthor());
            setIfPresent(tag, FieldKey.ARTIST, metadata.getAuthor());
            setIfPresent(tag, FieldKey.COMPOSER, metadata.getNarrator());
            setIfPresent(tag, FieldKey.GROUPING, metadata.getSeries());
            if (metadata.getYear() != null) {
                tag.setField(FieldKey.YEAR, String.valueOf(metadata.getYear()));
            }
            if (isBlank(tag.getFirst(FieldKey.TITLE))) {
                setIfPresent(tag, FieldKey.TITLE, metadata.getTitle());
            }
            audioFile.commit();
            log.debug("Tagged copy written, source={}, target={}", source, target);
            return target;
        } catch (Exception e) {
            Files.deleteIfExists(target);
            Files.deleteIfExists(copyDir);
            throw e;
        }
    }

    private void setIfPresent(Tag tag, FieldKey key, String value) throws Exception {
        if (!isBlank(value)) {
            tag.setField(key, value.trim());
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
