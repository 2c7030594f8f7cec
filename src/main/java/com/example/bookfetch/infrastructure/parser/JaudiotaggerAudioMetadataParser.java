package com.example.bookfetch.infrastructure.parser;

import com.example.bookfetch.domain.model.AudioTrackInfo;
import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");

    @Override
    public AudioTrackInfo parse(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        AudioTrackInfo info = new AudioTrackInfo();
        info.setTitle(safeTagValue(tag, FieldKey.TITLE));
        info.setTrackNo(parseInteger(safeTagValue(tag, FieldKey.TRACK)));
        info.setDiscNo(parseInteger(safeTagValue(tag, FieldKey.DISC_NO)));
        if (header != null) {
            info.setDurationSec(header.getTrackLength());
            info.setBitrate(parseInteger(header.getBitRate()));
        }
        return info;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value = tag.getFirst(fieldKey);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
