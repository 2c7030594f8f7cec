package com.example.bookfetch.infrastructure.parser;

import com.example.bookfetch.domain.model.AudioTrackInfo;
import java.io.File;

public interface AudioMetadataParser {

    AudioTrackInfo parse(File audioFile) throws Exception;
}
