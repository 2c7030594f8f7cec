package com.example.bookfetch.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.organize")
public class AppOrganizeProperties {

    private String mediaDir = "/media/audiobooks";

    private String tempDir = System.getProperty("java.io.tmpdir");

    private String pathTemplate = "{author}/{title} {asin}";

    private boolean chapterMergeEnabled = false;

    private boolean metadataTaggingEnabled = true;

    private boolean fileRenameEnabled = false;

    private String fileRenameTemplate = "{title}";

    private int maxImportRetries = 5;

    private String ffmpegPath = "ffmpeg";

    private int ffmpegTimeoutMinutes = 120;

    private int coverDownloadMaxBytes = 10 * 1024 * 1024;

    private int coverConnectTimeoutMs = 5000;

    private int coverSocketTimeoutMs = 15000;
}
