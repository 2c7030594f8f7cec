package com.example.bookfetch.application.service;

import com.example.bookfetch.common.config.AppDownloadProperties;
import com.example.bookfetch.common.config.AppOrganizeProperties;
import com.example.bookfetch.infrastructure.config.ConfigStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runtime settings the pipeline reads on every job. Values stored in the configuration table win
 * over application properties, so they can be changed without a restart.
 */
@Component
public class PipelineSettings {

    private static final Logger log = LoggerFactory.getLogger(PipelineSettings.class);

    public static final String KEY_PATH_TEMPLATE = "audiobook_path_template";
    public static final String KEY_FILE_RENAME_ENABLED = "file_rename_enabled";
    public static final String KEY_FILE_RENAME_TEMPLATE = "file_rename_template";
    public static final String KEY_CHAPTER_MERGE_ENABLED = "chapter_merge_enabled";
    public static final String KEY_METADATA_TAGGING_ENABLED = "metadata_tagging_enabled";
    public static final String KEY_MAX_IMPORT_RETRIES = "max_import_retries";
    public static final String KEY_LIBRARY_SCAN_AFTER_IMPORT = "library_scan_after_import";
    public static final String KEY_LIBRARY_ID = "library_id";
    public static final String KEY_DOWNLOAD_DIR = "download_dir";
    public static final String KEY_MEDIA_DIR = "media_dir";
    public static final String KEY_SEEDING_TIME_MINUTES = "seeding_time_minutes";

    private final ConfigStore configStore;
    private final AppOrganizeProperties organizeProperties;
    private final AppDownloadProperties downloadProperties;

    public PipelineSettings(ConfigStore configStore,
                            AppOrganizeProperties organizeProperties,
                            AppDownloadProperties downloadProperties) {
        this.configStore = configStore;
        this.organizeProperties = organizeProperties;
        this.downloadProperties = downloadProperties;
    }

    public String pathTemplate() {
        return configStore.get(KEY_PATH_TEMPLATE).orElse(organizeProperties.getPathTemplate());
    }

    public boolean fileRenameEnabled() {
        return bool(KEY_FILE_RENAME_ENABLED, organizeProperties.isFileRenameEnabled());
    }

    public String fileRenameTemplate() {
        return configStore.get(KEY_FILE_RENAME_TEMPLATE).orElse(organizeProperties.getFileRenameTemplate());
    }

    public boolean chapterMergeEnabled() {
        return bool(KEY_CHAPTER_MERGE_ENABLED, organizeProperties.isChapterMergeEnabled());
    }

    public boolean metadataTaggingEnabled() {
        return bool(KEY_METADATA_TAGGING_ENABLED, organizeProperties.isMetadataTaggingEnabled());
    }

    public int maxImportRetries() {
        return integer(KEY_MAX_IMPORT_RETRIES, organizeProperties.getMaxImportRetries());
    }

    public boolean libraryScanAfterImport() {
        return bool(KEY_LIBRARY_SCAN_AFTER_IMPORT, false);
    }

    public Optional<String> libraryId() {
        return configStore.get(KEY_LIBRARY_ID);
    }

    public String downloadDir() {
        return configStore.get(KEY_DOWNLOAD_DIR).orElse(downloadProperties.getDownloadDir());
    }

    public String mediaDir() {
        return configStore.get(KEY_MEDIA_DIR).orElse(organizeProperties.getMediaDir());
    }

    /**
     * Minimum seeding time for downloads from {@code indexer}; 0 means seed forever.
     */
    public int seedingTimeMinutes(String indexer) {
        Integer perIndexer = indexer == null ? null : downloadProperties.getSeedingTimeMinutes().get(indexer);
        if (perIndexer != null) {
            return Math.max(0, perIndexer);
        }
        return Math.max(0, integer(KEY_SEEDING_TIME_MINUTES, 0));
    }

    private boolean bool(String key, boolean fallback) {
        Optional<String> value = configStore.get(key);
        return value.map(v -> "true".equalsIgnoreCase(v) || "1".equals(v)).orElse(fallback);
    }

    private int integer(String key, int fallback) {
        Optional<String> value = configStore.get(key);
        if (!value.isPresent()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer setting, key={}, value={}, fallback={}", key, value.get(), fallback);
            return fallback;
        }
    }
}
