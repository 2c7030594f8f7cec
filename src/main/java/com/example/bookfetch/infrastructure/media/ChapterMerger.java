package com.example.bookfetch.infrastructure.media;

import com.example.bookfetch.domain.model.BookMetadata;
import java.nio.file.Path;
import java.util.List;

/**
 * Joins the parts of a multi-file book into one chaptered file.
 */
public interface ChapterMerger {

    boolean isAvailable();

    /**
     * @param parts audio parts in any order; the merger decides the chapter order
     * @return the merged file, written under {@code workDir}
     */
    Path merge(List<Path> parts, BookMetadata metadata, Path workDir) throws Exception;
}
