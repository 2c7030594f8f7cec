package com.example.bookfetch.infrastructure.tagging;

import com.example.bookfetch.domain.model.BookMetadata;
import java.nio.file.Path;

public interface MetadataTagger {

    /** Whether the tagging backend can run at all in this environment. */
    boolean isAvailable();

    boolean supports(Path audioFile);

    /**
     * Writes book metadata into a copy of {@code source} placed under {@code workDir}. Every call
     * yields a distinct file, even for sources that share a file name.
     *
     * @return the tagged copy; the source file is never modified
     */
    Path tagCopy(Path source, BookMetadata metadata, Path workDir) throws Exception;
}
