package com.example.bookfetch.application.organize;

import java.nio.file.Path;

/**
 * One way of getting a source file to its library target. {@link CopyChain} tries strategies in
 * order until one reports {@link CopyOutcome.Status#COPIED}.
 */
interface CopyStrategy {

    /** Short label used in fallback notes and errors. */
    String label();

    boolean appliesTo(FileOrganizer.SourceFile file);

    /**
     * @return {@code COPIED} or {@code FAILED}; a failed attempt leaves no partial target behind
     */
    CopyOutcome attempt(FileOrganizer.SourceFile file, Path target);
}
