package com.example.bookfetch.application.organize;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered copy strategies for one file. An existing target short-circuits the chain as already
 * present; otherwise the first strategy that copies wins and earlier failures become a note.
 */
final class CopyChain {

    private static final Logger log = LoggerFactory.getLogger(CopyChain.class);

    private final List<CopyStrategy> strategies;

    CopyChain(List<CopyStrategy> strategies) {
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
    }

    /** Tagged copy first, then the untagged original. */
    static CopyChain taggedThenUntagged(FileCopier fileCopier) {
        return new CopyChain(Arrays.<CopyStrategy>asList(
                FileCopyStrategy.tagged(fileCopier),
                FileCopyStrategy.untagged(fileCopier)));
    }

    CopyOutcome place(FileOrganizer.SourceFile file, Path target) {
        if (Files.exists(target)) {
            return CopyOutcome.alreadyPresent(target);
        }
        List<String> failedLabels = new ArrayList<>();
        List<String> failedErrors = new ArrayList<>();
        for (CopyStrategy strategy : strategies) {
            if (!strategy.appliesTo(file)) {
                continue;
            }
            CopyOutcome outcome = strategy.attempt(file, target);
            if (outcome.getStatus() == CopyOutcome.Status.COPIED) {
                if (failedLabels.isEmpty()) {
                    return outcome;
                }
                return CopyOutcome.copied(target, capitalize(String.join(" and ", failedLabels))
                        + " failed for " + file.getTargetName() + ", used " + strategy.label());
            }
            failedLabels.add(strategy.label());
            failedErrors.add(outcome.getError());
        }

        String error;
        if (failedErrors.isEmpty()) {
            error = "no copy strategy applies";
        } else if (failedErrors.size() == 1) {
            error = failedErrors.get(0);
        } else {
            List<String> labelled = new ArrayList<>();
            for (int i = 0; i < failedErrors.size(); i++) {
                labelled.add(failedLabels.get(i) + ": " + failedErrors.get(i));
            }
            error = String.join("; ", labelled);
        }
        log.warn("ORGANIZE_COPY_FAILED file={} target={} error={}", file.getPath(), target, error);
        return CopyOutcome.failed(target, "Failed to copy " + file.getTargetName() + ": " + error);
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
