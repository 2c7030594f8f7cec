package com.example.bookfetch.application.organize;

import com.example.bookfetch.common.util.TextUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies whichever file {@code selector} picks for a source, through a {@link FileCopier}.
 */
final class FileCopyStrategy implements CopyStrategy {

    private static final Logger log = LoggerFactory.getLogger(FileCopyStrategy.class);

    private final String label;
    private final Function<FileOrganizer.SourceFile, Path> selector;
    private final FileCopier fileCopier;

    FileCopyStrategy(String label, Function<FileOrganizer.SourceFile, Path> selector, FileCopier fileCopier) {
        this.label = label;
        this.selector = selector;
        this.fileCopier = fileCopier;
    }

    static FileCopyStrategy tagged(FileCopier fileCopier) {
        return new FileCopyStrategy("tagged copy", FileOrganizer.SourceFile::getTagged, fileCopier);
    }

    static FileCopyStrategy untagged(FileCopier fileCopier) {
        return new FileCopyStrategy("untagged", FileOrganizer.SourceFile::getPath, fileCopier);
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public boolean appliesTo(FileOrganizer.SourceFile file) {
        return selector.apply(file) != null;
    }

    @Override
    public CopyOutcome attempt(FileOrganizer.SourceFile file, Path target) {
        Path from = selector.apply(file);
        try {
            fileCopier.copy(from, target);
            return CopyOutcome.copied(target, null);
        } catch (IOException e) {
            deletePartial(target);
            log.debug("Copy attempt failed, strategy={}, source={}, target={}", label, from, target, e);
            return CopyOutcome.failed(target, TextUtil.messageOf(e));
        }
    }

    private static void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.debug("Partial file cleanup failed, target={}", target, e);
        }
    }
}
