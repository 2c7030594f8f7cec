package com.example.bookfetch.application.organize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CopyChainTest {

    @TempDir
    Path tempDir;

    private Path original;
    private Path tagged;
    private Path target;
    private FileOrganizer.SourceFile file;

    @BeforeEach
    void setUp() throws IOException {
        original = write(tempDir.resolve("src").resolve("01.mp3"), "original");
        tagged = write(tempDir.resolve("work").resolve("01.mp3"), "tagged");
        target = Files.createDirectories(tempDir.resolve("library")).resolve("01.mp3");
        file = new FileOrganizer.SourceFile(original, "01.mp3", "01.mp3");
    }

    @Test
    void placeShouldPreferTaggedCopy() throws IOException {
        file.setTagged(tagged);

        CopyOutcome outcome = CopyChain.taggedThenUntagged(new NioFileCopier()).place(file, target);

        assertEquals(CopyOutcome.Status.COPIED, outcome.getStatus());
        assertNull(outcome.getNote());
        assertEquals("tagged", read(target));
    }

    @Test
    void placeShouldSkipTaggedStrategyWithoutTaggedCopy() throws IOException {
        CopyOutcome outcome = CopyChain.taggedThenUntagged(new NioFileCopier()).place(file, target);

        assertEquals(CopyOutcome.Status.COPIED, outcome.getStatus());
        assertNull(outcome.getNote());
        assertEquals("original", read(target));
    }

    @Test
    void placeShouldFallBackAndNoteWhenTaggedCopyFails() throws IOException {
        file.setTagged(tagged);
        NioFileCopier delegate = new NioFileCopier();
        FileCopier halfWrites = (from, to) -> {
            if (from.equals(tagged)) {
                Files.write(to, "partial".getBytes(StandardCharsets.UTF_8));
                throw new IOException("stale handle");
            }
            delegate.copy(from, to);
        };

        CopyOutcome outcome = CopyChain.taggedThenUntagged(halfWrites).place(file, target);

        assertEquals(CopyOutcome.Status.COPIED, outcome.getStatus());
        assertEquals("Tagged copy failed for 01.mp3, used untagged", outcome.getNote());
        assertEquals("original", read(target));
    }

    @Test
    void placeShouldReportEveryAttemptWhenAllFail() {
        file.setTagged(tagged);
        FileCopier broken = (from, to) -> {
            throw new IOException(from.equals(tagged) ? "tagged gone" : "source gone");
        };

        CopyOutcome outcome = CopyChain.taggedThenUntagged(broken).place(file, target);

        assertEquals(CopyOutcome.Status.FAILED, outcome.getStatus());
        assertEquals("Failed to copy 01.mp3: tagged copy: tagged gone; untagged: source gone", outcome.getError());
        assertFalse(Files.exists(target));
    }

    @Test
    void placeShouldLeaveExistingTargetAlone() throws IOException {
        write(target, "already here");
        List<String> attempted = new ArrayList<>();
        CopyChain chain = new CopyChain(Arrays.<CopyStrategy>asList(recording("only", attempted)));

        CopyOutcome outcome = chain.place(file, target);

        assertEquals(CopyOutcome.Status.ALREADY_PRESENT, outcome.getStatus());
        assertTrue(attempted.isEmpty());
        assertEquals("already here", read(target));
    }

    @Test
    void placeShouldStopAtFirstStrategyThatCopies() {
        List<String> attempted = new ArrayList<>();
        CopyChain chain = new CopyChain(Arrays.<CopyStrategy>asList(
                failing("first", attempted),
                recording("second", attempted),
                recording("third", attempted)));

        CopyOutcome outcome = chain.place(file, target);

        assertEquals(Arrays.asList("first", "second"), attempted);
        assertEquals("First failed for 01.mp3, used second", outcome.getNote());
    }

    private static CopyStrategy recording(String label, List<String> attempted) {
        return new StubStrategy(label, attempted, true);
    }

    private static CopyStrategy failing(String label, List<String> attempted) {
        return new StubStrategy(label, attempted, false);
    }

    private static Path write(Path path, String content) throws IOException {
        Files.createDirectories(path.getParent());
        return Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    }

    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private static final class StubStrategy implements CopyStrategy {

        private final String label;
        private final List<String> attempted;
        private final boolean copies;

        StubStrategy(String label, List<String> attempted, boolean copies) {
            this.label = label;
            this.attempted = attempted;
            this.copies = copies;
        }

        @Override
        public String label() {
            return label;
        }

        @Override
        public boolean appliesTo(FileOrganizer.SourceFile file) {
            return true;
        }

        @Override
        public CopyOutcome attempt(FileOrganizer.SourceFile file, Path target) {
            attempted.add(label);
            return copies ? CopyOutcome.copied(target, null) : CopyOutcome.failed(target, label + " broke");
        }
    }
}
