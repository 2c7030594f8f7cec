package com.example.bookfetch.application.organize;

import java.nio.file.Path;

/**
 * Result of placing one file at its library target.
 */
public final class CopyOutcome {

    public enum Status {
        COPIED,
        ALREADY_PRESENT,
        FAILED
    }

    private final Status status;
    private final Path target;
    private final String note;
    private final String error;

    private CopyOutcome(Status status, Path target, String note, String error) {
        this.status = status;
        this.target = target;
        this.note = note;
        this.error = error;
    }

    public static CopyOutcome copied(Path target, String note) {
        return new CopyOutcome(Status.COPIED, target, note, null);
    }

    public static CopyOutcome alreadyPresent(Path target) {
        return new CopyOutcome(Status.ALREADY_PRESENT, target, null, null);
    }

    public static CopyOutcome failed(Path target, String error) {
        return new CopyOutcome(Status.FAILED, target, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public Path getTarget() {
        return target;
    }

    /** Set when a fallback was used. */
    public String getNote() {
        return note;
    }

    public String getError() {
        return error;
    }
}
