package com.example.bookfetch.domain.enumtype;

/**
 * Transfer state as reported by a download client.
 */
public enum DownloadState {
    QUEUED,
    CHECKING,
    DOWNLOADING,
    PAUSED,
    PROCESSING,
    SEEDING,
    COMPLETED,
    FAILED;

    /** Payload is fully on disk. Seeding torrents count as complete. */
    public boolean isComplete() {
        return this == COMPLETED || this == SEEDING;
    }

    public boolean isFailed() {
        return this == FAILED;
    }
}
