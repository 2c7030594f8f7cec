package com.example.bookfetch.infrastructure.client;

import java.io.IOException;

/**
 * Media server that serves the organized library (Plex, Audiobookshelf, ...).
 */
public interface LibraryBackend {

    void triggerScan(String libraryId) throws IOException;
}
