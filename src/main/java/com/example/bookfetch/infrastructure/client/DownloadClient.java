package com.example.bookfetch.infrastructure.client;

import com.example.bookfetch.domain.enumtype.ProgressUnit;
import com.example.bookfetch.domain.model.DownloadInfo;
import com.example.bookfetch.domain.model.TorrentCandidate;
import java.io.IOException;

/**
 * A torrent or usenet client. Implementations speak the client's protocol; nothing above this
 * interface knows which client it talks to.
 */
public interface DownloadClient {

    /** Stable id used in path mappings and stored on download history rows. */
    String clientId();

    /** qbittorrent, transmission, sabnzbd, ... */
    String clientType();

    boolean supportsProtocol(String protocol);

    ProgressUnit progressUnit();

    /**
     * Hands the candidate to the client.
     *
     * @return the client's handle for the transfer
     */
    String submit(TorrentCandidate candidate) throws IOException;

    /**
     * @return current status, or {@code null} when the client does not know the handle
     */
    DownloadInfo getStatus(String handle) throws IOException;

    void cancel(String handle, boolean deleteData) throws IOException;
}
