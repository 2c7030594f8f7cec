package com.example.bookfetch.application.service;

import static com.example.bookfetch.common.util.TextUtil.truncate;

import com.example.bookfetch.common.config.AppDownloadProperties;
import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.enumtype.DownloadHistoryStatus;
import com.example.bookfetch.domain.model.DownloadInfo;
import com.example.bookfetch.domain.model.DownloadSnapshot;
import com.example.bookfetch.domain.model.TorrentCandidate;
import com.example.bookfetch.infrastructure.client.DownloadClient;
import com.example.bookfetch.infrastructure.client.DownloadClientRegistry;
import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import com.example.bookfetch.infrastructure.persistence.mapper.DownloadHistoryMapper;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Boundary to the download clients. Client quirks (progress scale, remote paths) are resolved
 * here so the monitor only ever sees normalized snapshots.
 */
@Service
public class DownloadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DownloadOrchestrator.class);

    private final DownloadClientRegistry clientRegistry;
    private final DownloadHistoryMapper downloadHistoryMapper;
    private final AppDownloadProperties downloadProperties;

    public DownloadOrchestrator(DownloadClientRegistry clientRegistry,
                                DownloadHistoryMapper downloadHistoryMapper,
                                AppDownloadProperties downloadProperties) {
        this.clientRegistry = clientRegistry;
        this.downloadHistoryMapper = downloadHistoryMapper;
        this.downloadProperties = downloadProperties;
    }

    /**
     * Hands the candidate to the client for its protocol and opens a download history row.
     *
     * @throws NonRetryableJobException when the client refuses the transfer
     */
    public DownloadHistoryEntity startDownload(Long requestId, TorrentCandidate candidate, Integer qualityScore) {
        DownloadClient client = clientRegistry.forProtocol(candidate.getProtocol());
        String handle;
        try {
            handle = client.submit(candidate);
        } catch (IOException | RuntimeException e) {
            log.warn("DOWNLOAD_SUBMIT_FAILED requestId={} client={} title={} error={}",
                    requestId, client.clientId(), candidate.getTitle(), e.getMessage());
            throw new NonRetryableJobException("Failed to add download: " + TextUtil.messageOf(e), e);
        }
        if (TextUtil.isBlank(handle)) {
            throw new NonRetryableJobException("Failed to add download: client returned no transfer id");
        }

        DownloadHistoryEntity history = new DownloadHistoryEntity();
        history.setRequestId(requestId);
        history.setIndexerName(candidate.getIndexer());
        history.setTorrentName(truncate(candidate.getTitle(), 500));
        history.setTorrentHash(candidate.getInfoHash());
        history.setTorrentSizeBytes(candidate.getSize());
        history.setSeeders(candidate.getSeeders());
        history.setQualityScore(qualityScore);
        history.setSelected(Boolean.TRUE);
        history.setDownloadClient(client.clientId());
        history.setDownloadClientId(handle);
        history.setDownloadStatus(DownloadHistoryStatus.DOWNLOADING.getValue());
        history.setProgress(0);
        downloadHistoryMapper.insert(history);
        log.info("DOWNLOAD_STARTED requestId={} historyId={} client={} handle={} title={}",
                requestId, history.getId(), client.clientId(), handle, candidate.getTitle());
        return history;
    }

    /**
     * @return normalized status, or {@code null} when the client does not know the transfer
     */
    public DownloadSnapshot poll(String clientId, String handle) {
        DownloadClient client = clientRegistry.byId(clientId);
        DownloadInfo info;
        try {
            info = client.getStatus(handle);
        } catch (IOException e) {
            throw new RetryableJobException("Download client " + client.clientId() + " unreachable: "
                    + TextUtil.messageOf(e), e);
        }
        if (info == null) {
            return null;
        }
        DownloadSnapshot snapshot = new DownloadSnapshot();
        snapshot.setHandle(info.getHandle() == null ? handle : info.getHandle());
        snapshot.setName(info.getName());
        snapshot.setPercent(ProgressNormalizer.toPercent(info.getProgress(), client.progressUnit()));
        snapshot.setState(info.getState());
        snapshot.setDownloadSpeed(info.getDownloadSpeed());
        snapshot.setEta(info.getEta());
        snapshot.setLocalPath(downloadProperties.pathMappingFor(client.clientId()).transform(info.getDownloadPath()));
        snapshot.setErrorMessage(info.getErrorMessage());
        snapshot.setSeedingTimeSeconds(info.getSeedingTimeSeconds());
        return snapshot;
    }

    public void cancel(String clientId, String handle, boolean deleteData) throws IOException {
        DownloadClient client = clientRegistry.byId(clientId);
        client.cancel(handle, deleteData);
        log.info("DOWNLOAD_REMOVED client={} handle={} deleteData={}", client.clientId(), handle, deleteData);
    }

    /**
     * Maps a path reported by a client into this service's filesystem view.
     */
    public String mapPath(String clientId, String remotePath) {
        return downloadProperties.pathMappingFor(clientId).transform(remotePath);
    }
}
