package com.example.bookfetch.infrastructure.client;

import com.example.bookfetch.common.exception.RetryableJobException;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Looks up download clients registered as beans.
 */
@Component
public class DownloadClientRegistry {

    private final ObjectProvider<DownloadClient> clientProvider;

    public DownloadClientRegistry(ObjectProvider<DownloadClient> clientProvider) {
        this.clientProvider = clientProvider;
    }

    public DownloadClient forProtocol(String protocol) {
        String effective = protocol == null ? "torrent" : protocol;
        for (DownloadClient client : all()) {
            if (client.supportsProtocol(effective)) {
                return client;
            }
        }
        throw new RetryableJobException("No download client configured for protocol " + effective);
    }

    public DownloadClient byId(String clientId) {
        for (DownloadClient client : all()) {
            if (client.clientId().equals(clientId) || client.clientType().equals(clientId)) {
                return client;
            }
        }
        throw new RetryableJobException("Download client " + clientId + " is not configured");
    }

    public List<DownloadClient> all() {
        return clientProvider.orderedStream().collect(Collectors.toList());
    }
}
