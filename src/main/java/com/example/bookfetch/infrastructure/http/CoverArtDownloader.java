package com.example.bookfetch.infrastructure.http;

import com.example.bookfetch.common.config.AppOrganizeProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import javax.annotation.PreDestroy;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches remote cover images with a byte cap and connect/read timeouts.
 */
@Component
public class CoverArtDownloader {

    private static final Logger log = LoggerFactory.getLogger(CoverArtDownloader.class);

    private final CloseableHttpClient httpClient;
    private final int maxBytes;

    public CoverArtDownloader(AppOrganizeProperties appOrganizeProperties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(appOrganizeProperties.getCoverConnectTimeoutMs())
                .setConnectionRequestTimeout(appOrganizeProperties.getCoverConnectTimeoutMs())
                .setSocketTimeout(appOrganizeProperties.getCoverSocketTimeoutMs())
                .build();
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(8);
        cm.setDefaultMaxPerRoute(4);
        this.httpClient = HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestConfig)
                .build();
        this.maxBytes = appOrganizeProperties.getCoverDownloadMaxBytes();
    }

    /**
     * Downloads {@code url} into {@code target}. Nothing is left behind on failure.
     */
    public void download(String url, Path target) throws IOException {
        HttpGet httpGet = new HttpGet(url);
        Path partial = target.resolveSibling(target.getFileName().toString() + ".part");
        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            int statusCode = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            if (statusCode < 200 || statusCode >= 300 || entity == null) {
                EntityUtils.consumeQuietly(entity);
                throw new IOException("Cover download failed with HTTP " + statusCode);
            }
            if (entity.getContentLength() > maxBytes) {
                EntityUtils.consumeQuietly(entity);
                throw new IOException("Cover image too large: " + entity.getContentLength() + " bytes");
            }
            long written = 0L;
            try (InputStream in = entity.getContent(); OutputStream out = Files.newOutputStream(partial)) {
                byte[] buffer = new byte[8192];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    written += read;
                    if (written > maxBytes) {
                        throw new IOException("Cover image exceeds " + maxBytes + " bytes");
                    }
                    out.write(buffer, 0, read);
                }
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Cover downloaded, url={}, bytes={}, target={}", url, written, target);
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    @PreDestroy
    public void shutdown() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.debug("Cover http client close failed", e);
        }
    }
}
