package com.example.bookfetch.application.processor;

import com.example.bookfetch.application.service.PipelineSettings;
import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.common.exception.RetryableJobException;
import com.example.bookfetch.common.util.TextUtil;
import com.example.bookfetch.domain.payload.ScanLibraryPayload;
import com.example.bookfetch.infrastructure.client.LibraryBackend;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class ScanLibraryProcessor implements JobProcessor<ScanLibraryPayload> {

    private static final Logger log = LoggerFactory.getLogger(ScanLibraryProcessor.class);

    private final ObjectProvider<LibraryBackend> libraryBackendProvider;
    private final PipelineSettings pipelineSettings;

    public ScanLibraryProcessor(ObjectProvider<LibraryBackend> libraryBackendProvider,
                                PipelineSettings pipelineSettings) {
        this.libraryBackendProvider = libraryBackendProvider;
        this.pipelineSettings = pipelineSettings;
    }

    @Override
    public JobResult process(ScanLibraryPayload payload) {
        LibraryBackend backend = libraryBackendProvider.getIfAvailable();
        if (backend == null) {
            throw new RetryableJobException("No library backend configured");
        }
        String libraryId = TextUtil.isBlank(payload.getLibraryId())
                ? pipelineSettings.libraryId().orElse(null) : payload.getLibraryId();
        if (TextUtil.isBlank(libraryId)) {
            throw new NonRetryableJobException("No library id configured for scan");
        }
        try {
            backend.triggerScan(libraryId);
        } catch (IOException e) {
            throw new RetryableJobException("Library scan failed: " + TextUtil.messageOf(e), e);
        }
        log.info("LIBRARY_SCAN_TRIGGERED libraryId={}", libraryId);
        return JobResult.success("Library scan triggered").with("libraryId", libraryId);
    }
}
