package com.example.bookfetch.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.requests")
public class AppRequestProperties {

    /** Applies to users without an explicit auto-approve flag. */
    private boolean approvalRequired = false;

    private int retryMissingBatchSize = 50;

    private int retryImportBatchSize = 50;

    private int cleanupBatchSize = 100;
}
