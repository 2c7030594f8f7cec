package com.example.bookfetch.api.request;

import java.util.Map;
import lombok.Data;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
@Data
public class UpdateScheduledJobRequest {

    private String name;

    private String schedule;

    private Boolean enabled;

    private Map<String, Object> payload;
}
