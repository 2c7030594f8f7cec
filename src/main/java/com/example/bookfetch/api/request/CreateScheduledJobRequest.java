package com.example.bookfetch.api.request;

import java.util.Map;
import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CreateScheduledJobRequest {

    @NotBlank
    private String name;

    /** Job type code, e.g. {@code retry_missing_torrents}. */
    @NotBlank
    private String type;

    @NotBlank
    private String schedule;

    private Boolean enabled;

    private Map<String, Object> payload;
}
