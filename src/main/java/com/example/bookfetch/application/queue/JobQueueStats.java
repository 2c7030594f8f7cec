package com.example.bookfetch.application.queue;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class JobQueueStats {

    /** Ledger row count per job status. */
    private Map<String, Long> byStatus = new LinkedHashMap<>();

    /** Broker jobs waiting (including delayed) per job type. */
    private Map<String, Integer> waiting = new LinkedHashMap<>();

    /** Broker jobs running per job type. */
    private Map<String, Integer> active = new LinkedHashMap<>();
}
