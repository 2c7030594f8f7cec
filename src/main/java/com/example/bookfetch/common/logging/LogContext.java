package com.example.bookfetch.common.logging;

import org.slf4j.MDC;

/**
 * MDC keys shared by the HTTP filter and job workers.
 */
public final class LogContext {

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_JOB_ID = "jobId";
    public static final String MDC_JOB_TYPE = "jobType";

    private LogContext() {
    }

    public static void enterJob(Long jobId, String jobType) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, String.valueOf(jobId));
        }
        MDC.put(MDC_JOB_TYPE, jobType);
    }

    public static void exitJob() {
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_TYPE);
    }
}
