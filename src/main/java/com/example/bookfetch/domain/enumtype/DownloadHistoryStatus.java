package com.example.bookfetch.domain.enumtype;

public enum DownloadHistoryStatus {
    DOWNLOADING("downloading"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    DownloadHistoryStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
