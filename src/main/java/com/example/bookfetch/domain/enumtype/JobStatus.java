package com.example.bookfetch.domain.enumtype;

public enum JobStatus {
    PENDING("pending"),
    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed"),
    STUCK("stuck"),
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
