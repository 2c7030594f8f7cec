package com.example.bookfetch.domain.enumtype;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Lifecycle of a request. The lower-case {@link #getValue()} is what gets persisted.
 */
public enum RequestStatus {

    PENDING("pending"),
    AWAITING_APPROVAL("awaiting_approval"),
    AWAITING_SEARCH("awaiting_search"),
    SEARCHING("searching"),
    DOWNLOADING("downloading"),
    DOWNLOADED("downloaded"),
    AWAITING_IMPORT("awaiting_import"),
    PROCESSING("processing"),
    AVAILABLE("available"),
    COMPLETED("completed"),
    FAILED("failed"),
    WARN("warn"),
    CANCELLED("cancelled"),
    DENIED("denied");

    private final String value;

    RequestStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** No further stage will run for a request in this status. */
    public boolean isTerminal() {
        switch (this) {
            case AVAILABLE:
            case COMPLETED:
            case FAILED:
            case WARN:
            case CANCELLED:
            case DENIED:
                return true;
            default:
                return false;
        }
    }

    public boolean isActive() {
        return !isTerminal();
    }

    /** A new request for the same book may be created when the previous one ended like this. */
    public boolean isReRequestEligible() {
        return this == FAILED || this == WARN || this == CANCELLED;
    }

    public static RequestStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RequestStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown request status: " + value);
    }

    public static List<String> activeValues() {
        List<String> result = new ArrayList<>();
        for (RequestStatus status : values()) {
            if (status.isActive()) {
                result.add(status.value);
            }
        }
        return result;
    }

    public static List<String> valuesOf(RequestStatus... statuses) {
        List<String> result = new ArrayList<>();
        for (RequestStatus status : Arrays.asList(statuses)) {
            result.add(status.value);
        }
        return result;
    }
}
