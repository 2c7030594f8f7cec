package com.example.bookfetch.domain.enumtype;

public enum RequestType {

    AUDIOBOOK("audiobook"),
    EBOOK("ebook");

    private final String value;

    RequestType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RequestType fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return AUDIOBOOK;
        }
        for (RequestType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown request type: " + value);
    }
}
