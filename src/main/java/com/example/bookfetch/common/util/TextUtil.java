package com.example.bookfetch.common.util;

import java.io.PrintWriter;
import java.io.StringWriter;

public final class TextUtil {

    private TextUtil() {
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return isBlank(message) ? error.getClass().getSimpleName() : message;
    }

    public static String stackTraceOf(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
