package com.example.bookfetch.application.service;

import com.example.bookfetch.common.exception.BusinessException;
import java.time.LocalDateTime;
import org.springframework.scheduling.support.CronExpression;

/**
 * Cron handling for scheduled jobs. Accepts classic 5-field (minute first) and Spring's
 * 6-field (second first) expressions.
 */
public final class CronSupport {

    private CronSupport() {
    }

    public static String normalize(String cron) {
        if (cron == null || cron.trim().isEmpty()) {
            throw BusinessException.badRequest("Cron expression is required");
        }
        String trimmed = cron.trim().replaceAll("\\s+", " ");
        if (trimmed.split(" ").length == 5) {
            return "0 " + trimmed;
        }
        return trimmed;
    }

    public static boolean isValid(String cron) {
        try {
            CronExpression.parse(normalize(cron));
            return true;
        } catch (IllegalArgumentException | BusinessException e) {
            return false;
        }
    }

    public static String validate(String cron) {
        String normalized = normalize(cron);
        try {
            CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw BusinessException.badRequest("Invalid cron expression: " + cron);
        }
        return normalized;
    }

    public static LocalDateTime nextRun(String cron, LocalDateTime from) {
        return CronExpression.parse(normalize(cron)).next(from);
    }
}
