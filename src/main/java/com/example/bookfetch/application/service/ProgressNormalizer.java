package com.example.bookfetch.application.service;

import com.example.bookfetch.domain.enumtype.ProgressUnit;

/**
 * Converts client progress to an integer percent in [0, 100].
 */
public final class ProgressNormalizer {

    private ProgressNormalizer() {
    }

    public static int toPercent(double progress, ProgressUnit unit) {
        if (Double.isNaN(progress)) {
            return 0;
        }
        double percent = unit == ProgressUnit.FRACTION ? progress * 100D : progress;
        long rounded = Math.round(percent);
        if (rounded < 0L) {
            return 0;
        }
        if (rounded > 100L) {
            return 100;
        }
        return (int) rounded;
    }
}
