package com.example.bookfetch.domain.enumtype;

/**
 * Scale a download client reports progress in.
 */
public enum ProgressUnit {
    /** 0.0 - 1.0 */
    FRACTION,
    /** 0 - 100 */
    PERCENT
}
