package com.esports.dashboard.domain.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Display granularity of a history chart. Only affects point labels.
 */
public enum HistoryPeriod {
    DAY("d MMM"),
    MONTH("d"),
    YEAR("MMM"),
    CUSTOM("d MMM");

    private final DateTimeFormatter labelFormat;

    HistoryPeriod(String pattern) {
        this.labelFormat = DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
    }

    public String label(LocalDate date) {
        return labelFormat.format(date);
    }

    public static HistoryPeriod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid period: " + value + ". Valid options: day, month, year, custom", e);
        }
    }
}
