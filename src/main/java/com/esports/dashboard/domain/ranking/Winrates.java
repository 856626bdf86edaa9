package com.esports.dashboard.domain.ranking;

/**
 * Winrates are percentages with one decimal, 0 when no games were played.
 */
public final class Winrates {

    private Winrates() {
    }

    public static double percent(long wins, long games) {
        if (games <= 0) {
            return 0;
        }
        return Math.round((double) wins / games * 1000) / 10.0;
    }

    /**
     * Difference in percentage points, one decimal.
     */
    public static double change(double current, double previous) {
        return Math.round((current - previous) * 10) / 10.0;
    }

    public static long minutes(long durationSeconds) {
        return Math.round(durationSeconds / 60.0);
    }
}
