package com.esports.dashboard.domain.model;

import java.util.Arrays;

/**
 * Leaderboard sort keys. All sorts are descending.
 */
public enum SortOption {
    GAMES("games"),
    WINRATE("winrate"),
    LP("lp");

    private final String value;

    SortOption(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SortOption fromValue(String value) {
        if (value == null || value.isBlank()) {
            return GAMES;
        }
        return Arrays.stream(values())
                .filter(option -> option.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid sort option: " + value + ". Valid options: games, winrate, lp"));
    }
}
