package com.esports.dashboard.domain.model;

public enum ViewMode {
    PLAYERS,
    TEAMS;

    public static ViewMode fromValue(String value) {
        if (value == null || value.isBlank() || "players".equalsIgnoreCase(value)) {
            return PLAYERS;
        }
        if ("teams".equalsIgnoreCase(value)) {
            return TEAMS;
        }
        throw new IllegalArgumentException("Invalid view mode: " + value + ". Valid options: players, teams");
    }
}
