package com.esports.dashboard.domain.model;

/**
 * Direction for top lists. DESC means "most extreme first" for both gainers and losers.
 */
public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection fromValue(String value) {
        return "asc".equalsIgnoreCase(value) ? ASC : DESC;
    }

    public SortDirection reversed() {
        return this == ASC ? DESC : ASC;
    }
}
