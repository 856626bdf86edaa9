package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Validated request for the team and player leaderboards.
 *
 * Values arrive already bounded by the API layer (page >= 1, 1 <= perPage <= 100).
 * The whole object is hashed into the cache key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardFilters {

    private LocalDate startDate;
    private LocalDate endDate;
    private List<String> leagues;
    private List<String> roles;
    private int minGames;

    // Raw user input, escaped when the query is built
    private String search;

    private int page;
    private int perPage;
    private SortOption sort;

    // Player leaderboard only
    private boolean includeUnranked;

    public ReportingPeriod period() {
        return new ReportingPeriod(startDate, endDate);
    }

    public int offset() {
        return (page - 1) * perPage;
    }

    public SortOption sortOrDefault() {
        return sort != null ? sort : SortOption.GAMES;
    }
}
