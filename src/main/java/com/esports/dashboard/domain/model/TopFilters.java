package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Request for the top-N lists (grinders, LP gainers, LP losers).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopFilters {

    private LocalDate startDate;
    private LocalDate endDate;
    private List<String> leagues;
    private List<String> roles;
    private int minGames;
    private int limit;
    private SortDirection sortDirection;
    private ViewMode viewMode;

    public ReportingPeriod period() {
        return new ReportingPeriod(startDate, endDate);
    }

    public SortDirection directionOrDefault() {
        return sortDirection != null ? sortDirection : SortDirection.DESC;
    }

    public ViewMode viewModeOrDefault() {
        return viewMode != null ? viewMode : ViewMode.PLAYERS;
    }
}
