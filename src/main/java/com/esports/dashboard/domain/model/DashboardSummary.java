package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Totals across contracted players for a period, compared with the previous period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummary {

    private int totalGames;
    private int totalGamesChange;
    private double avgWinrate;
    private double avgWinrateChange;
    private long totalMinutes;
    private long totalMinutesChange;

    // Latest Master+ LP of every account, summed
    private int totalLp;
}
