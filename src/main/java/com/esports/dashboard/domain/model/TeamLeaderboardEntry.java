package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One row of the team leaderboard, with changes measured against the previous period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamLeaderboardEntry {

    private int rank;
    private TeamInfo team;
    private int games;
    private int gamesChange;
    private double winrate;
    private double winrateChange;
    private long totalMinutes;

    // Sum of the top 5 players' best-account LP
    private int totalLp;
    private int totalLpChange;

    private List<RosterPlayer> players;
}
