package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One row of the player leaderboard, built from the player's best account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerLeaderboardEntry {

    private int rank;
    private PlayerRef player;

    // Null for players without an active contract
    private TeamRef team;

    private String role;
    private int games;
    private int gamesChange;
    private double winrate;
    private double winrateChange;
    private long totalMinutes;
    private String tier;
    private String division;
    private int lp;
    private int totalLp;
    private int totalLpChange;
    private List<RankedAccount> accounts;
}
