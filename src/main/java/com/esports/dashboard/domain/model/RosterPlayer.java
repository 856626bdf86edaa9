package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Player embedded in a team leaderboard row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RosterPlayer {

    private int playerId;
    private String slug;
    private String pseudo;
    private String role;
    private boolean starter;
    private int games;
    private double winrate;
    private String tier;
    private String rank;
    private int lp;
    private List<RankedAccount> accounts;
}
