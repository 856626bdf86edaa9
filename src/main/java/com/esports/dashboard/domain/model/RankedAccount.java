package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One LoL account of a player with its latest rank in the period.
 * {@code lp} is 0 below MASTER.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedAccount {

    private Integer accountId;
    private String puuid;
    private String gameName;
    private String tagLine;
    private String region;
    private String tier;
    private String rank;
    private int lp;
    private int games;
    private int wins;
    private double winrate;
}
