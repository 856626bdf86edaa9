package com.esports.dashboard.infrastructure.query;

/**
 * Columns that may appear on the left side of a generated IN clause.
 */
public enum InColumn {
    TEAM_LEAGUE("t.league"),
    TEAM_ID("t.team_id"),
    PLAYER_ID("p.player_id"),
    RANKED_PLAYER_ROLE("rp.role"),
    CONTRACT_ROLE("pc.role"),
    ACCOUNT_PUUID("a.puuid"),
    ACCOUNT_ID("a.account_id"),
    LEAGUE("league"),
    ROLE("role");

    private final String sql;

    InColumn(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
