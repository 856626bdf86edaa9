package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import com.esports.dashboard.infrastructure.query.ConditionList;
import com.esports.dashboard.infrastructure.query.InColumn;

import java.util.ArrayList;
import java.util.List;

final class SummaryQueries {

    private SummaryQueries() {
    }

    /**
     * Games, wins and duration of every account of every player in the window.
     */
    static BoundQuery totals(ReportingPeriod period, List<String> leagues) {
        ConditionList where = new ConditionList()
                .add("ds.date BETWEEN ? AND ?", period.start(), period.end())
                .addIn(InColumn.TEAM_LEAGUE, leagues);

        String sql = """
                SELECT COALESCE(SUM(ds.games_played), 0)::bigint AS games,
                       COALESCE(SUM(ds.wins), 0)::bigint AS wins,
                       COALESCE(SUM(ds.total_game_duration), 0)::bigint AS duration
                FROM lol_daily_stats ds
                JOIN lol_accounts a ON a.puuid = ds.puuid
                JOIN players p ON p.player_id = a.player_id
                LEFT JOIN player_contracts pc ON pc.player_id = p.player_id AND pc.end_date IS NULL
                LEFT JOIN teams t ON t.team_id = pc.team_id
                %s
                """.formatted(where.where());

        return new BoundQuery(sql, where.params());
    }

    /**
     * Sum of each account's latest Master+ LP in the window.
     */
    static BoundQuery masterPlusLp(ReportingPeriod period, List<String> leagues) {
        ConditionList where = new ConditionList()
                .addIn(InColumn.TEAM_LEAGUE, leagues);

        String sql = """
                WITH latest AS (
                  SELECT DISTINCT ON (ds.puuid) ds.puuid, ds.tier, ds.lp
                  FROM lol_daily_stats ds
                  WHERE ds.date >= ? AND ds.date <= ?
                  ORDER BY ds.puuid, ds.date DESC
                )
                SELECT COALESCE(SUM(l.lp), 0)::bigint AS total_lp
                FROM latest l
                JOIN lol_accounts a ON a.puuid = l.puuid
                JOIN players p ON p.player_id = a.player_id
                LEFT JOIN player_contracts pc ON pc.player_id = p.player_id AND pc.end_date IS NULL
                LEFT JOIN teams t ON t.team_id = pc.team_id
                WHERE l.tier IN %s %s
                """.formatted(SqlFragments.MASTER_PLUS_TIERS, where.andJoined());

        List<Object> params = new ArrayList<>();
        params.add(period.start());
        params.add(period.end());
        params.addAll(where.params());
        return new BoundQuery(sql, params);
    }
}
