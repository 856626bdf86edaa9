package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import com.esports.dashboard.infrastructure.query.ConditionList;
import com.esports.dashboard.infrastructure.query.InColumn;

import java.util.ArrayList;
import java.util.List;

import static com.esports.dashboard.infrastructure.persistence.jdbc.SqlFragments.effectiveLp;
import static com.esports.dashboard.infrastructure.persistence.jdbc.SqlFragments.tierOrder;

/**
 * Daily history for a batch of teams or players in one round trip.
 *
 * Each day of the window picks the best account per player (tier, LP, then games);
 * teams sum their top 5 players of that day. Days without any snapshot yield no row.
 */
final class HistoryQueries {

    private static final String DAILY_CTES = """
            WITH date_series AS (
              SELECT generate_series(?::date, ?::date, '1 day'::interval)::date AS calc_date
            ),
            daily AS (
              SELECT d.calc_date, ds.puuid, ds.tier, ds.lp, ds.games_played, ds.wins
              FROM date_series d
              JOIN lol_daily_stats ds ON ds.date = d.calc_date
            )""";

    private HistoryQueries() {
    }

    static BoundQuery teams(ReportingPeriod period, List<Integer> teamIds) {
        ConditionList where = new ConditionList()
                .add("pc.end_date IS NULL")
                .addIn(InColumn.TEAM_ID, teamIds);

        String sql = DAILY_CTES + """
                ,
                player_best AS (
                  SELECT dl.calc_date, pc.team_id, pc.player_id, dl.tier,
                         %1$s AS player_lp,
                         COALESCE(dl.games_played, 0) AS games_played,
                         COALESCE(dl.wins, 0) AS wins,
                         ROW_NUMBER() OVER (
                           PARTITION BY pc.player_id, dl.calc_date
                           ORDER BY %2$s, %1$s DESC, COALESCE(dl.games_played, 0) DESC, a.account_id
                         ) AS account_rn
                  FROM player_contracts pc
                  JOIN teams t ON t.team_id = pc.team_id
                  JOIN lol_accounts a ON a.player_id = pc.player_id
                  JOIN daily dl ON dl.puuid = a.puuid
                  %3$s
                ),
                ranked_players AS (
                  SELECT calc_date, team_id, player_id, player_lp, games_played, wins,
                         ROW_NUMBER() OVER (
                           PARTITION BY team_id, calc_date
                           ORDER BY player_lp DESC, games_played DESC, player_id
                         ) AS rn
                  FROM player_best
                  WHERE account_rn = 1
                )
                SELECT team_id AS entity_id, calc_date,
                       COALESCE(SUM(player_lp), 0)::int AS total_lp,
                       SUM(games_played)::int AS games,
                       SUM(wins)::int AS wins
                FROM ranked_players
                WHERE rn <= 5
                GROUP BY team_id, calc_date
                ORDER BY team_id, calc_date
                """.formatted(effectiveLp("dl.tier", "dl.lp"), tierOrder("dl.tier"), where.where());

        return new BoundQuery(sql, params(period, where));
    }

    static BoundQuery players(ReportingPeriod period, List<Integer> playerIds) {
        ConditionList where = new ConditionList()
                .addIn(InColumn.PLAYER_ID, playerIds);

        String sql = DAILY_CTES + """
                ,
                player_best AS (
                  SELECT dl.calc_date, p.player_id,
                         %1$s AS player_lp,
                         COALESCE(dl.games_played, 0) AS games_played,
                         COALESCE(dl.wins, 0) AS wins,
                         ROW_NUMBER() OVER (
                           PARTITION BY p.player_id, dl.calc_date
                           ORDER BY %2$s, %1$s DESC, COALESCE(dl.games_played, 0) DESC, a.account_id
                         ) AS account_rn
                  FROM players p
                  JOIN lol_accounts a ON a.player_id = p.player_id
                  JOIN daily dl ON dl.puuid = a.puuid
                  %3$s
                )
                SELECT player_id AS entity_id, calc_date,
                       player_lp::int AS total_lp,
                       games_played::int AS games,
                       wins::int AS wins
                FROM player_best
                WHERE account_rn = 1
                ORDER BY player_id, calc_date
                """.formatted(effectiveLp("dl.tier", "dl.lp"), tierOrder("dl.tier"), where.where());

        return new BoundQuery(sql, params(period, where));
    }

    private static List<Object> params(ReportingPeriod period, ConditionList where) {
        List<Object> params = new ArrayList<>();
        params.add(period.start());
        params.add(period.end());
        params.addAll(where.params());
        return params;
    }
}
