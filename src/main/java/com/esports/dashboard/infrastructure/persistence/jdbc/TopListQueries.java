package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.domain.model.SortDirection;
import com.esports.dashboard.domain.model.StreakFilters;
import com.esports.dashboard.domain.model.TopFilters;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import com.esports.dashboard.infrastructure.query.ConditionList;
import com.esports.dashboard.infrastructure.query.InColumn;

import java.util.ArrayList;
import java.util.List;

import static com.esports.dashboard.infrastructure.persistence.jdbc.SqlFragments.MASTER_PLUS_TIERS;
import static com.esports.dashboard.infrastructure.persistence.jdbc.SqlFragments.tierOrder;

/**
 * Builds the top-N queries: grinders, LP gainers, LP losers and streaks.
 *
 * LP change lists only consider Master+ snapshots, since lower tiers have no
 * comparable LP. Gainers compare the best account at period end with its latest
 * Master+ snapshot on or before the start date; losers start from the best
 * account at the start and compare with its latest snapshot on or before the end,
 * counting a drop below MASTER as 0 LP.
 */
final class TopListQueries {

    private TopListQueries() {
    }

    // ---- grinders ---------------------------------------------------------

    static BoundQuery playerGrinders(TopFilters filters) {
        ReportingPeriod period = filters.period();
        ConditionList where = new ConditionList()
                .addIn(InColumn.TEAM_LEAGUE, filters.getLeagues())
                .addIn(InColumn.CONTRACT_ROLE, filters.getRoles());
        ConditionList having = minGamesHaving(filters);

        String sql = """
                SELECT p.player_id, p.slug, p.current_pseudo,
                       t.team_id, t.slug AS team_slug, t.short_name AS team_short_name,
                       pc.role,
                       COALESCE(SUM(ds.games_played), 0)::int AS games
                FROM players p
                LEFT JOIN player_contracts pc ON pc.player_id = p.player_id AND pc.end_date IS NULL
                LEFT JOIN teams t ON t.team_id = pc.team_id
                JOIN lol_accounts a ON a.player_id = p.player_id
                JOIN lol_daily_stats ds ON ds.puuid = a.puuid AND ds.date BETWEEN ? AND ?
                %s
                GROUP BY p.player_id, t.team_id, pc.role
                %s
                ORDER BY games %s, p.player_id
                LIMIT ?
                """.formatted(where.where(), having.having(), direction(filters.directionOrDefault()));

        List<Object> params = new ArrayList<>();
        params.add(period.start());
        params.add(period.end());
        params.addAll(where.params());
        params.addAll(having.params());
        params.add(filters.getLimit());
        return new BoundQuery(sql, params);
    }

    static BoundQuery teamGrinders(TopFilters filters) {
        ReportingPeriod period = filters.period();
        ConditionList where = new ConditionList()
                .add("t.is_active = true")
                .addIn(InColumn.TEAM_LEAGUE, filters.getLeagues())
                .addIn(InColumn.CONTRACT_ROLE, filters.getRoles());
        ConditionList having = minGamesHaving(filters);

        String sql = """
                SELECT t.team_id, t.slug, t.current_name, t.short_name, o.logo_url,
                       COALESCE(SUM(ds.games_played), 0)::int AS games
                FROM teams t
                LEFT JOIN organizations o ON o.org_id = t.org_id
                JOIN player_contracts pc ON pc.team_id = t.team_id AND pc.end_date IS NULL
                JOIN lol_accounts a ON a.player_id = pc.player_id
                JOIN lol_daily_stats ds ON ds.puuid = a.puuid AND ds.date BETWEEN ? AND ?
                %s
                GROUP BY t.team_id, o.org_id
                %s
                ORDER BY games %s, t.team_id
                LIMIT ?
                """.formatted(where.where(), having.having(), direction(filters.directionOrDefault()));

        List<Object> params = new ArrayList<>();
        params.add(period.start());
        params.add(period.end());
        params.addAll(where.params());
        params.addAll(having.params());
        params.add(filters.getLimit());
        return new BoundQuery(sql, params);
    }

    private static ConditionList minGamesHaving(TopFilters filters) {
        ConditionList having = new ConditionList();
        if (filters.getMinGames() > 0) {
            having.add("COALESCE(SUM(ds.games_played), 0) >= ?", filters.getMinGames());
        }
        return having;
    }

    // ---- LP gainers -------------------------------------------------------

    static BoundQuery playerGainers(TopFilters filters) {
        List<Object> params = new ArrayList<>();
        String ctes = gainerCtes(filters.period(), params);
        return playerLpChange(ctes, params, filters, "lp_change > 0", direction(filters.directionOrDefault()));
    }

    static BoundQuery teamGainers(TopFilters filters) {
        List<Object> params = new ArrayList<>();
        String ctes = gainerCtes(filters.period(), params);
        return teamLpChange(ctes, params, filters, "SUM(lp_change) > 0", direction(filters.directionOrDefault()));
    }

    /**
     * {@code player_lp_change(player_id, lp_change)} and {@code player_games(player_id, games)}
     * for accounts that finish the period in Master+.
     */
    private static String gainerCtes(ReportingPeriod period, List<Object> params) {
        String sql = """
                WITH last_lp AS (
                  SELECT DISTINCT ON (ds.puuid) ds.puuid, ds.tier, ds.lp AS lp_end
                  FROM lol_daily_stats ds
                  WHERE ds.date >= ? AND ds.date <= ? AND ds.tier IN %1$s
                  ORDER BY ds.puuid, ds.date DESC
                ),
                player_best AS (
                  SELECT player_id, puuid AS best_puuid, lp_end
                  FROM (
                    SELECT a.player_id, a.puuid, l.lp_end,
                           ROW_NUMBER() OVER (
                             PARTITION BY a.player_id
                             ORDER BY %2$s, l.lp_end DESC, a.account_id
                           ) AS rn
                    FROM lol_accounts a
                    JOIN last_lp l ON l.puuid = a.puuid
                  ) ranked
                  WHERE rn = 1
                ),
                first_day_lp AS (
                  SELECT DISTINCT ON (pb.player_id) pb.player_id, ds.lp AS lp_start
                  FROM player_best pb
                  JOIN lol_daily_stats ds ON ds.puuid = pb.best_puuid
                  WHERE ds.date <= ? AND ds.tier IN %1$s
                  ORDER BY pb.player_id, ds.date DESC
                ),
                player_games AS (
                  SELECT pb.player_id, COALESCE(SUM(ds.games_played), 0)::int AS games
                  FROM player_best pb
                  JOIN lol_daily_stats ds ON ds.puuid = pb.best_puuid
                  WHERE ds.date >= ? AND ds.date <= ?
                  GROUP BY pb.player_id
                ),
                player_lp_change AS (
                  SELECT pb.player_id, (pb.lp_end - COALESCE(f.lp_start, 0))::int AS lp_change
                  FROM player_best pb
                  LEFT JOIN first_day_lp f ON f.player_id = pb.player_id
                )
                """.formatted(MASTER_PLUS_TIERS, tierOrder("l.tier"));
        params.add(period.start());
        params.add(period.end());
        params.add(period.start());
        params.add(period.start());
        params.add(period.end());
        return sql;
    }

    // ---- LP losers --------------------------------------------------------

    /**
     * DESC still means "biggest drop first", which is ascending lp_change.
     */
    static BoundQuery playerLosers(TopFilters filters) {
        List<Object> params = new ArrayList<>();
        String ctes = loserCtes(filters.period(), params);
        return playerLpChange(ctes, params, filters, "lp_change < 0",
                direction(filters.directionOrDefault().reversed()));
    }

    static BoundQuery teamLosers(TopFilters filters) {
        List<Object> params = new ArrayList<>();
        String ctes = loserCtes(filters.period(), params);
        return teamLpChange(ctes, params, filters, "SUM(lp_change) < 0",
                direction(filters.directionOrDefault().reversed()));
    }

    private static String loserCtes(ReportingPeriod period, List<Object> params) {
        String sql = """
                WITH first_lp AS (
                  SELECT DISTINCT ON (ds.puuid) ds.puuid, ds.tier, ds.lp AS lp_start
                  FROM lol_daily_stats ds
                  WHERE ds.date <= ? AND ds.tier IN %1$s
                  ORDER BY ds.puuid, ds.date DESC
                ),
                player_best AS (
                  SELECT player_id, puuid AS best_puuid, lp_start
                  FROM (
                    SELECT a.player_id, a.puuid, f.lp_start,
                           ROW_NUMBER() OVER (
                             PARTITION BY a.player_id
                             ORDER BY %2$s, f.lp_start DESC, a.account_id
                           ) AS rn
                    FROM lol_accounts a
                    JOIN first_lp f ON f.puuid = a.puuid
                  ) ranked
                  WHERE rn = 1
                ),
                last_day_lp AS (
                  SELECT DISTINCT ON (pb.player_id) pb.player_id, %3$s AS lp_end
                  FROM player_best pb
                  JOIN lol_daily_stats ds ON ds.puuid = pb.best_puuid
                  WHERE ds.date <= ?
                  ORDER BY pb.player_id, ds.date DESC
                ),
                player_games AS (
                  SELECT pb.player_id, COALESCE(SUM(ds.games_played), 0)::int AS games
                  FROM player_best pb
                  JOIN lol_daily_stats ds ON ds.puuid = pb.best_puuid
                  WHERE ds.date >= ? AND ds.date <= ?
                  GROUP BY pb.player_id
                ),
                player_lp_change AS (
                  SELECT pb.player_id, (COALESCE(l.lp_end, 0) - pb.lp_start)::int AS lp_change
                  FROM player_best pb
                  LEFT JOIN last_day_lp l ON l.player_id = pb.player_id
                )
                """.formatted(MASTER_PLUS_TIERS, tierOrder("f.tier"),
                SqlFragments.effectiveLp("ds.tier", "ds.lp"));
        params.add(period.start());
        params.add(period.end());
        params.add(period.start());
        params.add(period.end());
        return sql;
    }

    // ---- shared LP change tails -------------------------------------------

    private static BoundQuery playerLpChange(String ctes, List<Object> params, TopFilters filters,
                                             String changeCondition, String direction) {
        ConditionList where = new ConditionList()
                .add(changeCondition)
                .addIn(InColumn.LEAGUE, filters.getLeagues())
                .addIn(InColumn.ROLE, filters.getRoles());
        if (filters.getMinGames() > 0) {
            where.add("games >= ?", filters.getMinGames());
        }

        String sql = ctes + """
                , player_rows AS (
                  SELECT p.player_id, p.slug, p.current_pseudo,
                         t.team_id, t.slug AS team_slug, t.short_name AS team_short_name,
                         t.league, pc.role,
                         plc.lp_change,
                         COALESCE(pg.games, 0) AS games
                  FROM player_lp_change plc
                  JOIN players p ON p.player_id = plc.player_id
                  LEFT JOIN player_contracts pc ON pc.player_id = p.player_id AND pc.end_date IS NULL
                  LEFT JOIN teams t ON t.team_id = pc.team_id
                  LEFT JOIN player_games pg ON pg.player_id = p.player_id
                )
                SELECT *
                FROM player_rows
                %s
                ORDER BY lp_change %s, player_id
                LIMIT ?
                """.formatted(where.where(), direction);

        params.addAll(where.params());
        params.add(filters.getLimit());
        return new BoundQuery(sql, params);
    }

    private static BoundQuery teamLpChange(String ctes, List<Object> params, TopFilters filters,
                                           String sumCondition, String direction) {
        ConditionList where = new ConditionList()
                .addIn(InColumn.LEAGUE, filters.getLeagues())
                .addIn(InColumn.ROLE, filters.getRoles());
        ConditionList having = new ConditionList().add(sumCondition);
        if (filters.getMinGames() > 0) {
            having.add("SUM(games) >= ?", filters.getMinGames());
        }

        String sql = ctes + """
                , team_rows AS (
                  SELECT t.team_id, t.slug, t.current_name, t.short_name, o.logo_url,
                         t.league, pc.role,
                         plc.lp_change,
                         COALESCE(pg.games, 0) AS games
                  FROM teams t
                  LEFT JOIN organizations o ON o.org_id = t.org_id
                  JOIN player_contracts pc ON pc.team_id = t.team_id AND pc.end_date IS NULL
                  JOIN player_lp_change plc ON plc.player_id = pc.player_id
                  LEFT JOIN player_games pg ON pg.player_id = pc.player_id
                  WHERE t.is_active = true
                )
                SELECT team_id, slug, current_name, short_name, logo_url,
                       SUM(lp_change)::int AS lp_change,
                       SUM(games)::int AS games
                FROM team_rows
                %s
                GROUP BY team_id, slug, current_name, short_name, logo_url
                %s
                ORDER BY lp_change %s, team_id
                LIMIT ?
                """.formatted(where.where(), having.having(), direction);

        params.addAll(where.params());
        params.addAll(having.params());
        params.add(filters.getLimit());
        return new BoundQuery(sql, params);
    }

    // ---- streaks ----------------------------------------------------------

    /**
     * Win streaks take each player's longest current positive streak; loss streaks the most negative.
     */
    static BoundQuery streaks(StreakFilters filters, boolean wins) {
        ConditionList where = new ConditionList()
                .addIn(InColumn.TEAM_LEAGUE, filters.getLeagues());

        String sql = """
                SELECT p.player_id, p.slug, p.current_pseudo,
                       t.team_id, t.slug AS team_slug, t.short_name AS team_short_name,
                       %1$s(s.current_streak)::int AS streak
                FROM lol_streaks s
                JOIN lol_accounts a ON a.puuid = s.puuid
                JOIN players p ON p.player_id = a.player_id
                LEFT JOIN player_contracts pc ON pc.player_id = p.player_id AND pc.end_date IS NULL
                LEFT JOIN teams t ON t.team_id = pc.team_id
                WHERE s.current_streak %2$s 0 %3$s
                GROUP BY p.player_id, t.team_id
                ORDER BY streak %4$s, p.player_id
                LIMIT ?
                """.formatted(wins ? "MAX" : "MIN", wins ? ">" : "<", where.andJoined(), wins ? "DESC" : "ASC");

        List<Object> params = new ArrayList<>(where.params());
        params.add(filters.getLimit());
        return new BoundQuery(sql, params);
    }

    private static String direction(SortDirection direction) {
        return direction == SortDirection.ASC ? "ASC" : "DESC";
    }
}
