package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.LeaderboardFilters;
import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.domain.model.SortOption;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import com.esports.dashboard.infrastructure.query.ConditionList;
import com.esports.dashboard.infrastructure.query.InColumn;
import com.esports.dashboard.infrastructure.query.SearchSanitizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.esports.dashboard.infrastructure.persistence.jdbc.SqlFragments.effectiveLp;
import static com.esports.dashboard.infrastructure.persistence.jdbc.SqlFragments.tierOrder;

/**
 * Builds the team and player leaderboard queries.
 *
 * Both leaderboards share a CTE prefix (latest ranks, best account per player,
 * aggregated stats for the period and the previous one). The page query appends
 * ordering, LIMIT/OFFSET and the JSON-aggregated roster or accounts; the count
 * query reuses the prefix and only counts rows.
 *
 * Parameter order follows the placeholders top to bottom, so every builder
 * appends values in the same order it appends text.
 */
final class LeaderboardQueries {

    private static final Map<SortOption, String> TEAM_ORDER = new EnumMap<>(SortOption.class);
    private static final Map<SortOption, String> PLAYER_ORDER = new EnumMap<>(SortOption.class);

    static final String UNRANKED_PLAYER_ORDER = "total_lp DESC, tier_order ASC, current_pseudo ASC, player_id ASC";

    static {
        TEAM_ORDER.put(SortOption.GAMES, "games DESC, team_id ASC");
        TEAM_ORDER.put(SortOption.WINRATE, "winrate_calc DESC, team_id ASC");
        TEAM_ORDER.put(SortOption.LP, "total_lp DESC, team_id ASC");

        PLAYER_ORDER.put(SortOption.GAMES, "games DESC, player_id ASC");
        PLAYER_ORDER.put(SortOption.WINRATE, "winrate_calc DESC, player_id ASC");
        PLAYER_ORDER.put(SortOption.LP, "total_lp DESC, player_id ASC");
    }

    private static final String WINRATE_CALC = """
            CASE WHEN COALESCE(SUM(ds.games_played), 0) > 0
                 THEN SUM(ds.wins)::float / SUM(ds.games_played)
                 ELSE 0 END AS winrate_calc""";

    private LeaderboardQueries() {
    }

    // ---- teams ------------------------------------------------------------

    static BoundQuery teamPage(LeaderboardFilters filters) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(teamPrefix(filters, params));
        ReportingPeriod period = filters.period();
        String order = TEAM_ORDER.get(filters.sortOrDefault());

        sql.append(",\n").append(SqlFragments.accountStatsCte("account_stats"));
        params.add(period.start());
        params.add(period.end());

        sql.append("""
                ,
                player_games AS (
                  SELECT rp.player_id, COALESCE(ast.games, 0) AS games, COALESCE(ast.wins, 0) AS wins
                  FROM ranked_players rp
                  LEFT JOIN account_stats ast ON ast.puuid = rp.best_puuid
                ),
                page AS (
                  SELECT twc.*, COUNT(*) OVER() AS total_count
                  FROM teams_with_changes twc
                  ORDER BY %1$s
                  LIMIT ? OFFSET ?
                ),
                roster AS (
                  SELECT pc.team_id,
                         json_agg(json_build_object(
                           'playerId', p.player_id,
                           'slug', p.slug,
                           'pseudo', p.current_pseudo,
                           'role', pc.role,
                           'starter', COALESCE(pc.is_starter, true),
                           'games', COALESCE(pg.games, 0),
                           'wins', COALESCE(pg.wins, 0),
                           'accounts', %2$s
                         ) ORDER BY %3$s, p.current_pseudo, p.player_id) AS players_json
                  FROM player_contracts pc
                  JOIN players p ON p.player_id = pc.player_id
                  LEFT JOIN player_games pg ON pg.player_id = p.player_id
                  WHERE pc.end_date IS NULL
                    AND pc.team_id IN (SELECT team_id FROM page)
                  GROUP BY pc.team_id
                )
                SELECT pg.*, COALESCE(r.players_json, '[]'::json) AS players_json
                FROM page pg
                LEFT JOIN roster r ON r.team_id = pg.team_id
                ORDER BY %1$s
                """.formatted(order, SqlFragments.accountsJson("p.player_id"), SqlFragments.roleOrder("pc.role")));
        params.add(filters.getPerPage());
        params.add(filters.offset());

        return new BoundQuery(sql.toString(), params);
    }

    static BoundQuery teamCount(LeaderboardFilters filters) {
        List<Object> params = new ArrayList<>();
        String sql = teamPrefix(filters, params) + "\nSELECT COUNT(*) FROM teams_with_changes";
        return new BoundQuery(sql, params);
    }

    /**
     * CTEs through {@code teams_with_changes}. Top 5 contracted players by best-account
     * tier then LP make up a team; their games and LP are summed.
     */
    private static String teamPrefix(LeaderboardFilters filters, List<Object> params) {
        ReportingPeriod period = filters.period();
        ReportingPeriod previous = period.previous();

        ConditionList where = new ConditionList()
                .add("t.is_active = true")
                .addIn(InColumn.TEAM_LEAGUE, filters.getLeagues())
                .addIn(InColumn.RANKED_PLAYER_ROLE, filters.getRoles());
        String pattern = SearchSanitizer.containsPattern(filters.getSearch());
        if (pattern != null) {
            where.add("(t.current_name ILIKE ? OR t.short_name ILIKE ?)", pattern, pattern);
        }

        ConditionList having = new ConditionList();
        if (filters.getMinGames() > 0) {
            having.add("COALESCE(SUM(ds.games_played), 0) >= ?", filters.getMinGames());
        }

        StringBuilder sql = new StringBuilder("WITH ");
        sql.append(SqlFragments.latestRanksCte("prev_latest_ranks")).append(",\n");
        params.add(previous.start());
        params.add(previous.end());
        sql.append(SqlFragments.latestRanksCte("latest_ranks")).append(",\n");
        params.add(period.start());
        params.add(period.end());

        sql.append(rankedPlayersCtes("prev_", "prev_latest_ranks")).append(",\n");
        sql.append(rankedPlayersCtes("", "latest_ranks")).append(",\n");

        sql.append("""
                prev_team_stats AS (
                  SELECT prp.team_id,
                         COALESCE(SUM(ds.games_played), 0)::int AS games,
                         COALESCE(SUM(ds.wins), 0)::int AS wins
                  FROM prev_ranked_players prp
                  LEFT JOIN lol_daily_stats ds
                    ON ds.puuid = prp.best_puuid AND ds.date >= ? AND ds.date <= ?
                  WHERE prp.rn <= 5
                  GROUP BY prp.team_id
                ),
                team_stats AS (
                  SELECT t.team_id, t.slug, t.current_name, t.short_name, o.logo_url, t.region, t.league,
                         COALESCE(SUM(ds.games_played), 0)::int AS games,
                         COALESCE(SUM(ds.wins), 0)::int AS wins,
                         COALESCE(SUM(ds.total_game_duration), 0)::bigint AS total_duration,
                %s
                  FROM teams t
                  LEFT JOIN organizations o ON o.org_id = t.org_id
                  JOIN ranked_players rp ON rp.team_id = t.team_id AND rp.rn <= 5
                  LEFT JOIN lol_daily_stats ds
                    ON ds.puuid = rp.best_puuid AND ds.date >= ? AND ds.date <= ?
                  %s
                  GROUP BY t.team_id, o.org_id
                  %s
                ),
                teams_with_changes AS (
                  SELECT ts.*,
                         COALESCE(tl.total_lp, 0) AS total_lp,
                         COALESCE(pts.games, 0) AS prev_games,
                         COALESCE(pts.wins, 0) AS prev_wins,
                         (COALESCE(tl.total_lp, 0) - COALESCE(ptl.total_lp, 0))::int AS total_lp_change
                  FROM team_stats ts
                  LEFT JOIN team_lp tl ON tl.team_id = ts.team_id
                  LEFT JOIN prev_team_stats pts ON pts.team_id = ts.team_id
                  LEFT JOIN prev_team_lp ptl ON ptl.team_id = ts.team_id
                )""".formatted(WINRATE_CALC, where.where(), having.having()));
        params.add(previous.start());
        params.add(previous.end());
        params.add(period.start());
        params.add(period.end());
        params.addAll(where.params());
        params.addAll(having.params());

        return sql.toString();
    }

    /**
     * Best account per contracted player, players ranked inside their team, team LP of the top 5.
     * Contains no placeholders.
     */
    private static String rankedPlayersCtes(String prefix, String ranksCte) {
        return """
                %1$splayer_best AS (
                  SELECT pc.team_id, pc.player_id, pc.role, acc.puuid, lr.tier,
                         %3$s AS player_lp,
                         ROW_NUMBER() OVER (
                           PARTITION BY pc.player_id
                           ORDER BY %4$s, %3$s DESC, acc.account_id
                         ) AS account_rn
                  FROM player_contracts pc
                  JOIN lol_accounts acc ON acc.player_id = pc.player_id
                  JOIN %2$s lr ON lr.puuid = acc.puuid
                  WHERE pc.end_date IS NULL AND lr.tier IS NOT NULL
                ),
                %1$sranked_players AS (
                  SELECT team_id, player_id, role, puuid AS best_puuid, player_lp,
                         ROW_NUMBER() OVER (
                           PARTITION BY team_id
                           ORDER BY %5$s, player_lp DESC, player_id
                         ) AS rn
                  FROM %1$splayer_best
                  WHERE account_rn = 1
                ),
                %1$steam_lp AS (
                  SELECT team_id, SUM(player_lp)::int AS total_lp
                  FROM %1$sranked_players
                  WHERE rn <= 5
                  GROUP BY team_id
                )""".formatted(prefix, ranksCte,
                effectiveLp("lr.tier", "lr.lp"), tierOrder("lr.tier"), tierOrder("tier"));
    }

    // ---- players ----------------------------------------------------------

    static BoundQuery playerPage(LeaderboardFilters filters) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(playerPrefix(filters, params));
        ReportingPeriod period = filters.period();
        String order = playerOrder(filters);

        sql.append(",\n").append(SqlFragments.accountStatsCte("account_stats"));
        params.add(period.start());
        params.add(period.end());

        sql.append("""
                ,
                page AS (
                  SELECT pwc.*, COUNT(*) OVER() AS total_count
                  FROM players_with_changes pwc
                  ORDER BY %1$s
                  LIMIT ? OFFSET ?
                )
                SELECT pg.*, %2$s AS accounts_json
                FROM page pg
                ORDER BY %1$s
                """.formatted(order, SqlFragments.accountsJson("pg.player_id")));
        params.add(filters.getPerPage());
        params.add(filters.offset());

        return new BoundQuery(sql.toString(), params);
    }

    static BoundQuery playerCount(LeaderboardFilters filters) {
        List<Object> params = new ArrayList<>();
        String sql = playerPrefix(filters, params) + "\nSELECT COUNT(*) FROM players_with_changes";
        return new BoundQuery(sql, params);
    }

    static String playerOrder(LeaderboardFilters filters) {
        return filters.isIncludeUnranked()
                ? UNRANKED_PLAYER_ORDER
                : PLAYER_ORDER.get(filters.sortOrDefault());
    }

    /**
     * CTEs through {@code players_with_changes}.
     *
     * Ranked mode starts from players with a ranked account in the period and
     * inner-joins the best account's daily rows, so only players with data in the
     * window are listed. With {@code includeUnranked} every player under an active
     * contract is listed, and players without data get zero stats.
     */
    private static String playerPrefix(LeaderboardFilters filters, List<Object> params) {
        ReportingPeriod period = filters.period();
        ReportingPeriod previous = period.previous();

        ConditionList where = new ConditionList()
                .addIn(InColumn.TEAM_LEAGUE, filters.getLeagues())
                .addIn(InColumn.CONTRACT_ROLE, filters.getRoles());
        String pattern = SearchSanitizer.containsPattern(filters.getSearch());
        if (pattern != null) {
            where.add("p.current_pseudo ILIKE ?", pattern);
        }

        ConditionList having = new ConditionList();
        if (filters.getMinGames() > 0) {
            having.add("COALESCE(SUM(ds.games_played), 0) >= ?", filters.getMinGames());
        }

        StringBuilder sql = new StringBuilder("WITH ");
        sql.append(SqlFragments.latestRanksCte("prev_latest_ranks")).append(",\n");
        params.add(previous.start());
        params.add(previous.end());
        sql.append(SqlFragments.latestRanksCte("latest_ranks")).append(",\n");
        params.add(period.start());
        params.add(period.end());

        sql.append(playerBestCte("prev_player_best", "prev_latest_ranks")).append(",\n");
        sql.append(playerBestCte("player_best", "latest_ranks")).append(",\n");

        sql.append("""
                prev_player_stats AS (
                  SELECT pb.player_id,
                         COALESCE(SUM(ds.games_played), 0)::int AS games,
                         COALESCE(SUM(ds.wins), 0)::int AS wins,
                         MAX(pb.player_lp) AS total_lp
                  FROM prev_player_best pb
                  LEFT JOIN lol_daily_stats ds
                    ON ds.puuid = pb.puuid AND ds.date >= ? AND ds.date <= ?
                  WHERE pb.account_rn = 1
                  GROUP BY pb.player_id
                ),
                """);
        params.add(previous.start());
        params.add(previous.end());

        String playerSource = filters.isIncludeUnranked()
                ? """
                  FROM players p
                  JOIN player_contracts pc ON pc.player_id = p.player_id AND pc.end_date IS NULL
                  LEFT JOIN teams t ON t.team_id = pc.team_id
                  LEFT JOIN organizations o ON o.org_id = t.org_id
                  LEFT JOIN player_best pb ON pb.player_id = p.player_id AND pb.account_rn = 1
                  LEFT JOIN lol_daily_stats ds
                    ON ds.puuid = pb.puuid AND ds.date >= ? AND ds.date <= ?"""
                : """
                  FROM players p
                  JOIN player_best pb ON pb.player_id = p.player_id AND pb.account_rn = 1
                  LEFT JOIN player_contracts pc ON pc.player_id = p.player_id AND pc.end_date IS NULL
                  LEFT JOIN teams t ON t.team_id = pc.team_id
                  LEFT JOIN organizations o ON o.org_id = t.org_id
                  JOIN lol_daily_stats ds
                    ON ds.puuid = pb.puuid AND ds.date >= ? AND ds.date <= ?""";

        sql.append("""
                player_stats AS (
                  SELECT p.player_id, p.slug, p.current_pseudo,
                         t.team_id, t.slug AS team_slug, t.short_name AS team_short_name,
                         o.logo_url AS team_logo_url, t.region AS team_region, t.league AS team_league,
                         pc.role, pb.tier, pb.rank AS division,
                         COALESCE(pb.player_lp, 0) AS total_lp,
                         %s AS tier_order,
                         COALESCE(SUM(ds.games_played), 0)::int AS games,
                         COALESCE(SUM(ds.wins), 0)::int AS wins,
                         COALESCE(SUM(ds.total_game_duration), 0)::bigint AS total_duration,
                %s
                %s
                  %s
                  GROUP BY p.player_id, t.team_id, o.org_id, pc.role, pb.tier, pb.rank, pb.player_lp
                  %s
                ),
                players_with_changes AS (
                  SELECT ps.*,
                         COALESCE(pps.games, 0) AS prev_games,
                         COALESCE(pps.wins, 0) AS prev_wins,
                         (ps.total_lp - COALESCE(pps.total_lp, 0))::int AS total_lp_change
                  FROM player_stats ps
                  LEFT JOIN prev_player_stats pps ON pps.player_id = ps.player_id
                )""".formatted(tierOrder("pb.tier"), WINRATE_CALC, playerSource,
                where.where(), having.having()));
        params.add(period.start());
        params.add(period.end());
        params.addAll(where.params());
        params.addAll(having.params());

        return sql.toString();
    }

    /**
     * Best account per player over all ranked accounts in the window. No placeholders.
     */
    private static String playerBestCte(String name, String ranksCte) {
        return """
                %1$s AS (
                  SELECT acc.player_id, acc.puuid, lr.tier, lr.rank,
                         %3$s AS player_lp,
                         ROW_NUMBER() OVER (
                           PARTITION BY acc.player_id
                           ORDER BY %4$s, %3$s DESC, acc.account_id
                         ) AS account_rn
                  FROM lol_accounts acc
                  JOIN %2$s lr ON lr.puuid = acc.puuid
                  WHERE lr.tier IS NOT NULL
                )""".formatted(name, ranksCte, effectiveLp("lr.tier", "lr.lp"), tierOrder("lr.tier"));
    }
}
