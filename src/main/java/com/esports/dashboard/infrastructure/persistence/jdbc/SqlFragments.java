package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.ranking.Tier;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Fixed SQL expressions shared by the dashboard queries.
 *
 * Everything here is derived from enums and literal column names, never from request input.
 */
final class SqlFragments {

    static final String MASTER_PLUS_TIERS = Arrays.stream(Tier.values())
            .filter(Tier::isMasterPlus)
            .map(tier -> "'" + tier.name() + "'")
            .collect(Collectors.joining(", ", "(", ")"));

    private static final String TIER_ORDER_CASES = Arrays.stream(Tier.values())
            .map(tier -> "WHEN '" + tier.name() + "' THEN " + (tier.ordinal() + 1))
            .collect(Collectors.joining(" "));

    private static final int UNRANKED_ORDER = Tier.values().length + 1;

    private SqlFragments() {
    }

    /**
     * CHALLENGER = 1 ... IRON = 10, anything else (including NULL) = 11.
     */
    static String tierOrder(String tierColumn) {
        return "CASE " + tierColumn + " " + TIER_ORDER_CASES + " ELSE " + UNRANKED_ORDER + " END";
    }

    /**
     * LP counted for rankings: stored LP for Master+, 0 otherwise.
     */
    static String effectiveLp(String tierColumn, String lpColumn) {
        return "CASE WHEN " + tierColumn + " IN " + MASTER_PLUS_TIERS
                + " THEN COALESCE(" + lpColumn + ", 0) ELSE 0 END";
    }

    static String roleOrder(String roleColumn) {
        return "CASE " + roleColumn
                + " WHEN 'Top' THEN 1 WHEN 'TOP' THEN 1"
                + " WHEN 'Jungle' THEN 2 WHEN 'JGL' THEN 2"
                + " WHEN 'Mid' THEN 3 WHEN 'MID' THEN 3"
                + " WHEN 'ADC' THEN 4 WHEN 'Bot' THEN 4 WHEN 'BOT' THEN 4"
                + " WHEN 'Support' THEN 5 WHEN 'SUP' THEN 5"
                + " ELSE 6 END";
    }

    /**
     * Latest snapshot per account inside a date window (two placeholders: from, to).
     */
    static String latestRanksCte(String name) {
        return """
                %s AS (
                  SELECT DISTINCT ON (puuid) puuid, tier, rank, lp
                  FROM lol_daily_stats
                  WHERE date >= ? AND date <= ?
                  ORDER BY puuid, date DESC
                )""".formatted(name);
    }

    /**
     * Games and wins per account inside a date window (two placeholders: from, to).
     */
    static String accountStatsCte(String name) {
        return """
                %s AS (
                  SELECT puuid,
                         COALESCE(SUM(games_played), 0)::int AS games,
                         COALESCE(SUM(wins), 0)::int AS wins
                  FROM lol_daily_stats
                  WHERE date >= ? AND date <= ?
                  GROUP BY puuid
                )""".formatted(name);
    }

    /**
     * JSON array of a player's accounts with latest rank and period stats.
     * Expects CTEs {@code latest_ranks} and {@code account_stats} in scope.
     */
    static String accountsJson(String playerIdExpression) {
        return """
                COALESCE((
                  SELECT json_agg(json_build_object(
                    'accountId', a.account_id,
                    'puuid', a.puuid,
                    'gameName', a.game_name,
                    'tagLine', a.tag_line,
                    'region', a.region,
                    'tier', lr.tier,
                    'rank', lr.rank,
                    'lp', lr.lp,
                    'games', COALESCE(ast.games, 0),
                    'wins', COALESCE(ast.wins, 0)
                  ) ORDER BY a.account_id)
                  FROM lol_accounts a
                  LEFT JOIN latest_ranks lr ON lr.puuid = a.puuid
                  LEFT JOIN account_stats ast ON ast.puuid = a.puuid
                  WHERE a.player_id = %s
                ), '[]'::json)""".formatted(playerIdExpression);
    }
}
