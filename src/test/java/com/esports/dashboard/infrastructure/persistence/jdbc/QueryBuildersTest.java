package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.LeaderboardFilters;
import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.domain.model.SortDirection;
import com.esports.dashboard.domain.model.SortOption;
import com.esports.dashboard.domain.model.StreakFilters;
import com.esports.dashboard.domain.model.TopFilters;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Placeholder counts must always match the bound values, whichever optional filters are present.
 */
class QueryBuildersTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 10);
    private static final LocalDate END = LocalDate.of(2024, 1, 16);

    static Stream<LeaderboardFilters> leaderboardFilters() {
        return Stream.of(
                LeaderboardFilters.builder().startDate(START).endDate(END).page(1).perPage(20).build(),
                LeaderboardFilters.builder().startDate(START).endDate(END).page(3).perPage(10)
                        .leagues(List.of("LEC", "LFL")).roles(List.of("MID"))
                        .minGames(5).search("kc").sort(SortOption.LP).build(),
                LeaderboardFilters.builder().startDate(START).endDate(END).page(1).perPage(50)
                        .search("100%_win").includeUnranked(true).build());
    }

    static Stream<TopFilters> topFilters() {
        return Stream.of(
                TopFilters.builder().startDate(START).endDate(END).limit(5).build(),
                TopFilters.builder().startDate(START).endDate(END).limit(10)
                        .leagues(List.of("LEC")).roles(List.of("TOP", "SUP")).minGames(3)
                        .sortDirection(SortDirection.ASC).build());
    }

    private static long placeholders(BoundQuery query) {
        return query.sql().chars().filter(c -> c == '?').count();
    }

    private static void assertBound(BoundQuery query) {
        assertEquals(placeholders(query), query.params().size(), query.sql());
    }

    @ParameterizedTest
    @MethodSource("leaderboardFilters")
    void testLeaderboardQueries_PlaceholdersMatchParams(LeaderboardFilters filters) {
        assertBound(LeaderboardQueries.teamPage(filters));
        assertBound(LeaderboardQueries.teamCount(filters));
        assertBound(LeaderboardQueries.playerPage(filters));
        assertBound(LeaderboardQueries.playerCount(filters));
    }

    @ParameterizedTest
    @MethodSource("topFilters")
    void testTopListQueries_PlaceholdersMatchParams(TopFilters filters) {
        assertBound(TopListQueries.playerGrinders(filters));
        assertBound(TopListQueries.teamGrinders(filters));
        assertBound(TopListQueries.playerGainers(filters));
        assertBound(TopListQueries.teamGainers(filters));
        assertBound(TopListQueries.playerLosers(filters));
        assertBound(TopListQueries.teamLosers(filters));
    }

    @Test
    void testStreaksAndHistoryAndSummary_PlaceholdersMatchParams() {
        ReportingPeriod period = new ReportingPeriod(START, END);

        assertBound(TopListQueries.streaks(new StreakFilters(null, 5), true));
        assertBound(TopListQueries.streaks(new StreakFilters(List.of("LEC", "LCK"), 5), false));
        assertBound(HistoryQueries.teams(period, List.of(1, 2, 3)));
        assertBound(HistoryQueries.players(period, List.of(7)));
        assertBound(SummaryQueries.totals(period, null));
        assertBound(SummaryQueries.totals(period, List.of("LEC")));
        assertBound(SummaryQueries.masterPlusLp(period, List.of("LEC", "LFL")));
    }

    @Test
    void testTeamPage_ParamsInPlaceholderOrder() {
        // Given
        LeaderboardFilters filters = LeaderboardFilters.builder().startDate(START).endDate(END)
                .page(2).perPage(20).leagues(List.of("LEC")).minGames(4).build();

        // When
        List<Object> params = LeaderboardQueries.teamPage(filters).params();

        // Then: previous window (Jan 3-9) comes first, LIMIT/OFFSET last
        assertEquals(LocalDate.of(2024, 1, 3), params.get(0));
        assertEquals(LocalDate.of(2024, 1, 9), params.get(1));
        assertEquals(START, params.get(2));
        assertEquals(END, params.get(3));
        assertTrue(params.contains("LEC"));
        assertEquals(20, params.get(params.size() - 2));
        assertEquals(20, params.get(params.size() - 1));
    }

    @Test
    void testSearch_BoundNotInlined() {
        LeaderboardFilters filters = LeaderboardFilters.builder().startDate(START).endDate(END)
                .page(1).perPage(20).search("x' OR 1=1 --").build();

        BoundQuery query = LeaderboardQueries.playerPage(filters);

        assertFalse(query.sql().contains("1=1"));
        assertTrue(query.params().contains("%x' OR 1=1 --%"));
    }

    @Test
    void testPlayerOrder_UnrankedIgnoresSort() {
        LeaderboardFilters filters = LeaderboardFilters.builder().sort(SortOption.GAMES).includeUnranked(true).build();

        assertEquals(LeaderboardQueries.UNRANKED_PLAYER_ORDER, LeaderboardQueries.playerOrder(filters));
    }

    @Test
    void testLosers_DefaultDirectionListsBiggestDropFirst() {
        TopFilters filters = TopFilters.builder().startDate(START).endDate(END).limit(5).build();

        assertTrue(TopListQueries.playerLosers(filters).sql().contains("ORDER BY lp_change ASC"));
        assertTrue(TopListQueries.playerGainers(filters).sql().contains("ORDER BY lp_change DESC"));
        assertTrue(TopListQueries.teamLosers(filters).sql().contains("ORDER BY lp_change ASC"));
        assertTrue(TopListQueries.teamGainers(filters).sql().contains("ORDER BY lp_change DESC"));
    }

    @Test
    void testLosers_AscendingDirectionIsReversed() {
        TopFilters filters = TopFilters.builder().startDate(START).endDate(END).limit(5)
                .sortDirection(SortDirection.ASC).build();

        assertTrue(TopListQueries.playerLosers(filters).sql().contains("ORDER BY lp_change DESC"));
        assertTrue(TopListQueries.teamLosers(filters).sql().contains("ORDER BY lp_change DESC"));
        assertTrue(TopListQueries.playerGainers(filters).sql().contains("ORDER BY lp_change ASC"));
    }

    @Test
    void testGainers_BestAccountChosenAtPeriodEnd() {
        // Given
        TopFilters filters = TopFilters.builder().startDate(START).endDate(END).limit(5).build();

        // When
        BoundQuery query = TopListQueries.playerGainers(filters);

        // Then: the window opens the query, start LP comes from the last snapshot on or before the start
        assertTrue(query.sql().startsWith("WITH last_lp AS"));
        assertTrue(query.sql().contains("WHERE ds.date >= ? AND ds.date <= ? AND ds.tier IN ('CHALLENGER', 'GRANDMASTER', 'MASTER')"));
        assertEquals(List.of(START, END, START, START, END, 5), query.params());
        assertTrue(query.sql().contains("WHERE lp_change > 0"));
        assertTrue(TopListQueries.teamGainers(filters).sql().contains("HAVING SUM(lp_change) > 0"));
    }

    @Test
    void testLosers_BestAccountChosenAtPeriodStart() {
        // Given
        TopFilters filters = TopFilters.builder().startDate(START).endDate(END).limit(5).build();

        // When
        BoundQuery query = TopListQueries.playerLosers(filters);

        // Then: Master+ on or before the start, compared with the last snapshot on or before the end
        assertTrue(query.sql().startsWith("WITH first_lp AS"));
        assertTrue(query.sql().contains("WHERE ds.date <= ? AND ds.tier IN ('CHALLENGER', 'GRANDMASTER', 'MASTER')"));
        assertEquals(List.of(START, END, START, END, 5), query.params());
        assertTrue(query.sql().contains("WHERE lp_change < 0"));
        assertTrue(TopListQueries.teamLosers(filters).sql().contains("HAVING SUM(lp_change) < 0"));
    }

    @Test
    void testMinGames_IsHavingOnPeriodGames() {
        LeaderboardFilters leaderboard = LeaderboardFilters.builder().startDate(START).endDate(END)
                .page(1).perPage(20).minGames(5).build();
        TopFilters top = TopFilters.builder().startDate(START).endDate(END).limit(5).minGames(5).build();

        assertTrue(LeaderboardQueries.teamPage(leaderboard).sql().contains("HAVING COALESCE(SUM(ds.games_played), 0) >= ?"));
        assertTrue(LeaderboardQueries.playerPage(leaderboard).sql().contains("HAVING COALESCE(SUM(ds.games_played), 0) >= ?"));
        assertTrue(TopListQueries.playerGrinders(top).sql().contains("HAVING COALESCE(SUM(ds.games_played), 0) >= ?"));
        assertTrue(TopListQueries.teamLosers(top).sql().contains("HAVING SUM(lp_change) < 0 AND SUM(games) >= ?"));
    }

    @Test
    void testTeamPage_TopFiveByTierThenLp() {
        String sql = LeaderboardQueries.teamPage(LeaderboardFilters.builder().startDate(START).endDate(END)
                .page(1).perPage(20).sort(SortOption.LP).build()).sql();

        assertTrue(sql.contains("JOIN ranked_players rp ON rp.team_id = t.team_id AND rp.rn <= 5"));
        assertTrue(sql.contains("PARTITION BY team_id\n"));
        assertTrue(sql.contains("THEN COALESCE(lr.lp, 0) ELSE 0 END AS player_lp"));
        assertTrue(sql.contains("ORDER BY total_lp DESC, team_id ASC"));
    }

    @Test
    void testPlayerPage_RankedJoinsStatsUnrankedKeepsEveryone() {
        LeaderboardFilters ranked = LeaderboardFilters.builder().startDate(START).endDate(END)
                .page(1).perPage(20).sort(SortOption.WINRATE).build();
        LeaderboardFilters unranked = LeaderboardFilters.builder().startDate(START).endDate(END)
                .page(1).perPage(20).includeUnranked(true).build();

        String rankedSql = LeaderboardQueries.playerPage(ranked).sql();
        String unrankedSql = LeaderboardQueries.playerPage(unranked).sql();

        assertTrue(rankedSql.contains("\nJOIN player_best pb ON pb.player_id = p.player_id AND pb.account_rn = 1\n"));
        assertTrue(rankedSql.contains("\nJOIN lol_daily_stats ds\n"));
        assertTrue(rankedSql.contains("ORDER BY winrate_calc DESC, player_id ASC"));

        assertTrue(unrankedSql.contains("\nLEFT JOIN player_best pb ON pb.player_id = p.player_id AND pb.account_rn = 1\n"));
        assertTrue(unrankedSql.contains("\nLEFT JOIN lol_daily_stats ds\n"));
        assertFalse(unrankedSql.contains("\nJOIN lol_daily_stats ds\n"));
        assertTrue(unrankedSql.contains("ORDER BY " + LeaderboardQueries.UNRANKED_PLAYER_ORDER));
    }
}
