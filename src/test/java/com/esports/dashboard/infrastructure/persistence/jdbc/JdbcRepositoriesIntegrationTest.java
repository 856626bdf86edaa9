package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.GrinderEntry;
import com.esports.dashboard.domain.model.LeaderboardFilters;
import com.esports.dashboard.domain.model.LpChangeEntry;
import com.esports.dashboard.domain.model.PlayerLeaderboardEntry;
import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.domain.model.SortDirection;
import com.esports.dashboard.domain.model.SortOption;
import com.esports.dashboard.domain.model.StreakEntry;
import com.esports.dashboard.domain.model.StreakFilters;
import com.esports.dashboard.domain.model.TeamLeaderboardEntry;
import com.esports.dashboard.domain.model.TopFilters;
import com.esports.dashboard.infrastructure.persistence.repository.HistoryRow;
import com.esports.dashboard.infrastructure.persistence.repository.PeriodTotals;
import com.esports.dashboard.infrastructure.persistence.repository.RowSlice;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the hand-written SQL against PostgreSQL with the fixture in {@code db/seed.sql}.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcRepositoriesIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("esports")
            .withUsername("esports")
            .withPassword("password");

    private static final LocalDate START = LocalDate.of(2024, 1, 10);
    private static final LocalDate END = LocalDate.of(2024, 1, 16);

    private static JdbcLeaderboardRepository leaderboardRepository;
    private static JdbcTopListRepository topListRepository;
    private static JdbcHistoryRepository historyRepository;
    private static JdbcSummaryRepository summaryRepository;

    @BeforeAll
    static void setup() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new ResourceDatabasePopulator(
                new ClassPathResource("db/schema.sql"),
                new ClassPathResource("db/seed.sql")).execute(dataSource);

        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        leaderboardRepository = new JdbcLeaderboardRepository(jdbcTemplate, new JsonColumns(new ObjectMapper()));
        topListRepository = new JdbcTopListRepository(jdbcTemplate);
        historyRepository = new JdbcHistoryRepository(jdbcTemplate);
        summaryRepository = new JdbcSummaryRepository(jdbcTemplate);
    }

    private static LeaderboardFilters.LeaderboardFiltersBuilder leaderboard() {
        return LeaderboardFilters.builder().startDate(START).endDate(END).page(1).perPage(20);
    }

    private static TopFilters.TopFiltersBuilder top() {
        return TopFilters.builder().startDate(START).endDate(END).limit(10);
    }

    @Test
    void teamLeaderboardSumsTopFivePlayers() {
        RowSlice<TeamLeaderboardEntry> slice = leaderboardRepository.findTeamPage(
                leaderboard().sort(SortOption.LP).build());

        assertThat(slice.getTotal()).isEqualTo(2);
        assertThat(slice.getRows()).extracting(row -> row.getTeam().getTeamId()).containsExactly(1, 2);

        // players 3-7 (600..1000), not the first five by id (3000)
        TeamLeaderboardEntry kc = slice.getRows().get(0);
        assertThat(kc.getTotalLp()).isEqualTo(4000);
        assertThat(kc.getGames()).isEqualTo(50);
        assertThat(kc.getWinrate()).isEqualTo(60.0);
        assertThat(kc.getTeam().getLogoUrl()).isEqualTo("https://cdn.example/kc.png");

        // previous window: player 2 at 900 and player 1 at 200, 6 games
        assertThat(kc.getTotalLpChange()).isEqualTo(2900);
        assertThat(kc.getGamesChange()).isEqualTo(44);

        // the roster lists every contracted player, including the one without ranked data
        assertThat(kc.getPlayers()).hasSize(8);
        assertThat(kc.getPlayers()).allSatisfy(player -> assertThat(player.getAccounts()).hasSize(1));

        // DIAMOND 50 and DIAMOND 20 are in the top five but count as 0
        TeamLeaderboardEntry vitality = slice.getRows().get(1);
        assertThat(vitality.getTotalLp()).isEqualTo(1200);
        assertThat(vitality.getTotalLpChange()).isEqualTo(600);
        assertThat(vitality.getGames()).isEqualTo(67);
    }

    @Test
    void teamLeaderboardSortsByGames() {
        RowSlice<TeamLeaderboardEntry> slice = leaderboardRepository.findTeamPage(
                leaderboard().sort(SortOption.GAMES).build());

        assertThat(slice.getRows()).extracting(row -> row.getTeam().getTeamId()).containsExactly(2, 1);
    }

    @Test
    void teamLeaderboardFiltersBeforeCounting() {
        LeaderboardFilters filters = leaderboard().leagues(List.of("LFL")).build();

        assertThat(leaderboardRepository.findTeamPage(filters).getRows()).hasSize(1);
        assertThat(leaderboardRepository.countTeams(filters)).isEqualTo(1);
    }

    @Test
    void pageBeyondLastIsEmptyButCountable() {
        LeaderboardFilters filters = leaderboard().page(999).build();

        RowSlice<PlayerLeaderboardEntry> slice = leaderboardRepository.findPlayerPage(filters);

        assertThat(slice.getRows()).isEmpty();
        assertThat(leaderboardRepository.countPlayers(filters)).isEqualTo(10);
    }

    @Test
    void playerLeaderboardByLp() {
        RowSlice<PlayerLeaderboardEntry> slice = leaderboardRepository.findPlayerPage(
                leaderboard().sort(SortOption.LP).perPage(3).build());

        assertThat(slice.getTotal()).isEqualTo(10);
        assertThat(slice.getRows()).extracting(row -> row.getPlayer().getPlayerId()).containsExactly(8, 7, 6);

        PlayerLeaderboardEntry subMid = slice.getRows().get(1);
        assertThat(subMid.getTotalLp()).isEqualTo(1000);
        assertThat(subMid.getTotalLpChange()).isEqualTo(1000);
        assertThat(subMid.getTier()).isEqualTo("MASTER");
        assertThat(subMid.getTeam().getShortName()).isEqualTo("KC");
        assertThat(subMid.getAccounts()).extracting("puuid").containsExactly("puuid-7");

        PlayerLeaderboardEntry canna = leaderboardRepository.findPlayerPage(leaderboard().search("canna").build())
                .getRows().get(0);
        assertThat(canna.getTotalLp()).isEqualTo(400);
        assertThat(canna.getTotalLpChange()).isEqualTo(200);
    }

    @Test
    void playerLeaderboardIncludeUnrankedListsEveryContractedPlayer() {
        LeaderboardFilters filters = leaderboard().includeUnranked(true).sort(SortOption.GAMES).build();

        RowSlice<PlayerLeaderboardEntry> slice = leaderboardRepository.findPlayerPage(filters);

        // LP first, then tier, then pseudo; sort=games is ignored
        assertThat(slice.getTotal()).isEqualTo(11);
        assertThat(leaderboardRepository.countPlayers(filters)).isEqualTo(11);
        assertThat(slice.getRows()).extracting(row -> row.getPlayer().getPlayerId())
                .containsExactly(8, 7, 6, 5, 4, 3, 2, 1, 10, 9, 11);

        PlayerLeaderboardEntry rookie = slice.getRows().get(10);
        assertThat(rookie.getTotalLp()).isZero();
        assertThat(rookie.getGames()).isZero();
        assertThat(rookie.getTier()).isNull();

        assertThat(leaderboardRepository.countPlayers(leaderboard().build())).isEqualTo(10);
    }

    @Test
    void playerLeaderboardSearchAndMinGames() {
        assertThat(leaderboardRepository.findPlayerPage(leaderboard().search("lyn").build()).getRows())
                .extracting(row -> row.getPlayer().getPseudo()).containsExactly("Lyncas");
        assertThat(leaderboardRepository.findPlayerPage(leaderboard().minGames(20).build()).getRows())
                .extracting(row -> row.getPlayer().getPlayerId()).containsExactly(9);
        assertThat(leaderboardRepository.findPlayerPage(leaderboard().search("100%").build()).getRows())
                .isEmpty();
    }

    @Test
    void grinders() {
        List<GrinderEntry> players = topListRepository.findPlayerGrinders(top().limit(3).build());
        List<GrinderEntry> teams = topListRepository.findTeamGrinders(top().build());

        assertThat(players).extracting(row -> row.getEntity().getId()).containsExactly(9, 1, 2);
        assertThat(players.get(0).getGames()).isEqualTo(60);
        assertThat(teams).extracting(GrinderEntry::getGames).containsExactly(70, 67);
    }

    @Test
    void lpGainersStartFromLastApexSnapshotBeforeWindow() {
        List<LpChangeEntry> gainers = topListRepository.findPlayerGainers(top().build());

        // player 2 dropped from 900 to 500 and is not a gainer
        assertThat(gainers).extracting(row -> row.getEntity().getId()).containsExactly(8, 7, 6, 5, 4, 3, 1);
        assertThat(gainers).extracting(LpChangeEntry::getLpChange)
                .containsExactly(1200, 1000, 900, 800, 700, 600, 200);

        assertThat(topListRepository.findTeamGainers(top().build()))
                .extracting(LpChangeEntry::getLpChange).containsExactly(3800, 1200);
    }

    @Test
    void lpChangeListsAnchorGainersAtEndAndLosersAtStart() {
        List<Integer> gainers = topListRepository.findPlayerGainers(top().build()).stream()
                .map(row -> row.getEntity().getId()).toList();
        List<Integer> losers = topListRepository.findPlayerLosers(top().build()).stream()
                .map(row -> row.getEntity().getId()).toList();

        // player 8 is only Master+ inside the window, player 10 only before it
        assertThat(gainers).contains(8).doesNotContain(10);
        assertThat(losers).contains(10).doesNotContain(8);
    }

    @Test
    void lpLosersAscendingDirectionListsSmallestDropFirst() {
        List<LpChangeEntry> biggestFirst = topListRepository.findPlayerLosers(top().build());
        List<LpChangeEntry> smallestFirst = topListRepository.findPlayerLosers(
                top().sortDirection(SortDirection.ASC).build());

        assertThat(biggestFirst).extracting(LpChangeEntry::getLpChange).containsExactly(-600, -400);
        assertThat(smallestFirst).extracting(row -> row.getEntity().getId()).containsExactly(2, 10);
    }

    @Test
    void lpLosersCountDropBelowMasterAsZero() {
        List<LpChangeEntry> losers = topListRepository.findPlayerLosers(top().build());

        assertThat(losers).extracting(row -> row.getEntity().getId()).containsExactly(10, 2);
        assertThat(losers.get(0).getLpChange()).isEqualTo(-600);
        assertThat(losers.get(0).getGames()).isEqualTo(5);

        // KC: player 1 +200 and player 2 -400
        assertThat(topListRepository.findTeamLosers(top().build()))
                .extracting(LpChangeEntry::getLpChange).containsExactly(-600, -200);
    }

    @Test
    void streaks() {
        StreakFilters filters = new StreakFilters(null, 5);

        assertThat(topListRepository.findWinStreaks(filters)).extracting(StreakEntry::getStreak).containsExactly(5, 3);
        assertThat(topListRepository.findLossStreaks(filters)).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getStreak()).isEqualTo(4);
                    assertThat(entry.getPlayer().getPseudo()).isEqualTo("Lyncas");
                });
        assertThat(topListRepository.findWinStreaks(new StreakFilters(List.of("LEC"), 5)))
                .extracting(entry -> entry.getPlayer().getPlayerId()).containsExactly(8);
    }

    @Test
    void batchTeamHistoryOmitsIdsWithoutData() {
        List<HistoryRow> rows = historyRepository.findTeamHistory(new ReportingPeriod(START, END), List.of(1, 2, 99));

        assertThat(rows).extracting(HistoryRow::getEntityId).containsExactly(1, 2, 2, 2);
        HistoryRow kc = rows.get(0);
        assertThat(kc.getDate()).isEqualTo(END);
        assertThat(kc.getTotalLp()).isEqualTo(4000);
        assertThat(kc.getGames()).isEqualTo(50);
        assertThat(kc.getWins()).isEqualTo(30);
        assertThat(rows).extracting(HistoryRow::getDate).containsSubsequence(
                LocalDate.of(2024, 1, 12), LocalDate.of(2024, 1, 14), LocalDate.of(2024, 1, 15));
    }

    @Test
    void batchPlayerHistory() {
        List<HistoryRow> rows = historyRepository.findPlayerHistory(new ReportingPeriod(START, END), List.of(8));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getDate()).isEqualTo(LocalDate.of(2024, 1, 15));
            assertThat(row.getTotalLp()).isEqualTo(1200);
            assertThat(row.getWins()).isEqualTo(2);
        });
    }

    @Test
    void summaryTotals() {
        ReportingPeriod period = new ReportingPeriod(START, END);

        PeriodTotals totals = summaryRepository.findTotals(period, null);
        assertThat(totals.getGames()).isEqualTo(137);
        assertThat(totals.getWins()).isEqualTo(65);
        assertThat(totals.getDurationSeconds()).isEqualTo(246_600);

        assertThat(summaryRepository.findMasterPlusLp(period, null)).isEqualTo(6100);
        assertThat(summaryRepository.findMasterPlusLp(period, List.of("LFL"))).isEqualTo(4900);
        assertThat(summaryRepository.findTotals(period.previous(), null).getGames()).isEqualTo(9);
    }
}
