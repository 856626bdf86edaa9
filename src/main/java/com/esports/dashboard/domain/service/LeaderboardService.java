package com.esports.dashboard.domain.service;

import com.esports.dashboard.domain.model.LeaderboardFilters;
import com.esports.dashboard.domain.model.LeaderboardPage;
import com.esports.dashboard.domain.model.PageMeta;
import com.esports.dashboard.domain.model.PlayerLeaderboardEntry;
import com.esports.dashboard.domain.model.RankedAccount;
import com.esports.dashboard.domain.model.RosterPlayer;
import com.esports.dashboard.domain.model.TeamLeaderboardEntry;
import com.esports.dashboard.domain.ranking.BestAccountSelector;
import com.esports.dashboard.domain.ranking.RolePriority;
import com.esports.dashboard.infrastructure.cache.DashboardCacheKeys;
import com.esports.dashboard.infrastructure.persistence.repository.LeaderboardRepository;
import com.esports.dashboard.infrastructure.persistence.repository.RowSlice;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Team and player leaderboards.
 *
 * Query Flow:
 * 1. One round trip returns the page with embedded rosters / accounts and the total
 * 2. An empty page past the first runs a separate COUNT so {@code meta.total} stays accurate
 * 3. Ranks follow the page offset; rosters and accounts are put in display order
 *
 * Results are cached per filter set under {@code leaderboard:team} / {@code leaderboard:player}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaderboardService {

    private static final TypeReference<LeaderboardPage<TeamLeaderboardEntry>> TEAM_PAGE = new TypeReference<>() {
    };
    private static final TypeReference<LeaderboardPage<PlayerLeaderboardEntry>> PLAYER_PAGE = new TypeReference<>() {
    };

    private final LeaderboardRepository leaderboardRepository;
    private final CachedQueryExecutor cachedQueryExecutor;

    @Value("${app.cache.ttl.leaderboard:300}")
    private long leaderboardTtl;

    @Value("${app.query.timeout-ms.leaderboard:8000}")
    private long leaderboardTimeoutMs;

    public LeaderboardPage<TeamLeaderboardEntry> getTeamLeaderboard(LeaderboardFilters filters) {
        return cachedQueryExecutor.getOrSet("getTeamLeaderboard", DashboardCacheKeys.LEADERBOARD_TEAM,
                filters, TEAM_PAGE, leaderboardTtl, leaderboardTimeoutMs, () -> {
                    RowSlice<TeamLeaderboardEntry> slice = leaderboardRepository.findTeamPage(filters);
                    long total = total(slice, filters, leaderboardRepository::countTeams);

                    List<TeamLeaderboardEntry> rows = slice.getRows();
                    for (int i = 0; i < rows.size(); i++) {
                        TeamLeaderboardEntry entry = rows.get(i);
                        entry.setRank(filters.offset() + i + 1);
                        entry.setPlayers(arrangeRoster(entry.getPlayers()));
                    }

                    log.info("Team leaderboard: {} rows, total {}, page {}", rows.size(), total, filters.getPage());
                    return new LeaderboardPage<>(rows, PageMeta.of(total, filters.getPerPage(), filters.getPage()));
                });
    }

    public LeaderboardPage<PlayerLeaderboardEntry> getPlayerLeaderboard(LeaderboardFilters filters) {
        return cachedQueryExecutor.getOrSet("getPlayerLeaderboard", DashboardCacheKeys.LEADERBOARD_PLAYER,
                filters, PLAYER_PAGE, leaderboardTtl, leaderboardTimeoutMs, () -> {
                    RowSlice<PlayerLeaderboardEntry> slice = leaderboardRepository.findPlayerPage(filters);
                    long total = total(slice, filters, leaderboardRepository::countPlayers);

                    List<PlayerLeaderboardEntry> rows = slice.getRows();
                    for (int i = 0; i < rows.size(); i++) {
                        PlayerLeaderboardEntry entry = rows.get(i);
                        entry.setRank(filters.offset() + i + 1);
                        entry.setAccounts(BestAccountSelector.sorted(entry.getAccounts()));
                    }

                    log.info("Player leaderboard: {} rows, total {}, page {}", rows.size(), total, filters.getPage());
                    return new LeaderboardPage<>(rows, PageMeta.of(total, filters.getPerPage(), filters.getPage()));
                });
    }

    /**
     * The window count rides on the page rows, so an empty page past the first needs its own COUNT.
     */
    private static <T> long total(RowSlice<T> slice,
                                  LeaderboardFilters filters,
                                  ToLongFunction<LeaderboardFilters> counter) {
        if (!slice.getRows().isEmpty() || filters.getPage() <= 1) {
            return slice.getTotal();
        }
        return counter.applyAsLong(filters);
    }

    /**
     * Role order, accounts best first, and the player's rank taken from the best account.
     */
    static List<RosterPlayer> arrangeRoster(List<RosterPlayer> players) {
        List<RosterPlayer> roster = players != null ? new ArrayList<>(players) : new ArrayList<>();
        for (RosterPlayer player : roster) {
            List<RankedAccount> accounts = BestAccountSelector.sorted(player.getAccounts());
            player.setAccounts(accounts);

            Optional<RankedAccount> best = BestAccountSelector.findBest(accounts);
            player.setTier(best.map(RankedAccount::getTier).orElse(null));
            player.setRank(best.map(RankedAccount::getRank).orElse(null));
            player.setLp(best.map(RankedAccount::getLp).orElse(0));
        }
        roster.sort(RolePriority.ROSTER_ORDER);
        return roster;
    }
}
