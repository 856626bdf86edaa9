package com.esports.dashboard.domain.service;

import com.esports.dashboard.domain.model.GrinderEntry;
import com.esports.dashboard.domain.model.LpChangeEntry;
import com.esports.dashboard.domain.model.StreakEntry;
import com.esports.dashboard.domain.model.StreakFilters;
import com.esports.dashboard.domain.model.TopFilters;
import com.esports.dashboard.domain.model.ViewMode;
import com.esports.dashboard.infrastructure.cache.DashboardCacheKeys;
import com.esports.dashboard.infrastructure.persistence.repository.TopListRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Top-N lists: grinders, LP gainers and losers, win and loss streaks.
 *
 * Each list is ordered and limited in SQL; ranks are assigned here (1..n).
 * LP lists use a short TTL since LP moves within the day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopListService {

    private static final TypeReference<List<GrinderEntry>> GRINDERS = new TypeReference<>() {
    };
    private static final TypeReference<List<LpChangeEntry>> LP_CHANGES = new TypeReference<>() {
    };
    private static final TypeReference<List<StreakEntry>> STREAKS = new TypeReference<>() {
    };

    private final TopListRepository topListRepository;
    private final CachedQueryExecutor cachedQueryExecutor;

    @Value("${app.cache.ttl.grinders:300}")
    private long grindersTtl;

    @Value("${app.cache.ttl.lp-changes:60}")
    private long lpChangesTtl;

    @Value("${app.cache.ttl.streaks:300}")
    private long streaksTtl;

    @Value("${app.query.timeout-ms.top-list:8000}")
    private long topListTimeoutMs;

    public List<GrinderEntry> getTopGrinders(TopFilters filters) {
        return cachedQueryExecutor.getOrSet("getTopGrinders", DashboardCacheKeys.GRINDERS,
                filters, GRINDERS, grindersTtl, topListTimeoutMs, () -> {
                    List<GrinderEntry> rows = filters.viewModeOrDefault() == ViewMode.TEAMS
                            ? topListRepository.findTeamGrinders(filters)
                            : topListRepository.findPlayerGrinders(filters);
                    for (int i = 0; i < rows.size(); i++) {
                        rows.get(i).setRank(i + 1);
                    }
                    return rows;
                });
    }

    public List<LpChangeEntry> getTopLpGainers(TopFilters filters) {
        return cachedQueryExecutor.getOrSet("getTopLpGainers", DashboardCacheKeys.LP_GAINERS,
                filters, LP_CHANGES, lpChangesTtl, topListTimeoutMs, () -> ranked(
                        filters.viewModeOrDefault() == ViewMode.TEAMS
                                ? topListRepository.findTeamGainers(filters)
                                : topListRepository.findPlayerGainers(filters)));
    }

    public List<LpChangeEntry> getTopLpLosers(TopFilters filters) {
        return cachedQueryExecutor.getOrSet("getTopLpLosers", DashboardCacheKeys.LP_LOSERS,
                filters, LP_CHANGES, lpChangesTtl, topListTimeoutMs, () -> ranked(
                        filters.viewModeOrDefault() == ViewMode.TEAMS
                                ? topListRepository.findTeamLosers(filters)
                                : topListRepository.findPlayerLosers(filters)));
    }

    public List<StreakEntry> getTopWinStreaks(StreakFilters filters) {
        return cachedQueryExecutor.getOrSet("getTopWinStreaks", DashboardCacheKeys.STREAKS_WIN,
                filters, STREAKS, streaksTtl, topListTimeoutMs,
                () -> rankedStreaks(topListRepository.findWinStreaks(filters)));
    }

    public List<StreakEntry> getTopLossStreaks(StreakFilters filters) {
        return cachedQueryExecutor.getOrSet("getTopLossStreaks", DashboardCacheKeys.STREAKS_LOSS,
                filters, STREAKS, streaksTtl, topListTimeoutMs,
                () -> rankedStreaks(topListRepository.findLossStreaks(filters)));
    }

    private static List<LpChangeEntry> ranked(List<LpChangeEntry> rows) {
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).setRank(i + 1);
        }
        return rows;
    }

    private static List<StreakEntry> rankedStreaks(List<StreakEntry> rows) {
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).setRank(i + 1);
        }
        return rows;
    }
}
