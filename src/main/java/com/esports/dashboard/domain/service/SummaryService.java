package com.esports.dashboard.domain.service;

import com.esports.dashboard.domain.model.DashboardSummary;
import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.domain.model.SummaryFilters;
import com.esports.dashboard.domain.ranking.Winrates;
import com.esports.dashboard.infrastructure.cache.DashboardCacheKeys;
import com.esports.dashboard.infrastructure.persistence.repository.PeriodTotals;
import com.esports.dashboard.infrastructure.persistence.repository.SummaryRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Headline numbers for the dashboard: games, winrate, play time and LP,
 * each compared with the previous period of the same length.
 */
@Service
@RequiredArgsConstructor
public class SummaryService {

    private static final TypeReference<DashboardSummary> SUMMARY = new TypeReference<>() {
    };

    private final SummaryRepository summaryRepository;
    private final CachedQueryExecutor cachedQueryExecutor;

    @Value("${app.cache.ttl.summary:300}")
    private long summaryTtl;

    @Value("${app.query.timeout-ms.summary:5000}")
    private long summaryTimeoutMs;

    public DashboardSummary getSummary(SummaryFilters filters) {
        return cachedQueryExecutor.getOrSet("getSummary", DashboardCacheKeys.SUMMARY,
                filters, SUMMARY, summaryTtl, summaryTimeoutMs, () -> {
                    ReportingPeriod period = filters.period();
                    PeriodTotals current = summaryRepository.findTotals(period, filters.getLeagues());
                    PeriodTotals previous = summaryRepository.findTotals(period.previous(), filters.getLeagues());
                    long totalLp = summaryRepository.findMasterPlusLp(period, filters.getLeagues());
                    return summarize(current, previous, totalLp);
                });
    }

    static DashboardSummary summarize(PeriodTotals current, PeriodTotals previous, long totalLp) {
        double winrate = Winrates.percent(current.getWins(), current.getGames());
        double previousWinrate = Winrates.percent(previous.getWins(), previous.getGames());
        long minutes = Winrates.minutes(current.getDurationSeconds());
        long previousMinutes = Winrates.minutes(previous.getDurationSeconds());

        return DashboardSummary.builder()
                .totalGames((int) current.getGames())
                .totalGamesChange((int) (current.getGames() - previous.getGames()))
                .avgWinrate(winrate)
                .avgWinrateChange(Winrates.change(winrate, previousWinrate))
                .totalMinutes(minutes)
                .totalMinutesChange(minutes - previousMinutes)
                .totalLp((int) totalLp)
                .build();
    }
}
