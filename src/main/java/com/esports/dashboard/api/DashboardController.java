package com.esports.dashboard.api;

import com.esports.dashboard.domain.model.BatchHistoryFilters;
import com.esports.dashboard.domain.model.DashboardSummary;
import com.esports.dashboard.domain.model.GrinderEntry;
import com.esports.dashboard.domain.model.HistoryPeriod;
import com.esports.dashboard.domain.model.LeaderboardFilters;
import com.esports.dashboard.domain.model.LeaderboardPage;
import com.esports.dashboard.domain.model.LpChangeEntry;
import com.esports.dashboard.domain.model.PlayerHistory;
import com.esports.dashboard.domain.model.PlayerLeaderboardEntry;
import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.domain.model.SortDirection;
import com.esports.dashboard.domain.model.SortOption;
import com.esports.dashboard.domain.model.StreakEntry;
import com.esports.dashboard.domain.model.StreakFilters;
import com.esports.dashboard.domain.model.SummaryFilters;
import com.esports.dashboard.domain.model.TeamHistory;
import com.esports.dashboard.domain.model.TeamLeaderboardEntry;
import com.esports.dashboard.domain.model.TopFilters;
import com.esports.dashboard.domain.model.ViewMode;
import com.esports.dashboard.domain.service.HistoryService;
import com.esports.dashboard.domain.service.LeaderboardService;
import com.esports.dashboard.domain.service.SummaryService;
import com.esports.dashboard.domain.service.TopListService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.esports.dashboard.api.InvalidParameterException.readParameter;

/**
 * REST API for the LoL dashboard.
 *
 * Endpoints:
 * - GET /api/v1/lol/dashboard/teams - Team leaderboard
 * - GET /api/v1/lol/dashboard/players - Player leaderboard
 * - GET /api/v1/lol/dashboard/top-grinders - Most games played
 * - GET /api/v1/lol/dashboard/top-lp-gainers - Biggest LP gains
 * - GET /api/v1/lol/dashboard/top-lp-losers - Biggest LP losses
 * - GET /api/v1/lol/dashboard/streaks - Current win streaks
 * - GET /api/v1/lol/dashboard/loss-streaks - Current loss streaks
 * - GET /api/v1/lol/dashboard/summary - Period totals
 * - GET /api/v1/lol/dashboard/batch-team-history - Daily history for many teams
 * - GET /api/v1/lol/dashboard/batch-player-history - Daily history for many players
 *
 * Common period parameters: period (day|month|year|custom), startDate, endDate, date (YYYY-MM-DD).
 * List parameters (leagues, roles) are comma-separated.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/lol/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final LeaderboardService leaderboardService;
    private final TopListService topListService;
    private final HistoryService historyService;
    private final SummaryService summaryService;
    private final DateRangeResolver dateRangeResolver;

    @Value("${app.pagination.default-per-page:20}")
    private int defaultPerPage;

    @Value("${app.pagination.max-per-page:100}")
    private int maxPerPage;

    @Value("${app.pagination.default-limit:5}")
    private int defaultLimit;

    @Value("${app.pagination.max-limit:10}")
    private int maxLimit;

    @Value("${app.batch.max-entity-ids:50}")
    private int maxEntityIds;

    /**
     * Team leaderboard.
     *
     * GET /api/v1/lol/dashboard/teams?period=day&leagues=LEC,LFL&sort=lp&page=1&perPage=20
     *
     * Response: {data: [...], meta: {total, perPage, currentPage, lastPage}}
     */
    @GetMapping("/teams")
    public ResponseEntity<LeaderboardPage<TeamLeaderboardEntry>> teams(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) List<String> leagues,
            @RequestParam(required = false) List<String> roles,
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer perPage,
            @RequestParam(required = false) String sort) {

        LeaderboardFilters filters = leaderboardFilters(period, startDate, endDate, date, leagues, roles,
                minGames, search, page, perPage, sort, false);
        log.info("Team leaderboard: period={}..{}, page={}, sort={}",
                filters.getStartDate(), filters.getEndDate(), filters.getPage(), filters.getSort().value());

        return ResponseEntity.ok(leaderboardService.getTeamLeaderboard(filters));
    }

    /**
     * Player leaderboard. {@code includeUnranked=true} lists every contracted player.
     */
    @GetMapping("/players")
    public ResponseEntity<LeaderboardPage<PlayerLeaderboardEntry>> players(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) List<String> leagues,
            @RequestParam(required = false) List<String> roles,
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer perPage,
            @RequestParam(required = false) String sort,
            @RequestParam(defaultValue = "false") boolean includeUnranked) {

        LeaderboardFilters filters = leaderboardFilters(period, startDate, endDate, date, leagues, roles,
                minGames, search, page, perPage, sort, includeUnranked);
        log.info("Player leaderboard: period={}..{}, page={}, sort={}, includeUnranked={}",
                filters.getStartDate(), filters.getEndDate(), filters.getPage(), filters.getSort().value(),
                includeUnranked);

        return ResponseEntity.ok(leaderboardService.getPlayerLeaderboard(filters));
    }

    @GetMapping("/top-grinders")
    public ResponseEntity<Map<String, List<GrinderEntry>>> topGrinders(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) List<String> leagues,
            @RequestParam(required = false) List<String> roles,
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) String viewMode) {

        TopFilters filters = topFilters(period, startDate, endDate, date, leagues, roles, minGames, limit,
                sort, viewMode);
        return ResponseEntity.ok(Map.of("data", topListService.getTopGrinders(filters)));
    }

    @GetMapping("/top-lp-gainers")
    public ResponseEntity<Map<String, List<LpChangeEntry>>> topLpGainers(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) List<String> leagues,
            @RequestParam(required = false) List<String> roles,
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) String viewMode) {

        TopFilters filters = topFilters(period, startDate, endDate, date, leagues, roles, minGames, limit,
                sort, viewMode);
        return ResponseEntity.ok(Map.of("data", topListService.getTopLpGainers(filters)));
    }

    /**
     * sort=desc (default) lists the biggest drops first.
     */
    @GetMapping("/top-lp-losers")
    public ResponseEntity<Map<String, List<LpChangeEntry>>> topLpLosers(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) List<String> leagues,
            @RequestParam(required = false) List<String> roles,
            @RequestParam(required = false) Integer minGames,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) String viewMode) {

        TopFilters filters = topFilters(period, startDate, endDate, date, leagues, roles, minGames, limit,
                sort, viewMode);
        return ResponseEntity.ok(Map.of("data", topListService.getTopLpLosers(filters)));
    }

    @GetMapping("/streaks")
    public ResponseEntity<Map<String, List<StreakEntry>>> streaks(
            @RequestParam(required = false) List<String> leagues,
            @RequestParam(required = false) Integer limit) {

        StreakFilters filters = new StreakFilters(cleanList(leagues), clampLimit(limit));
        return ResponseEntity.ok(Map.of("data", topListService.getTopWinStreaks(filters)));
    }

    @GetMapping("/loss-streaks")
    public ResponseEntity<Map<String, List<StreakEntry>>> lossStreaks(
            @RequestParam(required = false) List<String> leagues,
            @RequestParam(required = false) Integer limit) {

        StreakFilters filters = new StreakFilters(cleanList(leagues), clampLimit(limit));
        return ResponseEntity.ok(Map.of("data", topListService.getTopLossStreaks(filters)));
    }

    @GetMapping("/summary")
    public ResponseEntity<DashboardSummary> summary(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) List<String> leagues) {

        ReportingPeriod window = dateRangeResolver.resolve(period, startDate, endDate, date);
        SummaryFilters filters = new SummaryFilters(window.start(), window.end(), cleanList(leagues));
        return ResponseEntity.ok(summaryService.getSummary(filters));
    }

    /**
     * Daily history for up to 50 teams.
     *
     * GET /api/v1/lol/dashboard/batch-team-history?entityIds=1,2,3&period=month
     *
     * Response: {"1": {teamId, teamName, shortName, data: [...]}, ...}; teams without data are absent.
     */
    @GetMapping("/batch-team-history")
    public ResponseEntity<Map<Integer, TeamHistory>> batchTeamHistory(
            @RequestParam String entityIds,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date) {

        BatchHistoryFilters filters = batchFilters(entityIds, period, startDate, endDate, date);
        log.info("Batch team history: {} teams, period={}..{}", filters.getEntityIds().size(),
                filters.getStartDate(), filters.getEndDate());
        return ResponseEntity.ok(historyService.getBatchTeamHistory(filters));
    }

    @GetMapping("/batch-player-history")
    public ResponseEntity<Map<Integer, PlayerHistory>> batchPlayerHistory(
            @RequestParam String entityIds,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String date) {

        BatchHistoryFilters filters = batchFilters(entityIds, period, startDate, endDate, date);
        log.info("Batch player history: {} players, period={}..{}", filters.getEntityIds().size(),
                filters.getStartDate(), filters.getEndDate());
        return ResponseEntity.ok(historyService.getBatchPlayerHistory(filters));
    }

    private LeaderboardFilters leaderboardFilters(String period, String startDate, String endDate, String date,
                                                  List<String> leagues, List<String> roles, Integer minGames,
                                                  String search, Integer page, Integer perPage, String sort,
                                                  boolean includeUnranked) {
        ReportingPeriod window = dateRangeResolver.resolve(period, startDate, endDate, date);
        int pageSize = perPage == null ? defaultPerPage : Math.min(maxPerPage, Math.max(1, perPage));

        return LeaderboardFilters.builder()
                .startDate(window.start())
                .endDate(window.end())
                .leagues(cleanList(leagues))
                .roles(cleanList(roles))
                .minGames(minGames == null ? 0 : Math.max(0, minGames))
                .search(search == null || search.isBlank() ? null : search)
                .page(page == null ? 1 : Math.max(1, page))
                .perPage(pageSize)
                .sort(readParameter(() -> SortOption.fromValue(sort)))
                .includeUnranked(includeUnranked)
                .build();
    }

    private TopFilters topFilters(String period, String startDate, String endDate, String date,
                                  List<String> leagues, List<String> roles, Integer minGames, Integer limit,
                                  String sort, String viewMode) {
        ReportingPeriod window = dateRangeResolver.resolve(period, startDate, endDate, date);

        return TopFilters.builder()
                .startDate(window.start())
                .endDate(window.end())
                .leagues(cleanList(leagues))
                .roles(cleanList(roles))
                .minGames(minGames == null ? 0 : Math.max(0, minGames))
                .limit(clampLimit(limit))
                .sortDirection(SortDirection.fromValue(sort))
                .viewMode(readParameter(() -> ViewMode.fromValue(viewMode)))
                .build();
    }

    private BatchHistoryFilters batchFilters(String entityIds, String period, String startDate, String endDate,
                                             String date) {
        List<Integer> ids = EntityIdParser.parse(entityIds, maxEntityIds);
        HistoryPeriod historyPeriod = dateRangeResolver.resolvePeriod(period, startDate, endDate);
        ReportingPeriod window = dateRangeResolver.resolve(historyPeriod, startDate, endDate, date);

        return BatchHistoryFilters.builder()
                .startDate(window.start())
                .endDate(window.end())
                .period(historyPeriod)
                .entityIds(ids)
                .build();
    }

    private int clampLimit(Integer limit) {
        return limit == null ? defaultLimit : Math.min(maxLimit, Math.max(1, limit));
    }

    /**
     * Trimmed, non-blank values; null when nothing is left so the filter is skipped.
     */
    static List<String> cleanList(List<String> values) {
        if (values == null) {
            return null;
        }
        List<String> cleaned = values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .distinct()
                .collect(Collectors.toList());
        return cleaned.isEmpty() ? null : cleaned;
    }
}
