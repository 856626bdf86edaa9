package com.esports.dashboard.domain.service;

import com.esports.dashboard.domain.model.BatchHistoryFilters;
import com.esports.dashboard.domain.model.HistoryPeriod;
import com.esports.dashboard.domain.model.HistoryPoint;
import com.esports.dashboard.domain.model.PlayerHistory;
import com.esports.dashboard.domain.model.TeamHistory;
import com.esports.dashboard.domain.ranking.Winrates;
import com.esports.dashboard.infrastructure.cache.DashboardCacheKeys;
import com.esports.dashboard.infrastructure.persistence.entity.PlayerEntity;
import com.esports.dashboard.infrastructure.persistence.entity.TeamEntity;
import com.esports.dashboard.infrastructure.persistence.repository.HistoryRepository;
import com.esports.dashboard.infrastructure.persistence.repository.HistoryRow;
import com.esports.dashboard.infrastructure.persistence.repository.PlayerRepository;
import com.esports.dashboard.infrastructure.persistence.repository.TeamRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Daily history for many teams or players at once.
 *
 * One SQL round trip for all requested ids, one more for their names.
 * Ids with no data in the window are left out of the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryService {

    private static final TypeReference<Map<Integer, TeamHistory>> TEAM_HISTORY = new TypeReference<>() {
    };
    private static final TypeReference<Map<Integer, PlayerHistory>> PLAYER_HISTORY = new TypeReference<>() {
    };

    private final HistoryRepository historyRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final CachedQueryExecutor cachedQueryExecutor;

    @Value("${app.cache.ttl.history:180}")
    private long historyTtl;

    @Value("${app.query.timeout-ms.batch-history:15000}")
    private long batchHistoryTimeoutMs;

    public Map<Integer, TeamHistory> getBatchTeamHistory(BatchHistoryFilters filters) {
        return cachedQueryExecutor.getOrSet("getBatchTeamHistory", DashboardCacheKeys.HISTORY_TEAM,
                filters, TEAM_HISTORY, historyTtl, batchHistoryTimeoutMs, () -> {
                    List<HistoryRow> rows = historyRepository.findTeamHistory(
                            filters.reportingPeriod(), filters.getEntityIds());
                    Map<Integer, List<HistoryPoint>> series = toSeries(rows, filters.periodOrDefault());

                    Map<Integer, TeamEntity> teams = teamRepository.findAllById(series.keySet()).stream()
                            .collect(Collectors.toMap(TeamEntity::getTeamId, Function.identity()));

                    Map<Integer, TeamHistory> result = new LinkedHashMap<>();
                    series.forEach((teamId, points) -> {
                        TeamEntity team = teams.get(teamId);
                        result.put(teamId, TeamHistory.builder()
                                .teamId(teamId)
                                .teamName(team != null ? team.getCurrentName() : null)
                                .shortName(team != null ? team.getShortName() : null)
                                .data(points)
                                .build());
                    });

                    log.info("Batch team history: {} of {} teams with data", result.size(),
                            filters.getEntityIds().size());
                    return result;
                });
    }

    public Map<Integer, PlayerHistory> getBatchPlayerHistory(BatchHistoryFilters filters) {
        return cachedQueryExecutor.getOrSet("getBatchPlayerHistory", DashboardCacheKeys.HISTORY_PLAYER,
                filters, PLAYER_HISTORY, historyTtl, batchHistoryTimeoutMs, () -> {
                    List<HistoryRow> rows = historyRepository.findPlayerHistory(
                            filters.reportingPeriod(), filters.getEntityIds());
                    Map<Integer, List<HistoryPoint>> series = toSeries(rows, filters.periodOrDefault());

                    Map<Integer, PlayerEntity> players = playerRepository.findAllById(series.keySet()).stream()
                            .collect(Collectors.toMap(PlayerEntity::getPlayerId, Function.identity()));

                    Map<Integer, PlayerHistory> result = new LinkedHashMap<>();
                    series.forEach((playerId, points) -> {
                        PlayerEntity player = players.get(playerId);
                        result.put(playerId, PlayerHistory.builder()
                                .playerId(playerId)
                                .playerName(player != null ? player.getCurrentPseudo() : null)
                                .data(points)
                                .build());
                    });

                    log.info("Batch player history: {} of {} players with data", result.size(),
                            filters.getEntityIds().size());
                    return result;
                });
    }

    /**
     * Group rows by entity, keeping the date order of the query.
     */
    static Map<Integer, List<HistoryPoint>> toSeries(List<HistoryRow> rows, HistoryPeriod period) {
        Map<Integer, List<HistoryPoint>> series = new LinkedHashMap<>();
        for (HistoryRow row : rows) {
            series.computeIfAbsent(row.getEntityId(), id -> new ArrayList<>())
                    .add(HistoryPoint.builder()
                            .date(row.getDate())
                            .label(period.label(row.getDate()))
                            .games(row.getGames())
                            .wins(row.getWins())
                            .winrate(Winrates.percent(row.getWins(), row.getGames()))
                            .totalLp(row.getTotalLp())
                            .build());
        }
        return series;
    }
}
