package com.esports.dashboard.domain.service;

import com.esports.dashboard.domain.model.BatchHistoryFilters;
import com.esports.dashboard.domain.model.HistoryPeriod;
import com.esports.dashboard.domain.model.HistoryPoint;
import com.esports.dashboard.domain.model.PlayerHistory;
import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.domain.model.TeamHistory;
import com.esports.dashboard.infrastructure.persistence.entity.PlayerEntity;
import com.esports.dashboard.infrastructure.persistence.entity.TeamEntity;
import com.esports.dashboard.infrastructure.persistence.repository.HistoryRepository;
import com.esports.dashboard.infrastructure.persistence.repository.HistoryRow;
import com.esports.dashboard.infrastructure.persistence.repository.PlayerRepository;
import com.esports.dashboard.infrastructure.persistence.repository.TeamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HistoryServiceTest {

    private static final LocalDate JAN_10 = LocalDate.of(2024, 1, 10);
    private static final LocalDate JAN_11 = LocalDate.of(2024, 1, 11);

    @Mock
    private HistoryRepository historyRepository;

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private CachedQueryExecutor cachedQueryExecutor;

    private HistoryService historyService;

    @BeforeEach
    void setUp() {
        historyService = new HistoryService(historyRepository, teamRepository, playerRepository, cachedQueryExecutor);
        lenient().when(cachedQueryExecutor.getOrSet(anyString(), anyString(), any(), any(), anyLong(), anyLong(), any()))
                .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(6).get());
    }

    private static BatchHistoryFilters filters(List<Integer> ids) {
        return BatchHistoryFilters.builder()
                .startDate(JAN_10)
                .endDate(JAN_11)
                .period(HistoryPeriod.DAY)
                .entityIds(ids)
                .build();
    }

    @Test
    void testGetBatchTeamHistory_IdsWithoutDataOmitted() {
        // Given
        when(historyRepository.findTeamHistory(new ReportingPeriod(JAN_10, JAN_11), List.of(4, 8, 15)))
                .thenReturn(List.of(
                        new HistoryRow(4, JAN_10, 10, 6, 2400),
                        new HistoryRow(4, JAN_11, 0, 0, 2450),
                        new HistoryRow(15, JAN_10, 3, 1, 0)));
        when(teamRepository.findAllById(Set.of(4, 15))).thenReturn(List.of(
                TeamEntity.builder().teamId(4).currentName("Karmine Corp").shortName("KC").build()));

        // When
        Map<Integer, TeamHistory> result = historyService.getBatchTeamHistory(filters(List.of(4, 8, 15)));

        // Then
        assertEquals(List.of(4, 15), List.copyOf(result.keySet()));

        TeamHistory kc = result.get(4);
        assertEquals("Karmine Corp", kc.getTeamName());
        assertEquals("KC", kc.getShortName());
        assertEquals(2, kc.getData().size());
        assertEquals(60.0, kc.getData().get(0).getWinrate());
        assertEquals(0.0, kc.getData().get(1).getWinrate());
        assertEquals(2450, kc.getData().get(1).getTotalLp());

        // Name lookup missed: series still returned
        assertNull(result.get(15).getTeamName());
    }

    @Test
    void testGetBatchPlayerHistory_NamesFromPlayers() {
        // Given
        when(historyRepository.findPlayerHistory(any(), eq(List.of(21))))
                .thenReturn(List.of(new HistoryRow(21, JAN_10, 12, 7, 812)));
        when(playerRepository.findAllById(Set.of(21))).thenReturn(List.of(
                PlayerEntity.builder().playerId(21).slug("caliste").currentPseudo("Caliste").build()));

        // When
        Map<Integer, PlayerHistory> result = historyService.getBatchPlayerHistory(filters(List.of(21)));

        // Then
        PlayerHistory history = result.get(21);
        assertEquals("Caliste", history.getPlayerName());
        assertEquals(812, history.getData().get(0).getTotalLp());
        assertEquals("10 Jan", history.getData().get(0).getLabel());
    }

    @Test
    void testGetBatchPlayerHistory_NoRows() {
        when(historyRepository.findPlayerHistory(any(), anyList())).thenReturn(List.of());
        when(playerRepository.findAllById(Set.of())).thenReturn(List.of());

        assertTrue(historyService.getBatchPlayerHistory(filters(List.of(1, 2))).isEmpty());
    }

    @Test
    void testToSeries_LabelsFollowPeriod() {
        // Given
        List<HistoryRow> rows = List.of(
                new HistoryRow(1, LocalDate.of(2024, 3, 1), 2, 1, 0),
                new HistoryRow(1, LocalDate.of(2024, 3, 2), 4, 4, 0));

        // When
        Map<Integer, List<HistoryPoint>> month = HistoryService.toSeries(rows, HistoryPeriod.MONTH);
        Map<Integer, List<HistoryPoint>> year = HistoryService.toSeries(rows, HistoryPeriod.YEAR);

        // Then
        assertEquals("1", month.get(1).get(0).getLabel());
        assertEquals("2", month.get(1).get(1).getLabel());
        assertEquals("Mar", year.get(1).get(0).getLabel());
        assertEquals(100.0, month.get(1).get(1).getWinrate());
    }
}
