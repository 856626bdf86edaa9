package com.esports.dashboard.infrastructure.persistence.repository;

import com.esports.dashboard.domain.model.ReportingPeriod;

import java.util.List;

/**
 * Batched daily history, ordered by entity id then date.
 */
public interface HistoryRepository {

    List<HistoryRow> findTeamHistory(ReportingPeriod period, List<Integer> teamIds);

    List<HistoryRow> findPlayerHistory(ReportingPeriod period, List<Integer> playerIds);
}
