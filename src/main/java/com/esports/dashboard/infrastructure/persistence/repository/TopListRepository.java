package com.esports.dashboard.infrastructure.persistence.repository;

import com.esports.dashboard.domain.model.GrinderEntry;
import com.esports.dashboard.domain.model.LpChangeEntry;
import com.esports.dashboard.domain.model.StreakEntry;
import com.esports.dashboard.domain.model.StreakFilters;
import com.esports.dashboard.domain.model.TopFilters;

import java.util.List;

/**
 * Top-N reads, already ordered and limited. Entries carry no rank.
 */
public interface TopListRepository {

    List<GrinderEntry> findPlayerGrinders(TopFilters filters);

    List<GrinderEntry> findTeamGrinders(TopFilters filters);

    List<LpChangeEntry> findPlayerGainers(TopFilters filters);

    List<LpChangeEntry> findTeamGainers(TopFilters filters);

    List<LpChangeEntry> findPlayerLosers(TopFilters filters);

    List<LpChangeEntry> findTeamLosers(TopFilters filters);

    List<StreakEntry> findWinStreaks(StreakFilters filters);

    List<StreakEntry> findLossStreaks(StreakFilters filters);
}
