package com.esports.dashboard.infrastructure.persistence.repository;

import com.esports.dashboard.domain.model.LeaderboardFilters;
import com.esports.dashboard.domain.model.PlayerLeaderboardEntry;
import com.esports.dashboard.domain.model.TeamLeaderboardEntry;

/**
 * Paged leaderboard reads. Returned entries carry no rank; the caller assigns it
 * from the page offset.
 */
public interface LeaderboardRepository {

    RowSlice<TeamLeaderboardEntry> findTeamPage(LeaderboardFilters filters);

    long countTeams(LeaderboardFilters filters);

    RowSlice<PlayerLeaderboardEntry> findPlayerPage(LeaderboardFilters filters);

    long countPlayers(LeaderboardFilters filters);
}
