package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.EntityRef;
import com.esports.dashboard.domain.model.EntityType;
import com.esports.dashboard.domain.model.GrinderEntry;
import com.esports.dashboard.domain.model.LpChangeEntry;
import com.esports.dashboard.domain.model.PlayerRef;
import com.esports.dashboard.domain.model.StreakEntry;
import com.esports.dashboard.domain.model.StreakFilters;
import com.esports.dashboard.domain.model.TeamRef;
import com.esports.dashboard.domain.model.TopFilters;
import com.esports.dashboard.infrastructure.persistence.repository.TopListRepository;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcTopListRepository implements TopListRepository {

    private static final String NO_TEAM = "N/A";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<GrinderEntry> findPlayerGrinders(TopFilters filters) {
        return query(TopListQueries.playerGrinders(filters), (rs, rowNum) -> GrinderEntry.builder()
                .entity(playerEntity(rs))
                .entityType(EntityType.PLAYER)
                .team(contractTeam(rs))
                .role(rs.getString("role"))
                .games(rs.getInt("games"))
                .build());
    }

    @Override
    public List<GrinderEntry> findTeamGrinders(TopFilters filters) {
        return query(TopListQueries.teamGrinders(filters), (rs, rowNum) -> GrinderEntry.builder()
                .entity(teamEntity(rs))
                .entityType(EntityType.TEAM)
                .games(rs.getInt("games"))
                .build());
    }

    @Override
    public List<LpChangeEntry> findPlayerGainers(TopFilters filters) {
        return query(TopListQueries.playerGainers(filters), this::mapPlayerLpChange);
    }

    @Override
    public List<LpChangeEntry> findTeamGainers(TopFilters filters) {
        return query(TopListQueries.teamGainers(filters), this::mapTeamLpChange);
    }

    @Override
    public List<LpChangeEntry> findPlayerLosers(TopFilters filters) {
        return query(TopListQueries.playerLosers(filters), this::mapPlayerLpChange);
    }

    @Override
    public List<LpChangeEntry> findTeamLosers(TopFilters filters) {
        return query(TopListQueries.teamLosers(filters), this::mapTeamLpChange);
    }

    @Override
    public List<StreakEntry> findWinStreaks(StreakFilters filters) {
        return query(TopListQueries.streaks(filters, true), this::mapStreak);
    }

    @Override
    public List<StreakEntry> findLossStreaks(StreakFilters filters) {
        return query(TopListQueries.streaks(filters, false), this::mapStreak);
    }

    private <T> List<T> query(BoundQuery query, RowMapper<T> mapper) {
        return jdbcTemplate.query(query.sql(), mapper, query.paramArray());
    }

    private LpChangeEntry mapPlayerLpChange(ResultSet rs, int rowNum) throws SQLException {
        return LpChangeEntry.builder()
                .entity(playerEntity(rs))
                .entityType(EntityType.PLAYER)
                .team(contractTeam(rs))
                .lpChange(rs.getInt("lp_change"))
                .games(rs.getInt("games"))
                .build();
    }

    private LpChangeEntry mapTeamLpChange(ResultSet rs, int rowNum) throws SQLException {
        return LpChangeEntry.builder()
                .entity(teamEntity(rs))
                .entityType(EntityType.TEAM)
                .lpChange(rs.getInt("lp_change"))
                .games(rs.getInt("games"))
                .build();
    }

    /**
     * Streaks are stored signed; loss streaks are reported by length.
     */
    private StreakEntry mapStreak(ResultSet rs, int rowNum) throws SQLException {
        Integer teamId = rs.getObject("team_id", Integer.class);
        String shortName = rs.getString("team_short_name");
        return StreakEntry.builder()
                .player(PlayerRef.builder()
                        .playerId(rs.getInt("player_id"))
                        .slug(rs.getString("slug"))
                        .pseudo(rs.getString("current_pseudo"))
                        .build())
                .team(TeamRef.builder()
                        .teamId(teamId)
                        .slug(rs.getString("team_slug"))
                        .shortName(shortName != null ? shortName : NO_TEAM)
                        .build())
                .streak(Math.abs(rs.getInt("streak")))
                .build();
    }

    private static EntityRef playerEntity(ResultSet rs) throws SQLException {
        return EntityRef.builder()
                .id(rs.getInt("player_id"))
                .slug(rs.getString("slug"))
                .name(rs.getString("current_pseudo"))
                .build();
    }

    private static EntityRef teamEntity(ResultSet rs) throws SQLException {
        return EntityRef.builder()
                .id(rs.getInt("team_id"))
                .slug(rs.getString("slug"))
                .name(rs.getString("current_name"))
                .shortName(rs.getString("short_name"))
                .logoUrl(rs.getString("logo_url"))
                .build();
    }

    private static TeamRef contractTeam(ResultSet rs) throws SQLException {
        Integer teamId = rs.getObject("team_id", Integer.class);
        if (teamId == null) {
            return null;
        }
        return TeamRef.builder()
                .teamId(teamId)
                .slug(rs.getString("team_slug"))
                .shortName(rs.getString("team_short_name"))
                .build();
    }
}
