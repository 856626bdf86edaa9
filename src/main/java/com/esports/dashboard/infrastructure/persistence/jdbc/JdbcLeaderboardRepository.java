package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.LeaderboardFilters;
import com.esports.dashboard.domain.model.PlayerLeaderboardEntry;
import com.esports.dashboard.domain.model.PlayerRef;
import com.esports.dashboard.domain.model.TeamInfo;
import com.esports.dashboard.domain.model.TeamLeaderboardEntry;
import com.esports.dashboard.domain.model.TeamRef;
import com.esports.dashboard.domain.ranking.Winrates;
import com.esports.dashboard.infrastructure.persistence.repository.LeaderboardRepository;
import com.esports.dashboard.infrastructure.persistence.repository.RowSlice;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Team and player leaderboards, one round trip per page.
 *
 * The total row count comes from COUNT(*) OVER() on the page rows. An empty
 * page therefore carries no total; the caller decides whether to run the
 * count query.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcLeaderboardRepository implements LeaderboardRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    @Override
    public RowSlice<TeamLeaderboardEntry> findTeamPage(LeaderboardFilters filters) {
        BoundQuery query = LeaderboardQueries.teamPage(filters);
        long[] total = {0};
        List<TeamLeaderboardEntry> rows = jdbcTemplate.query(query.sql(), (rs, rowNum) -> {
            total[0] = rs.getLong("total_count");
            return mapTeam(rs);
        }, query.paramArray());
        log.debug("Team leaderboard page: {} rows of {}", rows.size(), total[0]);
        return new RowSlice<>(rows, total[0]);
    }

    @Override
    public long countTeams(LeaderboardFilters filters) {
        BoundQuery query = LeaderboardQueries.teamCount(filters);
        Long count = jdbcTemplate.queryForObject(query.sql(), Long.class, query.paramArray());
        return count != null ? count : 0;
    }

    @Override
    public RowSlice<PlayerLeaderboardEntry> findPlayerPage(LeaderboardFilters filters) {
        BoundQuery query = LeaderboardQueries.playerPage(filters);
        long[] total = {0};
        List<PlayerLeaderboardEntry> rows = jdbcTemplate.query(query.sql(), (rs, rowNum) -> {
            total[0] = rs.getLong("total_count");
            return mapPlayer(rs);
        }, query.paramArray());
        log.debug("Player leaderboard page: {} rows of {}", rows.size(), total[0]);
        return new RowSlice<>(rows, total[0]);
    }

    @Override
    public long countPlayers(LeaderboardFilters filters) {
        BoundQuery query = LeaderboardQueries.playerCount(filters);
        Long count = jdbcTemplate.queryForObject(query.sql(), Long.class, query.paramArray());
        return count != null ? count : 0;
    }

    private TeamLeaderboardEntry mapTeam(ResultSet rs) throws SQLException {
        int games = rs.getInt("games");
        int wins = rs.getInt("wins");
        int prevGames = rs.getInt("prev_games");
        int prevWins = rs.getInt("prev_wins");
        double winrate = Winrates.percent(wins, games);

        return TeamLeaderboardEntry.builder()
                .team(TeamInfo.builder()
                        .teamId(rs.getInt("team_id"))
                        .slug(rs.getString("slug"))
                        .currentName(rs.getString("current_name"))
                        .shortName(rs.getString("short_name"))
                        .logoUrl(rs.getString("logo_url"))
                        .region(rs.getString("region"))
                        .league(rs.getString("league"))
                        .build())
                .games(games)
                .gamesChange(games - prevGames)
                .winrate(winrate)
                .winrateChange(Winrates.change(winrate, Winrates.percent(prevWins, prevGames)))
                .totalMinutes(Winrates.minutes(rs.getLong("total_duration")))
                .totalLp(rs.getInt("total_lp"))
                .totalLpChange(rs.getInt("total_lp_change"))
                .players(jsonColumns.roster(rs.getString("players_json")))
                .build();
    }

    private PlayerLeaderboardEntry mapPlayer(ResultSet rs) throws SQLException {
        int games = rs.getInt("games");
        int wins = rs.getInt("wins");
        int prevGames = rs.getInt("prev_games");
        int prevWins = rs.getInt("prev_wins");
        double winrate = Winrates.percent(wins, games);
        int totalLp = rs.getInt("total_lp");

        return PlayerLeaderboardEntry.builder()
                .player(PlayerRef.builder()
                        .playerId(rs.getInt("player_id"))
                        .slug(rs.getString("slug"))
                        .pseudo(rs.getString("current_pseudo"))
                        .build())
                .team(mapTeamRef(rs))
                .role(rs.getString("role"))
                .games(games)
                .gamesChange(games - prevGames)
                .winrate(winrate)
                .winrateChange(Winrates.change(winrate, Winrates.percent(prevWins, prevGames)))
                .totalMinutes(Winrates.minutes(rs.getLong("total_duration")))
                .tier(rs.getString("tier"))
                .division(rs.getString("division"))
                .lp(totalLp)
                .totalLp(totalLp)
                .totalLpChange(rs.getInt("total_lp_change"))
                .accounts(jsonColumns.accounts(rs.getString("accounts_json")))
                .build();
    }

    private static TeamRef mapTeamRef(ResultSet rs) throws SQLException {
        Integer teamId = rs.getObject("team_id", Integer.class);
        if (teamId == null) {
            return null;
        }
        return TeamRef.builder()
                .teamId(teamId)
                .slug(rs.getString("team_slug"))
                .shortName(rs.getString("team_short_name"))
                .logoUrl(rs.getString("team_logo_url"))
                .region(rs.getString("team_region"))
                .league(rs.getString("team_league"))
                .build();
    }
}
