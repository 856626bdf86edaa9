package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.infrastructure.persistence.repository.HistoryRepository;
import com.esports.dashboard.infrastructure.persistence.repository.HistoryRow;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcHistoryRepository implements HistoryRepository {

    private static final RowMapper<HistoryRow> HISTORY_ROW = (rs, rowNum) -> HistoryRow.builder()
            .entityId(rs.getInt("entity_id"))
            .date(rs.getObject("calc_date", LocalDate.class))
            .games(rs.getInt("games"))
            .wins(rs.getInt("wins"))
            .totalLp(rs.getInt("total_lp"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<HistoryRow> findTeamHistory(ReportingPeriod period, List<Integer> teamIds) {
        BoundQuery query = HistoryQueries.teams(period, teamIds);
        return jdbcTemplate.query(query.sql(), HISTORY_ROW, query.paramArray());
    }

    @Override
    public List<HistoryRow> findPlayerHistory(ReportingPeriod period, List<Integer> playerIds) {
        BoundQuery query = HistoryQueries.players(period, playerIds);
        return jdbcTemplate.query(query.sql(), HISTORY_ROW, query.paramArray());
    }
}
