package com.esports.dashboard.infrastructure.persistence.jdbc;

import com.esports.dashboard.domain.model.ReportingPeriod;
import com.esports.dashboard.infrastructure.persistence.repository.PeriodTotals;
import com.esports.dashboard.infrastructure.persistence.repository.SummaryRepository;
import com.esports.dashboard.infrastructure.query.BoundQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcSummaryRepository implements SummaryRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public PeriodTotals findTotals(ReportingPeriod period, List<String> leagues) {
        BoundQuery query = SummaryQueries.totals(period, leagues);
        return jdbcTemplate.queryForObject(query.sql(), (rs, rowNum) -> new PeriodTotals(
                rs.getLong("games"),
                rs.getLong("wins"),
                rs.getLong("duration")
        ), query.paramArray());
    }

    @Override
    public long findMasterPlusLp(ReportingPeriod period, List<String> leagues) {
        BoundQuery query = SummaryQueries.masterPlusLp(period, leagues);
        Long total = jdbcTemplate.queryForObject(query.sql(), Long.class, query.paramArray());
        return total != null ? total : 0;
    }
}
