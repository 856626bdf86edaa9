package com.esports.dashboard.infrastructure.persistence.repository;

import com.esports.dashboard.domain.model.ReportingPeriod;

import java.util.List;

public interface SummaryRepository {

    PeriodTotals findTotals(ReportingPeriod period, List<String> leagues);

    long findMasterPlusLp(ReportingPeriod period, List<String> leagues);
}
