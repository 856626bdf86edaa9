package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Request for per-entity daily history of up to 50 teams or players.
 * {@code entityIds} are positive and deduplicated by the API layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchHistoryFilters {

    private LocalDate startDate;
    private LocalDate endDate;
    private HistoryPeriod period;
    private List<Integer> entityIds;

    public ReportingPeriod reportingPeriod() {
        return new ReportingPeriod(startDate, endDate);
    }

    public HistoryPeriod periodOrDefault() {
        return period != null ? period : HistoryPeriod.DAY;
    }
}
