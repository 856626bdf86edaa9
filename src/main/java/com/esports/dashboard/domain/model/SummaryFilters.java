package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryFilters {

    private LocalDate startDate;
    private LocalDate endDate;
    private List<String> leagues;

    public ReportingPeriod period() {
        return new ReportingPeriod(startDate, endDate);
    }
}
