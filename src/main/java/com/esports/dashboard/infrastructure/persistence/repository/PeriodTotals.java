package com.esports.dashboard.infrastructure.persistence.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeriodTotals {
    private long games;
    private long wins;
    private long durationSeconds;
}
