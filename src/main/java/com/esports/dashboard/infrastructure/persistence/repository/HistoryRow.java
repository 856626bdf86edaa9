package com.esports.dashboard.infrastructure.persistence.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One day of one team or player.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRow {
    private int entityId;
    private LocalDate date;
    private int games;
    private int wins;
    private int totalLp;
}
