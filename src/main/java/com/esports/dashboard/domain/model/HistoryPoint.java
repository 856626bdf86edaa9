package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryPoint {

    private LocalDate date;
    private String label;
    private int games;
    private int wins;
    private double winrate;
    private int totalLp;
}
