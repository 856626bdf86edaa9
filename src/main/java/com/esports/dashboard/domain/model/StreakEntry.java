package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreakEntry {

    private int rank;
    private PlayerRef player;
    private TeamRef team;

    // Always positive; loss streaks are reported by length
    private int streak;
}
