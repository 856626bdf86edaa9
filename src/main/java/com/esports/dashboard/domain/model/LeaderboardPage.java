package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a leaderboard. An out-of-range page has empty {@code data}
 * and the same {@code meta.total} as any other page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardPage<T> {

    private List<T> data;
    private PageMeta meta;
}
