package com.esports.dashboard.infrastructure.cache;

/**
 * Key prefixes used under the {@code dashboard} namespace.
 */
public final class DashboardCacheKeys {

    public static final String LEADERBOARD_TEAM = "leaderboard:team";
    public static final String LEADERBOARD_PLAYER = "leaderboard:player";
    public static final String GRINDERS = "grinders";
    public static final String LP_GAINERS = "lp:gainers";
    public static final String LP_LOSERS = "lp:losers";
    public static final String HISTORY_TEAM = "history:team";
    public static final String HISTORY_PLAYER = "history:player";
    public static final String STREAKS_WIN = "streaks:win";
    public static final String STREAKS_LOSS = "streaks:loss";
    public static final String SUMMARY = "summary";

    private DashboardCacheKeys() {
    }
}
