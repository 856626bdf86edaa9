package com.esports.dashboard.infrastructure.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pattern-based invalidation of dashboard cache entries.
 *
 * Filters are hashed into the key, so entries cannot be targeted per team or
 * player; invalidation always drops every entry of the affected views.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheInvalidationService {

    private static final List<String> LEADERBOARD_VIEWS = List.of(
            "leaderboard", "grinders", "lp", "streaks", DashboardCacheKeys.SUMMARY);

    private final QueryCache cache;

    /**
     * Drop leaderboards, top lists, streaks and summaries.
     */
    public long invalidateLeaderboards() {
        long removed = 0;
        for (String view : LEADERBOARD_VIEWS) {
            removed += cache.deletePattern(CacheKeyBuilder.pattern(view));
        }
        log.info("Leaderboard caches invalidated: {} keys", removed);
        return removed;
    }

    public long invalidateHistory() {
        long removed = cache.deletePattern(CacheKeyBuilder.pattern("history"));
        log.info("History caches invalidated: {} keys", removed);
        return removed;
    }

    /**
     * Entries that embed team rosters: team leaderboards and team history.
     */
    public long invalidateTeamViews() {
        return cache.deletePattern(CacheKeyBuilder.pattern(DashboardCacheKeys.LEADERBOARD_TEAM))
                + cache.deletePattern(CacheKeyBuilder.pattern(DashboardCacheKeys.HISTORY_TEAM));
    }

    public long invalidatePlayerViews() {
        return cache.deletePattern(CacheKeyBuilder.pattern(DashboardCacheKeys.LEADERBOARD_PLAYER))
                + cache.deletePattern(CacheKeyBuilder.pattern(DashboardCacheKeys.HISTORY_PLAYER));
    }

    public long invalidateAll() {
        long removed = cache.deletePattern(CacheKeyBuilder.NAMESPACE + ":*");
        log.info("All dashboard caches invalidated: {} keys", removed);
        return removed;
    }
}
