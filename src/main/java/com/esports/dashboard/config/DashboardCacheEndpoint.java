package com.esports.dashboard.config;

import com.esports.dashboard.infrastructure.cache.CacheInvalidationService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.endpoint.InvalidEndpointRequestException;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Operator hook for dropping cached dashboard results after a data refresh.
 *
 * POST /actuator/dashboardcache/{scope} with scope one of
 * leaderboards, history, teams, players, all.
 */
@Component
@Endpoint(id = "dashboardcache")
@RequiredArgsConstructor
public class DashboardCacheEndpoint {

    private final CacheInvalidationService invalidationService;

    @WriteOperation
    public Map<String, Object> invalidate(@Selector String scope) {
        long removed = switch (scope) {
            case "leaderboards" -> invalidationService.invalidateLeaderboards();
            case "history" -> invalidationService.invalidateHistory();
            case "teams" -> invalidationService.invalidateTeamViews();
            case "players" -> invalidationService.invalidatePlayerViews();
            case "all" -> invalidationService.invalidateAll();
            default -> throw new InvalidEndpointRequestException("Unknown cache scope: " + scope, "Unknown cache scope");
        };
        return Map.of("scope", scope, "removedKeys", removed);
    }
}
