package com.esports.dashboard.domain.ranking;

import com.esports.dashboard.domain.model.RosterPlayer;

import java.util.Comparator;
import java.util.Map;

/**
 * Display order of roles in a roster: Top, Jungle, Mid, ADC/Bot, Support, then anything else.
 */
public final class RolePriority {

    private static final int UNKNOWN = 6;

    private static final Map<String, Integer> PRIORITIES = Map.ofEntries(
            Map.entry("Top", 1),
            Map.entry("TOP", 1),
            Map.entry("Jungle", 2),
            Map.entry("JGL", 2),
            Map.entry("Mid", 3),
            Map.entry("MID", 3),
            Map.entry("ADC", 4),
            Map.entry("Bot", 4),
            Map.entry("BOT", 4),
            Map.entry("Support", 5),
            Map.entry("SUP", 5)
    );

    /**
     * Stable: players sharing a role keep their incoming order.
     */
    public static final Comparator<RosterPlayer> ROSTER_ORDER =
            Comparator.comparingInt(player -> of(player.getRole()));

    private RolePriority() {
    }

    public static int of(String role) {
        if (role == null) {
            return UNKNOWN;
        }
        return PRIORITIES.getOrDefault(role, UNKNOWN);
    }
}
