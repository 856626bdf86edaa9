package com.esports.dashboard.domain.ranking;

import java.util.Locale;

/**
 * Ranked ladder tiers, best first. Declaration order is the comparison order.
 */
public enum Tier {
    CHALLENGER,
    GRANDMASTER,
    MASTER,
    DIAMOND,
    EMERALD,
    PLATINUM,
    GOLD,
    SILVER,
    BRONZE,
    IRON;

    /**
     * Only apex tiers rank by LP; everything below counts as 0 LP.
     */
    public boolean isMasterPlus() {
        return this == CHALLENGER || this == GRANDMASTER || this == MASTER;
    }

    /**
     * Parse a tier name case-insensitively; null for unranked or unknown values.
     */
    public static Tier parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * LP that counts toward rankings: the stored LP for Master+, otherwise 0.
     */
    public static int effectiveLp(String tier, Integer lp) {
        Tier parsed = parse(tier);
        if (parsed == null || !parsed.isMasterPlus() || lp == null) {
            return 0;
        }
        return lp;
    }
}
