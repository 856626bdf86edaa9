package com.esports.dashboard.domain.ranking;

import com.esports.dashboard.domain.model.RankedAccount;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks a player's representative account.
 *
 * Order:
 * 1. Tier, CHALLENGER first; unranked accounts last
 * 2. Effective LP descending (Master+ only, lower tiers count as 0)
 * 3. Account id ascending, so equal accounts resolve the same way on every request
 */
public final class BestAccountSelector {

    public static final Comparator<RankedAccount> ACCOUNT_ORDER = Comparator
            .comparingInt((RankedAccount account) -> tierIndex(account.getTier()))
            .thenComparing(Comparator.comparingInt(
                    (RankedAccount account) -> Tier.effectiveLp(account.getTier(), account.getLp())).reversed())
            .thenComparing(RankedAccount::getAccountId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final int UNRANKED_INDEX = Tier.values().length;

    private BestAccountSelector() {
    }

    /**
     * Best ranked account, ignoring accounts with no tier in the period.
     */
    public static Optional<RankedAccount> findBest(List<RankedAccount> accounts) {
        if (accounts == null) {
            return Optional.empty();
        }
        return accounts.stream()
                .filter(account -> Tier.parse(account.getTier()) != null)
                .min(ACCOUNT_ORDER);
    }

    /**
     * LP of the best account as it counts toward rankings; 0 below MASTER or with no ranked account.
     */
    public static int bestLp(List<RankedAccount> accounts) {
        return findBest(accounts)
                .map(account -> Tier.effectiveLp(account.getTier(), account.getLp()))
                .orElse(0);
    }

    /**
     * Copy of the accounts in display order, best first.
     */
    public static List<RankedAccount> sorted(List<RankedAccount> accounts) {
        if (accounts == null) {
            return new ArrayList<>();
        }
        List<RankedAccount> copy = new ArrayList<>(accounts);
        copy.sort(ACCOUNT_ORDER);
        return copy;
    }

    static int tierIndex(String tier) {
        Tier parsed = Tier.parse(tier);
        return parsed != null ? parsed.ordinal() : UNRANKED_INDEX;
    }
}
