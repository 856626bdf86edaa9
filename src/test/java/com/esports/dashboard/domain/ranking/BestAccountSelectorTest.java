package com.esports.dashboard.domain.ranking;

import com.esports.dashboard.domain.model.RankedAccount;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BestAccountSelectorTest {

    private static RankedAccount account(int id, String tier, int lp) {
        return RankedAccount.builder().accountId(id).tier(tier).rank("I").lp(lp).build();
    }

    @Test
    void testFindBest_TierBeatsLp() {
        // Given
        List<RankedAccount> accounts = List.of(
                account(1, "MASTER", 900),
                account(2, "GRANDMASTER", 450),
                account(3, "DIAMOND", 99));

        // When / Then
        assertEquals(2, BestAccountSelector.findBest(accounts).orElseThrow().getAccountId());
    }

    @Test
    void testFindBest_SameTierHigherLpWins() {
        List<RankedAccount> accounts = List.of(account(1, "CHALLENGER", 1200), account(2, "CHALLENGER", 1500));

        assertEquals(2, BestAccountSelector.findBest(accounts).orElseThrow().getAccountId());
    }

    @Test
    void testFindBest_TieResolvedByAccountId() {
        List<RankedAccount> accounts = List.of(account(9, "MASTER", 300), account(4, "MASTER", 300));

        assertEquals(4, BestAccountSelector.findBest(accounts).orElseThrow().getAccountId());
    }

    @Test
    void testFindBest_LpIgnoredBelowMaster() {
        // Stored LP of sub-Master accounts does not count, so the lower id wins
        List<RankedAccount> accounts = List.of(account(7, "DIAMOND", 10), account(3, "DIAMOND", 90));

        assertEquals(3, BestAccountSelector.findBest(accounts).orElseThrow().getAccountId());
    }

    @Test
    void testFindBest_UnrankedIgnored() {
        List<RankedAccount> accounts = List.of(account(1, null, 0), account(2, "", 0));

        assertTrue(BestAccountSelector.findBest(accounts).isEmpty());
        assertTrue(BestAccountSelector.findBest(null).isEmpty());
    }

    @Test
    void testBestLp() {
        assertEquals(650, BestAccountSelector.bestLp(List.of(account(1, "MASTER", 650), account(2, "GOLD", 80))));
        assertEquals(0, BestAccountSelector.bestLp(List.of(account(1, "EMERALD", 75))));
        assertEquals(0, BestAccountSelector.bestLp(List.of()));
    }

    @Test
    void testSorted_UnrankedLastAndInputUntouched() {
        List<RankedAccount> accounts = List.of(
                account(5, null, 0),
                account(1, "MASTER", 100),
                account(2, "CHALLENGER", 900));

        List<RankedAccount> sorted = BestAccountSelector.sorted(accounts);

        assertEquals(List.of(2, 1, 5), sorted.stream().map(RankedAccount::getAccountId).collect(Collectors.toList()));
        assertEquals(5, accounts.get(0).getAccountId());
        assertTrue(BestAccountSelector.sorted(null).isEmpty());
    }
}
