package com.esports.dashboard.domain.ranking;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TierTest {

    @Test
    void testParse() {
        assertEquals(Tier.CHALLENGER, Tier.parse("challenger"));
        assertEquals(Tier.MASTER, Tier.parse(" Master "));
        assertNull(Tier.parse("UNRANKED"));
        assertNull(Tier.parse(" "));
        assertNull(Tier.parse(null));
    }

    @Test
    void testOrder_ChallengerFirstIronLast() {
        assertTrue(Tier.CHALLENGER.compareTo(Tier.GRANDMASTER) < 0);
        assertTrue(Tier.MASTER.compareTo(Tier.DIAMOND) < 0);
        assertEquals(Tier.IRON, Tier.values()[Tier.values().length - 1]);
    }

    @ParameterizedTest
    @CsvSource({
            "CHALLENGER, 1500, 1500",
            "GRANDMASTER, 700, 700",
            "MASTER, 0, 0",
            "DIAMOND, 99, 0",
            "IRON, 50, 0",
            "'', 300, 0"
    })
    void testEffectiveLp(String tier, int lp, int expected) {
        assertEquals(expected, Tier.effectiveLp(tier, lp));
    }

    @Test
    void testEffectiveLp_NullLp() {
        assertEquals(0, Tier.effectiveLp("MASTER", null));
    }
}
