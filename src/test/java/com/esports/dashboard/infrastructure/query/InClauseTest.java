package com.esports.dashboard.infrastructure.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InClauseTest {

    @Test
    void testOf_OnePlaceholderPerValue() {
        // When
        InClause clause = InClause.of(InColumn.TEAM_LEAGUE, List.of("LEC", "LFL", "LCK"));

        // Then
        assertEquals("t.league IN (?,?,?)", clause.condition());
        assertEquals(List.of("LEC", "LFL", "LCK"), clause.values());
    }

    @Test
    void testOf_KeepsValueOrderAndDuplicates() {
        InClause clause = InClause.of(InColumn.PLAYER_ID, List.of(3, 1, 3));

        assertEquals("p.player_id IN (?,?,?)", clause.condition());
        assertEquals(List.of(3, 1, 3), clause.values());
    }

    @Test
    void testOf_SingleValue() {
        assertEquals("pc.role IN (?)", InClause.of(InColumn.CONTRACT_ROLE, List.of("Mid")).condition());
    }

    @Test
    void testOf_EmptyListRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> InClause.of(InColumn.TEAM_LEAGUE, List.of()));
        assertEquals("IN clause requires at least one value", e.getMessage());
    }

    @Test
    void testOf_ValuesNeverReachTheFragment() {
        InClause clause = InClause.of(InColumn.TEAM_LEAGUE, List.of("LEC') OR 1=1 --"));

        assertEquals("t.league IN (?)", clause.condition());
        assertDoesNotThrow(() -> FilterConditionValidator.validate(clause.condition()));
    }

    @Test
    void testOf_EveryColumnPassesTheValidator() {
        for (InColumn column : InColumn.values()) {
            InClause clause = InClause.of(column, List.of(1, 2));
            assertDoesNotThrow(() -> FilterConditionValidator.validate(clause.condition()), column.name());
        }
    }
}
