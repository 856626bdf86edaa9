package com.esports.dashboard.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ReportingPeriodTest {

    @Test
    void testPrevious_SameLengthEndingDayBeforeStart() {
        // Given
        ReportingPeriod period = new ReportingPeriod(LocalDate.of(2024, 1, 10), LocalDate.of(2024, 1, 16));

        // When
        ReportingPeriod previous = period.previous();

        // Then
        assertEquals(LocalDate.of(2024, 1, 3), previous.start());
        assertEquals(LocalDate.of(2024, 1, 9), previous.end());
        assertEquals(7, previous.lengthInDays());
    }

    @Test
    void testPrevious_SingleDay() {
        ReportingPeriod day = new ReportingPeriod(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 1));

        assertEquals(new ReportingPeriod(LocalDate.of(2024, 2, 29), LocalDate.of(2024, 2, 29)), day.previous());
    }

    @Test
    void testConstructor_EndBeforeStartRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReportingPeriod(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)));
    }
}
