package com.esports.dashboard.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive date window used by every dashboard query.
 */
public final class ReportingPeriod {

    private final LocalDate start;
    private final LocalDate end;

    public ReportingPeriod(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        this.start = start;
        this.end = end;
    }

    public LocalDate start() {
        return start;
    }

    public LocalDate end() {
        return end;
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    /**
     * Window of the same length ending the day before {@link #start()}.
     * Jan 10-16 gives Jan 3-9.
     */
    public ReportingPeriod previous() {
        LocalDate prevEnd = start.minusDays(1);
        return new ReportingPeriod(prevEnd.minusDays(lengthInDays() - 1), prevEnd);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReportingPeriod)) {
            return false;
        }
        ReportingPeriod other = (ReportingPeriod) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
