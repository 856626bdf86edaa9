package com.esports.dashboard.api;

import com.esports.dashboard.domain.model.HistoryPeriod;
import com.esports.dashboard.domain.model.ReportingPeriod;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Turns the dashboard's period parameters into a concrete date window.
 *
 * - day: the 7 days ending on {@code date} (default today)
 * - month / year: the calendar month or year containing {@code date}
 * - custom: {@code startDate}..{@code endDate}; a missing start means 7 days before the end
 *
 * Without a period, an explicit startDate and endDate pair is treated as custom.
 * Windows longer than 365 days (end minus start) are rejected.
 */
@Component
public class DateRangeResolver {

    static final long MAX_SPAN_DAYS = 365;

    private final Clock clock;

    public DateRangeResolver(Clock clock) {
        this.clock = clock;
    }

    public ReportingPeriod resolve(String period, String startDate, String endDate, String date) {
        return resolve(resolvePeriod(period, startDate, endDate), startDate, endDate, date);
    }

    public HistoryPeriod resolvePeriod(String period, String startDate, String endDate) {
        if ((period == null || period.isBlank()) && startDate != null && endDate != null) {
            return HistoryPeriod.CUSTOM;
        }
        return InvalidParameterException.readParameter(() -> HistoryPeriod.fromValue(period));
    }

    public ReportingPeriod resolve(HistoryPeriod period, String startDate, String endDate, String date) {
        LocalDate reference = date != null ? parse("date", date) : LocalDate.now(clock);
        LocalDate start;
        LocalDate end;

        switch (period) {
            case MONTH -> {
                start = reference.withDayOfMonth(1);
                end = reference.with(TemporalAdjusters.lastDayOfMonth());
            }
            case YEAR -> {
                start = reference.withDayOfYear(1);
                end = reference.with(TemporalAdjusters.lastDayOfYear());
            }
            case CUSTOM -> {
                end = endDate != null ? parse("endDate", endDate) : LocalDate.now(clock);
                start = startDate != null ? parse("startDate", startDate) : end.minusDays(7);
            }
            default -> {
                end = reference;
                start = reference.minusDays(6);
            }
        }

        if (end.isBefore(start)) {
            throw new RequestValidationException("endDate must not be before startDate");
        }
        if (ChronoUnit.DAYS.between(start, end) > MAX_SPAN_DAYS) {
            throw new RequestValidationException("Date range cannot exceed " + MAX_SPAN_DAYS + " days");
        }
        return new ReportingPeriod(start, end);
    }

    private static LocalDate parse(String name, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new RequestValidationException("Invalid " + name + ": expected YYYY-MM-DD");
        }
    }
}
