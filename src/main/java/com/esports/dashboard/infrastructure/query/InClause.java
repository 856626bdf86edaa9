package com.esports.dashboard.infrastructure.query;

import java.util.Collections;
import java.util.List;

/**
 * A parameterized {@code <column> IN (?,?,...)} fragment and the values bound to it.
 *
 * The placeholder count always equals the number of values, and values keep
 * their input order.
 */
public final class InClause {

    private final String condition;
    private final List<Object> values;

    private InClause(String condition, List<Object> values) {
        this.condition = condition;
        this.values = values;
    }

    public static InClause of(InColumn column, List<?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("IN clause requires at least one value");
        }

        String placeholders = String.join(",", Collections.nCopies(values.size(), "?"));
        return new InClause(column.sql() + " IN (" + placeholders + ")", List.copyOf(values));
    }

    public String condition() {
        return condition;
    }

    public List<Object> values() {
        return values;
    }
}
