package com.esports.dashboard.infrastructure.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered set of filter fragments plus the values they bind.
 *
 * Fragments are validated against {@link FilterConditionValidator} when the
 * clause is rendered, so nothing unvalidated reaches the query text.
 */
public class ConditionList {

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    public ConditionList add(String condition, Object... values) {
        conditions.add(condition);
        params.addAll(Arrays.asList(values));
        return this;
    }

    public ConditionList add(InClause clause) {
        conditions.add(clause.condition());
        params.addAll(clause.values());
        return this;
    }

    public ConditionList addIn(InColumn column, List<?> values) {
        if (values != null && !values.isEmpty()) {
            add(InClause.of(column, values));
        }
        return this;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public List<Object> params() {
        return params;
    }

    /**
     * Validated fragments joined with AND, or an empty string.
     */
    public String joined() {
        FilterConditionValidator.validateAll(conditions);
        return String.join(" AND ", conditions);
    }

    public String where() {
        return isEmpty() ? "" : "WHERE " + joined();
    }

    public String having() {
        return isEmpty() ? "" : "HAVING " + joined();
    }

    /**
     * Joined fragments prefixed with AND, for appending to a fixed predicate.
     */
    public String andJoined() {
        return isEmpty() ? "" : "AND " + joined();
    }
}
