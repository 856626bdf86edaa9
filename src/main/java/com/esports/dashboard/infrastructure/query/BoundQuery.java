package com.esports.dashboard.infrastructure.query;

import java.util.List;

/**
 * SQL text with {@code ?} placeholders and the values bound to them, in order.
 */
public final class BoundQuery {

    private final String sql;
    private final List<Object> params;

    public BoundQuery(String sql, List<Object> params) {
        this.sql = sql;
        this.params = List.copyOf(params);
    }

    public String sql() {
        return sql;
    }

    public List<Object> params() {
        return params;
    }

    public Object[] paramArray() {
        return params.toArray();
    }

    @Override
    public String toString() {
        return "BoundQuery{params=" + params.size() + "}";
    }
}
